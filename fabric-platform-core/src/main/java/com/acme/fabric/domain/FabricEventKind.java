package com.acme.fabric.domain;

/** The closed set of facts a fabric can emit, and the wire event type recorded for each. */
public enum FabricEventKind {
  CREATED,
  UPDATED,
  DELETED,
  REACTIVATED;

  public String eventType() {
    return switch (this) {
      case CREATED -> "app.fabric.created";
      case UPDATED -> "app.fabric.updated";
      case DELETED -> "app.fabric.deleted";
      case REACTIVATED -> "app.fabric.reactivated";
    };
  }
}
