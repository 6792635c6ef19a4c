package com.acme.fabric.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Domain event emitted by a successful {@link Fabric} mutation. Every event carries the version
 * the mutation produced.
 */
public sealed interface FabricEvent
    permits FabricCreated, FabricUpdated, FabricDeleted, FabricReactivated {

  String code();

  int version();

  @JsonIgnore
  FabricEventKind kind();
}
