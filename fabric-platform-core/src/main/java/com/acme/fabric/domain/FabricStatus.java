package com.acme.fabric.domain;

/** Lifecycle status of a fabric row. Deletion is a status change, rows are never removed. */
public enum FabricStatus {
  ACTIVE,
  DELETED
}
