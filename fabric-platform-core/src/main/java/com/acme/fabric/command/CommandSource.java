package com.acme.fabric.command;

/** Ingress path a command arrived on. */
public enum CommandSource {
  /** Synchronous REST request. Resulting events are published outward. */
  REST,
  /** Inbound event from an external system. Resulting events are recorded but not re-published. */
  EVENT
}
