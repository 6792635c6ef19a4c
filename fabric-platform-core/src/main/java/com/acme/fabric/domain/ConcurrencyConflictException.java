package com.acme.fabric.domain;

/**
 * The caller's expected version no longer matches, or another writer already recorded an event for
 * the same aggregate version.
 */
public class ConcurrencyConflictException extends FabricDomainException {

  public ConcurrencyConflictException(String message) {
    super("a concurrency conflict occurred: " + message);
  }

  public ConcurrencyConflictException(String message, Throwable cause) {
    super("a concurrency conflict occurred: " + message, cause);
  }

  public static ConcurrencyConflictException versionMismatch(
      String code, int expectedVersion, int actualVersion) {
    return new ConcurrencyConflictException(
        String.format(
            "fabric %s is at version %d, caller expected %d", code, actualVersion, expectedVersion));
  }
}
