package com.acme.fabric.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;
import lombok.AccessLevel;
import lombok.Getter;

/**
 * Aggregate root for a fabric.
 *
 * <p>Every successful mutation increments {@code version} by exactly one and appends exactly one
 * {@link FabricEvent} to the pending list. Failed mutations leave the aggregate untouched. The
 * pending list is drained by the command service after persistence and is never stored on the row.
 */
@Getter
public class Fabric {
  public static final int CODE_MIN_LENGTH = 2;
  public static final int CODE_MAX_LENGTH = 30;
  public static final int NAME_MAX_LENGTH = 250;
  public static final Pattern CODE_PATTERN = Pattern.compile("^[A-Z0-9]+$");

  private final String code;
  private String name;
  private String measureUnit;
  private String offerStatus;
  private FabricStatus status;
  private int version;

  @Getter(AccessLevel.NONE)
  private final List<FabricEvent> events = new ArrayList<>();

  private Fabric(
      String code,
      String name,
      String measureUnit,
      String offerStatus,
      FabricStatus status,
      int version) {
    this.code = code;
    this.name = name;
    this.measureUnit = measureUnit;
    this.offerStatus = offerStatus;
    this.status = status;
    this.version = version;
  }

  /**
   * Creates a new ACTIVE fabric at version 1 with one pending {@link FabricCreated}.
   *
   * @throws FabricValidationException if the code or name breaks a rule
   */
  public static Fabric create(String code, String name, String measureUnit, String offerStatus) {
    validateCode(code);
    validateName(name);

    Fabric fabric = new Fabric(code, name, measureUnit, offerStatus, FabricStatus.ACTIVE, 1);
    fabric.events.add(new FabricCreated(code, name, measureUnit, offerStatus, fabric.version));
    return fabric;
  }

  /**
   * Rebuilds a fabric from a persisted row. Should only be called by repositories; the result has
   * no pending events.
   */
  public static Fabric restore(
      String code,
      String name,
      String measureUnit,
      String offerStatus,
      FabricStatus status,
      int version) {
    return new Fabric(code, name, measureUnit, offerStatus, status, version);
  }

  public void update(String name, String measureUnit, String offerStatus, int expectedVersion) {
    if (status == FabricStatus.DELETED) {
      throw new FabricAlreadyDeletedException(code);
    }
    checkVersion(expectedVersion);
    validateName(name);

    this.name = name;
    this.measureUnit = measureUnit;
    this.offerStatus = offerStatus;
    this.version++;
    events.add(new FabricUpdated(code, name, measureUnit, offerStatus, version));
  }

  public void delete(int expectedVersion) {
    if (status == FabricStatus.DELETED) {
      throw new FabricAlreadyDeletedException(code);
    }
    checkVersion(expectedVersion);

    this.status = FabricStatus.DELETED;
    this.version++;
    events.add(new FabricDeleted(code, version));
  }

  /**
   * Brings a DELETED fabric back with new attribute values, continuing its version sequence. On an
   * ACTIVE fabric this is an ordinary {@link #update}.
   */
  public void reactivate(String name, String measureUnit, String offerStatus, int expectedVersion) {
    if (status == FabricStatus.ACTIVE) {
      update(name, measureUnit, offerStatus, expectedVersion);
      return;
    }
    checkVersion(expectedVersion);
    validateName(name);

    this.status = FabricStatus.ACTIVE;
    this.name = name;
    this.measureUnit = measureUnit;
    this.offerStatus = offerStatus;
    this.version++;
    events.add(new FabricReactivated(code, name, measureUnit, offerStatus, version));
  }

  public boolean isDeleted() {
    return status == FabricStatus.DELETED;
  }

  public List<FabricEvent> pendingEvents() {
    return Collections.unmodifiableList(events);
  }

  /** Returns the pending events in emission order and clears them. */
  public List<FabricEvent> drainEvents() {
    List<FabricEvent> drained = List.copyOf(events);
    events.clear();
    return drained;
  }

  private void checkVersion(int expectedVersion) {
    if (expectedVersion != version) {
      throw ConcurrencyConflictException.versionMismatch(code, expectedVersion, version);
    }
  }

  private static void validateCode(String code) {
    if (code == null || code.length() < CODE_MIN_LENGTH || code.length() > CODE_MAX_LENGTH) {
      throw new FabricValidationException(FabricValidationException.Rule.CODE_LENGTH);
    }
    if (!CODE_PATTERN.matcher(code).matches()) {
      throw new FabricValidationException(FabricValidationException.Rule.CODE_PATTERN);
    }
  }

  private static void validateName(String name) {
    int length = name == null ? 0 : name.codePointCount(0, name.length());
    if (length < 1 || length > NAME_MAX_LENGTH) {
      throw new FabricValidationException(FabricValidationException.Rule.NAME_LENGTH);
    }
  }

  @Override
  public String toString() {
    return "Fabric{code=" + code + ", status=" + status + ", version=" + version + "}";
  }
}
