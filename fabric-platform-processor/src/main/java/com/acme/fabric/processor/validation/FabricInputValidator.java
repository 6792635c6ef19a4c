package com.acme.fabric.processor.validation;

import com.acme.fabric.domain.Fabric;

/**
 * Field checks shared by the REST controller and the inbound ERP adapter. They run before the
 * command service so every failing field is reported at once.
 */
public final class FabricInputValidator {

  private FabricInputValidator() {}

  public static FieldErrors validateCreate(String code, String name) {
    FieldErrors errors = new FieldErrors();
    errors
        .check(!isBlank(code), "code", "code must be provided")
        .check(
            code != null
                && code.length() >= Fabric.CODE_MIN_LENGTH
                && code.length() <= Fabric.CODE_MAX_LENGTH,
            "code",
            "code must be between 2 and 30 characters long")
        .check(
            code != null && Fabric.CODE_PATTERN.matcher(code).matches(),
            "code",
            "code must only contain uppercase letters and numbers");
    checkName(errors, name);
    return errors;
  }

  public static FieldErrors validateUpdate(int version, String name) {
    FieldErrors errors = new FieldErrors();
    checkVersion(errors, version);
    checkName(errors, name);
    return errors;
  }

  public static FieldErrors validateDelete(int version) {
    FieldErrors errors = new FieldErrors();
    checkVersion(errors, version);
    return errors;
  }

  private static void checkVersion(FieldErrors errors, int version) {
    errors.check(version > 0, "version", "version must be provided and greater than 0");
  }

  private static void checkName(FieldErrors errors, String name) {
    errors
        .check(!isBlank(name), "name", "name must be provided")
        .check(
            name == null || name.codePointCount(0, name.length()) <= Fabric.NAME_MAX_LENGTH,
            "name",
            "name must not be more than 250 characters long");
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
