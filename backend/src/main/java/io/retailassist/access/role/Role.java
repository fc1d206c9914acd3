package io.retailassist.access.role;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The four roles a principal can hold. Exactly one per principal at any time. */
public enum Role {
  SUPER_ADMIN("super_admin"),
  PLATFORM_STAFF("platform_staff"),
  ADMIN("admin"),
  EMPLOYEE("employee");

  private final String wireValue;

  Role(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  @JsonCreator
  public static Role fromWireValue(String value) {
    for (Role role : values()) {
      if (role.wireValue.equalsIgnoreCase(value) || role.name().equalsIgnoreCase(value)) {
        return role;
      }
    }
    throw new IllegalArgumentException("Unknown role: " + value);
  }
}
