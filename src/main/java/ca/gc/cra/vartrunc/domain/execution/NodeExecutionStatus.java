package ca.gc.cra.vartrunc.domain.execution;

import java.util.Locale;

/**
 * Lifecycle state of a node execution.
 *
 * @since 0.1.0
 */
public enum NodeExecutionStatus {
  RUNNING,
  SUCCEEDED,
  FAILED,
  EXCEPTION;

  /**
   * Parses a status name case-insensitively.
   *
   * @param raw status text
   * @return matching status
   * @throws IllegalArgumentException if {@code raw} is blank or unknown
   */
  public static NodeExecutionStatus fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("status must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
