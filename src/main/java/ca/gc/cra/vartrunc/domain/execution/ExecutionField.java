package ca.gc.cra.vartrunc.domain.execution;

/**
 * Payload fields of a node execution.
 *
 * @since 0.1.0
 */
public enum ExecutionField {
  INPUTS("inputs", true),
  OUTPUTS("outputs", true),
  PROCESS_DATA("process_data", false);

  private final String fieldName;
  private final boolean offloadable;

  ExecutionField(String fieldName, boolean offloadable) {
    this.fieldName = fieldName;
    this.offloadable = offloadable;
  }

  /**
   * Returns the lower-case name used in blob file names and log lines.
   *
   * @return field name
   */
  public String fieldName() {
    return fieldName;
  }

  /**
   * Indicates whether oversized values of this field are moved to blob storage.
   *
   * @return {@code true} for inputs and outputs
   */
  public boolean offloadable() {
    return offloadable;
  }
}
