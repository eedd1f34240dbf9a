/**
 * Execution record stores implementing {@link ca.gc.cra.vartrunc.application.port.ExecutionRecordPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.infrastructure.persistence;
