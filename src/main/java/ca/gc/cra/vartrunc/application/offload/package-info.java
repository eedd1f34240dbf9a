/**
 * <strong>Purpose:</strong> Moves oversized execution payloads to blob storage and keeps truncated previews
 * inline.
 * <p><strong>Pipeline role:</strong> Application services between the domain model and the persistence ports:
 * {@link ca.gc.cra.vartrunc.application.offload.OffloadCoordinator} decides per field,
 * {@link ca.gc.cra.vartrunc.application.offload.NodeExecutionRepository} assembles and stores the record.</p>
 * <p><strong>Concurrency:</strong> Stateless apart from injected ports; calls block on blob uploads.</p>
 * <p><strong>Error handling:</strong> Upload failures propagate as
 * {@link ca.gc.cra.vartrunc.application.port.BlobStorageException} before anything is persisted.</p>
 * <p><strong>Observability:</strong> Emits {@code offload.*} metrics and INFO logs per upload.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.application.offload;
