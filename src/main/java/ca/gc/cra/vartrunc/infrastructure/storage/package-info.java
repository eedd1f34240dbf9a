/**
 * Blob storage adapters.
 * <p><strong>Role:</strong> Implements {@link ca.gc.cra.vartrunc.application.port.BlobStoragePort} on the local
 * filesystem.</p>
 * <p><strong>Concurrency:</strong> Every upload writes its own file; no shared handles.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.infrastructure.storage;
