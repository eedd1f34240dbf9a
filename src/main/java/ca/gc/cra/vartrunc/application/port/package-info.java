/**
 * Ports decoupling the truncation and offload pipeline from storage, persistence and metrics back ends.
 * <p><strong>Role:</strong> Application-layer boundary; adapters under {@code ca.gc.cra.vartrunc.infrastructure}
 * implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Implementations document their own guarantees; the offload coordinator calls
 * ports synchronously from the caller's thread.</p>
 * <p><strong>Error handling:</strong> Storage I/O failures surface as {@link
 * ca.gc.cra.vartrunc.application.port.BlobStorageException}; they are never retried here.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.vartrunc.application.port;
