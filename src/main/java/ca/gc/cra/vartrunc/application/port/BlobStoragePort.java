package ca.gc.cra.vartrunc.application.port;

/**
 * <strong>What:</strong> Port storing full, untruncated payloads outside the execution record.
 * <p><strong>Why:</strong> Truncated payloads stay inline; the original bytes must remain recoverable.</p>
 * <p><strong>Role:</strong> Called by the offload coordinator once per offloaded field.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent uploads.</p>
 * <p><strong>Performance:</strong> Blocking; the caller waits for the blob to be durable.</p>
 *
 * @since 0.1.0
 */
public interface BlobStoragePort {
  /**
   * Stores {@code content} and returns an opaque identifier for it.
   *
   * @param filename flat display name for the blob (letters, digits, dot, underscore, hyphen)
   * @param content bytes to store; never modified
   * @param mimeType content type recorded with the blob
   * @return identifier that can later be used to fetch the blob
   * @throws BlobStorageException if the blob could not be stored
   */
  String upload(String filename, byte[] content, String mimeType) throws BlobStorageException;
}
