package ca.gc.cra.vartrunc.application.port;

import java.io.IOException;

/**
 * Signals that a blob could not be stored.
 *
 * @since 0.1.0
 */
public class BlobStorageException extends IOException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message failure description
   */
  public BlobStorageException(String message) {
    super(message);
  }

  /**
   * Creates an exception wrapping an underlying cause.
   *
   * @param message failure description
   * @param cause underlying I/O failure
   */
  public BlobStorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
