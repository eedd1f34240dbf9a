package ca.gc.cra.vartrunc.testutil;

import ca.gc.cra.vartrunc.application.port.BlobStorageException;
import ca.gc.cra.vartrunc.application.port.BlobStoragePort;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Blob store whose uploads always fail.
 */
public final class FailingBlobStorage implements BlobStoragePort {
  private final AtomicInteger attempts = new AtomicInteger();

  @Override
  public String upload(String filename, byte[] content, String mimeType) throws BlobStorageException {
    attempts.incrementAndGet();
    throw new BlobStorageException("storage unavailable for " + filename);
  }

  public int attempts() {
    return attempts.get();
  }
}
