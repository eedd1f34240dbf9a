package ca.gc.cra.vartrunc.infrastructure.storage;

import ca.gc.cra.vartrunc.application.port.BlobStorageException;
import ca.gc.cra.vartrunc.application.port.BlobStoragePort;
import ca.gc.cra.vartrunc.validation.Strings;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Stores blobs as files under a root directory, one sub-directory per blob id.
 * <p><strong>Why:</strong> Gives the offload path a durable, inspectable store without an external service.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link BlobStoragePort}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write content to a temporary file, force it to disk and move it into place atomically.</li>
 *   <li>Return a random UUID as blob id; the layout is {@code root/<id>/<filename>}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe; uploads never share files.</p>
 * <p><strong>Observability:</strong> Logs each stored blob at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class FileBlobStorageAdapter implements BlobStoragePort {
  private static final Logger log = LoggerFactory.getLogger(FileBlobStorageAdapter.class);

  private final Path root;

  /**
   * Creates an adapter rooted at {@code root}. The directory is created on first upload.
   *
   * @param root directory holding blobs
   */
  public FileBlobStorageAdapter(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
  }

  @Override
  public String upload(String filename, byte[] content, String mimeType) throws BlobStorageException {
    String safeName = Strings.requireFileName("filename", filename);
    Objects.requireNonNull(content, "content");
    String id = UUID.randomUUID().toString();
    Path dir = root.resolve(id);
    Path target = dir.resolve(safeName);
    Path temp = dir.resolve(safeName + ".tmp");
    try {
      Files.createDirectories(dir);
      try (FileChannel channel = FileChannel.open(
          temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
        ByteBuffer buffer = ByteBuffer.wrap(content);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      move(temp, target);
    } catch (IOException ex) {
      deleteQuietly(temp);
      throw new BlobStorageException("Failed to store blob " + safeName + " under " + dir, ex);
    }
    log.debug("Stored blob {} ({} bytes, {}) at {}", id, content.length, mimeType, target);
    return id;
  }

  /**
   * Reads a stored blob.
   *
   * @param id blob id returned by {@link #upload(String, byte[], String)}
   * @return blob bytes, or empty when no blob has that id
   * @throws BlobStorageException if the blob exists but cannot be read
   */
  public Optional<byte[]> read(String id) throws BlobStorageException {
    Optional<Path> path = locate(id);
    if (path.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Files.readAllBytes(path.get()));
    } catch (IOException ex) {
      throw new BlobStorageException("Failed to read blob " + id, ex);
    }
  }

  /**
   * Resolves the file holding a blob.
   *
   * @param id blob id
   * @return file path, or empty when unknown
   * @throws BlobStorageException if the blob directory cannot be listed
   */
  public Optional<Path> locate(String id) throws BlobStorageException {
    Path dir = root.resolve(Strings.requireFileName("id", id));
    if (!Files.isDirectory(dir)) {
      return Optional.empty();
    }
    try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, p -> !p.toString().endsWith(".tmp"))) {
      for (Path file : files) {
        return Optional.of(file);
      }
      return Optional.empty();
    } catch (IOException ex) {
      throw new BlobStorageException("Failed to list blob " + id, ex);
    }
  }

  /**
   * Returns the root directory.
   *
   * @return absolute root path
   */
  public Path root() {
    return root;
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to replace", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException cleanup) {
      log.warn("Failed to remove temporary blob file {}", path, cleanup);
    }
  }
}
