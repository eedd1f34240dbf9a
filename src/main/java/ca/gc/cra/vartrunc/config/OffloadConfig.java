package ca.gc.cra.vartrunc.config;

import ca.gc.cra.vartrunc.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for moving oversized execution fields to blob storage.
 * <p><strong>Why:</strong> Inputs and outputs above the threshold are stored in full elsewhere and kept inline
 * only as a truncated preview.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param thresholdBytes compact-JSON size above which a field is offloaded; also the inline budget
 * @param blobDirectory directory used by the file-backed blob store
 * @since 0.1.0
 */
public record OffloadConfig(int thresholdBytes, Path blobDirectory) {
  /** Default offload threshold (10 KiB). */
  public static final int DEFAULT_THRESHOLD_BYTES = 10 * 1024;
  /** Default blob directory, relative to the working directory. */
  public static final Path DEFAULT_BLOB_DIRECTORY = Path.of("blobs");
  /** Smallest threshold that still leaves room for the truncation marker and a preview. */
  public static final int MIN_THRESHOLD_BYTES = 32;

  public OffloadConfig {
    Numbers.requireAtLeast("offloadThresholdBytes", thresholdBytes, MIN_THRESHOLD_BYTES);
    Objects.requireNonNull(blobDirectory, "blobDirectory");
  }

  /**
   * Returns the default offload configuration.
   *
   * @return defaults
   */
  public static OffloadConfig defaults() {
    return new OffloadConfig(DEFAULT_THRESHOLD_BYTES, DEFAULT_BLOB_DIRECTORY);
  }

  /**
   * Builds an offload configuration from flat key/value pairs.
   *
   * @param args flattened configuration; must not be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException if the threshold or directory is invalid
   */
  public static OffloadConfig fromMap(Map<String, String> args) {
    Objects.requireNonNull(args, "args");
    int threshold =
        Numbers.parseInt("offloadThresholdBytes", args.get("offloadThresholdBytes"), DEFAULT_THRESHOLD_BYTES);
    String dir = args.get("blobDirectory");
    Path blobDirectory;
    if (dir == null || dir.isBlank()) {
      blobDirectory = DEFAULT_BLOB_DIRECTORY;
    } else {
      try {
        blobDirectory = Path.of(dir.trim());
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("blobDirectory is not a valid path: " + dir, ex);
      }
    }
    return new OffloadConfig(threshold, blobDirectory);
  }
}
