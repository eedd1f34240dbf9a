package ca.gc.cra.vartrunc.domain.segment;

import ca.gc.cra.vartrunc.validation.Strings;
import java.util.Optional;

/**
 * Opaque pointer to a stored file. Never expanded into JSON by the truncator.
 *
 * @param id storage identifier
 * @param filename display name
 * @param mimeType optional content type
 * @param size size in bytes; non-negative
 * @since 0.1.0
 */
public record FileReference(String id, String filename, Optional<String> mimeType, long size) {
  public FileReference {
    id = Strings.requireNonBlank("id", id);
    filename = Strings.requireNonBlank("filename", filename);
    mimeType = mimeType == null ? Optional.empty() : mimeType;
    if (size < 0) {
      throw new IllegalArgumentException("size must be >= 0");
    }
  }
}
