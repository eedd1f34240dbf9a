package ca.gc.cra.vartrunc.domain.execution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Copy helpers for optional payload maps; values may be {@code null}. */
final class Payloads {
  private Payloads() {
    // Utility
  }

  static Optional<Map<String, Object>> copy(Optional<Map<String, Object>> payload) {
    if (payload == null || payload.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(Collections.unmodifiableMap(new LinkedHashMap<>(payload.get())));
  }
}
