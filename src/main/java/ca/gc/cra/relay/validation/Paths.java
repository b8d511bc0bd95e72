package ca.gc.cra.relay.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for RELAY configuration flows.
 * <p><strong>Why:</strong> TLS material (CA bundle, client certificate, client key) is read lazily at first
 * connect; checking the files at configuration time surfaces typos while the operator is still watching.
 * <p><strong>Role:</strong> Domain support utilities executed before endpoints are registered.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that {@code raw} names an existing, readable regular file.
   *
   * @param name logical parameter name for diagnostics
   * @param raw candidate path text; must not be blank or contain control characters
   * @return real path of the file
   * @throws IllegalArgumentException if the file is missing, not a regular file, or unreadable
   */
  public static Path validateReadableFile(String name, String raw) {
    String sanitized = Strings.requireNonBlank(name, raw);
    Path normalized = Path.of(sanitized).toAbsolutePath().normalize();
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " file does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " file is not readable: " + normalized);
    }
    try {
      return normalized.toRealPath();
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to resolve " + name + " file " + normalized + ": " + ex.getMessage(), ex);
    }
  }
}
