package ca.gc.cra.ftrace.application.port;

import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.strings.StringId;
import java.util.Optional;

/**
 * <strong>What:</strong> Port for the global string pool.
 * <p><strong>Why:</strong> Compact scheduling batches carry a per-bundle intern table; interning each entry once
 * yields handles that stay valid after the bundle buffer is released.</p>
 * <p><strong>Role:</strong> Domain port implemented by {@code InMemoryStringPool}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use by several tokenizers.</p>
 *
 * @since 0.1.0
 */
public interface StringPoolPort {
  /**
   * Interns the UTF-8 bytes covered by {@code bytes}.
   *
   * @param bytes string bytes; must not be {@code null}
   * @return stable handle; equal strings yield equal handles
   */
  StringId intern(TraceBlobView bytes);

  /**
   * Resolves a handle back to its string.
   *
   * @param id handle previously returned by {@link #intern(TraceBlobView)}
   * @return string value, or empty when the handle is unknown
   */
  Optional<String> lookup(StringId id);
}
