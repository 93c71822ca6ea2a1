package ca.gc.cra.ftrace.infrastructure.strings;

import ca.gc.cra.ftrace.application.port.StringPoolPort;
import ca.gc.cra.ftrace.domain.blob.TraceBlobView;
import ca.gc.cra.ftrace.domain.strings.StringId;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Heap-backed string pool.
 *
 * <p>Identifier {@code 0} is reserved for the empty string; other strings receive consecutive identifiers in
 * first-seen order. Bytes are decoded as UTF-8, with malformed sequences replaced.</p>
 *
 * <p>Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class InMemoryStringPool implements StringPoolPort {
  private final Map<String, StringId> ids = new HashMap<>();
  private final List<String> strings = new ArrayList<>();

  /** Creates a pool holding only the empty string. */
  public InMemoryStringPool() {
    strings.add("");
    ids.put("", StringId.NULL);
  }

  @Override
  public StringId intern(TraceBlobView bytes) {
    Objects.requireNonNull(bytes, "bytes");
    return intern(new String(bytes.buffer(), bytes.offset(), bytes.length(), StandardCharsets.UTF_8));
  }

  /**
   * Interns an already decoded string.
   *
   * @param value string to intern; must not be {@code null}
   * @return stable handle
   */
  public synchronized StringId intern(String value) {
    Objects.requireNonNull(value, "value");
    StringId existing = ids.get(value);
    if (existing != null) {
      return existing;
    }
    StringId id = new StringId(strings.size());
    strings.add(value);
    ids.put(value, id);
    return id;
  }

  @Override
  public synchronized Optional<String> lookup(StringId id) {
    if (id == null || id.id() >= strings.size()) {
      return Optional.empty();
    }
    return Optional.of(strings.get(id.id()));
  }

  /**
   * Returns the number of distinct strings, including the reserved empty string.
   *
   * @return pool size
   */
  public synchronized int size() {
    return strings.size();
  }
}
