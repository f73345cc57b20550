/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.config;

import com.google.gson.JsonObject;
import java.util.List;

/**
 * Describes one versioned configuration document: its file name, current version, defaults,
 * migration chain and typed mapping.
 *
 * @param <T> typed view of the document
 */
public interface ConfigSchema<T> {

  /** File stem, e.g. {@code "metabolism"} for {@code metabolism.json5}. */
  String name();

  /** Typed view produced by {@link #decode}; values handed out by the store are cast to it. */
  Class<T> type();

  /** Version written by this build. */
  int currentVersion();

  /** Default document at {@link #currentVersion()}. Must return a fresh object per call. */
  JsonObject defaults();

  /** Ordered steps taking version 1 to {@link #currentVersion()}. */
  default List<ConfigMigration> migrations() {
    return List.of();
  }

  /**
   * Maps and validates a current-version document.
   *
   * @throws IllegalStateException naming the offending key when validation fails
   */
  T decode(JsonObject document);

  /** Maps a typed value back to its document form. */
  JsonObject encode(T value);

  /** Commented JSON5 text written on first boot and as {@code <name>.json5.example}, or null. */
  default String template() {
    return null;
  }
}
