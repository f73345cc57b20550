/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes/updates the {@code <name>.json5.example} snapshots next to live documents. */
final class ConfigTemplateWriter {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  private ConfigTemplateWriter() {}

  /**
   * Writes the example file if missing or if the contents changed. Failures are logged; an
   * example file is never worth aborting a load for.
   *
   * @param path destination path (usually {@code config/vitalis.json5.example})
   * @param contents canonical template to persist
   */
  static void writeExample(Path path, String contents) {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(contents, "contents");

    try {
      Path parent = path.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      byte[] data = contents.getBytes(StandardCharsets.UTF_8);
      if (Files.exists(path) && Arrays.equals(Files.readAllBytes(path), data)) {
        return;
      }
      Files.write(path, data);
    } catch (IOException e) {
      LOG.warn("(vitalis) failed to write config example {}: {}", path, e.getMessage());
    }
  }
}
