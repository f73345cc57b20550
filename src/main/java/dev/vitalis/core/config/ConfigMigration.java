/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.config;

import com.google.gson.JsonObject;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One step of a configuration migration chain.
 *
 * <p>The transform receives a private deep copy and must not touch anything else, so every step can
 * be tested in isolation. {@link #apply} stamps {@code configVersion} after the transform returns.
 *
 * @param fromVersion version the step accepts
 * @param toVersion version the step produces, always {@code fromVersion + 1}
 * @param description human readable summary logged when applied
 * @param transform pure document transform
 */
public record ConfigMigration(
    int fromVersion, int toVersion, String description, UnaryOperator<JsonObject> transform) {

  public ConfigMigration {
    if (fromVersion < 1) {
      throw new IllegalArgumentException("fromVersion must be >= 1");
    }
    if (toVersion != fromVersion + 1) {
      throw new IllegalArgumentException(
          "migration must advance exactly one version: " + fromVersion + " -> " + toVersion);
    }
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(transform, "transform");
  }

  /** Applies the transform to a copy of {@code document} and stamps the new version. */
  public JsonObject apply(JsonObject document) {
    JsonObject migrated = transform.apply(document.deepCopy());
    if (migrated == null) {
      throw new IllegalStateException(
          "migration v" + fromVersion + " -> v" + toVersion + " returned no document");
    }
    migrated.addProperty(ConfigStore.VERSION_KEY, toVersion);
    return migrated;
  }
}
