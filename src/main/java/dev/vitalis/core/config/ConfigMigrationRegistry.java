/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.config;

import com.google.gson.JsonObject;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered migration chain for one document. Validation happens at construction so a gap is
 * reported when the document is registered, never halfway through a migration.
 */
public final class ConfigMigrationRegistry {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  private final String document;
  private final int currentVersion;
  private final List<ConfigMigration> steps;

  /**
   * Creates a registry.
   *
   * @param document document name used in messages
   * @param currentVersion version produced by the last step
   * @param migrations steps in any order
   * @throws IllegalStateException when steps are missing, duplicated or overshoot
   */
  public ConfigMigrationRegistry(
      String document, int currentVersion, List<ConfigMigration> migrations) {
    this.document = Objects.requireNonNull(document, "document");
    if (currentVersion < 1) {
      throw new IllegalArgumentException("config '" + document + "' currentVersion must be >= 1");
    }
    this.currentVersion = currentVersion;
    Objects.requireNonNull(migrations, "migrations");
    List<ConfigMigration> sorted = new ArrayList<>(migrations);
    sorted.sort(Comparator.comparingInt(ConfigMigration::fromVersion));

    int expected = 1;
    for (ConfigMigration step : sorted) {
      if (step.fromVersion() < expected) {
        throw new IllegalStateException(
            "config '" + document + "' has more than one migration from v" + step.fromVersion());
      }
      if (step.fromVersion() > expected) {
        throw new IllegalStateException(
            "config '"
                + document
                + "' has no migration from v"
                + expected
                + " (next step starts at v"
                + step.fromVersion()
                + ")");
      }
      expected = step.toVersion();
    }
    if (expected != currentVersion) {
      throw new IllegalStateException(
          "config '"
              + document
              + "' migrations end at v"
              + expected
              + " but the current version is v"
              + currentVersion);
    }
    this.steps = List.copyOf(sorted);
  }

  public int currentVersion() {
    return currentVersion;
  }

  public List<ConfigMigration> steps() {
    return steps;
  }

  /**
   * Applies every step between two versions, one version at a time. Returns an unchanged copy when
   * {@code from == to}.
   *
   * @param source document at {@code from}; never modified
   * @param from starting version
   * @param to target version
   * @return migrated copy
   */
  public JsonObject migrate(JsonObject source, int from, int to) {
    if (from < 1 || to > currentVersion || from > to) {
      throw new IllegalArgumentException(
          "config '" + document + "' cannot migrate v" + from + " -> v" + to);
    }
    JsonObject current = source.deepCopy();
    for (int version = from; version < to; version++) {
      ConfigMigration step = steps.get(version - 1);
      current = step.apply(current);
      LOG.info(
          "(vitalis) config={} migrated v{}->v{} ({})",
          document,
          step.fromVersion(),
          step.toVersion(),
          step.description());
    }
    return current;
  }
}
