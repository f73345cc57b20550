/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.storage;

import dev.vitalis.api.storage.SchemaHelper;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * One module schema migration. Applied in its own transaction together with the version bump.
 *
 * @param version version this step produces
 * @param description summary logged when applied
 * @param body DDL/DML to run
 */
public record SchemaStep(int version, String description, Body body) {

  public SchemaStep {
    if (version < 1) {
      throw new IllegalArgumentException("schema step version must be >= 1");
    }
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(body, "body");
  }

  /** Work performed by a step on the transaction's connection. */
  @FunctionalInterface
  public interface Body {
    void apply(Connection connection, SchemaHelper schema) throws SQLException;
  }
}
