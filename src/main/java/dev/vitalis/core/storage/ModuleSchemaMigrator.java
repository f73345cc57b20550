/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.storage;

import dev.vitalis.api.ErrorCode;
import dev.vitalis.api.StorageException;
import dev.vitalis.api.storage.WorldStorage;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Brings a module's tables in one world up to the version this build expects.
 *
 * <p>Steps must be numbered 1..N without gaps. Each pending step commits atomically with its
 * version bump, so a crash leaves the world at the last fully applied step.
 */
public final class ModuleSchemaMigrator {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  private ModuleSchemaMigrator() {}

  /**
   * Applies pending steps.
   *
   * @param storage world storage
   * @param moduleId module owning the tables
   * @param steps ordered steps
   * @return schema version after migration
   * @throws StorageException {@link ErrorCode#SCHEMA_MISMATCH} when the stored version is newer
   *     than the last step
   */
  public static int migrate(WorldStorage storage, String moduleId, List<SchemaStep> steps) {
    for (int i = 0; i < steps.size(); i++) {
      if (steps.get(i).version() != i + 1) {
        throw new IllegalArgumentException(
            "module '" + moduleId + "' schema steps must be numbered 1.." + steps.size());
      }
    }
    int latest = steps.size();
    int current = storage.getModuleSchemaVersion(moduleId);
    if (current > latest) {
      LOG.error(
          "(vitalis) code={} op={} world={} module={} stored={} supported={}",
          ErrorCode.SCHEMA_MISMATCH,
          "schema.migrate",
          storage.worldId(),
          moduleId,
          current,
          latest);
      throw new StorageException(
          ErrorCode.SCHEMA_MISMATCH,
          "module '"
              + moduleId
              + "' schema v"
              + current
              + " is newer than supported v"
              + latest
              + " in world "
              + storage.worldId());
    }
    for (SchemaStep step : steps.subList(current, latest)) {
      storage.transaction(
          c -> {
            step.body().apply(c, new SchemaHelperImpl(c));
            ModuleSchemaVersions.write(c, moduleId, step.version());
            return null;
          });
      LOG.info(
          "(vitalis) world={} module={} schema v{}->v{} ({})",
          storage.worldId(),
          moduleId,
          step.version() - 1,
          step.version(),
          step.description());
    }
    return latest;
  }
}
