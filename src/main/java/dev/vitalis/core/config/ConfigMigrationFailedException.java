/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.config;

import dev.vitalis.api.ErrorCode;

/**
 * Describes why a document fell back to defaults or its last good value. Recorded by {@link
 * ConfigStore} and exposed through {@link ConfigStore#lastFailure(String)}; the store never throws
 * it.
 */
public final class ConfigMigrationFailedException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String document;
  private final int fromVersion;
  private final int targetVersion;

  public ConfigMigrationFailedException(
      String document, int fromVersion, int targetVersion, String message, Throwable cause) {
    super("config '" + document + "': " + message, cause);
    this.document = document;
    this.fromVersion = fromVersion;
    this.targetVersion = targetVersion;
  }

  public ErrorCode code() {
    return ErrorCode.CONFIG_MIGRATION_FAILED;
  }

  public String document() {
    return document;
  }

  /** Version found on disk, or {@code 0} when unknown. */
  public int fromVersion() {
    return fromVersion;
  }

  public int targetVersion() {
    return targetVersion;
  }
}
