/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.api;

/**
 * Canonical error codes produced by Vitalis subsystems.
 *
 * <p>Every fallback, migration and isolation event is logged with one of these codes so operators
 * can grep for them. Only {@link #STORAGE_BUSY} is considered retryable.
 */
public enum ErrorCode {
  /** A write could not acquire the per-world writer slot before the configured timeout. */
  STORAGE_BUSY,

  /** The world database file is unreadable or failed its integrity check. */
  STORAGE_CORRUPT,

  /** An existing table conflicts with the expected layout, or a schema is newer than supported. */
  SCHEMA_MISMATCH,

  /** The storage handle was already closed. */
  STORAGE_CLOSED,

  /** Any other database failure. */
  STORAGE_FAILURE,

  /** A configuration document could not be migrated or validated; defaults were used. */
  CONFIG_MIGRATION_FAILED,

  /** A module raised during setup or start and was isolated. */
  MODULE_LIFECYCLE_FAILED,

  /** The module dependency graph contains a cycle. */
  MODULE_DEPENDENCY_CYCLE,

  /** The host could not classify a player's activity; idle was assumed. */
  ACTIVITY_CLASSIFICATION_UNAVAILABLE;
}
