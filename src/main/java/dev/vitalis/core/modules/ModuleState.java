/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.modules;

/** Lifecycle position of a module inside {@link ModuleManager}. */
public enum ModuleState {
  REGISTERED,
  SETUP,
  ACTIVE,
  SKIPPED,
  FAILED,
  STOPPED
}
