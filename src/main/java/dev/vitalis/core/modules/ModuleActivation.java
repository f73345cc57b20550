/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.modules;

import java.util.Objects;

/**
 * Outcome of {@link VitalisModule#start}: the state {@link ModuleManager} records for the module.
 *
 * @param state {@link ModuleState#ACTIVE} or {@link ModuleState#SKIPPED}
 * @param reason why the module skipped itself; null when active
 */
public record ModuleActivation(ModuleState state, String reason) {

  public ModuleActivation {
    Objects.requireNonNull(state, "state");
    if (state == ModuleState.SKIPPED) {
      Objects.requireNonNull(reason, "reason");
    } else if (state != ModuleState.ACTIVE) {
      throw new IllegalArgumentException("start can only end ACTIVE or SKIPPED, not " + state);
    }
  }

  public static ModuleActivation activated() {
    return new ModuleActivation(ModuleState.ACTIVE, null);
  }

  /**
   * The module declined to run, e.g. because its document disables it. Services it published are
   * withdrawn and modules depending on it are skipped as well.
   */
  public static ModuleActivation skipped(String reason) {
    return new ModuleActivation(ModuleState.SKIPPED, reason);
  }

  public boolean isActivated() {
    return state == ModuleState.ACTIVE;
  }
}
