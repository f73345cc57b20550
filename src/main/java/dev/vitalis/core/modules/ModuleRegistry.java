/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.modules;

import dev.vitalis.modules.metabolism.MetabolismModule;
import dev.vitalis.modules.players.PlayersModule;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Built-in module factories, keyed by module identifier. */
public final class ModuleRegistry {
  private static final Map<String, ModuleFactory> FACTORIES =
      Map.of(
          PlayersModule.ID, PlayersModule::new,
          MetabolismModule.ID, MetabolismModule::new);

  private ModuleRegistry() {}

  /** Whether a built-in module exists for the identifier. */
  public static boolean has(String id) {
    return FACTORIES.containsKey(id);
  }

  /** Creates a fresh module instance. */
  public static Optional<VitalisModule> create(String id) {
    ModuleFactory factory = FACTORIES.get(id);
    return factory == null ? Optional.empty() : Optional.of(factory.create());
  }

  /** Identifiers of every built-in module. */
  public static Set<String> ids() {
    return FACTORIES.keySet();
  }
}
