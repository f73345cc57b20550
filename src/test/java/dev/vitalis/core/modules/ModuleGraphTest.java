/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.modules;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import dev.vitalis.api.ErrorCode;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ModuleGraphTest {

  private static VitalisModule module(String id, String... dependencies) {
    return new VitalisModule() {
      @Override
      public String id() {
        return id;
      }

      @Override
      public List<String> dependencies() {
        return List.of(dependencies);
      }

      @Override
      public ModuleActivation start(ModuleContext context) {
        return ModuleActivation.activated();
      }

      @Override
      public void shutdown(ModuleContext context) {}
    };
  }

  private static List<String> ids(List<VitalisModule> modules) {
    return modules.stream().map(VitalisModule::id).collect(Collectors.toList());
  }

  @Test
  void dependenciesComeFirstAndTiesSortById() {
    List<VitalisModule> ordered =
        ModuleGraph.order(
            List.of(
                module("metabolism", "players"),
                module("zeta"),
                module("players"),
                module("alpha", "zeta")));

    assertEquals(List.of("players", "metabolism", "zeta", "alpha"), ids(ordered));
  }

  @Test
  void unknownDependenciesDoNotBlockOrdering() {
    assertEquals(
        List.of("metabolism"), ids(ModuleGraph.order(List.of(module("metabolism", "players")))));
  }

  @Test
  void cycleNamesEveryModuleInvolved() {
    ModuleCycleException error =
        assertThrows(
            ModuleCycleException.class,
            () ->
                ModuleGraph.order(
                    List.of(module("a", "c"), module("b", "a"), module("c", "b"), module("d"))));

    assertEquals(Set.of("a", "b", "c"), error.modules());
    assertEquals(ErrorCode.MODULE_DEPENDENCY_CYCLE, error.code());
  }
}
