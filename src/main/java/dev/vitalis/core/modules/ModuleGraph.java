/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.modules;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.TreeSet;

/** Topological ordering of modules over their declared dependencies (Kahn's algorithm). */
final class ModuleGraph {

  private ModuleGraph() {}

  /**
   * Orders modules so every module follows its dependencies. Ties are broken by identifier so the
   * order is stable across runs. Dependencies on identifiers outside {@code modules} are ignored
   * here; the manager reports them when the dependent is set up.
   *
   * @throws ModuleCycleException when no valid order exists
   */
  static List<VitalisModule> order(Collection<VitalisModule> modules) {
    Map<String, VitalisModule> byId = new HashMap<>();
    for (VitalisModule module : modules) {
      byId.put(module.id(), module);
    }
    Map<String, Integer> indegree = new HashMap<>();
    Map<String, List<String>> dependents = new HashMap<>();
    for (VitalisModule module : modules) {
      indegree.putIfAbsent(module.id(), 0);
      for (String dependency : module.dependencies()) {
        if (!byId.containsKey(dependency)) {
          continue;
        }
        indegree.merge(module.id(), 1, Integer::sum);
        dependents.computeIfAbsent(dependency, id -> new ArrayList<>()).add(module.id());
      }
    }

    PriorityQueue<String> ready = new PriorityQueue<>();
    indegree.forEach(
        (id, count) -> {
          if (count == 0) {
            ready.add(id);
          }
        });
    List<VitalisModule> ordered = new ArrayList<>(modules.size());
    while (!ready.isEmpty()) {
      String id = ready.poll();
      ordered.add(byId.get(id));
      for (String dependent : dependents.getOrDefault(id, List.of())) {
        if (indegree.merge(dependent, -1, Integer::sum) == 0) {
          ready.add(dependent);
        }
      }
    }
    if (ordered.size() < byId.size()) {
      TreeSet<String> remaining = new TreeSet<>(byId.keySet());
      ordered.forEach(m -> remaining.remove(m.id()));
      throw new ModuleCycleException(remaining);
    }
    return ordered;
  }
}
