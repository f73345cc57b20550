/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.modules;

import dev.vitalis.api.ErrorCode;
import java.util.Set;

/** Startup-fatal: the requested modules' dependencies form a cycle. */
public final class ModuleCycleException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final Set<String> modules;

  public ModuleCycleException(Set<String> modules) {
    super("module dependency cycle among " + modules);
    this.modules = Set.copyOf(modules);
  }

  /** Modules left unordered once every acyclic module was placed. */
  public Set<String> modules() {
    return modules;
  }

  public ErrorCode code() {
    return ErrorCode.MODULE_DEPENDENCY_CYCLE;
  }
}
