/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.modules;

/** Factory for creating {@link VitalisModule} instances. */
@FunctionalInterface
interface ModuleFactory {
  VitalisModule create();
}
