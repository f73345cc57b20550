/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core.world;

import dev.vitalis.api.storage.WorldStorage;
import java.util.UUID;

/** Opens the storage of a world on first use. */
@FunctionalInterface
public interface StorageOpener {
  WorldStorage open(UUID worldId);
}
