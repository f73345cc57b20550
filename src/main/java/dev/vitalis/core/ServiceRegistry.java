/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Typed lookup table shared by modules. Every entry records the module that published it so a
 * failed or stopped module's services can be withdrawn in one call.
 */
public final class ServiceRegistry {
  private final Map<Class<?>, Object> services = new HashMap<>();
  private final Map<Class<?>, String> owners = new HashMap<>();
  private final Map<String, Set<Class<?>>> byOwner = new HashMap<>();

  /**
   * Publishes a service, replacing any previous instance of the same type.
   *
   * @param ownerId publishing module (or {@code "core"})
   * @param type lookup key
   * @param service implementation
   */
  public synchronized <T> void publish(String ownerId, Class<T> type, T service) {
    Objects.requireNonNull(ownerId, "ownerId");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(service, "service");
    String previousOwner = owners.put(type, ownerId);
    if (previousOwner != null && !previousOwner.equals(ownerId)) {
      Set<Class<?>> previous = byOwner.get(previousOwner);
      if (previous != null) {
        previous.remove(type);
      }
    }
    services.put(type, type.cast(service));
    byOwner.computeIfAbsent(ownerId, id -> new LinkedHashSet<>()).add(type);
  }

  /** Looks up a service. */
  public synchronized <T> Optional<T> find(Class<T> type) {
    Objects.requireNonNull(type, "type");
    return Optional.ofNullable(type.cast(services.get(type)));
  }

  /**
   * Looks up a service that must exist.
   *
   * @throws IllegalStateException when nothing is published for {@code type}
   */
  public <T> T require(Class<T> type) {
    return find(type)
        .orElseThrow(() -> new IllegalStateException("service not available: " + type.getName()));
  }

  /** Removes every service published by an owner. */
  public synchronized void clearOwner(String ownerId) {
    Set<Class<?>> published = byOwner.remove(ownerId);
    if (published == null) {
      return;
    }
    for (Class<?> type : published) {
      services.remove(type);
      owners.remove(type);
    }
  }

  /** Types currently published by an owner. */
  public synchronized Set<Class<?>> publishedBy(String ownerId) {
    Set<Class<?>> published = byOwner.get(ownerId);
    return published == null ? Set.of() : Set.copyOf(published);
  }
}
