/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.modules.players;

import dev.vitalis.api.Players;
import dev.vitalis.core.Services;
import dev.vitalis.core.modules.ModuleActivation;
import dev.vitalis.core.modules.ModuleContext;
import dev.vitalis.core.modules.VitalisModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maintains the per-world {@code players} directory and publishes {@link Players}. */
public final class PlayersModule implements VitalisModule {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  public static final String ID = "players";

  private AutoCloseable listener;

  @Override
  public String id() {
    return ID;
  }

  @Override
  public ModuleActivation start(ModuleContext context) {
    if (!context.config().modules().players().enabled()) {
      return ModuleActivation.skipped("disabled in config");
    }
    Services services = context.services();
    listener =
        services
            .worlds()
            .addListener(new DirectoryListener(services.ioExecutor(), System::currentTimeMillis));
    context.publishService(Players.class, new PlayersImpl(services.worlds()));
    LOG.info("(vitalis) player directory enabled");
    return ModuleActivation.activated();
  }

  @Override
  public void shutdown(ModuleContext context) throws Exception {
    AutoCloseable handle = listener;
    listener = null;
    if (handle != null) {
      handle.close();
    }
  }
}
