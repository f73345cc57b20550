/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.core;

import dev.vitalis.api.events.VitalsEvents;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asynchronous in-process event bus for core events.
 *
 * <p>Each player has a dedicated serial queue to guarantee in-order delivery while still allowing
 * concurrent dispatch for different players. Publishing never blocks the tick thread.
 */
public final class EventBus implements VitalsEvents, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger("vitalis");

  private final List<Consumer<EffectTransitionEvent>> transitions = new CopyOnWriteArrayList<>();
  private final Map<UUID, PlayerQueue> queues = new ConcurrentHashMap<>();
  private final ExecutorService executor;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /** Creates a new event bus with a daemon thread pool sized for the host. */
  public EventBus() {
    this(createExecutor());
  }

  EventBus(ExecutorService executor) {
    this.executor = executor;
  }

  private static ExecutorService createExecutor() {
    int threads = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    ThreadFactory factory =
        r -> {
          Thread t = new Thread(r, "vitalis-events");
          t.setDaemon(true);
          return t;
        };
    return Executors.newFixedThreadPool(threads, factory);
  }

  @Override
  public AutoCloseable onEffectTransition(Consumer<EffectTransitionEvent> h) {
    transitions.add(h);
    return () -> transitions.remove(h);
  }

  /**
   * Dispatches an effect transition asynchronously.
   *
   * @param e event to dispatch
   */
  public void fireEffectTransition(EffectTransitionEvent e) {
    if (e == null || closed.get() || transitions.isEmpty()) {
      return;
    }
    enqueue(e.playerId(), () -> dispatch(transitions, e));
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      executor.shutdownNow();
      queues.clear();
      transitions.clear();
    }
  }

  private <T> void dispatch(List<Consumer<T>> handlers, T event) {
    for (Consumer<T> handler : handlers) {
      try {
        handler.accept(event);
      } catch (RuntimeException e) {
        LOG.debug("(vitalis) event handler failed: {}", e.getMessage(), e);
      }
    }
  }

  private void enqueue(UUID player, Runnable task) {
    if (player == null) {
      submit(task);
      return;
    }
    PlayerQueue queue = queues.computeIfAbsent(player, id -> new PlayerQueue());
    queue.tasks.add(task);
    if (queue.draining.compareAndSet(false, true)) {
      submit(() -> drain(player, queue));
    }
  }

  private void submit(Runnable task) {
    try {
      executor.execute(task);
    } catch (RejectedExecutionException e) {
      LOG.debug("(vitalis) event dropped; bus closed");
    }
  }

  private void drain(UUID player, PlayerQueue queue) {
    while (true) {
      Runnable next = queue.tasks.poll();
      if (next == null) {
        queue.draining.set(false);
        if (queue.tasks.isEmpty()) {
          queues.remove(player, queue);
          Runnable extra;
          while ((extra = queue.tasks.poll()) != null) {
            enqueue(player, extra);
          }
          return;
        }
        if (!queue.draining.compareAndSet(false, true)) {
          return;
        }
        continue;
      }
      next.run();
    }
  }

  private static final class PlayerQueue {
    private final ConcurrentLinkedQueue<Runnable> tasks = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
  }
}
