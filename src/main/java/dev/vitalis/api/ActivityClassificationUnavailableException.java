/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.api;

/** Thrown by an {@link ActivitySource} that has no movement signal for a player. */
public final class ActivityClassificationUnavailableException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public ActivityClassificationUnavailableException(String message) {
    super(message);
  }
}
