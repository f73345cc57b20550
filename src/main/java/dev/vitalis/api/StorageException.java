/* Vitalis © 2025 Vitalis Devs — MIT */
package dev.vitalis.api;

import java.util.Objects;

/** Raised by world storage operations; carries the canonical {@link ErrorCode}. */
public final class StorageException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ErrorCode code;

  public StorageException(ErrorCode code, String message) {
    super(message);
    this.code = Objects.requireNonNull(code, "code");
  }

  public StorageException(ErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code, "code");
  }

  /** Error code describing the failure. */
  public ErrorCode code() {
    return code;
  }

  /** Whether the caller may retry the same operation after a short backoff. */
  public boolean retryable() {
    return code == ErrorCode.STORAGE_BUSY;
  }
}
