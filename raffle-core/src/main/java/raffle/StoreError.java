package raffle;

import java.util.Objects;

/**
 * Details of a failed operation carried by {@link StoreResult.Failure}.
 *
 * @param kind    the error classification
 * @param message human-readable description
 * @param cause   the underlying exception, or {@code null}
 */
public record StoreError(ErrorKind kind, String message, Throwable cause) {

  public StoreError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  public static StoreError of(ErrorKind kind, String message) {
    return new StoreError(kind, message, null);
  }

  public static StoreError validation(String message) {
    return new StoreError(ErrorKind.VALIDATION, message, null);
  }
}
