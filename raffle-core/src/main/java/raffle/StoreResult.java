package raffle;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a repository or pool operation: either a value or a classified error.
 *
 * <ul>
 *   <li>{@link Ok} carries the value (which may be {@code null} for side-effect-only calls)</li>
 *   <li>{@link Failure} carries a {@link StoreError}</li>
 * </ul>
 *
 * @param <T> the value type
 */
public sealed interface StoreResult<T> permits StoreResult.Ok, StoreResult.Failure {

  static <T> StoreResult<T> ok(T value) {
    return new Ok<>(value);
  }

  static <T> StoreResult<T> failure(StoreError error) {
    return new Failure<>(error);
  }

  static <T> StoreResult<T> failure(ErrorKind kind, String message) {
    return new Failure<>(StoreError.of(kind, message));
  }

  static <T> StoreResult<T> failure(ErrorKind kind, String message, Throwable cause) {
    return new Failure<>(new StoreError(kind, message, cause));
  }

  boolean isOk();

  /**
   * Returns the value of an {@link Ok} result.
   *
   * @throws StoreException if this result is a {@link Failure}
   */
  T orElseThrow();

  Optional<StoreError> error();

  <R> StoreResult<R> map(Function<? super T, ? extends R> fn);

  <R> StoreResult<R> flatMap(Function<? super T, StoreResult<R>> fn);

  /** Successful result. */
  record Ok<T>(T value) implements StoreResult<T> {
    @Override
    public boolean isOk() {
      return true;
    }

    @Override
    public T orElseThrow() {
      return value;
    }

    @Override
    public Optional<StoreError> error() {
      return Optional.empty();
    }

    @Override
    public <R> StoreResult<R> map(Function<? super T, ? extends R> fn) {
      return new Ok<>(fn.apply(value));
    }

    @Override
    public <R> StoreResult<R> flatMap(Function<? super T, StoreResult<R>> fn) {
      return Objects.requireNonNull(fn.apply(value), "flatMap result");
    }
  }

  /** Failed result. */
  record Failure<T>(StoreError cause) implements StoreResult<T> {
    public Failure {
      Objects.requireNonNull(cause, "cause");
    }

    public ErrorKind kind() {
      return cause.kind();
    }

    @Override
    public boolean isOk() {
      return false;
    }

    @Override
    public T orElseThrow() {
      throw new StoreException(cause);
    }

    @Override
    public Optional<StoreError> error() {
      return Optional.of(cause);
    }

    @Override
    public <R> StoreResult<R> map(Function<? super T, ? extends R> fn) {
      return new Failure<>(cause);
    }

    @Override
    public <R> StoreResult<R> flatMap(Function<? super T, StoreResult<R>> fn) {
      return new Failure<>(cause);
    }
  }
}
