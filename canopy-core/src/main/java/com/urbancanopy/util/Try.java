package com.urbancanopy.util;

import static com.urbancanopy.util.Exceptions.throwFatalException;

import java.util.function.Function;

/**
 * The result of an operation that may succeed or fail, used to keep one location's failure from aborting a batch.
 *
 * @param <T> Type of the result value, if success
 */
public interface Try<T> {

  /**
   * Calls {@code supplier} and wraps the result in {@link Success} if successful, or {@link Failure} if it throws an
   * exception.
   */
  static <T> Try<T> apply(SupplierThatThrows<T> supplier) {
    try {
      return success(supplier.get());
    } catch (Exception e) {
      return failure(e);
    }
  }

  static <T> Success<T> success(T item) {
    return new Success<>(item);
  }

  static <T> Failure<T> failure(Exception throwable) {
    return new Failure<>(throwable);
  }

  /**
   * Returns the result if success, or re-throws the failure.
   *
   * @throws RuntimeException wrapping the exception on failure
   */
  T get();

  default boolean isSuccess() {
    return !isFailure();
  }

  default boolean isFailure() {
    return exception() != null;
  }

  default Exception exception() {
    return null;
  }

  /** Returns the value when successful, otherwise {@code fallback}. */
  default T getOrElse(T fallback) {
    return isSuccess() ? get() : fallback;
  }

  /** Collapses this result into a single value using {@code onSuccess} or {@code onFailure}. */
  <O> O fold(Function<T, O> onSuccess, Function<Exception, O> onFailure);

  record Success<T>(T get) implements Try<T> {

    @Override
    public <O> O fold(Function<T, O> onSuccess, Function<Exception, O> onFailure) {
      return onSuccess.apply(get);
    }
  }

  record Failure<T>(@Override Exception exception) implements Try<T> {

    @Override
    public T get() {
      return throwFatalException(exception);
    }

    @Override
    public <O> O fold(Function<T, O> onSuccess, Function<Exception, O> onFailure) {
      return onFailure.apply(exception);
    }
  }

  @FunctionalInterface
  interface SupplierThatThrows<T> {
    @SuppressWarnings("java:S112")
    T get() throws Exception;
  }
}
