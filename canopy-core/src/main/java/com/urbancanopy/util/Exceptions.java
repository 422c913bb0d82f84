package com.urbancanopy.util;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Exception-handling utilities.
 */
public class Exceptions {
  private Exceptions() {}

  /**
   * Re-throw a caught exception, restoring the interrupt flag and wrapping checked exceptions in a
   * {@link FatalCanopyException}.
   *
   * @param exception The original exception
   * @param <T>       Return type if caller requires it
   */
  public static <T> T throwFatalException(Throwable exception) {
    if (exception instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    if (exception instanceof RuntimeException runtimeException) {
      throw runtimeException;
    } else if (exception instanceof IOException ioe) {
      throw new UncheckedIOException(ioe);
    } else if (exception instanceof Error error) {
      throw error;
    }
    throw new FatalCanopyException(exception);
  }

  /** Unrecoverable failure that aborts the current run. */
  public static class FatalCanopyException extends RuntimeException {
    public FatalCanopyException(Throwable exception) {
      super(exception);
    }
  }
}
