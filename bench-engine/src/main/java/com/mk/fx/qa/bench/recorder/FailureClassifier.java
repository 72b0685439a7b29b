package com.mk.fx.qa.bench.recorder;

import com.mk.fx.qa.bench.model.ErrorKind;
import java.io.IOException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/** Maps a failed exchange to an {@link ErrorKind}. */
final class FailureClassifier {

  private FailureClassifier() {}

  static ErrorKind classify(Throwable failure) {
    if (failure == null) {
      return ErrorKind.UNKNOWN_ERROR;
    }
    // connect timeouts are transport failures, not request timeouts
    if (hasCause(failure, HttpConnectTimeoutException.class)) {
      return ErrorKind.CONNECTION_ERROR;
    }
    if (hasCause(failure, HttpTimeoutException.class)
        || hasCause(failure, TimeoutException.class)) {
      return ErrorKind.TIMEOUT;
    }
    if (hasCause(failure, IOException.class)) {
      return ErrorKind.CONNECTION_ERROR;
    }
    return ErrorKind.UNKNOWN_ERROR;
  }

  /** Best-effort description taken from the innermost meaningful exception. */
  static String describe(Throwable failure) {
    if (failure == null) {
      return "unknown";
    }
    Throwable cause = unwrap(failure);
    Throwable root = cause;
    while (root.getCause() != null && root.getCause() != root) {
      root = root.getCause();
    }
    String msg = cause.getMessage();
    if (msg == null || msg.isBlank()) {
      msg = root.getMessage();
    }
    if (msg == null || msg.isBlank()) {
      return root.getClass().getSimpleName();
    }
    return root.getClass().getSimpleName() + ": " + msg;
  }

  private static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static boolean hasCause(Throwable failure, Class<? extends Throwable> type) {
    Throwable current = failure;
    while (current != null) {
      if (type.isInstance(current)) {
        return true;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return false;
  }
}
