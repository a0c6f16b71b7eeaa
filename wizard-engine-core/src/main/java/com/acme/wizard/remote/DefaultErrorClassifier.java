package com.acme.wizard.remote;

import com.acme.wizard.core.PermanentException;
import com.acme.wizard.core.TransientException;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default mapping from remote failure categories and thrown exceptions to engine error kinds.
 *
 * <ul>
 *   <li>VALIDATION → REMOTE_VALIDATION, CONFLICT → CONFLICT (message kept verbatim)
 *   <li>UNAUTHORIZED → AUTH (halts navigation until re-authentication)
 *   <li>FORBIDDEN, NOT_FOUND → REJECTED
 *   <li>SERVER_ERROR, NETWORK_ERROR, TIMEOUT → TRANSIENT
 *   <li>timeouts and I/O exceptions → TRANSIENT; anything else thrown → UNEXPECTED
 * </ul>
 */
public class DefaultErrorClassifier implements ErrorClassifier {

  private static final Logger LOG = LoggerFactory.getLogger(DefaultErrorClassifier.class);

  @Override
  public StepFailure classify(String stepId, RemoteResult.Failure failure) {
    FailureCategory category = failure.category();
    String message = messageOrDefault(failure.message(), category);

    StepFailure classified =
        switch (category) {
          case VALIDATION -> new StepFailure(
              stepId,
              ErrorKind.REMOTE_VALIDATION,
              category,
              message,
              failure.fieldErrors(),
              CallToAction.CORRECT_FIELDS,
              true);
          case CONFLICT -> new StepFailure(
              stepId, ErrorKind.CONFLICT, category, message, List.of(), CallToAction.VIEW_CONFLICT, true);
          case UNAUTHORIZED -> new StepFailure(
              stepId, ErrorKind.AUTH, category, message, List.of(), CallToAction.REAUTHENTICATE, true);
          case FORBIDDEN, NOT_FOUND -> new StepFailure(
              stepId,
              ErrorKind.REJECTED,
              category,
              message,
              List.of(),
              CallToAction.CONTACT_SUPPORT,
              true);
          case SERVER_ERROR, NETWORK_ERROR, TIMEOUT -> new StepFailure(
              stepId, ErrorKind.TRANSIENT, category, message, List.of(), CallToAction.RETRY, true);
        };

    if (category == FailureCategory.SERVER_ERROR) {
      LOG.error("Remote server error in step {}: {}", stepId, message);
    } else {
      LOG.warn("Remote failure in step {} ({} -> {}): {}", stepId, category, classified.kind(), message);
    }
    return classified;
  }

  @Override
  public StepFailure classify(String stepId, Throwable error) {
    Throwable cause = unwrap(error);

    if (isTimeout(cause)) {
      LOG.warn("Remote call timed out in step {}: {}", stepId, cause.getMessage());
      return transientFailure(stepId, FailureCategory.TIMEOUT, cause);
    }
    if (cause instanceof IOException
        || cause instanceof UncheckedIOException
        || cause instanceof TransientException) {
      LOG.warn("Network failure in step {}: {}", stepId, cause.getMessage());
      return transientFailure(stepId, FailureCategory.NETWORK_ERROR, cause);
    }

    if (cause instanceof PermanentException) {
      LOG.error("Permanent failure in step {}", stepId, cause);
    } else {
      LOG.error("Unexpected failure in step {}", stepId, cause);
    }
    return new StepFailure(
        stepId,
        ErrorKind.UNEXPECTED,
        null,
        cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(),
        List.of(),
        CallToAction.CONTACT_SUPPORT,
        false);
  }

  private static StepFailure transientFailure(
      String stepId, FailureCategory category, Throwable cause) {
    return new StepFailure(
        stepId,
        ErrorKind.TRANSIENT,
        category,
        messageOrDefault(cause.getMessage(), category),
        List.of(),
        CallToAction.RETRY,
        true);
  }

  private static boolean isTimeout(Throwable cause) {
    // SocketTimeoutException is an InterruptedIOException
    return cause instanceof TimeoutException || cause instanceof InterruptedIOException;
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  static String messageOrDefault(String message, FailureCategory category) {
    if (message != null && !message.isBlank()) {
      return message;
    }
    return switch (category) {
      case VALIDATION -> "The server rejected some of the entered values";
      case UNAUTHORIZED -> "Your session has expired, please sign in again";
      case FORBIDDEN -> "You do not have permission to perform this action";
      case NOT_FOUND -> "The requested record was not found";
      case CONFLICT -> "The record was changed or already exists";
      case SERVER_ERROR -> "The server failed to process the request";
      case NETWORK_ERROR -> "Could not reach the server";
      case TIMEOUT -> "The server did not respond in time";
    };
  }
}
