package com.github.adamzv.kafkakit.domain;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class Problems {

  private Problems() {
  }

  public static ProblemException invalidArgument(String message, Map<String, Object> details) {
    return raise(ProblemCodes.INVALID_ARGUMENT, message, details, null);
  }

  public static ProblemException schemaError(String message, Map<String, Object> details) {
    return raise(ProblemCodes.SCHEMA_ERROR, message, details, null);
  }

  public static ProblemException schemaError(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.SCHEMA_ERROR, message, details, cause);
  }

  public static ProblemException versionMismatch(String message, Map<String, Object> details) {
    return raise(ProblemCodes.VERSION_MISMATCH, message, details, null);
  }

  public static ProblemException transportError(String message, Map<String, Object> details) {
    return raise(ProblemCodes.TRANSPORT_ERROR, message, details, null);
  }

  public static ProblemException transportError(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.TRANSPORT_ERROR, message, details, cause);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details) {
    return raise(ProblemCodes.OPERATION_FAILED, message, details, null);
  }

  public static ProblemException operationFailed(String message, Map<String, Object> details, Throwable cause) {
    return raise(ProblemCodes.OPERATION_FAILED, message, details, cause);
  }

  /**
   * Unwraps future wrappers and converts anything that is not already a {@link ProblemException}
   * into an {@code OPERATION_FAILED} problem.
   */
  public static ProblemException from(Throwable failure) {
    Throwable cause = unwrap(failure);
    if (cause instanceof ProblemException problemException) {
      return problemException;
    }
    Map<String, Object> details = new HashMap<>();
    details.put("error", cause.getClass().getSimpleName());
    if (cause.getMessage() != null) {
      details.put("message", cause.getMessage());
    }
    return operationFailed("Unexpected failure", details, cause);
  }

  public static Throwable unwrap(Throwable failure) {
    Throwable current = failure;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static ProblemException raise(String code, String message, Map<String, Object> details, Throwable cause) {
    return new ProblemException(new Problem(code, message, details), cause);
  }
}
