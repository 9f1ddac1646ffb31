package com.github.adamzv.kafkakit.domain;

public final class ProblemCodes {
  public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
  public static final String SCHEMA_ERROR = "SCHEMA_ERROR";
  public static final String VERSION_MISMATCH = "VERSION_MISMATCH";
  public static final String TRANSPORT_ERROR = "TRANSPORT_ERROR";
  public static final String HANDLER_RETRYABLE = "HANDLER_RETRYABLE";
  public static final String HANDLER_PERMANENT = "HANDLER_PERMANENT";
  public static final String OPERATION_FAILED = "OPERATION_FAILED";

  private ProblemCodes() {
  }
}
