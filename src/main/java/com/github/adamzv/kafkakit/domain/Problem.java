package com.github.adamzv.kafkakit.domain;

import java.util.Map;

public record Problem(
    String code,
    String message,
    Map<String, Object> details
) {

  public Problem {
    details = details == null ? Map.of() : Map.copyOf(details);
  }

  public boolean is(String expectedCode) {
    return code != null && code.equals(expectedCode);
  }

  public String summary() {
    return code + ": " + message;
  }
}
