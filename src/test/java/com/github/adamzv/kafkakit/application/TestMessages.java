package com.github.adamzv.kafkakit.application;

import com.github.adamzv.kafkakit.domain.SchemaCatalog;

final class TestMessages {

  static final String USER_CREATED = "user-created";

  private TestMessages() {
  }

  public record UserCreatedV1(String userId, String email) {}

  public record UserCreatedV2(String userId, String email, String displayName) {}

  static SchemaCatalog catalog() {
    return SchemaCatalog.builder()
        .register(USER_CREATED, 1, UserCreatedV1.class, "userId", "email")
        .register(USER_CREATED, 2, UserCreatedV2.class, "userId", "email", "displayName")
        .build();
  }
}
