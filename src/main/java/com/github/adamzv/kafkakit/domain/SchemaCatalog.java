package com.github.adamzv.kafkakit.domain;

import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit registry of the wire schemas a codec understands. Each entry binds a
 * {@code (messageType, version)} pair to the Java type its payload decodes into and to the JSON
 * fields that must be present and non-null.
 */
public final class SchemaCatalog {

  public record Entry(
      String messageType,
      int version,
      Class<?> javaType,
      Set<String> requiredFields
  ) {

    public Entry {
      requiredFields = requiredFields == null ? Set.of() : Set.copyOf(requiredFields);
    }
  }

  private final Map<String, Map<Integer, Entry>> byType;

  private SchemaCatalog(Map<String, Map<Integer, Entry>> byType) {
    this.byType = byType;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<Entry> lookup(String messageType, int version) {
    Map<Integer, Entry> versions = byType.get(messageType);
    if (versions == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(versions.get(version));
  }

  /**
   * Highest version registered for exactly this Java type.
   */
  public Optional<Entry> latestFor(Class<?> javaType) {
    return byType.values().stream()
        .flatMap(versions -> versions.values().stream())
        .filter(entry -> entry.javaType().equals(javaType))
        .max(Comparator.comparingInt(Entry::version));
  }

  public static final class Builder {

    private final Map<String, Map<Integer, Entry>> byType = new LinkedHashMap<>();

    private Builder() {
    }

    public Builder register(String messageType, int version, Class<?> javaType, String... requiredFields) {
      if (messageType == null || messageType.isBlank()) {
        throw Problems.invalidArgument("Message type must not be blank", Map.of());
      }
      if (version < 1) {
        throw Problems.invalidArgument("Schema version must be >= 1", Map.of("version", version));
      }
      Map<Integer, Entry> versions = byType.computeIfAbsent(messageType, key -> new LinkedHashMap<>());
      if (versions.containsKey(version)) {
        throw Problems.invalidArgument(
            "Schema version already registered",
            Map.of("messageType", messageType, "version", version)
        );
      }
      versions.put(version, new Entry(messageType, version, javaType, Set.of(requiredFields)));
      return this;
    }

    public SchemaCatalog build() {
      Map<String, Map<Integer, Entry>> copy = new LinkedHashMap<>();
      byType.forEach((type, versions) -> copy.put(type, Map.copyOf(versions)));
      return new SchemaCatalog(Collections.unmodifiableMap(copy));
    }
  }
}
