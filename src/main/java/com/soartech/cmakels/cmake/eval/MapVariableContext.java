package com.soartech.cmakels.cmake.eval;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** An immutable variable context backed by maps. */
public final class MapVariableContext implements VariableContext {
  public final ImmutableMap<String, String> normal;

  public final ImmutableMap<String, String> environment;

  public final ImmutableMap<String, String> cache;

  private MapVariableContext(Builder builder) {
    this.normal = ImmutableMap.copyOf(builder.normal);
    this.environment = ImmutableMap.copyOf(builder.environment);
    this.cache = ImmutableMap.copyOf(builder.cache);
  }

  /** Create a context with only ordinary variables. */
  public static MapVariableContext of(Map<String, String> normal) {
    return builder().putAllNormal(normal).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Optional<String> normal(String name) {
    return Optional.ofNullable(normal.get(name));
  }

  @Override
  public Optional<String> environment(String name) {
    return Optional.ofNullable(environment.get(name));
  }

  @Override
  public Optional<String> cache(String name) {
    return Optional.ofNullable(cache.get(name));
  }

  /** Later values for the same name replace earlier ones. */
  public static final class Builder {
    private final Map<String, String> normal = new LinkedHashMap<>();
    private final Map<String, String> environment = new LinkedHashMap<>();
    private final Map<String, String> cache = new LinkedHashMap<>();

    private Builder() {}

    public Builder normal(String name, String value) {
      normal.put(name, value);
      return this;
    }

    public Builder environment(String name, String value) {
      environment.put(name, value);
      return this;
    }

    public Builder cache(String name, String value) {
      cache.put(name, value);
      return this;
    }

    public Builder putAllNormal(Map<String, String> values) {
      normal.putAll(values);
      return this;
    }

    public Builder putAllEnvironment(Map<String, String> values) {
      environment.putAll(values);
      return this;
    }

    public Builder putAllCache(Map<String, String> values) {
      cache.putAll(values);
      return this;
    }

    public MapVariableContext build() {
      return new MapVariableContext(this);
    }
  }
}
