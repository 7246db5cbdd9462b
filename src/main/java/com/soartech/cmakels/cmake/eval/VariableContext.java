package com.soartech.cmakels.cmake.eval;

import java.util.Optional;

/**
 * Read-only access to variable values. The three namespaces are looked up independently; an absent
 * value is not an error, it expands to the empty string.
 *
 * <p>Implementations that are shared between threads must be safe for concurrent reads.
 */
public interface VariableContext {
  /** A context without any variables. */
  VariableContext EMPTY =
      new VariableContext() {
        @Override
        public Optional<String> normal(String name) {
          return Optional.empty();
        }

        @Override
        public Optional<String> environment(String name) {
          return Optional.empty();
        }

        @Override
        public Optional<String> cache(String name) {
          return Optional.empty();
        }
      };

  Optional<String> normal(String name);

  Optional<String> environment(String name);

  Optional<String> cache(String name);

  default Optional<String> lookup(Namespace namespace, String name) {
    switch (namespace) {
      case ENVIRONMENT:
        return environment(name);
      case CACHE:
        return cache(name);
      default:
        return normal(name);
    }
  }

  /**
   * Check a variable the way {@code if(DEFINED ...)} does. The operand is either a plain name,
   * which may be an ordinary variable or a cache entry, or one of the forms {@code ENV{NAME}} and
   * {@code CACHE{NAME}}.
   */
  default boolean isDefined(String operand) {
    if (operand.startsWith("ENV{") && operand.endsWith("}")) {
      return environment(operand.substring(4, operand.length() - 1)).isPresent();
    }
    if (operand.startsWith("CACHE{") && operand.endsWith("}")) {
      return cache(operand.substring(6, operand.length() - 1)).isPresent();
    }
    return normal(operand).isPresent() || cache(operand).isPresent();
  }
}
