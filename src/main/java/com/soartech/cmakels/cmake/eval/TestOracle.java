package com.soartech.cmakels.cmake.eval;

import java.util.function.BiPredicate;
import java.util.function.Predicate;

/**
 * Answers the tests in conditions that need knowledge from outside the script, such as {@code
 * if(EXISTS path)} or {@code if(TARGET name)}. Each method receives its operand as written, after
 * variable expansion.
 */
public interface TestOracle {
  /** An oracle that knows nothing, so every test is false. */
  TestOracle NONE = builder().build();

  boolean exists(String path);

  boolean command(String name);

  boolean target(String name);

  /**
   * The operand may be a plain name or one of the forms {@code ENV{NAME}} and {@code CACHE{NAME}}.
   */
  boolean defined(String name);

  boolean policy(String id);

  default boolean test(String name) {
    return false;
  }

  default boolean isDirectory(String path) {
    return false;
  }

  default boolean isSymlink(String path) {
    return false;
  }

  default boolean isNewerThan(String path, String otherPath) {
    return false;
  }

  static Builder builder() {
    return new Builder();
  }

  /** Builds an oracle from predicates. Tests without a predicate are false. */
  final class Builder {
    private Predicate<String> exists = operand -> false;
    private Predicate<String> command = operand -> false;
    private Predicate<String> target = operand -> false;
    private Predicate<String> defined = operand -> false;
    private Predicate<String> policy = operand -> false;
    private Predicate<String> test = operand -> false;
    private Predicate<String> isDirectory = operand -> false;
    private Predicate<String> isSymlink = operand -> false;
    private BiPredicate<String, String> isNewerThan = (left, right) -> false;

    private Builder() {}

    public Builder exists(Predicate<String> exists) {
      this.exists = exists;
      return this;
    }

    public Builder command(Predicate<String> command) {
      this.command = command;
      return this;
    }

    public Builder target(Predicate<String> target) {
      this.target = target;
      return this;
    }

    public Builder defined(Predicate<String> defined) {
      this.defined = defined;
      return this;
    }

    /** Answer {@code DEFINED} from the variables in a context. */
    public Builder defined(VariableContext context) {
      return defined(context::isDefined);
    }

    public Builder policy(Predicate<String> policy) {
      this.policy = policy;
      return this;
    }

    public Builder test(Predicate<String> test) {
      this.test = test;
      return this;
    }

    public Builder isDirectory(Predicate<String> isDirectory) {
      this.isDirectory = isDirectory;
      return this;
    }

    public Builder isSymlink(Predicate<String> isSymlink) {
      this.isSymlink = isSymlink;
      return this;
    }

    public Builder isNewerThan(BiPredicate<String, String> isNewerThan) {
      this.isNewerThan = isNewerThan;
      return this;
    }

    public TestOracle build() {
      final Predicate<String> exists = this.exists;
      final Predicate<String> command = this.command;
      final Predicate<String> target = this.target;
      final Predicate<String> defined = this.defined;
      final Predicate<String> policy = this.policy;
      final Predicate<String> test = this.test;
      final Predicate<String> isDirectory = this.isDirectory;
      final Predicate<String> isSymlink = this.isSymlink;
      final BiPredicate<String, String> isNewerThan = this.isNewerThan;

      return new TestOracle() {
        @Override
        public boolean exists(String path) {
          return exists.test(path);
        }

        @Override
        public boolean command(String name) {
          return command.test(name);
        }

        @Override
        public boolean target(String name) {
          return target.test(name);
        }

        @Override
        public boolean defined(String name) {
          return defined.test(name);
        }

        @Override
        public boolean policy(String id) {
          return policy.test(id);
        }

        @Override
        public boolean test(String name) {
          return test.test(name);
        }

        @Override
        public boolean isDirectory(String path) {
          return isDirectory.test(path);
        }

        @Override
        public boolean isSymlink(String path) {
          return isSymlink.test(path);
        }

        @Override
        public boolean isNewerThan(String path, String otherPath) {
          return isNewerThan.test(path, otherPath);
        }
      };
    }
  }
}
