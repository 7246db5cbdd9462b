package com.soartech.cmakels;

import com.google.common.base.Enums;
import com.soartech.cmakels.cmake.eval.DereferencePolicy;
import com.soartech.cmakels.cmake.eval.MapVariableContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * This class contains configuration options for a single project. It defines the structure of the
 * optional cmakels.json manifest file at the workspace root. Every field has a default, so a
 * project without a manifest behaves as if it had an empty one.
 */
public class ProjectConfiguration {

  /** Ordinary variables that are set before the first command of every file. */
  public final Map<String, String> variables = new LinkedHashMap<>();

  /** Environment variables, as read by $ENV{NAME}. */
  public final Map<String, String> environment = new LinkedHashMap<>();

  /** Cache entries, as read by $CACHE{NAME}. */
  public final Map<String, String> cache = new LinkedHashMap<>();

  /**
   * How quoted arguments in conditions are treated, either "OLD" or "NEW" as for policy CMP0054.
   * Unrecognised values fall back to NEW.
   */
  public String policy = "NEW";

  /** Commands to treat as defined in if(COMMAND ...), in addition to the CMake built-ins. */
  public final List<String> commands = new ArrayList<>();

  /** Targets to treat as defined in if(TARGET ...), such as those created by other directories. */
  public final List<String> targets = new ArrayList<>();

  /**
   * The policies known to if(POLICY ...). If this is empty, every policy id of the form CMPnnnn up
   * to the most recent one is known.
   */
  public final List<String> policies = new ArrayList<>();

  public ProjectConfiguration() {}

  public DereferencePolicy dereferencePolicy() {
    if (policy == null) {
      return DereferencePolicy.NEW;
    }
    return Enums.getIfPresent(DereferencePolicy.class, policy.toUpperCase(Locale.ROOT))
        .toJavaUtil()
        .orElse(DereferencePolicy.NEW);
  }

  /** The variables that are in effect before the first command of a file. */
  public MapVariableContext initialVariables() {
    MapVariableContext.Builder builder = MapVariableContext.builder();
    // Gson leaves null in fields that are explicitly null in the manifest.
    if (variables != null) {
      builder.putAllNormal(variables);
    }
    if (environment != null) {
      builder.putAllEnvironment(environment);
    }
    if (cache != null) {
      builder.putAllCache(cache);
    }
    return builder.build();
  }
}
