package com.soartech.cmakels.analysis;

import com.google.common.collect.ImmutableSet;
import com.soartech.cmakels.ProjectConfiguration;
import com.soartech.cmakels.cmake.eval.TestOracle;
import com.soartech.cmakels.cmake.eval.VariableContext;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers the tests in conditions from what the analysis has seen so far, the project
 * configuration, and the file system around the document. Relative paths are resolved against the
 * directory of the document.
 */
class AnalysisTestOracle implements TestOracle {
  private static final Logger LOG = LoggerFactory.getLogger(AnalysisTestOracle.class);

  private static final Pattern POLICY_ID = Pattern.compile("CMP(\\d{4})");

  /** The number of the most recent policy known to if(POLICY). */
  static final int LATEST_POLICY = 170;

  /** Commands that CMake provides itself. */
  static final ImmutableSet<String> BUILTIN_COMMANDS =
      ImmutableSet.of(
          "add_compile_definitions",
          "add_compile_options",
          "add_custom_command",
          "add_custom_target",
          "add_definitions",
          "add_dependencies",
          "add_executable",
          "add_library",
          "add_link_options",
          "add_subdirectory",
          "add_test",
          "block",
          "break",
          "cmake_host_system_information",
          "cmake_language",
          "cmake_minimum_required",
          "cmake_parse_arguments",
          "cmake_path",
          "cmake_policy",
          "configure_file",
          "continue",
          "else",
          "elseif",
          "enable_language",
          "enable_testing",
          "endblock",
          "endforeach",
          "endfunction",
          "endif",
          "endmacro",
          "endwhile",
          "execute_process",
          "export",
          "file",
          "find_file",
          "find_library",
          "find_package",
          "find_path",
          "find_program",
          "foreach",
          "function",
          "get_cmake_property",
          "get_directory_property",
          "get_filename_component",
          "get_property",
          "get_target_property",
          "get_test_property",
          "if",
          "include",
          "include_directories",
          "include_guard",
          "install",
          "link_directories",
          "link_libraries",
          "list",
          "macro",
          "mark_as_advanced",
          "math",
          "message",
          "option",
          "project",
          "return",
          "separate_arguments",
          "set",
          "set_directory_properties",
          "set_property",
          "set_source_files_properties",
          "set_target_properties",
          "set_tests_properties",
          "site_name",
          "source_group",
          "string",
          "target_compile_definitions",
          "target_compile_features",
          "target_compile_options",
          "target_include_directories",
          "target_link_directories",
          "target_link_libraries",
          "target_link_options",
          "target_precompile_headers",
          "target_sources",
          "try_compile",
          "try_run",
          "unset",
          "variable_watch",
          "while");

  private final Optional<Path> directory;

  private final ProjectConfiguration config;

  private final VariableContext variables;

  /** Names of the functions and macros defined in the file, lower case. */
  private final Set<String> definedCommands;

  /** Targets created so far. */
  private final Set<String> targets;

  AnalysisTestOracle(
      URI documentUri,
      ProjectConfiguration config,
      VariableContext variables,
      Set<String> definedCommands,
      Set<String> targets) {
    this.directory = directoryOf(documentUri);
    this.config = config;
    this.variables = variables;
    this.definedCommands = definedCommands;
    this.targets = targets;
  }

  @Override
  public boolean exists(String path) {
    return resolve(path).map(Files::exists).orElse(false);
  }

  @Override
  public boolean command(String name) {
    String key = name.toLowerCase(Locale.ROOT);
    return BUILTIN_COMMANDS.contains(key)
        || definedCommands.contains(key)
        || config.commands.stream().anyMatch(command -> command.equalsIgnoreCase(name));
  }

  @Override
  public boolean target(String name) {
    return targets.contains(name) || config.targets.contains(name);
  }

  @Override
  public boolean defined(String name) {
    return variables.isDefined(name);
  }

  @Override
  public boolean policy(String id) {
    if (!config.policies.isEmpty()) {
      return config.policies.contains(id);
    }
    Matcher matcher = POLICY_ID.matcher(id);
    return matcher.matches() && Integer.parseInt(matcher.group(1)) <= LATEST_POLICY;
  }

  @Override
  public boolean isDirectory(String path) {
    return resolve(path).map(Files::isDirectory).orElse(false);
  }

  @Override
  public boolean isSymlink(String path) {
    return resolve(path).map(Files::isSymbolicLink).orElse(false);
  }

  /** As in CMake, this is also true if either of the files does not exist. */
  @Override
  public boolean isNewerThan(String path, String otherPath) {
    Optional<Path> file = resolve(path).filter(Files::exists);
    Optional<Path> other = resolve(otherPath).filter(Files::exists);
    if (!file.isPresent() || !other.isPresent()) {
      return true;
    }
    try {
      return Files.getLastModifiedTime(file.get(), LinkOption.NOFOLLOW_LINKS)
              .compareTo(Files.getLastModifiedTime(other.get(), LinkOption.NOFOLLOW_LINKS))
          >= 0;
    } catch (IOException e) {
      LOG.debug("Could not compare modification times of {} and {}", path, otherPath, e);
      return true;
    }
  }

  private Optional<Path> resolve(String path) {
    if (path.isEmpty()) {
      return Optional.empty();
    }
    try {
      Path candidate = Paths.get(path);
      if (candidate.isAbsolute()) {
        return Optional.of(candidate);
      }
      return directory.map(dir -> dir.resolve(candidate));
    } catch (InvalidPathException e) {
      LOG.debug("Not a valid path: {}", path);
      return Optional.empty();
    }
  }

  private static Optional<Path> directoryOf(URI uri) {
    if (!"file".equals(uri.getScheme())) {
      return Optional.empty();
    }
    return Optional.ofNullable(Paths.get(uri).getParent());
  }
}
