package com.soartech.cmakels.analysis;

import com.google.common.collect.ImmutableList;
import com.soartech.cmakels.cmake.ast.DefinitionBlock;
import com.soartech.cmakels.cmake.ast.MacroBlock;
import java.util.List;
import java.util.Optional;
import org.eclipse.lsp4j.Location;

/** A record of a function or macro that was defined and its associated metadata. */
public class CommandDefinition {
  /** The name of the command, as written in the definition. */
  public final String name;

  /** The location of the name in the function() or macro() command. */
  public final Location location;

  /** The names of the declared parameters. */
  public final ImmutableList<String> parameters;

  /** The syntax tree of the whole definition block. */
  public final DefinitionBlock block;

  /**
   * The text of the comments directly preceding the definition, one line per comment line, without
   * the '#' characters.
   */
  public final Optional<String> commentText;

  CommandDefinition(
      String name,
      Location location,
      List<String> parameters,
      DefinitionBlock block,
      String commentText) {
    this.name = name;
    this.location = location;
    this.parameters = ImmutableList.copyOf(parameters);
    this.block = block;
    this.commentText = Optional.ofNullable(commentText);
  }

  public boolean isMacro() {
    return block instanceof MacroBlock;
  }

  /** A signature such as {@code my_function(first second)}. */
  public String signature() {
    return name + "(" + String.join(" ", parameters) + ")";
  }
}
