package com.soartech.cmakels.analysis;

import com.soartech.cmakels.cmake.ast.CommandInvocation;
import com.soartech.cmakels.cmake.eval.Namespace;
import java.util.Optional;
import org.eclipse.lsp4j.Location;

/** A record of a variable that was set and its associated metadata. */
public class VariableDefinition {
  /** The name of the variable. */
  public final String name;

  public final Namespace namespace;

  /** The location of the command that set the variable. */
  public final Location location;

  /** The command that set the variable. */
  public final CommandInvocation command;

  /** The value of this variable. */
  public final String value;

  /** The text of the comments directly preceding the command, if any. */
  public final Optional<String> commentText;

  VariableDefinition(
      String name,
      Namespace namespace,
      Location location,
      CommandInvocation command,
      String value,
      String commentText) {
    this.name = name;
    this.namespace = namespace;
    this.location = location;
    this.command = command;
    this.value = value;
    this.commentText = Optional.ofNullable(commentText);
  }
}
