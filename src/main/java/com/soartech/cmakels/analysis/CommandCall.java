package com.soartech.cmakels.analysis;

import com.soartech.cmakels.cmake.ast.CommandInvocation;
import java.util.Optional;
import org.eclipse.lsp4j.Location;

/** A record of a command being invoked and its associated metadata. */
public class CommandCall {
  /** The location of the whole invocation. */
  public final Location callSiteLocation;

  /** The syntax tree of the invocation and its arguments. */
  public final CommandInvocation command;

  /** Where and how the command was defined, if it is a function or macro from this file. */
  public final Optional<CommandDefinition> definition;

  CommandCall(Location location, CommandInvocation command, CommandDefinition definition) {
    this.callSiteLocation = location;
    this.command = command;
    this.definition = Optional.ofNullable(definition);
  }
}
