package com.soartech.cmakels.analysis;

import com.soartech.cmakels.cmake.ast.CommandInvocation;
import com.soartech.cmakels.cmake.eval.VariableReference;
import java.util.Optional;
import org.eclipse.lsp4j.Location;

/** A record of a variable's value being read by a reference and its associated metadata. */
public class VariableRetrieval {
  /** The location of the reference, from its opener to its closing brace. */
  public final Location readSiteLocation;

  /** Offset in the file of the first character of the opener. */
  public final int startOffset;

  /** Offset in the file of the character after the closing brace. */
  public final int endOffset;

  /** The reference, including the value it had at this point of the file. */
  public final VariableReference reference;

  /** The command whose argument contains the reference. */
  public final CommandInvocation command;

  /** The command that gave the variable its value, if it was set in this file. */
  public final Optional<VariableDefinition> definition;

  VariableRetrieval(
      Location location,
      int startOffset,
      int endOffset,
      VariableReference reference,
      CommandInvocation command,
      VariableDefinition definition) {
    this.readSiteLocation = location;
    this.startOffset = startOffset;
    this.endOffset = endOffset;
    this.reference = reference;
    this.command = command;
    this.definition = Optional.ofNullable(definition);
  }

  public String value() {
    return reference.value;
  }

  public boolean containsOffset(int offset) {
    return offset >= startOffset && offset < endOffset;
  }
}
