package com.soartech.cmakels.analysis;

import com.soartech.cmakels.cmake.ast.CommandInvocation;

/** The result of evaluating the condition of an if(), elseif() or while() command. */
public class ConditionEvaluation {
  public final CommandInvocation command;

  public final boolean result;

  ConditionEvaluation(CommandInvocation command, boolean result) {
    this.command = command;
    this.result = result;
  }
}
