package com.soartech.cmakels;

import static java.util.stream.Collectors.toList;

import com.soartech.cmakels.cmake.ast.Argument;
import com.soartech.cmakels.cmake.ast.AstNode;
import com.soartech.cmakels.cmake.ast.BlockNode;
import com.soartech.cmakels.cmake.ast.BodyBlock;
import com.soartech.cmakels.cmake.ast.CommandInvocation;
import com.soartech.cmakels.cmake.ast.DefinitionBlock;
import com.soartech.cmakels.cmake.ast.IfBlock;
import com.soartech.cmakels.cmake.ast.MacroBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.eclipse.lsp4j.DocumentSymbol;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.SymbolKind;

/**
 * A helper class for responding to the textDocument/documentSymbol request.
 *
 * <p>CMake has few constructs that map onto the protocol's symbol kinds. Functions and macros
 * are reported as functions, and the variables set by set() and option() as variables. Control
 * blocks such as if() and foreach() do not declare anything, but they are reported as namespaces
 * so that the symbols inside them keep the nesting of the file.
 *
 * <p>The symbols come from the syntax tree alone, so they are available without waiting for an
 * analysis.
 */
public class DocumentSymbolRequest {
  public static Stream<DocumentSymbol> symbols(CMakeFile file) {
    return file.script.map(script -> symbols(file, script.nodes)).orElseGet(Stream::empty);
  }

  static Stream<DocumentSymbol> symbols(CMakeFile file, List<AstNode> nodes) {
    return nodes.stream()
        .map(node -> symbol(file, node))
        .filter(Optional::isPresent)
        .map(Optional::get);
  }

  static Optional<DocumentSymbol> symbol(CMakeFile file, AstNode node) {
    if (node instanceof DefinitionBlock) {
      return definition(file, (DefinitionBlock) node);
    } else if (node instanceof BodyBlock) {
      BodyBlock block = (BodyBlock) node;
      return Optional.of(namespace(file, block, symbols(file, block.body).collect(toList())));
    } else if (node instanceof IfBlock) {
      IfBlock block = (IfBlock) node;
      List<DocumentSymbol> children = new ArrayList<>();
      for (IfBlock.Branch branch : block.branches) {
        symbols(file, branch.body).forEach(children::add);
      }
      block.elseBranch.ifPresent(branch -> symbols(file, branch.body).forEach(children::add));
      return Optional.of(namespace(file, block, children));
    } else if (node instanceof CommandInvocation) {
      return variable(file, (CommandInvocation) node);
    }
    return Optional.empty();
  }

  static Optional<DocumentSymbol> definition(CMakeFile file, DefinitionBlock block) {
    return block
        .nameArgument()
        .map(
            name -> {
              List<DocumentSymbol> children = symbols(file, block.body).collect(toList());
              String detail =
                  (block instanceof MacroBlock ? "macro" : "function")
                      + "("
                      + String.join(" ", block.parameters())
                      + ")";
              return new DocumentSymbol(
                  name.text,
                  SymbolKind.Function,
                  file.rangeFor(block.span),
                  file.rangeFor(name.span),
                  detail,
                  children);
            });
  }

  static DocumentSymbol namespace(CMakeFile file, BlockNode block, List<DocumentSymbol> children) {
    Range range = file.rangeFor(block.span);
    Range selectionRange = file.rangeFor(block.header.span);
    return new DocumentSymbol(
        block.header.toString(), SymbolKind.Namespace, range, selectionRange, null, children);
  }

  static Optional<DocumentSymbol> variable(CMakeFile file, CommandInvocation command) {
    if (!command.is("set") && !command.is("option")) {
      return Optional.empty();
    }
    if (command.arguments.isEmpty()) {
      return Optional.empty();
    }
    Argument name = command.arguments.get(0);
    Range range = file.rangeFor(command.span);
    DocumentSymbol symbol =
        new DocumentSymbol(name.text, SymbolKind.Variable, range, file.rangeFor(name.span));
    symbol.setDetail(command.toString());
    return Optional.of(symbol);
  }
}
