package com.soartech.cmakels.cmake.eval;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * CMake lists are strings with elements separated by semicolons. A semicolon preceded by a
 * backslash, or inside square brackets, does not separate elements.
 */
public final class ListValues {
  private static final Joiner JOINER = Joiner.on(';');

  private ListValues() {}

  /**
   * Split a list into its elements. Empty elements are dropped and {@code \;} becomes {@code ;}.
   */
  public static ImmutableList<String> split(String list) {
    ImmutableList.Builder<String> elements = ImmutableList.builder();
    StringBuilder element = new StringBuilder();
    int squareNesting = 0;
    for (int i = 0; i < list.length(); ++i) {
      char c = list.charAt(i);
      if (c == '\\' && i + 1 < list.length() && list.charAt(i + 1) == ';') {
        element.append(';');
        ++i;
      } else if (c == '[') {
        ++squareNesting;
        element.append(c);
      } else if (c == ']') {
        if (squareNesting > 0) {
          --squareNesting;
        }
        element.append(c);
      } else if (c == ';' && squareNesting == 0) {
        addElement(elements, element);
      } else {
        element.append(c);
      }
    }
    addElement(elements, element);
    return elements.build();
  }

  private static void addElement(ImmutableList.Builder<String> elements, StringBuilder element) {
    if (element.length() > 0) {
      elements.add(element.toString());
      element.setLength(0);
    }
  }

  public static String join(List<String> elements) {
    return JOINER.join(elements);
  }
}
