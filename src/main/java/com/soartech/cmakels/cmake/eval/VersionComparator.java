package com.soartech.cmakels.cmake.eval;

import com.google.common.base.Splitter;
import java.math.BigInteger;
import java.util.Comparator;
import java.util.List;

/**
 * Compares version strings such as {@code 3.20.1} component by component. Each component is read
 * as the integer formed by its leading digits, a component without digits counts as zero, and
 * missing trailing components are zero, so {@code 1.2} equals {@code 1.2.0}.
 */
public final class VersionComparator implements Comparator<String> {
  public static final VersionComparator INSTANCE = new VersionComparator();

  private static final Splitter DOT = Splitter.on('.');

  private VersionComparator() {}

  @Override
  public int compare(String left, String right) {
    List<String> leftComponents = DOT.splitToList(left);
    List<String> rightComponents = DOT.splitToList(right);
    int length = Math.max(leftComponents.size(), rightComponents.size());
    for (int i = 0; i < length; ++i) {
      int result = component(leftComponents, i).compareTo(component(rightComponents, i));
      if (result != 0) {
        return result;
      }
    }
    return 0;
  }

  private static BigInteger component(List<String> components, int index) {
    if (index >= components.size()) {
      return BigInteger.ZERO;
    }
    String component = components.get(index);
    int digits = 0;
    while (digits < component.length() && Character.isDigit(component.charAt(digits))) {
      ++digits;
    }
    return digits == 0 ? BigInteger.ZERO : new BigInteger(component.substring(0, digits));
  }
}
