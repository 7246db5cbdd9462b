package com.soartech.cmakels.cmake.eval;

/**
 * How conditions treat quoted arguments, which CMake controls with policy CMP0054. Scripts written
 * for different minimum CMake versions need different settings, so the policy is chosen per
 * evaluation.
 */
public enum DereferencePolicy {
  /** Quoted and bracket arguments are dereferenced and may be keywords, like unquoted ones. */
  OLD,

  /** Quoted and bracket arguments are only ever used as literal strings. */
  NEW
}
