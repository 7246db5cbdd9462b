package com.soartech.cmakels;

/**
 * This structure describes the configuration that clients send to the server via the
 * workspace/didChangeConfiguration notification, under the "cmake" key.
 */
class Configuration {
  /** How long in milliseconds to wait for changes to stop before an analysis is begun. */
  public Integer debounceTime = 1000;

  /** Whether hover tooltips should show full comment text or just the first line. */
  public Boolean fullCommentHover = true;

  /**
   * If true, then hover text will be prepended with four leading spaces such that a markdown
   * renderer will render the text verbatim.
   */
  public Boolean renderHoverVerbatim = false;
}
