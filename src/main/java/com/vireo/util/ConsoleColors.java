package com.vireo.util;

/** ANSI color codes used by the start-up banner and colored log messages. */
public final class ConsoleColors {
  public static final String RESET = "\033[0m";

  public static final String RED = "\033[0;31m";
  public static final String GREEN = "\033[0;32m";
  public static final String YELLOW = "\033[0;33m";
  public static final String BLUE = "\033[0;34m";
  public static final String PURPLE = "\033[0;35m";
  public static final String CYAN = "\033[0;36m";
  public static final String WHITE = "\033[0;37m";

  public static final String GREEN_BOLD = "\033[1;32m";
  public static final String YELLOW_BOLD = "\033[1;33m";
  public static final String BLUE_BOLD = "\033[1;34m";
  public static final String CYAN_BOLD = "\033[1;36m";
  public static final String WHITE_BOLD = "\033[1;37m";

  private ConsoleColors() {}

  /**
   * Wraps text in a color and a trailing reset.
   *
   * @param color one of the color constants
   * @param text the text to color
   * @return the colored text
   */
  public static String paint(String color, Object text) {
    return color + text + RESET;
  }
}
