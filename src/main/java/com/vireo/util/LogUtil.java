package com.vireo.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/** Utility class for enhancing log messages with color coding. */
public final class LogUtil {

  private static final DateTimeFormatter TIME_FORMATTER =
      DateTimeFormatter.ofPattern("HH:mm:ss.SSS");

  private LogUtil() {}

  /**
   * Creates a formatted debug log message with appropriate colors
   *
   * @param message the log message
   * @return the formatted and colored log message
   */
  public static String debug(String message) {
    return formatLog("DEBUG", ConsoleColors.CYAN, message);
  }

  /**
   * Creates a formatted info log message with appropriate colors
   *
   * @param message the log message
   * @return the formatted and colored log message
   */
  public static String info(String message) {
    return formatLog("INFO", ConsoleColors.GREEN, message);
  }

  /**
   * Creates a formatted warning log message with appropriate colors
   *
   * @param message the log message
   * @return the formatted and colored log message
   */
  public static String warn(String message) {
    return formatLog("WARN", ConsoleColors.YELLOW, message);
  }

  /**
   * Creates a formatted error log message with appropriate colors
   *
   * @param message the log message
   * @return the formatted and colored log message
   */
  public static String error(String message) {
    return formatLog("ERROR", ConsoleColors.RED, message);
  }

  /**
   * Renders a request line such as {@code GET /users/42} in bold blue.
   *
   * @param method the HTTP method
   * @param path the request path
   * @return the colored request line
   */
  public static String requestLine(String method, String path) {
    return ConsoleColors.paint(ConsoleColors.BLUE_BOLD, method + " " + path);
  }

  private static String formatLog(String level, String color, String message) {
    String time = LocalDateTime.now().format(TIME_FORMATTER);

    // Format: [TIME] [LEVEL] message
    return new StringBuilder()
        .append(ConsoleColors.WHITE)
        .append('[')
        .append(time)
        .append(']')
        .append(ConsoleColors.RESET)
        .append(' ')
        .append(color)
        .append('[')
        .append(level)
        .append(']')
        .append(ConsoleColors.RESET)
        .append(' ')
        .append(message)
        .toString();
  }
}
