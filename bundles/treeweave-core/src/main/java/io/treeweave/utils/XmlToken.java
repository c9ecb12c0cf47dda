/*
 * Copyright (c) 2024, TreeWeave Contributors
 *
 * All rights reserved.
 */
package io.treeweave.utils;

import static java.util.Objects.requireNonNull;

/**
 * Escaping of character data and attribute values for XML output.
 */
public final class XmlToken {

  /** Hidden constructor. */
  private XmlToken() {
    throw new AssertionError("May never be instantiated!");
  }

  /**
   * Checks if the specified character is a valid XML character.
   *
   * @param ch the letter to be checked
   * @return result of comparison
   */
  public static boolean valid(final int ch) {
    return ch >= 0x20 && ch <= 0xD7FF || ch == 0xA || ch == 0x9 || ch == 0xD || ch >= 0xE000 && ch <= 0xFFFD
        || ch >= 0x10000 && ch <= 0x10ffff;
  }

  /**
   * Escape characters not allowed in text content.
   *
   * @param value the string value
   * @return the escaped value
   */
  public static String escapeContent(final String value) {
    requireNonNull(value);
    final StringBuilder escape = new StringBuilder(value.length());
    value.codePoints().forEach(cp -> {
      switch (cp) {
        case '&' -> escape.append("&amp;");
        case '<' -> escape.append("&lt;");
        case '>' -> escape.append("&gt;");
        case '\r' -> escape.append("&#13;");
        default -> appendValid(escape, cp);
      }
    });
    return escape.toString();
  }

  /**
   * Escape characters not allowed in attribute values.
   *
   * @param value the string value
   * @return the escaped value
   */
  public static String escapeAttribute(final String value) {
    requireNonNull(value);
    final StringBuilder escape = new StringBuilder(value.length());
    value.codePoints().forEach(cp -> {
      switch (cp) {
        case '&' -> escape.append("&amp;");
        case '<' -> escape.append("&lt;");
        case '>' -> escape.append("&gt;");
        case '"' -> escape.append("&quot;");
        case '\n' -> escape.append("&#10;");
        case '\r' -> escape.append("&#13;");
        case '\t' -> escape.append("&#9;");
        default -> appendValid(escape, cp);
      }
    });
    return escape.toString();
  }

  // Characters XML 1.0 cannot represent are replaced.
  private static void appendValid(final StringBuilder builder, final int cp) {
    if (valid(cp)) {
      builder.appendCodePoint(cp);
    } else {
      builder.append('\uFFFD');
    }
  }
}
