package com.flamingo.ai.scopetree.service.stylesheet;

/**
 * One lexical token of a stylesheet.
 *
 * @param start char offset of the first char
 * @param end char offset just past the last char
 * @param line 1-based line of {@code start}
 * @param column 0-based column of {@code start}
 */
public record StylesheetToken(
    StylesheetTokenType type, String value, int start, int end, int line, int column) {

  public boolean is(StylesheetTokenType expected) {
    return type == expected;
  }
}
