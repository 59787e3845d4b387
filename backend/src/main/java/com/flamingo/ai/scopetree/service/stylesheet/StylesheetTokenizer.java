package com.flamingo.ai.scopetree.service.stylesheet;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Hand-written lexer for CSS and SCSS.
 *
 * <p>Whitespace is dropped. Every branch of {@link #tokenize()} consumes at least one char, so the
 * lexer terminates on any input; unrecognized chars become single-char {@link
 * StylesheetTokenType#UNKNOWN} tokens.
 */
public final class StylesheetTokenizer {

  private static final Set<String> KEYWORDS =
      Set.of(
          "important", "inherit", "initial", "unset", "auto", "none", "normal", "bold", "italic",
          "solid", "dotted", "dashed", "absolute", "relative", "fixed", "static", "block",
          "inline", "flex", "grid", "center", "left", "right", "top", "bottom", "hidden",
          "visible", "transparent", "true", "false", "null", "and", "or", "not", "if", "else",
          "for", "while", "each", "in", "from", "through", "to");

  private final String text;
  private final boolean lineComments;
  private final List<StylesheetToken> tokens = new ArrayList<>();
  private int position;
  private int line = 1;
  private int column;

  /**
   * @param text stylesheet source
   * @param lineComments whether {@code //} starts a comment, as in SCSS
   */
  public StylesheetTokenizer(String text, boolean lineComments) {
    this.text = text;
    this.lineComments = lineComments;
  }

  public List<StylesheetToken> tokenize() {
    while (position < text.length()) {
      char c = text.charAt(position);
      char next = peek(1);
      if (Character.isWhitespace(c)) {
        advance(1);
      } else if (c == '/' && next == '*') {
        blockComment();
      } else if (c == '/' && next == '/' && lineComments) {
        lineComment();
      } else if (c == '"' || c == '\'') {
        string(c);
      } else if (isDigit(c)) {
        emitWhile(StylesheetTokenType.NUMBER, 1, StylesheetTokenizer::isNumberPart);
      } else if (c == '$') {
        emitWhile(StylesheetTokenType.VARIABLE, 1, StylesheetTokenizer::isNamePart);
      } else if (c == '-' && next == '-') {
        emitWhile(StylesheetTokenType.CUSTOM_PROPERTY, 2, StylesheetTokenizer::isNamePart);
      } else if (isIdentifierStart(c) || (c == '-' && isIdentifierStart(next))) {
        identifier();
      } else if (c == '@') {
        emitWhile(StylesheetTokenType.AT_KEYWORD, 1, StylesheetTokenizer::isNamePart);
      } else {
        StylesheetTokenType symbol = StylesheetTokenType.symbol(c);
        int width = Character.isHighSurrogate(c) && Character.isLowSurrogate(next) ? 2 : 1;
        emit(symbol != null ? symbol : StylesheetTokenType.UNKNOWN, position, width);
      }
    }
    return tokens;
  }

  private void blockComment() {
    int close = text.indexOf("*/", position + 2);
    int length = close < 0 ? text.length() - position : close + 2 - position;
    emit(StylesheetTokenType.COMMENT, position, length);
  }

  private void lineComment() {
    int newline = text.indexOf('\n', position);
    int length = newline < 0 ? text.length() - position : newline - position;
    emit(StylesheetTokenType.COMMENT, position, length);
  }

  private void string(char quote) {
    int i = position + 1;
    while (i < text.length() && text.charAt(i) != quote) {
      i += text.charAt(i) == '\\' ? 2 : 1;
    }
    int end = Math.min(i + 1, text.length());
    emit(StylesheetTokenType.STRING, position, end - position);
  }

  private void identifier() {
    int i = position + 1;
    while (i < text.length() && isIdentifierPart(text.charAt(i))) {
      i++;
    }
    String value = text.substring(position, i);
    emit(
        KEYWORDS.contains(value) ? StylesheetTokenType.KEYWORD : StylesheetTokenType.IDENTIFIER,
        position,
        i - position);
  }

  private interface CharTest {
    boolean test(char c);
  }

  /** Emits a token of {@code prefix} chars followed by every char passing {@code part}. */
  private void emitWhile(StylesheetTokenType type, int prefix, CharTest part) {
    int i = Math.min(position + prefix, text.length());
    while (i < text.length() && part.test(text.charAt(i))) {
      i++;
    }
    emit(type, position, i - position);
  }

  private void emit(StylesheetTokenType type, int start, int length) {
    int end = start + length;
    tokens.add(new StylesheetToken(type, text.substring(start, end), start, end, line, column));
    advance(length);
  }

  private void advance(int count) {
    int end = Math.min(position + count, text.length());
    for (; position < end; position++) {
      if (text.charAt(position) == '\n') {
        line++;
        column = 0;
      } else {
        column++;
      }
    }
  }

  private char peek(int ahead) {
    int index = position + ahead;
    return index < text.length() ? text.charAt(index) : '\0';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static boolean isAsciiLetter(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
  }

  private static boolean isIdentifierStart(char c) {
    return isAsciiLetter(c) || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return isAsciiLetter(c) || isDigit(c) || c == '_' || c == '-' || c == '$';
  }

  private static boolean isNamePart(char c) {
    return isAsciiLetter(c) || isDigit(c) || c == '_' || c == '-';
  }

  private static boolean isNumberPart(char c) {
    return isDigit(c) || isAsciiLetter(c) || c == '.' || c == '%';
  }
}
