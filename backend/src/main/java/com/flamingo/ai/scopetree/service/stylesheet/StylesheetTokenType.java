package com.flamingo.ai.scopetree.service.stylesheet;

/** Token kinds produced by {@link StylesheetTokenizer}. */
public enum StylesheetTokenType {
  COMMENT,
  STRING,
  NUMBER,
  IDENTIFIER,
  KEYWORD,
  /** SCSS {@code $name}. */
  VARIABLE,
  /** CSS custom property {@code --name}. */
  CUSTOM_PROPERTY,
  AT_KEYWORD,
  LBRACE,
  RBRACE,
  LPAREN,
  RPAREN,
  LBRACKET,
  RBRACKET,
  COLON,
  SEMICOLON,
  COMMA,
  DOT,
  HASH,
  AMPERSAND,
  PLUS,
  TILDE,
  GT,
  ASTERISK,
  EQUALS,
  EXCLAMATION,
  UNKNOWN;

  /** Symbol token for {@code c}, or {@code null} when {@code c} is not a symbol. */
  static StylesheetTokenType symbol(char c) {
    return switch (c) {
      case '{' -> LBRACE;
      case '}' -> RBRACE;
      case '(' -> LPAREN;
      case ')' -> RPAREN;
      case '[' -> LBRACKET;
      case ']' -> RBRACKET;
      case ':' -> COLON;
      case ';' -> SEMICOLON;
      case ',' -> COMMA;
      case '.' -> DOT;
      case '#' -> HASH;
      case '&' -> AMPERSAND;
      case '+' -> PLUS;
      case '~' -> TILDE;
      case '>' -> GT;
      case '*' -> ASTERISK;
      case '=' -> EQUALS;
      case '!' -> EXCLAMATION;
      default -> null;
    };
  }
}
