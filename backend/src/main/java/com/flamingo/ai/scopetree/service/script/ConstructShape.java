package com.flamingo.ai.scopetree.service.script;

/**
 * Syntactic facts about a declaration or call that drive its category.
 *
 * @param kind what kind of construct it is
 * @param name declared or bound name, {@code null} when anonymous
 * @param returnsJsx whether the body syntactically returns a JSX element
 */
public record ConstructShape(Kind kind, String name, boolean returnsJsx) {

  /** Declaration kinds the classifier distinguishes. */
  public enum Kind {
    FUNCTION,
    ARROW_FUNCTION,
    CLASS,
    CALL
  }

  public static ConstructShape call(String calleeName) {
    return new ConstructShape(Kind.CALL, calleeName, false);
  }
}
