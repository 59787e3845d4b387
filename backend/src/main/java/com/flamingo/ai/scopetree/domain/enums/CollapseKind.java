package com.flamingo.ai.scopetree.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Marks how the flattening pass folded a low-information node. */
public enum CollapseKind {
  /** Plain block holding only declarations and at most one return. */
  BLOCK("block"),

  /** Short arrow function, typically a callback argument. */
  ARROW_FUNCTION("arrowFunction");

  private final String value;

  CollapseKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
