package com.flamingo.ai.scopetree.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Span of a node in its source file; {@code start <= end}.
 *
 * @param start first position covered
 * @param end position just past the last covered char
 */
public record SourceRange(Position start, Position end) {

  public SourceRange {
    if (start.compareTo(end) > 0) {
      throw new IllegalArgumentException("Range start " + start + " is after end " + end);
    }
  }

  @JsonIgnore
  public boolean isSingleLine() {
    return start.line() == end.line();
  }
}
