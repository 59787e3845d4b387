package com.flamingo.ai.scopetree.domain.model;

/**
 * A point in a source file.
 *
 * @param line 1-based line number
 * @param column 0-based column, counted in UTF-16 chars
 */
public record Position(int line, int column) implements Comparable<Position> {

  public static final Position START = new Position(1, 0);

  @Override
  public int compareTo(Position other) {
    if (line != other.line) {
      return Integer.compare(line, other.line);
    }
    return Integer.compare(column, other.column);
  }
}
