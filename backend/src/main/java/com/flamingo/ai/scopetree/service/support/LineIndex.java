package com.flamingo.ai.scopetree.service.support;

import com.flamingo.ai.scopetree.domain.model.Position;
import java.util.Arrays;

/** Converts between char offsets and line/column positions of one text. */
public final class LineIndex {

  private final int[] lineStarts;
  private final int length;

  public LineIndex(String text) {
    int[] starts = new int[16];
    int count = 1;
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n') {
        if (count == starts.length) {
          starts = Arrays.copyOf(starts, count * 2);
        }
        starts[count++] = i + 1;
      }
    }
    this.lineStarts = Arrays.copyOf(starts, count);
    this.length = text.length();
  }

  /** Position of {@code offset}; offsets past the end clamp to the end of the text. */
  public Position positionOf(int offset) {
    int clamped = Math.max(0, Math.min(offset, length));
    int lineIndex = Arrays.binarySearch(lineStarts, clamped);
    if (lineIndex < 0) {
      lineIndex = -lineIndex - 2;
    }
    return new Position(lineIndex + 1, clamped - lineStarts[lineIndex]);
  }

  /** Char offset of {@code position}. */
  public int offsetOf(Position position) {
    return offsetOf(position.line() - 1, position.column());
  }

  /** Char offset of a 0-based line index and column. */
  public int offsetOf(int lineIndex, int column) {
    if (lineIndex >= lineStarts.length) {
      return length;
    }
    return Math.min(lineStarts[Math.max(0, lineIndex)] + column, length);
  }

  /** Offset just past the last char of a 0-based line, excluding its line terminator. */
  public int lineEndOffset(int lineIndex) {
    if (lineIndex + 1 >= lineStarts.length) {
      return length;
    }
    return lineStarts[lineIndex + 1] - 1;
  }

  public Position endPosition() {
    return positionOf(length);
  }

  public int lineCount() {
    return lineStarts.length;
  }
}
