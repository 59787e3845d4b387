package com.flamingo.ai.scopetree.service.support;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.scopetree.domain.model.Position;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LineIndex Tests")
class LineIndexTest {

  private final LineIndex index = new LineIndex("ab\ncd\n\nef");

  @Test
  @DisplayName("should map offsets to one-based lines and zero-based columns")
  void shouldMapOffsetsToPositions() {
    assertThat(index.positionOf(0)).isEqualTo(new Position(1, 0));
    assertThat(index.positionOf(2)).isEqualTo(new Position(1, 2));
    assertThat(index.positionOf(3)).isEqualTo(new Position(2, 0));
    assertThat(index.positionOf(6)).isEqualTo(new Position(3, 0));
    assertThat(index.positionOf(8)).isEqualTo(new Position(4, 1));
  }

  @Test
  @DisplayName("should map positions back to the same offsets")
  void shouldMapPositionsToOffsets() {
    for (int offset = 0; offset <= 9; offset++) {
      assertThat(index.offsetOf(index.positionOf(offset))).isEqualTo(offset);
    }
  }

  @Test
  @DisplayName("should clamp offsets outside the text")
  void shouldClampOutOfRangeOffsets() {
    assertThat(index.positionOf(-5)).isEqualTo(new Position(1, 0));
    assertThat(index.positionOf(100)).isEqualTo(index.endPosition());
    assertThat(index.offsetOf(10, 0)).isEqualTo(9);
  }

  @Test
  @DisplayName("should report line count and line ends")
  void shouldReportLines() {
    assertThat(index.lineCount()).isEqualTo(4);
    assertThat(index.lineEndOffset(0)).isEqualTo(2);
    assertThat(index.lineEndOffset(3)).isEqualTo(9);
  }

  @Test
  @DisplayName("should handle empty text")
  void shouldHandleEmptyText() {
    LineIndex empty = new LineIndex("");

    assertThat(empty.lineCount()).isEqualTo(1);
    assertThat(empty.endPosition()).isEqualTo(Position.START);
  }
}
