package com.flamingo.ai.scopetree.service.support;

/**
 * Maps byte offsets reported by a native parser back to Java char offsets.
 *
 * <p>Text reaches the native side through JNI as modified UTF-8: every UTF-16 char is encoded on
 * its own, so a surrogate pair takes six bytes and {@code U+0000} takes two. Pure-ASCII text maps
 * one to one and needs no table.
 */
public final class Utf8OffsetMapper {

  private final int byteLength;
  private final int[] charOffsetByByte;

  public Utf8OffsetMapper(String text) {
    int length = 0;
    boolean ascii = true;
    for (int i = 0; i < text.length(); i++) {
      int width = width(text.charAt(i));
      ascii &= width == 1;
      length += width;
    }
    this.byteLength = length;
    if (ascii) {
      this.charOffsetByByte = null;
      return;
    }
    int[] table = new int[length + 1];
    int byteOffset = 0;
    for (int charOffset = 0; charOffset < text.length(); charOffset++) {
      int width = width(text.charAt(charOffset));
      for (int i = 0; i < width; i++) {
        table[byteOffset + i] = charOffset;
      }
      byteOffset += width;
    }
    table[length] = text.length();
    this.charOffsetByByte = table;
  }

  /** Encoded width of one char in modified UTF-8. */
  static int width(char c) {
    if (c != 0 && c < 0x80) {
      return 1;
    }
    return c < 0x800 ? 2 : 3;
  }

  public int toCharOffset(int byteOffset) {
    int clamped = Math.max(0, Math.min(byteOffset, byteLength));
    return charOffsetByByte == null ? clamped : charOffsetByByte[clamped];
  }

  /** Length of the encoded text in bytes. */
  public int byteLength() {
    return byteLength;
  }
}
