package com.codeheadsystems.aegis.common;

import java.util.Arrays;

/**
 * Utility methods for slicing and inspecting envelope byte layouts.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Concatenates multiple byte arrays into a single array.
   *
   * @param arrays the arrays
   * @return the byte [ ]
   */
  public static byte[] concat(byte[]... arrays) {
    int totalLength = 0;
    for (byte[] arr : arrays) {
      totalLength += arr.length;
    }
    byte[] result = new byte[totalLength];
    int offset = 0;
    for (byte[] arr : arrays) {
      System.arraycopy(arr, 0, result, offset, arr.length);
      offset += arr.length;
    }
    return result;
  }

  /**
   * Returns a copy of {@code length} bytes starting at {@code offset}.
   *
   * @param source the source
   * @param offset the offset
   * @param length the length
   * @return the byte [ ]
   * @throws IllegalArgumentException if the range lies outside the source
   */
  public static byte[] slice(byte[] source, int offset, int length) {
    if (offset < 0 || length < 0 || offset + length > source.length) {
      throw new IllegalArgumentException("Slice out of range: offset=" + offset
          + " length=" + length + " size=" + source.length);
    }
    return Arrays.copyOfRange(source, offset, offset + length);
  }

  /**
   * True when every byte is zero. Runs over the whole array regardless of content.
   *
   * @param bytes the bytes
   * @return the boolean
   */
  public static boolean isAllZero(byte[] bytes) {
    int acc = 0;
    for (byte b : bytes) {
      acc |= b;
    }
    return acc == 0;
  }
}
