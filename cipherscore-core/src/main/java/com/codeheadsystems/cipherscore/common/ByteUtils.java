package com.codeheadsystems.cipherscore.common;

import java.math.BigInteger;

/**
 * Utility methods for fixed-width octet string encoding of non-negative integers.
 */
public class ByteUtils {

  private ByteUtils() {
  }

  /**
   * Integer to Octet String Primitive (I2OSP) from RFC 8017.
   * Converts a non-negative integer to a big-endian octet string of exactly {@code length} bytes.
   *
   * @param value  the value
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] I2OSP(BigInteger value, int length) {
    if (value.signum() < 0 || value.bitLength() > 8 * length) {
      throw new IllegalArgumentException("Value too large for specified length");
    }
    byte[] raw = value.toByteArray();
    byte[] result = new byte[length];
    // toByteArray() may carry a leading sign byte, which bitLength() already accounted for.
    int copy = Math.min(raw.length, length);
    System.arraycopy(raw, raw.length - copy, result, length - copy, copy);
    return result;
  }

  /**
   * Octet String to Integer Primitive (OS2IP) from RFC 8017.
   *
   * @param bytes big-endian octets
   * @return the non-negative integer they encode
   */
  public static BigInteger OS2IP(byte[] bytes) {
    return new BigInteger(1, bytes);
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
   * Returns {@code length} bytes of {@code source} starting at {@code offset}.
   *
   * @param source the source
   * @param offset the offset
   * @param length the length
   * @return the byte [ ]
   */
  public static byte[] slice(byte[] source, int offset, int length) {
    if (offset < 0 || length < 0 || offset + length > source.length) {
      throw new IllegalArgumentException("Slice out of bounds: offset=" + offset + " length=" + length
          + " size=" + source.length);
    }
    byte[] out = new byte[length];
    System.arraycopy(source, offset, out, 0, length);
    return out;
  }
}
