/*
Copyright (c) 2005 Health Market Science, Inc.

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

    http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package com.healthmarketscience.colstudio.impl;

/**
 * Byte manipulation and display utilities.
 */
public final class ByteUtil
{
  private static final char[] HEX_CHARS = new char[] {
    '0', '1', '2', '3', '4', '5', '6', '7',
    '8', '9', 'A', 'B', 'C', 'D', 'E', 'F'};

  private static final int NUM_BYTES_PER_BLOCK = 4;
  private static final int NUM_BYTES_PER_LINE = 24;

  private ByteUtil() {}

  /**
   * Convert a byte array to a contiguous hexadecimal string, the canonical
   * text form of binary cell values.
   */
  public static String toHexString(byte[] array) {
    return toHexString(array, 0, array.length, false);
  }

  /**
   * Convert a byte array to a hexadecimal string for display
   * @param array byte array to display
   * @param offset Offset at which to start reading the array
   * @param size Number of bytes to read from the array
   * @return The display String
   */
  public static String toHexString(byte[] array, int offset, int size) {
    return toHexString(array, offset, size, true);
  }

  /**
   * Convert a byte array to a hexadecimal string
   * @param array byte array to display
   * @param offset Offset at which to start reading the array
   * @param size Number of bytes to read from the array
   * @param formatted flag indicating if formatting (blocks and lines) is
   *                  required
   * @return The display String
   */
  public static String toHexString(byte[] array, int offset, int size,
                                   boolean formatted) {

    StringBuilder rtn = new StringBuilder(size * 3);

    for (int i = 0; i < size; i++) {
      byte b = array[offset + i];
      rtn.append(HEX_CHARS[(b >>> 4) & 0x0F]);
      rtn.append(HEX_CHARS[b & 0x0F]);

      int next = (i + 1);
      if(formatted && (next < size))
      {
        if((next % NUM_BYTES_PER_LINE) == 0) {

          rtn.append("\n");

        } else {

          rtn.append(" ");

          if ((next % NUM_BYTES_PER_BLOCK) == 0) {
            rtn.append(" ");
          }
        }
      }
    }

    return rtn.toString();
  }

  /**
   * Parses a sequence of hexidecimal values, where every two characters
   * represent one byte value.  Whitespace between byte values is ignored.
   *
   * @throws IllegalArgumentException if the string is not valid hex
   */
  public static byte[] parseHexString(String hexStr)
  {
    StringBuilder digits = new StringBuilder(hexStr.length());
    for(int i = 0; i < hexStr.length(); ++i) {
      char c = hexStr.charAt(i);
      if(Character.isWhitespace(c)) {
        if((digits.length() % 2) != 0) {
          throw new IllegalArgumentException(
              "Whitespace within a hex byte value at position " + i);
        }
        continue;
      }
      if(Character.digit(c, 16) < 0) {
        throw new IllegalArgumentException(
            "Invalid hex character '" + c + "' at position " + i);
      }
      digits.append(c);
    }
    if((digits.length() % 2) != 0) {
      throw new IllegalArgumentException("Hex string length must be even");
    }
    byte[] bytes = new byte[digits.length() / 2];
    for(int i = 0; i < bytes.length; ++i) {
      bytes[i] = (byte)((Character.digit(digits.charAt(2 * i), 16) << 4) |
                        Character.digit(digits.charAt((2 * i) + 1), 16));
    }
    return bytes;
  }
}
