/*
Copyright (c) 2026 Health Market Science, Inc.

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

import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class ByteUtilTest
{
  @Test
  public void testToHexString()
  {
    byte[] bytes = new byte[]{(byte)0xCA, (byte)0xFE, 0x00, 0x7F, 0x10};
    assertEquals("CAFE007F10", ByteUtil.toHexString(bytes));
    assertEquals("CA FE 00 7F  10", ByteUtil.toHexString(bytes, 0, 5));
    assertEquals("FE 00", ByteUtil.toHexString(bytes, 1, 2));
    assertEquals("", ByteUtil.toHexString(new byte[0]));
  }

  @Test
  public void testParseHexString()
  {
    assertArrayEquals(new byte[]{(byte)0xCA, (byte)0xFE, 0x01},
                      ByteUtil.parseHexString("cafe01"));
    assertArrayEquals(new byte[]{(byte)0xCA, (byte)0xFE, 0x01},
                      ByteUtil.parseHexString(" CA FE\n01 "));
    assertArrayEquals(new byte[0], ByteUtil.parseHexString(""));

    assertThrows(IllegalArgumentException.class,
                 () -> ByteUtil.parseHexString("CAF"));
    assertThrows(IllegalArgumentException.class,
                 () -> ByteUtil.parseHexString("C AFE"));
    assertThrows(IllegalArgumentException.class,
                 () -> ByteUtil.parseHexString("CG"));
  }
}
