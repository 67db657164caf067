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

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import com.healthmarketscience.colstudio.Cell;
import com.healthmarketscience.colstudio.Column;
import com.healthmarketscience.colstudio.ColumnBuilder;
import com.healthmarketscience.colstudio.LogicalType;
import com.healthmarketscience.colstudio.NullabilityViolationException;
import com.healthmarketscience.colstudio.SchemaCatalog;
import com.healthmarketscience.colstudio.SchemaMismatchException;
import com.healthmarketscience.colstudio.TestUtil;
import com.healthmarketscience.colstudio.TimeUnit;
import com.healthmarketscience.colstudio.TypeCoercionException;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class ValueCoercerTest
{
  private static Column column(LogicalType type) {
    SchemaCatalog schema = TestUtil.createSchema(
        new ColumnBuilder("col", type));
    return schema.getColumn(0);
  }

  private static Object text(LogicalType type, String text)
    throws TypeCoercionException
  {
    return ValueCoercer.coerceText(column(type), 0, text);
  }

  private static TypeCoercionException textFails(LogicalType type,
                                                 String text) {
    return assertThrows(TypeCoercionException.class,
                        () -> ValueCoercer.coerceText(column(type), 4, text));
  }

  @Test
  public void testIntegers() throws Exception
  {
    assertEquals(12, text(LogicalType.int32(), "12"));
    assertEquals(-12, text(LogicalType.int32(), " -12 "));
    assertEquals(12, text(LogicalType.int32(), "+12"));
    assertEquals(Integer.MAX_VALUE, text(LogicalType.int32(), "2147483647"));
    assertEquals(Long.MIN_VALUE,
                 text(LogicalType.int64(), "-9223372036854775808"));

    TypeCoercionException e = textFails(LogicalType.int32(), "12.5");
    assertEquals("col", e.getColumnName());
    assertEquals(4, e.getRowIndex());
    assertEquals("12.5", e.getInput());
    assertEquals("Not an integer", e.getReason());
    assertEquals("Not an integer (Column=col;Row=4;Input='12.5')",
                 e.getMessage());

    assertTrue(textFails(LogicalType.int32(), "2147483648").getReason()
               .startsWith("Out of range"));
    assertTrue(textFails(LogicalType.int64(), "9223372036854775808")
               .getReason().startsWith("Out of range"));
    textFails(LogicalType.int32(), "");
    textFails(LogicalType.int32(), "abc");
    textFails(LogicalType.int32(), "1e3");
  }

  @Test
  public void testFloatingPoint() throws Exception
  {
    assertEquals(1.5d, text(LogicalType.float64(), "1.5"));
    assertEquals(-2.5E-7d, text(LogicalType.float64(), "-2.5e-7"));
    assertEquals(0.5d, text(LogicalType.float64(), ".5"));
    assertEquals(1.5f, text(LogicalType.float32(), "1.5"));
    assertEquals(Double.NaN, text(LogicalType.float64(), "NaN"));
    assertEquals(Float.NEGATIVE_INFINITY,
                 text(LogicalType.float32(), "-Infinity"));
    assertEquals(Double.POSITIVE_INFINITY,
                 text(LogicalType.float64(), "infinity"));

    textFails(LogicalType.float32(), "1e39");
    textFails(LogicalType.float64(), "1e309");
    assertTrue(textFails(LogicalType.float32(), "1e-50").getReason()
               .startsWith("Out of range"));
    textFails(LogicalType.float64(), "1e-400");
    textFails(LogicalType.float64(), "-2.5e-99999999999");
    assertEquals(0.0f, text(LogicalType.float32(), "0.000e-50"));
    assertEquals(0.0d, text(LogicalType.float64(), "0e99999999999"));
    assertEquals(1.0E-40f, text(LogicalType.float32(), "1e-40"));
    textFails(LogicalType.float64(), "0x1p3");
    textFails(LogicalType.float64(), "1.5f");
  }

  @Test
  public void testBooleans() throws Exception
  {
    LogicalType type = LogicalType.booleanType();
    assertEquals(Boolean.TRUE, text(type, "TRUE"));
    assertEquals(Boolean.TRUE, text(type, "yes"));
    assertEquals(Boolean.TRUE, text(type, "1"));
    assertEquals(Boolean.FALSE, text(type, " False "));
    assertEquals(Boolean.FALSE, text(type, "No"));
    assertEquals(Boolean.FALSE, text(type, "0"));
    textFails(type, "maybe");
    textFails(type, "2");
  }

  @Test
  public void testDecimals() throws Exception
  {
    LogicalType type = LogicalType.decimal(5, 2);
    assertEquals(new BigDecimal("12.50"), text(type, "12.5"));
    assertEquals(new BigDecimal("-0.01"), text(type, "-0.01"));
    assertEquals(new BigDecimal("120.00"), text(type, "1.2E2"));
    assertEquals(new BigDecimal("999.99"), text(type, "999.99"));

    assertTrue(textFails(type, "1.234").getReason()
               .startsWith("More than 2 fractional digits"));
    assertTrue(textFails(type, "1000").getReason()
               .startsWith("More than 5 digits"));
    textFails(type, "12,5");

    // huge exponents never get expanded
    TypeCoercionException e = textFails(type, "1e99999999999");
    assertEquals("1e99999999999", e.getInput());
    assertTrue(e.getReason().startsWith("Out of range"));
    assertTrue(textFails(type, "9e999999999").getReason()
               .startsWith("More than 5 digits"));
    assertTrue(textFails(type, "1e-999999999").getReason()
               .startsWith("More than 2 fractional digits"));
    assertEquals(new BigDecimal("0.00"), text(type, "0e999999999"));
    assertEquals(new BigDecimal("100.00"), text(type, "1.0000e2"));
  }

  @Test
  public void testTemporals() throws Exception
  {
    assertEquals(LocalDate.of(2024, 2, 29),
                 text(LogicalType.date(), "2024-02-29"));
    textFails(LogicalType.date(), "2023-02-29");
    textFails(LogicalType.date(), "29.02.2024");

    LogicalType micros = LogicalType.timestamp(TimeUnit.MICROSECOND);
    assertEquals(LocalDateTime.of(2024, 1, 15, 10, 30, 0, 123456000),
                 text(micros, "2024-01-15T10:30:00.123456"));
    assertEquals(LocalDateTime.of(2024, 1, 15, 10, 30),
                 text(micros, "2024-01-15T10:30"));
    assertTrue(textFails(micros, "2024-01-15T10:30:00.1234567").getReason()
               .contains("more precision"));
    textFails(micros, "2024-01-15T10:30:00Z");

    LogicalType zoned = LogicalType.timestamp(TimeUnit.SECOND, "UTC");
    assertEquals(Instant.parse("2024-01-15T09:30:00Z"),
                 text(zoned, "2024-01-15T10:30:00+01:00"));
    assertEquals(Instant.parse("2024-01-15T10:30:00Z"),
                 text(zoned, "2024-01-15T10:30:00Z"));
    textFails(zoned, "2024-01-15T10:30:00");
    textFails(zoned, "2024-01-15T10:30:00.5Z");
  }

  @Test
  public void testBinaryAndText() throws Exception
  {
    assertArrayEquals(new byte[]{(byte)0xCA, (byte)0xFE, 0x01},
                      (byte[])text(LogicalType.binary(), "CAfe 01"));
    assertArrayEquals(new byte[0], (byte[])text(LogicalType.binary(), ""));
    textFails(LogicalType.binary(), "CAF");
    textFails(LogicalType.binary(), "C AFE");
    textFails(LogicalType.binary(), "XY");

    // text is kept verbatim
    assertEquals("  spaced  ", text(LogicalType.utf8(), "  spaced  "));
  }

  @Test
  public void testTypedValues() throws Exception
  {
    Column int32 = column(LogicalType.int32());
    assertEquals(12, ValueCoercer.coerceValue(int32, 0, 12L));
    assertEquals(12, ValueCoercer.coerceValue(int32, 0, 12.0d));
    assertEquals(12, ValueCoercer.coerceValue(int32, 0, new BigDecimal("12.00")));
    assertEquals(12, ValueCoercer.coerceValue(int32, 0, "12"));
    assertNull(ValueCoercer.coerceValue(int32, 0, null));
    assertThrows(TypeCoercionException.class,
                 () -> ValueCoercer.coerceValue(int32, 0, 12.5d));
    assertThrows(TypeCoercionException.class,
                 () -> ValueCoercer.coerceValue(int32, 0, 1L << 40));
    assertThrows(TypeCoercionException.class,
                 () -> ValueCoercer.coerceValue(int32, 0, Double.NaN));
    assertThrows(TypeCoercionException.class,
                 () -> ValueCoercer.coerceValue(int32, 0, Boolean.TRUE));

    Column float32 = column(LogicalType.float32());
    assertEquals(0.5f, ValueCoercer.coerceValue(float32, 0, 0.5d));
    assertEquals(3.0f, ValueCoercer.coerceValue(float32, 0, 3));
    assertThrows(TypeCoercionException.class,
                 () -> ValueCoercer.coerceValue(float32, 0, 0.1d));

    Column float64 = column(LogicalType.float64());
    assertEquals(7.0d, ValueCoercer.coerceValue(float64, 0, 7L));
    assertThrows(TypeCoercionException.class,
                 () -> ValueCoercer.coerceValue(float64, 0,
                                                Long.MAX_VALUE - 1L));

    Column dec = column(LogicalType.decimal(6, 3));
    assertEquals(new BigDecimal("1.500"),
                 ValueCoercer.coerceValue(dec, 0, 1.5d));
    assertEquals(new BigDecimal("42.000"),
                 ValueCoercer.coerceValue(dec, 0, 42));

    Column bool = column(LogicalType.booleanType());
    assertEquals(Boolean.FALSE, ValueCoercer.coerceValue(bool, 0, false));
    assertThrows(TypeCoercionException.class,
                 () -> ValueCoercer.coerceValue(bool, 0, 1));

    Column zoned = column(LogicalType.timestamp(TimeUnit.MILLISECOND, "UTC"));
    assertEquals(Instant.parse("2024-01-01T00:00:00Z"),
                 ValueCoercer.coerceValue(
                     zoned, 0, OffsetDateTime.of(2024, 1, 1, 1, 0, 0, 0,
                                                 ZoneOffset.ofHours(1))));
    assertThrows(TypeCoercionException.class,
                 () -> ValueCoercer.coerceValue(
                     zoned, 0, LocalDateTime.of(2024, 1, 1, 0, 0)));
    assertThrows(TypeCoercionException.class,
                 () -> ValueCoercer.coerceValue(
                     zoned, 0, Instant.parse("2024-01-01T00:00:00.0001Z")));

    Column days = column(LogicalType.date());
    assertThrows(TypeCoercionException.class,
                 () -> ValueCoercer.coerceValue(days, 0, LocalDate.MAX));
  }

  @Test
  public void testResolve() throws Exception
  {
    SchemaCatalog schema = TestUtil.createSchema(
        new ColumnBuilder("req", LogicalType.int32()).setNullable(false),
        new ColumnBuilder("opt", LogicalType.int32()));
    Column req = schema.getColumn("req");
    Column opt = schema.getColumn("opt");

    assertNull(ValueCoercer.resolve(opt, 0, Cell.nullCell()));
    NullabilityViolationException e = assertThrows(
        NullabilityViolationException.class,
        () -> ValueCoercer.resolve(req, 3, Cell.nullCell()));
    assertEquals("req", e.getColumnName());
    assertEquals(3, e.getRowIndex());

    assertEquals(5, ValueCoercer.resolve(
                     req, 0, Cell.of(LogicalType.int32(), 5)));
    assertEquals(7, ValueCoercer.resolve(req, 0, Cell.rawEdit("7")));
    assertThrows(SchemaMismatchException.class,
                 () -> ValueCoercer.resolve(
                     req, 0, Cell.of(LogicalType.int64(), 5L)));
  }
}
