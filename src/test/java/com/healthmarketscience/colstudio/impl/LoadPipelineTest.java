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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;

import com.healthmarketscience.colstudio.ColumnarTable;
import com.healthmarketscience.colstudio.DecodeException;
import com.healthmarketscience.colstudio.LogicalType;
import com.healthmarketscience.colstudio.SchemaCatalog;
import com.healthmarketscience.colstudio.SchemaMismatchException;
import com.healthmarketscience.colstudio.TestUtil;
import com.healthmarketscience.colstudio.TimeUnit;
import com.healthmarketscience.colstudio.UnsupportedTypeException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.arrow.vector.util.Text;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class LoadPipelineTest
{
  private static final Schema INT_TEXT_SCHEMA = new Schema(Arrays.asList(
      Field.notNullable("n", new ArrowType.Int(32, true)),
      Field.nullable("s", ArrowType.Utf8.INSTANCE)));

  private static VectorSchemaRoot createBatch(BufferAllocator allocator,
                                              int first, int count) {
    VectorSchemaRoot root = VectorSchemaRoot.create(INT_TEXT_SCHEMA,
                                                    allocator);
    IntVector n = (IntVector)root.getVector("n");
    VarCharVector s = (VarCharVector)root.getVector("s");
    n.allocateNew(count);
    s.allocateNew(count);
    for(int i = 0; i < count; ++i) {
      n.set(i, first + i);
      if(((first + i) % 2) == 0) {
        s.setSafe(i, new Text("v" + (first + i)));
      } else {
        s.setNull(i);
      }
    }
    n.setValueCount(count);
    s.setValueCount(count);
    root.setRowCount(count);
    return root;
  }

  @Test
  public void testLoadMixed() throws Exception
  {
    try(BufferAllocator allocator = new RootAllocator();
        ColumnarTable table = TestUtil.createTable(
            allocator, TestUtil.createMixedSchema(),
            TestUtil.createMixedRows())) {

      EditBufferImpl buffer = LoadPipeline.load(table, true);

      assertEquals(TestUtil.createMixedSchema(), buffer.getSchema());
      TestUtil.assertRows(TestUtil.createMixedRows(), buffer.snapshot());
      assertFalse(buffer.isModified());
      assertTrue(buffer.isEmptyStringAsNull());
    }
  }

  @Test
  public void testLoadBatches() throws Exception
  {
    try(BufferAllocator allocator = new RootAllocator()) {
      try(ColumnarTable table = new ColumnarTable(
              INT_TEXT_SCHEMA, Arrays.asList(createBatch(allocator, 0, 3),
                                             createBatch(allocator, 3, 0),
                                             createBatch(allocator, 3, 2)))) {

        EditBufferImpl buffer = LoadPipeline.load(table, false);
        SchemaCatalog schema = buffer.getSchema();

        assertEquals(2, schema.size());
        assertFalse(schema.getColumn("n").isNullable());
        assertEquals(5, buffer.getRowCount());
        for(int i = 0; i < 5; ++i) {
          assertEquals(Integer.valueOf(i), buffer.getRow(i).getInt("n"));
          assertEquals(((i % 2) == 0) ? "v" + i : null,
                       buffer.getRow(i).getString("s"));
          assertEquals(new RowIdImpl(i), buffer.getRow(i).getId());
        }
      }
    }
  }

  @Test
  public void testInvalidTables() throws Exception
  {
    assertThrows(DecodeException.class, () -> LoadPipeline.load(null, true));

    try(BufferAllocator allocator = new RootAllocator()) {
      ColumnarTable table = new ColumnarTable(createBatch(allocator, 0, 1));
      table.close();
      assertThrows(DecodeException.class, () -> LoadPipeline.load(table, true));
    }
  }

  private static ColumnarTable createDateMillisTable(BufferAllocator allocator,
                                                     long... values) {
    Schema schema = new Schema(Collections.singletonList(
        Field.nullable("d", new ArrowType.Date(DateUnit.MILLISECOND))));
    VectorSchemaRoot root = VectorSchemaRoot.create(schema, allocator);
    DateMilliVector v = (DateMilliVector)root.getVector(0);
    v.allocateNew(values.length);
    for(int i = 0; i < values.length; ++i) {
      v.set(i, values[i]);
    }
    root.setRowCount(values.length);
    return new ColumnarTable(root);
  }

  @Test
  public void testDateMillis() throws Exception
  {
    try(BufferAllocator allocator = new RootAllocator()) {
      try(ColumnarTable table = createDateMillisTable(
              allocator, -86_400_000L, 0L)) {
        EditBufferImpl buffer = LoadPipeline.load(table, true);
        assertEquals(LogicalType.date(TimeUnit.MILLISECOND),
                     buffer.getSchema().getColumn("d").getType());
        assertEquals(LocalDate.of(1969, 12, 31),
                     buffer.getRow(0).getLocalDate("d"));
        assertEquals(LocalDate.of(1970, 1, 1),
                     buffer.getRow(1).getLocalDate("d"));
      }

      // a date64 value must be a whole day
      try(ColumnarTable table = createDateMillisTable(
              allocator, 0L, 86_400_000L + 5L)) {
        DecodeException e = assertThrows(DecodeException.class,
                                         () -> LoadPipeline.load(table, true));
        assertTrue(e.getMessage().contains("Column=d;Row=1"));
      }
    }
  }

  @Test
  public void testMismatchedBatch() throws Exception
  {
    try(BufferAllocator allocator = new RootAllocator()) {
      VectorSchemaRoot batch = createBatch(allocator, 0, 2);
      Schema wider = new Schema(Arrays.asList(
          Field.notNullable("n", new ArrowType.Int(32, true)),
          Field.nullable("s", ArrowType.Utf8.INSTANCE),
          Field.nullable("x", ArrowType.Utf8.INSTANCE)));
      try(ColumnarTable table = new ColumnarTable(
              wider, Collections.singletonList(batch))) {
        assertThrows(SchemaMismatchException.class,
                     () -> LoadPipeline.load(table, true));
      }

      VectorSchemaRoot batch2 = createBatch(allocator, 0, 2);
      Schema swapped = new Schema(Arrays.asList(
          Field.nullable("s", ArrowType.Utf8.INSTANCE),
          Field.notNullable("n", new ArrowType.Int(32, true))));
      try(ColumnarTable table = new ColumnarTable(
              swapped, Collections.singletonList(batch2))) {
        assertThrows(SchemaMismatchException.class,
                     () -> LoadPipeline.load(table, true));
      }
    }
  }

  private static VectorSchemaRoot createTimestampBatch(
      BufferAllocator allocator, ArrowType.Timestamp type, long value)
  {
    VectorSchemaRoot root = VectorSchemaRoot.create(
        new Schema(Collections.singletonList(Field.nullable("ts", type))),
        allocator);
    TimeStampVector v = (TimeStampVector)root.getVector(0);
    v.allocateNew(1);
    v.setSafe(0, value);
    v.setValueCount(1);
    root.setRowCount(1);
    return root;
  }

  @Test
  public void testTimestampUnits() throws Exception
  {
    ArrowType.Timestamp millis = new ArrowType.Timestamp(
        org.apache.arrow.vector.types.TimeUnit.MILLISECOND, null);
    ArrowType.Timestamp micros = new ArrowType.Timestamp(
        org.apache.arrow.vector.types.TimeUnit.MICROSECOND, null);
    ArrowType.Timestamp utcMillis = new ArrowType.Timestamp(
        org.apache.arrow.vector.types.TimeUnit.MILLISECOND, "UTC");
    Schema millisSchema = new Schema(Collections.singletonList(
        Field.nullable("ts", millis)));

    try(BufferAllocator allocator = new RootAllocator()) {
      try(ColumnarTable table = new ColumnarTable(
              millisSchema, Collections.singletonList(
                  createTimestampBatch(allocator, millis, 1000L)))) {
        assertEquals(LocalDateTime.of(1970, 1, 1, 0, 0, 1),
                     LoadPipeline.load(table, true).getRow(0)
                     .getLocalDateTime("ts"));
      }

      // microseconds under a millisecond field
      try(ColumnarTable table = new ColumnarTable(
              millisSchema, Collections.singletonList(
                  createTimestampBatch(allocator, micros, 1000L)))) {
        assertThrows(SchemaMismatchException.class,
                     () -> LoadPipeline.load(table, true));
      }

      // zoned values under a local field
      try(ColumnarTable table = new ColumnarTable(
              millisSchema, Collections.singletonList(
                  createTimestampBatch(allocator, utcMillis, 1000L)))) {
        assertThrows(SchemaMismatchException.class,
                     () -> LoadPipeline.load(table, true));
      }
      assertEquals(0L, allocator.getAllocatedMemory());
    }
  }

  @Test
  public void testUnsupportedType() throws Exception
  {
    Schema schema = new Schema(Collections.singletonList(
        Field.nullable("tiny", new ArrowType.Int(8, true))));

    try(BufferAllocator allocator = new RootAllocator()) {
      VectorSchemaRoot root = VectorSchemaRoot.create(schema, allocator);
      TinyIntVector v = (TinyIntVector)root.getVector(0);
      v.allocateNew(1);
      v.set(0, 1);
      v.setValueCount(1);
      root.setRowCount(1);

      try(ColumnarTable table = new ColumnarTable(root)) {
        UnsupportedTypeException e = assertThrows(
            UnsupportedTypeException.class,
            () -> LoadPipeline.load(table, true));
        assertEquals("tiny", e.getFieldName());
      }
    }
  }
}
