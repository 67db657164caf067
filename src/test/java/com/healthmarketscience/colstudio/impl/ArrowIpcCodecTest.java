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

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.healthmarketscience.colstudio.ColumnBuilder;
import com.healthmarketscience.colstudio.ColumnarTable;
import com.healthmarketscience.colstudio.DecodeException;
import com.healthmarketscience.colstudio.EncodeException;
import com.healthmarketscience.colstudio.LogicalType;
import com.healthmarketscience.colstudio.SchemaCatalog;
import com.healthmarketscience.colstudio.TestUtil;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class ArrowIpcCodecTest
{
  @Test
  public void testRoundTrip() throws Exception
  {
    try(BufferAllocator allocator = new RootAllocator()) {
      for(ArrowIpcCodec.Format format : ArrowIpcCodec.Format.values()) {
        ArrowIpcCodec codec = new ArrowIpcCodec(format);
        assertSame(format, codec.getFormat());

        byte[] bytes = null;
        try(ColumnarTable table = TestUtil.createTable(
                allocator, TestUtil.createMixedSchema(),
                TestUtil.createMixedRows())) {
          bytes = codec.encode(table);
          assertFalse(table.isClosed());
        }
        assertSame(format, ArrowIpcCodec.detectFormat(bytes));

        try(ColumnarTable decoded = codec.decode(bytes, allocator)) {
          assertEquals(3L, decoded.getRowCount());
          assertEquals("test",
                       decoded.getSchema().getCustomMetadata().get("origin"));

          EditBufferImpl buffer = LoadPipeline.load(decoded, true);
          assertEquals(TestUtil.createMixedSchema(), buffer.getSchema());
          TestUtil.assertRows(TestUtil.createMixedRows(), buffer.snapshot());
        }
      }
    }
  }

  @Test
  public void testDecodeEitherFormat() throws Exception
  {
    try(BufferAllocator allocator = new RootAllocator()) {
      SchemaCatalog schema = TestUtil.createSchema(
          new ColumnBuilder("n", LogicalType.int64()));

      byte[] bytes = null;
      try(ColumnarTable table = TestUtil.createTable(
              allocator, schema, new Object[]{7L})) {
        bytes = new ArrowIpcCodec(ArrowIpcCodec.Format.STREAM).encode(table);
      }

      // a file format codec still reads streams
      try(ColumnarTable decoded = new ArrowIpcCodec().decode(
              bytes, allocator)) {
        assertEquals(7L, LoadPipeline.load(decoded, true).getRow(0)
                     .getLong("n").longValue());
      }
    }
  }

  @Test
  public void testMultipleBatches() throws Exception
  {
    try(BufferAllocator allocator = new RootAllocator()) {
      SchemaCatalog schema = TestUtil.createSchema(
          new ColumnBuilder("id", LogicalType.int32()),
          new ColumnBuilder("name", LogicalType.utf8()));

      ColumnarTable first = TestUtil.createTable(
          allocator, schema, new Object[]{1, "a"}, new Object[]{2, "b"});
      ColumnarTable second = TestUtil.createTable(
          allocator, schema, new Object[]{3, null});

      for(ArrowIpcCodec.Format format : ArrowIpcCodec.Format.values()) {
        byte[] bytes = null;
        try(ColumnarTable table = new ColumnarTable(
                schema.toArrowSchema(),
                Arrays.asList(first.getBatches().get(0),
                              second.getBatches().get(0)))) {
          bytes = new ArrowIpcCodec(format).encode(table);
        }

        try(ColumnarTable decoded = new ArrowIpcCodec().decode(
                bytes, allocator)) {
          assertEquals(2, decoded.getBatches().size());
          assertEquals(3L, decoded.getRowCount());
          TestUtil.assertRows(new Object[][] {
              {1, "a"},
              {2, "b"},
              {3, null},
            }, LoadPipeline.load(decoded, true).snapshot());
        }
      }
    }
  }

  @Test
  public void testInvalidData() throws Exception
  {
    try(BufferAllocator allocator = new RootAllocator()) {
      ArrowIpcCodec codec = new ArrowIpcCodec();

      assertThrows(DecodeException.class,
                   () -> codec.decode(new byte[0], allocator));
      assertThrows(DecodeException.class,
                   () -> codec.decode(null, allocator));
      assertThrows(DecodeException.class, () -> codec.decode(
          new byte[]{8, 0, 0, 0, 1, 2, 3}, allocator));
      assertThrows(DecodeException.class, () -> codec.decode(
          "ARROW1\0\0garbage".getBytes(StandardCharsets.US_ASCII),
          allocator));

      byte[] bytes = null;
      try(ColumnarTable table = TestUtil.createTable(
              allocator, TestUtil.createMixedSchema(),
              TestUtil.createMixedRows())) {
        bytes = codec.encode(table);
      }
      byte[] truncated = Arrays.copyOf(bytes, bytes.length / 2);
      assertThrows(DecodeException.class,
                   () -> codec.decode(truncated, allocator));

      ColumnarTable closed = TestUtil.createTable(
          allocator, TestUtil.createMixedSchema(),
          TestUtil.createMixedRows());
      closed.close();
      assertThrows(EncodeException.class, () -> codec.encode(closed));

      assertEquals(0L, allocator.getAllocatedMemory());
    }
  }

  @Test
  public void testDetectFormat()
  {
    assertSame(ArrowIpcCodec.Format.FILE, ArrowIpcCodec.detectFormat(
                   "ARROW1xx".getBytes(StandardCharsets.US_ASCII)));
    assertSame(ArrowIpcCodec.Format.STREAM, ArrowIpcCodec.detectFormat(
                   "ARROW".getBytes(StandardCharsets.US_ASCII)));
    assertSame(ArrowIpcCodec.Format.STREAM,
               ArrowIpcCodec.detectFormat(new byte[]{-1, -1, -1, -1}));
  }
}
