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

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.healthmarketscience.colstudio.ColumnarCodec;
import com.healthmarketscience.colstudio.ColumnarTable;
import com.healthmarketscience.colstudio.DecodeException;
import com.healthmarketscience.colstudio.EncodeException;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorLoader;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.VectorUnloader;
import org.apache.arrow.vector.ipc.ArrowFileReader;
import org.apache.arrow.vector.ipc.ArrowFileWriter;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.apache.arrow.vector.ipc.ArrowWriter;
import org.apache.arrow.vector.ipc.message.ArrowRecordBatch;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.arrow.vector.util.ByteArrayReadableSeekableByteChannel;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Codec for the Arrow IPC formats.  Decoding accepts both the file
 * (random access) and the stream format, encoding writes the configured
 * one.
 */
public class ArrowIpcCodec implements ColumnarCodec
{
  private static final Log LOG = LogFactory.getLog(ArrowIpcCodec.class);

  /** leading magic of the IPC file format */
  private static final byte[] FILE_MAGIC =
    "ARROW1".getBytes(StandardCharsets.US_ASCII);

  /** the Arrow IPC formats */
  public enum Format {
    /** the random access file format (".arrow" files) */
    FILE,
    /** the streaming format (".arrows" files) */
    STREAM;
  }

  private final Format _format;

  public ArrowIpcCodec() {
    this(Format.FILE);
  }

  public ArrowIpcCodec(Format format) {
    _format = format;
  }

  public Format getFormat() {
    return _format;
  }

  /**
   * @return the format of the given encoded table, determined by its leading
   *         magic
   */
  public static Format detectFormat(byte[] bytes) {
    if(bytes.length < FILE_MAGIC.length) {
      return Format.STREAM;
    }
    for(int i = 0; i < FILE_MAGIC.length; ++i) {
      if(bytes[i] != FILE_MAGIC[i]) {
        return Format.STREAM;
      }
    }
    return Format.FILE;
  }

  @Override
  public ColumnarTable decode(byte[] bytes, BufferAllocator allocator)
    throws DecodeException
  {
    if((bytes == null) || (bytes.length == 0)) {
      throw new DecodeException("No Arrow IPC data");
    }

    Format format = detectFormat(bytes);
    List<VectorSchemaRoot> batches = new ArrayList<VectorSchemaRoot>();
    boolean success = false;
    try(ArrowReader reader = newReader(format, bytes, allocator)) {

      VectorSchemaRoot readRoot = reader.getVectorSchemaRoot();
      Schema schema = readRoot.getSchema();
      while(reader.loadNextBatch()) {
        // the reader reuses its root, so every batch is copied out
        VectorSchemaRoot batch = VectorSchemaRoot.create(schema, allocator);
        batches.add(batch);
        try(ArrowRecordBatch recordBatch =
            new VectorUnloader(readRoot).getRecordBatch()) {
          new VectorLoader(batch).load(recordBatch);
        }
      }

      if(LOG.isDebugEnabled()) {
        LOG.debug("Decoded " + batches.size() + " batches in " + format +
                  " format");
      }
      success = true;
      return new ColumnarTable(schema, batches);

    } catch(IOException | RuntimeException e) {
      throw new DecodeException("Invalid Arrow IPC " + format + " data", e);
    } finally {
      if(!success) {
        for(VectorSchemaRoot batch : batches) {
          batch.close();
        }
      }
    }
  }

  private static ArrowReader newReader(Format format, byte[] bytes,
                                       BufferAllocator allocator) {
    if(format == Format.FILE) {
      return new ArrowFileReader(
          new ByteArrayReadableSeekableByteChannel(bytes), allocator);
    }
    return new ArrowStreamReader(new ByteArrayInputStream(bytes), allocator);
  }

  @Override
  public byte[] encode(ColumnarTable table) throws EncodeException {
    if(table.isClosed()) {
      throw new EncodeException("Table has already been closed");
    }

    List<VectorSchemaRoot> batches = table.getBatches();
    try {
      if(batches.size() == 1) {
        return write(batches.get(0), batches);
      }

      // all batches are written through one root which must share the
      // allocator tree of the batches
      BufferAllocator allocator = findAllocator(batches);
      BufferAllocator tmpAllocator = null;
      if(allocator == null) {
        allocator = tmpAllocator = new RootAllocator();
      }
      try(VectorSchemaRoot writeRoot =
          VectorSchemaRoot.create(table.getSchema(), allocator)) {
        return write(writeRoot, batches);
      } finally {
        if(tmpAllocator != null) {
          tmpAllocator.close();
        }
      }

    } catch(IOException | RuntimeException e) {
      throw new EncodeException("Failed writing Arrow IPC " + _format +
                                " data", e);
    }
  }

  private byte[] write(VectorSchemaRoot writeRoot,
                       List<VectorSchemaRoot> batches)
    throws IOException
  {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try(ArrowWriter writer = newWriter(writeRoot, out)) {
      writer.start();
      for(VectorSchemaRoot batch : batches) {
        if(batch != writeRoot) {
          try(ArrowRecordBatch recordBatch =
              new VectorUnloader(batch).getRecordBatch()) {
            new VectorLoader(writeRoot).load(recordBatch);
          }
        }
        writer.writeBatch();
      }
      writer.end();
    }

    if(LOG.isDebugEnabled()) {
      LOG.debug("Encoded " + batches.size() + " batches in " + _format +
                " format, " + out.size() + " bytes");
    }
    return out.toByteArray();
  }

  private ArrowWriter newWriter(VectorSchemaRoot root,
                                ByteArrayOutputStream out) {
    if(_format == Format.FILE) {
      return new ArrowFileWriter(root, null, Channels.newChannel(out));
    }
    return new ArrowStreamWriter(root, null, Channels.newChannel(out));
  }

  private static BufferAllocator findAllocator(List<VectorSchemaRoot> batches)
  {
    for(VectorSchemaRoot batch : batches) {
      for(FieldVector vector : batch.getFieldVectors()) {
        return vector.getAllocator();
      }
    }
    return null;
  }
}
