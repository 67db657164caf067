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

package com.healthmarketscience.colstudio;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * A decoded columnar table: an Arrow schema plus zero or more record batches
 * sharing that schema.  The table owns the memory of its batches, it must be
 * closed after use.
 */
public final class ColumnarTable implements AutoCloseable
{
  private final Schema _schema;
  private final List<VectorSchemaRoot> _batches;
  private boolean _closed;

  public ColumnarTable(Schema schema, List<VectorSchemaRoot> batches) {
    _schema = schema;
    _batches = Collections.unmodifiableList(
        new ArrayList<VectorSchemaRoot>(batches));
  }

  /**
   * Creates a table with the given single batch.
   */
  public ColumnarTable(VectorSchemaRoot batch) {
    this(batch.getSchema(), Collections.singletonList(batch));
  }

  public Schema getSchema() {
    return _schema;
  }

  /**
   * @return the record batches of this table, in order
   */
  public List<VectorSchemaRoot> getBatches() {
    return _batches;
  }

  /**
   * @return the total number of records in all batches
   */
  public long getRowCount() {
    long count = 0L;
    for(VectorSchemaRoot batch : _batches) {
      count += batch.getRowCount();
    }
    return count;
  }

  public boolean isClosed() {
    return _closed;
  }

  /**
   * Releases the memory of all batches.  Closing an already closed table has
   * no effect.
   */
  @Override
  public void close() {
    if(_closed) {
      return;
    }
    _closed = true;
    RuntimeException failure = null;
    for(VectorSchemaRoot batch : _batches) {
      try {
        batch.close();
      } catch(RuntimeException e) {
        if(failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e);
        }
      }
    }
    if(failure != null) {
      throw failure;
    }
  }
}
