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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import com.healthmarketscience.colstudio.Column;
import com.healthmarketscience.colstudio.ColumnarTable;
import com.healthmarketscience.colstudio.EncodeException;
import com.healthmarketscience.colstudio.InvalidValueException;
import com.healthmarketscience.colstudio.LogicalType;
import com.healthmarketscience.colstudio.SchemaCatalog;
import com.healthmarketscience.colstudio.TableSnapshot;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseVariableWidthVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.Decimal256Vector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Builds a new single batch {@link ColumnarTable} from a snapshot of an edit
 * buffer.  Every column is coerced and assembled independently (optionally
 * on an executor), the resulting vectors are always assembled in catalog
 * order and their types always come from the catalog.
 * <p>
 * A commit is all-or-nothing: the first invalid cell (lowest column, then
 * lowest row) aborts the commit and every vector built so far is released.
 */
public class CommitPipeline
{
  private static final Log LOG = LogFactory.getLog(CommitPipeline.class);

  /** rows between interruption checks */
  private static final int INTERRUPT_CHECK_ROWS = 1024;

  /** writes one non-null value to a vector */
  @FunctionalInterface
  private interface ValueWriter
  {
    public void write(int index, Object value);
  }

  private final BufferAllocator _allocator;
  private final ExecutorService _executor;

  /**
   * @param allocator allocator for the vectors of committed tables
   * @param executor optional executor for coercing columns concurrently, if
   *                 {@code null} all columns are coerced on the calling
   *                 thread
   */
  public CommitPipeline(BufferAllocator allocator, ExecutorService executor) {
    _allocator = allocator;
    _executor = executor;
  }

  /**
   * Coerces every cell of the given snapshot to its column type and
   * assembles the result.  The caller owns (and must close) the returned
   * table.
   *
   * @throws InvalidValueException if a cell cannot be stored in its column
   * @throws InterruptedIOException if the calling thread is interrupted
   */
  public ColumnarTable commit(TableSnapshot snapshot) throws IOException {
    SchemaCatalog schema = snapshot.getSchema();
    CommitState state = new CommitState(schema.size());

    boolean success = false;
    try {
      if(_executor == null) {
        for(Column col : schema.getColumns()) {
          state.register(col.getColumnIndex(),
                         buildVector(col, snapshot, state));
        }
      } else {
        commitConcurrently(schema, snapshot, state);
      }

      VectorSchemaRoot root = new VectorSchemaRoot(
          schema.toArrowSchema(), state.getVectors(), snapshot.getRowCount());
      // the root owns the vectors now
      state.release();
      success = true;

      if(LOG.isDebugEnabled()) {
        LOG.debug("Committed " + snapshot.getRowCount() + " rows of " +
                  schema.size() + " columns");
      }
      return new ColumnarTable(root);

    } finally {
      if(!success) {
        state.abort();
      }
    }
  }

  private void commitConcurrently(SchemaCatalog schema,
                                  final TableSnapshot snapshot,
                                  final CommitState state)
    throws IOException
  {
    List<Future<Void>> futures = new ArrayList<Future<Void>>(schema.size());
    try {
      for(final Column col : schema.getColumns()) {
        futures.add(_executor.submit(new Callable<Void>() {
          @Override
          public Void call() throws Exception {
            FieldVector vector = buildVector(col, snapshot, state);
            if(!state.register(col.getColumnIndex(), vector)) {
              vector.close();
            }
            return null;
          }
        }));
      }

      // wait in catalog order so the reported failure is the one of the
      // lowest failing column
      for(Future<Void> future : futures) {
        future.get();
      }

    } catch(InterruptedException e) {
      Thread.currentThread().interrupt();
      throw (InterruptedIOException)new InterruptedIOException(
          "Commit interrupted").initCause(e);
    } catch(ExecutionException e) {
      Throwable cause = e.getCause();
      if(cause instanceof IOException) {
        throw (IOException)cause;
      }
      if(cause instanceof RuntimeException) {
        throw (RuntimeException)cause;
      }
      if(cause instanceof Error) {
        throw (Error)cause;
      }
      throw new EncodeException("Failed building committed table", cause);
    } finally {
      for(Future<Void> future : futures) {
        future.cancel(true);
      }
    }
  }

  private FieldVector buildVector(Column col, TableSnapshot snapshot,
                                  CommitState state)
    throws IOException
  {
    int rowCount = snapshot.getRowCount();
    int colIdx = col.getColumnIndex();

    // coerce everything before allocating any memory
    Object[] values = new Object[rowCount];
    for(int r = 0; r < rowCount; ++r) {
      if((r % INTERRUPT_CHECK_ROWS) == 0) {
        checkInterrupted(state);
      }
      values[r] = ValueCoercer.resolve(
          col, r, snapshot.getRow(r).getCell(colIdx));
    }
    checkInterrupted(state);

    FieldVector vector = ArrowSchemas.toField(col).createVector(_allocator);
    boolean success = false;
    try {
      vector.allocateNew();
      ValueWriter writer = newWriter(col.getType(), vector);
      for(int r = 0; r < rowCount; ++r) {
        Object value = values[r];
        if(value == null) {
          setNull(vector, r);
        } else {
          writer.write(r, value);
        }
      }
      vector.setValueCount(rowCount);
      success = true;
      return vector;
    } finally {
      if(!success) {
        vector.close();
      }
    }
  }

  private static void checkInterrupted(CommitState state)
    throws InterruptedIOException
  {
    if(Thread.currentThread().isInterrupted() || state.isAborted()) {
      throw new InterruptedIOException("Commit interrupted");
    }
  }

  private static void setNull(FieldVector vector, int index) {
    if(vector instanceof BaseFixedWidthVector) {
      ((BaseFixedWidthVector)vector).setNull(index);
    } else {
      ((BaseVariableWidthVector)vector).setNull(index);
    }
  }

  private static ValueWriter newWriter(final LogicalType type,
                                       FieldVector vector) {
    switch(type.getType()) {
    case BOOLEAN:
      BitVector bitVec = (BitVector)vector;
      return (i, v) -> bitVec.setSafe(i, ((Boolean)v) ? 1 : 0);
    case INT32:
      IntVector intVec = (IntVector)vector;
      return (i, v) -> intVec.setSafe(i, (Integer)v);
    case INT64:
      BigIntVector bigIntVec = (BigIntVector)vector;
      return (i, v) -> bigIntVec.setSafe(i, (Long)v);
    case FLOAT32:
      Float4Vector float4Vec = (Float4Vector)vector;
      return (i, v) -> float4Vec.setSafe(i, (Float)v);
    case FLOAT64:
      Float8Vector float8Vec = (Float8Vector)vector;
      return (i, v) -> float8Vec.setSafe(i, (Double)v);
    case UTF8:
      VarCharVector varCharVec = (VarCharVector)vector;
      return (i, v) -> varCharVec.setSafe(
          i, ((String)v).getBytes(StandardCharsets.UTF_8));
    case BINARY:
      VarBinaryVector varBinVec = (VarBinaryVector)vector;
      return (i, v) -> varBinVec.setSafe(i, (byte[])v);
    case DATE:
      if(vector instanceof DateDayVector) {
        DateDayVector dayVec = (DateDayVector)vector;
        return (i, v) -> dayVec.setSafe(
            i, (int)Temporals.toEpochAmount(type, v));
      }
      DateMilliVector milliVec = (DateMilliVector)vector;
      return (i, v) -> milliVec.setSafe(i, Temporals.toEpochAmount(type, v));
    case TIMESTAMP:
      TimeStampVector tsVec = (TimeStampVector)vector;
      return (i, v) -> tsVec.setSafe(i, Temporals.toEpochAmount(type, v));
    case DECIMAL:
      if(vector instanceof DecimalVector) {
        DecimalVector decVec = (DecimalVector)vector;
        return (i, v) -> decVec.setSafe(i, (BigDecimal)v);
      }
      Decimal256Vector dec256Vec = (Decimal256Vector)vector;
      return (i, v) -> dec256Vec.setSafe(i, (BigDecimal)v);
    default:
      throw new IllegalStateException("Unknown data type " + type.getType());
    }
  }

  /**
   * Vectors built by one commit.  Once aborted, all registered vectors are
   * released and later registrations are refused.
   */
  private static final class CommitState
  {
    private final FieldVector[] _vectors;
    private boolean _aborted;

    private CommitState(int numCols) {
      _vectors = new FieldVector[numCols];
    }

    private synchronized boolean isAborted() {
      return _aborted;
    }

    /**
     * @return {@code false} if the commit was aborted, in which case the
     *         caller still owns the vector
     */
    private synchronized boolean register(int colIdx, FieldVector vector) {
      if(_aborted) {
        return false;
      }
      _vectors[colIdx] = vector;
      return true;
    }

    /**
     * @return all vectors, in catalog order
     */
    private synchronized List<FieldVector> getVectors() {
      List<FieldVector> vectors = new ArrayList<FieldVector>(_vectors.length);
      for(int i = 0; i < _vectors.length; ++i) {
        if(_vectors[i] == null) {
          throw new IllegalStateException("Column " + i + " was not built");
        }
        vectors.add(_vectors[i]);
      }
      return vectors;
    }

    /**
     * Forgets all vectors without releasing them.
     */
    private synchronized void release() {
      _aborted = true;
      Arrays.fill(_vectors, null);
    }

    private synchronized void abort() {
      _aborted = true;
      for(int i = 0; i < _vectors.length; ++i) {
        if(_vectors[i] != null) {
          _vectors[i].close();
          _vectors[i] = null;
        }
      }
    }
  }
}
