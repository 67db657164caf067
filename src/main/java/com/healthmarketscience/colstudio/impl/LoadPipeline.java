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
import java.util.ArrayList;
import java.util.List;

import com.healthmarketscience.colstudio.Cell;
import com.healthmarketscience.colstudio.Column;
import com.healthmarketscience.colstudio.ColumnarTable;
import com.healthmarketscience.colstudio.DecodeException;
import com.healthmarketscience.colstudio.LogicalType;
import com.healthmarketscience.colstudio.SchemaCatalog;
import com.healthmarketscience.colstudio.SchemaMismatchException;
import com.healthmarketscience.colstudio.TimeUnit;
import com.healthmarketscience.colstudio.UnsupportedTypeException;
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
 * Converts a decoded {@link ColumnarTable} into a new generation: the
 * {@link SchemaCatalog} of the table plus one typed {@link RowImpl} per
 * record, in batch and record order.
 */
public class LoadPipeline
{
  private static final Log LOG = LogFactory.getLog(LoadPipeline.class);

  /** reads the (non-null) value at an index of one vector */
  @FunctionalInterface
  private interface ValueReader
  {
    public Object read(int index);
  }

  private LoadPipeline() {}

  /**
   * Loads the given table into a new edit buffer.  The table is not closed.
   *
   * @throws DecodeException if the table is missing or closed, or holds a
   *         value which cannot be represented by its column type
   * @throws UnsupportedTypeException if a field has an unsupported type
   * @throws SchemaMismatchException if a batch does not match the table
   *         schema
   */
  public static EditBufferImpl load(ColumnarTable table,
                                    boolean emptyStringAsNull)
    throws DecodeException, UnsupportedTypeException
  {
    if(table == null) {
      throw new DecodeException("No table to load");
    }
    if(table.isClosed()) {
      throw new DecodeException("Table has already been closed");
    }

    SchemaCatalog schema = SchemaCatalog.fromSourceTable(table);
    long rowCount = table.getRowCount();
    if(rowCount > Integer.MAX_VALUE) {
      throw new DecodeException("Too many rows to edit: " + rowCount);
    }

    List<RowImpl> rows = new ArrayList<RowImpl>((int)rowCount);
    int numCols = schema.size();
    int batchNum = 0;
    for(VectorSchemaRoot batch : table.getBatches()) {
      List<FieldVector> vectors = batch.getFieldVectors();
      if(vectors.size() != numCols) {
        throw new SchemaMismatchException(
            "Batch " + batchNum + " has " + vectors.size() +
            " vectors, schema has " + numCols + " columns");
      }

      int batchRows = batch.getRowCount();
      ValueReader[] readers = new ValueReader[numCols];
      for(int c = 0; c < numCols; ++c) {
        FieldVector vector = vectors.get(c);
        if(vector.getValueCount() < batchRows) {
          throw new SchemaMismatchException(
              "Vector of column '" + schema.getColumn(c).getName() +
              "' has " + vector.getValueCount() + " values, batch " +
              batchNum + " has " + batchRows + " rows");
        }
        readers[c] = newReader(schema.getColumn(c), vector);
      }

      for(int r = 0; r < batchRows; ++r) {
        int rowIndex = rows.size();
        Cell[] cells = new Cell[numCols];
        for(int c = 0; c < numCols; ++c) {
          cells[c] = readCell(schema.getColumn(c), vectors.get(c), readers[c],
                              r, rowIndex);
        }
        rows.add(new RowImpl(schema, new RowIdImpl(rowIndex), cells));
      }
      ++batchNum;
    }

    if(LOG.isDebugEnabled()) {
      LOG.debug("Loaded " + rows.size() + " rows of " + numCols +
                " columns from " + batchNum + " batches");
    }

    return new EditBufferImpl(schema, rows, emptyStringAsNull);
  }

  private static Cell readCell(Column col, FieldVector vector,
                               ValueReader reader, int index, int rowIndex)
    throws DecodeException
  {
    if(vector.isNull(index)) {
      return Cell.nullCell();
    }
    try {
      return Cell.of(col.getType(), reader.read(index));
    } catch(ArithmeticException | IllegalArgumentException e) {
      throw new DecodeException(
          "Invalid " + col.getType() + " value (Column=" + col.getName() +
          ";Row=" + rowIndex + ")", e);
    }
  }

  private static ValueReader newReader(Column col, FieldVector vector) {
    LogicalType type = col.getType();
    switch(type.getType()) {
    case BOOLEAN:
      if(vector instanceof BitVector) {
        BitVector v = (BitVector)vector;
        return i -> (v.get(i) != 0);
      }
      break;
    case INT32:
      if(vector instanceof IntVector) {
        IntVector v = (IntVector)vector;
        return i -> v.get(i);
      }
      break;
    case INT64:
      if(vector instanceof BigIntVector) {
        BigIntVector v = (BigIntVector)vector;
        return i -> v.get(i);
      }
      break;
    case FLOAT32:
      if(vector instanceof Float4Vector) {
        Float4Vector v = (Float4Vector)vector;
        return i -> v.get(i);
      }
      break;
    case FLOAT64:
      if(vector instanceof Float8Vector) {
        Float8Vector v = (Float8Vector)vector;
        return i -> v.get(i);
      }
      break;
    case UTF8:
      if(vector instanceof VarCharVector) {
        VarCharVector v = (VarCharVector)vector;
        return i -> new String(v.get(i), StandardCharsets.UTF_8);
      }
      break;
    case BINARY:
      if(vector instanceof VarBinaryVector) {
        VarBinaryVector v = (VarBinaryVector)vector;
        return i -> v.get(i);
      }
      break;
    case DATE:
      if((vector instanceof DateDayVector) &&
         (type.getUnit() == TimeUnit.DAY)) {
        DateDayVector v = (DateDayVector)vector;
        return i -> Temporals.fromEpochAmount(type, v.get(i));
      }
      if((vector instanceof DateMilliVector) &&
         (type.getUnit() == TimeUnit.MILLISECOND)) {
        DateMilliVector v = (DateMilliVector)vector;
        return i -> Temporals.fromEpochAmount(type, v.get(i));
      }
      break;
    case TIMESTAMP:
      // the unit and zone of the vector must be those of the column
      if((vector instanceof TimeStampVector) &&
         ArrowSchemas.toArrowType(type).equals(
             vector.getField().getType())) {
        TimeStampVector v = (TimeStampVector)vector;
        return i -> Temporals.fromEpochAmount(type, v.get(i));
      }
      break;
    case DECIMAL:
      if((vector instanceof DecimalVector) &&
         (((DecimalVector)vector).getScale() == type.getScale())) {
        DecimalVector v = (DecimalVector)vector;
        return i -> v.getObject(i);
      }
      if((vector instanceof Decimal256Vector) &&
         (((Decimal256Vector)vector).getScale() == type.getScale())) {
        Decimal256Vector v = (Decimal256Vector)vector;
        return i -> v.getObject(i);
      }
      break;
    default:
      throw new IllegalStateException("Unknown data type " + type.getType());
    }

    throw new SchemaMismatchException(
        "Vector " + vector.getClass().getSimpleName() + " of column '" +
        col.getName() + "' does not hold " + type + " values");
  }
}
