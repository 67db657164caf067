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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.healthmarketscience.colstudio.Column;
import com.healthmarketscience.colstudio.ColumnBuilder;
import com.healthmarketscience.colstudio.LogicalType;
import com.healthmarketscience.colstudio.SchemaCatalog;
import com.healthmarketscience.colstudio.SchemaCatalogBuilder;
import com.healthmarketscience.colstudio.TimeUnit;
import com.healthmarketscience.colstudio.UnsupportedTypeException;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Utilities for converting between Arrow schemas and {@link SchemaCatalog}s.
 * The mapping is exact in both directions for every supported type, so a
 * catalog read from a schema converts back to an equal schema.
 */
public final class ArrowSchemas
{
  private ArrowSchemas() {}

  /**
   * Reads the column descriptors of the given Arrow schema.
   *
   * @throws UnsupportedTypeException if a field has no LogicalType
   *         counterpart or field names are not unique
   */
  public static SchemaCatalog toSchemaCatalog(Schema schema)
    throws UnsupportedTypeException
  {
    SchemaCatalogBuilder builder = new SchemaCatalogBuilder()
      .putMetadata(schema.getCustomMetadata());
    Set<String> names = new HashSet<String>();
    for(Field field : schema.getFields()) {
      if(!names.add(field.getName())) {
        throw new UnsupportedTypeException(
            field.getName(), "Duplicate field name");
      }
      builder.addColumn(new ColumnBuilder(field.getName(), toLogicalType(field))
                        .setNullable(field.isNullable())
                        .putMetadata(field.getMetadata()));
    }
    return builder.toSchema();
  }

  /**
   * @return the LogicalType of the given Arrow field
   * @throws UnsupportedTypeException if the field has no LogicalType
   *         counterpart
   */
  public static LogicalType toLogicalType(Field field)
    throws UnsupportedTypeException
  {
    if(field.getDictionary() != null) {
      throw new UnsupportedTypeException(
          field.getName(), "Dictionary encoded fields are not supported");
    }
    if(!field.getChildren().isEmpty()) {
      throw new UnsupportedTypeException(
          field.getName(), "Nested fields are not supported");
    }

    ArrowType type = field.getType();
    switch(type.getTypeID()) {
    case Bool:
      return LogicalType.booleanType();
    case Int:
      ArrowType.Int intType = (ArrowType.Int)type;
      if(intType.getIsSigned()) {
        if(intType.getBitWidth() == 32) {
          return LogicalType.int32();
        }
        if(intType.getBitWidth() == 64) {
          return LogicalType.int64();
        }
      }
      break;
    case FloatingPoint:
      FloatingPointPrecision precision =
        ((ArrowType.FloatingPoint)type).getPrecision();
      if(precision == FloatingPointPrecision.SINGLE) {
        return LogicalType.float32();
      }
      if(precision == FloatingPointPrecision.DOUBLE) {
        return LogicalType.float64();
      }
      break;
    case Utf8:
      return LogicalType.utf8();
    case Binary:
      return LogicalType.binary();
    case Date:
      return LogicalType.date(
          (((ArrowType.Date)type).getUnit() == DateUnit.DAY) ?
          TimeUnit.DAY : TimeUnit.MILLISECOND);
    case Timestamp:
      ArrowType.Timestamp tsType = (ArrowType.Timestamp)type;
      return LogicalType.timestamp(toTimeUnit(tsType.getUnit()),
                                   tsType.getTimezone());
    case Decimal:
      ArrowType.Decimal decType = (ArrowType.Decimal)type;
      try {
        return LogicalType.decimal(decType.getPrecision(), decType.getScale(),
                                   decType.getBitWidth());
      } catch(IllegalArgumentException e) {
        throw new UnsupportedTypeException(field.getName(), e.getMessage());
      }
    default:
      // fall through to failure
    }

    throw new UnsupportedTypeException(
        field.getName(), "Unsupported field type " + type);
  }

  /**
   * @return the Arrow schema described by the given catalog
   */
  public static Schema toArrowSchema(SchemaCatalog schema) {
    List<Field> fields = new ArrayList<Field>(schema.size());
    for(Column col : schema.getColumns()) {
      fields.add(toField(col));
    }
    return new Schema(fields, nullIfEmpty(schema.getMetadata()));
  }

  public static Field toField(Column col) {
    return new Field(col.getName(),
                     new FieldType(col.isNullable(), toArrowType(col.getType()),
                                   null, nullIfEmpty(col.getMetadata())),
                     null);
  }

  public static ArrowType toArrowType(LogicalType type) {
    switch(type.getType()) {
    case BOOLEAN:
      return ArrowType.Bool.INSTANCE;
    case INT32:
      return new ArrowType.Int(32, true);
    case INT64:
      return new ArrowType.Int(64, true);
    case FLOAT32:
      return new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
    case FLOAT64:
      return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
    case UTF8:
      return ArrowType.Utf8.INSTANCE;
    case BINARY:
      return ArrowType.Binary.INSTANCE;
    case DATE:
      return new ArrowType.Date((type.getUnit() == TimeUnit.DAY) ?
                                DateUnit.DAY : DateUnit.MILLISECOND);
    case TIMESTAMP:
      return new ArrowType.Timestamp(toArrowTimeUnit(type.getUnit()),
                                     type.getTimeZone());
    case DECIMAL:
      return new ArrowType.Decimal(type.getPrecision(), type.getScale(),
                                   type.getBitWidth());
    default:
      throw new IllegalStateException("Unknown data type " + type.getType());
    }
  }

  private static TimeUnit toTimeUnit(
      org.apache.arrow.vector.types.TimeUnit unit)
  {
    switch(unit) {
    case SECOND:
      return TimeUnit.SECOND;
    case MILLISECOND:
      return TimeUnit.MILLISECOND;
    case MICROSECOND:
      return TimeUnit.MICROSECOND;
    case NANOSECOND:
      return TimeUnit.NANOSECOND;
    default:
      throw new IllegalStateException("Unknown time unit " + unit);
    }
  }

  private static org.apache.arrow.vector.types.TimeUnit toArrowTimeUnit(
      TimeUnit unit)
  {
    switch(unit) {
    case SECOND:
      return org.apache.arrow.vector.types.TimeUnit.SECOND;
    case MILLISECOND:
      return org.apache.arrow.vector.types.TimeUnit.MILLISECOND;
    case MICROSECOND:
      return org.apache.arrow.vector.types.TimeUnit.MICROSECOND;
    case NANOSECOND:
      return org.apache.arrow.vector.types.TimeUnit.NANOSECOND;
    default:
      throw new IllegalStateException("Invalid timestamp unit " + unit);
    }
  }

  private static Map<String,String> nullIfEmpty(Map<String,String> metadata) {
    return (metadata.isEmpty() ? null : metadata);
  }
}
