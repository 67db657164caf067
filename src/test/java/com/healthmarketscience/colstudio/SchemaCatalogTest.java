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

import java.util.Arrays;
import java.util.Collections;

import com.healthmarketscience.colstudio.impl.ArrowSchemas;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class SchemaCatalogTest
{
  @Test
  public void testLookup()
  {
    SchemaCatalog schema = TestUtil.createMixedSchema();

    assertEquals(11, schema.size());
    assertEquals(2, schema.columnIndex("price"));
    assertEquals("price", schema.getColumn(2).getName());
    assertEquals(LogicalType.decimal(10, 2),
                 schema.getColumn("price").getType());
    assertFalse(schema.getColumn("id").isNullable());
    assertTrue(schema.getColumn("name").isNullable());
    assertEquals("Name", schema.getColumn("name").getMetadata().get("label"));
    assertEquals("test", schema.getMetadata().get("origin"));
    assertEquals(Arrays.asList("id", "name", "price", "active", "born",
                               "created", "updated", "ratio", "score",
                               "total", "data"),
                 schema.getColumnNames());
    assertTrue(schema.hasColumn("data"));
    assertFalse(schema.hasColumn("Data"));

    UnknownColumnException e = assertThrows(UnknownColumnException.class,
                                            () -> schema.columnIndex("nope"));
    assertEquals("nope", e.getColumnName());
  }

  @Test
  public void testImmutable()
  {
    SchemaCatalog schema = TestUtil.createMixedSchema();
    assertThrows(UnsupportedOperationException.class,
                 () -> schema.getColumns().remove(0));
    assertThrows(UnsupportedOperationException.class,
                 () -> schema.getMetadata().put("a", "b"));
    assertThrows(UnsupportedOperationException.class,
                 () -> schema.getColumn(1).getMetadata().clear());
  }

  @Test
  public void testDuplicateNames()
  {
    assertThrows(IllegalArgumentException.class,
                 () -> TestUtil.createSchema(
                     new ColumnBuilder("a", LogicalType.int32()),
                     new ColumnBuilder("a", LogicalType.utf8())));

    Schema arrowSchema = new Schema(Arrays.asList(
        Field.nullable("a", new ArrowType.Int(32, true)),
        Field.nullable("a", ArrowType.Utf8.INSTANCE)));
    UnsupportedTypeException e = assertThrows(
        UnsupportedTypeException.class,
        () -> ArrowSchemas.toSchemaCatalog(arrowSchema));
    assertEquals("a", e.getFieldName());
  }

  @Test
  public void testArrowRoundTrip() throws Exception
  {
    SchemaCatalog schema = TestUtil.createMixedSchema();
    Schema arrowSchema = schema.toArrowSchema();

    assertEquals(schema.size(), arrowSchema.getFields().size());
    assertEquals("test", arrowSchema.getCustomMetadata().get("origin"));
    assertFalse(arrowSchema.findField("id").isNullable());
    assertEquals(new ArrowType.Decimal(10, 2, 128),
                 arrowSchema.findField("price").getType());
    assertEquals(new ArrowType.Timestamp(
                     org.apache.arrow.vector.types.TimeUnit.MILLISECOND, "UTC"),
                 arrowSchema.findField("updated").getType());

    assertEquals(schema, ArrowSchemas.toSchemaCatalog(arrowSchema));
  }

  @Test
  public void testUnsupportedTypes()
  {
    assertUnsupported(Field.nullable("u8", new ArrowType.Int(8, true)));
    assertUnsupported(Field.nullable("u32", new ArrowType.Int(32, false)));
    assertUnsupported(Field.nullable(
        "half", new ArrowType.FloatingPoint(FloatingPointPrecision.HALF)));
    assertUnsupported(Field.nullable("big", ArrowType.LargeUtf8.INSTANCE));
    assertUnsupported(Field.nullable(
        "time", new ArrowType.Time(
            org.apache.arrow.vector.types.TimeUnit.MILLISECOND, 32)));
    assertUnsupported(new Field(
        "list", FieldType.nullable(ArrowType.List.INSTANCE),
        Collections.singletonList(
            Field.nullable("item", new ArrowType.Int(32, true)))));
  }

  private static void assertUnsupported(Field field)
  {
    Schema arrowSchema = new Schema(Collections.singletonList(field));
    UnsupportedTypeException e = assertThrows(
        UnsupportedTypeException.class,
        () -> ArrowSchemas.toSchemaCatalog(arrowSchema));
    assertEquals(field.getName(), e.getFieldName());
  }
}
