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
import java.util.Arrays;
import java.util.Collections;

import com.healthmarketscience.colstudio.Cell;
import com.healthmarketscience.colstudio.ColumnBuilder;
import com.healthmarketscience.colstudio.LogicalType;
import com.healthmarketscience.colstudio.Row;
import com.healthmarketscience.colstudio.SchemaCatalog;
import com.healthmarketscience.colstudio.TableSnapshot;
import com.healthmarketscience.colstudio.TestUtil;
import com.healthmarketscience.colstudio.TypeCoercionException;
import com.healthmarketscience.colstudio.UnknownColumnException;
import static org.junit.jupiter.api.Assertions.*;
import org.junit.jupiter.api.Test;

public class EditBufferImplTest
{
  private static SchemaCatalog createSchema() {
    return TestUtil.createSchema(
        new ColumnBuilder("key", LogicalType.utf8()),
        new ColumnBuilder("num", LogicalType.int32()),
        new ColumnBuilder("flag", LogicalType.booleanType()),
        new ColumnBuilder("amount", LogicalType.decimal(8, 2)));
  }

  private static EditBufferImpl createBuffer() {
    return TestUtil.createBuffer(
        createSchema(),
        new Object[]{"A", 1, true, new BigDecimal("1.00")},
        new Object[]{"B", 2, false, null},
        new Object[]{"C", 3, null, new BigDecimal("3.30")},
        new Object[]{"D", 4, true, new BigDecimal("-4.00")});
  }

  private static String keys(EditBufferImpl buffer) {
    StringBuilder sb = new StringBuilder();
    for(int i = 0; i < buffer.getRowCount(); ++i) {
      sb.append(buffer.getRow(i).getString("key"));
    }
    return sb.toString();
  }

  @Test
  public void testSetCell()
  {
    EditBufferImpl buffer = createBuffer();
    assertFalse(buffer.isModified());

    buffer.setCell(1, "num", "12.5");
    Cell cell = buffer.getRow(1).getCell("num");
    assertTrue(cell.isRawEdit());
    assertEquals("12.5", cell.getText());
    assertTrue(buffer.isModified());

    // text columns store values directly
    buffer.setCell(0, "key", "Z");
    assertEquals(Cell.of(LogicalType.utf8(), "Z"),
                 buffer.getRow(0).getCell("key"));

    buffer.setCell(2, "num", "");
    assertTrue(buffer.getRow(2).getCell("num").isNull());
    buffer.setCell(2, "key", null);
    assertTrue(buffer.getRow(2).getCell("key").isNull());

    // the schema never changes
    assertEquals(createSchema(), buffer.getSchema());
    assertEquals(LogicalType.int32(),
                 buffer.getSchema().getColumn("num").getType());

    assertThrows(IndexOutOfBoundsException.class,
                 () -> buffer.setCell(4, "num", "1"));
    assertThrows(IndexOutOfBoundsException.class,
                 () -> buffer.setCell(-1, "num", "1"));
    assertThrows(UnknownColumnException.class,
                 () -> buffer.setCell(0, "nope", "1"));
  }

  @Test
  public void testEmptyStringPolicy()
  {
    EditBufferImpl buffer = new EditBufferImpl(
        createSchema(), Collections.singletonList(
            TestUtil.createRow(createSchema(), 0, "A", 1, true, null)),
        false);
    buffer.setCell(0, "key", "");
    assertEquals(Cell.of(LogicalType.utf8(), ""),
                 buffer.getRow(0).getCell("key"));
    buffer.setCell(0, "num", "");
    assertEquals(Cell.rawEdit(""), buffer.getRow(0).getCell("num"));
  }

  @Test
  public void testSetValue() throws Exception
  {
    EditBufferImpl buffer = createBuffer();

    buffer.setValue(1, "flag", true);
    assertEquals(Boolean.TRUE, buffer.getRow(1).getBoolean("flag"));

    buffer.setValue(1, "amount", 2);
    assertEquals(new BigDecimal("2.00"),
                 buffer.getRow(1).getBigDecimal("amount"));

    buffer.setValue(1, "num", "42");
    assertEquals(Integer.valueOf(42), buffer.getRow(1).getInt("num"));

    Row before = buffer.getRow(1);
    TypeCoercionException e = assertThrows(
        TypeCoercionException.class,
        () -> buffer.setValue(1, "num", "4.2"));
    assertEquals(1, e.getRowIndex());
    assertEquals("num", e.getColumnName());
    assertEquals(before, buffer.getRow(1));

    buffer.setValue(1, "num", null);
    assertTrue(buffer.getRow(1).getCell("num").isNull());
  }

  @Test
  public void testDeleteRows()
  {
    EditBufferImpl buffer = createBuffer();

    assertEquals(2, buffer.deleteRows(Arrays.asList(1, 3)));
    assertEquals("AC", keys(buffer));
    assertTrue(buffer.isModified());

    // out of range indexes are ignored
    assertEquals(2, buffer.deleteRows(Arrays.asList(5, -1)));
    assertEquals(1, buffer.deleteRows(Arrays.asList(0, 0, 7)));
    assertEquals("C", keys(buffer));

    assertEquals(1, buffer.deleteRows(Collections.<Integer>emptyList()));
  }

  @Test
  public void testDeleteIdempotence()
  {
    EditBufferImpl buffer1 = createBuffer();
    buffer1.deleteRows(Arrays.asList(0, 2));

    EditBufferImpl buffer2 = createBuffer();
    buffer2.deleteRows(Arrays.asList(2, 0, 2));

    assertEquals(buffer1.snapshot().getRows(), buffer2.snapshot().getRows());
  }

  @Test
  public void testSelection()
  {
    EditBufferImpl buffer = createBuffer();

    buffer.select(1);
    buffer.select(3);
    assertEquals(Arrays.asList(1, 3),
                 Arrays.asList(buffer.getSelectedIndexes().toArray()));

    // selection follows the rows when earlier rows go away
    buffer.deleteRows(Collections.singletonList(0));
    assertEquals("BCD", keys(buffer));
    assertEquals(Arrays.asList(0, 2),
                 Arrays.asList(buffer.getSelectedIndexes().toArray()));
    assertTrue(buffer.isSelected(0));
    assertFalse(buffer.isSelected(1));

    // and survives edits
    buffer.setCell(2, "key", "DD");
    assertTrue(buffer.isSelected(2));

    // deleted rows leave the selection
    buffer.deleteRows(Collections.singletonList(0));
    assertEquals(Arrays.asList(1),
                 Arrays.asList(buffer.getSelectedIndexes().toArray()));

    buffer.deselect(1);
    assertTrue(buffer.getSelectedIndexes().isEmpty());

    buffer.select(0);
    buffer.select(1);
    assertEquals(0, buffer.deleteSelectedRows());
    assertTrue(buffer.getSelectedIndexes().isEmpty());

    assertThrows(IndexOutOfBoundsException.class, () -> buffer.select(0));
  }

  @Test
  public void testSnapshots()
  {
    EditBufferImpl buffer = createBuffer();
    TableSnapshot snapshot = buffer.snapshot();

    buffer.setCell(0, "key", "X");
    buffer.deleteRows(Collections.singletonList(3));

    assertEquals(4, snapshot.getRowCount());
    assertEquals("A", snapshot.getRow(0).getString("key"));
    assertThrows(UnsupportedOperationException.class,
                 () -> snapshot.getRows().clear());

    TableSnapshot current = buffer.snapshot();
    assertEquals(3, current.getRowCount());
    assertEquals("X", current.getRow(0).getString("key"));
    // rows keep their ids through edits
    assertEquals(snapshot.getRow(0).getId(), current.getRow(0).getId());
  }

  @Test
  public void testMarkSaved()
  {
    EditBufferImpl buffer = createBuffer();
    buffer.setCell(0, "key", "X");
    TableSnapshot saved = buffer.snapshot();
    buffer.setCell(0, "key", "Y");

    buffer.markSaved(saved);
    assertTrue(buffer.isModified());

    buffer.markSaved(buffer.snapshot());
    assertFalse(buffer.isModified());

    assertThrows(IllegalArgumentException.class,
                 () -> buffer.markSaved(createBuffer().snapshot()));
  }

  @Test
  public void testRawEditAccess()
  {
    EditBufferImpl buffer = createBuffer();
    buffer.setCell(0, "num", "oops");
    assertEquals("oops", buffer.getRow(0).getValue("num"));
    assertThrows(ClassCastException.class,
                 () -> buffer.getRow(0).getInt("num"));
  }
}
