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

package com.healthmarketscience.colstudio.util;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import com.healthmarketscience.colstudio.Column;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

/**
 * Writes a single sheet Excel workbook.  Numbers and booleans become numeric
 * and boolean cells, dates and timestamps date formatted cells (zoned
 * timestamps in UTC), everything else text cells in canonical form.
 * <p>
 * Values Excel cannot hold exactly are written as text instead (e.g. dates
 * before 1900, integers beyond 2^53), text too long for a cell is skipped.
 * Both are reported as warnings.
 */
class XlsxRowExporter extends RowExporter
{
  static final String DATE_FORMAT = "yyyy-mm-dd";
  static final String TIMESTAMP_FORMAT = "yyyy-mm-dd hh:mm:ss";

  private static final int MAX_TEXT_LENGTH =
    SpreadsheetVersion.EXCEL2007.getMaxTextLength();
  /** largest magnitude of an integer a double holds exactly */
  private static final long MAX_EXACT_LONG = 1L << 53;
  private static final int MIN_EXCEL_YEAR = 1900;

  private final OutputStream _out;
  private final boolean _header;
  private final XSSFWorkbook _workbook = new XSSFWorkbook();
  private final Sheet _sheet;
  private final CellStyle _dateStyle;
  private final CellStyle _timestampStyle;
  private int _nextRow;

  XlsxRowExporter(OutputStream out, boolean header, String sheetName) {
    _out = out;
    _header = header;
    _sheet = _workbook.createSheet(WorkbookUtil.createSafeSheetName(sheetName));

    CreationHelper helper = _workbook.getCreationHelper();
    _dateStyle = _workbook.createCellStyle();
    _dateStyle.setDataFormat(
        helper.createDataFormat().getFormat(DATE_FORMAT));
    _timestampStyle = _workbook.createCellStyle();
    _timestampStyle.setDataFormat(
        helper.createDataFormat().getFormat(TIMESTAMP_FORMAT));
  }

  @Override
  protected void writeHeader() throws IOException {
    if(!_header) {
      return;
    }
    List<Column> columns = getColumns();
    Row row = _sheet.createRow(_nextRow++);
    for(int i = 0; i < columns.size(); ++i) {
      row.createCell(i).setCellValue(columns.get(i).getName());
    }
  }

  @Override
  public void writeRow(int rowIndex, Object[] rowData) throws IOException {
    Row row = _sheet.createRow(_nextRow++);
    for(int i = 0; i < getColumns().size(); ++i) {
      Object value = rowData[i];
      if(value != null) {
        writeValue(row, i, getColumns().get(i), rowIndex, value);
      }
    }
  }

  private void writeValue(Row row, int colIdx, Column column, int rowIndex,
                          Object value)
  {
    if(value instanceof Boolean) {
      row.createCell(colIdx).setCellValue((Boolean)value);
      return;
    }

    if(value instanceof Number) {
      Double d = toExactDouble((Number)value);
      if(d != null) {
        row.createCell(colIdx).setCellValue(d);
        return;
      }
      if(!isNonFinite((Number)value)) {
        addWarning(column, rowIndex,
                   "Number cannot be held exactly by a spreadsheet cell, " +
                   "written as text");
      }
    }

    if(value instanceof Instant) {
      value = LocalDateTime.ofInstant((Instant)value, ZoneOffset.UTC);
    }
    if(value instanceof LocalDate) {
      if(((LocalDate)value).getYear() >= MIN_EXCEL_YEAR) {
        Cell cell = row.createCell(colIdx);
        cell.setCellValue((LocalDate)value);
        cell.setCellStyle(_dateStyle);
        return;
      }
      addWarning(column, rowIndex,
                 "Date before " + MIN_EXCEL_YEAR + " written as text");
    } else if(value instanceof LocalDateTime) {
      if(((LocalDateTime)value).getYear() >= MIN_EXCEL_YEAR) {
        Cell cell = row.createCell(colIdx);
        cell.setCellValue((LocalDateTime)value);
        cell.setCellStyle(_timestampStyle);
        return;
      }
      addWarning(column, rowIndex,
                 "Timestamp before " + MIN_EXCEL_YEAR + " written as text");
    }

    String text = CellFormatter.format(value);
    if(text.length() > MAX_TEXT_LENGTH) {
      addWarning(column, rowIndex,
                 "Text of " + text.length() + " characters exceeds the " +
                 "spreadsheet cell limit of " + MAX_TEXT_LENGTH +
                 ", value skipped");
      return;
    }
    row.createCell(colIdx).setCellValue(text);
  }

  private static Double toExactDouble(Number num) {
    if((num instanceof Integer) || (num instanceof Short) ||
       (num instanceof Byte) || (num instanceof Float)) {
      double d = num.doubleValue();
      return (isNonFinite(num) ? null : d);
    }
    if(num instanceof Long) {
      long l = num.longValue();
      return (((l >= -MAX_EXACT_LONG) && (l <= MAX_EXACT_LONG)) ?
              (Double)(double)l : null);
    }
    if(num instanceof Double) {
      return (isNonFinite(num) ? null : num.doubleValue());
    }
    if(num instanceof BigDecimal) {
      BigDecimal bd = (BigDecimal)num;
      double d = bd.doubleValue();
      if(!Double.isInfinite(d) &&
         (BigDecimal.valueOf(d).compareTo(bd) == 0)) {
        return d;
      }
      return null;
    }
    return null;
  }

  private static boolean isNonFinite(Number num) {
    double d = num.doubleValue();
    return (((num instanceof Double) || (num instanceof Float)) &&
            (Double.isNaN(d) || Double.isInfinite(d)));
  }

  @Override
  public void finish() throws IOException {
    try {
      _workbook.write(new NonClosingOutputStream(_out));
    } finally {
      _workbook.close();
    }
    _out.flush();
  }

  /** keeps the workbook from closing the caller's stream */
  private static final class NonClosingOutputStream extends FilterOutputStream
  {
    private NonClosingOutputStream(OutputStream out) {
      super(out);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      out.write(b, off, len);
    }

    @Override
    public void close() throws IOException {
      flush();
    }
  }
}
