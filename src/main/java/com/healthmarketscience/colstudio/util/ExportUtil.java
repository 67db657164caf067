/*
Copyright (c) 2007 Health Market Science, Inc.

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

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.healthmarketscience.colstudio.Column;
import com.healthmarketscience.colstudio.ExportException;
import com.healthmarketscience.colstudio.Row;
import com.healthmarketscience.colstudio.TableSnapshot;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Utility class for exporting the contents of a table to delimited text,
 * JSON or Excel workbooks.  Exports always work on a {@link TableSnapshot},
 * they never affect the edit buffer the snapshot was taken from.
 * <p>
 * Simple example usage:
 * <pre>
 *   ExportResult result = new ExportUtil.Builder(buffer.snapshot())
 *     .setFormat(ExportFormat.CSV)
 *     .exportFile(Paths.get("out.csv"));
 * </pre>
 *
 * @see Builder
 * @usage _general_class_
 */
public class ExportUtil
{
  private static final Log LOG = LogFactory.getLog(ExportUtil.class);

  public static final String DEFAULT_DELIMITER = ",";
  public static final char DEFAULT_QUOTE_CHAR = '"';
  public static final String DEFAULT_SHEET_NAME = "Export";

  private static final JsonFactory JSON_FACTORY = new JsonFactory();

  private ExportUtil() {
  }

  private static ExportResult export(TableSnapshot snapshot,
                                     ExportFormat format, ExportFilter filter,
                                     RowExporter exporter)
    throws IOException
  {
    List<Column> columns = filter.filterColumns(
        new ArrayList<Column>(snapshot.getSchema().getColumns()));

    exporter.start(columns);

    int rowCount = 0;
    Object[] unfilteredRowData = new Object[columns.size()];
    for(int r = 0; r < snapshot.getRowCount(); ++r) {
      Row row = snapshot.getRow(r);

      // fill raw row data in array
      for(int i = 0; i < columns.size(); i++) {
        unfilteredRowData[i] = CellFormatter.exportValue(
            row.getCell(columns.get(i).getName()));
      }

      // apply filter
      Object[] rowData = filter.filterRow(unfilteredRowData);
      if(rowData == null) {
        continue;
      }

      exporter.writeRow(r, rowData);
      ++rowCount;
    }

    exporter.finish();

    List<ExportWarning> warnings = exporter.getWarnings();
    for(ExportWarning warning : warnings) {
      LOG.warn("Export to " + format + ": " + warning);
    }
    if(LOG.isDebugEnabled()) {
      LOG.debug("Exported " + rowCount + " rows of " + columns.size() +
                " columns to " + format + " with " + warnings.size() +
                " warnings");
    }

    return new ExportResult(format, null, rowCount, columns.size(),
                            warnings);
  }

  /**
   * Builder which simplifies configuration of an export operation.
   */
  public static class Builder
  {
    private final TableSnapshot _snapshot;
    private ExportFormat _format = ExportFormat.CSV;
    private ExportFilter _filter = SimpleExportFilter.INSTANCE;
    private boolean _header = true;
    private String _delim = DEFAULT_DELIMITER;
    private char _quote = DEFAULT_QUOTE_CHAR;
    private String _sheetName = DEFAULT_SHEET_NAME;

    public Builder(TableSnapshot snapshot) {
      _snapshot = snapshot;
    }

    public Builder setFormat(ExportFormat format) {
      _format = format;
      return this;
    }

    public Builder setFilter(ExportFilter filter) {
      _filter = filter;
      return this;
    }

    /**
     * Whether the first line (CSV) or row (XLSX) holds the column names.
     * Defaults to {@code true}.
     */
    public Builder setHeader(boolean header) {
      _header = header;
      return this;
    }

    /**
     * The CSV column delimiter, {@code null} for the default (comma).
     */
    public Builder setDelimiter(String delim) {
      _delim = ((delim != null) ? delim : DEFAULT_DELIMITER);
      return this;
    }

    /**
     * The CSV quote character.
     */
    public Builder setQuote(char quote) {
      _quote = quote;
      return this;
    }

    /**
     * The name of the XLSX sheet, made safe for Excel if necessary.
     */
    public Builder setSheetName(String sheetName) {
      _sheetName = ((sheetName != null) ? sheetName : DEFAULT_SHEET_NAME);
      return this;
    }

    /**
     * Exports to the given writer, which is flushed but not closed.
     *
     * @throws IllegalStateException if the format is not a text format
     * @see ExportFormat#isText
     */
    public ExportResult exportWriter(BufferedWriter out) throws IOException {
      switch(_format) {
      case CSV:
        return export(_snapshot, _format, _filter,
                      new CsvRowExporter(out, _header, _delim, _quote));
      case JSON:
        return export(_snapshot, _format, _filter,
                      new JsonRowExporter(
                          JSON_FACTORY.createGenerator(out)
                          .useDefaultPrettyPrinter()));
      default:
        throw new IllegalStateException(
            "Format " + _format + " cannot be written as text");
      }
    }

    /**
     * Exports to the given stream, which is flushed but not closed.  Text
     * formats are written in UTF-8.
     */
    public ExportResult exportStream(OutputStream out) throws IOException {
      if(_format.isText()) {
        BufferedWriter writer = new BufferedWriter(
            new OutputStreamWriter(out, StandardCharsets.UTF_8));
        return exportWriter(writer);
      }
      try {
        return export(_snapshot, _format, _filter,
                      new XlsxRowExporter(out, _header, _sheetName));
      } catch(RuntimeException e) {
        throw new ExportException("Failed writing " + _format + " export", e);
      }
    }

    /**
     * Exports to the given file.  If the given path is a directory, the file
     * is created in that directory using the default name of the format
     * (see {@link ExportFormat#defaultFileName}).  A failed export removes
     * the partially written file.
     */
    public ExportResult exportFile(Path file) throws IOException {
      if(Files.isDirectory(file)) {
        file = file.resolve(_format.defaultFileName(
                                System.currentTimeMillis()));
      }

      boolean success = false;
      try {
        ExportResult result = null;
        try(OutputStream out = Files.newOutputStream(file)) {
          result = exportStream(out);
        }
        success = true;
        return result.withFile(file);
      } finally {
        if(!success) {
          try {
            Files.deleteIfExists(file);
          } catch(IOException e) {
            LOG.warn("Could not delete partial export " + file, e);
          }
        }
      }
    }
  }
}
