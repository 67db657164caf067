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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.healthmarketscience.colstudio.impl.CustomToStringStyle;

/**
 * Summary of a finished export.
 *
 * @usage _general_class_
 */
public final class ExportResult
{
  private final ExportFormat _format;
  private final Path _file;
  private final int _rowCount;
  private final int _columnCount;
  private final List<ExportWarning> _warnings;

  public ExportResult(ExportFormat format, Path file, int rowCount,
                      int columnCount, List<ExportWarning> warnings)
  {
    _format = format;
    _file = file;
    _rowCount = rowCount;
    _columnCount = columnCount;
    _warnings = Collections.unmodifiableList(
        new ArrayList<ExportWarning>(warnings));
  }

  public ExportFormat getFormat() {
    return _format;
  }

  /**
   * @return the exported file, {@code null} if the export was written to a
   *         stream
   */
  public Path getFile() {
    return _file;
  }

  /**
   * @return the number of rows written (after filtering)
   */
  public int getRowCount() {
    return _rowCount;
  }

  /**
   * @return the number of columns written (after filtering)
   */
  public int getColumnCount() {
    return _columnCount;
  }

  public List<ExportWarning> getWarnings() {
    return _warnings;
  }

  public boolean hasWarnings() {
    return !_warnings.isEmpty();
  }

  ExportResult withFile(Path file) {
    return new ExportResult(_format, file, _rowCount, _columnCount,
                            _warnings);
  }

  @Override
  public String toString() {
    return CustomToStringStyle.valueBuilder(this)
      .append("format", _format)
      .append("file", _file)
      .append("rowCount", _rowCount)
      .append("columnCount", _columnCount)
      .append("warnings", _warnings)
      .toString();
  }
}
