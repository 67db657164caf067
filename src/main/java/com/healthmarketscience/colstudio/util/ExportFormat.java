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

/**
 * The supported export formats.
 * @usage _general_class_
 */
public enum ExportFormat
{
  /** delimited flat text */
  CSV("csv"),
  /** an array of JSON objects, one per row */
  JSON("json"),
  /** an Excel (OOXML) workbook with a single sheet */
  XLSX("xlsx");

  private final String _fileExtension;

  private ExportFormat(String fileExtension) {
    _fileExtension = fileExtension;
  }

  public String getFileExtension() {
    return _fileExtension;
  }

  /**
   * @return whether this format is written as text
   */
  public boolean isText() {
    return (this != XLSX);
  }

  /**
   * @return the default name for a file exported at the given time (in
   *         milliseconds since the epoch), e.g. {@code export_1700000000000.csv}
   */
  public String defaultFileName(long timeMillis) {
    return "export_" + timeMillis + "." + _fileExtension;
  }
}
