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
 * A cell which could not be exported as is.
 *
 * @usage _general_class_
 */
public final class ExportWarning
{
  private final String _columnName;
  private final int _rowIndex;
  private final String _message;

  public ExportWarning(String columnName, int rowIndex, String message) {
    _columnName = columnName;
    _rowIndex = rowIndex;
    _message = message;
  }

  public String getColumnName() {
    return _columnName;
  }

  /**
   * @return the position of the row in the exported snapshot
   */
  public int getRowIndex() {
    return _rowIndex;
  }

  public String getMessage() {
    return _message;
  }

  @Override
  public String toString() {
    return _message + " (Column=" + _columnName + ";Row=" + _rowIndex + ")";
  }
}
