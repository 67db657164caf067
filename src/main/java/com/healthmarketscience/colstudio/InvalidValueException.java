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

/**
 * ColumnarException which indicates that a cell value could not be committed
 * to its column.  These are user input errors: the offending cell can be
 * corrected and the commit retried, the edit buffer is left untouched.
 */
public abstract class InvalidValueException extends ColumnarException
{
  private static final long serialVersionUID = 20261018L;

  private final String _columnName;
  private final int _rowIndex;
  private final String _input;
  private final String _reason;

  protected InvalidValueException(String columnName, int rowIndex,
                                  String input, String reason,
                                  Throwable cause)
  {
    super(reason + " (Column=" + columnName + ";Row=" + rowIndex +
          ";Input=" + ((input != null) ? "'" + input + "'" : "<null>") + ")",
          cause);
    _columnName = columnName;
    _rowIndex = rowIndex;
    _input = input;
    _reason = reason;
  }

  /**
   * @return the name of the column holding the offending cell
   */
  public String getColumnName() {
    return _columnName;
  }

  /**
   * @return the 0-based position of the offending row at the time of the
   *         commit, or -1 if the value was not yet part of a row
   */
  public int getRowIndex() {
    return _rowIndex;
  }

  /**
   * @return the offending input as text, {@code null} for a null cell
   */
  public String getInput() {
    return _input;
  }

  /**
   * @return a short description of the failure, without location info
   */
  public String getReason() {
    return _reason;
  }
}
