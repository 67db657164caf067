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
 * InvalidValueException thrown when an edited value cannot be converted to
 * the logical type of its column (wrong shape, out of range, or more
 * precision than the type can hold).
 */
public class TypeCoercionException extends InvalidValueException
{
  private static final long serialVersionUID = 20261018L;

  public TypeCoercionException(String columnName, int rowIndex, String input,
                               String reason) {
    this(columnName, rowIndex, input, reason, null);
  }

  public TypeCoercionException(String columnName, int rowIndex, String input,
                               String reason, Throwable cause) {
    super(columnName, rowIndex, input, reason, cause);
  }

  /**
   * Returns a copy of this exception which reports the given row index.
   */
  public TypeCoercionException atRow(int rowIndex) {
    return new TypeCoercionException(getColumnName(), rowIndex, getInput(),
                                     getReason(), getCause());
  }
}
