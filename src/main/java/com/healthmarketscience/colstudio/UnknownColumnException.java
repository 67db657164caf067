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
 * Thrown when a column is addressed by a name which the {@link SchemaCatalog}
 * does not contain.  This indicates a caller bug, a consistent UI only ever
 * uses names it got from the catalog.
 */
public class UnknownColumnException extends IllegalArgumentException
{
  private static final long serialVersionUID = 20261018L;

  private final String _columnName;

  public UnknownColumnException(String columnName) {
    super("Unknown column '" + columnName + "'");
    _columnName = columnName;
  }

  public String getColumnName() {
    return _columnName;
  }
}
