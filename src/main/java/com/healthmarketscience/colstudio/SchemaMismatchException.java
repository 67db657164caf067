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
 * Thrown when table data does not line up with its {@link SchemaCatalog}
 * (wrong vector count, wrong vector class, a cell holding a value of another
 * type).  This is an internal invariant violation, not a recoverable user
 * error.
 */
public class SchemaMismatchException extends IllegalStateException
{
  private static final long serialVersionUID = 20261018L;

  public SchemaMismatchException(String msg) {
    super(msg);
  }
}
