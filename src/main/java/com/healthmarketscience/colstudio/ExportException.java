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
 * ColumnarException which indicates that an export attempt failed as a
 * whole.  Individual cells which cannot be exported are reported as warnings
 * instead, see {@link com.healthmarketscience.colstudio.util.ExportResult}.
 */
public class ExportException extends ColumnarException
{
  private static final long serialVersionUID = 20261018L;

  public ExportException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
