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
 * ColumnarException which indicates that a committed table could not be
 * encoded by the configured {@link ColumnarCodec}.
 */
public class EncodeException extends ColumnarException
{
  private static final long serialVersionUID = 20261018L;

  public EncodeException(String msg) {
    super(msg);
  }

  public EncodeException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
