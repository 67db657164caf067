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

import org.apache.arrow.memory.BufferAllocator;

/**
 * Converts between the encoded bytes of a columnar file and a decoded {@link
 * ColumnarTable}.  The codec is a black box to the editing engine, it only
 * has to reproduce the schema of whatever table it is given.
 */
public interface ColumnarCodec
{
  /**
   * Decodes the given bytes into a table whose memory is allocated from the
   * given allocator.  The caller owns (and must close) the returned table.
   *
   * @throws DecodeException if the bytes are not a valid encoded table
   */
  public ColumnarTable decode(byte[] bytes, BufferAllocator allocator)
    throws DecodeException;

  /**
   * Encodes the given table.  The table is not closed by this method.
   *
   * @throws EncodeException if the table cannot be encoded
   */
  public byte[] encode(ColumnarTable table) throws EncodeException;
}
