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

package com.healthmarketscience.colstudio.impl;

import com.healthmarketscience.colstudio.RowId;

/**
 * Stable handle of a row within one edit buffer.  Ids are assigned in load
 * order and never reused by the buffer which assigned them.
 */
public final class RowIdImpl implements RowId
{
  private final long _id;

  public RowIdImpl(long id) {
    _id = id;
  }

  public long getId() {
    return _id;
  }

  @Override
  public int compareTo(RowId other) {
    return Long.compare(_id, ((RowIdImpl)other)._id);
  }

  @Override
  public boolean equals(Object o) {
    return ((this == o) ||
            ((o instanceof RowIdImpl) && (_id == ((RowIdImpl)o)._id)));
  }

  @Override
  public int hashCode() {
    return Long.hashCode(_id);
  }

  @Override
  public String toString() {
    return "RowId[" + _id + "]";
  }
}
