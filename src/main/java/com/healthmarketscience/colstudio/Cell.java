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

import java.util.Arrays;
import java.util.Objects;

/**
 * A single cell of a {@link Row}.  A cell is exactly one of:
 * <ul>
 *   <li>{@link Kind#NULL}: no value</li>
 *   <li>{@link Kind#VALUE}: a value conforming to a {@link LogicalType}</li>
 *   <li>{@link Kind#RAW_EDIT}: text entered by the user which has not yet
 *       been coerced to the column type.  Raw edits only exist between an
 *       edit and the next commit, the commit either coerces or rejects
 *       them.</li>
 * </ul>
 * Cells are immutable.
 */
public abstract class Cell
{
  /** the kinds of cells */
  public enum Kind {
    NULL, VALUE, RAW_EDIT;
  }

  private static final Cell NULL_CELL = new NullCell();

  private Cell() {
  }

  /**
   * @return the shared null cell
   */
  public static Cell nullCell() {
    return NULL_CELL;
  }

  /**
   * Returns a typed cell holding the given value, or the null cell if the
   * value is {@code null}.
   *
   * @throws IllegalArgumentException if the value is not a valid value of
   *         the given type (see {@link LogicalType#isValidValue})
   */
  public static Cell of(LogicalType type, Object value) {
    if(value == null) {
      return NULL_CELL;
    }
    if(!type.isValidValue(value)) {
      throw new IllegalArgumentException(
          "Value of " + value.getClass().getName() +
          " is not a valid " + type + " value");
    }
    if(value instanceof byte[]) {
      value = ((byte[])value).clone();
    }
    return new ValueCell(type, value);
  }

  /**
   * Returns a cell holding the given unvalidated text.
   */
  public static Cell rawEdit(String text) {
    return new RawEditCell(Objects.requireNonNull(text, "text"));
  }

  public abstract Kind getKind();

  public boolean isNull() {
    return (getKind() == Kind.NULL);
  }

  public boolean isRawEdit() {
    return (getKind() == Kind.RAW_EDIT);
  }

  /**
   * @return the logical type of a {@link Kind#VALUE} cell, {@code null}
   *         otherwise
   */
  public LogicalType getType() {
    return null;
  }

  /**
   * @return the typed value of a {@link Kind#VALUE} cell, {@code null}
   *         otherwise.  Note, byte[] values are returned as copies.
   */
  public Object getValue() {
    return null;
  }

  /**
   * @return the text of a {@link Kind#RAW_EDIT} cell, {@code null}
   *         otherwise
   */
  public String getText() {
    return null;
  }

  private static final class NullCell extends Cell
  {
    @Override
    public Kind getKind() {
      return Kind.NULL;
    }

    @Override
    public String toString() {
      return "Null";
    }
  }

  private static final class ValueCell extends Cell
  {
    private final LogicalType _type;
    private final Object _value;

    private ValueCell(LogicalType type, Object value) {
      _type = type;
      _value = value;
    }

    @Override
    public Kind getKind() {
      return Kind.VALUE;
    }

    @Override
    public LogicalType getType() {
      return _type;
    }

    @Override
    public Object getValue() {
      if(_value instanceof byte[]) {
        return ((byte[])_value).clone();
      }
      return _value;
    }

    @Override
    public boolean equals(Object o) {
      if(this == o) {
        return true;
      }
      if(!(o instanceof ValueCell)) {
        return false;
      }
      ValueCell other = (ValueCell)o;
      return (_type.equals(other._type) &&
              Objects.deepEquals(_value, other._value));
    }

    @Override
    public int hashCode() {
      return ((_value instanceof byte[]) ? Arrays.hashCode((byte[])_value) :
              _value.hashCode());
    }

    @Override
    public String toString() {
      return "Value[" + _type + ": " +
        ((_value instanceof byte[]) ? Arrays.toString((byte[])_value) :
         _value) + "]";
    }
  }

  private static final class RawEditCell extends Cell
  {
    private final String _text;

    private RawEditCell(String text) {
      _text = text;
    }

    @Override
    public Kind getKind() {
      return Kind.RAW_EDIT;
    }

    @Override
    public String getText() {
      return _text;
    }

    @Override
    public boolean equals(Object o) {
      return ((this == o) ||
              ((o instanceof RawEditCell) &&
               _text.equals(((RawEditCell)o)._text)));
    }

    @Override
    public int hashCode() {
      return _text.hashCode();
    }

    @Override
    public String toString() {
      return "RawEdit['" + _text + "']";
    }
  }
}
