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

import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Collection;

import com.healthmarketscience.colstudio.util.ExportFormat;
import com.healthmarketscience.colstudio.util.ExportResult;

/**
 * An editing session over one columnar file at a time.  This is the surface
 * a UI layer talks to: load a file, edit and delete rows, commit/save the
 * result or export it.
 * <p>
 * Loads and commits are all-or-nothing.  A failed load leaves the
 * previously loaded table in place, a failed commit or save leaves the edit
 * buffer untouched (so the user can fix the offending cell and retry) and
 * never writes a partial file.
 * <p>
 * Sessions are not thread-safe.  Use {@link TableSessionBuilder} to create
 * them.
 */
public interface TableSession extends Closeable
{
  /** (boolean) system property which can be used to set whether empty user
   *  input is stored as a null cell.  Defaults to {@code true}.
   * @usage _general_field_
   */
  public static final String EMPTY_STRING_AS_NULL_PROPERTY =
    "com.healthmarketscience.colstudio.emptyStringAsNull";

  /** system property which can be used to set the number of threads used to
   *  coerce columns during a commit.  Defaults to {@code 1} (coerce on the
   *  calling thread).
   * @usage _intermediate_field_
   */
  public static final String COMMIT_PARALLELISM_PROPERTY =
    "com.healthmarketscience.colstudio.commitParallelism";

  /** system property which can be used to set the Arrow IPC format written
   *  by the default codec, one of the {@link
   *  com.healthmarketscience.colstudio.impl.ArrowIpcCodec.Format} values.
   *  Defaults to {@code FILE}.
   * @usage _intermediate_field_
   */
  public static final String IPC_FORMAT_PROPERTY =
    "com.healthmarketscience.colstudio.ipcFormat";

  /**
   * @return the file of the currently loaded table, {@code null} if no table
   *         is loaded
   */
  public Path getFile();

  public boolean isLoaded();

  /**
   * @throws IllegalStateException if no table is loaded
   */
  public SchemaCatalog getSchema();

  /**
   * @throws IllegalStateException if no table is loaded
   */
  public EditBuffer getEditBuffer();

  public int getRowCount();

  public int getColumnCount();

  /**
   * Loads the given file, replacing the currently loaded table (unsaved edits
   * are discarded) only if the file was loaded successfully.
   *
   * @throws DecodeException if the file is not a valid columnar file
   * @throws UnsupportedTypeException if the file uses unsupported types
   * @throws IOException if the file cannot be read
   */
  public void load(Path file) throws IOException;

  /**
   * Stores the given text for a cell, see {@link EditBuffer#setCell}.
   */
  public void edit(int rowIndex, String columnName, String text);

  /**
   * Stores a typed value for a cell, see {@link EditBuffer#setValue}.
   */
  public void setValue(int rowIndex, String columnName, Object value)
    throws TypeCoercionException;

  /**
   * Deletes rows, see {@link EditBuffer#deleteRows}.
   *
   * @return the new row count
   */
  public int deleteRows(Collection<Integer> rowIndexes);

  /**
   * Builds and encodes a table from the current contents of the edit buffer.
   * The schema of the result is always the schema of the loaded table.
   *
   * @return the encoded table, ready to be stored
   * @throws InvalidValueException if a cell cannot be committed to its column
   * @throws EncodeException if the table cannot be encoded
   */
  public byte[] commit() throws IOException;

  /**
   * Commits the table and writes it back to the loaded file.
   */
  public void save() throws IOException;

  /**
   * Commits the table and writes it to the given file, which becomes the
   * file of this session.
   */
  public void saveAs(Path file) throws IOException;

  /**
   * Exports the current contents of the edit buffer to the given file.
   * Export never affects the edit buffer.
   */
  public ExportResult export(ExportFormat format, Path target)
    throws IOException;

  /**
   * Exports the current contents of the edit buffer to the given stream,
   * which is flushed but not closed.
   */
  public ExportResult export(ExportFormat format, OutputStream out)
    throws IOException;

  /**
   * @return {@code true} if the loaded table has unsaved edits
   */
  public boolean isModified();

  /**
   * Releases all resources of this session.
   */
  @Override
  public void close() throws IOException;
}
