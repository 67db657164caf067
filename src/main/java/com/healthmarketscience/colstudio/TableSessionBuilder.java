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

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;

import com.healthmarketscience.colstudio.impl.TableSessionImpl;
import org.apache.arrow.memory.BufferAllocator;

/**
 * Builder style class for opening a {@link TableSession}.
 * <p/>
 * Simple example usage:
 * <pre>
 *   TableSession session = TableSessionBuilder.open(Paths.get("data.arrow"));
 * </pre>
 * <p/>
 * Advanced example usage:
 * <pre>
 *   TableSession session = new TableSessionBuilder(Paths.get("data.arrow"))
 *     .setEmptyStringAsNull(false)
 *     .setCommitParallelism(4)
 *     .open();
 * </pre>
 */
public class TableSessionBuilder
{
  /** the file to load, if any */
  private Path _file;
  /** optional codec, defaults to Arrow IPC */
  private ColumnarCodec _codec;
  /** optional storage, defaults to the local file system */
  private Storage _storage;
  /** optional allocator, will _not_ be closed by the session */
  private BufferAllocator _allocator;
  /** optional override of the empty-string-as-null policy */
  private Boolean _emptyStringAsNull;
  /** optional override of the commit parallelism */
  private Integer _commitParallelism;
  /** optional executor for commits, will _not_ be shut down by the
      session */
  private ExecutorService _commitExecutor;

  public TableSessionBuilder() {
    this(null);
  }

  public TableSessionBuilder(Path file) {
    _file = file;
  }

  /**
   * Convenience method for loading the given file with the default settings.
   */
  public static TableSession open(Path file) throws IOException {
    return new TableSessionBuilder(file).open();
  }

  /**
   * File to load when the session is opened.  If {@code null}, the session
   * starts out empty and a file may be loaded later.
   */
  public TableSessionBuilder setFile(Path file) {
    _file = file;
    return this;
  }

  /**
   * Sets the codec used to decode and encode files.
   */
  public TableSessionBuilder setCodec(ColumnarCodec codec) {
    _codec = codec;
    return this;
  }

  /**
   * Sets the storage used to read and write files.
   */
  public TableSessionBuilder setStorage(Storage storage) {
    _storage = storage;
    return this;
  }

  /**
   * Sets the allocator used for decoded tables.  If not set, the session
   * creates (and closes) its own.
   */
  public TableSessionBuilder setAllocator(BufferAllocator allocator) {
    _allocator = allocator;
    return this;
  }

  /**
   * Sets whether empty user input is stored as a null cell.  If not set, the
   * value of the system property {@value
   * com.healthmarketscience.colstudio.TableSession#EMPTY_STRING_AS_NULL_PROPERTY}
   * is used.
   */
  public TableSessionBuilder setEmptyStringAsNull(boolean emptyStringAsNull) {
    _emptyStringAsNull = emptyStringAsNull;
    return this;
  }

  /**
   * Sets the number of threads used to coerce columns during a commit.  If
   * not set, the value of the system property {@value
   * com.healthmarketscience.colstudio.TableSession#COMMIT_PARALLELISM_PROPERTY}
   * is used.  Ignored if an executor is given.
   */
  public TableSessionBuilder setCommitParallelism(int commitParallelism) {
    if(commitParallelism < 1) {
      throw new IllegalArgumentException(
          "Invalid commit parallelism " + commitParallelism);
    }
    _commitParallelism = commitParallelism;
    return this;
  }

  /**
   * Sets the executor used to coerce columns during a commit.
   */
  public TableSessionBuilder setCommitExecutor(ExecutorService executor) {
    _commitExecutor = executor;
    return this;
  }

  /**
   * Opens a new session with the current configuration, loading the
   * configured file (if any).
   */
  public TableSession open() throws IOException {
    return TableSessionImpl.open(_file, _codec, _storage, _allocator,
                                 _emptyStringAsNull, _commitParallelism,
                                 _commitExecutor);
  }
}
