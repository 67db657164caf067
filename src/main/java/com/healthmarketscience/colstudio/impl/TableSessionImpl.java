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

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import com.healthmarketscience.colstudio.ColumnarCodec;
import com.healthmarketscience.colstudio.ColumnarTable;
import com.healthmarketscience.colstudio.SchemaCatalog;
import com.healthmarketscience.colstudio.Storage;
import com.healthmarketscience.colstudio.TableSession;
import com.healthmarketscience.colstudio.TableSnapshot;
import com.healthmarketscience.colstudio.TypeCoercionException;
import com.healthmarketscience.colstudio.util.ExportFormat;
import com.healthmarketscience.colstudio.util.ExportResult;
import com.healthmarketscience.colstudio.util.ExportUtil;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Default TableSession: reads and writes files through a {@link Storage},
 * converts them with a {@link ColumnarCodec} and keeps the loaded table in
 * an {@link EditBufferImpl}.
 */
public class TableSessionImpl implements TableSession
{
  private static final Log LOG = LogFactory.getLog(TableSessionImpl.class);

  private final ColumnarCodec _codec;
  private final Storage _storage;
  private final BufferAllocator _allocator;
  /** whether the allocator was created by (and is closed with) this
      session */
  private final boolean _ownsAllocator;
  private final boolean _emptyStringAsNull;
  private final int _commitParallelism;
  private ExecutorService _commitExecutor;
  /** whether the executor was created by (and is shut down with) this
      session */
  private boolean _ownsExecutor;
  /** file of the current generation */
  private Path _file;
  /** rows of the current generation */
  private EditBufferImpl _buffer;
  private boolean _closed;

  protected TableSessionImpl(ColumnarCodec codec, Storage storage,
                             BufferAllocator allocator,
                             Boolean emptyStringAsNull,
                             Integer commitParallelism,
                             ExecutorService commitExecutor)
  {
    _codec = ((codec != null) ? codec :
              new ArrowIpcCodec(getDefaultIpcFormat()));
    _storage = ((storage != null) ? storage : FileStorage.INSTANCE);
    _ownsAllocator = (allocator == null);
    _allocator = ((allocator != null) ? allocator : new RootAllocator());
    _emptyStringAsNull = ((emptyStringAsNull != null) ? emptyStringAsNull :
                          getDefaultEmptyStringAsNull());
    _commitParallelism = ((commitParallelism != null) ? commitParallelism :
                          getDefaultCommitParallelism());
    _commitExecutor = commitExecutor;
  }

  /**
   * Opens a new session, loading the given file if it is not {@code null}.
   * @usage _advanced_method_
   */
  public static TableSessionImpl open(
      Path file, ColumnarCodec codec, Storage storage,
      BufferAllocator allocator, Boolean emptyStringAsNull,
      Integer commitParallelism, ExecutorService commitExecutor)
    throws IOException
  {
    TableSessionImpl session = new TableSessionImpl(
        codec, storage, allocator, emptyStringAsNull, commitParallelism,
        commitExecutor);
    if(file != null) {
      boolean success = false;
      try {
        session.load(file);
        success = true;
      } finally {
        if(!success) {
          session.closeQuietly();
        }
      }
    }
    return session;
  }

  public ColumnarCodec getCodec() {
    return _codec;
  }

  public Storage getStorage() {
    return _storage;
  }

  public BufferAllocator getAllocator() {
    return _allocator;
  }

  public boolean isEmptyStringAsNull() {
    return _emptyStringAsNull;
  }

  public int getCommitParallelism() {
    return _commitParallelism;
  }

  @Override
  public Path getFile() {
    return _file;
  }

  @Override
  public boolean isLoaded() {
    return (_buffer != null);
  }

  @Override
  public SchemaCatalog getSchema() {
    return getEditBuffer().getSchema();
  }

  @Override
  public EditBufferImpl getEditBuffer() {
    checkOpen();
    if(_buffer == null) {
      throw new IllegalStateException("No table loaded");
    }
    return _buffer;
  }

  @Override
  public int getRowCount() {
    return ((_buffer != null) ? _buffer.getRowCount() : 0);
  }

  @Override
  public int getColumnCount() {
    return ((_buffer != null) ? _buffer.getSchema().size() : 0);
  }

  @Override
  public void load(Path file) throws IOException {
    checkOpen();
    byte[] bytes = _storage.read(file);
    EditBufferImpl buffer = null;
    try(ColumnarTable table = _codec.decode(bytes, _allocator)) {
      buffer = LoadPipeline.load(table, _emptyStringAsNull);
    }

    // only replace the current generation once the new one is complete
    _buffer = buffer;
    _file = file;

    if(LOG.isDebugEnabled()) {
      LOG.debug("Loaded " + file + ": " + buffer.getRowCount() + " rows, " +
                buffer.getSchema().size() + " columns");
    }
  }

  @Override
  public void edit(int rowIndex, String columnName, String text) {
    getEditBuffer().setCell(rowIndex, columnName, text);
  }

  @Override
  public void setValue(int rowIndex, String columnName, Object value)
    throws TypeCoercionException
  {
    getEditBuffer().setValue(rowIndex, columnName, value);
  }

  @Override
  public int deleteRows(Collection<Integer> rowIndexes) {
    return getEditBuffer().deleteRows(rowIndexes);
  }

  @Override
  public byte[] commit() throws IOException {
    return commit(getEditBuffer().snapshot());
  }

  private byte[] commit(TableSnapshot snapshot) throws IOException {
    CommitPipeline pipeline = new CommitPipeline(
        _allocator, getCommitExecutor());
    try(ColumnarTable table = pipeline.commit(snapshot)) {
      return _codec.encode(table);
    }
  }

  @Override
  public void save() throws IOException {
    getEditBuffer();
    if(_file == null) {
      throw new IllegalStateException("No file to save to");
    }
    saveAs(_file);
  }

  @Override
  public void saveAs(Path file) throws IOException {
    TableSnapshot snapshot = getEditBuffer().snapshot();
    byte[] bytes = commit(snapshot);
    _storage.write(file, bytes);
    _file = file;
    _buffer.markSaved(snapshot);

    if(LOG.isDebugEnabled()) {
      LOG.debug("Saved " + snapshot.getRowCount() + " rows to " + file);
    }
  }

  @Override
  public ExportResult export(ExportFormat format, Path target)
    throws IOException
  {
    return new ExportUtil.Builder(getEditBuffer().snapshot())
      .setFormat(format)
      .exportFile(target);
  }

  @Override
  public ExportResult export(ExportFormat format, OutputStream out)
    throws IOException
  {
    return new ExportUtil.Builder(getEditBuffer().snapshot())
      .setFormat(format)
      .exportStream(out);
  }

  @Override
  public boolean isModified() {
    return ((_buffer != null) && _buffer.isModified());
  }

  private ExecutorService getCommitExecutor() {
    if((_commitExecutor == null) && (_commitParallelism > 1)) {
      _commitExecutor = Executors.newFixedThreadPool(
          _commitParallelism, new CommitThreadFactory());
      _ownsExecutor = true;
    }
    return _commitExecutor;
  }

  private void checkOpen() {
    if(_closed) {
      throw new IllegalStateException("Session is closed");
    }
  }

  @Override
  public void close() throws IOException {
    if(_closed) {
      return;
    }
    _closed = true;
    _buffer = null;
    if(_ownsExecutor) {
      _commitExecutor.shutdownNow();
    }
    _commitExecutor = null;
    if(_ownsAllocator) {
      _allocator.close();
    }
  }

  private void closeQuietly() {
    try {
      close();
    } catch(IOException | RuntimeException e) {
      LOG.warn("Could not close session", e);
    }
  }

  @Override
  public String toString() {
    return CustomToStringStyle.builder(this)
      .append("file", _file)
      .append("rowCount", getRowCount())
      .append("columnCount", getColumnCount())
      .append("modified", isModified())
      .toString();
  }

  /**
   * Returns the default empty-string-as-null policy.  This defaults to
   * {@code true}, but can be overridden using the system property
   * {@value com.healthmarketscience.colstudio.TableSession#EMPTY_STRING_AS_NULL_PROPERTY}.
   * @usage _advanced_method_
   */
  public static boolean getDefaultEmptyStringAsNull()
  {
    String prop = System.getProperty(EMPTY_STRING_AS_NULL_PROPERTY);
    if(prop != null) {
      return Boolean.TRUE.toString().equalsIgnoreCase(prop.trim());
    }
    return true;
  }

  /**
   * Returns the default commit parallelism.  This defaults to {@code 1},
   * but can be overridden using the system property
   * {@value com.healthmarketscience.colstudio.TableSession#COMMIT_PARALLELISM_PROPERTY}.
   * @usage _advanced_method_
   */
  public static int getDefaultCommitParallelism()
  {
    String prop = System.getProperty(COMMIT_PARALLELISM_PROPERTY);
    if(prop != null) {
      prop = prop.trim();
      if(prop.length() > 0) {
        int parallelism = Integer.parseInt(prop);
        if(parallelism < 1) {
          throw new IllegalArgumentException(
              "Invalid commit parallelism " + parallelism);
        }
        return parallelism;
      }
    }
    return 1;
  }

  /**
   * Returns the default IPC format written by the default codec.  This
   * defaults to {@link ArrowIpcCodec.Format#FILE}, but can be overridden
   * using the system property
   * {@value com.healthmarketscience.colstudio.TableSession#IPC_FORMAT_PROPERTY}.
   * @usage _advanced_method_
   */
  public static ArrowIpcCodec.Format getDefaultIpcFormat()
  {
    String prop = System.getProperty(IPC_FORMAT_PROPERTY);
    if(prop != null) {
      prop = prop.trim();
      if(prop.length() > 0) {
        return ArrowIpcCodec.Format.valueOf(prop.toUpperCase(Locale.ROOT));
      }
    }
    return ArrowIpcCodec.Format.FILE;
  }

  /** creates daemon threads for commit executors */
  private static final class CommitThreadFactory implements ThreadFactory
  {
    private static final AtomicInteger POOL_NUM = new AtomicInteger();
    private final int _poolNum = POOL_NUM.incrementAndGet();
    private final AtomicInteger _threadNum = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "colstudio-commit-" + _poolNum + "-" +
                            _threadNum.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
