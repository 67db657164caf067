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
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.concurrent.ThreadLocalRandom;

import com.healthmarketscience.colstudio.Storage;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;

/**
 * Storage on the local file system.  Writes go to a temporary file next to
 * the target which is then moved over the target, so a failed write leaves
 * any previous file untouched.
 */
public class FileStorage implements Storage
{
  private static final Log LOG = LogFactory.getLog(FileStorage.class);

  public static final FileStorage INSTANCE = new FileStorage();

  private static final int MAX_TEMP_FILE_ATTEMPTS = 100;

  public FileStorage() {
  }

  @Override
  public byte[] read(Path file) throws IOException {
    return Files.readAllBytes(file);
  }

  @Override
  public void write(Path file, byte[] bytes) throws IOException {
    Path target = file.toAbsolutePath();
    Path dir = target.getParent();
    Path tmpFile = createTempFile(dir, target.getFileName().toString());
    boolean success = false;
    try {
      Files.write(tmpFile, bytes);
      copyPermissions(target, tmpFile);
      try {
        Files.move(tmpFile, target, StandardCopyOption.ATOMIC_MOVE,
                   StandardCopyOption.REPLACE_EXISTING);
      } catch(AtomicMoveNotSupportedException e) {
        Files.move(tmpFile, target, StandardCopyOption.REPLACE_EXISTING);
      }
      success = true;
      if(LOG.isDebugEnabled()) {
        LOG.debug("Wrote " + bytes.length + " bytes to " + target);
      }
    } finally {
      if(!success) {
        try {
          Files.deleteIfExists(tmpFile);
        } catch(IOException e) {
          LOG.warn("Could not delete temporary file " + tmpFile, e);
        }
      }
    }
  }

  /**
   * Creates a new, empty sibling file for the given file name, with the
   * default permissions of the process.
   */
  private static Path createTempFile(Path dir, String fileName)
    throws IOException
  {
    for(int i = 0; ; ++i) {
      Path tmpFile = dir.resolve(
          "." + fileName + "." +
          Long.toHexString(ThreadLocalRandom.current().nextLong()) + ".tmp");
      try {
        return Files.createFile(tmpFile);
      } catch(FileAlreadyExistsException e) {
        if(i >= MAX_TEMP_FILE_ATTEMPTS) {
          throw e;
        }
      }
    }
  }

  /**
   * Gives the new file the permissions of the existing target, if any.
   */
  private static void copyPermissions(Path target, Path tmpFile)
    throws IOException
  {
    if(!Files.exists(target)) {
      return;
    }
    PosixFileAttributeView view = Files.getFileAttributeView(
        target, PosixFileAttributeView.class);
    if(view == null) {
      return;
    }
    Files.setPosixFilePermissions(tmpFile,
                                  view.readAttributes().permissions());
  }
}
