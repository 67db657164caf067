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

/**
 * Raw byte access to stored files.
 */
public interface Storage
{
  public byte[] read(Path path) throws IOException;

  /**
   * Writes the given bytes to the given path, replacing any existing file.
   * Implementations must not leave a partially written file behind on
   * failure.
   */
  public void write(Path path, byte[] bytes) throws IOException;
}
