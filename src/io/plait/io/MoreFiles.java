/*
 * Copyright 2018-present Facebook, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License. You may obtain
 * a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */

package io.plait.io;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Arrays;

public final class MoreFiles {

  /** Utility class: do not instantiate. */
  private MoreFiles() {}

  /**
   * Writes {@code contents} to a temporary sibling of {@code file} and then moves it into place,
   * so readers never observe a partially written file.
   */
  public static void writeAtomically(Path file, byte[] contents) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path temp = file.resolveSibling("." + file.getFileName() + ".tmp");
    try {
      Files.write(temp, contents);
      try {
        Files.move(
            temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  public static void writeAtomically(Path file, String contents) throws IOException {
    writeAtomically(file, contents.getBytes(UTF_8));
  }

  /**
   * Writes {@code contents} only when the file is missing or holds different bytes, so that the
   * file's modification time only changes along with its contents.
   *
   * @return whether the file was written.
   */
  public static boolean writeIfChanged(Path file, String contents) throws IOException {
    byte[] bytes = contents.getBytes(UTF_8);
    if (Files.isRegularFile(file) && Arrays.equals(Files.readAllBytes(file), bytes)) {
      return false;
    }
    writeAtomically(file, bytes);
    return true;
  }
}
