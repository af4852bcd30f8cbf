// Copyright 2026 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package net.pyast.java.syntax;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import javax.annotation.concurrent.Immutable;

/**
 * FileLocations maps each character offset of a single input to its {@link Location}. The lexer
 * uses it to attach spans to tokens; the builder never needs it, as it derives every span from
 * its inputs.
 */
@Immutable
public final class FileLocations {

  private final int[] linestart; // maps line number (line >= 1) to char offset

  private final String file;
  private final int size; // size of file in chars

  private FileLocations(int[] linestart, String file, int size) {
    this.linestart = linestart;
    this.file = file;
    this.size = size;
  }

  /** Returns the locations table for the given file content. */
  public static FileLocations create(String content, String file) {
    return create(content.toCharArray(), file);
  }

  public static FileLocations create(char[] buffer, String file) {
    Preconditions.checkNotNull(file);
    int[] array = new int[buffer.length + 2]; // at most one line per char, plus sentinels
    int n = 1; // linestart[0] is unused
    array[n++] = 0; // line 1 starts at offset 0
    for (int i = 0; i < buffer.length; i++) {
      if (buffer[i] == '\n') {
        array[n++] = i + 1;
      }
    }
    return new FileLocations(Arrays.copyOf(array, n), file, buffer.length);
  }

  /** Returns the name of the file. */
  public String file() {
    return file;
  }

  /** Returns the number of characters in the file. */
  public int size() {
    return size;
  }

  private int getLineAt(int offset) {
    Preconditions.checkArgument(
        offset >= 0 && offset <= size, "offset %s out of range [0, %s]", offset, size);
    int i = Arrays.binarySearch(linestart, 1, linestart.length, offset);
    if (i >= 0) {
      return i; // start of a line; line starts are strictly increasing
    }
    return -i - 2; // insertion point - 1
  }

  /** Returns the location of the given character offset. */
  public Location getLocation(int offset) {
    int line = getLineAt(offset);
    int column = offset - linestart[line] + 1;
    return new Location(file, offset, line, column);
  }

  /** Returns the span from {@code start} (inclusive) to {@code end} (exclusive). */
  public Span getSpan(int start, int end) {
    return Span.of(getLocation(start), getLocation(end));
  }
}
