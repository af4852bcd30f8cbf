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
import java.io.Serializable;
import java.util.Objects;
import javax.annotation.concurrent.Immutable;

/**
 * A Location denotes a position within a source file: a character offset together with the
 * 1-based line and column it falls on.
 *
 * <p>Locations are ordered by offset within a file. Comparing locations of different files is
 * permitted, and orders them by file name first.
 */
@Immutable
public final class Location implements Serializable, Comparable<Location> {

  private final String file;
  private final int offset;
  private final int line;
  private final int column;

  public Location(String file, int offset, int line, int column) {
    Preconditions.checkArgument(offset >= 0, "negative offset: %s", offset);
    Preconditions.checkArgument(line >= 1, "line must be 1-based: %s", line);
    Preconditions.checkArgument(column >= 1, "column must be 1-based: %s", column);
    this.file = Preconditions.checkNotNull(file);
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  /** Returns the name of the file containing this location. */
  public String file() {
    return file;
  }

  /** Returns the zero-based character offset of this location. */
  public int offset() {
    return offset;
  }

  /** Returns the line number of this location. */
  public int line() {
    return line;
  }

  /** Returns the column number of this location. */
  public int column() {
    return column;
  }

  /** Returns a string of the form "file:line:column". */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    buf.append(file);
    buf.append(':').append(line);
    buf.append(':').append(column);
    return buf.toString();
  }

  @Override
  public int compareTo(Location that) {
    int cmp = this.file.compareTo(that.file);
    if (cmp != 0) {
      return cmp;
    }
    return Integer.compare(this.offset, that.offset);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, offset, line, column);
  }

  @Override
  public boolean equals(Object that) {
    return this == that
        || (that instanceof Location loc
            && this.file.equals(loc.file)
            && this.offset == loc.offset
            && this.line == loc.line
            && this.column == loc.column);
  }
}
