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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of {@link FileLocations}. */
@RunWith(JUnit4.class)
public final class FileLocationsTest {

  private static String locationOf(FileLocations locs, int offset) {
    Location loc = locs.getLocation(offset);
    return loc.line() + ":" + loc.column();
  }

  @Test
  public void testLinesAndColumns() {
    FileLocations locs = FileLocations.create("ab\ncd\n\nef", "foo.py");
    assertThat(locationOf(locs, 0)).isEqualTo("1:1");
    assertThat(locationOf(locs, 1)).isEqualTo("1:2");
    assertThat(locationOf(locs, 2)).isEqualTo("1:3"); // the newline itself
    assertThat(locationOf(locs, 3)).isEqualTo("2:1");
    assertThat(locationOf(locs, 4)).isEqualTo("2:2");
    assertThat(locationOf(locs, 6)).isEqualTo("3:1");
    assertThat(locationOf(locs, 7)).isEqualTo("4:1");
    assertThat(locationOf(locs, 9)).isEqualTo("4:3"); // end of file
  }

  @Test
  public void testEmptyFile() {
    FileLocations locs = FileLocations.create("", "empty.py");
    assertThat(locs.size()).isEqualTo(0);
    assertThat(locs.getLocation(0).toString()).isEqualTo("empty.py:1:1");
  }

  @Test
  public void testOffsetOutOfRange() {
    FileLocations locs = FileLocations.create("abc", "foo.py");
    assertThrows(IllegalArgumentException.class, () -> locs.getLocation(4));
    assertThrows(IllegalArgumentException.class, () -> locs.getLocation(-1));
  }

  @Test
  public void testGetSpan() {
    FileLocations locs = FileLocations.create("x = 1\nyy = 22\n", "foo.py");
    Span span = locs.getSpan(6, 13);
    assertThat(span.file()).isEqualTo("foo.py");
    assertThat(span.getStartOffset()).isEqualTo(6);
    assertThat(span.getEndOffset()).isEqualTo(13);
    assertThat(span.toString()).isEqualTo("foo.py:2:1-2:8");
  }

  @Test
  public void testLocationOrder() {
    FileLocations locs = FileLocations.create("abc\ndef", "foo.py");
    assertThat(locs.getLocation(2)).isLessThan(locs.getLocation(5));
    assertThat(locs.getLocation(5)).isEquivalentAccordingToCompareTo(locs.getLocation(5));
    assertThat(locs.getLocation(5)).isEqualTo(locs.getLocation(5));
  }
}
