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

import com.google.auto.value.AutoValue;

/**
 * FileOptions is a set of options that affect which constructs an {@link AstBuilder} accepts when
 * assembling the tree of a single file. These options select the dialect, much like the
 * command-line options of a compiler.
 *
 * <p>The {@link #DEFAULT} options accept everything the grammar produces, deferring any further
 * rejection to later stages.
 */
@AutoValue
public abstract class FileOptions {

  /** The default options. New clients should use these defaults. */
  public static final FileOptions DEFAULT = builder().build();

  /**
   * Permit a dictionary unpacking {@code **d} as the body of a dict comprehension, as in {@code
   * {**d for d in ds}}. The grammar accepts it but the language does not, so a later stage must
   * report it when this is enabled.
   */
  public abstract boolean allowDictUnpackingInComprehension();

  /**
   * Permit legacy tuple-unpacking parameters such as {@code def f(a, (b, c)): ...}. <br>
   * (Required only for grammars of older versions of the language.)
   */
  public abstract boolean allowTupleParameters();

  public static Builder builder() {
    // These are the DEFAULT values.
    return new AutoValue_FileOptions.Builder()
        .allowDictUnpackingInComprehension(true)
        .allowTupleParameters(true);
  }

  /** Builder for {@link FileOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder allowDictUnpackingInComprehension(boolean value);

    public abstract Builder allowTupleParameters(boolean value);

    public abstract FileOptions build();
  }
}
