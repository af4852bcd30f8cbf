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
import javax.annotation.Nullable;

/**
 * Syntax node for a parameter in a function definition.
 *
 * <p>Parameters may be of five forms, as in {@code def f(a, b=1, (c, d), *, e, **kwargs)} or
 * {@code def f(a, *args, **kwargs)}. These are represented by the subclasses Named, UnpackTuple,
 * EndPositional, Star and StarStar.
 *
 * <p>The legal orders of these forms within one signature are enforced by {@link
 * OrderingChecker#checkParameters}.
 */
public abstract class Parameter extends Node {

  @Nullable private final Identifier id;
  @Nullable private final Expression annotation;

  private Parameter(Span span, @Nullable Identifier id, @Nullable Expression annotation) {
    super(span);
    this.id = id;
    this.annotation = annotation;
  }

  /** Returns the name of the parameter, or null for a bare {@code *} or a tuple pattern. */
  @Nullable
  public String getName() {
    return id != null ? id.getName() : null;
  }

  @Nullable
  public Identifier getIdentifier() {
    return id;
  }

  /** Returns the type annotation {@code T} of {@code name: T}, if any. */
  @Nullable
  public Expression getAnnotation() {
    return annotation;
  }

  @Nullable
  public Expression getDefaultValue() {
    return null;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /**
   * Syntax node for a named parameter, {@code name}, {@code name: T}, {@code name=default} or
   * {@code name: T = default}.
   */
  public static final class Named extends Parameter {
    @Nullable private final Expression defaultValue;

    Named(
        Span span,
        Identifier id,
        @Nullable Expression annotation,
        @Nullable Expression defaultValue) {
      super(span, Preconditions.checkNotNull(id), annotation);
      this.defaultValue = defaultValue;
    }

    @Override
    @Nullable
    public Expression getDefaultValue() {
      return defaultValue;
    }

    /** Reports whether the parameter has a default value. */
    public boolean isOptional() {
      return defaultValue != null;
    }

    @Override
    public String toString() {
      StringBuilder buf = new StringBuilder(getName());
      if (getAnnotation() != null) {
        buf.append(": ").append(getAnnotation());
      }
      if (defaultValue != null) {
        buf.append(getAnnotation() != null ? " = " : "=").append(defaultValue);
      }
      return buf.toString();
    }
  }

  /**
   * Syntax node for a legacy tuple-unpacking parameter, {@code (a, (b, c))} or {@code (a, b)=x}.
   * Only older grammars of the language produce these.
   */
  public static final class UnpackTuple extends Parameter {
    private final ParamTuple pattern;
    @Nullable private final Expression defaultValue;

    UnpackTuple(Span span, ParamTuple pattern, @Nullable Expression defaultValue) {
      super(span, null, null);
      this.pattern = Preconditions.checkNotNull(pattern);
      this.defaultValue = defaultValue;
    }

    /** Returns the pattern of names the argument is unpacked into. */
    public ParamTuple getPattern() {
      return pattern;
    }

    @Override
    @Nullable
    public Expression getDefaultValue() {
      return defaultValue;
    }

    @Override
    public String toString() {
      return defaultValue == null ? pattern.toString() : pattern + "=" + defaultValue;
    }
  }

  /** Syntax node for a bare {@code *}, which ends the positional parameters. */
  public static final class EndPositional extends Parameter {
    EndPositional(Span span) {
      super(span, null, null);
    }

    @Override
    public String toString() {
      return "*";
    }
  }

  /** Syntax node for a variadic-positional parameter, {@code *args} or {@code *args: T}. */
  public static final class Star extends Parameter {
    Star(Span span, Identifier id, @Nullable Expression annotation) {
      super(span, Preconditions.checkNotNull(id), annotation);
    }

    @Override
    public String toString() {
      return getAnnotation() == null ? "*" + getName() : "*" + getName() + ": " + getAnnotation();
    }
  }

  /** Syntax node for a variadic-keyword parameter, {@code **kwargs} or {@code **kwargs: T}. */
  public static final class StarStar extends Parameter {
    StarStar(Span span, Identifier id, @Nullable Expression annotation) {
      super(span, Preconditions.checkNotNull(id), annotation);
    }

    @Override
    public String toString() {
      return getAnnotation() == null
          ? "**" + getName()
          : "**" + getName() + ": " + getAnnotation();
    }
  }
}
