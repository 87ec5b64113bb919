/*
 * Copyright 2026 The Noirfmt Authors. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.noirfmt.ast;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * Binding pattern of a let or global declaration.
 *
 * <p>The set of shapes is closed; callers dispatch on {@link #getKind()} with an exhaustive switch
 * and then narrow with the matching {@code as*} accessor.
 */
public abstract class Pattern {
  /** Every shape a {@link Pattern} can take. */
  public enum Kind {
    IDENTIFIER,
    MUT_WRAPPED,
    TUPLE,
    STRUCT,
    PARENTHESIZED,
    INTERNED
  }

  Pattern() {}

  public abstract Kind getKind();

  public static Identifier identifier(String name) {
    return identifier(name, false);
  }

  public static Identifier identifier(String name, boolean isMut) {
    return new AutoValue_Pattern_Identifier(name, isMut);
  }

  public static MutWrapped mutWrapped(Pattern inner) {
    return new AutoValue_Pattern_MutWrapped(inner);
  }

  public static Tuple tuple(Iterable<? extends Pattern> elements) {
    return new AutoValue_Pattern_Tuple(ImmutableList.copyOf(elements));
  }

  public static Struct struct(String typePath, Iterable<StructField> fields) {
    return new AutoValue_Pattern_Struct(typePath, ImmutableList.copyOf(fields));
  }

  public static Parenthesized parenthesized(Pattern inner) {
    return new AutoValue_Pattern_Parenthesized(inner);
  }

  public static Interned interned(int id) {
    return new AutoValue_Pattern_Interned(id);
  }

  public Identifier asIdentifier() {
    return cast(Kind.IDENTIFIER, Identifier.class);
  }

  public MutWrapped asMutWrapped() {
    return cast(Kind.MUT_WRAPPED, MutWrapped.class);
  }

  public Tuple asTuple() {
    return cast(Kind.TUPLE, Tuple.class);
  }

  public Struct asStruct() {
    return cast(Kind.STRUCT, Struct.class);
  }

  public Parenthesized asParenthesized() {
    return cast(Kind.PARENTHESIZED, Parenthesized.class);
  }

  public Interned asInterned() {
    return cast(Kind.INTERNED, Interned.class);
  }

  private <T extends Pattern> T cast(Kind kind, Class<T> cls) {
    if (getKind() != kind) {
      throw new IllegalStateException("expected " + kind + " pattern but was " + getKind());
    }
    return cls.cast(this);
  }

  /** A single binding name; {@code isMut} is set for {@code let mut x}. */
  @AutoValue
  public abstract static class Identifier extends Pattern {
    public abstract String name();

    public abstract boolean isMut();

    @Override
    public final Kind getKind() {
      return Kind.IDENTIFIER;
    }
  }

  /**
   * A {@code mut} marker wrapping another pattern. This is also how {@code mut global x} is stored,
   * since globals carry no mutability flag of their own.
   */
  @AutoValue
  public abstract static class MutWrapped extends Pattern {
    public abstract Pattern inner();

    @Override
    public final Kind getKind() {
      return Kind.MUT_WRAPPED;
    }
  }

  @AutoValue
  public abstract static class Tuple extends Pattern {
    public abstract ImmutableList<Pattern> elements();

    @Override
    public final Kind getKind() {
      return Kind.TUPLE;
    }
  }

  /** {@code Foo { a, b: (c, d) }}. */
  @AutoValue
  public abstract static class Struct extends Pattern {
    public abstract String typePath();

    public abstract ImmutableList<StructField> fields();

    @Override
    public final Kind getKind() {
      return Kind.STRUCT;
    }
  }

  @AutoValue
  public abstract static class Parenthesized extends Pattern {
    public abstract Pattern inner();

    @Override
    public final Kind getKind() {
      return Kind.PARENTHESIZED;
    }
  }

  /** A pattern produced by macro expansion, known only by its interner id. */
  @AutoValue
  public abstract static class Interned extends Pattern {
    public abstract int id();

    @Override
    public final Kind getKind() {
      return Kind.INTERNED;
    }
  }

  /** One {@code name: pattern} entry of a {@link Struct} pattern. */
  @AutoValue
  public abstract static class StructField {
    public static StructField create(String name, Pattern pattern) {
      return new AutoValue_Pattern_StructField(name, pattern);
    }

    public abstract String name();

    public abstract Pattern pattern();

    /** Returns true if the field binds a variable of its own name, as in {@code Foo { a }}. */
    public boolean isShorthand() {
      if (pattern().getKind() != Kind.IDENTIFIER) {
        return false;
      }
      Identifier identifier = pattern().asIdentifier();
      return !identifier.isMut() && identifier.name().equals(name());
    }
  }
}
