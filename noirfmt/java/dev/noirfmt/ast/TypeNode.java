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

/** Type annotation of a declaration. */
public abstract class TypeNode {
  /** Every shape a {@link TypeNode} can take. */
  public enum Kind {
    NAMED,
    ARRAY,
    SLICE,
    TUPLE,
    REFERENCE
  }

  TypeNode() {}

  public abstract Kind getKind();

  public static Named named(String path) {
    return named(path, ImmutableList.of());
  }

  public static Named named(String path, Iterable<? extends TypeNode> genericArguments) {
    return new AutoValue_TypeNode_Named(path, ImmutableList.copyOf(genericArguments));
  }

  public static Array array(TypeNode element, String length) {
    return new AutoValue_TypeNode_Array(element, length);
  }

  public static Slice slice(TypeNode element) {
    return new AutoValue_TypeNode_Slice(element);
  }

  public static Tuple tuple(Iterable<? extends TypeNode> elements) {
    return new AutoValue_TypeNode_Tuple(ImmutableList.copyOf(elements));
  }

  public static Reference reference(boolean isMut, TypeNode element) {
    return new AutoValue_TypeNode_Reference(isMut, element);
  }

  /**
   * A path with optional generic arguments: {@code Field}, {@code std::option::Option<u8>}, or a
   * numeric generic such as the {@code 3} in {@code str<3>}.
   */
  @AutoValue
  public abstract static class Named extends TypeNode {
    public abstract String path();

    public abstract ImmutableList<TypeNode> genericArguments();

    @Override
    public final Kind getKind() {
      return Kind.NAMED;
    }
  }

  /** {@code [element; length]}; the length is a literal or a generic name. */
  @AutoValue
  public abstract static class Array extends TypeNode {
    public abstract TypeNode element();

    public abstract String length();

    @Override
    public final Kind getKind() {
      return Kind.ARRAY;
    }
  }

  @AutoValue
  public abstract static class Slice extends TypeNode {
    public abstract TypeNode element();

    @Override
    public final Kind getKind() {
      return Kind.SLICE;
    }
  }

  @AutoValue
  public abstract static class Tuple extends TypeNode {
    public abstract ImmutableList<TypeNode> elements();

    @Override
    public final Kind getKind() {
      return Kind.TUPLE;
    }
  }

  @AutoValue
  public abstract static class Reference extends TypeNode {
    public abstract boolean isMut();

    public abstract TypeNode element();

    @Override
    public final Kind getKind() {
      return Kind.REFERENCE;
    }
  }
}
