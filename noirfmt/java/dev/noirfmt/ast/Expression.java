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

/** Initializer expression of a declaration. Only the shapes a declaration needs are modeled. */
public abstract class Expression {
  /** Every shape an {@link Expression} can take. */
  public enum Kind {
    LITERAL,
    PATH,
    CALL,
    ARRAY,
    REPEATED_ARRAY,
    TUPLE,
    PARENTHESIZED,
    UNARY,
    BINARY,
    MEMBER,
    INDEX
  }

  Expression() {}

  public abstract Kind getKind();

  /** Integer, string and boolean literals, kept as written. */
  public static Literal literal(String text) {
    return new AutoValue_Expression_Literal(text);
  }

  public static Path path(String text) {
    return new AutoValue_Expression_Path(text);
  }

  public static Call call(Expression callee, Iterable<? extends Expression> arguments) {
    return new AutoValue_Expression_Call(callee, ImmutableList.copyOf(arguments));
  }

  public static ArrayLiteral array(Iterable<? extends Expression> elements) {
    return new AutoValue_Expression_ArrayLiteral(ImmutableList.copyOf(elements));
  }

  public static RepeatedArray repeatedArray(Expression element, Expression length) {
    return new AutoValue_Expression_RepeatedArray(element, length);
  }

  public static Tuple tuple(Iterable<? extends Expression> elements) {
    return new AutoValue_Expression_Tuple(ImmutableList.copyOf(elements));
  }

  public static Parenthesized parenthesized(Expression inner) {
    return new AutoValue_Expression_Parenthesized(inner);
  }

  public static Unary unary(String operator, Expression operand) {
    return new AutoValue_Expression_Unary(operator, operand);
  }

  public static Binary binary(Expression lhs, String operator, Expression rhs) {
    return new AutoValue_Expression_Binary(lhs, operator, rhs);
  }

  public static Member member(Expression base, String name) {
    return new AutoValue_Expression_Member(base, name);
  }

  public static Index index(Expression base, Expression index) {
    return new AutoValue_Expression_Index(base, index);
  }

  @AutoValue
  public abstract static class Literal extends Expression {
    public abstract String text();

    @Override
    public final Kind getKind() {
      return Kind.LITERAL;
    }
  }

  /** A possibly qualified name such as {@code x} or {@code std::hash::pedersen}. */
  @AutoValue
  public abstract static class Path extends Expression {
    public abstract String text();

    @Override
    public final Kind getKind() {
      return Kind.PATH;
    }
  }

  @AutoValue
  public abstract static class Call extends Expression {
    public abstract Expression callee();

    public abstract ImmutableList<Expression> arguments();

    @Override
    public final Kind getKind() {
      return Kind.CALL;
    }
  }

  @AutoValue
  public abstract static class ArrayLiteral extends Expression {
    public abstract ImmutableList<Expression> elements();

    @Override
    public final Kind getKind() {
      return Kind.ARRAY;
    }
  }

  /** {@code [element; length]}. */
  @AutoValue
  public abstract static class RepeatedArray extends Expression {
    public abstract Expression element();

    public abstract Expression length();

    @Override
    public final Kind getKind() {
      return Kind.REPEATED_ARRAY;
    }
  }

  @AutoValue
  public abstract static class Tuple extends Expression {
    public abstract ImmutableList<Expression> elements();

    @Override
    public final Kind getKind() {
      return Kind.TUPLE;
    }
  }

  @AutoValue
  public abstract static class Parenthesized extends Expression {
    public abstract Expression inner();

    @Override
    public final Kind getKind() {
      return Kind.PARENTHESIZED;
    }
  }

  @AutoValue
  public abstract static class Unary extends Expression {
    public abstract String operator();

    public abstract Expression operand();

    @Override
    public final Kind getKind() {
      return Kind.UNARY;
    }
  }

  @AutoValue
  public abstract static class Binary extends Expression {
    public abstract Expression lhs();

    public abstract String operator();

    public abstract Expression rhs();

    @Override
    public final Kind getKind() {
      return Kind.BINARY;
    }
  }

  /** Field access {@code base.name}. */
  @AutoValue
  public abstract static class Member extends Expression {
    public abstract Expression base();

    public abstract String name();

    @Override
    public final Kind getKind() {
      return Kind.MEMBER;
    }
  }

  @AutoValue
  public abstract static class Index extends Expression {
    public abstract Expression base();

    public abstract Expression index();

    @Override
    public final Kind getKind() {
      return Kind.INDEX;
    }
  }
}
