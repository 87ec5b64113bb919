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
import java.util.Optional;

/**
 * A let or global binding: {@code #[attr] pub comptime mut global x: Field = 1;}.
 *
 * <p>The keyword is not part of the node; it is supplied by whoever owns the declaration.
 * Comments are kept only as text attached to the fragment they followed.
 */
@AutoValue
public abstract class Declaration {
  public abstract Visibility visibility();

  public abstract boolean comptime();

  public abstract Pattern pattern();

  public abstract Optional<TypeNode> typeAnnotation();

  public abstract Optional<Expression> initializer();

  public abstract ImmutableList<Attribute> attributes();

  /** Whole-line comments directly above the declaration, each including its {@code //}. */
  public abstract ImmutableList<String> leadingComments();

  /** A comment written right after the {@code =}. */
  public abstract Optional<String> assignmentComment();

  /** A comment written after the terminating {@code ;} on the same line. */
  public abstract Optional<String> trailingComment();

  public static Builder builder() {
    return new AutoValue_Declaration.Builder()
        .setVisibility(Visibility.PRIVATE)
        .setComptime(false)
        .setAttributes(ImmutableList.of())
        .setLeadingComments(ImmutableList.of());
  }

  /** Builder for {@link Declaration}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setVisibility(Visibility visibility);

    public abstract Builder setComptime(boolean comptime);

    public abstract Builder setPattern(Pattern pattern);

    public abstract Builder setTypeAnnotation(TypeNode typeAnnotation);

    public abstract Builder setInitializer(Expression initializer);

    public abstract Builder setAttributes(Iterable<Attribute> attributes);

    public abstract Builder setLeadingComments(Iterable<String> leadingComments);

    public abstract Builder setAssignmentComment(String assignmentComment);

    public abstract Builder setTrailingComment(String trailingComment);

    public abstract Declaration build();
  }
}
