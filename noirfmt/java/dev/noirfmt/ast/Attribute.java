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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.util.Optional;

/** A secondary attribute such as {@code #[abi(foo)]}, kept as the tokens between the brackets. */
@AutoValue
public abstract class Attribute {
  public static Attribute create(Iterable<String> tokens) {
    return create(tokens, Optional.empty());
  }

  public static Attribute create(Iterable<String> tokens, Optional<String> trailingComment) {
    ImmutableList<String> copy = ImmutableList.copyOf(tokens);
    checkArgument(!copy.isEmpty(), "attribute has no content");
    return new AutoValue_Attribute(copy, trailingComment);
  }

  public abstract ImmutableList<String> tokens();

  /** A line comment written after the attribute on the same line, including its {@code //}. */
  public abstract Optional<String> trailingComment();

  public String name() {
    return tokens().get(0);
  }
}
