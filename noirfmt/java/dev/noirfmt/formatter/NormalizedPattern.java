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

package dev.noirfmt.formatter;

import com.google.auto.value.AutoValue;
import dev.noirfmt.ast.Pattern;

/** A pattern with its {@code mut} marker lifted out into a flag. */
@AutoValue
public abstract class NormalizedPattern {
  static NormalizedPattern create(boolean mutable, Pattern canonical) {
    return new AutoValue_NormalizedPattern(mutable, canonical);
  }

  /** Whether the declaration is prefixed with {@code mut}. */
  public abstract boolean mutable();

  /** The pattern to render after the keyword; it carries no {@code mut} of its own. */
  public abstract Pattern canonical();
}
