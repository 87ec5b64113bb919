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

package dev.noirfmt.fragments;

import com.google.auto.value.AutoValue;

/** The formatters a declaration delegates its patterns, types, initializers and attributes to. */
@AutoValue
public abstract class FragmentFormatters {
  public static FragmentFormatters create(
      PatternFormatter patterns,
      TypeFormatter types,
      ExpressionFormatter expressions,
      AttributeFormatter attributes) {
    return new AutoValue_FragmentFormatters(patterns, types, expressions, attributes);
  }

  /** Returns the formatters shipped with noirfmt. */
  public static FragmentFormatters standard() {
    return create(
        new StandardPatternFormatter(),
        new StandardTypeFormatter(),
        new StandardExpressionFormatter(),
        new StandardAttributeFormatter());
  }

  public abstract PatternFormatter patterns();

  public abstract TypeFormatter types();

  public abstract ExpressionFormatter expressions();

  public abstract AttributeFormatter attributes();
}
