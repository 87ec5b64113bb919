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

/** Item visibility of a declaration. */
public enum Visibility {
  PRIVATE(""),
  PUBLIC("pub"),
  PUBLIC_CRATE("pub(crate)");

  private final String keyword;

  Visibility(String keyword) {
    this.keyword = keyword;
  }

  /** Returns the source text of this visibility, empty for {@link #PRIVATE}. */
  public String getKeyword() {
    return keyword;
  }
}
