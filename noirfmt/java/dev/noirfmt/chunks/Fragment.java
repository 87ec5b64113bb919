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

package dev.noirfmt.chunks;

/** A member of a {@link ChunkGroup}: either a {@link Chunk} or a nested {@link ChunkGroup}. */
public interface Fragment {
  /** Width of this fragment laid out on a single line, in code points. */
  int flatWidth();

  /** Returns true if this fragment cannot be laid out on a single line. */
  boolean containsForcedBreak();

  /** Returns true if the last text this fragment renders carries a line comment. */
  boolean endsWithComment();
}
