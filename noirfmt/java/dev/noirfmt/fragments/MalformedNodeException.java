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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown by a fragment formatter for a node it cannot render. It is never caught by the
 * formatting core; it aborts the whole pass.
 */
public class MalformedNodeException extends RuntimeException {
  public MalformedNodeException(String message) {
    super(message);
  }

  @FormatMethod
  static MalformedNodeException create(String format, Object... args) {
    return new MalformedNodeException(String.format(format, args));
  }
}
