/*
 * Copyright 2026 The Closure Compiler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.wscomp.ast;

import static com.google.common.base.Preconditions.checkArgument;

/** A half-open range of character offsets in a source file. */
public record Span(int start, int end) {
  /** Span attached to synthetic code that has no source position. */
  public static final Span NONE = new Span(-1, -1);

  public Span {
    checkArgument(start <= end, "span start %s after end %s", start, end);
  }

  public boolean isKnown() {
    return start >= 0;
  }

  @Override
  public String toString() {
    return start + ".." + end;
  }
}
