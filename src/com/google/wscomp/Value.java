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

package com.google.wscomp;

/** A literal value produced by constant folding. */
public interface Value {

  /** A folded boolean. */
  record BooleanValue(boolean value) implements Value {
    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  /** A folded number. */
  record NumberValue(double value) implements Value {
    @Override
    public String toString() {
      return CodeGenerator.formatNumber(value);
    }
  }

  static Value of(boolean value) {
    return new BooleanValue(value);
  }

  static Value of(double value) {
    return new NumberValue(value);
  }
}
