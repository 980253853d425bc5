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

import static com.google.common.base.Preconditions.checkNotNull;

import java.text.MessageFormat;

/**
 * A kind of diagnostic the compiler reports, identified by its key. Two types with the same key are
 * equal; diagnostics sort by key after their source position.
 */
public final class DiagnosticType implements Comparable<DiagnosticType> {

  /** Stable identifier such as {@code WSC_UNREACHABLE_CODE}, printed in brackets. */
  public final String key;

  /** java.text.MessageFormat pattern for the description. */
  public final String format;

  /** Level used unless {@link CompilerOptions} override it. */
  public final CheckLevel level;

  public static DiagnosticType error(String key, String format) {
    return new DiagnosticType(key, CheckLevel.ERROR, format);
  }

  public static DiagnosticType warning(String key, String format) {
    return new DiagnosticType(key, CheckLevel.WARNING, format);
  }

  private DiagnosticType(String key, CheckLevel level, String format) {
    this.key = checkNotNull(key);
    this.level = checkNotNull(level);
    this.format = checkNotNull(format);
  }

  /** Fills {@code arguments} into the description pattern. */
  String format(String... arguments) {
    return MessageFormat.format(format, (Object[]) arguments);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof DiagnosticType && key.equals(((DiagnosticType) other).key);
  }

  @Override
  public int hashCode() {
    return key.hashCode();
  }

  @Override
  public int compareTo(DiagnosticType other) {
    return key.compareTo(other.key);
  }

  @Override
  public String toString() {
    return key + ": " + format;
  }
}
