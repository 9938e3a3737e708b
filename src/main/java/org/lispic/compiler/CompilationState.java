/*
 * Copyright 2025 The Lispic Authors
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

package org.lispic.compiler;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The per-compilation-unit constant tables: every distinct string literal and every distinct
 * symbol literal seen by {@link ConstantInterner}, each with the index it was assigned when first
 * seen.
 *
 * <p>Both tables only grow; an index never changes once assigned. A CompilationState belongs to
 * the thread doing the compilation and is not thread-safe.
 */
public final class CompilationState {

  private final Map<String, Integer> strings = new LinkedHashMap<>();
  private final Map<String, Integer> symbols = new LinkedHashMap<>();

  /**
   * Adds {@code s} to the string table if it isn't already present. Returns its index (the number
   * of distinct strings interned before it was first seen).
   */
  @CanIgnoreReturnValue
  public int internString(String s) {
    return intern(strings, s);
  }

  /** Like {@link #internString}, but for the symbol table. */
  @CanIgnoreReturnValue
  public int internSymbol(String name) {
    return intern(symbols, name);
  }

  private static int intern(Map<String, Integer> table, String key) {
    return table.computeIfAbsent(key, k -> table.size());
  }

  /** Returns the index of an interned string, or -1 if it has not been interned. */
  public int stringIndex(String s) {
    return strings.getOrDefault(s, -1);
  }

  /** Returns the index of an interned symbol, or -1 if it has not been interned. */
  public int symbolIndex(String name) {
    return symbols.getOrDefault(name, -1);
  }

  /** Returns the interned strings in index order. */
  public ImmutableList<String> strings() {
    return ImmutableList.copyOf(strings.keySet());
  }

  /** Returns the interned symbols in index order. */
  public ImmutableList<String> symbols() {
    return ImmutableList.copyOf(symbols.keySet());
  }

  @Override
  public String toString() {
    return String.format("strings=%s, symbols=%s", strings.keySet(), symbols.keySet());
  }
}
