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

package org.lispic.core;

import com.google.common.base.Preconditions;
import java.util.Objects;

/** One {@code (name value)} pair of a {@link Expr.Let}. */
public final class Binding<N> {
  public final N name;
  public final Expr<N> value;

  public Binding(N name, Expr<N> value) {
    this.name = Preconditions.checkNotNull(name);
    this.value = Preconditions.checkNotNull(value);
  }

  /** Returns a Binding of the same name to a different value. */
  public Binding<N> withValue(Expr<N> newValue) {
    return (newValue == value) ? this : new Binding<>(name, newValue);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Binding<?> other && name.equals(other.name) && value.equals(other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, value);
  }

  @Override
  public String toString() {
    return "(" + name + " " + value + ")";
  }
}
