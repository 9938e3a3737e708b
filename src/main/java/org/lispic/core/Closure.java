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

import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * The code of a function value.
 *
 * <ul>
 *   <li>{@code formals} are the parameter names, in order.
 *   <li>{@code free} are the variables captured from enclosing scopes; the reader leaves this
 *       empty and lambda lifting fills it in.
 *   <li>{@code tail} is true if the body ends with a call to the function itself; it is only
 *       computed by tail-call annotation, and is false before then.
 * </ul>
 */
public final class Closure<N> {
  public final ImmutableList<N> formals;
  public final ImmutableList<N> free;
  public final ImmutableList<Expr<N>> body;
  public final boolean tail;

  public Closure(
      ImmutableList<N> formals, ImmutableList<N> free, ImmutableList<Expr<N>> body, boolean tail) {
    this.formals = formals;
    this.free = free;
    this.body = body;
    this.tail = tail;
  }

  /** Returns a new Closure with the given formals and body, no free variables, and no tail flag. */
  public static <N> Closure<N> of(ImmutableList<N> formals, ImmutableList<Expr<N>> body) {
    return new Closure<>(formals, ImmutableList.of(), body, false);
  }

  public Closure<N> withBody(ImmutableList<Expr<N>> newBody) {
    return new Closure<>(formals, free, newBody, tail);
  }

  public Closure<N> withFree(ImmutableList<N> newFree) {
    return new Closure<>(formals, newFree, body, tail);
  }

  public Closure<N> withTail(boolean newTail) {
    return (newTail == tail) ? this : new Closure<>(formals, free, body, newTail);
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Closure<?> other
        && tail == other.tail
        && formals.equals(other.formals)
        && free.equals(other.free)
        && body.equals(other.body);
  }

  @Override
  public int hashCode() {
    return Objects.hash(formals, free, body, tail);
  }
}
