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
import com.google.common.collect.Iterables;
import org.jspecify.annotations.Nullable;
import org.lispic.core.Binding;
import org.lispic.core.Closure;
import org.lispic.core.Expr;
import org.lispic.core.Expr.Cond;
import org.lispic.core.Expr.Define;
import org.lispic.core.Expr.Identifier;
import org.lispic.core.Expr.Lambda;
import org.lispic.core.Expr.Let;
import org.lispic.core.Expr.ListExpr;
import org.lispic.core.Ident;

/**
 * Sets the {@link Closure#tail} flag of functions whose body ends with a call to themselves.
 *
 * <p>Only functions defined by a {@code define} or a let binding are annotated, and only direct
 * self-recursion is detected; two functions that tail-call each other are not marked.
 */
public final class TailCalls {

  private TailCalls() {}

  /** Returns {@code expr} with the tail flag of each function it defines set. */
  public static Expr<Ident> annotate(Expr<Ident> expr) {
    if (expr instanceof Define<Ident> define) {
      if (define.val instanceof Lambda<Ident> lambda) {
        return Expr.define(define.name, annotate(define.name, lambda.code));
      }
    } else if (expr instanceof Let<Ident> let) {
      ImmutableList<Binding<Ident>> bindings =
          let.bindings.stream()
              .map(
                  b ->
                      (b.value instanceof Lambda<Ident> lambda)
                          ? b.withValue(annotate(b.name, lambda.code))
                          : b)
              .collect(ImmutableList.toImmutableList());
      return Expr.let(bindings, let.body);
    }
    return expr;
  }

  private static Expr<Ident> annotate(Ident name, Closure<Ident> code) {
    return Expr.lambda(code.withTail(isSelfTailCall(name, code)));
  }

  /**
   * Returns true if the expression in tail position of {@code code}'s body is a call whose head is
   * {@code name}.
   */
  static boolean isSelfTailCall(Ident name, Closure<Ident> code) {
    Expr<Ident> last = code.body.isEmpty() ? null : tail(Iterables.getLast(code.body));
    return last instanceof ListExpr<Ident> call
        && call.head() instanceof Identifier<Ident> head
        && head.name.equals(name);
  }

  /**
   * Returns the expression in tail position of {@code expr}, or null if there is none.
   *
   * <ul>
   *   <li>The tail position of a let is the tail position of the last expression in its body.
   *   <li>The tail position of a conditional is the tail position of its else branch, and there is
   *       none if it has no else branch. The then branch is never examined.
   *   <li>Any other expression is its own tail position.
   * </ul>
   */
  static @Nullable Expr<Ident> tail(Expr<Ident> expr) {
    if (expr instanceof Let<Ident> let) {
      return let.body.isEmpty() ? null : tail(Iterables.getLast(let.body));
    } else if (expr instanceof Cond<Ident> cond) {
      // TODO: the then branch is also in tail position; marking calls there needs the code
      // generator to handle a tail call in either branch.
      return (cond.alt == null) ? null : tail(cond.alt);
    }
    return expr;
  }
}
