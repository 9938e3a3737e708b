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
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.lispic.core.Binding;
import org.lispic.core.Closure;
import org.lispic.core.Expr;
import org.lispic.core.Expr.Cond;
import org.lispic.core.Expr.Define;
import org.lispic.core.Expr.Identifier;
import org.lispic.core.Expr.Lambda;
import org.lispic.core.Expr.Let;
import org.lispic.core.Expr.ListExpr;
import org.lispic.core.Expr.LiteralExpr;
import org.lispic.core.Expr.Vector;
import org.lispic.core.Ident;

/**
 * Lifts every function to a top-level {@code define}.
 *
 * <p>After renaming every lambda bound by a let already has a unique name, so a let binding {@code
 * (f (lambda ...))} can simply be replaced by a top-level {@code (define (f ...) ...)}, leaving a
 * let of the remaining bindings. Definitions lifted from inside an expression are emitted before
 * it, innermost first, so a single top-to-bottom pass over the result sees every function defined
 * before it is used.
 *
 * <p>Each lifted closure's {@code free} list is extended with the local variables of enclosing
 * scopes that its body refers to. Capture is not transitive: if a lifted function calls another
 * lifted function, it does not inherit the callee's captured variables, so a caller that isn't
 * itself in the callee's scope must pass them explicitly.
 *
 * <p>A lambda that is neither the value of a define nor of a let binding has no name to be lifted
 * under; the reader rejects those, so encountering one here is an internal error.
 *
 * <p>See http://matt.might.net/articles/closure-conversion
 */
public final class Lifter {

  /** Definitions lifted out of nested positions, in the order they must appear. */
  private final List<Expr<Ident>> hoisted = new ArrayList<>();

  private Lifter() {}

  /**
   * Lifts all lambdas in a top-level form. Returns the lifted definitions followed by what is left
   * of {@code expr} (if anything).
   */
  public static ImmutableList<Expr<Ident>> lift(Expr<Ident> expr) {
    Lifter lifter = new Lifter();
    ImmutableList<Expr<Ident>> items = lifter.liftItem(expr, ImmutableSet.of());
    return ImmutableList.<Expr<Ident>>builder().addAll(lifter.hoisted).addAll(items).build();
  }

  /**
   * Collapses a sequence of expressions into one: nil if there are none, the expression itself if
   * there is one, or a list of them.
   */
  static Expr<Ident> shrink(List<Expr<Ident>> exprs) {
    switch (exprs.size()) {
      case 0:
        return Expr.nil();
      case 1:
        return exprs.get(0);
      default:
        return Expr.list(ImmutableList.copyOf(exprs));
    }
  }

  /** Returns true if {@code expr} is a define of a lambda. */
  static boolean isFunctionDefinition(Expr<Ident> expr) {
    return expr instanceof Define<Ident> define && define.code() != null;
  }

  /**
   * Lifts {@code expr}, returning the function definitions it was split into followed by its
   * residue.
   *
   * @param locals the variables bound by enclosing local scopes, which lifted functions must
   *     capture if they refer to them
   */
  private ImmutableList<Expr<Ident>> liftItem(Expr<Ident> expr, ImmutableSet<Ident> locals) {
    return expr.accept(new ItemVisitor(locals));
  }

  /**
   * Lifts an expression that must remain a single expression: any function definitions it produces
   * are added to {@link #hoisted}, and the rest is collapsed with {@link #shrink}.
   */
  private Expr<Ident> liftNested(Expr<Ident> expr, ImmutableSet<Ident> locals) {
    List<Expr<Ident>> rest = new ArrayList<>();
    for (Expr<Ident> item : liftItem(expr, locals)) {
      if (isFunctionDefinition(item)) {
        hoisted.add(item);
      } else {
        rest.add(item);
      }
    }
    return shrink(rest);
  }

  private ImmutableList<Expr<Ident>> liftNestedAll(
      ImmutableList<Expr<Ident>> exprs, ImmutableSet<Ident> locals) {
    return exprs.stream().map(e -> liftNested(e, locals)).collect(ImmutableList.toImmutableList());
  }

  /**
   * Returns the definition of function {@code name}, with its body lifted and its captured
   * variables added to {@code free}.
   */
  private Define<Ident> liftFunction(Ident name, Closure<Ident> code, ImmutableSet<Ident> locals) {
    ImmutableSet<Ident> bodyLocals =
        ImmutableSet.<Ident>builder()
            .addAll(locals)
            .addAll(code.formals)
            .addAll(localDefinitions(code.body))
            .build();
    Set<Ident> free = new LinkedHashSet<>(code.free);
    if (!locals.isEmpty()) {
      Set<Ident> formals = ImmutableSet.copyOf(code.formals);
      for (Ident ref : References.of(code.body)) {
        if (locals.contains(ref) && !formals.contains(ref)) {
          free.add(ref);
        }
      }
    }
    Closure<Ident> lifted =
        code.withBody(liftNestedAll(code.body, bodyLocals)).withFree(ImmutableList.copyOf(free));
    return Expr.define(name, Expr.lambda(lifted));
  }

  /** Returns the names of the non-function defines that appear directly in {@code body}. */
  private static ImmutableList<Ident> localDefinitions(ImmutableList<Expr<Ident>> body) {
    return body.stream()
        .filter(e -> e instanceof Define && !isFunctionDefinition(e))
        .map(e -> ((Define<Ident>) e).name)
        .collect(ImmutableList.toImmutableList());
  }

  private class ItemVisitor implements Expr.Visitor<Ident, ImmutableList<Expr<Ident>>> {
    final ImmutableSet<Ident> locals;

    ItemVisitor(ImmutableSet<Ident> locals) {
      this.locals = locals;
    }

    @Override
    public ImmutableList<Expr<Ident>> visitIdentifier(Identifier<Ident> expr) {
      return ImmutableList.of(expr);
    }

    @Override
    public ImmutableList<Expr<Ident>> visitLet(Let<Ident> expr) {
      ImmutableSet.Builder<Ident> innerLocals = ImmutableSet.<Ident>builder().addAll(locals);
      for (Binding<Ident> binding : expr.bindings) {
        if (!(binding.value instanceof Lambda)) {
          innerLocals.add(binding.name);
        }
      }
      innerLocals.addAll(localDefinitions(expr.body));
      ImmutableSet<Ident> scope = innerLocals.build();

      ImmutableList.Builder<Expr<Ident>> result = ImmutableList.builder();
      ImmutableList.Builder<Binding<Ident>> rest = ImmutableList.builder();
      for (Binding<Ident> binding : expr.bindings) {
        if (binding.value instanceof Lambda<Ident> lambda) {
          result.add(liftFunction(binding.name, lambda.code, scope));
        } else {
          rest.add(binding.withValue(liftNested(binding.value, scope)));
        }
      }
      result.add(Expr.let(rest.build(), liftNestedAll(expr.body, scope)));
      return result.build();
    }

    @Override
    public ImmutableList<Expr<Ident>> visitList(ListExpr<Ident> expr) {
      return ImmutableList.of(Expr.list(liftNestedAll(expr.elements, locals)));
    }

    @Override
    public ImmutableList<Expr<Ident>> visitCond(Cond<Ident> expr) {
      return ImmutableList.of(
          Expr.cond(
              liftNested(expr.pred, locals),
              liftNested(expr.then, locals),
              (expr.alt == null) ? null : liftNested(expr.alt, locals)));
    }

    @Override
    public ImmutableList<Expr<Ident>> visitLambda(Lambda<Ident> expr) {
      throw new AssertionError("Unnamed lambda reached lambda lifting: " + expr);
    }

    @Override
    public ImmutableList<Expr<Ident>> visitDefine(Define<Ident> expr) {
      if (expr.val instanceof Lambda<Ident> lambda) {
        return ImmutableList.of(liftFunction(expr.name, lambda.code, locals));
      }
      return ImmutableList.of(Expr.define(expr.name, liftNested(expr.val, locals)));
    }

    @Override
    public ImmutableList<Expr<Ident>> visitVector(Vector<Ident> expr) {
      return ImmutableList.of(Expr.vector(liftNestedAll(expr.elements, locals)));
    }

    @Override
    public ImmutableList<Expr<Ident>> visitLiteral(LiteralExpr<Ident> expr) {
      return ImmutableList.of(expr);
    }
  }
}
