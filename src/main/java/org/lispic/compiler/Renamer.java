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
import com.google.common.collect.ImmutableMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.apache.log4j.Logger;
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
import org.lispic.core.Expr.LiteralExpr;
import org.lispic.core.Expr.Vector;
import org.lispic.core.Ident;
import org.lispic.util.Logging;

/**
 * Replaces each name in a program with an {@link Ident} that is unique to its binding site.
 *
 * <ul>
 *   <li>A top-level {@code (define pi 3.14)} is named {@code pi}.
 *   <li>The formals of a function are qualified by the function's name: {@code f::x}.
 *   <li>The bindings of a {@code let} are qualified by an indexed segment for the let: {@code {let
 *       0}::a}; a let nested in the body of another gets the next index, {@code {let 0}::{let
 *       1}::b}.
 *   <li>A name that is not bound anywhere in scope is left as written and treated as a global.
 * </ul>
 *
 * <p>The value of a let binding sees all of its sibling bindings if it is itself a {@code lambda}
 * or a {@code let} (so that functions bound by one let can call each other), but sees every sibling
 * <i>except itself</i> otherwise. This is what distinguishes {@code (let ((x 1) (y x)) ...)}, where
 * the second {@code x} refers to an outer {@code x}, from a recursive function binding.
 *
 * <p>A Renamer remembers the let scopes it has allocated, so that sibling lets (which would
 * otherwise get the same index) are given distinct names; use one Renamer for all the top-level
 * forms of a program.
 */
public final class Renamer {

  private static final Logger logger = Logging.getLogger();

  /** Returns true for the raw names that may be referenced without a lexical binding. */
  private final @Nullable Predicate<String> knownGlobal;

  /** Every let scope allocated so far. */
  private final Set<Ident> letScopes = new HashSet<>();

  /** Returns a Renamer that treats every unresolved name as a global reference. */
  public Renamer() {
    this.knownGlobal = null;
  }

  /**
   * Returns a strict Renamer: an unresolved name that doesn't satisfy {@code knownGlobal} is
   * reported as a CompileError.
   */
  public Renamer(Predicate<String> knownGlobal) {
    this.knownGlobal = knownGlobal;
  }

  /** Renames a top-level form. */
  public Expr<Ident> rename(Expr<String> expr) {
    return rename(ImmutableMap.of(), Ident.empty(), 0, expr);
  }

  /**
   * Renames {@code expr}.
   *
   * @param env the Idents of the names visible at this point
   * @param base the prefix for any names bound by {@code expr}
   * @param index the index for a let at this point
   */
  public Expr<Ident> rename(Map<String, Ident> env, Ident base, int index, Expr<String> expr) {
    return expr.accept(new Context(env, base, index));
  }

  /**
   * Returns the path for a new let scope under {@code base}, using the first unused index that is
   * at least {@code index}.
   */
  private Ident allocateLetScope(Ident base, int index) {
    for (int i = index; ; i++) {
      Ident scope = base.extend("{let " + i + "}");
      if (letScopes.add(scope)) {
        return scope;
      }
    }
  }

  private Expr<Ident> unresolved(String name) {
    if (knownGlobal != null && !knownGlobal.test(name)) {
      throw CompileError.of("Unbound identifier '%s'", name);
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Unresolved identifier '" + name + "' treated as global");
    }
    return Expr.identifier(Ident.of(name));
  }

  /**
   * Returns a Context for renaming the body of a let or lambda. Each {@code define} directly in
   * the body is named {@code base::name} and is visible to every expression of the body.
   *
   * @param bound the names already bound at {@code base} (the let's bindings or the lambda's
   *     formals); a define may not reuse one of them, since it would get the same Ident
   */
  private Context bodyContext(
      Map<String, Ident> env,
      Ident base,
      int index,
      ImmutableList<Expr<String>> body,
      Set<String> bound) {
    Map<String, Ident> inner = env;
    for (Expr<String> expr : body) {
      if (expr instanceof Define<String> define) {
        if (!bound.add(define.name)) {
          throw CompileError.of("Duplicate definition '%s'", define.name);
        }
        if (inner == env) {
          inner = new HashMap<>(env);
        }
        inner.put(define.name, base.extend(define.name));
      }
    }
    return new Context(inner, base, index);
  }

  /** Renames the nodes of one scope; a new Context is created for each nested scope. */
  private class Context implements Expr.Visitor<String, Expr<Ident>> {
    final Map<String, Ident> env;
    final Ident base;
    final int index;

    Context(Map<String, Ident> env, Ident base, int index) {
      this.env = env;
      this.base = base;
      this.index = index;
    }

    ImmutableList<Expr<Ident>> renameAll(ImmutableList<Expr<String>> exprs) {
      return exprs.stream().map(e -> e.accept(this)).collect(ImmutableList.toImmutableList());
    }

    @Override
    public Expr<Ident> visitIdentifier(Identifier<String> expr) {
      Ident ident = env.get(expr.name);
      return (ident != null) ? Expr.identifier(ident) : unresolved(expr.name);
    }

    @Override
    public Expr<Ident> visitLet(Let<String> expr) {
      Ident letBase = allocateLetScope(base, index);
      Map<String, Ident> all = new HashMap<>(env);
      for (Binding<String> binding : expr.bindings) {
        all.put(binding.name, letBase.extend(binding.name));
      }
      Context inner =
          bodyContext(
              all,
              letBase,
              index + 1,
              expr.body,
              expr.bindings.stream()
                  .map(b -> b.name)
                  .collect(Collectors.toCollection(HashSet::new)));
      ImmutableList<Binding<Ident>> bindings =
          expr.bindings.stream()
              .map(b -> new Binding<>(all.get(b.name), renameBinding(b, letBase, all)))
              .collect(ImmutableList.toImmutableList());
      return Expr.let(bindings, inner.renameAll(expr.body));
    }

    /**
     * Renames the value of a let binding. A lambda or let sees every binding in {@code all}; any
     * other value sees all of them but the one being bound.
     */
    private Expr<Ident> renameBinding(
        Binding<String> binding, Ident letBase, Map<String, Ident> all) {
      Expr<String> value = binding.value;
      if (value instanceof Lambda) {
        return rename(all, letBase.extend(binding.name), index + 1, value);
      } else if (value instanceof Let) {
        return rename(all, letBase, index + 1, value);
      }
      Map<String, Ident> rest = new HashMap<>(all);
      Ident outer = env.get(binding.name);
      if (outer != null) {
        rest.put(binding.name, outer);
      } else {
        rest.remove(binding.name);
      }
      return rename(rest, letBase, index + 1, value);
    }

    @Override
    public Expr<Ident> visitList(ListExpr<String> expr) {
      return Expr.list(renameAll(expr.elements));
    }

    @Override
    public Expr<Ident> visitCond(Cond<String> expr) {
      return Expr.cond(
          expr.pred.accept(this),
          expr.then.accept(this),
          (expr.alt == null) ? null : expr.alt.accept(this));
    }

    @Override
    public Expr<Ident> visitLambda(Lambda<String> expr) {
      Closure<String> code = expr.code;
      Map<String, Ident> inner = new HashMap<>(env);
      for (String formal : code.formals) {
        inner.put(formal, base.extend(formal));
      }
      Context body = bodyContext(inner, base, 0, code.body, new HashSet<>(code.formals));
      return Expr.lambda(
          new Closure<>(
              qualify(code.formals), qualify(code.free), body.renameAll(code.body), code.tail));
    }

    private ImmutableList<Ident> qualify(ImmutableList<String> names) {
      return names.stream().map(base::extend).collect(ImmutableList.toImmutableList());
    }

    @Override
    public Expr<Ident> visitDefine(Define<String> expr) {
      Ident name = base.extend(expr.name);
      Map<String, Ident> inner = new HashMap<>(env);
      inner.put(expr.name, name);
      return Expr.define(name, rename(inner, name, 0, expr.val));
    }

    @Override
    public Expr<Ident> visitVector(Vector<String> expr) {
      return Expr.vector(renameAll(expr.elements));
    }

    @Override
    public Expr<Ident> visitLiteral(LiteralExpr<String> expr) {
      return Expr.literal(expr.value);
    }
  }
}
