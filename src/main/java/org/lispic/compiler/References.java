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

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import org.lispic.core.Binding;
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

/** Collects the identifiers referenced by an expression, including inside nested lambdas. */
final class References implements Expr.Visitor<Ident, Void> {

  private final ImmutableSet.Builder<Ident> refs = ImmutableSet.builder();

  private References() {}

  /** Returns every identifier referenced in {@code exprs}, in order of first reference. */
  static ImmutableSet<Ident> of(Collection<Expr<Ident>> exprs) {
    References visitor = new References();
    visitor.visitAll(exprs);
    return visitor.refs.build();
  }

  private void visitAll(Collection<Expr<Ident>> exprs) {
    exprs.forEach(e -> e.accept(this));
  }

  @Override
  public Void visitIdentifier(Identifier<Ident> expr) {
    refs.add(expr.name);
    return null;
  }

  @Override
  public Void visitLet(Let<Ident> expr) {
    for (Binding<Ident> binding : expr.bindings) {
      binding.value.accept(this);
    }
    visitAll(expr.body);
    return null;
  }

  @Override
  public Void visitList(ListExpr<Ident> expr) {
    visitAll(expr.elements);
    return null;
  }

  @Override
  public Void visitCond(Cond<Ident> expr) {
    expr.pred.accept(this);
    expr.then.accept(this);
    if (expr.alt != null) {
      expr.alt.accept(this);
    }
    return null;
  }

  @Override
  public Void visitLambda(Lambda<Ident> expr) {
    visitAll(expr.code.body);
    return null;
  }

  @Override
  public Void visitDefine(Define<Ident> expr) {
    expr.val.accept(this);
    return null;
  }

  @Override
  public Void visitVector(Vector<Ident> expr) {
    visitAll(expr.elements);
    return null;
  }

  @Override
  public Void visitLiteral(LiteralExpr<Ident> expr) {
    return null;
  }
}
