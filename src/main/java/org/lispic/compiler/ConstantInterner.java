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
import org.apache.log4j.Logger;
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
import org.lispic.core.Literal;
import org.lispic.util.Logging;

/**
 * Adds every string and symbol literal in an expression to the constant tables of a {@link
 * CompilationState}, in the order they are encountered. The expression itself is returned
 * unchanged.
 */
public final class ConstantInterner implements Expr.Visitor<Ident, Void> {

  private static final Logger logger = Logging.getLogger();

  private final CompilationState state;

  private ConstantInterner(CompilationState state) {
    this.state = state;
  }

  /** Interns the literals of {@code expr} into {@code state} and returns {@code expr}. */
  public static Expr<Ident> intern(CompilationState state, Expr<Ident> expr) {
    expr.accept(new ConstantInterner(state));
    return expr;
  }

  private void visitAll(ImmutableList<Expr<Ident>> exprs) {
    exprs.forEach(e -> e.accept(this));
  }

  @Override
  public Void visitLiteral(LiteralExpr<Ident> expr) {
    Literal literal = expr.value;
    int index;
    switch (literal.kind) {
      case STRING:
        index = state.internString(literal.text());
        break;
      case SYMBOL:
        index = state.internSymbol(literal.text());
        break;
      default:
        return null;
    }
    if (logger.isTraceEnabled()) {
      logger.trace("Constant " + literal + " has index " + index);
    }
    return null;
  }

  @Override
  public Void visitIdentifier(Identifier<Ident> expr) {
    return null;
  }

  @Override
  public Void visitLet(Let<Ident> expr) {
    expr.bindings.forEach(b -> b.value.accept(this));
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
}
