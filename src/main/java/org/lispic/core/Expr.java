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
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A node in the expression tree, parameterized by the representation of names.
 *
 * <p>The reader produces {@code Expr<String>} (raw names as written); renaming converts that to
 * {@code Expr<Ident>}, which is what the rest of the compiler works with.
 *
 * <p>There is a fixed set of subclasses, one for each kind of node. Passes dispatch on them with a
 * {@link Visitor}, which has a method for every kind so that none can be forgotten.
 *
 * <p>Exprs are immutable and compare structurally; {@link #toString} renders them as
 * s-expressions.
 */
public abstract class Expr<N> {

  // Only the nested subclasses
  private Expr() {}

  /** Calls the visitor method corresponding to this node's kind. */
  public abstract <R> R accept(Visitor<N, R> visitor);

  /**
   * Returns true if this expression needs no further evaluation before being passed as an
   * argument, i.e. it is an Identifier, Literal, or Lambda.
   */
  public boolean isAtomic() {
    return false;
  }

  /** One method for each subclass of Expr. */
  public interface Visitor<N, R> {
    R visitIdentifier(Identifier<N> expr);

    R visitLet(Let<N> expr);

    R visitList(ListExpr<N> expr);

    R visitCond(Cond<N> expr);

    R visitLambda(Lambda<N> expr);

    R visitDefine(Define<N> expr);

    R visitVector(Vector<N> expr);

    R visitLiteral(LiteralExpr<N> expr);
  }

  public static <N> Identifier<N> identifier(N name) {
    return new Identifier<>(name);
  }

  public static <N> Let<N> let(ImmutableList<Binding<N>> bindings, ImmutableList<Expr<N>> body) {
    return new Let<>(bindings, body);
  }

  public static <N> ListExpr<N> list(ImmutableList<Expr<N>> elements) {
    return new ListExpr<>(elements);
  }

  @SafeVarargs
  public static <N> ListExpr<N> list(Expr<N>... elements) {
    return new ListExpr<>(ImmutableList.copyOf(elements));
  }

  public static <N> Cond<N> cond(Expr<N> pred, Expr<N> then, @Nullable Expr<N> alt) {
    return new Cond<>(pred, then, alt);
  }

  public static <N> Lambda<N> lambda(Closure<N> code) {
    return new Lambda<>(code);
  }

  public static <N> Define<N> define(N name, Expr<N> val) {
    return new Define<>(name, val);
  }

  public static <N> Vector<N> vector(ImmutableList<Expr<N>> elements) {
    return new Vector<>(elements);
  }

  public static <N> LiteralExpr<N> literal(Literal value) {
    return new LiteralExpr<>(value);
  }

  public static <N> LiteralExpr<N> nil() {
    return new LiteralExpr<>(Literal.NIL);
  }

  private static String join(ImmutableList<?> items) {
    return items.stream().map(String::valueOf).collect(Collectors.joining(" "));
  }

  /** Renders {@code (head items...)}, omitting the separator if there are no items. */
  private static String form(String head, ImmutableList<?> items) {
    return items.isEmpty() ? "(" + head + ")" : "(" + head + " " + join(items) + ")";
  }

  /** A reference to a variable. */
  public static final class Identifier<N> extends Expr<N> {
    public final N name;

    private Identifier(N name) {
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public <R> R accept(Visitor<N, R> visitor) {
      return visitor.visitIdentifier(this);
    }

    @Override
    public boolean isAtomic() {
      return true;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Identifier<?> other && name.equals(other.name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return String.valueOf(name);
    }
  }

  /** {@code (let ((name value) ...) body...)} */
  public static final class Let<N> extends Expr<N> {
    public final ImmutableList<Binding<N>> bindings;
    public final ImmutableList<Expr<N>> body;

    private Let(ImmutableList<Binding<N>> bindings, ImmutableList<Expr<N>> body) {
      this.bindings = bindings;
      this.body = body;
    }

    @Override
    public <R> R accept(Visitor<N, R> visitor) {
      return visitor.visitLet(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Let<?> other
          && bindings.equals(other.bindings)
          && body.equals(other.body);
    }

    @Override
    public int hashCode() {
      return Objects.hash(bindings, body);
    }

    @Override
    public String toString() {
      return form("let (" + join(bindings) + ")", body);
    }
  }

  /**
   * A function or primitive application; the first element is the thing applied. Lambda lifting
   * also uses a ListExpr to hold a sequence of expressions in a position that expects one.
   */
  public static final class ListExpr<N> extends Expr<N> {
    public final ImmutableList<Expr<N>> elements;

    private ListExpr(ImmutableList<Expr<N>> elements) {
      this.elements = elements;
    }

    @Override
    public <R> R accept(Visitor<N, R> visitor) {
      return visitor.visitList(this);
    }

    /** Returns the first element, or null if this list is empty. */
    public @Nullable Expr<N> head() {
      return elements.isEmpty() ? null : elements.get(0);
    }

    /** Returns all elements after the first. */
    public ImmutableList<Expr<N>> args() {
      return elements.isEmpty() ? elements : elements.subList(1, elements.size());
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof ListExpr<?> other && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
      return elements.hashCode();
    }

    @Override
    public String toString() {
      return "(" + join(elements) + ")";
    }
  }

  /** {@code (if pred then alt)}, where {@code alt} is optional. */
  public static final class Cond<N> extends Expr<N> {
    public final Expr<N> pred;
    public final Expr<N> then;
    public final @Nullable Expr<N> alt;

    private Cond(Expr<N> pred, Expr<N> then, @Nullable Expr<N> alt) {
      this.pred = Preconditions.checkNotNull(pred);
      this.then = Preconditions.checkNotNull(then);
      this.alt = alt;
    }

    @Override
    public <R> R accept(Visitor<N, R> visitor) {
      return visitor.visitCond(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Cond<?> other
          && pred.equals(other.pred)
          && then.equals(other.then)
          && Objects.equals(alt, other.alt);
    }

    @Override
    public int hashCode() {
      return Objects.hash(pred, then, alt);
    }

    @Override
    public String toString() {
      return (alt == null)
          ? String.format("(if %s %s)", pred, then)
          : String.format("(if %s %s %s)", pred, then, alt);
    }
  }

  /** A function value. */
  public static final class Lambda<N> extends Expr<N> {
    public final Closure<N> code;

    private Lambda(Closure<N> code) {
      this.code = Preconditions.checkNotNull(code);
    }

    @Override
    public <R> R accept(Visitor<N, R> visitor) {
      return visitor.visitLambda(this);
    }

    @Override
    public boolean isAtomic() {
      return true;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Lambda<?> other && code.equals(other.code);
    }

    @Override
    public int hashCode() {
      return code.hashCode();
    }

    @Override
    public String toString() {
      return form("lambda (" + join(code.formals) + ")", code.body);
    }
  }

  /** {@code (define name val)}; a lambda-valued define renders as {@code (define (name x) ...)}. */
  public static final class Define<N> extends Expr<N> {
    public final N name;
    public final Expr<N> val;

    private Define(N name, Expr<N> val) {
      this.name = Preconditions.checkNotNull(name);
      this.val = Preconditions.checkNotNull(val);
    }

    @Override
    public <R> R accept(Visitor<N, R> visitor) {
      return visitor.visitDefine(this);
    }

    /** Returns the defined closure, or null if the value is not a lambda. */
    public @Nullable Closure<N> code() {
      return (val instanceof Lambda<N> lambda) ? lambda.code : null;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Define<?> other && name.equals(other.name) && val.equals(other.val);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, val);
    }

    @Override
    public String toString() {
      Closure<N> code = code();
      if (code == null) {
        return String.format("(define %s %s)", name, val);
      }
      return form("define " + form(String.valueOf(name), code.formals), code.body);
    }
  }

  /** A vector constructor, {@code #(elements...)}. */
  public static final class Vector<N> extends Expr<N> {
    public final ImmutableList<Expr<N>> elements;

    private Vector(ImmutableList<Expr<N>> elements) {
      this.elements = elements;
    }

    @Override
    public <R> R accept(Visitor<N, R> visitor) {
      return visitor.visitVector(this);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Vector<?> other && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
      return elements.hashCode();
    }

    @Override
    public String toString() {
      return "#(" + join(elements) + ")";
    }
  }

  /** A constant. */
  public static final class LiteralExpr<N> extends Expr<N> {
    public final Literal value;

    private LiteralExpr(Literal value) {
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public <R> R accept(Visitor<N, R> visitor) {
      return visitor.visitLiteral(this);
    }

    @Override
    public boolean isAtomic() {
      return true;
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof LiteralExpr<?> other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }
}
