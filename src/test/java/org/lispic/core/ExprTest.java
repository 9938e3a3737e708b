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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ExprTest {

  private static Expr<String> id(String name) {
    return Expr.identifier(name);
  }

  private static Expr<String> num(long n) {
    return Expr.literal(Literal.number(n));
  }

  @Test
  public void rendering() {
    Expr<String> call = Expr.list(id("+"), id("x"), num(1));
    assertThat(call.toString()).isEqualTo("(+ x 1)");
    assertThat(Expr.let(ImmutableList.of(new Binding<>("x", num(2))), ImmutableList.of(call)))
        .hasToString("(let ((x 2)) (+ x 1))");
    assertThat(Expr.let(ImmutableList.<Binding<String>>of(), ImmutableList.of(call)))
        .hasToString("(let () (+ x 1))");
    assertThat(Expr.cond(id("p"), num(1), null)).hasToString("(if p 1)");
    assertThat(Expr.cond(id("p"), num(1), num(2))).hasToString("(if p 1 2)");
    Closure<String> inc = Closure.of(ImmutableList.of("x"), ImmutableList.of(call));
    assertThat(Expr.lambda(inc)).hasToString("(lambda (x) (+ x 1))");
    assertThat(Expr.define("inc", Expr.lambda(inc))).hasToString("(define (inc x) (+ x 1))");
    Closure<String> thunk = Closure.of(ImmutableList.of(), ImmutableList.of(num(7)));
    assertThat(Expr.define("seven", Expr.lambda(thunk))).hasToString("(define (seven) 7)");
    assertThat(Expr.define("pi", num(3))).hasToString("(define pi 3)");
    assertThat(Expr.vector(ImmutableList.of(num(1), id("y")))).hasToString("#(1 y)");
  }

  @Test
  public void literals() {
    assertThat(Literal.number(-12).toString()).isEqualTo("-12");
    assertThat(Literal.string("say \"hi\"\n").toString()).isEqualTo("\"say \\\"hi\\\"\\n\"");
    assertThat(Literal.symbol("foo").toString()).isEqualTo("'foo");
    assertThat(Literal.bool(true).toString()).isEqualTo("#t");
    assertThat(Literal.bool(false).toString()).isEqualTo("#f");
    assertThat(Literal.NIL.toString()).isEqualTo("nil");
    // Strings and symbols with the same text are different literals
    assertThat(Literal.string("a")).isNotEqualTo(Literal.symbol("a"));
    assertThat(Literal.bool(true)).isSameInstanceAs(Literal.TRUE);
  }

  @Test
  public void atomic() {
    Closure<String> code = Closure.of(ImmutableList.of(), ImmutableList.of(num(1)));
    assertThat(id("x").isAtomic()).isTrue();
    assertThat(num(1).isAtomic()).isTrue();
    assertThat(Expr.lambda(code).isAtomic()).isTrue();
    assertThat(Expr.list(id("f")).isAtomic()).isFalse();
    assertThat(Expr.vector(ImmutableList.of(num(1))).isAtomic()).isFalse();
    assertThat(Expr.cond(id("p"), num(1), null).isAtomic()).isFalse();
  }

  @Test
  public void structuralEquality() {
    Expr<String> a = Expr.list(id("f"), Expr.cond(id("p"), num(1), null));
    Expr<String> b = Expr.list(id("f"), Expr.cond(id("p"), num(1), null));
    assertThat(a).isEqualTo(b);
    assertThat(a.hashCode()).isEqualTo(b.hashCode());
    assertThat(a).isNotEqualTo(Expr.list(id("f"), Expr.cond(id("p"), num(1), num(2))));
    Closure<String> code = Closure.of(ImmutableList.of("x"), ImmutableList.of(id("x")));
    assertThat(Expr.lambda(code)).isNotEqualTo(Expr.lambda(code.withTail(true)));
  }
}
