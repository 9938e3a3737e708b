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

package org.lispic.reader;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import junitparams.naming.TestCaseName;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.lispic.compiler.CompileError;
import org.lispic.core.Expr;
import org.lispic.core.Expr.Define;
import org.lispic.core.Expr.Lambda;
import org.lispic.core.Expr.LiteralExpr;
import org.lispic.core.Literal;

@RunWith(JUnitParamsRunner.class)
public class ReaderTest {

  /** Returns [source, rendering] pairs for forms that render differently than they are written. */
  private static Object[] normalizedForms() {
    return new Object[] {
      new Object[] {"(define f (lambda (x) x))", "(define (f x) x)"},
      new Object[] {"()", "nil"},
      new Object[] {"'()", "nil"},
      new Object[] {"#true", "#t"},
      new Object[] {"#false", "#f"},
      new Object[] {"(let ()   ( f  ))", "(let () (f))"},
      new Object[] {"(list 1 ; one\n 2 #| two |# 3)", "(list 1 2 3)"},
    };
  }

  @Test
  @Parameters(method = "normalizedForms")
  @TestCaseName("{method}_{index}")
  public void normalized(String source, String rendered) {
    assertThat(Reader.readOne(source).toString()).isEqualTo(rendered);
  }

  /** Returns forms that render exactly as they are written. */
  private static Object[] canonicalForms() {
    return new Object[] {
      new Object[] {"(define (f x y) (if x 'a \"b\"))"},
      new Object[] {"(define (thunk) 42)"},
      new Object[] {"(define pi -3)"},
      new Object[] {"(let ((x 1) (f (lambda (y) (+ x y)))) (f 2) #(x #f nil))"},
      new Object[] {"(if (< a b) (print \"a\\tb\"))"},
      new Object[] {"(f (g (h)) 'sym)"},
    };
  }

  @Test
  @Parameters(method = "canonicalForms")
  @TestCaseName("{method}_{index}")
  public void roundTrip(String source) {
    assertThat(Reader.readOne(source).toString()).isEqualTo(source);
  }

  /** Returns [source, error message] pairs. */
  private static Object[] badForms() {
    return new Object[] {
      new Object[] {
        "(f (lambda (x) x))", "'lambda' must be the value of a define or a let binding (1:3)"
      },
      new Object[] {"(if)", "Malformed 'if' (1:0)"},
      new Object[] {"(if a b c d)", "Malformed 'if' (1:0)"},
      new Object[] {"(let ((x 1) (x 2)) x)", "Duplicate binding 'x' (1:0)"},
      new Object[] {"(let (x) x)", "Malformed 'let' binding (1:0)"},
      new Object[] {"(let x x)", "Malformed 'let' (1:0)"},
      new Object[] {"(let ((x 1)))", "Malformed 'let' (1:0)"},
      new Object[] {"(define (f x x) x)", "Duplicate parameter 'x' (1:0)"},
      new Object[] {"(define (f 1) x)", "Parameter name expected (1:0)"},
      new Object[] {"(define ((f) x) x)", "Function name expected (1:0)"},
      new Object[] {"(define x)", "Malformed 'define' (1:0)"},
      new Object[] {"(define x 1 2)", "Malformed 'define' (1:0)"},
      new Object[] {"(define (f x))", "Function body is empty (1:0)"},
      new Object[] {"(define)", "Malformed 'define' (1:0)"},
      new Object[] {"(let ((f (lambda x x))) f)", "Malformed 'lambda' (1:9)"},
      new Object[] {"(let ((f (lambda (x)))) f)", "Function body is empty (1:9)"},
      new Object[] {"'(a b)", "Only symbols and () may be quoted (1:0)"},
      new Object[] {"99999999999999999999", "Number out of range (1:0)"},
      new Object[] {"\n  \"a\\qb\"", "Unknown escape '\\q' (2:2)"},
    };
  }

  @Test
  @Parameters(method = "badForms")
  @TestCaseName("{method}_{index}")
  public void errors(String source, String message) {
    CompileError e = assertThrows(CompileError.class, () -> Reader.read(source));
    assertThat(e).hasMessageThat().isEqualTo(message);
  }

  @Test
  public void syntaxErrors() {
    CompileError e = assertThrows(CompileError.class, () -> Reader.read("(f\n  (g x)"));
    assertThat(e.lineNum).isEqualTo(2);
    e = assertThrows(CompileError.class, () -> Reader.read("(f))"));
    assertThat(e.lineNum).isEqualTo(1);
    assertThat(e.charPositionInLine).isEqualTo(3);
  }

  @Test
  public void readOne() {
    CompileError e = assertThrows(CompileError.class, () -> Reader.readOne("1 2"));
    assertThat(e).hasMessageThat().isEqualTo("Expected one form, found 2");
    assertThat(e.lineNum).isEqualTo(-1);
  }

  @Test
  public void program() {
    ImmutableList<Expr<String>> forms = Reader.read("(define x 1)\n\n(print x)\n");
    assertThat(forms).hasSize(2);
    assertThat(forms.get(0)).isInstanceOf(Define.class);
    assertThat(Reader.read("; nothing here\n")).isEmpty();
  }

  @Test
  public void literals() {
    assertThat(literal("\"a\\\"b\\n\"")).isEqualTo(Literal.string("a\"b\n"));
    assertThat(literal("-17")).isEqualTo(Literal.number(-17));
    assertThat(literal("'nil")).isEqualTo(Literal.symbol("nil"));
    assertThat(literal("nil")).isEqualTo(Literal.NIL);
    // A lone minus sign is a symbol
    assertThat(Reader.readOne("-").toString()).isEqualTo("-");
  }

  @Test
  public void lambdaBindings() {
    Define<String> define = (Define<String>) Reader.readOne("(define (f x) (g x) (h x))");
    Lambda<String> lambda = (Lambda<String>) define.val;
    assertThat(lambda.code.formals).containsExactly("x");
    assertThat(lambda.code.body).hasSize(2);
    assertThat(lambda.code.free).isEmpty();
    assertThat(lambda.code.tail).isFalse();
  }

  private static Literal literal(String source) {
    return ((LiteralExpr<String>) Reader.readOne(source)).value;
  }
}
