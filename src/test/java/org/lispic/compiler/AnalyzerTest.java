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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import java.util.HashSet;
import java.util.Set;
import org.antlr.v4.runtime.CharStreams;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.lispic.core.Binding;
import org.lispic.core.Closure;
import org.lispic.core.Expr;
import org.lispic.core.Expr.Cond;
import org.lispic.core.Expr.Define;
import org.lispic.core.Expr.Lambda;
import org.lispic.core.Expr.Let;
import org.lispic.core.Expr.ListExpr;
import org.lispic.core.Expr.Vector;
import org.lispic.core.Ident;
import org.lispic.reader.Reader;

@RunWith(TestParameterInjector.class)
public class AnalyzerTest {

  private static final ImmutableList<String> PRIMITIVES =
      ImmutableList.of("+", "-", "*", "=", "<", "f", "print", "list", "concat");

  @TestParameter boolean strict;

  private Analyzer.Options options() {
    return strict ? Analyzer.Options.strict(PRIMITIVES) : Analyzer.Options.DEFAULT;
  }

  private ImmutableList<Expr<Ident>> analyze(CompilationState state, String source) {
    return Analyzer.analyze(state, Reader.read(source), options());
  }

  private static ImmutableList<String> render(ImmutableList<Expr<Ident>> items) {
    return items.stream().map(String::valueOf).collect(ImmutableList.toImmutableList());
  }

  @Test
  public void endToEnd() {
    CompilationState state = new CompilationState();
    ImmutableList<Expr<Ident>> items =
        analyze(
            state,
            "(define (sq x) (* x x))\n"
                + "(define (loop n) (if (< n 1) \"done\" (loop (- n 1))))\n"
                + "(print (sq (+ 1 2)) 'ok)\n");
    assertThat(render(items))
        .containsExactly(
            "(define (sq sq::x) (* sq::x sq::x))",
            "(define (loop loop::n) (if (< loop::n 1) \"done\" (loop (- loop::n 1))))",
            "(let ((_0 (sq (+ 1 2)))) (print _0 'ok))")
        .inOrder();
    assertThat(((Define<Ident>) items.get(0)).code().tail).isFalse();
    assertThat(((Define<Ident>) items.get(1)).code().tail).isTrue();
    assertThat(state.strings()).containsExactly("done");
    assertThat(state.symbols()).containsExactly("ok");
  }

  @Test
  public void letBoundLambda() {
    assertThat(render(analyze(new CompilationState(), "(let ((id (lambda (x) x))) (id 42))")))
        .containsExactly(
            "(define ({let 0}::id {let 0}::id::x) {let 0}::id::x)", "(let () ({let 0}::id 42))")
        .inOrder();
  }

  @Test
  public void callWithCompoundArgument() {
    assertThat(render(analyze(new CompilationState(), "(f (+ 1 2) 7)")))
        .containsExactly("(let ((_0 (+ 1 2))) (f _0 7))");
  }

  @Test
  public void liftsBeforeUse() {
    ImmutableList<Expr<Ident>> items =
        analyze(
            new CompilationState(),
            "(define (compose f g)\n"
                + "  (let ((h (lambda (x) (f (g x)))))\n"
                + "    h))\n"
                + "(print ((compose list list) 1))\n");
    assertThat(render(items))
        .containsExactly(
            "(define (compose::{let 0}::h compose::{let 0}::h::x)"
                + " (compose::f (compose::g compose::{let 0}::h::x)))",
            "(define (compose compose::f compose::g) (let () compose::{let 0}::h))",
            "(let ((_0 ((compose list list) 1))) (print _0))")
        .inOrder();
    Closure<Ident> h = ((Define<Ident>) items.get(0)).code();
    assertThat(h.free).containsExactly(Ident.parse("compose::f"), Ident.parse("compose::g"));
    checkInvariants(items);
  }

  @Test
  public void invariants() {
    String program =
        "(define count 0)\n"
            + "(define (walk tree depth)\n"
            + "  (let ((visit (lambda (node) (list node depth)))\n"
            + "        (label \"node\"))\n"
            + "    (if (= tree nil)\n"
            + "        (list 'leaf label)\n"
            + "        (let ((x (visit tree)) (y (visit (+ tree 1))))\n"
            + "          (walk (list x y) (+ depth 1))))))\n"
            + "(walk (list 1 (let ((k (lambda (z) (* z 2)))) (k 3))) 0)\n"
            + "(list (let ((a 1)) a) (let ((a 2)) a) #(\"node\" 'leaf))\n";
    CompilationState state = new CompilationState();
    ImmutableList<Expr<Ident>> items = analyze(state, program);
    checkInvariants(items);
    assertThat(state.strings()).containsExactly("node");
    assertThat(state.symbols()).containsExactly("leaf");
    Define<Ident> walk =
        items.stream()
            .filter(e -> e instanceof Define<Ident> d && d.name.equals(Ident.of("walk")))
            .map(e -> (Define<Ident>) e)
            .findFirst()
            .orElseThrow();
    assertThat(walk.code().tail).isTrue();
  }

  @Test
  public void unboundIdentifier() {
    String program = "(define (f x) (+ x y))";
    if (strict) {
      CompileError e =
          assertThrows(CompileError.class, () -> analyze(new CompilationState(), program));
      assertThat(e).hasMessageThat().isEqualTo("Unbound identifier 'y'");
    } else {
      assertThat(render(analyze(new CompilationState(), program)))
          .containsExactly("(define (f f::x) (+ f::x y))");
    }
  }

  @Test
  public void forwardReference() {
    assertThat(
            render(
                analyze(new CompilationState(), "(define (f) (g 1))\n(define (g x) (* x 2))")))
        .containsExactly("(define (f) (g 1))", "(define (g g::x) (* g::x 2))")
        .inOrder();
  }

  @Test
  public void charStream() {
    CompilationState state = new CompilationState();
    ImmutableList<Expr<Ident>> items =
        Analyzer.analyze(state, CharStreams.fromString("(print \"a\" \"b\" \"a\")"));
    assertThat(render(items)).containsExactly("(print \"a\" \"b\" \"a\")");
    assertThat(state.strings()).containsExactly("a", "b").inOrder();
  }

  /**
   * Checks the properties of analyzed output: no lambda appears except as the value of a top-level
   * define, every lifted function is defined before any expression item that refers to it, and no
   * let binding name is bound twice (other than the A-normal form locals).
   */
  private static void checkInvariants(ImmutableList<Expr<Ident>> items) {
    Set<Ident> lifted = new HashSet<>();
    for (Expr<Ident> item : items) {
      if (Lifter.isFunctionDefinition(item)) {
        Ident name = ((Define<Ident>) item).name;
        if (name.segments().size() > 1) {
          lifted.add(name);
        }
      }
    }
    Set<Ident> defined = new HashSet<>();
    Set<Ident> bound = new HashSet<>();
    for (Expr<Ident> item : items) {
      if (item instanceof Define<Ident> define) {
        if (define.val instanceof Lambda<Ident> lambda) {
          lambda.code.body.forEach(e -> checkNested(e, bound));
        } else {
          checkNested(define.val, bound);
        }
        defined.add(define.name);
      } else {
        checkNested(item, bound);
        for (Ident ref : References.of(ImmutableList.of(item))) {
          if (lifted.contains(ref)) {
            assertThat(defined).contains(ref);
          }
        }
      }
    }
  }

  private static void checkNested(Expr<Ident> expr, Set<Ident> bound) {
    if (expr instanceof Lambda) {
      throw new AssertionError("Nested lambda: " + expr);
    } else if (expr instanceof Define<Ident> define) {
      checkNested(define.val, bound);
    } else if (expr instanceof Let<Ident> let) {
      for (Binding<Ident> binding : let.bindings) {
        if (!binding.name.name().startsWith("_")) {
          assertThat(bound.add(binding.name)).isTrue();
        }
        checkNested(binding.value, bound);
      }
      let.body.forEach(e -> checkNested(e, bound));
    } else if (expr instanceof ListExpr<Ident> list) {
      list.elements.forEach(e -> checkNested(e, bound));
    } else if (expr instanceof Vector<Ident> vector) {
      vector.elements.forEach(e -> checkNested(e, bound));
    } else if (expr instanceof Cond<Ident> cond) {
      checkNested(cond.pred, bound);
      checkNested(cond.then, bound);
      if (cond.alt != null) {
        checkNested(cond.alt, bound);
      }
    }
  }
}
