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

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.lispic.core.Binding;
import org.lispic.core.Closure;
import org.lispic.core.Expr;
import org.lispic.core.Literal;
import org.lispic.reader.LispParser.BooleanDatumContext;
import org.lispic.reader.LispParser.DatumContext;
import org.lispic.reader.LispParser.ListDatumContext;
import org.lispic.reader.LispParser.NumberDatumContext;
import org.lispic.reader.LispParser.ProgramContext;
import org.lispic.reader.LispParser.QuoteDatumContext;
import org.lispic.reader.LispParser.StringDatumContext;
import org.lispic.reader.LispParser.SymbolDatumContext;
import org.lispic.reader.LispParser.VectorDatumContext;

/**
 * Converts a parse tree into syntax trees, recognizing the special forms:
 *
 * <ul>
 *   <li>{@code (define name value)} and {@code (define (name formals...) body...)}
 *   <li>{@code (lambda (formals...) body...)}, which must be the value of a define or a let binding
 *   <li>{@code (let ((name value) ...) body...)}
 *   <li>{@code (if pred then)} and {@code (if pred then else)}
 * </ul>
 *
 * Any other non-empty list is an application. The symbol {@code nil} and the empty list read as
 * the nil literal; {@code 'sym} reads as a symbol literal.
 */
class SyntaxReader extends VisitorBase<Expr<String>> {

  private static final String DEFINE = "define";
  private static final String LAMBDA = "lambda";
  private static final String LET = "let";
  private static final String IF = "if";
  private static final String NIL = "nil";

  /** Returns the top-level forms of a program. */
  static ImmutableList<Expr<String>> readProgram(ProgramContext ctx) {
    SyntaxReader reader = new SyntaxReader();
    return reader.readAll(ctx.datum());
  }

  private SyntaxReader() {}

  private ImmutableList<Expr<String>> readAll(List<DatumContext> data) {
    return data.stream().map(this::visit).collect(ImmutableList.toImmutableList());
  }

  /** If {@code datum} is a symbol, returns its name; otherwise returns null. */
  private static @Nullable String symbolName(DatumContext datum) {
    return (datum instanceof SymbolDatumContext symbol) ? symbol.SYMBOL().getText() : null;
  }

  @Override
  public Expr<String> visitListDatum(ListDatumContext ctx) {
    List<DatumContext> items = ctx.datum();
    if (items.isEmpty()) {
      return Expr.nil();
    }
    String head = symbolName(items.get(0));
    if (head != null) {
      switch (head) {
        case DEFINE:
          return readDefine(items);
        case LET:
          return readLet(items);
        case IF:
          return readIf(items);
        case LAMBDA:
          throw error("'lambda' must be the value of a define or a let binding");
        default:
          break;
      }
    }
    return Expr.list(readAll(items));
  }

  private Expr<String> readDefine(List<DatumContext> items) {
    if (items.size() < 2) {
      throw error("Malformed 'define'");
    }
    DatumContext target = items.get(1);
    String name = symbolName(target);
    if (name != null) {
      if (items.size() != 3) {
        throw error("Malformed 'define'");
      }
      return Expr.define(name, readBoundValue(items.get(2)));
    } else if (target instanceof ListDatumContext signature && !signature.datum().isEmpty()) {
      List<DatumContext> parts = signature.datum();
      name = symbolName(parts.get(0));
      if (name == null) {
        throw error("Function name expected");
      }
      ImmutableList<String> formals = readFormals(parts.subList(1, parts.size()));
      return Expr.define(name, readLambdaBody(formals, items.subList(2, items.size())));
    }
    throw error("Malformed 'define'");
  }

  /**
   * Reads the value of a define or a let binding; this is the only place where a lambda is
   * allowed.
   */
  private Expr<String> readBoundValue(DatumContext datum) {
    if (datum instanceof ListDatumContext list
        && !list.datum().isEmpty()
        && LAMBDA.equals(symbolName(list.datum().get(0)))) {
      return visitWithCurrentNode(datum, d -> readLambda(list.datum()));
    }
    return visit(datum);
  }

  private Expr<String> readLambda(List<DatumContext> items) {
    if (items.size() < 2 || !(items.get(1) instanceof ListDatumContext formals)) {
      throw error("Malformed 'lambda'");
    }
    return readLambdaBody(readFormals(formals.datum()), items.subList(2, items.size()));
  }

  private Expr<String> readLambdaBody(ImmutableList<String> formals, List<DatumContext> body) {
    if (body.isEmpty()) {
      throw error("Function body is empty");
    }
    return Expr.lambda(Closure.of(formals, readAll(body)));
  }

  private ImmutableList<String> readFormals(List<DatumContext> data) {
    Set<String> seen = new HashSet<>();
    ImmutableList.Builder<String> formals = ImmutableList.builder();
    for (DatumContext datum : data) {
      String name = symbolName(datum);
      if (name == null) {
        throw error("Parameter name expected");
      } else if (!seen.add(name)) {
        throw error("Duplicate parameter '%s'", name);
      }
      formals.add(name);
    }
    return formals.build();
  }

  private Expr<String> readLet(List<DatumContext> items) {
    if (items.size() < 3 || !(items.get(1) instanceof ListDatumContext bindingList)) {
      throw error("Malformed 'let'");
    }
    Set<String> seen = new HashSet<>();
    ImmutableList.Builder<Binding<String>> bindings = ImmutableList.builder();
    for (DatumContext datum : bindingList.datum()) {
      String name = null;
      if (datum instanceof ListDatumContext binding && binding.datum().size() == 2) {
        name = symbolName(binding.datum().get(0));
      }
      if (name == null) {
        throw error("Malformed 'let' binding");
      } else if (!seen.add(name)) {
        throw error("Duplicate binding '%s'", name);
      }
      Expr<String> value = readBoundValue(((ListDatumContext) datum).datum().get(1));
      bindings.add(new Binding<>(name, value));
    }
    return Expr.let(bindings.build(), readAll(items.subList(2, items.size())));
  }

  private Expr<String> readIf(List<DatumContext> items) {
    if (items.size() != 3 && items.size() != 4) {
      throw error("Malformed 'if'");
    }
    Expr<String> alt = (items.size() == 4) ? visit(items.get(3)) : null;
    return Expr.cond(visit(items.get(1)), visit(items.get(2)), alt);
  }

  @Override
  public Expr<String> visitVectorDatum(VectorDatumContext ctx) {
    return Expr.vector(readAll(ctx.datum()));
  }

  @Override
  public Expr<String> visitQuoteDatum(QuoteDatumContext ctx) {
    DatumContext quoted = ctx.datum();
    String name = symbolName(quoted);
    if (name != null) {
      return Expr.literal(Literal.symbol(name));
    } else if (quoted instanceof ListDatumContext list && list.datum().isEmpty()) {
      return Expr.nil();
    }
    throw error("Only symbols and () may be quoted");
  }

  @Override
  public Expr<String> visitNumberDatum(NumberDatumContext ctx) {
    try {
      return Expr.literal(Literal.number(Long.parseLong(ctx.NUMBER().getText())));
    } catch (NumberFormatException e) {
      throw error("Number out of range");
    }
  }

  @Override
  public Expr<String> visitStringDatum(StringDatumContext ctx) {
    String text = ctx.STRING().getText();
    return Expr.literal(Literal.string(unescape(text.substring(1, text.length() - 1))));
  }

  @Override
  public Expr<String> visitBooleanDatum(BooleanDatumContext ctx) {
    return Expr.literal(Literal.bool(ctx.BOOLEAN().getText().startsWith("#t")));
  }

  @Override
  public Expr<String> visitSymbolDatum(SymbolDatumContext ctx) {
    String name = ctx.SYMBOL().getText();
    return NIL.equals(name) ? Expr.nil() : Expr.identifier(name);
  }

  /** Replaces each backslash escape in the body of a string literal. */
  private String unescape(String s) {
    if (s.indexOf('\\') < 0) {
      return s;
    }
    StringBuilder sb = new StringBuilder(s.length());
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      // The grammar guarantees that a backslash is followed by another character.
      char escaped = s.charAt(++i);
      switch (escaped) {
        case 'n':
          sb.append('\n');
          break;
        case 't':
          sb.append('\t');
          break;
        case '"':
        case '\\':
          sb.append(escaped);
          break;
        default:
          throw error("Unknown escape '\\%s'", escaped);
      }
    }
    return sb.toString();
  }
}
