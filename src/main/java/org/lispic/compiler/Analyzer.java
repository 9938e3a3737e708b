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
import java.util.List;
import java.util.Set;
import org.antlr.v4.runtime.CharStream;
import org.apache.log4j.Logger;
import org.lispic.core.Expr;
import org.lispic.core.Expr.Define;
import org.lispic.core.Ident;
import org.lispic.reader.Reader;
import org.lispic.util.Logging;

/**
 * Runs the language passes over a program: each top-level form is renamed, lambda lifted (which
 * may split it into several items), and then each item has its constants interned, is converted to
 * A-normal form, and has its tail calls annotated.
 */
public final class Analyzer {

  private static final Logger logger = Logging.getLogger();

  // Static methods only
  private Analyzer() {}

  /** Settings that change how a program is analyzed. */
  public static final class Options {

    /** Unresolved identifiers are references to globals, which are not checked. */
    public static final Options DEFAULT = new Options(false, ImmutableSet.of());

    /** If true, unresolved identifiers must name a top-level define or a known global. */
    public final boolean strict;

    /** Globals (such as primitives) that are provided by the runtime rather than the program. */
    public final ImmutableSet<String> knownGlobals;

    private Options(boolean strict, ImmutableSet<String> knownGlobals) {
      this.strict = strict;
      this.knownGlobals = knownGlobals;
    }

    /** Returns Options that report references to unknown globals as CompileErrors. */
    public static Options strict(Iterable<String> knownGlobals) {
      return new Options(true, ImmutableSet.copyOf(knownGlobals));
    }

    @Override
    public String toString() {
      return strict ? "strict " + knownGlobals : "default";
    }
  }

  /** Reads a program and analyzes it with default options. */
  public static ImmutableList<Expr<Ident>> analyze(CompilationState state, CharStream input) {
    return analyze(state, Reader.read(input), Options.DEFAULT);
  }

  /** Analyzes a program with default options. */
  public static ImmutableList<Expr<Ident>> analyze(
      CompilationState state, List<Expr<String>> program) {
    return analyze(state, program, Options.DEFAULT);
  }

  /**
   * Analyzes a program.
   *
   * @param state the constant tables to which string and symbol literals will be added
   * @param program the top-level forms, as returned by the {@link Reader}
   * @param options the settings to use
   * @return the top-level items of the analyzed program, in the order they must be defined
   */
  public static ImmutableList<Expr<Ident>> analyze(
      CompilationState state, List<Expr<String>> program, Options options) {
    Renamer renamer =
        options.strict ? new Renamer(knownGlobals(program, options)::contains) : new Renamer();
    ImmutableList<Expr<Ident>> result =
        program.stream()
            .map(renamer::rename)
            .flatMap(e -> Lifter.lift(e).stream())
            .map(e -> ConstantInterner.intern(state, e))
            .map(AnfConverter::convert)
            .map(TailCalls::annotate)
            .collect(ImmutableList.toImmutableList());
    if (logger.isDebugEnabled()) {
      logger.debug(
          String.format(
              "Analyzed %s forms into %s items (%s)", program.size(), result.size(), state));
    }
    if (logger.isTraceEnabled()) {
      result.forEach(item -> logger.trace("  " + item));
    }
    return result;
  }

  /**
   * Returns the names that may be referenced without a lexical binding: the program's top-level
   * defines (which may be referenced before they appear) and the given known globals.
   */
  private static Set<String> knownGlobals(List<Expr<String>> program, Options options) {
    ImmutableSet.Builder<String> result = ImmutableSet.builder();
    result.addAll(options.knownGlobals);
    for (Expr<String> form : program) {
      if (form instanceof Define<String> define) {
        result.add(define.name);
      }
    }
    return result.build();
  }
}
