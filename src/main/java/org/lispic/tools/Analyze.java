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

package org.lispic.tools;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.apache.log4j.Level;
import org.lispic.compiler.Analyzer;
import org.lispic.compiler.CompilationState;
import org.lispic.compiler.CompileError;
import org.lispic.core.Expr;
import org.lispic.core.Ident;
import org.lispic.core.Literal;
import org.lispic.reader.Reader;
import org.lispic.util.Logging;

/**
 * A simple command-line tool that analyzes a single Lispic program and prints the result.
 *
 * <p>System properties: {@code strict} (default false) reports references to undefined globals;
 * {@code globals} is a comma-separated list of the names that strict mode allows without a
 * definition (e.g. {@code -Dglobals=+,-,print}); {@code verbose} (default false) logs each pass at
 * DEBUG level.
 */
public class Analyze {
  private Analyze() {}

  private static void checkUsage(boolean condition) {
    if (!condition) {
      System.err.println("Use: analyze <fileName>");
      System.exit(1);
    }
  }

  public static void main(String[] args) throws IOException {
    boolean strict = Boolean.parseBoolean(System.getProperty("strict", "false"));
    boolean verbose = Boolean.parseBoolean(System.getProperty("verbose", "false"));
    checkUsage(args.length == 1);
    Logging.setupConsole(verbose ? Level.DEBUG : Level.WARN);
    Path file = Path.of(args[0]);
    Analyzer.Options options =
        strict
            ? Analyzer.Options.strict(
                Splitter.on(',')
                    .trimResults()
                    .omitEmptyStrings()
                    .split(System.getProperty("globals", "")))
            : Analyzer.Options.DEFAULT;
    try {
      run(CharStreams.fromPath(file), options, System.out);
    } catch (CompileError e) {
      System.err.printf("%s: %s\n", file.getFileName(), e.getMessage());
      System.exit(1);
    }
  }

  /**
   * Analyzes the program and prints each resulting item, followed by the constant tables in a
   * comment.
   */
  static void run(CharStream input, Analyzer.Options options, PrintStream out) {
    CompilationState state = new CompilationState();
    ImmutableList<Expr<Ident>> items = Analyzer.analyze(state, Reader.read(input), options);
    items.forEach(out::println);
    out.println("/* STRINGS");
    ImmutableList<String> strings = state.strings();
    for (int i = 0; i < strings.size(); i++) {
      out.printf("  %s: %s\n", i, Literal.quote(strings.get(i)));
    }
    out.println("   SYMBOLS");
    ImmutableList<String> symbols = state.symbols();
    for (int i = 0; i < symbols.size(); i++) {
      out.printf("  %s: '%s\n", i, symbols.get(i));
    }
    out.println("*/");
  }
}
