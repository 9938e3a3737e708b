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
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.lispic.compiler.CompileError;
import org.lispic.core.Expr;
import org.lispic.reader.LispParser.ProgramContext;

/** Parses Lispic source text into syntax trees. */
public final class Reader {

  // Static methods only
  private Reader() {}

  /**
   * Reads all the top-level forms of a program.
   *
   * @throws CompileError if the program is not syntactically valid
   */
  public static ImmutableList<Expr<String>> read(CharStream input) {
    return SyntaxReader.readProgram(parse(input));
  }

  /** Reads all the top-level forms in a string. */
  public static ImmutableList<Expr<String>> read(String input) {
    return read(CharStreams.fromString(input));
  }

  /** Reads a string containing exactly one top-level form. */
  public static Expr<String> readOne(String input) {
    ImmutableList<Expr<String>> forms = read(input);
    if (forms.size() != 1) {
      throw new CompileError(String.format("Expected one form, found %s", forms.size()));
    }
    return forms.get(0);
  }

  /** Parses a program into an ANTLR parse tree. */
  static ProgramContext parse(CharStream input) {
    // Throw CompileErrors in response to parsing errors.
    BaseErrorListener errorListener =
        new BaseErrorListener() {
          @Override
          public void syntaxError(
              Recognizer<?, ?> recognizer,
              Object offendingSymbol,
              int lineNum,
              int charPositionInLine,
              String msg,
              RecognitionException e) {
            throw new CompileError(msg, lineNum, charPositionInLine);
          }
        };
    LispLexer lexer = new LispLexer(input);
    lexer.removeErrorListeners();
    lexer.addErrorListener(errorListener);
    LispParser parser = new LispParser(new CommonTokenStream(lexer));
    parser.removeErrorListeners();
    parser.addErrorListener(errorListener);
    return parser.program();
  }

  /** Returns a new CompileError referring to the given token. */
  static CompileError error(Token token, String msg) {
    int lineNum;
    int charPositionInLine;
    if (token != null) {
      lineNum = token.getLine();
      charPositionInLine = token.getCharPositionInLine();
    } else {
      // Shouldn't happen, but 0:0 is less useless than a NullPointerException.
      lineNum = 0;
      charPositionInLine = 0;
    }
    return new CompileError(msg, lineNum, charPositionInLine);
  }
}
