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

import com.google.errorprone.annotations.FormatMethod;

/**
 * All errors in a Lispic program detected at compile time throw a CompileError.
 *
 * <p>Errors found by the reader have a source position. Errors found by later passes (which work
 * on trees without positions) have {@code lineNum} -1.
 */
public class CompileError extends RuntimeException {
  public final String msg;
  public final int lineNum;
  public final int charPositionInLine;

  public CompileError(String msg, int lineNum, int charPositionInLine) {
    super(msg);
    this.msg = msg;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
  }

  public CompileError(String msg) {
    this(msg, -1, -1);
  }

  /** Returns a new CompileError with no source position. */
  @FormatMethod
  public static CompileError of(String fmt, Object... fmtArgs) {
    return new CompileError(String.format(fmt, fmtArgs));
  }

  @Override
  public String getMessage() {
    if (lineNum < 0) {
      return msg;
    }
    return String.format("%s (%s:%s)", msg, lineNum, charPositionInLine);
  }
}
