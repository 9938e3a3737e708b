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
import com.google.errorprone.annotations.Immutable;
import java.util.Objects;

/** An atomic constant: a number, string, symbol, boolean, or nil. */
@Immutable
public final class Literal {

  /** The kinds of Literal. */
  public enum Kind {
    NUMBER,
    STRING,
    SYMBOL,
    BOOLEAN,
    NIL
  }

  public static final Literal NIL = new Literal(Kind.NIL, 0, null);
  public static final Literal TRUE = new Literal(Kind.BOOLEAN, 1, null);
  public static final Literal FALSE = new Literal(Kind.BOOLEAN, 0, null);

  public final Kind kind;

  /** The value of a NUMBER; 1 or 0 for a BOOLEAN. */
  private final long number;

  /** The text of a STRING or the name of a SYMBOL; null otherwise. */
  private final String text;

  private Literal(Kind kind, long number, String text) {
    this.kind = kind;
    this.number = number;
    this.text = text;
  }

  public static Literal number(long value) {
    return new Literal(Kind.NUMBER, value, null);
  }

  public static Literal string(String value) {
    return new Literal(Kind.STRING, 0, Preconditions.checkNotNull(value));
  }

  public static Literal symbol(String name) {
    Preconditions.checkArgument(!name.isEmpty());
    return new Literal(Kind.SYMBOL, 0, name);
  }

  public static Literal bool(boolean value) {
    return value ? TRUE : FALSE;
  }

  public long asNumber() {
    Preconditions.checkState(kind == Kind.NUMBER);
    return number;
  }

  public boolean asBoolean() {
    Preconditions.checkState(kind == Kind.BOOLEAN);
    return number != 0;
  }

  /** Returns the contents of a STRING or the name of a SYMBOL. */
  public String text() {
    Preconditions.checkState(kind == Kind.STRING || kind == Kind.SYMBOL);
    return text;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Literal other
        && kind == other.kind
        && number == other.number
        && Objects.equals(text, other.text);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, number, text);
  }

  @Override
  public String toString() {
    switch (kind) {
      case NUMBER:
        return Long.toString(number);
      case STRING:
        return quote(text);
      case SYMBOL:
        return "'" + text;
      case BOOLEAN:
        return (number != 0) ? "#t" : "#f";
      case NIL:
        return "nil";
    }
    throw new AssertionError();
  }

  /** Returns the source representation of a string, with quotes and escapes. */
  public static String quote(String s) {
    StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          sb.append(c);
      }
    }
    return sb.append('"').toString();
  }
}
