// Copyright 2012 Benjamin Kalman
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//     http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package org.lman.tmplfmt.parse;

/**
 * A token produced by the {@link Lexer}.
 */
public final class Token {

  public enum Type {
    ERROR,
    EOF,
    TEXT,
    COMMENT,
    LEFT_DELIM,
    RIGHT_DELIM,
    LEFT_PAREN,
    RIGHT_PAREN,
    PIPE,
    SPACE,
    COMMA,
    // Any other printable ASCII character inside an action.
    CHAR,
    DECLARE,
    ASSIGN,
    IDENTIFIER,
    FIELD,
    VARIABLE,
    DOT,
    NIL,
    BOOL,
    NUMBER,
    CHAR_CONSTANT,
    COMPLEX,
    STRING,
    RAW_STRING,
    // Keywords.
    IF,
    ELSE,
    END,
    BRANCH;

    public boolean isKeyword() {
      return this == IF || this == ELSE || this == END || this == BRANCH;
    }
  }

  public final Type type;
  public final String value;
  /** Offset of the first character of the token in the input. */
  public final int pos;
  /** 1-based line of the first character of the token. */
  public final int line;
  /** Set on a left delimiter written as "{{- ". */
  public final boolean trimLeft;
  /** Set on a right delimiter written as " -}}". */
  public final boolean trimRight;

  Token(Type type, String value, int pos, int line, boolean trimLeft, boolean trimRight) {
    this.type = type;
    this.value = value;
    this.pos = pos;
    this.line = line;
    this.trimLeft = trimLeft;
    this.trimRight = trimRight;
  }

  Token(Type type, String value, int pos, int line) {
    this(type, value, pos, line, false, false);
  }

  @Override
  public String toString() {
    switch (type) {
      case EOF:
        return "EOF";
      case ERROR:
        return value;
      default:
        if (type.isKeyword())
          return "<" + value + ">";
        if (value.length() > 10)
          return Literals.quote(value.substring(0, 10)) + "...";
        return Literals.quote(value);
    }
  }
}
