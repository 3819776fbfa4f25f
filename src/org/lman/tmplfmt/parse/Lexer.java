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

import java.util.HashMap;
import java.util.Map;

import org.lman.tmplfmt.parse.Token.Type;

/**
 * Tokeniser for templates. Text outside of delimiters is returned verbatim as a single token;
 * inside {{ }} the input is split into the pieces the {@link Parser} understands, including the
 * whitespace between them.
 *
 * Tokens are produced lazily by {@link #nextToken}. The first malformed construct produces an
 * {@link Type#ERROR} token and every request after that returns {@link Type#EOF}.
 */
public final class Lexer {

  static final String LEFT_DELIM = "{{";
  static final String RIGHT_DELIM = "}}";
  static final String LEFT_COMMENT = "/*";
  static final String RIGHT_COMMENT = "*/";

  private static final int EOF = -1;

  private static final Map<String, Type> KEYWORDS = new HashMap<String, Type>();
  static {
    KEYWORDS.put("if", Type.IF);
    KEYWORDS.put("else", Type.ELSE);
    KEYWORDS.put("end", Type.END);
    KEYWORDS.put("range", Type.BRANCH);
    KEYWORDS.put("with", Type.BRANCH);
    KEYWORDS.put("define", Type.BRANCH);
    KEYWORDS.put("block", Type.BRANCH);
    KEYWORDS.put("nil", Type.NIL);
    KEYWORDS.put("true", Type.BOOL);
    KEYWORDS.put("false", Type.BOOL);
  }

  private final String input;

  /** Start of the token being scanned. */
  private int start = 0;
  /** Current scanning position. */
  private int pos = 0;
  /** Line of {@link #start}. */
  private int line = 1;

  private boolean insideAction = false;
  private int parenDepth = 0;
  private boolean finished = false;

  public Lexer(String input) {
    this.input = input;
  }

  /**
   * Returns the next token of the input.
   */
  public Token nextToken() {
    if (finished)
      return new Token(Type.EOF, "", input.length(), line);
    return insideAction ? lexInsideAction() : lexText();
  }

  private Token lexText() {
    int delim = input.indexOf(LEFT_DELIM, pos);
    if (delim < 0) {
      pos = input.length();
      if (pos > start)
        return emit(Type.TEXT);
      finished = true;
      return emit(Type.EOF);
    }
    if (delim > start) {
      pos = delim;
      return emit(Type.TEXT);
    }
    return lexLeftDelim();
  }

  private Token lexLeftDelim() {
    pos += LEFT_DELIM.length();
    boolean trim = hasLeftTrimMarker(pos);
    int afterMarker = trim ? pos + 2 : pos;
    if (input.startsWith(LEFT_COMMENT, afterMarker))
      return lexComment(afterMarker);
    pos = afterMarker;
    insideAction = true;
    parenDepth = 0;
    return emit(Type.LEFT_DELIM, trim, false);
  }

  /** Scans a comment; {@link #pos} is just past the left delimiter. */
  private Token lexComment(int commentStart) {
    int bodyStart = pos;
    int close = input.indexOf(RIGHT_COMMENT, commentStart + LEFT_COMMENT.length());
    if (close < 0)
      return error("unclosed comment");
    pos = close + RIGHT_COMMENT.length();
    if (hasRightTrimMarker(pos))
      pos += 2;
    if (!input.startsWith(RIGHT_DELIM, pos))
      return error("comment ends before closing delimiter");
    String body = input.substring(bodyStart, pos);
    pos += RIGHT_DELIM.length();
    return emit(Type.COMMENT, body, false, false);
  }

  private Token lexInsideAction() {
    if (input.startsWith(RIGHT_DELIM, pos))
      return lexRightDelim(false);
    if (hasRightTrimMarker(pos))
      return lexRightDelim(true);

    int r = next();
    switch (r) {
      case EOF:
        return error("unclosed action");
      case ' ':
      case '\t':
      case '\r':
      case '\n':
        return lexSpace();
      case '=':
        return emit(Type.ASSIGN);
      case ':':
        if (next() != '=')
          return error("expected :=");
        return emit(Type.DECLARE);
      case '|':
        return emit(Type.PIPE);
      case ',':
        return emit(Type.COMMA);
      case '"':
        return lexQuote();
      case '`':
        return lexRawQuote();
      case '\'':
        return lexCharConstant();
      case '$':
        return lexVariable();
      case '(':
        parenDepth++;
        return emit(Type.LEFT_PAREN);
      case ')':
        parenDepth--;
        if (parenDepth < 0)
          return error("unexpected right paren " + describe(r));
        return emit(Type.RIGHT_PAREN);
      case '.':
        // A leading dot followed by a digit is a number like ".5".
        if (pos < input.length()) {
          char c = input.charAt(pos);
          if (c < '0' || c > '9')
            return lexFieldOrVariable(Type.FIELD);
        }
        backup(r);
        return lexNumber();
      default:
        if (r == '+' || r == '-' || ('0' <= r && r <= '9')) {
          backup(r);
          return lexNumber();
        }
        if (isAlphaNumeric(r))
          return lexIdentifier();
        if (r <= 0x7f && r >= 0x20 && r != 0x7f)
          return emit(Type.CHAR);
        return error("unrecognized character in action: " + describe(r));
    }
  }

  private Token lexRightDelim(boolean trim) {
    if (parenDepth > 0)
      return error("unclosed left paren");
    pos += trim ? 2 + RIGHT_DELIM.length() : RIGHT_DELIM.length();
    insideAction = false;
    return emit(Type.RIGHT_DELIM, false, trim);
  }

  /**
   * Scans a run of spaces. The space belonging to a " -}}" trim marker is left for the right
   * delimiter.
   */
  private Token lexSpace() {
    while (pos < input.length() && isSpace(input.charAt(pos)) && !hasRightTrimMarker(pos))
      pos++;
    return emit(Type.SPACE);
  }

  private Token lexQuote() {
    while (true) {
      int r = next();
      if (r == '\\') {
        r = next();
        if (r != EOF && r != '\n')
          continue;
      }
      if (r == EOF || r == '\n')
        return error("unterminated quoted string");
      if (r == '"')
        return emit(Type.STRING);
    }
  }

  private Token lexRawQuote() {
    int close = input.indexOf('`', pos);
    if (close < 0)
      return error("unterminated raw quoted string");
    pos = close + 1;
    return emit(Type.RAW_STRING);
  }

  private Token lexCharConstant() {
    while (true) {
      int r = next();
      if (r == '\\') {
        r = next();
        if (r != EOF && r != '\n')
          continue;
      }
      if (r == EOF || r == '\n')
        return error("unterminated character constant");
      if (r == '\'')
        return emit(Type.CHAR_CONSTANT);
    }
  }

  private Token lexVariable() {
    if (atTerminator())
      return emit(Type.VARIABLE);
    return lexFieldOrVariable(Type.VARIABLE);
  }

  /** Scans the name after a leading '.' or '$'. A lone '.' is the dot. */
  private Token lexFieldOrVariable(Type type) {
    if (atTerminator())
      return emit(type == Type.VARIABLE ? Type.VARIABLE : Type.DOT);
    int r;
    while (true) {
      r = next();
      if (!isAlphaNumeric(r)) {
        backup(r);
        break;
      }
    }
    if (!atTerminator())
      return error("bad character " + describe(peek()));
    return emit(type);
  }

  private Token lexIdentifier() {
    while (true) {
      int r = next();
      if (!isAlphaNumeric(r)) {
        backup(r);
        break;
      }
    }
    if (!atTerminator())
      return error("bad character " + describe(peek()));
    Type keyword = KEYWORDS.get(input.substring(start, pos));
    return emit(keyword != null ? keyword : Type.IDENTIFIER);
  }

  private Token lexNumber() {
    if (!scanNumber())
      return error("bad number syntax: " + Literals.quote(input.substring(start, pos)));
    int sign = peek();
    if (sign == '+' || sign == '-') {
      // Complex: 1+2i. No spaces, must end in 'i'.
      if (!scanNumber() || input.charAt(pos - 1) != 'i')
        return error("bad number syntax: " + Literals.quote(input.substring(start, pos)));
      return emit(Type.COMPLEX);
    }
    return emit(Type.NUMBER);
  }

  private boolean scanNumber() {
    accept("+-");
    String digits = "0123456789_";
    if (accept("0")) {
      if (accept("xX"))
        digits = "0123456789abcdefABCDEF_";
      else if (accept("oO"))
        digits = "01234567_";
      else if (accept("bB"))
        digits = "01_";
    }
    acceptRun(digits);
    if (accept("."))
      acceptRun(digits);
    if (digits.length() == 11 && accept("eE")) {
      accept("+-");
      acceptRun("0123456789_");
    }
    if (digits.length() == 23 && accept("pP")) {
      accept("+-");
      acceptRun("0123456789_");
    }
    accept("i");
    if (isAlphaNumeric(peek())) {
      next();
      return false;
    }
    return true;
  }

  private boolean accept(String valid) {
    int r = next();
    if (r != EOF && valid.indexOf(r) >= 0)
      return true;
    backup(r);
    return false;
  }

  private void acceptRun(String valid) {
    while (accept(valid)) {}
  }

  private int next() {
    if (pos >= input.length())
      return EOF;
    int r = input.codePointAt(pos);
    pos += Character.charCount(r);
    return r;
  }

  private int peek() {
    return pos >= input.length() ? EOF : input.codePointAt(pos);
  }

  private void backup(int r) {
    if (r != EOF)
      pos -= Character.charCount(r);
  }

  private boolean atTerminator() {
    int r = peek();
    if (r == EOF || isSpace(r))
      return true;
    switch (r) {
      case '.':
      case ',':
      case '|':
      case ':':
      case ')':
      case '(':
        return true;
      default:
        return input.startsWith(RIGHT_DELIM, pos);
    }
  }

  /** "{{- " : a dash followed by a space. */
  private boolean hasLeftTrimMarker(int at) {
    return at + 1 < input.length() && input.charAt(at) == '-' && isSpace(input.charAt(at + 1));
  }

  /** " -}}" : a space followed by a dash and the right delimiter. */
  private boolean hasRightTrimMarker(int at) {
    return at < input.length() && isSpace(input.charAt(at))
        && input.startsWith("-" + RIGHT_DELIM, at + 1);
  }

  private Token emit(Type type) {
    return emit(type, input.substring(start, pos), false, false);
  }

  private Token emit(Type type, boolean trimLeft, boolean trimRight) {
    return emit(type, input.substring(start, pos), trimLeft, trimRight);
  }

  private Token emit(Type type, String value, boolean trimLeft, boolean trimRight) {
    Token token = new Token(type, value, start, line, trimLeft, trimRight);
    for (int i = start; i < pos; i++) {
      if (input.charAt(i) == '\n')
        line++;
    }
    start = pos;
    return token;
  }

  private Token error(String message) {
    Token token = new Token(Type.ERROR, message, start, line);
    finished = true;
    return token;
  }

  static boolean isSpace(int r) {
    return r == ' ' || r == '\t' || r == '\r' || r == '\n';
  }

  static boolean isAlphaNumeric(int r) {
    return r == '_' || Character.isLetter(r) || Character.isDigit(r);
  }

  /** Describes a character as U+0041 'A'. */
  private static String describe(int r) {
    if (r == EOF)
      return "EOF";
    return String.format("U+%04X '%s'", r, new String(Character.toChars(r)));
  }
}
