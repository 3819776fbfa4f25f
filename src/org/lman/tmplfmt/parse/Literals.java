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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

import org.lman.tmplfmt.parse.Node.NumberNode;

/**
 * Decoding of the literal tokens of an action: quoted strings, character constants and numbers.
 * The syntax is the one of the template language's host language, so e.g. 0x1p-2, 1_000 and
 * 1+2i are all numbers.
 */
final class Literals {

  /** Thrown for a literal that doesn't decode. The message is the whole diagnostic. */
  static class SyntaxException extends Exception {
    private static final long serialVersionUID = 1L;

    public SyntaxException(String message) {
      super(message);
    }
  }

  private static final Pattern DECIMAL_FLOAT = Pattern.compile(
      "[+-]?(?:[0-9_]+\\.?[0-9_]*|\\.[0-9_]+)(?:[eE][+-]?[0-9_]+)?");
  private static final Pattern HEX_FLOAT = Pattern.compile(
      "[+-]?0[xX](?:[0-9a-fA-F_]+\\.?[0-9a-fA-F_]*|\\.[0-9a-fA-F_]+)[pP][+-]?[0-9_]+");

  private static final BigInteger MAX_UINT64 = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);
  private static final BigInteger MIN_INT64 = BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger MAX_INT64 = BigInteger.valueOf(Long.MAX_VALUE);
  private static final double TWO_TO_63 = 0x1p63;
  private static final double TWO_TO_64 = 0x1p64;

  private Literals() {}

  /**
   * Quotes a string for diagnostics, escaping quotes, backslashes and control characters.
   */
  static String quote(String s) {
    StringBuilder buf = new StringBuilder("\"");
    for (int i = 0; i < s.length(); ) {
      int c = s.codePointAt(i);
      i += Character.charCount(c);
      switch (c) {
        case '"': buf.append("\\\""); break;
        case '\\': buf.append("\\\\"); break;
        case 0x07: buf.append("\\a"); break;
        case '\b': buf.append("\\b"); break;
        case '\f': buf.append("\\f"); break;
        case '\n': buf.append("\\n"); break;
        case '\r': buf.append("\\r"); break;
        case '\t': buf.append("\\t"); break;
        case 0x0b: buf.append("\\v"); break;
        default:
          if (c < 0x20 || c == 0x7f)
            buf.append(String.format("\\x%02x", c));
          else if (Character.isISOControl(c))
            buf.append(String.format("\\u%04x", c));
          else
            buf.appendCodePoint(c);
      }
    }
    return buf.append('"').toString();
  }

  /**
   * Removes the quotes of a double-quoted or back-quoted string literal and interprets its
   * escapes.
   */
  static String unquote(String quoted) throws SyntaxException {
    int n = quoted.length();
    if (n < 2 || quoted.charAt(0) != quoted.charAt(n - 1))
      throw new SyntaxException("invalid syntax");
    char quote = quoted.charAt(0);
    String body = quoted.substring(1, n - 1);

    if (quote == '`') {
      if (body.indexOf('`') >= 0)
        throw new SyntaxException("invalid syntax");
      return body.replace("\r", "");
    }
    if (quote != '"')
      throw new SyntaxException("invalid syntax");
    if (body.indexOf('\n') >= 0)
      throw new SyntaxException("invalid syntax");

    StringBuilder buf = new StringBuilder();
    int[] index = {0};
    while (index[0] < body.length())
      buf.appendCodePoint(unquoteChar(body, index, '"'));
    return buf.toString();
  }

  /**
   * Decodes one possibly escaped character of {@code s} starting at {@code index[0]}, advancing
   * the index past it.
   */
  private static int unquoteChar(String s, int[] index, char quote) throws SyntaxException {
    int i = index[0];
    int c = s.codePointAt(i);
    if (c == quote)
      throw new SyntaxException("invalid syntax");
    if (c != '\\') {
      index[0] = i + Character.charCount(c);
      return c;
    }
    if (i + 1 >= s.length())
      throw new SyntaxException("invalid syntax");
    char escape = s.charAt(i + 1);
    i += 2;
    int value;
    switch (escape) {
      case 'a': value = 0x07; break;
      case 'b': value = '\b'; break;
      case 'f': value = '\f'; break;
      case 'n': value = '\n'; break;
      case 'r': value = '\r'; break;
      case 't': value = '\t'; break;
      case 'v': value = 0x0b; break;
      case '\\': value = '\\'; break;
      case '\'':
      case '"':
        if (escape != quote)
          throw new SyntaxException("invalid syntax");
        value = escape;
        break;
      case 'x':
      case 'u':
      case 'U': {
        int digits = escape == 'x' ? 2 : escape == 'u' ? 4 : 8;
        if (i + digits > s.length())
          throw new SyntaxException("invalid syntax");
        value = 0;
        for (int j = 0; j < digits; j++) {
          int d = Character.digit(s.charAt(i + j), 16);
          if (d < 0 || s.charAt(i + j) > 0x7f)
            throw new SyntaxException("invalid syntax");
          value = (value << 4) | d;
        }
        i += digits;
        if (escape != 'x' && (value < 0 || value > Character.MAX_CODE_POINT
            || (value >= Character.MIN_SURROGATE && value <= Character.MAX_SURROGATE)))
          throw new SyntaxException("invalid syntax");
        break;
      }
      case '0': case '1': case '2': case '3':
      case '4': case '5': case '6': case '7': {
        value = escape - '0';
        if (i + 2 > s.length())
          throw new SyntaxException("invalid syntax");
        for (int j = 0; j < 2; j++) {
          int d = s.charAt(i + j) - '0';
          if (d < 0 || d > 7)
            throw new SyntaxException("invalid syntax");
          value = (value << 3) | d;
        }
        i += 2;
        if (value > 255)
          throw new SyntaxException("invalid syntax");
        break;
      }
      default:
        throw new SyntaxException("invalid syntax");
    }
    index[0] = i;
    return value;
  }

  /**
   * Types a numeric token, recording every representation the value legally has.
   */
  static NumberNode parseNumber(int pos, String text, Token.Type type) throws SyntaxException {
    switch (type) {
      case CHAR_CONSTANT:
        return parseCharConstant(pos, text);
      case COMPLEX:
        return parseComplex(pos, text);
      default:
        break;
    }

    // Imaginary constants can only be complex unless they are zero.
    if (text.endsWith("i")) {
      Double imaginary = parseFloat(text.substring(0, text.length() - 1));
      if (imaginary != null)
        return complexNumber(pos, text, 0, imaginary);
    }

    boolean isInt = false, isUint = false, isFloat = false;
    long int64 = 0, uint64 = 0;
    double float64 = 0;

    // Integers first, so that 0x123 and friends are read as such.
    BigInteger unsigned = parseUnsigned(text);
    if (unsigned != null) {
      isUint = true;
      uint64 = unsigned.longValue();
    }
    BigInteger signed = parseSigned(text);
    if (signed != null) {
      isInt = true;
      int64 = signed.longValue();
      if (int64 == 0) {
        // -0 is unsigned too.
        isUint = true;
        uint64 = 0;
      }
    }

    if (isInt) {
      isFloat = true;
      float64 = int64;
    } else if (isUint) {
      isFloat = true;
      float64 = unsigned.doubleValue();
    } else {
      Double f = parseFloat(text);
      if (f != null) {
        // Parses as a float but looks like an integer: too large for any integer type.
        if (!containsAny(text, ".eEpP"))
          throw new SyntaxException("integer overflow: " + quote(text));
        isFloat = true;
        float64 = f;
        if (isIntegral(f)) {
          isInt = true;
          int64 = (long) float64;
        }
        if (isUnsignedIntegral(f)) {
          isUint = true;
          uint64 = toUnsigned(f);
        }
      }
    }

    if (!isInt && !isUint && !isFloat)
      throw new SyntaxException("illegal number syntax: " + quote(text));
    return new NumberNode(pos, text, isInt, isUint, isFloat, false, int64, uint64, float64, 0, 0);
  }

  private static NumberNode parseCharConstant(int pos, String text) throws SyntaxException {
    if (text.length() < 2 || text.charAt(0) != '\'')
      throw new SyntaxException("malformed character constant: " + text);
    String body = text.substring(1);
    int[] index = {0};
    int rune = unquoteChar(body, index, '\'');
    if (!body.substring(index[0]).equals("'"))
      throw new SyntaxException("malformed character constant: " + text);
    return new NumberNode(pos, text, true, true, true, false, rune, rune, rune, 0, 0);
  }

  private static NumberNode parseComplex(int pos, String text) throws SyntaxException {
    int split = -1;
    for (int i = text.length() - 1; i > 0; i--) {
      char c = text.charAt(i);
      if (c != '+' && c != '-')
        continue;
      char before = text.charAt(i - 1);
      if (before == 'e' || before == 'E' || before == 'p' || before == 'P')
        continue;
      split = i;
      break;
    }
    if (split < 0 || !text.endsWith("i"))
      throw new SyntaxException("illegal number syntax: " + quote(text));
    Double real = parseFloat(text.substring(0, split));
    Double imaginary = parseFloat(text.substring(split, text.length() - 1));
    if (real == null || imaginary == null)
      throw new SyntaxException("illegal number syntax: " + quote(text));
    return complexNumber(pos, text, real, imaginary);
  }

  /** Builds a complex number, also recording the simpler types it has when it's real. */
  private static NumberNode complexNumber(int pos, String text, double real, double imaginary) {
    boolean isFloat = imaginary == 0;
    boolean isInt = false, isUint = false;
    long int64 = 0, uint64 = 0;
    double float64 = 0;
    if (isFloat) {
      float64 = real;
      isInt = isIntegral(real);
      if (isInt)
        int64 = (long) real;
      isUint = isUnsignedIntegral(real);
      if (isUint)
        uint64 = toUnsigned(real);
    }
    return new NumberNode(
        pos, text, isInt, isUint, isFloat, true, int64, uint64, float64, real, imaginary);
  }

  private static boolean isIntegral(double f) {
    return f >= -TWO_TO_63 && f < TWO_TO_63 && f == Math.floor(f);
  }

  private static boolean isUnsignedIntegral(double f) {
    return f >= 0 && f < TWO_TO_64 && f == Math.floor(f);
  }

  private static long toUnsigned(double f) {
    return new BigDecimal(f).toBigInteger().longValue();
  }

  /**
   * Parses an unsigned integer with an optional 0b/0o/0x or legacy octal prefix. Returns null if
   * the text isn't one or doesn't fit in 64 bits.
   */
  static BigInteger parseUnsigned(String text) {
    if (text.isEmpty())
      return null;
    String digits = text;
    int base = 10;
    if (text.charAt(0) == '0') {
      char prefix = text.length() >= 3 ? Character.toLowerCase(text.charAt(1)) : 0;
      if (prefix == 'b') {
        base = 2;
        digits = text.substring(2);
      } else if (prefix == 'o') {
        base = 8;
        digits = text.substring(2);
      } else if (prefix == 'x') {
        base = 16;
        digits = text.substring(2);
      } else {
        base = 8;
        digits = text.substring(1);
      }
    }

    BigInteger value = BigInteger.ZERO;
    BigInteger bigBase = BigInteger.valueOf(base);
    boolean underscores = false;
    for (int i = 0; i < digits.length(); i++) {
      char c = digits.charAt(i);
      if (c == '_') {
        underscores = true;
        continue;
      }
      int d = c > 0x7f ? -1 : Character.digit(c, 36);
      if (d < 0 || d >= base)
        return null;
      value = value.multiply(bigBase).add(BigInteger.valueOf(d));
      if (value.compareTo(MAX_UINT64) > 0)
        return null;
    }
    if (underscores && !underscoreOk(text))
      return null;
    return value;
  }

  /** Like {@link #parseUnsigned} with an optional sign, limited to the signed 64-bit range. */
  static BigInteger parseSigned(String text) {
    if (text.isEmpty())
      return null;
    boolean negative = false;
    String magnitude = text;
    if (text.charAt(0) == '+' || text.charAt(0) == '-') {
      negative = text.charAt(0) == '-';
      magnitude = text.substring(1);
    }
    BigInteger value = parseUnsigned(magnitude);
    if (value == null)
      return null;
    if (negative)
      value = value.negate();
    if (value.compareTo(MIN_INT64) < 0 || value.compareTo(MAX_INT64) > 0)
      return null;
    return value;
  }

  /**
   * Parses a decimal or hexadecimal (with mandatory p exponent) float. Returns null for anything
   * else, including values that overflow to infinity.
   */
  static Double parseFloat(String text) {
    boolean hex = HEX_FLOAT.matcher(text).matches();
    if (!hex && !DECIMAL_FLOAT.matcher(text).matches())
      return null;
    if (text.indexOf('_') >= 0) {
      if (!underscoreOk(text))
        return null;
      text = text.replace("_", "");
    }
    double f;
    try {
      f = Double.parseDouble(text);
    } catch (NumberFormatException e) {
      return null;
    }
    if (Double.isInfinite(f) || Double.isNaN(f))
      return null;
    return f;
  }

  /**
   * Underscores may only separate digits, or follow a base prefix.
   */
  static boolean underscoreOk(String s) {
    char saw = '^';
    int i = 0;
    if (!s.isEmpty() && (s.charAt(0) == '-' || s.charAt(0) == '+'))
      s = s.substring(1);

    boolean hex = false;
    if (s.length() >= 2 && s.charAt(0) == '0') {
      char prefix = Character.toLowerCase(s.charAt(1));
      if (prefix == 'b' || prefix == 'o' || prefix == 'x') {
        i = 2;
        saw = '0';
        hex = prefix == 'x';
      }
    }

    for (; i < s.length(); i++) {
      char c = s.charAt(i);
      char lower = Character.toLowerCase(c);
      if (('0' <= c && c <= '9') || (hex && 'a' <= lower && lower <= 'f')) {
        saw = '0';
        continue;
      }
      if (c == '_') {
        if (saw != '0')
          return false;
        saw = '_';
        continue;
      }
      if (saw == '_')
        return false;
      saw = '!';
    }
    return saw != '_';
  }

  private static boolean containsAny(String s, String chars) {
    for (int i = 0; i < chars.length(); i++) {
      if (s.indexOf(chars.charAt(i)) >= 0)
        return true;
    }
    return false;
  }
}
