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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;
import org.lman.tmplfmt.parse.Literals.SyntaxException;
import org.lman.tmplfmt.parse.Node.NumberNode;
import org.lman.tmplfmt.parse.Token.Type;

public class LiteralsTest {

  @Test
  public void quote() {
    assertEquals("\"plain\"", Literals.quote("plain"));
    assertEquals("\"a\\\"b\\\\\\n\\t\"", Literals.quote("a\"b\\\n\t"));
    assertEquals("\"\\x01\"", Literals.quote("\u0001"));
    assertEquals("\"é\"", Literals.quote("é"));
  }

  @Test
  public void unquote() throws SyntaxException {
    assertEquals("a\tb", Literals.unquote("\"a\\tb\""));
    assertEquals("A", Literals.unquote("\"\\x41\""));
    assertEquals("A", Literals.unquote("\"\\101\""));
    assertEquals("é", Literals.unquote("\"\\u00e9\""));
    assertEquals("\uD83D\uDE00", Literals.unquote("\"\\U0001F600\""));
    assertEquals("a\\n\nb", Literals.unquote("`a\\n\r\nb`"));
    assertEquals("", Literals.unquote("\"\""));
  }

  @Test
  public void unquoteInvalid() {
    for (String quoted : new String[] {
        "\"a", "'a'", "\"\\'\"", "\"\\q\"", "\"\\x4\"", "\"\\400\"", "\"\\uD800\"", "a" }) {
      try {
        Literals.unquote(quoted);
        fail(quoted);
      } catch (SyntaxException expected) {
        assertEquals("invalid syntax", expected.getMessage());
      }
    }
  }

  @Test
  public void integers() throws SyntaxException {
    assertInt(1000, number("1_000"));
    assertInt(5, number("0b101"));
    assertInt(15, number("0o17"));
    assertInt(15, number("017"));
    assertInt(255, number("0xff"));

    NumberNode negative = number("-7");
    assertTrue(negative.isInt);
    assertFalse(negative.isUint);
    assertEquals(-7, negative.int64);

    NumberNode negativeZero = number("-0");
    assertTrue(negativeZero.isInt);
    assertTrue(negativeZero.isUint);
  }

  @Test
  public void largeUnsigned() throws SyntaxException {
    NumberNode max = number("18446744073709551615");
    assertFalse(max.isInt);
    assertTrue(max.isUint);
    assertTrue(max.isFloat);
    assertEquals("18446744073709551615", Long.toUnsignedString(max.uint64));
  }

  @Test
  public void floats() throws SyntaxException {
    NumberNode thousand = number("1e3");
    assertTrue(thousand.isFloat);
    assertInt(1000, thousand);

    NumberNode quarter = number("0x1p-2");
    assertTrue(quarter.isFloat);
    assertFalse(quarter.isInt);
    assertEquals(0.25, quarter.float64, 0);

    NumberNode half = number(".5");
    assertFalse(half.isUint);
    assertEquals(0.5, half.float64, 0);
  }

  @Test
  public void complex() throws SyntaxException {
    NumberNode c = Literals.parseNumber(0, "1e+3+2i", Type.COMPLEX);
    assertTrue(c.isComplex);
    assertFalse(c.isFloat);
    assertEquals(1000, c.real, 0);
    assertEquals(2, c.imaginary, 0);

    // A zero imaginary part leaves a real number.
    NumberNode real = Literals.parseNumber(0, "4-0i", Type.COMPLEX);
    assertTrue(real.isComplex);
    assertInt(4, real);
  }

  @Test
  public void characters() throws SyntaxException {
    assertInt('a', Literals.parseNumber(0, "'a'", Type.CHAR_CONSTANT));
    assertInt('\n', Literals.parseNumber(0, "'\\n'", Type.CHAR_CONSTANT));
    assertInt('A', Literals.parseNumber(0, "'\\x41'", Type.CHAR_CONSTANT));
    assertInt('\'', Literals.parseNumber(0, "'\\''", Type.CHAR_CONSTANT));
    expectSyntaxException("'ab'", Type.CHAR_CONSTANT, "malformed character constant: 'ab'");
    expectSyntaxException("'\\\"'", Type.CHAR_CONSTANT, "invalid syntax");
  }

  @Test
  public void invalidNumbers() {
    expectSyntaxException("1_", Type.NUMBER, "illegal number syntax: \"1_\"");
    expectSyntaxException("0x", Type.NUMBER, "illegal number syntax: \"0x\"");
    expectSyntaxException("08", Type.NUMBER, "integer overflow: \"08\"");
    expectSyntaxException("1e999", Type.NUMBER, "illegal number syntax: \"1e999\"");
    expectSyntaxException(
        "99999999999999999999", Type.NUMBER, "integer overflow: \"99999999999999999999\"");
  }

  @Test
  public void underscores() {
    assertTrue(Literals.underscoreOk("1_000"));
    assertTrue(Literals.underscoreOk("0x_1f"));
    assertTrue(Literals.underscoreOk("-1_0"));
    assertFalse(Literals.underscoreOk("_1"));
    assertFalse(Literals.underscoreOk("1__0"));
    assertFalse(Literals.underscoreOk("1_"));
    assertFalse(Literals.underscoreOk("1_.5"));
  }

  private static NumberNode number(String text) throws SyntaxException {
    return Literals.parseNumber(0, text, Type.NUMBER);
  }

  private static void assertInt(long expected, NumberNode number) {
    assertTrue(number.text, number.isInt);
    assertTrue(number.text, number.isUint);
    assertTrue(number.text, number.isFloat);
    assertEquals(number.text, expected, number.int64);
    assertEquals(number.text, expected, number.uint64);
    assertEquals(number.text, expected, number.float64, 0);
  }

  private static void expectSyntaxException(String text, Type type, String message) {
    try {
      Literals.parseNumber(0, text, type);
      fail(text);
    } catch (SyntaxException expected) {
      assertEquals(message, expected.getMessage());
    }
  }
}
