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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.lman.tmplfmt.parse.Token.Type;

public class LexerTest {

  @Test
  public void text() {
    assertTokens("hello", "TEXT hello", "EOF");
    assertTokens("", "EOF");
  }

  @Test
  public void simpleAction() {
    assertTokens("a{{.X}}b",
        "TEXT a", "LEFT_DELIM {{", "FIELD .X", "RIGHT_DELIM }}", "TEXT b", "EOF");
  }

  @Test
  public void spaces() {
    assertTokens("{{ .X  | f\n}}",
        "LEFT_DELIM {{",
        "SPACE  ",
        "FIELD .X",
        "SPACE   ",
        "PIPE |",
        "SPACE  ",
        "IDENTIFIER f",
        "SPACE \n",
        "RIGHT_DELIM }}",
        "EOF");
  }

  @Test
  public void trimMarkers() {
    List<Token> tokens = lex("{{- .X -}}");
    assertEquals(Type.LEFT_DELIM, tokens.get(0).type);
    assertTrue(tokens.get(0).trimLeft);
    assertEquals(Type.FIELD, tokens.get(1).type);
    assertEquals(Type.RIGHT_DELIM, tokens.get(2).type);
    assertTrue(tokens.get(2).trimRight);

    // The space before " -}}" belongs to the delimiter, the others are spaces.
    assertTokens("{{.X  -}}", "LEFT_DELIM {{", "FIELD .X", "SPACE  ", "RIGHT_DELIM  -}}", "EOF");

    // No space after the dash, so it's a negative number.
    tokens = lex("{{-3}}");
    assertFalse(tokens.get(0).trimLeft);
    assertEquals("-3", tokens.get(1).value);
    assertEquals(Type.NUMBER, tokens.get(1).type);
  }

  @Test
  public void comments() {
    assertTokens("a{{/* hi */}}b", "TEXT a", "COMMENT /* hi */", "TEXT b", "EOF");
    assertTokens("{{- /* hi */ -}}", "COMMENT - /* hi */ -", "EOF");
    assertTokens("{{/* x }}", "ERROR unclosed comment", "EOF");
    assertTokens("{{/* x */ }}", "ERROR comment ends before closing delimiter", "EOF");
  }

  @Test
  public void keywords() {
    assertTokens("{{if}}{{else}}{{end}}{{range}}{{with}}{{define}}{{block}}",
        "LEFT_DELIM {{", "IF if", "RIGHT_DELIM }}",
        "LEFT_DELIM {{", "ELSE else", "RIGHT_DELIM }}",
        "LEFT_DELIM {{", "END end", "RIGHT_DELIM }}",
        "LEFT_DELIM {{", "BRANCH range", "RIGHT_DELIM }}",
        "LEFT_DELIM {{", "BRANCH with", "RIGHT_DELIM }}",
        "LEFT_DELIM {{", "BRANCH define", "RIGHT_DELIM }}",
        "LEFT_DELIM {{", "BRANCH block", "RIGHT_DELIM }}",
        "EOF");
    assertTokens("{{nil true false template}}",
        "LEFT_DELIM {{", "NIL nil", "SPACE  ", "BOOL true", "SPACE  ", "BOOL false",
        "SPACE  ", "IDENTIFIER template", "RIGHT_DELIM }}", "EOF");
  }

  @Test
  public void variablesAndFields() {
    assertTokens("{{$ $x.Y . .A.B}}",
        "LEFT_DELIM {{",
        "VARIABLE $",
        "SPACE  ",
        "VARIABLE $x",
        "FIELD .Y",
        "SPACE  ",
        "DOT .",
        "SPACE  ",
        "FIELD .A",
        "FIELD .B",
        "RIGHT_DELIM }}",
        "EOF");
  }

  @Test
  public void declarations() {
    assertTokens("{{$k, $v := .}}",
        "LEFT_DELIM {{", "VARIABLE $k", "COMMA ,", "SPACE  ", "VARIABLE $v", "SPACE  ",
        "DECLARE :=", "SPACE  ", "DOT .", "RIGHT_DELIM }}", "EOF");
    assertTokens("{{$x = 1}}",
        "LEFT_DELIM {{", "VARIABLE $x", "SPACE  ", "ASSIGN =", "SPACE  ", "NUMBER 1",
        "RIGHT_DELIM }}", "EOF");
  }

  @Test
  public void literals() {
    assertTokens("{{1 0x1F 1_000 1.5e3 .5 0x1p-2 1+2i 'a' \"s\\\"\" `r\nr` @}}",
        "LEFT_DELIM {{",
        "NUMBER 1", "SPACE  ",
        "NUMBER 0x1F", "SPACE  ",
        "NUMBER 1_000", "SPACE  ",
        "NUMBER 1.5e3", "SPACE  ",
        "NUMBER .5", "SPACE  ",
        "NUMBER 0x1p-2", "SPACE  ",
        "COMPLEX 1+2i", "SPACE  ",
        "CHAR_CONSTANT 'a'", "SPACE  ",
        "STRING \"s\\\"\"", "SPACE  ",
        "RAW_STRING `r\nr`", "SPACE  ",
        "CHAR @",
        "RIGHT_DELIM }}",
        "EOF");
  }

  @Test
  public void parens() {
    assertTokens("{{(f .X).Y}}",
        "LEFT_DELIM {{", "LEFT_PAREN (", "IDENTIFIER f", "SPACE  ", "FIELD .X",
        "RIGHT_PAREN )", "FIELD .Y", "RIGHT_DELIM }}", "EOF");
  }

  @Test
  public void errors() {
    assertTokens("{{.X", "LEFT_DELIM {{", "FIELD .X", "ERROR unclosed action", "EOF");
    assertTokens("{{(.X}}",
        "LEFT_DELIM {{", "LEFT_PAREN (", "FIELD .X", "ERROR unclosed left paren", "EOF");
    assertTokens("{{.X)}}",
        "LEFT_DELIM {{", "FIELD .X", "ERROR unexpected right paren U+0029 ')'", "EOF");
    assertTokens("{{\"abc}}", "LEFT_DELIM {{", "ERROR unterminated quoted string", "EOF");
    assertTokens("{{`abc}}", "LEFT_DELIM {{", "ERROR unterminated raw quoted string", "EOF");
    assertTokens("{{'a}}", "LEFT_DELIM {{", "ERROR unterminated character constant", "EOF");
    assertTokens("{{.X#}}", "LEFT_DELIM {{", "ERROR bad character U+0023 '#'", "EOF");
    assertTokens("{{3k}}", "LEFT_DELIM {{", "ERROR bad number syntax: \"3k\"", "EOF");
    assertTokens("{{a:b}}", "LEFT_DELIM {{", "IDENTIFIER a", "ERROR expected :=", "EOF");
    assertTokens("{{§}}",
        "LEFT_DELIM {{", "ERROR unrecognized character in action: U+00A7 '§'", "EOF");
  }

  @Test
  public void positions() {
    List<Token> tokens = lex("a\n{{.X\n}}b");
    assertEquals(Arrays.asList(0, 2, 4, 6, 7, 9, 10), positions(tokens));
    assertEquals(Arrays.asList(1, 2, 2, 2, 3, 3, 3), lines(tokens));
  }

  private static List<Token> lex(String input) {
    Lexer lexer = new Lexer(input);
    List<Token> tokens = new ArrayList<Token>();
    Token token;
    do {
      token = lexer.nextToken();
      tokens.add(token);
    } while (token.type != Type.EOF);
    return tokens;
  }

  private static void assertTokens(String input, String... expected) {
    List<String> actual = new ArrayList<String>();
    for (Token token : lex(input))
      actual.add(token.type == Type.EOF ? "EOF" : token.type + " " + token.value);
    assertEquals(Arrays.asList(expected), actual);
  }

  private static List<Integer> positions(List<Token> tokens) {
    List<Integer> positions = new ArrayList<Integer>();
    for (Token token : tokens)
      positions.add(token.pos);
    return positions;
  }

  private static List<Integer> lines(List<Token> tokens) {
    List<Integer> lines = new ArrayList<Integer>();
    for (Token token : tokens)
      lines.add(token.line);
    return lines;
  }
}
