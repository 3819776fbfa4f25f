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

import org.lman.tmplfmt.parse.Node.PipeNode;
import org.lman.tmplfmt.parse.Node.Trim;

/**
 * The state of printing a tree: the output so far, plus the indentation to use when an action
 * is broken over several lines.
 *
 * An action's indentation is the whitespace before its {{ on the source line, captured only when
 * there's nothing else before it on that line. Operands continued on a later line get that
 * indentation plus one unit per level of nesting (the action body, then each parenthesised
 * pipeline).
 */
final class Printer {

  private final StringBuilder text = new StringBuilder();
  /** Null when printing a node on its own, e.g. for diagnostics. */
  private final SourceText source;
  private final String indent;
  private final boolean quoteText;

  private String prefix = "";
  private int depth = 0;
  private int newlines = 0;

  Printer(SourceText source, String indent, boolean quoteText) {
    this.source = source;
    this.indent = indent;
    this.quoteText = quoteText;
  }

  static Printer detached() {
    return new Printer(null, "\t", false);
  }

  Printer write(String s) {
    for (int i = 0; i < s.length(); i++) {
      if (s.charAt(i) == '\n')
        newlines++;
    }
    text.append(s);
    return this;
  }

  Printer write(char c) {
    if (c == '\n')
      newlines++;
    text.append(c);
    return this;
  }

  void writeText(String s) {
    write(quoteText ? Literals.quote(s) : s);
  }

  void writePrefix() {
    write(prefix);
    for (int i = 0; i < depth; i++)
      write(indent);
  }

  /** Source line of a node; all nodes are on line 0 when detached. */
  int lineOf(Node node) {
    return source == null ? 0 : source.lineOf(node.pos);
  }

  /**
   * Writes {{ head pipe }}. When the pipe is spread over several lines and the action starts its
   * line, the closing delimiter goes on a line of its own, lined up with the opening one.
   */
  void writeAction(int delimPos, Trim trim, String head, PipeNode pipe) {
    String indentation = source == null ? null : source.indentationBefore(delimPos);
    prefix = indentation == null ? "" : indentation;

    write(trim.leftDelim()).write(head);
    int before = newlines;
    if (pipe != null) {
      depth = 1;
      pipe.writeTo(this);
      depth = 0;
    }
    if (indentation != null && newlines != before) {
      write('\n');
      writePrefix();
      write(trim.rightDelimNoSpace());
    } else {
      write(trim.rightDelim());
    }
  }

  /** Writes (pipe), closing the paren on its own line if the pipe went over several. */
  void writeParenthesized(PipeNode pipe) {
    write('(');
    int before = newlines;
    depth++;
    pipe.writeTo(this);
    depth--;
    if (newlines != before) {
      write('\n');
      writePrefix();
    }
    write(')');
  }

  @Override
  public String toString() {
    return text.toString();
  }
}
