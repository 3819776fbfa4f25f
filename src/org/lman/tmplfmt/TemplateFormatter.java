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

package org.lman.tmplfmt;

import org.lman.tmplfmt.parse.Node;
import org.lman.tmplfmt.parse.ParseException;
import org.lman.tmplfmt.parse.Parser;
import org.lman.tmplfmt.parse.Tree;
import org.lman.tmplfmt.parse.Tree.ErrorContext;

/**
 * Normalises the whitespace within the actions of a template, leaving text alone:
 *
 *   {{if   .X}}  a{{else}}b{{end}}
 *
 * becomes
 *
 *   {{ if .X }}  a{{ else }}b{{ end }}
 *
 * Formatting is idempotent, and the result renders the same as the input.
 */
public final class TemplateFormatter {

  private final String indent;
  private final boolean quoteText;

  public TemplateFormatter() {
    this(new FormatOptions());
  }

  public TemplateFormatter(FormatOptions options) throws ConfigException {
    options.validate();
    this.indent = options.indent;
    this.quoteText = options.quoteText;
  }

  /**
   * @throws ParseException if the template is malformed. Nothing is returned in that case, not
   *     even partial output.
   */
  public String format(String text) throws ParseException {
    return parse(text).print(indent);
  }

  public Tree parse(String text) throws ParseException {
    return Parser.parse(text);
  }

  /** Describes {@code node}, which must be within {@code tree}. */
  public ErrorContext errorContext(Tree tree, Node node) {
    return tree.errorContext(node, quoteText);
  }
}
