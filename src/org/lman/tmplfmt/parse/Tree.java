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

import org.lman.common.Struct;
import org.lman.tmplfmt.parse.Node.ListNode;

/**
 * A parsed template: the root of its nodes together with the text they were parsed from.
 */
public final class Tree {

  /**
   * Where a node is and what it looks like, for messages about it.
   */
  public static class ErrorContext extends Struct {
    /** line:column */
    public final String location;
    public final String context;

    public ErrorContext(String location, String context) {
      this.location = location;
      this.context = context;
    }
  }

  public final SourceText source;
  public final ListNode root;

  Tree(SourceText source, ListNode root) {
    this.source = source;
    this.root = root;
  }

  /**
   * Prints the tree with normalised whitespace, using {@code indent} once per level of nesting
   * when an action goes over several lines.
   */
  public String print(String indent) {
    Printer printer = new Printer(source, indent, false);
    root.writeTo(printer);
    return printer.toString();
  }

  /**
   * Describes a node of this tree. With {@code quoteText} the text nodes within the context are
   * quoted, which makes leading and trailing whitespace visible.
   */
  public ErrorContext errorContext(Node node, boolean quoteText) {
    Printer printer = new Printer(null, "\t", quoteText);
    node.writeTo(printer);
    return new ErrorContext(
        source.lineOf(node.pos) + ":" + source.columnOf(node.pos), printer.toString());
  }

  @Override
  public String toString() {
    return print("\t");
  }
}
