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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A node within the parsed content of a template. Nodes are immutable once the {@link Parser}
 * has built them and know nothing about the source text beyond their offset into it; anything
 * that needs the text (line numbers, indentation) goes through the {@link SourceText} owned by
 * the {@link Tree}.
 */
public abstract class Node {

  public enum Type {
    TEXT,
    COMMENT,
    ACTION,
    BOOL,
    CHAIN,
    COMMAND,
    DOT,
    ELSE,
    END,
    FIELD,
    IDENTIFIER,
    BRANCH,
    LIST,
    NIL,
    NUMBER,
    PIPE,
    STRING,
    VARIABLE
  }

  /** Offset of the start of the node in the source text. */
  public final int pos;

  protected Node(int pos) {
    this.pos = pos;
  }

  public abstract Type getType();

  abstract void writeTo(Printer printer);

  /**
   * The node as source text, on as few lines as possible.
   */
  @Override
  public String toString() {
    Printer printer = Printer.detached();
    writeTo(printer);
    return printer.toString();
  }

  /**
   * The trim markers of an action, i.e. whether it was written {{- or -}}.
   */
  public static final class Trim {
    public static final Trim NONE = new Trim(false, false);

    public final boolean left;
    public final boolean right;

    public Trim(boolean left, boolean right) {
      this.left = left;
      this.right = right;
    }

    public String leftDelim() {
      return left ? "{{- " : "{{ ";
    }

    public String rightDelim() {
      return right ? " -}}" : " }}";
    }

    public String rightDelimNoSpace() {
      return right ? "-}}" : "}}";
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof Trim))
        return false;
      Trim other = (Trim) o;
      return left == other.left && right == other.right;
    }

    @Override
    public int hashCode() {
      return (left ? 2 : 0) + (right ? 1 : 0);
    }

    @Override
    public String toString() {
      return leftDelim() + rightDelim();
    }
  }

  /** A sequence of nodes; the body of the document or of a block. */
  public static final class ListNode extends Node {
    public final List<Node> nodes;

    public ListNode(int pos, List<Node> nodes) {
      super(pos);
      this.nodes = Collections.unmodifiableList(new ArrayList<Node>(nodes));
    }

    @Override
    public Type getType() {
      return Type.LIST;
    }

    @Override
    void writeTo(Printer printer) {
      for (Node node : nodes)
        node.writeTo(printer);
    }
  }

  /** Text outside of actions; may span lines. */
  public static final class TextNode extends Node {
    public final String text;

    public TextNode(int pos, String text) {
      super(pos);
      this.text = text;
    }

    @Override
    public Type getType() {
      return Type.TEXT;
    }

    @Override
    void writeTo(Printer printer) {
      printer.writeText(text);
    }
  }

  /** A comment action. The text is everything between the delimiters, markers included. */
  public static final class CommentNode extends Node {
    public final String text;

    public CommentNode(int pos, String text) {
      super(pos);
      this.text = text;
    }

    @Override
    public Type getType() {
      return Type.COMMENT;
    }

    @Override
    void writeTo(Printer printer) {
      printer.write(Lexer.LEFT_DELIM).write(text).write(Lexer.RIGHT_DELIM);
    }
  }

  /** A pipeline with optional declaration: $x, $y := a b | c. */
  public static final class PipeNode extends Node {
    /** The variables are assigned with =, not declared with :=. */
    public final boolean isAssign;
    public final List<VariableNode> decl;
    public final List<CommandNode> cmds;

    public PipeNode(
        int pos, boolean isAssign, List<VariableNode> decl, List<CommandNode> cmds) {
      super(pos);
      this.isAssign = isAssign;
      this.decl = Collections.unmodifiableList(new ArrayList<VariableNode>(decl));
      this.cmds = Collections.unmodifiableList(new ArrayList<CommandNode>(cmds));
    }

    @Override
    public Type getType() {
      return Type.PIPE;
    }

    @Override
    void writeTo(Printer printer) {
      if (!decl.isEmpty()) {
        for (int i = 0; i < decl.size(); i++) {
          if (i > 0)
            printer.write(", ");
          decl.get(i).writeTo(printer);
        }
        printer.write(isAssign ? " = " : " := ");
      }
      for (int i = 0; i < cmds.size(); i++) {
        if (i > 0)
          printer.write(" | ");
        cmds.get(i).writeTo(printer);
      }
    }
  }

  /** {{pipeline}}, an action which isn't a control structure. */
  public static final class ActionNode extends Node {
    public final PipeNode pipe;
    public final Trim trim;

    /** @param pos offset of the left delimiter */
    public ActionNode(int pos, PipeNode pipe, Trim trim) {
      super(pos);
      this.pipe = pipe;
      this.trim = trim;
    }

    @Override
    public Type getType() {
      return Type.ACTION;
    }

    @Override
    void writeTo(Printer printer) {
      printer.writeAction(pos, trim, "", pipe);
    }
  }

  /** One stage of a pipeline: space separated operands. */
  public static final class CommandNode extends Node {
    public final List<Node> args;

    public CommandNode(int pos, List<Node> args) {
      super(pos);
      this.args = Collections.unmodifiableList(new ArrayList<Node>(args));
    }

    @Override
    public Type getType() {
      return Type.COMMAND;
    }

    @Override
    void writeTo(Printer printer) {
      int previousLine = 0;
      for (int i = 0; i < args.size(); i++) {
        Node arg = args.get(i);
        int line = printer.lineOf(arg);
        if (i > 0) {
          // Keep operands that were written on a later line on a later line.
          if (line > previousLine) {
            printer.write('\n');
            printer.writePrefix();
          } else {
            printer.write(' ');
          }
        }
        previousLine = line;
        if (arg instanceof PipeNode)
          printer.writeParenthesized((PipeNode) arg);
        else
          arg.writeTo(printer);
      }
    }
  }

  /** A function name. */
  public static final class IdentifierNode extends Node {
    public final String ident;

    public IdentifierNode(int pos, String ident) {
      super(pos);
      this.ident = ident;
    }

    @Override
    public Type getType() {
      return Type.IDENTIFIER;
    }

    @Override
    void writeTo(Printer printer) {
      printer.write(ident);
    }
  }

  /** $x or $x.Field.Chain. The first name includes the dollar sign. */
  public static final class VariableNode extends Node {
    public final List<String> ident;

    public VariableNode(int pos, List<String> ident) {
      super(pos);
      this.ident = Collections.unmodifiableList(new ArrayList<String>(ident));
    }

    public VariableNode(int pos, String ident) {
      this(pos, Arrays.asList(ident.split("\\.", -1)));
    }

    @Override
    public Type getType() {
      return Type.VARIABLE;
    }

    @Override
    void writeTo(Printer printer) {
      for (int i = 0; i < ident.size(); i++) {
        if (i > 0)
          printer.write('.');
        printer.write(ident.get(i));
      }
    }
  }

  /** The cursor, '.'. */
  public static final class DotNode extends Node {
    public DotNode(int pos) {
      super(pos);
    }

    @Override
    public Type getType() {
      return Type.DOT;
    }

    @Override
    void writeTo(Printer printer) {
      printer.write('.');
    }
  }

  /** The untyped nil constant. */
  public static final class NilNode extends Node {
    public NilNode(int pos) {
      super(pos);
    }

    @Override
    public Type getType() {
      return Type.NIL;
    }

    @Override
    void writeTo(Printer printer) {
      printer.write("nil");
    }
  }

  /** .Field or .Field.Chain. The names don't include the dots. */
  public static final class FieldNode extends Node {
    public final List<String> ident;

    public FieldNode(int pos, List<String> ident) {
      super(pos);
      this.ident = Collections.unmodifiableList(new ArrayList<String>(ident));
    }

    /** @param ident a field token, with its leading dot */
    public FieldNode(int pos, String ident) {
      this(pos, Arrays.asList(ident.substring(1).split("\\.", -1)));
    }

    @Override
    public Type getType() {
      return Type.FIELD;
    }

    @Override
    void writeTo(Printer printer) {
      for (String id : ident)
        printer.write('.').write(id);
    }
  }

  /** A term followed by field accesses, e.g. (pipeline).Field or fn.Field. */
  public static final class ChainNode extends Node {
    public final Node node;
    public final List<String> fields;

    public ChainNode(int pos, Node node, List<String> fields) {
      super(pos);
      if (fields.isEmpty())
        throw new IllegalArgumentException("A chain needs at least one field");
      this.node = node;
      this.fields = Collections.unmodifiableList(new ArrayList<String>(fields));
    }

    @Override
    public Type getType() {
      return Type.CHAIN;
    }

    @Override
    void writeTo(Printer printer) {
      if (node instanceof PipeNode)
        printer.writeParenthesized((PipeNode) node);
      else
        node.writeTo(printer);
      for (String field : fields)
        printer.write('.').write(field);
    }
  }

  /** true or false. */
  public static final class BoolNode extends Node {
    public final boolean value;

    public BoolNode(int pos, boolean value) {
      super(pos);
      this.value = value;
    }

    @Override
    public Type getType() {
      return Type.BOOL;
    }

    @Override
    void writeTo(Printer printer) {
      printer.write(value ? "true" : "false");
    }
  }

  /**
   * A numeric constant, stored under every type that can represent its value: 1 is an int, a
   * uint and a float; 1.5 only a float; 2i only a complex.
   */
  public static final class NumberNode extends Node {
    public final String text;
    public final boolean isInt;
    public final boolean isUint;
    public final boolean isFloat;
    public final boolean isComplex;
    public final long int64;
    /** Unsigned; see {@link Long#toUnsignedString}. */
    public final long uint64;
    public final double float64;
    public final double real;
    public final double imaginary;

    public NumberNode(
        int pos,
        String text,
        boolean isInt,
        boolean isUint,
        boolean isFloat,
        boolean isComplex,
        long int64,
        long uint64,
        double float64,
        double real,
        double imaginary) {
      super(pos);
      this.text = text;
      this.isInt = isInt;
      this.isUint = isUint;
      this.isFloat = isFloat;
      this.isComplex = isComplex;
      this.int64 = int64;
      this.uint64 = uint64;
      this.float64 = float64;
      this.real = real;
      this.imaginary = imaginary;
    }

    @Override
    public Type getType() {
      return Type.NUMBER;
    }

    @Override
    void writeTo(Printer printer) {
      printer.write(text);
    }
  }

  /** A string constant. The quoted form is what gets printed. */
  public static final class StringNode extends Node {
    public final String quoted;
    public final String text;

    public StringNode(int pos, String quoted, String text) {
      super(pos);
      this.quoted = quoted;
      this.text = text;
    }

    @Override
    public Type getType() {
      return Type.STRING;
    }

    @Override
    void writeTo(Printer printer) {
      printer.write(quoted);
    }
  }

  /**
   * Every block: {{if}}, {{range}}, {{with}}, {{define}}, {{block}}. The keyword is only kept
   * for printing.
   */
  public static final class BranchNode extends Node {
    public final String keyword;
    public final PipeNode pipe;
    public final ListNode list;
    public final List<ElseNode> elses;
    public final EndNode end;
    public final Trim trim;

    /** @param pos offset of the left delimiter */
    public BranchNode(
        int pos,
        String keyword,
        PipeNode pipe,
        ListNode list,
        List<ElseNode> elses,
        EndNode end,
        Trim trim) {
      super(pos);
      this.keyword = keyword;
      this.pipe = pipe;
      this.list = list;
      this.elses = Collections.unmodifiableList(new ArrayList<ElseNode>(elses));
      this.end = end;
      this.trim = trim;
    }

    @Override
    public Type getType() {
      return Type.BRANCH;
    }

    @Override
    void writeTo(Printer printer) {
      printer.writeAction(pos, trim, keyword + " ", pipe);
      list.writeTo(printer);
      for (ElseNode elseNode : elses)
        elseNode.writeTo(printer);
      end.writeTo(printer);
    }
  }

  /** {{else}} or {{else if pipeline}} and the nodes following it. */
  public static final class ElseNode extends Node {
    /** Null for a plain {{else}}. */
    public final PipeNode pipe;
    public final ListNode list;
    public final Trim trim;

    /** @param pos offset of the left delimiter */
    public ElseNode(int pos, PipeNode pipe, ListNode list, Trim trim) {
      super(pos);
      this.pipe = pipe;
      this.list = list;
      this.trim = trim;
    }

    @Override
    public Type getType() {
      return Type.ELSE;
    }

    @Override
    void writeTo(Printer printer) {
      printer.writeAction(pos, trim, pipe == null ? "else" : "else if ", pipe);
      list.writeTo(printer);
    }
  }

  /** {{end}}. */
  public static final class EndNode extends Node {
    public final Trim trim;

    /** @param pos offset of the left delimiter */
    public EndNode(int pos, Trim trim) {
      super(pos);
      this.trim = trim;
    }

    @Override
    public Type getType() {
      return Type.END;
    }

    @Override
    void writeTo(Printer printer) {
      printer.writeAction(pos, trim, "end", null);
    }
  }
}
