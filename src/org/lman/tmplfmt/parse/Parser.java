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
import java.util.List;

import org.lman.tmplfmt.parse.Literals.SyntaxException;
import org.lman.tmplfmt.parse.Node.ActionNode;
import org.lman.tmplfmt.parse.Node.BoolNode;
import org.lman.tmplfmt.parse.Node.BranchNode;
import org.lman.tmplfmt.parse.Node.ChainNode;
import org.lman.tmplfmt.parse.Node.CommandNode;
import org.lman.tmplfmt.parse.Node.CommentNode;
import org.lman.tmplfmt.parse.Node.DotNode;
import org.lman.tmplfmt.parse.Node.ElseNode;
import org.lman.tmplfmt.parse.Node.EndNode;
import org.lman.tmplfmt.parse.Node.FieldNode;
import org.lman.tmplfmt.parse.Node.IdentifierNode;
import org.lman.tmplfmt.parse.Node.ListNode;
import org.lman.tmplfmt.parse.Node.NilNode;
import org.lman.tmplfmt.parse.Node.PipeNode;
import org.lman.tmplfmt.parse.Node.StringNode;
import org.lman.tmplfmt.parse.Node.TextNode;
import org.lman.tmplfmt.parse.Node.Trim;
import org.lman.tmplfmt.parse.Node.VariableNode;
import org.lman.tmplfmt.parse.Token.Type;

/**
 * Recursive descent parser from the tokens of a {@link Lexer} to a {@link Tree}.
 *
 * All the block keywords (if, range, with, define, block) share one grammar:
 *
 *   {{keyword pipeline}} items ({{else}} items | {{else if pipeline}} items)* {{end}}
 *
 * so the parser only remembers which keyword it saw, for printing.
 */
public final class Parser {

  /**
   * The result of parsing one item of a list. An {{else}} or {{end}} ends the list it's in
   * rather than becoming part of it, so they're kept apart from the nodes.
   */
  private static final class Item {
    enum Kind { NODE, ELSE, END }

    final Kind kind;
    final Node node;
    final ElseClause elseClause;
    final EndNode end;

    private Item(Kind kind, Node node, ElseClause elseClause, EndNode end) {
      this.kind = kind;
      this.node = node;
      this.elseClause = elseClause;
      this.end = end;
    }

    static Item node(Node node) {
      return new Item(Kind.NODE, node, null, null);
    }

    static Item elseClause(ElseClause elseClause) {
      return new Item(Kind.ELSE, null, elseClause, null);
    }

    static Item end(EndNode end) {
      return new Item(Kind.END, null, null, end);
    }
  }

  /** An {{else}} or {{else if}} whose body hasn't been parsed yet. */
  private static final class ElseClause {
    final int pos;
    final PipeNode pipe;
    final Trim trim;

    ElseClause(int pos, PipeNode pipe, Trim trim) {
      this.pos = pos;
      this.pipe = pipe;
      this.trim = trim;
    }

    ElseNode withBody(ListNode list) {
      return new ElseNode(pos, pipe, list, trim);
    }
  }

  private final SourceText source;
  private final TokenBuffer tokens;

  /** Line of the left delimiter of the action being parsed, 0 outside of actions. */
  private int actionLine = 0;

  private Parser(SourceText source) {
    this.source = source;
    this.tokens = new TokenBuffer(new Lexer(source.getText()));
  }

  /**
   * Parses a whole template.
   */
  public static Tree parse(String text) throws ParseException {
    SourceText source = new SourceText(text);
    return new Tree(source, new Parser(source).parseTemplate());
  }

  private ListNode parseTemplate() {
    int pos = tokens.peek().pos;
    List<Node> nodes = new ArrayList<Node>();
    while (tokens.peek().type != Type.EOF) {
      Item item = textOrAction();
      switch (item.kind) {
        case ELSE:
          throw error(item.elseClause.pos,
              "unexpected " + item.elseClause.withBody(new ListNode(item.elseClause.pos,
                  new ArrayList<Node>())));
        case END:
          throw error(item.end.pos, "unexpected " + item.end);
        default:
          nodes.add(item.node);
      }
    }
    return new ListNode(pos, nodes);
  }

  /**
   * Parses items into {@code nodes} up to the {{else}} or {{end}} which terminates them, and
   * returns that terminator.
   */
  private Item itemList(List<Node> nodes) {
    while (tokens.peekNonSpace().type != Type.EOF) {
      Item item = textOrAction();
      if (item.kind != Item.Kind.NODE)
        return item;
      nodes.add(item.node);
    }
    throw error(tokens.peek(), "unexpected EOF");
  }

  private Item textOrAction() {
    Token token = tokens.nextNonSpace();
    switch (token.type) {
      case TEXT:
        return Item.node(new TextNode(token.pos, token.value));
      case COMMENT:
        return Item.node(new CommentNode(token.pos, token.value));
      case LEFT_DELIM:
        actionLine = token.line;
        try {
          return action(token);
        } finally {
          actionLine = 0;
        }
      default:
        throw unexpected(token, "input");
    }
  }

  /**
   * Parses what follows a left delimiter: a control keyword or a plain pipeline.
   */
  private Item action(Token leftDelim) {
    Token token = tokens.nextNonSpace();
    switch (token.type) {
      case ELSE:
        return elseControl(leftDelim);
      case END:
        return endControl(leftDelim);
      case IF:
      case BRANCH:
        return Item.node(branchControl(leftDelim, token.value));
      default:
        break;
    }
    tokens.pushBack(token);
    PipeNode pipe = pipeline("command", Type.RIGHT_DELIM, token.pos);
    Token rightDelim = tokens.nextNonSpace();
    return Item.node(new ActionNode(leftDelim.pos, pipe, trim(leftDelim, rightDelim)));
  }

  private BranchNode branchControl(Token leftDelim, String keyword) {
    PipeNode pipe = pipeline(keyword, Type.RIGHT_DELIM, tokens.peekNonSpace().pos);
    Token rightDelim = tokens.nextNonSpace();

    List<Node> nodes = new ArrayList<Node>();
    int listPos = tokens.peek().pos;
    Item next = itemList(nodes);
    ListNode list = new ListNode(listPos, nodes);

    List<ElseNode> elses = new ArrayList<ElseNode>();
    while (next.kind == Item.Kind.ELSE) {
      ElseClause elseClause = next.elseClause;
      List<Node> elseNodes = new ArrayList<Node>();
      int elsePos = tokens.peek().pos;
      next = itemList(elseNodes);
      elses.add(elseClause.withBody(new ListNode(elsePos, elseNodes)));
    }
    return new BranchNode(
        leftDelim.pos, keyword, pipe, list, elses, next.end, trim(leftDelim, rightDelim));
  }

  private Item elseControl(Token leftDelim) {
    PipeNode pipe = null;
    Token rightDelim;
    if (tokens.peekNonSpace().type == Type.IF) {
      tokens.nextNonSpace();
      pipe = pipeline("else if", Type.RIGHT_DELIM, tokens.peekNonSpace().pos);
      rightDelim = tokens.nextNonSpace();
    } else {
      rightDelim = expect(Type.RIGHT_DELIM, "else");
    }
    return Item.elseClause(new ElseClause(leftDelim.pos, pipe, trim(leftDelim, rightDelim)));
  }

  private Item endControl(Token leftDelim) {
    Token rightDelim = expect(Type.RIGHT_DELIM, "end");
    return Item.end(new EndNode(leftDelim.pos, trim(leftDelim, rightDelim)));
  }

  /**
   * Parses
   *
   *   declarations? command ('|' command)*
   *
   * up to, but not including, the {@code end} token.
   */
  private PipeNode pipeline(String context, Type end, int pos) {
    boolean isAssign = false;
    boolean declared = false;
    List<VariableNode> decl = new ArrayList<VariableNode>();

    while (tokens.peekNonSpace().type == Type.VARIABLE) {
      Token variable = tokens.next();
      // Spaces are tokens, so "$x foo" needs the token after the space to tell that $x is an
      // operand rather than being declared. Remember the token adjacent to the variable so that
      // both can be pushed back.
      Token afterVariable = tokens.peek();
      Token next = tokens.peekNonSpace();
      if (next.type == Type.ASSIGN || next.type == Type.DECLARE) {
        tokens.nextNonSpace();
        isAssign = next.type == Type.ASSIGN;
        declared = true;
        decl.add(new VariableNode(variable.pos, variable.value));
        break;
      } else if (next.type == Type.COMMA) {
        tokens.nextNonSpace();
        decl.add(new VariableNode(variable.pos, variable.value));
        if (context.equals("range") && decl.size() < 2) {
          Type following = tokens.peekNonSpace().type;
          if (following == Type.VARIABLE
              || following == Type.RIGHT_DELIM
              || following == Type.RIGHT_PAREN)
            continue;
          throw error(tokens.peekNonSpace(), "range can only initialize variables");
        }
        throw error(next, "too many declarations in " + context);
      } else if (afterVariable.type == Type.SPACE) {
        tokens.pushBack(afterVariable);
        tokens.pushBack(variable);
        break;
      } else {
        tokens.pushBack(variable);
        break;
      }
    }
    if (!decl.isEmpty() && !declared)
      throw error(tokens.peekNonSpace(), "unterminated declaration in " + context);

    List<CommandNode> cmds = new ArrayList<CommandNode>();
    boolean afterPipe = false;
    while (true) {
      Token token = tokens.nextNonSpace();
      if (token.type == end) {
        if (afterPipe)
          throw error(token, "missing value for " + context);
        tokens.pushBack(token);
        checkPipeline(cmds, context, token);
        return new PipeNode(pos, isAssign, decl, cmds);
      }
      switch (token.type) {
        case PIPE:
          if (cmds.isEmpty() || afterPipe)
            throw error(token, "missing value for " + context);
          afterPipe = true;
          break;
        case BOOL:
        case CHAR_CONSTANT:
        case COMPLEX:
        case DOT:
        case FIELD:
        case IDENTIFIER:
        case NUMBER:
        case NIL:
        case RAW_STRING:
        case STRING:
        case VARIABLE:
        case LEFT_PAREN:
          tokens.pushBack(token);
          cmds.add(command());
          afterPipe = false;
          break;
        default:
          throw unexpected(token, context);
      }
    }
  }

  private void checkPipeline(List<CommandNode> cmds, String context, Token at) {
    if (cmds.isEmpty())
      throw error(at, "missing value for " + context);
    // Only the first command of a pipeline can start with a non executable operand; with A|B|C,
    // stage 2 is B.
    for (int i = 1; i < cmds.size(); i++) {
      CommandNode cmd = cmds.get(i);
      switch (cmd.args.get(0).getType()) {
        case BOOL:
        case DOT:
        case NIL:
        case NUMBER:
        case STRING:
          throw error(cmd.pos, "non executable command in pipeline stage " + (i + 1));
        default:
          break;
      }
    }
  }

  /**
   * Parses space separated operands up to a pipe or the end of the pipeline, neither of which
   * is consumed.
   */
  private CommandNode command() {
    int pos = tokens.peekNonSpace().pos;
    List<Node> args = new ArrayList<Node>();
    while (true) {
      Node operand = operand();
      if (operand != null)
        args.add(operand);
      Token token = tokens.next();
      if (token.type == Type.SPACE)
        continue;
      if (token.type == Type.RIGHT_DELIM
          || token.type == Type.RIGHT_PAREN
          || token.type == Type.PIPE) {
        tokens.pushBack(token);
        break;
      }
      throw unexpected(token, "operand");
    }
    if (args.isEmpty())
      throw error(pos, "empty command");
    return new CommandNode(pos, args);
  }

  /**
   * Parses a term followed by any number of field accesses. Returns null if the next token
   * doesn't start a term.
   */
  private Node operand() {
    Node node = term();
    if (node == null)
      return null;
    if (tokens.peek().type != Type.FIELD)
      return node;

    List<String> fields = new ArrayList<String>();
    while (tokens.peek().type == Type.FIELD)
      fields.add(tokens.next().value.substring(1));

    // Fields on a field or variable extend it; anything else becomes a chain. Literals have no
    // fields at all.
    switch (node.getType()) {
      case FIELD: {
        List<String> ident = new ArrayList<String>(((FieldNode) node).ident);
        ident.addAll(fields);
        return new FieldNode(node.pos, ident);
      }
      case VARIABLE: {
        List<String> ident = new ArrayList<String>(((VariableNode) node).ident);
        ident.addAll(fields);
        return new VariableNode(node.pos, ident);
      }
      case BOOL:
      case STRING:
      case NUMBER:
      case NIL:
      case DOT:
        throw error(node.pos, "unexpected . after term " + Literals.quote(node.toString()));
      default:
        return new ChainNode(node.pos, node, fields);
    }
  }

  /**
   * Parses a literal, identifier, dot, field, variable or parenthesised pipeline. Returns null
   * if the next token is none of those.
   */
  private Node term() {
    Token token = tokens.nextNonSpace();
    switch (token.type) {
      case IDENTIFIER:
        return new IdentifierNode(token.pos, token.value);
      case DOT:
        return new DotNode(token.pos);
      case NIL:
        return new NilNode(token.pos);
      case VARIABLE:
        return new VariableNode(token.pos, token.value);
      case FIELD:
        return new FieldNode(token.pos, token.value);
      case BOOL:
        return new BoolNode(token.pos, token.value.equals("true"));
      case CHAR_CONSTANT:
      case COMPLEX:
      case NUMBER:
        try {
          return Literals.parseNumber(token.pos, token.value, token.type);
        } catch (SyntaxException e) {
          throw error(token, e.getMessage());
        }
      case LEFT_PAREN: {
        PipeNode pipe = pipeline("parenthesized pipeline", Type.RIGHT_PAREN, token.pos);
        tokens.nextNonSpace();
        return pipe;
      }
      case STRING:
      case RAW_STRING:
        try {
          return new StringNode(token.pos, token.value, Literals.unquote(token.value));
        } catch (SyntaxException e) {
          throw error(token, e.getMessage());
        }
      default:
        tokens.pushBack(token);
        return null;
    }
  }

  private Token expect(Type expected, String context) {
    Token token = tokens.nextNonSpace();
    if (token.type != expected)
      throw unexpected(token, context);
    return token;
  }

  private ParseException unexpected(Token token, String context) {
    if (token.type == Type.ERROR) {
      String extra = "";
      if (actionLine != 0 && actionLine != token.line) {
        extra = " in action started at :" + actionLine;
        // Avoid "unclosed action in action started at".
        if (token.value.endsWith(" action"))
          extra = extra.substring(" in action".length());
      }
      return error(token, token.value + extra);
    }
    return error(token, "unexpected " + token + " in " + context);
  }

  private static Trim trim(Token leftDelim, Token rightDelim) {
    return new Trim(leftDelim.trimLeft, rightDelim.trimRight);
  }

  private ParseException error(Token token, String message) {
    return error(token.pos, message);
  }

  private ParseException error(int pos, String message) {
    return new ParseException(message, source.lineOf(pos), source.columnOf(pos));
  }
}
