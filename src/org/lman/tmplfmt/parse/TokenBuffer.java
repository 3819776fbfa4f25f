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

import java.util.ArrayDeque;
import java.util.Deque;

import org.lman.tmplfmt.parse.Token.Type;

/**
 * Look-ahead over the tokens of a {@link Lexer}. At most three tokens can be pending, which is
 * what it takes to tell "$x := ..." from "$x foo" when spaces are tokens too.
 */
final class TokenBuffer {

  static final int CAPACITY = 3;

  private final Lexer lexer;
  private final Deque<Token> pending = new ArrayDeque<Token>(CAPACITY);

  TokenBuffer(Lexer lexer) {
    this.lexer = lexer;
  }

  /** Consumes and returns the next token. */
  Token next() {
    return pending.isEmpty() ? lexer.nextToken() : pending.removeFirst();
  }

  /** Returns the next token without consuming it. */
  Token peek() {
    if (pending.isEmpty())
      pending.addFirst(lexer.nextToken());
    return pending.peekFirst();
  }

  /** Consumes spaces, then consumes and returns the token after them. */
  Token nextNonSpace() {
    Token token;
    do {
      token = next();
    } while (token.type == Type.SPACE);
    return token;
  }

  /** Consumes spaces, then returns the token after them without consuming it. */
  Token peekNonSpace() {
    Token token = nextNonSpace();
    pushBack(token);
    return token;
  }

  /** Makes {@code token} the next token again. */
  void pushBack(Token token) {
    if (pending.size() == CAPACITY)
      throw new IllegalStateException("Look-ahead is limited to " + CAPACITY + " tokens");
    pending.addFirst(token);
  }
}
