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

/**
 * Thrown if parsing a template fails. Parsing stops at the first error.
 */
public class ParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /** 1-based line of the offending token. */
  public final int line;
  /** 1-based column of the offending token. */
  public final int column;

  private final String detail;

  public ParseException(String detail, int line, int column) {
    super("template: " + line + ":" + column + ": " + detail);
    this.line = line;
    this.column = column;
    this.detail = detail;
  }

  /** The message without the location. */
  public String getDetail() {
    return detail;
  }
}
