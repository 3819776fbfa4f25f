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
import java.util.List;

/**
 * The text of a template, with a line table for mapping offsets to lines and columns.
 */
public final class SourceText {

  private final String text;
  /** Offset of the first character of each line. */
  private final int[] lineStarts;

  public SourceText(String text) {
    this.text = text;
    List<Integer> starts = new ArrayList<Integer>();
    starts.add(0);
    for (int i = 0; i < text.length(); i++) {
      if (text.charAt(i) == '\n')
        starts.add(i + 1);
    }
    lineStarts = new int[starts.size()];
    for (int i = 0; i < lineStarts.length; i++)
      lineStarts[i] = starts.get(i);
  }

  public String getText() {
    return text;
  }

  /** 1-based line of an offset. */
  public int lineOf(int pos) {
    int index = Arrays.binarySearch(lineStarts, pos);
    return index >= 0 ? index + 1 : -index - 1;
  }

  /** 1-based column of an offset, in characters. */
  public int columnOf(int pos) {
    return pos - lineStarts[lineOf(pos) - 1] + 1;
  }

  /**
   * The whitespace between the start of the line and {@code pos}, or null if there's anything
   * other than spaces and tabs.
   */
  public String indentationBefore(int pos) {
    int lineStart = lineStarts[lineOf(pos) - 1];
    for (int i = lineStart; i < pos; i++) {
      char c = text.charAt(i);
      if (c != ' ' && c != '\t')
        return null;
    }
    return text.substring(lineStart, pos);
  }
}
