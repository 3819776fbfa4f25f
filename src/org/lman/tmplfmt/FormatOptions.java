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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.json.JSONException;
import org.lman.common.Struct;
import org.lman.json.JsonConverter;

/**
 * Options for {@link TemplateFormatter}. Read from JSON like
 *
 *   { "indent": "  ", "quoteText": true }
 *
 * where any key can be left out to keep its default.
 */
public class FormatOptions extends Struct {

  /** Written once per level of nesting when an action continues on another line. */
  public String indent = "\t";

  /** Quote text nodes when describing them in error contexts. */
  public Boolean quoteText = false;

  public FormatOptions() {}

  public FormatOptions(String indent, boolean quoteText) {
    this.indent = indent;
    this.quoteText = quoteText;
  }

  public static FormatOptions fromJson(String json) throws ConfigException {
    FormatOptions options;
    try {
      options = JsonConverter.fromJson(json, FormatOptions.class);
    } catch (JSONException e) {
      throw new ConfigException("Invalid options: " + e.getMessage(), e);
    }
    options.validate();
    return options;
  }

  public static FormatOptions load(File file) throws IOException, ConfigException {
    String json = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
    try {
      return fromJson(json);
    } catch (ConfigException e) {
      throw new ConfigException(file + ": " + e.getMessage(), e.getCause());
    }
  }

  /**
   * @throws ConfigException unless the indent is a non-empty run of spaces and tabs
   */
  public void validate() throws ConfigException {
    if (indent == null || indent.isEmpty())
      throw new ConfigException("indent must not be empty");
    for (int i = 0; i < indent.length(); i++) {
      char c = indent.charAt(i);
      if (c != ' ' && c != '\t')
        throw new ConfigException("indent must only contain spaces and tabs, not " + indent);
    }
    if (quoteText == null)
      throw new ConfigException("quoteText must be true or false");
  }
}
