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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class FormatOptionsTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  @Test
  public void defaults() {
    assertEquals(new FormatOptions("\t", false), new FormatOptions());
    assertEquals(new FormatOptions(), FormatOptions.fromJson("{}"));
  }

  @Test
  public void fromJson() {
    assertEquals(
        new FormatOptions("  ", true),
        FormatOptions.fromJson("{ \"indent\": \"  \", \"quoteText\": true }"));
    assertEquals(
        new FormatOptions(" \t", false),
        FormatOptions.fromJson("{ \"indent\": \" \\t\" }"));
  }

  @Test
  public void unknownKeysAreIgnored() {
    assertEquals(new FormatOptions(), FormatOptions.fromJson("{ \"width\": 80 }"));
  }

  @Test
  public void invalid() {
    expectConfigException("{ \"indent\": \"\" }", "indent must not be empty");
    expectConfigException("{ \"indent\": \"--\" }", "indent must only contain spaces and tabs");
    expectConfigException("{ \"indent\": null }", "indent must not be empty");
    expectConfigException("{ \"indent\": 4 }", "\"indent\" should be a String");
    expectConfigException("{ \"quoteText\": \"yes\" }", "\"quoteText\" should be a Boolean");
    expectConfigException("{ \"quoteText\": null }", "quoteText must be true or false");
    expectConfigException("[]", "Invalid options");
    expectConfigException("indent: 2", "Invalid options");
  }

  @Test
  public void load() throws Exception {
    File file = folder.newFile("options.json");
    Files.write(file.toPath(), "{ \"indent\": \"    \" }".getBytes(StandardCharsets.UTF_8));
    assertEquals(new FormatOptions("    ", false), FormatOptions.load(file));

    Files.write(file.toPath(), "{ \"indent\": \"x\" }".getBytes(StandardCharsets.UTF_8));
    try {
      FormatOptions.load(file);
      fail();
    } catch (ConfigException e) {
      assertTrue(e.getMessage(), e.getMessage().startsWith(file + ": "));
    }
  }

  private static void expectConfigException(String json, String message) {
    try {
      FormatOptions.fromJson(json);
      fail(json);
    } catch (ConfigException e) {
      assertTrue(e.getMessage(), e.getMessage().contains(message));
    }
  }
}
