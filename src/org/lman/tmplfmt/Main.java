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
import java.io.PrintStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;

import org.lman.tmplfmt.parse.ParseException;

/**
 * Formats a template file, in place or into another file.
 */
public final class Main {

  static final String USAGE = "usage: tmplfmt [--config <options.json>] [--] <input> [output]";

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, System.err));
  }

  static int run(String[] args, PrintStream err) {
    List<String> paths = new ArrayList<String>();
    String config = null;
    boolean options = true;
    for (int i = 0; i < args.length; i++) {
      if (!options) {
        paths.add(args[i]);
      } else if (args[i].equals("--")) {
        options = false;
      } else if (args[i].equals("--config")) {
        if (i + 1 == args.length || config != null) {
          err.println(USAGE);
          return EXIT_USAGE;
        }
        config = args[++i];
      } else if (args[i].startsWith("-") && !args[i].equals("-")) {
        err.println(USAGE);
        return EXIT_USAGE;
      } else {
        paths.add(args[i]);
      }
    }
    if (paths.isEmpty() || paths.size() > 2) {
      err.println(USAGE);
      return EXIT_USAGE;
    }

    Path input = new File(paths.get(0)).toPath();
    Path output = paths.size() > 1 ? new File(paths.get(1)).toPath() : input;

    FormatOptions formatOptions;
    try {
      formatOptions = config == null ? new FormatOptions() : FormatOptions.load(new File(config));
    } catch (IOException e) {
      err.println("Can't read " + config + ": " + e);
      return EXIT_FAILURE;
    } catch (ConfigException e) {
      err.println(e.getMessage());
      return EXIT_FAILURE;
    }

    String text;
    try {
      // Reports malformed input instead of replacing it.
      text = StandardCharsets.UTF_8.newDecoder()
          .decode(ByteBuffer.wrap(Files.readAllBytes(input)))
          .toString();
    } catch (IOException e) {
      err.println("Can't read " + input + ": " + e);
      return EXIT_FAILURE;
    }

    String formatted;
    try {
      formatted = new TemplateFormatter(formatOptions).format(text);
    } catch (ParseException e) {
      err.println(input + ": " + e.getMessage());
      return EXIT_FAILURE;
    }

    try {
      writeAtomically(output, formatted);
    } catch (IOException e) {
      err.println("Can't write " + output + ": " + e);
      return EXIT_FAILURE;
    }
    return EXIT_OK;
  }

  /**
   * Writes to a temporary file next to {@code target} then moves it over, so that a failed
   * write never leaves a truncated file behind.
   */
  static void writeAtomically(Path target, String text) throws IOException {
    Path dir = target.toAbsolutePath().getParent();
    Path temp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
    try {
      Files.write(temp, text.getBytes(StandardCharsets.UTF_8));
      if (dir.getFileSystem().supportedFileAttributeViews().contains("posix"))
        Files.setPosixFilePermissions(temp, PosixFilePermissions.fromString("rw-r--r--"));
      try {
        Files.move(temp, target,
            StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      try {
        Files.deleteIfExists(temp);
      } catch (IOException deleteFailure) {
        e.addSuppressed(deleteFailure);
      }
      throw e;
    }
  }
}
