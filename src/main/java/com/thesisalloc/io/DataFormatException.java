// Copyright 2010-2021 Google LLC
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

package com.thesisalloc.io;

/** Malformed input file content, reported with the file and the 1-based line it was found on. */
public class DataFormatException extends RuntimeException {
  private final String file;
  private final int line;

  public DataFormatException(String file, int line, String message) {
    super(file + (line > 0 ? ":" + line : "") + ": " + message);
    this.file = file;
    this.line = line;
  }

  public String getFile() {
    return file;
  }

  /** Line of the offending record, 0 if the problem is not tied to one line. */
  public int getLine() {
    return line;
  }
}
