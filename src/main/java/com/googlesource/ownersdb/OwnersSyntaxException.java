// Copyright (C) 2017 The Android Open Source Project
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.googlesource.ownersdb;

/** Exception that is thrown if an OWNERS file, or a file it includes, cannot be parsed. */
public class OwnersSyntaxException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String path;
  private final int lineNumber;
  private final String reason;

  public OwnersSyntaxException(String path, int lineNumber, String reason) {
    super(String.format("%s:%d syntax error: %s", path, lineNumber, reason));
    this.path = path;
    this.lineNumber = lineNumber;
    this.reason = reason;
  }

  /** Returns the repository path of the OWNERS file with the error. */
  public String getPath() {
    return path;
  }

  /** Returns the 1-based line number of the offending line. */
  public int getLineNumber() {
    return lineNumber;
  }

  public String getReason() {
    return reason;
  }
}
