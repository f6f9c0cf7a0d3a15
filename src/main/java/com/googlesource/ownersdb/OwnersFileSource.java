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

import java.io.IOException;
import java.util.List;

/**
 * A read-only snapshot of a repository tree from which OWNERS files are loaded.
 *
 * <p>All paths are relative to the root of the snapshot and use "/" as separator.
 */
public interface OwnersFileSource {
  /** Returns a key that identifies this snapshot, used to cache databases. */
  String getKey();

  /** Returns true if path names an existing regular file. */
  boolean exists(String path) throws IOException;

  /** Reads all lines of an existing file. */
  List<String> readLines(String path) throws IOException;
}
