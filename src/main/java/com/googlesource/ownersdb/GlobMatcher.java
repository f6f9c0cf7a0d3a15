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

import com.google.common.flogger.FluentLogger;
import java.nio.file.FileSystems;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Matches repository paths against keys of the ownership index.
 *
 * <p>A key is either a plain path, compared literally whatever characters it contains, or a
 * per-file key registered by {@link #addPerFile}. A per-file key is a directory and a Java NIO
 * glob; the directory is compared literally and the glob is matched against the file name
 * relative to that directory, so '*' never crosses a '/' and a per-file glob only applies to
 * files directly in the directory of its OWNERS file.
 */
class GlobMatcher {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Directory and glob of one per-file key. */
  private static class PerFile {
    final String dir;
    final String glob;

    PerFile(String dir, String glob) {
      this.dir = dir;
      this.glob = glob;
    }
  }

  private final Map<String, PerFile> perFileKeys = new HashMap<>(); // key => dir and glob
  private final Map<String, PathMatcher> matchers = new HashMap<>(); // glob => matcher

  /** Registers a per-file glob of dir and returns its key. */
  String addPerFile(String dir, String glob) {
    String key = Util.join(dir, glob);
    perFileKeys.put(key, new PerFile(dir, glob));
    return key;
  }

  boolean isPerFile(String key) {
    return perFileKeys.containsKey(key);
  }

  boolean matches(String key, String path) {
    PerFile perFile = perFileKeys.get(key);
    if (perFile == null) {
      return key.equals(path);
    }
    if (path.isEmpty() || !Util.getDirName(path).equals(perFile.dir)) {
      return false;
    }
    return getMatcher(perFile.glob).matches(Paths.get(Util.getBaseName(path)));
  }

  private PathMatcher getMatcher(String glob) {
    PathMatcher matcher = matchers.get(glob);
    if (matcher == null) {
      try {
        matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
      } catch (PatternSyntaxException e) {
        logger.atFine().log("glob %s is invalid: %s", glob, e.getMessage());
        matcher = p -> false;
      }
      matchers.put(glob, matcher);
    }
    return matcher;
  }

  /** Returns the reason why glob cannot be compiled, or null if it is a valid glob. */
  static String checkGlob(String glob) {
    try {
      FileSystems.getDefault().getPathMatcher("glob:" + glob);
      return null;
    } catch (PatternSyntaxException e) {
      return e.getDescription();
    }
  }
}
