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

import com.google.common.collect.Ordering;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Utility classes and functions.
 *
 * <p>Repository paths handled here are relative to the repository root, use "/" as separator, and
 * the root directory itself is the empty string "".
 */
class Util {
  // Returns the parent directory of a repository path; "" for top level paths and the root.
  static String getDirName(String path) {
    int slash = path.lastIndexOf('/');
    return slash < 0 ? "" : path.substring(0, slash);
  }

  // Returns the last segment of a repository path.
  static String getBaseName(String path) {
    return path.substring(path.lastIndexOf('/') + 1);
  }

  static String join(String dir, String path) {
    if (dir.isEmpty()) {
      return path;
    }
    return path.isEmpty() ? dir : (dir + "/" + path);
  }

  // Git repository file path cannot contain leading "/" or "./", or "/" at the end.
  static String gitRepoFilePath(String file) {
    if (file == null) {
      return "";
    }
    int last = file.length() - 1;
    while (last >= 0 && file.charAt(last) == '/') {
      --last;
    }
    int first = 0;
    while (first < last && file.charAt(first) == '/') {
      ++first;
    }
    file = file.substring(first, last + 1);
    if (file.startsWith("./")) {
      return gitRepoFilePath(file.substring(2));
    }
    return file;
  }

  /**
   * Resolves "." and ".." segments of a relative repository path.
   *
   * @return the normalized path, or null if the path climbs above the repository root.
   */
  static String normalize(String path) {
    Deque<String> segments = new ArrayDeque<>();
    for (String segment : gitRepoFilePath(path).split("/", -1)) {
      if (segment.isEmpty() || segment.equals(".")) {
        continue;
      }
      if (segment.equals("..")) {
        if (segments.isEmpty()) {
          return null;
        }
        segments.removeLast();
      } else {
        segments.addLast(segment);
      }
    }
    return String.join("/", segments);
  }

  // A path is acceptable as input when it is relative and stays under the root.
  static boolean isUnderRoot(String path) {
    return path != null
        && !path.isEmpty()
        && !path.startsWith("/")
        && !path.startsWith("\\")
        && normalize(path) != null;
  }

  static boolean parseBoolean(String s) {
    return (s != null) && (s.equals("1") || s.equalsIgnoreCase("yes") || Boolean.parseBoolean(s));
  }

  static SortedMap<String, List<String>> makeSortedMap(Map<String, Set<String>> map) {
    SortedMap<String, List<String>> result = new TreeMap<>();
    for (String key : Ordering.natural().sortedCopy(map.keySet())) {
      result.put(key, Ordering.natural().sortedCopy(map.get(key)));
    }
    return result;
  }

  static void addToMap(Map<String, Set<String>> map, String key, String value) {
    if (map.get(key) == null) {
      map.put(key, new HashSet<>());
    }
    map.get(key).add(value);
  }
}
