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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/** What a given reviewer should review. */
public class ReviewerAssignment {
  // OWNERS comment explaining the grant => files reviewed for that reason
  private final SortedMap<String, List<String>> comments = new TreeMap<>();
  // other reviewers who also could have been chosen
  private final SortedSet<String> alternates = new TreeSet<>();
  // directories under review, with any comment
  private final SortedSet<String> dirs = new TreeSet<>();

  void add(String dir, Collection<String> files, String comment) {
    comments.computeIfAbsent(comment, c -> new ArrayList<>()).addAll(files);
    dirs.add(dir);
  }

  void addAlternates(Collection<String> owners) {
    alternates.addAll(owners);
  }

  public Map<String, List<String>> getComments() {
    return Collections.unmodifiableMap(comments);
  }

  public Set<String> getAlternates() {
    return Collections.unmodifiableSet(alternates);
  }

  public Set<String> getDirs() {
    return Collections.unmodifiableSet(dirs);
  }

  /** Returns all files of all comments. */
  public List<String> getFiles() {
    List<String> files = new ArrayList<>();
    comments.values().forEach(files::addAll);
    Collections.sort(files);
    return files;
  }
}
