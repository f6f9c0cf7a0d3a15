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

import static com.googlesource.ownersdb.Parser.EVERYONE;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The set of suggested reviewers and what they should review.
 *
 * <p>Built fresh for every query by {@link CoverageSolver}.
 */
public class ReviewerSet {
  /** Reported instead of "*" when nobody specific owns the files. */
  public static final String ANYONE = "<anyone>";

  private final SortedMap<String, ReviewerAssignment> reviewers = new TreeMap<>();

  void add(String primary, String dir, Collection<String> files, String comment) {
    reviewers.computeIfAbsent(primary, p -> new ReviewerAssignment()).add(dir, files, comment);
  }

  void addAlternates(String primary, Collection<String> alternates) {
    reviewers.computeIfAbsent(primary, p -> new ReviewerAssignment()).addAlternates(alternates);
  }

  public Set<String> getReviewers() {
    return Collections.unmodifiableSet(reviewers.keySet());
  }

  /** Returns directories assigned to a primary reviewer, empty for others. */
  public Set<String> getReviewDirs(String primary) {
    ReviewerAssignment assignment = reviewers.get(primary);
    return assignment == null ? Collections.emptySet() : assignment.getDirs();
  }

  /** Returns the assignment of a primary reviewer, or null. */
  public ReviewerAssignment getAssignment(String primary) {
    return reviewers.get(primary);
  }

  public boolean isEmpty() {
    return reviewers.isEmpty();
  }

  /**
   * Simplify the set if "*" is in it.
   *
   * <p>A lone "*" becomes {@link #ANYONE}. Next to named reviewers it is dropped, as any of them
   * can approve directories owned by everyone.
   */
  void reduceEveryone() {
    ReviewerAssignment everyone = reviewers.remove(EVERYONE);
    if (everyone != null && reviewers.isEmpty()) {
      reviewers.put(ANYONE, everyone);
    }
  }
}
