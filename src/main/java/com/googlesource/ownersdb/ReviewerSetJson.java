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
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.annotations.SerializedName;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/** JSON data of a reviewer suggestion or coverage check. */
class ReviewerSetJson {
  private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

  String ownersFileName;
  String author;

  List<String> files = new ArrayList<>();

  // Present for a reviewer suggestion.
  SortedMap<String, ReviewerInfo> reviewers;

  // Present for a coverage check.
  @SerializedName("checked_reviewers")
  List<String> checkedReviewers;

  @SerializedName("not_covered")
  List<String> notCovered;

  DebugMessages dbgmsgs;

  static class ReviewerInfo {
    List<String> dirs;
    SortedMap<String, List<String>> comments;
    List<String> alternates;

    ReviewerInfo(ReviewerAssignment assignment) {
      dirs = new ArrayList<>(assignment.getDirs());
      comments = new TreeMap<>(assignment.getComments());
      alternates = new ArrayList<>(assignment.getAlternates());
    }
  }

  static class DebugMessages {
    String key;
    @SerializedName("read_files")
    List<String> readFiles;
    @SerializedName("stop_looking")
    List<String> stopLooking;
    SortedMap<String, List<String>> path2owners;
    SortedMap<String, List<String>> owner2paths;
    List<String> logs;
  }

  ReviewerSetJson(Config config, Collection<String> files, boolean addDebugMsg) {
    ownersFileName = config.getOwnersFileName();
    this.files = Ordering.natural().sortedCopy(files);
    if (addDebugMsg) {
      dbgmsgs = new DebugMessages();
    }
  }

  ReviewerSetJson setReviewers(ReviewerSet reviewerSet) {
    reviewers = new TreeMap<>();
    for (String reviewer : reviewerSet.getReviewers()) {
      reviewers.put(reviewer, new ReviewerInfo(reviewerSet.getAssignment(reviewer)));
    }
    return this;
  }

  ReviewerSetJson setCoverage(Collection<String> reviewers, Collection<String> notCovered) {
    checkedReviewers = Ordering.natural().sortedCopy(reviewers);
    this.notCovered = Ordering.natural().sortedCopy(notCovered);
    return this;
  }

  ReviewerSetJson setDebugMessages(OwnersDb db) {
    if (dbgmsgs != null) {
      dbgmsgs.key = db.getKey();
      dbgmsgs.readFiles = new ArrayList<>(db.getReadFiles());
      dbgmsgs.stopLooking = Ordering.natural().sortedCopy(db.getStopLooking());
      dbgmsgs.path2owners = Util.makeSortedMap(db.getIndex().path2Owners());
      dbgmsgs.owner2paths = Util.makeSortedMap(db.getIndex().owner2Paths());
      dbgmsgs.logs = new ArrayList<>(db.logs);
    }
    return this;
  }

  String toJson() {
    return GSON.toJson(this);
  }
}
