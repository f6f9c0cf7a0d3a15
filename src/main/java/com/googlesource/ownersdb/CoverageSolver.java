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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Find a small set of reviewers that covers all directories of changed files.
 *
 * <p>This is a weighted greedy set cover over directories: each round picks the owner with the
 * lowest {@link OwnerDistances#cost} for the directories not yet covered, and assigns to it all
 * of those it owns. Owners with the same lowest cost that own every assigned directory are
 * reported as alternates.
 */
class CoverageSolver {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /** Primary owner of one round and the other owners with the same cost. */
  static class Choice {
    final String primary;
    final SortedSet<String> alternates;

    Choice(String primary, SortedSet<String> alternates) {
      this.primary = primary;
      this.alternates = alternates;
    }
  }

  private final OwnersDb db;
  private final TieBreaker tieBreaker;

  CoverageSolver(OwnersDb db, TieBreaker tieBreaker) {
    this.db = db;
    this.tieBreaker = tieBreaker;
  }

  /**
   * Returns suggested reviewers of the given files.
   *
   * @param files normalized repository paths, with their OWNERS files already loaded.
   * @param author excluded from the suggestion if not null.
   */
  ReviewerSet solve(Collection<String> files, String author) {
    Map<String, List<String>> dirsToFiles = new LinkedHashMap<>();
    for (String f : files) {
      dirsToFiles.computeIfAbsent(db.enclosingDirWithOwners(f), d -> new ArrayList<>()).add(f);
    }
    Set<String> dirsRemaining = new TreeSet<>(dirsToFiles.keySet());
    Map<String, OwnerDistances> allPossibleOwners = allPossibleOwners(dirsRemaining, author);
    for (Map.Entry<String, OwnerDistances> e : allPossibleOwners.entrySet()) {
      logger.atFinest().log("candidate %s owns %s", e.getKey(), e.getValue().encodeDistances());
    }
    ReviewerSet suggestedOwners = new ReviewerSet();
    while (!dirsRemaining.isEmpty()) {
      Choice choice = lowestCostOwnerWithAlternates(allPossibleOwners, dirsRemaining);
      List<String> dirsToRemove = allPossibleOwners.get(choice.primary).ownedDirsIn(dirsRemaining);
      for (String d : dirsToRemove) {
        String comment = db.getMostSpecificComment(choice.primary, d);
        suggestedOwners.add(choice.primary, d, dirsToFiles.get(d), comment);
      }
      // Every alternate needs to own every directory that
      // is currently assigned to the primary reviewer.
      Set<String> reviewDirs = suggestedOwners.getReviewDirs(choice.primary);
      List<String> finalAlternates = new ArrayList<>();
      for (String alternate : choice.alternates) {
        if (allPossibleOwners.get(alternate).getDirs().containsAll(reviewDirs)) {
          finalAlternates.add(alternate);
        }
      }
      suggestedOwners.addAlternates(choice.primary, finalAlternates);
      logger.atFine().log(
          "assign %s to %s, alternates %s", dirsToRemove, choice.primary, finalAlternates);
      dirsRemaining.removeAll(dirsToRemove);
    }
    return suggestedOwners;
  }

  /**
   * Returns every possible owner of the given directories with the distance to each of them;
   * a distance of 1 is the lowest/closest possible distance (which makes the subsequent math
   * easier).
   */
  Map<String, OwnerDistances> allPossibleOwners(Set<String> dirs, String author) {
    Map<String, OwnerDistances> result = new TreeMap<>();
    for (String currentDir : dirs) {
      String dirName = currentDir;
      int distance = 1;
      while (true) {
        for (String owner : db.ownersOf(dirName)) {
          if (author != null && owner.equals(author)) {
            continue;
          }
          // If the same person is in multiple OWNERS files above a given
          // directory, only count the closest one.
          result.computeIfAbsent(owner, o -> new OwnerDistances()).addDir(currentDir, distance);
        }
        if (db.isStopBoundary(dirName)) {
          break;
        }
        dirName = Util.getDirName(dirName);
        distance++;
      }
    }
    return result;
  }

  static Map<String, Double> totalCostsByOwner(
      Map<String, OwnerDistances> allPossibleOwners, Set<String> dirs) {
    Map<String, Double> result = new HashMap<>();
    for (Map.Entry<String, OwnerDistances> e : allPossibleOwners.entrySet()) {
      Double cost = e.getValue().cost(dirs);
      if (cost != null) {
        result.put(e.getKey(), cost);
      }
    }
    return result;
  }

  Choice lowestCostOwnerWithAlternates(
      Map<String, OwnerDistances> allPossibleOwners, Set<String> dirs) {
    Map<String, Double> costs = totalCostsByOwner(allPossibleOwners, dirs);
    checkState(!costs.isEmpty(), "No more owners for dirs %s", dirs);
    List<String> sortedOwners = OwnerDistances.sortKeys(costs);
    double lowestCost = costs.get(sortedOwners.get(0));
    List<String> lowestCostOwners = new ArrayList<>();
    for (String owner : sortedOwners) {
      if (costs.get(owner) != lowestCost) {
        break;
      }
      lowestCostOwners.add(owner);
    }
    // In the case of a tie, the tie breaker picks one, the others are alternates.
    String primary = tieBreaker.choose(lowestCostOwners);
    SortedSet<String> alternates = new TreeSet<>(lowestCostOwners);
    alternates.remove(primary);
    return new Choice(primary, alternates);
  }

  String lowestCostOwner(Map<String, OwnerDistances> allPossibleOwners, Set<String> dirs) {
    return lowestCostOwnerWithAlternates(allPossibleOwners, dirs).primary;
  }
}
