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
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keep owned directories of one possible reviewer and their distances.
 *
 * <p>A directory under review can be owned through OWNERS files in itself and in parent
 *    directories. The distance is 1 when the owner is found in the directory itself,
 *    2 in its parent directory, etc.
 * <p>The cost of an owner for a set of remaining directories is the sum of distances
 *    divided by (number of owned remaining directories) ^ 1.75.
 */
class OwnerDistances {
  // We want to minimize both the number of reviewers and the distance
  // from the dirs needing reviews. This arbitrarily-selected scaling factor
  // selects one reviewer in the parent directory over three reviewers
  // in subdirs, but not one reviewer over just two.
  static final double BREADTH_EXPONENT = 1.75;

  /** Orders owners by lowest cost first, then by name. */
  static class CostComparator implements Comparator<String> {
    private final Map<String, Double> costs;

    CostComparator(Map<String, Double> costs) {
      this.costs = costs;
    }

    @Override
    public int compare(String k1, String k2) {
      int n = Double.compare(costs.get(k1), costs.get(k2));
      return n != 0 ? n : k1.compareTo(k2);
    }
  }

  private final Map<String, Integer> dirs = new LinkedHashMap<>(); // dir => distance

  void addDir(String dir, int distance) {
    // If a dir is added multiple times, only the closest distance counts.
    Integer old = dirs.get(dir);
    if (old == null || distance < old) {
      dirs.put(dir, distance);
    }
  }

  Set<String> getDirs() {
    return Collections.unmodifiableSet(dirs.keySet());
  }

  /** Returns owned dirs that are in remaining. */
  List<String> ownedDirsIn(Set<String> remaining) {
    List<String> result = new ArrayList<>();
    for (String dir : dirs.keySet()) {
      if (remaining.contains(dir)) {
        result.add(dir);
      }
    }
    return result;
  }

  /** Returns the cost to review remaining dirs, or null if no remaining dir is owned. */
  Double cost(Set<String> remaining) {
    int totalDistance = 0;
    int numDirsOwned = 0;
    for (Map.Entry<String, Integer> e : dirs.entrySet()) {
      if (remaining.contains(e.getKey())) {
        totalDistance += e.getValue();
        numDirsOwned++;
      }
    }
    return numDirsOwned > 0 ? (totalDistance / Math.pow(numDirsOwned, BREADTH_EXPONENT)) : null;
  }

  /** Returns owned dirs with distances as a compact string. */
  String encodeDistances() {
    StringBuilder sb = new StringBuilder("[");
    for (Map.Entry<String, Integer> e : dirs.entrySet()) {
      if (sb.length() > 1) {
        sb.append(',');
      }
      sb.append(e.getKey()).append(':').append(e.getValue());
    }
    return sb.append(']').toString();
  }

  /** Sort keys in costs map by cost, and return keys. */
  static List<String> sortKeys(Map<String, Double> costs) {
    List<String> keys = new ArrayList<>(costs.keySet());
    Collections.sort(keys, new CostComparator(costs));
    return keys;
  }
}
