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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static com.googlesource.ownersdb.Parser.EVERYONE;

import com.google.common.collect.ImmutableSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Owner email to owned paths, and owned path to owner emails.
 *
 * <p>An owned path is a directory ("" for the root) or a directory joined with a per-file glob.
 * Both directions are only updated through {@link #add}, so every (owner, path) pair is present
 * in both maps. The {@code "*"} owner is always a key of the owner map, possibly with no paths.
 */
class OwnershipIndex {
  private final Map<String, Set<String>> owner2Paths = new HashMap<>();
  private final Map<String, Set<String>> path2Owners = new HashMap<>();

  OwnershipIndex() {
    owner2Paths.put(EVERYONE, new HashSet<>());
  }

  void add(String owner, String path) {
    checkArgument(owner != null && !owner.isEmpty(), "empty owner for %s", path);
    checkArgument(path != null, "null path for %s", owner);
    Util.addToMap(owner2Paths, owner, path);
    Util.addToMap(path2Owners, path, owner);
  }

  /** Grants every owner of path {@code from} also the path {@code to}. */
  void copyOwners(String from, String to) {
    // Copy first, from and to can be the same key.
    for (String owner : ImmutableSet.copyOf(ownersAt(from))) {
      add(owner, to);
    }
  }

  /** Returns owned paths of an owner, empty if the owner is unknown. */
  Set<String> pathsOf(String owner) {
    Set<String> paths = owner2Paths.get(owner);
    return paths == null ? Collections.emptySet() : Collections.unmodifiableSet(paths);
  }

  /** Returns owners of exactly this path key, without glob matching. */
  Set<String> ownersAt(String path) {
    Set<String> owners = path2Owners.get(path);
    return owners == null ? Collections.emptySet() : Collections.unmodifiableSet(owners);
  }

  Set<String> owners() {
    return Collections.unmodifiableSet(owner2Paths.keySet());
  }

  Map<String, Set<String>> owner2Paths() {
    return Collections.unmodifiableMap(owner2Paths);
  }

  Map<String, Set<String>> path2Owners() {
    return Collections.unmodifiableMap(path2Owners);
  }

  void checkConsistency() {
    checkState(owner2Paths.containsKey(EVERYONE), "missing %s owner", EVERYONE);
    for (Map.Entry<String, Set<String>> e : owner2Paths.entrySet()) {
      for (String path : e.getValue()) {
        checkState(
            ownersAt(path).contains(e.getKey()), "%s -> %s has no reverse", e.getKey(), path);
      }
    }
    for (Map.Entry<String, Set<String>> e : path2Owners.entrySet()) {
      for (String owner : e.getValue()) {
        checkState(
            pathsOf(owner).contains(e.getKey()), "%s -> %s has no reverse", e.getKey(), owner);
      }
    }
  }
}
