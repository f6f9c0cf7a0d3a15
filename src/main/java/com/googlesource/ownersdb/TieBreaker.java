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

import java.util.List;
import java.util.Random;

/** Picks the primary reviewer among owners with the same lowest cost. */
public interface TieBreaker {
  /**
   * Returns one of the candidates.
   *
   * @param candidates tied owners in natural order, never empty.
   */
  String choose(List<String> candidates);

  /** Uniformly random choice, different from run to run. */
  static TieBreaker random() {
    return random(new Random());
  }

  /** Uniformly random choice, reproducible for the same seed and input. */
  static TieBreaker seeded(long seed) {
    return random(new Random(seed));
  }

  static TieBreaker random(Random random) {
    return candidates -> candidates.get(random.nextInt(candidates.size()));
  }

  /** Always the first candidate in natural order. */
  static TieBreaker sorted() {
    return candidates -> candidates.get(0);
  }
}
