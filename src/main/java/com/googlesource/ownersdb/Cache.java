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

import static java.util.concurrent.TimeUnit.SECONDS;

import com.google.common.base.Joiner;
import com.google.common.cache.CacheBuilder;
import com.google.common.flogger.FluentLogger;
import java.util.concurrent.ExecutionException;

/** Save OwnersDb in a cache for multiple queries against the same snapshot. */
public class Cache {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  // An OwnersDb only loads OWNERS files of directories that contain queried
  // files, and keeps them for later queries. OwnersDb can be cached as long as
  // the snapshot it reads from does not change: a Git source is keyed by
  // repository and commit, a local source by its root directory, which is only
  // safe for a short period of time.

  private static Cache instance = null; // a singleton

  private com.google.common.cache.Cache<String, OwnersDb> dbCache;

  private Cache(int maxSeconds, int maxSize) {
    init(maxSeconds, maxSize);
  }

  long size() {
    return (dbCache == null) ? 0 : dbCache.size();
  }

  Cache init(int maxSeconds, int maxSize) {
    // This should be called once in normal configuration,
    // but could be called multiple times in unit tests.
    if (dbCache != null) {
      dbCache.invalidateAll(); // release all cached objects
    }
    if (maxSeconds > 0) {
      logger.atInfo().log("Initialize Cache with maxSeconds=%d maxSize=%d", maxSeconds, maxSize);
      dbCache =
          CacheBuilder.newBuilder()
              .maximumSize(maxSize)
              .expireAfterWrite(maxSeconds, SECONDS)
              .build();
    } else {
      logger.atInfo().log("Cache disabled.");
      dbCache = null;
    }
    return this;
  }

  /** Returns a cached or new OwnersDb for the source. */
  public OwnersDb get(OwnersFileSource source, Config config) {
    String key = makeKey(source, config);
    if (dbCache == null) { // Do not cache OwnersDb
      logger.atFiner().log("Create new OwnersDb, key=%s", key);
      return new OwnersDb(source, config);
    }
    try {
      logger.atFiner().log(
          "Get from cache %s, key=%s, cache size=%d", dbCache, key, dbCache.size());
      return dbCache.get(
          key,
          () -> {
            logger.atFiner().log("Create new OwnersDb, key=%s", key);
            return new OwnersDb(source, config);
          });
    } catch (ExecutionException e) {
      logger.atSevere().withCause(e).log("Cache.get has exception for %s", key);
      return new OwnersDb(source, config);
    }
  }

  void invalidate(OwnersFileSource source, Config config) {
    if (dbCache != null) {
      dbCache.invalidate(makeKey(source, config));
    }
  }

  // Every config value that an OwnersDb keeps is part of the key.
  // The email pattern is last, as it can contain ':'.
  static String makeKey(OwnersFileSource source, Config config) {
    return Joiner.on(':')
        .useForNull("")
        .join(
            source.getKey(),
            config.getOwnersFileName(),
            config.getTieBreak(),
            config.getTieBreakSeed(),
            config.getEmailPattern().pattern());
  }

  /** Returns the shared cache, created with the limits of the first config. */
  public static synchronized Cache getInstance(Config config) {
    if (instance == null) {
      instance = new Cache(config.getMaxCacheAge(), config.getMaxCacheSize());
    }
    return instance;
  }
}
