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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.flogger.FluentLogger;
import java.io.File;
import java.io.IOException;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.storage.file.FileBasedConfig;
import org.eclipse.jgit.util.FS;

/**
 * owners-db configuration parameters.
 *
 * <p>Read from the {@code [owners]} section of a git-config style file, e.g.
 *
 * <pre>
 * [owners]
 *   ownersFileName = OWNERS
 *   tieBreak = sorted
 *   maxCacheAge = 60
 * </pre>
 */
public class Config {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String SECTION = "owners";

  // Name of config parameters:
  static final String ADD_DEBUG_MSG = "addDebugMsg"; // include "dbgmsgs" in returned JSON object
  static final String EMAIL_PATTERN = "emailPattern"; // regexp of owner and reviewer emails
  static final String MAX_CACHE_AGE = "maxCacheAge"; // seconds to stay in cache
  static final String MAX_CACHE_SIZE = "maxCacheSize"; // number of OwnersDb in cache
  static final String OWNERS_FILE_NAME = "ownersFileName"; // config key for file name
  static final String TIE_BREAK = "tieBreak"; // random or sorted
  static final String TIE_BREAK_SEED = "tieBreakSeed"; // seed of random tie-breaks

  static final String OWNERS = "OWNERS"; // default OWNERS file name

  /** How to pick one of several owners with the same lowest cost. */
  public enum TieBreak {
    RANDOM,
    SORTED
  }

  private boolean addDebugMsg = false;
  private Pattern emailPattern = Pattern.compile(Parser.BASIC_EMAIL_REGEXP);
  private int maxCacheAge = 0;
  private int maxCacheSize = 1000;
  private String ownersFileName = OWNERS;
  private TieBreak tieBreak = TieBreak.RANDOM;
  private Long tieBreakSeed = null;

  /** Default configuration. */
  public Config() {}

  Config(BaseConfig config) {
    addDebugMsg = config.getBoolean(ADD_DEBUG_MSG, false);
    maxCacheAge = config.getInt(MAX_CACHE_AGE, 0);
    maxCacheSize = config.getInt(MAX_CACHE_SIZE, 1000);
    String name = config.getString(OWNERS_FILE_NAME, OWNERS);
    if (name.trim().isEmpty() || name.contains("/")) {
      logger.atSevere().log("Wrong %s: \"%s\", use %s", OWNERS_FILE_NAME, name, OWNERS);
    } else {
      ownersFileName = name.trim();
    }
    String regexp = config.getString(EMAIL_PATTERN);
    if (regexp != null) {
      try {
        emailPattern = Pattern.compile(regexp);
      } catch (PatternSyntaxException e) {
        logger.atSevere().withCause(e).log("Wrong %s: \"%s\"", EMAIL_PATTERN, regexp);
      }
    }
    try {
      tieBreak = config.getEnum(TIE_BREAK, TieBreak.RANDOM);
    } catch (IllegalArgumentException e) {
      logger.atWarning().log(
          "Unknown %s: \"%s\", use random", TIE_BREAK, config.getString(TIE_BREAK));
    }
    if (config.getString(TIE_BREAK_SEED) != null) {
      tieBreakSeed = config.getLong(TIE_BREAK_SEED, 0);
    }
  }

  /** Parses the {@code [owners]} section of config file content. */
  public static Config fromText(String text) throws ConfigInvalidException {
    org.eclipse.jgit.lib.Config cfg = new org.eclipse.jgit.lib.Config();
    cfg.fromText(text);
    return new Config(new BaseConfig(SECTION, cfg));
  }

  /** Loads the {@code [owners]} section of a config file. */
  public static Config fromFile(File file) throws IOException, ConfigInvalidException {
    FileBasedConfig cfg = new FileBasedConfig(file, FS.DETECTED);
    cfg.load();
    return new Config(new BaseConfig(SECTION, cfg));
  }

  public boolean getAddDebugMsg() {
    return addDebugMsg;
  }

  public Pattern getEmailPattern() {
    return emailPattern;
  }

  public int getMaxCacheAge() {
    return maxCacheAge;
  }

  public int getMaxCacheSize() {
    return maxCacheSize;
  }

  public String getOwnersFileName() {
    return ownersFileName;
  }

  public TieBreak getTieBreak() {
    return tieBreak;
  }

  /** Returns the seed of random tie-breaks, or null if none is configured. */
  public Long getTieBreakSeed() {
    return tieBreakSeed;
  }

  /** Returns a new tie breaker as configured. */
  public TieBreaker newTieBreaker() {
    if (tieBreak == TieBreak.SORTED) {
      return TieBreaker.sorted();
    }
    return tieBreakSeed != null ? TieBreaker.seeded(tieBreakSeed) : TieBreaker.random();
  }

  @VisibleForTesting
  Config setTieBreak(TieBreak value) {
    tieBreak = value;
    return this;
  }

  @VisibleForTesting
  Config setMaxCacheAge(int seconds) {
    maxCacheAge = seconds;
    return this;
  }
}
