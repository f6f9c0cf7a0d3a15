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
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/** Command line tool to suggest reviewers of changed files, or check their coverage. */
public class FindReviewers {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final int EXIT_OK = 0;
  static final int EXIT_ERROR = 1; // OWNERS syntax or read error, or no owner left
  static final int EXIT_USAGE = 2;

  @Option(name = "--root", metaVar = "DIR", usage = "work tree with OWNERS files")
  private File root;

  @Option(name = "--git-dir", metaVar = "DIR", usage = "read OWNERS files from a Git repository")
  private File gitDir;

  @Option(name = "--revision", metaVar = "REV", usage = "commit to read with --git-dir")
  private String revision = "HEAD";

  @Option(name = "--author", metaVar = "EMAIL", usage = "change author, never suggested")
  private String author;

  @Option(
      name = "--reviewer",
      metaVar = "EMAIL",
      usage = "check which files these reviewers do not cover")
  private List<String> reviewers = new ArrayList<>();

  @Option(name = "--config", metaVar = "FILE", usage = "config file with an [owners] section")
  private File configFile;

  // "debug" could be true/yes/1 or false/no/0,
  // when not specified configuration variable "addDebugMsg" is used.
  @Option(name = "--debug", usage = "get extra debug info")
  private String debug;

  @Argument(metaVar = "FILE", multiValued = true, usage = "changed files, relative to the root")
  private List<String> files = new ArrayList<>();

  public static void main(String[] args) {
    System.exit(new FindReviewers().run(args, System.out, System.err));
  }

  @VisibleForTesting
  int run(String[] args, PrintStream out, PrintStream err) {
    CmdLineParser parser = new CmdLineParser(this);
    try {
      parser.parseArgument(args);
      if ((root == null) == (gitDir == null)) {
        throw new CmdLineException(parser, "exactly one of --root or --git-dir is required");
      }
      if (files.isEmpty()) {
        throw new CmdLineException(parser, "no changed files");
      }
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      parser.printUsage(err);
      return EXIT_USAGE;
    }
    try {
      Config config = configFile != null ? Config.fromFile(configFile) : new Config();
      if (gitDir != null) {
        try (Repository repo =
            new FileRepositoryBuilder().setGitDir(gitDir).setMustExist(true).build()) {
          return query(GitOwnersFileSource.open(repo, revision), config, out, err);
        }
      }
      return query(new LocalOwnersFileSource(root.toPath()), config, out, err);
    } catch (ConfigInvalidException e) {
      err.println("invalid config " + configFile + ": " + e.getMessage());
      return EXIT_USAGE;
    } catch (IllegalArgumentException e) {
      // Paths outside the root and malformed reviewers are caller errors.
      err.println(e.getMessage());
      return EXIT_USAGE;
    } catch (IOException e) {
      logger.atSevere().withCause(e).log("Cannot read OWNERS files");
      err.println(e.getMessage());
      return EXIT_ERROR;
    }
  }

  private int query(OwnersFileSource source, Config config, PrintStream out, PrintStream err)
      throws IOException {
    boolean addDebugMsg = (debug != null) ? Util.parseBoolean(debug) : config.getAddDebugMsg();
    OwnersDb db = Cache.getInstance(config).get(source, config);
    ReviewerSetJson json = new ReviewerSetJson(config, files, addDebugMsg);
    json.author = author;
    try {
      if (reviewers.isEmpty()) {
        json.setReviewers(db.reviewerSetFor(files, author));
      } else {
        json.setCoverage(reviewers, db.filesNotCoveredBy(files, reviewers));
      }
    } catch (OwnersSyntaxException e) {
      // No partial suggestion from a partially understood set of OWNERS files.
      Cache.getInstance(config).invalidate(source, config);
      err.println(e.getMessage());
      return EXIT_ERROR;
    } catch (IOException e) {
      // A later run must read the OWNERS files again.
      Cache.getInstance(config).invalidate(source, config);
      throw e;
    } catch (IllegalStateException e) {
      // No OWNERS file, or nobody but the author owns some of the files.
      logger.atWarning().log("No reviewers for %s: %s", files, e.getMessage());
      err.println(e.getMessage());
      return EXIT_ERROR;
    }
    out.println(json.setDebugMessages(db).toJson());
    return EXIT_OK;
  }
}
