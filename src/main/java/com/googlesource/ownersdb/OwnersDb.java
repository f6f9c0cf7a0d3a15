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
import static com.googlesource.ownersdb.Parser.EVERYONE;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;
import com.google.common.flogger.FluentLogger;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * A database of OWNERS files for one repository snapshot.
 *
 * <p>OWNERS files are loaded on demand, walking up from the directories of queried files, and
 * kept for later queries. This class finds a suggested set of reviewers for a list of changed
 * files, and checks if a list of changed files is covered by a list of reviewers.
 *
 * <p>Query methods are synchronized because loading mutates the database; a database shared
 * through {@link Cache} is loaded by one caller at a time.
 */
public class OwnersDb {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final OwnersFileSource source;
  private final String ownersFileName;
  private final Pattern emailPattern;
  private final CoverageSolver solver;
  private final GlobMatcher globMatcher = new GlobMatcher();

  // Owner email to owned dirs or file globs, and the reverse.
  private final OwnershipIndex index = new OwnershipIndex();
  // Owner email to owned dir or file glob to the comment preceding that grant.
  private final Map<String, Map<String, String>> comments = new HashMap<>();
  // Dirs and per-file keys that stop us from looking above them for owners.
  // (This is implicitly true for the root directory).
  private final Set<String> stopLooking = new HashSet<>();
  // OWNERS and included files which have already been read.
  private final Set<String> readFiles = new LinkedHashSet<>();

  final List<String> logs = new ArrayList<>(); // trace/debug messages

  // First failure to load OWNERS files; the partially loaded data is not used again.
  private OwnersSyntaxException syntaxError;
  private IOException readError;

  public OwnersDb(OwnersFileSource source) {
    this(source, new Config());
  }

  public OwnersDb(OwnersFileSource source, Config config) {
    this(source, config, config.newTieBreaker());
  }

  public OwnersDb(OwnersFileSource source, Config config, TieBreaker tieBreaker) {
    this.source = source;
    this.ownersFileName = config.getOwnersFileName();
    this.emailPattern = config.getEmailPattern();
    this.solver = new CoverageSolver(this, tieBreaker);
    stopLooking.add("");
    logs.add("key:" + source.getKey());
    logs.add("ownersFileName:" + ownersFileName);
  }

  /** Returns the key of the snapshot this database reads from. */
  public String getKey() {
    return source.getKey();
  }

  /** Returns suggested reviewer emails for the files, see {@link #reviewerSetFor}. */
  public synchronized Set<String> reviewersFor(Collection<String> files, String author)
      throws IOException, OwnersSyntaxException {
    return new LinkedHashSet<>(reviewerSetFor(files, author).getReviewers());
  }

  /**
   * Returns a suggested set of reviewers that will cover the files.
   *
   * @param files paths relative to (and under) the root of the snapshot.
   * @param author if not null, it is not included in the set returned, in order to avoid
   *     suggesting the author as a reviewer for their own changes.
   * @throws OwnersSyntaxException if any OWNERS file needed for the files is malformed.
   */
  public synchronized ReviewerSet reviewerSetFor(Collection<String> files, String author)
      throws IOException, OwnersSyntaxException {
    List<String> paths = checkPaths(files);
    load(paths);
    logs.add("reviewerSetFor:" + paths);
    ReviewerSet suggestedOwners = solver.solve(paths, author);
    suggestedOwners.reduceEveryone();
    return suggestedOwners;
  }

  /**
   * Returns the files not owned by one of the reviewers.
   *
   * @param files paths relative to (and under) the root of the snapshot.
   * @param reviewers emails matching the configured email pattern, or {@link ReviewerSet#ANYONE}.
   */
  public synchronized Set<String> filesNotCoveredBy(
      Collection<String> files, Collection<String> reviewers)
      throws IOException, OwnersSyntaxException {
    List<String> paths = checkPaths(files);
    checkReviewers(reviewers);
    load(paths);
    logs.add("filesNotCoveredBy:" + paths);
    Set<String> result = new LinkedHashSet<>();
    for (String f : paths) {
      if (!isObjCoveredBy(f, reviewers)) {
        result.add(f);
      }
    }
    return result;
  }

  private void load(List<String> paths) throws IOException, OwnersSyntaxException {
    if (syntaxError != null) {
      throw syntaxError;
    }
    if (readError != null) {
      throw new IOException("incomplete OWNERS data of " + getKey(), readError);
    }
    try {
      loadDataNeededFor(paths);
    } catch (OwnersSyntaxException e) {
      logs.add("syntaxError:" + e.getMessage());
      syntaxError = e;
      throw e;
    } catch (IOException e) {
      logs.add("readError:" + e.getMessage());
      readError = e;
      throw e;
    }
  }

  private List<String> checkPaths(Collection<String> files) {
    checkArgument(files != null, "null files");
    List<String> paths = new ArrayList<>();
    for (String f : files) {
      checkArgument(Util.isUnderRoot(f), "%s is not a relative path under the root", f);
      paths.add(Util.normalize(f));
    }
    return paths;
  }

  private void checkReviewers(Collection<String> reviewers) {
    checkArgument(reviewers != null, "null reviewers");
    for (String r : reviewers) {
      // A suggested "<anyone>" stands for "*", which every check includes anyway.
      if (EVERYONE.equals(r) || ReviewerSet.ANYONE.equals(r)) {
        continue;
      }
      checkArgument(r != null && emailPattern.matcher(r).matches(), "invalid reviewer %s", r);
    }
  }

  private boolean isObjCoveredBy(String objName, Collection<String> reviewers) {
    List<String> owners = ImmutableList.<String>builder().addAll(reviewers).add(EVERYONE).build();
    while (true) {
      for (String reviewer : owners) {
        for (String ownedPattern : index.pathsOf(reviewer)) {
          if (globMatcher.matches(ownedPattern, objName)) {
            return true;
          }
        }
      }
      if (isStopBoundary(objName)) {
        break;
      }
      objName = Util.getDirName(objName);
    }
    return false;
  }

  /** Returns the innermost enclosing directory, or the path itself, that has owners. */
  String enclosingDirWithOwners(String objName) {
    String dirPath = objName;
    while (ownersOf(dirPath).isEmpty()) {
      if (isStopBoundary(dirPath)) {
        break;
      }
      dirPath = Util.getDirName(dirPath);
    }
    return dirPath;
  }

  /**
   * Reads OWNERS files in the directories of the files and their parents.
   *
   * <p>Going up stops at the first directory that already has owners, even if those owners are
   * per-file owners of other files, or at a directory with "set noparent".
   */
  void loadDataNeededFor(Collection<String> files) throws IOException, OwnersSyntaxException {
    for (String f : files) {
      String dirPath = Util.getDirName(f);
      while (ownersOf(dirPath).isEmpty()) {
        readOwners(Util.join(dirPath, ownersFileName));
        if (isStopBoundary(dirPath)) {
          break;
        }
        dirPath = Util.getDirName(dirPath);
      }
    }
  }

  boolean isStopBoundary(String objName) {
    for (String stop : stopLooking) {
      if (globMatcher.matches(stop, objName)) {
        return true;
      }
    }
    return false;
  }

  /** Returns owners of all owned dirs and globs matching objName, without going up. */
  Set<String> ownersOf(String objName) {
    Set<String> objOwners = new HashSet<>();
    for (Map.Entry<String, Set<String>> e : index.path2Owners().entrySet()) {
      if (globMatcher.matches(e.getKey(), objName)) {
        objOwners.addAll(e.getValue());
      }
    }
    return objOwners;
  }

  private void readOwners(String path) throws IOException, OwnersSyntaxException {
    if (readFiles.contains(path) || !source.exists(path)) {
      return;
    }
    readFiles.add(path);
    logs.add("readOwners:" + path);
    logger.atFine().log("read %s from %s", path, source.getKey());
    String dirPath = Util.getDirName(path);
    Parser parser = new Parser(path, emailPattern);
    for (Parser.Directive directive : parser.parseFile(source.readLines(path))) {
      addEntry(dirPath, path, directive);
    }
    index.checkConsistency();
  }

  private void addEntry(String dirPath, String ownersPath, Parser.Directive directive)
      throws IOException, OwnersSyntaxException {
    String path =
        directive.isPerFile() ? globMatcher.addPerFile(dirPath, directive.glob) : dirPath;
    switch (directive.kind) {
      case NO_PARENT:
        stopLooking.add(path);
        break;
      case INCLUDE:
        String ownersFile = resolveInclude(directive.value, ownersPath);
        if (ownersFile == null) {
          throw new OwnersSyntaxException(
              ownersPath,
              directive.lineNumber,
              directive.value + " does not refer to an existing file.");
        }
        readOwners(ownersFile);
        // Only owners are included, a "set noparent" of the included file is not.
        index.copyOwners(Util.getDirName(ownersFile), path);
        break;
      case GRANT:
        comments
            .computeIfAbsent(directive.value, o -> new HashMap<>())
            .put(path, directive.comment);
        index.add(directive.value, path);
        break;
    }
  }

  /**
   * Returns the repository path of an included file, or null if it does not exist.
   *
   * @param path "//" prefixed path from the root, or a path relative to the including file.
   * @param start path of the including file.
   */
  private String resolveInclude(String path, String start) throws IOException {
    String includePath;
    if (path.startsWith("//")) {
      includePath = path.substring(2);
    } else {
      includePath = Util.join(Util.getDirName(start), path);
    }
    includePath = Util.normalize(includePath);
    if (includePath == null || includePath.isEmpty() || !source.exists(includePath)) {
      return null;
    }
    return includePath;
  }

  /** Returns the comment of the closest grant of owner at dir or its parents, or "". */
  String getMostSpecificComment(String owner, String dir) {
    Map<String, String> ownerComments = comments.getOrDefault(owner, Collections.emptyMap());
    String searchDir = dir;
    while (true) {
      String comment = ownerComments.get(searchDir);
      if (comment == null) {
        for (String pattern : Ordering.natural().sortedCopy(ownerComments.keySet())) {
          if (globMatcher.isPerFile(pattern) && globMatcher.matches(pattern, searchDir)) {
            comment = ownerComments.get(pattern);
            break;
          }
        }
      }
      if (comment != null) {
        return comment;
      }
      if (searchDir.isEmpty()) {
        break;
      }
      searchDir = Util.getDirName(searchDir);
    }
    return "";
  }

  /** Returns the number of distinct owners found so far, without "*". */
  public synchronized int getNumOwners() {
    return index.owners().size() - 1;
  }

  OwnershipIndex getIndex() {
    return index;
  }

  Set<String> getStopLooking() {
    return Collections.unmodifiableSet(stopLooking);
  }

  Set<String> getReadFiles() {
    return Collections.unmodifiableSet(readFiles);
  }

  CoverageSolver getSolver() {
    return solver;
  }
}
