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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.flogger.FluentLogger;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.eclipse.jgit.errors.RevisionSyntaxException;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevTree;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.TreeWalk;

/**
 * OWNERS files of one commit of a Git repository.
 *
 * <p>The content of every looked up path is kept, so a file included by several OWNERS files, or
 * checked for existence before it is read, is only read once from the object database.
 */
public class GitOwnersFileSource implements OwnersFileSource {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Repository repo;
  private final ObjectId commitId;
  private RevTree tree; // parsed lazily
  private final Map<String, Optional<String>> readFiles = new HashMap<>(); // path => content

  public GitOwnersFileSource(Repository repo, ObjectId commitId) {
    this.repo = repo;
    this.commitId = commitId;
  }

  /** Returns a source for the commit that revision, e.g. "HEAD" or "refs/heads/main", names. */
  public static GitOwnersFileSource open(Repository repo, String revision) throws IOException {
    ObjectId id;
    try {
      id = repo.resolve(revision);
    } catch (RevisionSyntaxException e) {
      throw new IOException("invalid revision " + revision, e);
    }
    if (id == null) {
      logger.atSevere().log("cannot find revision %s in %s", revision, repo.getIdentifier());
      throw new IOException("cannot find revision " + revision);
    }
    return new GitOwnersFileSource(repo, id);
  }

  public ObjectId getCommitId() {
    return commitId;
  }

  @Override
  public String getKey() {
    return repo.getIdentifier() + ":" + commitId.name();
  }

  @Override
  public boolean exists(String path) throws IOException {
    return getFile(path).isPresent();
  }

  @Override
  public List<String> readLines(String path) throws IOException {
    Optional<String> content = getFile(path);
    if (!content.isPresent()) {
      throw new FileNotFoundException(path + " not found in " + commitId.name());
    }
    return List.of(content.get().split("\\R"));
  }

  /** Returns file content, or empty if there is no regular file at path. */
  private Optional<String> getFile(String path) throws IOException {
    String file = Util.gitRepoFilePath(path);
    Optional<String> content = readFiles.get(file);
    if (content != null) {
      return content;
    }
    content = Optional.empty();
    try (RevWalk revWalk = new RevWalk(repo)) {
      if (tree == null) {
        tree = revWalk.parseCommit(commitId).getTree();
      }
      ObjectReader reader = revWalk.getObjectReader();
      try (TreeWalk treeWalk = file.isEmpty() ? null : TreeWalk.forPath(reader, file, tree)) {
        if (treeWalk != null
            && (treeWalk.getRawMode(0) & FileMode.TYPE_MASK) == FileMode.TYPE_FILE) {
          content = Optional.of(new String(reader.open(treeWalk.getObjectId(0)).getBytes(), UTF_8));
          logger.atFiner().log("getFile:%s:(...)", file);
        } else {
          logger.atFiner().log("getFile:%s (NOT FOUND)", file);
        }
      }
    }
    readFiles.put(file, content);
    return content;
  }
}
