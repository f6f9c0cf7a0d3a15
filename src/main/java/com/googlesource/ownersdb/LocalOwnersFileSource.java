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
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** OWNERS files of a checked out work tree. */
public class LocalOwnersFileSource implements OwnersFileSource {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Path root;

  public LocalOwnersFileSource(Path root) {
    this.root = root.toAbsolutePath().normalize();
  }

  @Override
  public String getKey() {
    return root.toString();
  }

  @Override
  public boolean exists(String path) {
    return Files.isRegularFile(resolve(path));
  }

  @Override
  public List<String> readLines(String path) throws IOException {
    logger.atFiner().log("read %s under %s", path, root);
    return Files.readAllLines(resolve(path), UTF_8);
  }

  private Path resolve(String path) {
    return root.resolve(Util.gitRepoFilePath(path));
  }
}
