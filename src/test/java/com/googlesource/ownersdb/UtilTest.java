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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.FluentLogger;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Test Util class */
@RunWith(JUnit4.class)
public class UtilTest {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  @Rule public Watcher watcher = new Watcher(logger);

  @Test
  public void getDirNameTest() {
    assertThat(Util.getDirName("a/b/c.java")).isEqualTo("a/b");
    assertThat(Util.getDirName("a/b")).isEqualTo("a");
    assertThat(Util.getDirName("c.java")).isEqualTo("");
    assertThat(Util.getDirName("")).isEqualTo("");
  }

  @Test
  public void getBaseNameTest() {
    assertThat(Util.getBaseName("a/b/c.java")).isEqualTo("c.java");
    assertThat(Util.getBaseName("c.java")).isEqualTo("c.java");
  }

  @Test
  public void joinTest() {
    assertThat(Util.join("", "OWNERS")).isEqualTo("OWNERS");
    assertThat(Util.join("a/b", "OWNERS")).isEqualTo("a/b/OWNERS");
    assertThat(Util.join("a/b", "*.md")).isEqualTo("a/b/*.md");
    assertThat(Util.join("a", "")).isEqualTo("a");
  }

  @Test
  public void gitRepoFilePathTest() {
    assertThat(Util.gitRepoFilePath(null)).isEqualTo("");
    assertThat(Util.gitRepoFilePath("")).isEqualTo("");
    assertThat(Util.gitRepoFilePath("./")).isEqualTo(".");
    assertThat(Util.gitRepoFilePath("//a/b/")).isEqualTo("a/b");
    assertThat(Util.gitRepoFilePath("./a/b")).isEqualTo("a/b");
    assertThat(Util.gitRepoFilePath("././a/b//")).isEqualTo("a/b");
    assertThat(Util.gitRepoFilePath("a/./b")).isEqualTo("a/./b");
  }

  @Test
  public void normalizeTest() {
    assertThat(Util.normalize("a/b/c")).isEqualTo("a/b/c");
    assertThat(Util.normalize("./a//b/")).isEqualTo("a/b");
    assertThat(Util.normalize("a/./b/../c")).isEqualTo("a/c");
    assertThat(Util.normalize("a/..")).isEqualTo("");
    assertThat(Util.normalize("../a")).isNull();
    assertThat(Util.normalize("a/../../b")).isNull();
  }

  @Test
  public void isUnderRootTest() {
    assertThat(Util.isUnderRoot("a/b.c")).isTrue();
    assertThat(Util.isUnderRoot("./a/../b.c")).isTrue();
    assertThat(Util.isUnderRoot(null)).isFalse();
    assertThat(Util.isUnderRoot("")).isFalse();
    assertThat(Util.isUnderRoot("/etc/passwd")).isFalse();
    assertThat(Util.isUnderRoot("\\a")).isFalse();
    assertThat(Util.isUnderRoot("a/../../b")).isFalse();
  }

  @Test
  public void parseBooleanTest() {
    for (String s : new String[] {"1", "yes", "Yes", "YES", "true", "True", "TRUE"}) {
      assertThat(Util.parseBoolean(s)).isTrue();
    }
    for (String s : new String[] {"0", "no", "No", "NO", "false", "False", "FALSE", "", "2"}) {
      assertThat(Util.parseBoolean(s)).isFalse();
    }
    assertThat(Util.parseBoolean(null)).isFalse();
  }

  @Test
  public void addToMapTest() {
    Map<String, Set<String>> m = new HashMap<>();
    Util.addToMap(m, "k1", "v1");
    Util.addToMap(m, "k1", "v2");
    Util.addToMap(m, "k1", "v1");
    Util.addToMap(m, "k2", "v3");
    assertThat(m).hasSize(2);
    assertThat(m.get("k1")).containsExactly("v1", "v2");
    assertThat(m.get("k2")).containsExactly("v3");
  }

  @Test
  public void makeSortedMapTest() {
    Map<String, Set<String>> m = new HashMap<>();
    m.put("b", ImmutableSet.of("y", "x"));
    m.put("a", ImmutableSet.of());
    SortedMap<String, List<String>> sorted = Util.makeSortedMap(m);
    assertThat(sorted.keySet()).containsExactly("a", "b").inOrder();
    assertThat(sorted.get("a")).isEmpty();
    assertThat(sorted.get("b")).containsExactly("x", "y").inOrder();
  }
}
