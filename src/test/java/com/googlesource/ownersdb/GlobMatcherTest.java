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

import com.google.common.flogger.FluentLogger;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Test GlobMatcher class */
@RunWith(JUnit4.class)
public class GlobMatcherTest {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  @Rule public Watcher watcher = new Watcher(logger);

  private final GlobMatcher matcher = new GlobMatcher();

  @Test
  public void addPerFileTest() {
    assertThat(matcher.addPerFile("docs", "*.md")).isEqualTo("docs/*.md");
    assertThat(matcher.addPerFile("", "*.md")).isEqualTo("*.md");
    assertThat(matcher.isPerFile("docs/*.md")).isTrue();
    assertThat(matcher.isPerFile("*.md")).isTrue();
    assertThat(matcher.isPerFile("docs")).isFalse();
    assertThat(matcher.isPerFile("docs/*.txt")).isFalse();
  }

  @Test
  public void plainPathTest() {
    assertThat(matcher.matches("", "")).isTrue();
    assertThat(matcher.matches("", "docs")).isFalse();
    assertThat(matcher.matches("docs", "docs")).isTrue();
    assertThat(matcher.matches("docs", "docs/a.md")).isFalse();
    assertThat(matcher.matches("docs", "doc")).isFalse();
  }

  @Test
  public void globCharactersInDirectoryNamesTest() {
    assertThat(matcher.matches("a{b", "a{b")).isTrue();
    assertThat(matcher.matches("a{b", "ab")).isFalse();
    assertThat(matcher.matches("a[1]", "a[1]")).isTrue();
    assertThat(matcher.matches("a[1]", "a1")).isFalse();
    assertThat(matcher.matches("src/*", "src/*")).isTrue();
    assertThat(matcher.matches("src/*", "src/lib")).isFalse();
    String key = matcher.addPerFile("a{b", "*.c");
    assertThat(matcher.matches(key, "a{b/x.c")).isTrue();
    assertThat(matcher.matches(key, "ab/x.c")).isFalse();
  }

  @Test
  public void globTest() {
    String md = matcher.addPerFile("docs", "*.md");
    assertThat(matcher.matches(md, "docs/readme.md")).isTrue();
    assertThat(matcher.matches(md, "docs/build.py")).isFalse();
    String rootMd = matcher.addPerFile("", "*.md");
    assertThat(matcher.matches(rootMd, "readme.md")).isTrue();
    String txt = matcher.addPerFile("docs", "{a,b}.txt");
    assertThat(matcher.matches(txt, "docs/b.txt")).isTrue();
    assertThat(matcher.matches(txt, "docs/c.txt")).isFalse();
    assertThat(matcher.matches(matcher.addPerFile("docs", "?.txt"), "docs/c.txt")).isTrue();
    assertThat(matcher.matches(matcher.addPerFile("docs", "[a-c].txt"), "docs/c.txt")).isTrue();
  }

  @Test
  public void globDoesNotCrossDirectoriesTest() {
    String all = matcher.addPerFile("docs", "*");
    String md = matcher.addPerFile("docs", "*.md");
    String rootMd = matcher.addPerFile("", "*.md");
    assertThat(matcher.matches(all, "docs/sub/readme.md")).isFalse();
    assertThat(matcher.matches(md, "docs/sub/readme.md")).isFalse();
    assertThat(matcher.matches(md, "other/readme.md")).isFalse();
    assertThat(matcher.matches(rootMd, "docs/readme.md")).isFalse();
    // The directory itself is not a file in it.
    assertThat(matcher.matches(all, "docs")).isFalse();
    assertThat(matcher.matches(rootMd, "")).isFalse();
  }

  @Test
  public void invalidGlobTest() {
    String key = matcher.addPerFile("docs", "[a.md");
    assertThat(matcher.matches(key, "docs/[a.md")).isFalse();
    assertThat(matcher.matches(key, "docs/a.md")).isFalse();
    assertThat(GlobMatcher.checkGlob("[a.md")).isNotNull();
    assertThat(GlobMatcher.checkGlob("{a,b")).isNotNull();
    assertThat(GlobMatcher.checkGlob("*.md")).isNull();
    assertThat(GlobMatcher.checkGlob("{a,b}.txt")).isNull();
  }
}
