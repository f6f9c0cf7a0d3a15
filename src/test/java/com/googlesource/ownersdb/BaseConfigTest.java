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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.googlesource.ownersdb.Config.TieBreak;
import org.eclipse.jgit.errors.ConfigInvalidException;
import org.eclipse.jgit.lib.Config;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class BaseConfigTest {

  private static BaseConfig createConfig(String name, String content)
      throws ConfigInvalidException {
    Config cfg = new Config();
    cfg.fromText(content); // could throw ConfigInvalidException
    return new BaseConfig(name, cfg);
  }

  private static String section(String name) {
    return "[" + name + "]\n";
  }

  private static void sanityChecks(BaseConfig cfg) {
    assertEquals("string", "1+1", cfg.getString("k1"));
    assertEquals("string", "'t'+k1", cfg.getString("v1"));
    assertEquals("int", 2, cfg.getInt("v2", 1));
    assertEquals("long", 2L, cfg.getLong("v2", 1L));
    assertEquals("int", 7, cfg.getInt("v7", 7));
    assertNull(cfg.getString("k3"));
    assertEquals("string", "dflt", cfg.getString("k3", "dflt"));
    assertTrue("boolean", cfg.getBoolean("k2", false));
  }

  @Test
  public void sanity() throws ConfigInvalidException {
    String name = "owners";
    String content0 = section(name) + "k1=1+1\nk2=true\nv1='t'+k1\nv2=2\n";
    String content1 = section("other") + "k3='abc'\n";
    BaseConfig cfg = createConfig(name, content0 + content1);
    sanityChecks(cfg);
    assertFalse("boolean", cfg.getBoolean("addDebugMsg", false));
    assertTrue("boolean", cfg.getBoolean("addDebugMsg", true));
    // Other sections are not visible.
    cfg = createConfig(name, content0 + content1 + "addDebugMsg=true\n");
    sanityChecks(cfg);
    assertFalse("boolean", cfg.getBoolean("addDebugMsg", false));
    cfg = createConfig(name, content0 + "addDebugMsg=yes\n" + content1);
    assertTrue("boolean", cfg.getBoolean("addDebugMsg", false));
  }

  @Test
  public void enumTest() throws ConfigInvalidException {
    BaseConfig cfg = createConfig("owners", section("owners") + "a=sorted\nb=Random\nc=bad\n");
    assertEquals(TieBreak.SORTED, cfg.getEnum("a", TieBreak.RANDOM));
    assertEquals(TieBreak.RANDOM, cfg.getEnum("b", TieBreak.SORTED));
    assertEquals(TieBreak.SORTED, cfg.getEnum("d", TieBreak.SORTED));
    assertThrows(IllegalArgumentException.class, () -> cfg.getEnum("c", TieBreak.SORTED));
  }
}
