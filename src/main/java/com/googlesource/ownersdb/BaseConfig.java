// Copyright (C) 2019 The Android Open Source Project
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

import org.eclipse.jgit.lib.Config;

/**
 * BaseConfig wraps one section of a JGit Config for owners-db Config.
 *
 * <p>This base class provides a subset of JGit Config methods, bound to a section name, so that
 * callers only pass key names. It could be extended in the future to provide more dynamic
 * evaluation of key values.
 */
class BaseConfig {
  protected final String section; // name of the wrapped section
  protected final Config config; // wrapped JGit Config

  public BaseConfig(String section, Config config) {
    this.section = section;
    this.config = config;
  }

  public String getString(String name) {
    return config.getString(section, null, name);
  }

  public String getString(String name, String defaultValue) {
    String value = getString(name);
    return value != null ? value : defaultValue;
  }

  public int getInt(String name, int defaultValue) {
    return config.getInt(section, name, defaultValue);
  }

  public long getLong(String name, long defaultValue) {
    return config.getLong(section, name, defaultValue);
  }

  public boolean getBoolean(String name, boolean defaultValue) {
    return config.getBoolean(section, name, defaultValue);
  }

  public <T extends Enum<?>> T getEnum(String name, T defaultValue) {
    return config.getEnum(section, null, name, defaultValue);
  }
}
