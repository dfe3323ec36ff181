// This file is part of SatFusion.
// Copyright (C) 2026  The SatFusion Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.satfusion.configuration;

import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import net.satfusion.configuration.provider.MapProvider;

/**
 * A helper for unit testing configuration consumers. Only a map provider and
 * the runtime overrides are consulted so the environment of the build does
 * not leak into the tests.
 * 
 * @since 1.0
 */
public class UnitTestConfiguration extends Configuration {

  /**
   * @param settings A non-null map of values.
   */
  protected UnitTestConfiguration(final Map<String, String> settings) {
    super(ImmutableList.of(new MapProvider("UnitTest", settings)));
  }
  
  /** @return A config without any settings. */
  public static UnitTestConfiguration getConfiguration() {
    return new UnitTestConfiguration(Maps.<String, String>newHashMap());
  }
  
  /**
   * @param settings A non-null map of key values to load on registration.
   * @return A config backed by the map.
   */
  public static UnitTestConfiguration getConfiguration(
      final Map<String, String> settings) {
    if (settings == null) {
      throw new IllegalArgumentException("Settings cannot be null.");
    }
    return new UnitTestConfiguration(settings);
  }
  
  /**
   * Injects a value for a registered key.
   * @param key A non-null and non-empty registered key.
   * @param value The value.
   */
  public void override(final String key, final Object value) {
    addOverride(key, value);
  }
}
