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
package net.satfusion.configuration.provider;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;

import com.google.common.collect.Maps;

/**
 * A provider backed by a mutable map. Used for runtime overrides and unit
 * tests.
 * 
 * @since 1.0
 */
public class MapProvider implements Provider {
  
  /** The source name of the runtime overrides. */
  public static final String RUNTIME_SOURCE = "RuntimeOverride";
  
  /** The name of this provider. */
  protected final String source;
  
  /** The values. */
  protected final Map<String, Object> kvs;
  
  /**
   * Ctor with an empty map.
   * @param source A non-null source name.
   */
  public MapProvider(final String source) {
    this(source, Maps.<String, Object>newHashMap());
  }
  
  /**
   * Ctor with initial values. The map is copied.
   * @param source A non-null source name.
   * @param kvs A non-null map of values.
   */
  public MapProvider(final String source, final Map<String, ?> kvs) {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    if (kvs == null) {
      throw new IllegalArgumentException("Map cannot be null.");
    }
    this.source = source;
    this.kvs = Collections.synchronizedMap(Maps.<String, Object>newHashMap(kvs));
  }
  
  /**
   * Sets a value.
   * @param key A non-null key.
   * @param value A value, may be null.
   */
  public void put(final String key, final Object value) {
    kvs.put(key, value);
  }
  
  @Override
  public Object getSetting(final String key) {
    return kvs.get(key);
  }

  @Override
  public String source() {
    return source;
  }
  
  @Override
  public void close() throws IOException {
    // no-op
  }
}
