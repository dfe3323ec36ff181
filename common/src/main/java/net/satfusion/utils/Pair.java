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
package net.satfusion.utils;

import java.util.Objects;

/**
 * Simple immutable pair where either of the values may be null. Used to
 * return two results from a single call, e.g. a filtered dataset and the
 * filters that could not be applied yet.
 *
 * @param <K> Object type for the key
 * @param <V> Object type for the value
 * 
 * @since 1.0
 */
public class Pair<K, V> {

  /** The key or left hand value */
  protected final K key;
  
  /** The value or right hand value */
  protected final V value;
  
  /**
   * Ctor that stores references to the objects
   * @param key The key or left hand value to store
   * @param value The value or right hand value to store
   */
  public Pair(final K key, final V value) {
    this.key = key;
    this.value = value;
  }
  
  /** @return The stored key/left value, may be null */
  public K getKey() {
    return key;
  }
  
  /** @return The stored value/right value, may be null */
  public V getValue() {
    return value;
  }
  
  @Override
  public int hashCode() {
    return (key == null ? 0 : key.hashCode()) ^
           (value == null ? 0 : value.hashCode());
  }
  
  @Override
  public boolean equals(final Object object) {
    if (object == this) {
      return true;
    }
    if (object instanceof Pair<?, ?>) {
      final Pair<?, ?> other = (Pair<?, ?>) object;
      return Objects.equals(key, other.key) 
          && Objects.equals(value, other.value);
    }
    return false;
  }
  
  /** @return a descriptive string in the format "key=K, value=V" */
  @Override
  public String toString() {
    return new StringBuilder().append("key=")
      .append(key).append(", value=").append(value).toString();
  }
}
