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
package net.satfusion.storage;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import net.satfusion.data.Column;
import net.satfusion.query.ModelSource;

/**
 * Keeps the cached model columns and their provenance in memory. Each 
 * entry is keyed by collection and product identifier and holds one column
 * and source list per model name.
 * 
 * @since 1.0
 */
public class MemoryModelCacheStore implements ModelCacheStore {

  /** The entries by collection then product identifier. */
  private final Map<String, Map<String, Entry>> collections = 
      Maps.newHashMap();
  
  @Override
  public synchronized Map<String, List<ModelSource>> readProvenance(
      final String collection, 
      final String product) throws IOException {
    final Entry entry = entry(collection, product, false);
    return entry == null ? null : ImmutableMap.copyOf(entry.sources);
  }
  
  @Override
  public synchronized Column readColumn(final String collection, 
                                        final String product, 
                                        final String model) 
      throws IOException {
    final Entry entry = entry(collection, product, false);
    return entry == null ? null : entry.columns.get(model);
  }
  
  @Override
  public synchronized void write(final String collection, 
                                 final String product, 
                                 final String model, 
                                 final Column column, 
                                 final List<ModelSource> sources) 
      throws IOException {
    if (model == null || model.isEmpty()) {
      throw new IllegalArgumentException("Model cannot be null or empty.");
    }
    if (column == null) {
      throw new IllegalArgumentException("Column cannot be null.");
    }
    final Entry entry = entry(collection, product, true);
    entry.columns.put(model, column);
    entry.sources.put(model, sources == null 
        ? ImmutableList.<ModelSource>of() : ImmutableList.copyOf(sources));
  }
  
  @Override
  public synchronized boolean remove(final String collection, 
                                     final String product, 
                                     final String model) throws IOException {
    final Entry entry = entry(collection, product, false);
    if (entry == null || !entry.sources.containsKey(model)) {
      return false;
    }
    entry.columns.remove(model);
    entry.sources.remove(model);
    return true;
  }
  
  @Override
  public synchronized boolean removeEntry(final String collection, 
                                          final String product) 
      throws IOException {
    final Map<String, Entry> entries = collections.get(collection);
    return entries != null && entries.remove(product) != null;
  }
  
  @Override
  public synchronized Set<String> listEntries(final String collection) 
      throws IOException {
    final Map<String, Entry> entries = collections.get(collection);
    return entries == null 
        ? ImmutableSet.<String>of() : ImmutableSet.copyOf(entries.keySet());
  }
  
  private Entry entry(final String collection, 
                      final String product, 
                      final boolean create) {
    if (collection == null || product == null) {
      throw new IllegalArgumentException("Collection and product cannot be "
          + "null.");
    }
    Map<String, Entry> entries = collections.get(collection);
    if (entries == null) {
      if (!create) {
        return null;
      }
      entries = Maps.newHashMap();
      collections.put(collection, entries);
    }
    Entry entry = entries.get(product);
    if (entry == null && create) {
      entry = new Entry();
      entries.put(product, entry);
    }
    return entry;
  }
  
  /** A cache entry of a product. */
  private static class Entry {
    private final Map<String, Column> columns = Maps.newLinkedHashMap();
    private final Map<String, List<ModelSource>> sources = 
        Maps.newLinkedHashMap();
  }
}
