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
package net.satfusion.maintenance;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.satfusion.query.CacheableModel;
import net.satfusion.query.ModelSource;
import net.satfusion.storage.ModelCacheStore;
import net.satfusion.storage.Product;
import net.satfusion.storage.RecordRepository;

/**
 * Statistics of the model cache of a collection. A collection is 
 * <i>synced</i> when every product has an entry seeded with every listed
 * model and <i>clean</i> when there are no obsolete models, no models 
 * that are not listed and no entries without a product.
 * 
 * @since 1.0
 */
@JsonPropertyOrder({ "collection", "clean", "synced", "files", "models", 
  "looseModels" })
public class ModelCacheStatistics {
  private static final Logger LOG = LoggerFactory.getLogger(
      ModelCacheStatistics.class);
  
  private final String collection;
  private final FileCounts files = new FileCounts();
  private final Map<String, ModelCounts> models = Maps.newLinkedHashMap();
  private final Map<String, Integer> loose_models = Maps.newTreeMap();
  
  private ModelCacheStatistics(final String collection) {
    this.collection = collection;
  }
  
  /**
   * Walks the records and the cache entries of a collection.
   * @param repository The non-null record repository.
   * @param store The non-null cache store.
   * @param collection The non-null collection.
   * @param listed The models expected in the cache.
   * @return The statistics.
   * @throws IOException if the cache could not be read.
   */
  public static ModelCacheStatistics collect(
      final RecordRepository repository, 
      final ModelCacheStore store, 
      final String collection, 
      final List<? extends CacheableModel> listed) throws IOException {
    final Map<String, CacheableModel> by_name = CachedModels.byName(listed);
    final ModelCacheStatistics stats = new ModelCacheStatistics(collection);
    for (final String name : by_name.keySet()) {
      stats.models.put(name, new ModelCounts());
    }
    
    final Set<String> entries = Sets.newHashSet(
        store.listEntries(collection));
    final Set<String> products = Sets.newHashSet();
    stats.files.file_count = entries.size();
    for (final Product product : repository.listAll(collection)) {
      products.add(product.getIdentifier());
      stats.files.product_count++;
      final Map<String, List<ModelSource>> provenance = 
          entries.contains(product.getIdentifier()) 
            ? store.readProvenance(collection, product.getIdentifier()) 
            : null;
      if (provenance == null) {
        stats.files.missing_file_count++;
        for (final ModelCounts counts : stats.models.values()) {
          counts.missing++;
        }
        continue;
      }
      for (final Map.Entry<String, CacheableModel> entry : 
          by_name.entrySet()) {
        final ModelCounts counts = stats.models.get(entry.getKey());
        final List<ModelSource> cached = provenance.get(entry.getKey());
        if (cached == null) {
          counts.missing++;
        } else {
          counts.seeded++;
          if (CachedModels.isObsolete(entry.getValue(), product, cached)) {
            counts.obsolete++;
          }
        }
      }
      for (final String name : provenance.keySet()) {
        if (!by_name.containsKey(name)) {
          final Integer count = stats.loose_models.get(name);
          stats.loose_models.put(name, count == null ? 1 : count + 1);
        }
      }
    }
    for (final String entry : entries) {
      if (!products.contains(entry)) {
        stats.files.loose_file_count++;
      }
    }
    LOG.debug("Collected cache statistics of {}: clean={}, synced={}", 
        collection, stats.isClean(), stats.isSynced());
    return stats;
  }
  
  /** @return The collection. */
  @JsonProperty("collection")
  public String getCollection() {
    return collection;
  }
  
  /** @return True if nothing is obsolete or loose. */
  @JsonProperty("clean")
  public boolean isClean() {
    if (files.loose_file_count > 0 || !loose_models.isEmpty()) {
      return false;
    }
    for (final ModelCounts counts : models.values()) {
      if (counts.obsolete > 0) {
        return false;
      }
    }
    return true;
  }
  
  /** @return True if every product has every listed model. */
  @JsonProperty("synced")
  public boolean isSynced() {
    if (files.missing_file_count > 0) {
      return false;
    }
    for (final ModelCounts counts : models.values()) {
      if (counts.missing > 0) {
        return false;
      }
    }
    return true;
  }
  
  /** @return The file counts. */
  @JsonProperty("files")
  public FileCounts getFiles() {
    return files;
  }
  
  /** @return The counts per listed model. */
  @JsonProperty("models")
  public Map<String, ModelCounts> getModels() {
    return models;
  }
  
  /** @return The number of entries holding each model that is not listed. */
  @JsonProperty("looseModels")
  public Map<String, Integer> getLooseModels() {
    return loose_models;
  }
  
  /** Cache entry counts. */
  public static class FileCounts {
    private int file_count;
    private int product_count;
    private int missing_file_count;
    private int loose_file_count;
    
    @JsonProperty("fileCount")
    public int getFileCount() {
      return file_count;
    }
    
    @JsonProperty("productCount")
    public int getProductCount() {
      return product_count;
    }
    
    @JsonProperty("missingFileCount")
    public int getMissingFileCount() {
      return missing_file_count;
    }
    
    @JsonProperty("looseFileCount")
    public int getLooseFileCount() {
      return loose_file_count;
    }
  }
  
  /** Counts of a listed model. */
  public static class ModelCounts {
    private int seeded;
    private int obsolete;
    private int missing;
    
    @JsonProperty("seeded")
    public int getSeeded() {
      return seeded;
    }
    
    @JsonProperty("obsolete")
    public int getObsolete() {
      return obsolete;
    }
    
    @JsonProperty("missing")
    public int getMissing() {
      return missing;
    }
  }
}
