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

import com.google.common.collect.Sets;

import net.satfusion.query.CacheableModel;
import net.satfusion.query.ModelSource;
import net.satfusion.storage.ModelCacheStore;
import net.satfusion.storage.Product;
import net.satfusion.storage.RecordRepository;

/**
 * Removes cached models from the cache entries of a collection. By default
 * only obsolete models are removed, forcing removes every listed model.
 * 
 * @since 1.0
 */
public class ModelCacheFlusher {
  private static final Logger LOG = LoggerFactory.getLogger(
      ModelCacheFlusher.class);
  
  /** The product records. */
  private final RecordRepository repository;
  
  /** The cache store. */
  private final ModelCacheStore store;
  
  /**
   * Default ctor.
   * @param repository The non-null record repository.
   * @param store The non-null cache store.
   */
  public ModelCacheFlusher(final RecordRepository repository, 
                           final ModelCacheStore store) {
    if (repository == null) {
      throw new IllegalArgumentException("Repository cannot be null.");
    }
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    this.repository = repository;
    this.store = store;
  }
  
  /**
   * Flushes the entries of every product of the collection.
   * @param collection The non-null collection.
   * @param models The listed models.
   * @param force Remove the listed models even if up to date.
   * @param flush_nonlisted Also remove models that are not listed.
   * @param remove_empty Remove entries left without any model.
   * @return The counters of the batch.
   */
  public MaintenanceSummary flush(final String collection, 
                                  final List<? extends CacheableModel> models,
                                  final boolean force, 
                                  final boolean flush_nonlisted, 
                                  final boolean remove_empty) {
    if (models == null) {
      throw new IllegalArgumentException("Models cannot be null.");
    }
    final Map<String, CacheableModel> listed = CachedModels.byName(models);
    final MaintenanceSummary summary = new MaintenanceSummary();
    for (final Product product : repository.listAll(collection)) {
      try {
        final int removed = flushProduct(product, listed, force, 
            flush_nonlisted, remove_empty);
        summary.success(removed);
        if (removed > 0) {
          LOG.info("{}: {} model(s) flushed", product.getIdentifier(), 
              removed);
        }
      } catch (IOException | RuntimeException e) {
        summary.failure();
        LOG.error("Failed to flush product {}", product.getIdentifier(), e);
      }
    }
    LOG.info("Flushing finished: {}", summary);
    return summary;
  }
  
  /**
   * Flushes the entry of a single product.
   * @param product The non-null product.
   * @param listed The listed models by name.
   * @param force Remove the listed models even if up to date.
   * @param flush_nonlisted Also remove models that are not listed.
   * @param remove_empty Remove the entry if left without any model.
   * @return The number of models removed.
   * @throws IOException if the cache could not be accessed.
   */
  public int flushProduct(final Product product, 
                          final Map<String, CacheableModel> listed, 
                          final boolean force, 
                          final boolean flush_nonlisted, 
                          final boolean remove_empty) throws IOException {
    final Map<String, List<ModelSource>> provenance = store.readProvenance(
        product.getCollection(), product.getIdentifier());
    if (provenance == null) {
      return 0;
    }
    final Set<String> to_remove = Sets.newLinkedHashSet();
    for (final Map.Entry<String, List<ModelSource>> entry : 
        provenance.entrySet()) {
      final CacheableModel model = listed.get(entry.getKey());
      if (model == null) {
        if (flush_nonlisted) {
          to_remove.add(entry.getKey());
        }
      } else if (force 
          || CachedModels.isObsolete(model, product, entry.getValue())) {
        to_remove.add(entry.getKey());
      }
    }
    int removed = 0;
    for (final String name : to_remove) {
      if (store.remove(product.getCollection(), product.getIdentifier(), 
          name)) {
        removed++;
      }
    }
    if (remove_empty && to_remove.size() == provenance.size()) {
      store.removeEntry(product.getCollection(), product.getIdentifier());
      LOG.debug("{}: removed empty cache entry", product.getIdentifier());
    }
    return removed;
  }
  
  /**
   * Removes the cache entries without a matching product record.
   * @param collection The non-null collection.
   * @return The number of entries removed.
   * @throws IOException if the cache could not be listed.
   */
  public int flushLoose(final String collection) throws IOException {
    final Set<String> products = Sets.newHashSet();
    for (final Product product : repository.listAll(collection)) {
      products.add(product.getIdentifier());
    }
    int removed = 0;
    for (final String entry : store.listEntries(collection)) {
      if (products.contains(entry)) {
        continue;
      }
      if (store.removeEntry(collection, entry)) {
        LOG.info("{}: removed loose cache entry", entry);
        removed++;
      }
    }
    return removed;
  }
}
