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
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.satfusion.data.Column;
import net.satfusion.data.Dataset;
import net.satfusion.exceptions.IllegalDataException;
import net.satfusion.query.CacheableModel;
import net.satfusion.query.ModelSource;
import net.satfusion.storage.ColumnReader;
import net.satfusion.storage.ModelCacheStore;
import net.satfusion.storage.Product;
import net.satfusion.storage.RecordRepository;

/**
 * Evaluates cacheable models over whole products and stores the results 
 * with the sources used. Products are seeded in parallel through a 
 * {@link StreamExecutor}; a model already seeded with up to date sources 
 * is skipped unless forced.
 * 
 * @since 1.0
 */
public class ModelCacheSeeder {
  private static final Logger LOG = LoggerFactory.getLogger(
      ModelCacheSeeder.class);
  
  /** The product records. */
  private final RecordRepository repository;
  
  /** The product reader. */
  private final ColumnReader reader;
  
  /** The cache store. */
  private final ModelCacheStore store;
  
  /**
   * Default ctor.
   * @param repository The non-null record repository.
   * @param reader The non-null product reader.
   * @param store The non-null cache store.
   */
  public ModelCacheSeeder(final RecordRepository repository, 
                          final ColumnReader reader, 
                          final ModelCacheStore store) {
    if (repository == null) {
      throw new IllegalArgumentException("Repository cannot be null.");
    }
    if (reader == null) {
      throw new IllegalArgumentException("Reader cannot be null.");
    }
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    this.repository = repository;
    this.reader = reader;
    this.store = store;
  }
  
  /**
   * Seeds every product of the collection.
   * @param collection The non-null collection.
   * @param models The non-null models to seed.
   * @param force Whether to re-seed models that are up to date.
   * @param executor The non-null executor.
   * @return The counters of the batch.
   */
  public MaintenanceSummary seed(final String collection, 
                                 final List<? extends CacheableModel> models, 
                                 final boolean force, 
                                 final StreamExecutor executor) {
    return seed(repository.listAll(collection), models, force, executor);
  }
  
  /**
   * Seeds the given products.
   * @param products The non-null products.
   * @param models The non-null models to seed.
   * @param force Whether to re-seed models that are up to date.
   * @param executor The non-null executor.
   * @return The counters of the batch.
   */
  public MaintenanceSummary seed(final Collection<Product> products, 
                                 final List<? extends CacheableModel> models, 
                                 final boolean force, 
                                 final StreamExecutor executor) {
    if (models == null) {
      throw new IllegalArgumentException("Models cannot be null.");
    }
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null.");
    }
    CachedModels.byName(models);
    final List<CacheableModel> model_list = ImmutableList.copyOf(models);
    final MaintenanceSummary summary = new MaintenanceSummary();
    final Iterator<TaskResult<Product, Integer>> results = executor.execute(
        products.iterator(), 
        new Task<Product, Integer>() {
          @Override
          public Integer run(final Product product) throws Exception {
            return seedProduct(product, model_list, force);
          }
        });
    while (results.hasNext()) {
      final TaskResult<Product, Integer> result = results.next();
      if (result.isSuccess()) {
        summary.success(result.result());
        if (result.result() > 0) {
          LOG.info("{}: {} model(s) seeded", 
              result.input().getIdentifier(), result.result());
        } else {
          LOG.debug("{}: skipped, already seeded", 
              result.input().getIdentifier());
        }
      } else {
        summary.failure();
        LOG.error("Failed to seed product {}", 
            result.input().getIdentifier(), result.error());
      }
    }
    LOG.info("Seeding finished: {}", summary);
    return summary;
  }
  
  /**
   * Seeds a single product.
   * @param product The non-null product.
   * @param models The non-null models.
   * @param force Whether to re-seed models that are up to date.
   * @return The number of models written.
   * @throws IOException if the product or the cache could not be accessed.
   * @throws IllegalDataException if a required variable is missing or a 
   * model returned an unexpected number of rows.
   */
  public int seedProduct(final Product product, 
                         final List<? extends CacheableModel> models, 
                         final boolean force) throws IOException {
    Map<String, List<ModelSource>> provenance = store.readProvenance(
        product.getCollection(), product.getIdentifier());
    final List<CacheableModel> pending = Lists.newArrayList();
    for (final CacheableModel model : models) {
      final List<ModelSource> cached = provenance == null 
          ? null : provenance.get(model.name());
      if (force || cached == null 
          || CachedModels.isObsolete(model, product, cached)) {
        pending.add(model);
      }
    }
    if (pending.isEmpty()) {
      return 0;
    }
    
    final Dataset inputs = readInputs(product, pending);
    for (final CacheableModel model : pending) {
      final Dataset output = model.eval(inputs, 
          ImmutableList.of(model.cachedVariable()));
      final Column column = output.get(model.cachedVariable());
      if (column == null) {
        throw new IllegalDataException("Model " + model.name() 
            + " did not produce " + model.cachedVariable());
      }
      if (column.rows() != inputs.length()) {
        throw new IllegalDataException("Model " + model.name() + " returned " 
            + column.rows() + " rows for " + inputs.length() + " inputs.");
      }
      store.write(product.getCollection(), product.getIdentifier(), 
          model.name(), column, CachedModels.expectedSources(model, product));
    }
    return pending.size();
  }
  
  /**
   * Reads every variable the models need over the whole product.
   * @param product The product.
   * @param models The models.
   * @return The dataset.
   * @throws IOException if the product could not be read.
   */
  private Dataset readInputs(final Product product, 
                             final List<CacheableModel> models) 
      throws IOException {
    final Set<String> required = Sets.newLinkedHashSet();
    for (final CacheableModel model : models) {
      required.addAll(model.requiredVariables());
    }
    final int rows = reader.rowCount(product);
    final Dataset dataset = new Dataset();
    for (final String variable : required) {
      if (!reader.contains(product, variable)) {
        throw new IllegalDataException("Product " + product.getIdentifier() 
            + " does not contain required variable " + variable);
      }
      if (reader.isRecordVarying(product, variable)) {
        dataset.set(variable, reader.read(product, variable, 0, rows));
      } else {
        dataset.set(variable, 
            reader.read(product, variable, 0, 1).broadcast(rows));
      }
    }
    return dataset;
  }
}
