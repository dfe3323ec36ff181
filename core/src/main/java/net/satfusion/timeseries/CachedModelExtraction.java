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
package net.satfusion.timeseries;

import java.io.IOException;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.satfusion.data.Column;
import net.satfusion.data.ColumnType;
import net.satfusion.data.Dataset;
import net.satfusion.data.DatasetIterator;
import net.satfusion.data.DatasetIterators;
import net.satfusion.data.Record;
import net.satfusion.exceptions.IllegalDataException;
import net.satfusion.exceptions.QueryExecutionException;
import net.satfusion.interpolation.InterpolationKind;
import net.satfusion.query.CacheableModel;
import net.satfusion.query.ModelSource;
import net.satfusion.source.ProductSource;
import net.satfusion.storage.ColumnReader;
import net.satfusion.storage.ModelCacheStore;
import net.satfusion.storage.Product;
import net.satfusion.utils.DateTime;

/**
 * Extracts the model values precomputed per product from the 
 * {@link ModelCacheStore}. A cached column is only trusted when the sources
 * it was computed from, restricted to the span of the record, equal the 
 * sources the live model reports for the same span. Obsolete or absent 
 * columns are filled with NaNs to be evaluated later by the
 * {@link net.satfusion.models.CachedModelGapFill}.
 * <p>
 * The variables are named {@link #PREFIX} followed by the cached variable
 * of the model, e.g. {@code __cached__B_NEC_CHAOS-Core}.
 * 
 * @since 1.0
 */
public class CachedModelExtraction extends BaseProductTimeSeries {
  private static final Logger LOG = LoggerFactory.getLogger(
      CachedModelExtraction.class);
  
  /** The prefix of the cached variables. */
  public static final String PREFIX = "__cached__";
  
  /** Number of components of the cached vectors. */
  public static final int WIDTH = 3;
  
  /** The models keyed by their cached variable name. */
  private final LinkedHashMap<String, CacheableModel> models;
  
  /** The cache store. */
  private final ModelCacheStore store;
  
  /** The offered variables. */
  private final List<String> variables;
  
  /**
   * Default ctor.
   * @param source A non-null product source.
   * @param reader A non-null column reader.
   * @param store A non-null cache store.
   * @param models A non-null and non-empty list of cached models.
   * @param kind The interpolation kind of the cached variables, nearest
   * when null. Use nearest when the source is the master collection.
   */
  public CachedModelExtraction(final ProductSource source, 
                               final ColumnReader reader,
                               final ModelCacheStore store,
                               final List<? extends CacheableModel> models,
                               final InterpolationKind kind) {
    super(source, reader, kinds(models, kind));
    if (store == null) {
      throw new IllegalArgumentException("Store cannot be null.");
    }
    this.store = store;
    this.models = Maps.newLinkedHashMap();
    for (final CacheableModel model : models) {
      this.models.put(cacheVariable(model), model);
    }
    variables = ImmutableList.copyOf(this.models.keySet());
    LOG.debug("{}: cached models {} interpolated with {}", id(), 
        variables, kind);
  }
  
  /**
   * @param model A non-null model.
   * @return The name of the cached variable of the model.
   */
  public static String cacheVariable(final CacheableModel model) {
    return PREFIX + model.cachedVariable();
  }
  
  @Override
  public String id() {
    return source.identifier() + ":cached";
  }
  
  @Override
  public List<String> variables() {
    return variables;
  }
  
  @Override
  public DatasetIterator subset(final long start, 
                                final long stop, 
                                final Collection<String> variables) {
    final List<String> extracted = extractedVariables(variables);
    if (LOG.isDebugEnabled()) {
      LOG.debug("{}: subset {}/{} of {}", id(), DateTime.format(start), 
          DateTime.format(stop), extracted);
    }
    if (extracted.isEmpty()) {
      return DatasetIterators.empty();
    }
    return new CachedChunks(start, stop, extracted);
  }
  
  @Override
  protected Dataset emptyDataset(final List<String> variables) {
    final Dataset dataset = new Dataset();
    dataset.set(timeVariable(), Column.empty(ColumnType.TIMESTAMP, 1, null));
    fillMissing(dataset, modelVariables(variables));
    return dataset;
  }
  
  /** @return The requested cached model variables. */
  private Set<String> modelVariables(final Collection<String> variables) {
    final Set<String> result = Sets.newLinkedHashSet();
    for (final String variable : variables) {
      if (models.containsKey(variable)) {
        result.add(variable);
      }
    }
    return result;
  }
  
  /** Sets NaN columns for the variables. */
  private void fillMissing(final Dataset dataset, 
                           final Collection<String> variables) {
    final int length = dataset.length();
    for (final String variable : variables) {
      dataset.set(variable, Column.missing(ColumnType.DOUBLE, WIDTH, length, 
          null));
    }
  }
  
  /**
   * Reads the trusted cached columns of a product.
   * @param product The product.
   * @param selection The selected rows.
   * @param requested The requested cached variables.
   * @param start The start of the record span.
   * @param end The end of the record span.
   * @return The trusted columns.
   * @throws IOException if the cache could not be read.
   */
  private Dataset readCached(final Product product, 
                             final RowSelection selection, 
                             final Set<String> requested, 
                             final long start, 
                             final long end) throws IOException {
    final Dataset dataset = new Dataset();
    if (requested.isEmpty()) {
      return dataset;
    }
    final Map<String, List<ModelSource>> provenance = store.readProvenance(
        product.getCollection(), product.getIdentifier());
    if (provenance == null) {
      LOG.debug("{}: no cache entry for product {}", id(), 
          product.getIdentifier());
      return dataset;
    }
    final List<String> obsolete = Lists.newArrayList();
    for (final String variable : requested) {
      final CacheableModel model = models.get(variable);
      final List<ModelSource> cached_sources = provenance.get(model.name());
      if (cached_sources == null) {
        continue;
      }
      final Set<String> cached = Sets.newHashSet();
      for (final ModelSource cached_source : cached_sources) {
        if (cached_source.intersects(start, end)) {
          cached.add(cached_source.getName());
        }
      }
      final Set<String> expected = Sets.newHashSet();
      for (final ModelSource expected_source : model.sources(start, end)) {
        expected.add(expected_source.getName());
      }
      if (!expected.equals(cached)) {
        obsolete.add(model.name());
        continue;
      }
      final Column column = store.readColumn(product.getCollection(), 
          product.getIdentifier(), model.name());
      if (column == null) {
        continue;
      }
      if (column.type() != ColumnType.DOUBLE || column.width() != WIDTH) {
        throw new IllegalDataException("Cached model " + model.name() 
            + " of product " + product.getIdentifier() 
            + " has an unexpected shape: " + column);
      }
      if (column.rows() < selection.to) {
        throw new IllegalDataException("Cached model " + model.name() 
            + " of product " + product.getIdentifier() + " has " 
            + column.rows() + " rows but " + selection.to 
            + " were expected.");
      }
      dataset.set(variable, selection.apply(column));
      product_set.addAll(cached);
    }
    if (!obsolete.isEmpty()) {
      LOG.warn("{}: obsolete cached models detected: {}", id(), 
          Joiner.on(", ").join(obsolete));
    }
    return dataset;
  }
  
  /** One chunk per record. */
  private class CachedChunks extends ChunkIterator {
    private final long start;
    private final long stop;
    private final List<String> variables;
    private final Set<String> requested;
    private final List<String> raw;
    private final Iterator<Record<Product>> records;
    private int counter;
    
    CachedChunks(final long start, 
                 final long stop, 
                 final List<String> variables) {
      this.start = start;
      this.stop = stop;
      this.variables = variables;
      requested = modelVariables(variables);
      raw = Lists.newArrayList();
      for (final String variable : variables) {
        if (!models.containsKey(variable)) {
          raw.add(variable);
        }
      }
      records = source.iterRecords(start, stop, 
          parameters.getTimeTolerance());
    }
    
    @Override
    protected Dataset computeNext() {
      if (!records.hasNext()) {
        if (counter++ < 1) {
          return emptyDataset(variables);
        }
        return endOfData();
      }
      counter++;
      final Record<Product> record = records.next();
      final Product product = record.payload();
      product_set.add(product.getIdentifier());
      final long span_start = Math.max(start, record.start());
      final long span_end = Math.min(stop, record.end());
      try {
        final RowSelection selection = selectRows(product, span_start, 
            span_end);
        final Dataset dataset = extract(product, raw, selection);
        final Dataset cached = readCached(product, selection, requested, 
            span_start, span_end);
        if (dataset.isEmpty()) {
          dataset.update(cached);
        } else {
          dataset.merge(cached);
        }
        final Set<String> missing = Sets.newLinkedHashSet(requested);
        missing.removeAll(cached.variables());
        if (!missing.isEmpty()) {
          LOG.debug("{}: missing model variables: {}", id(), missing);
          if (dataset.isEmpty()) {
            // no raw variable, keep the row count of the selection
            Column times = reader.read(product, timeVariable(), 
                selection.from, selection.to);
            if (selection.index != null) {
              times = times.select(selection.index);
            }
            dataset.set(timeVariable(), times);
          }
          fillMissing(dataset, missing);
        }
        return dataset.extract(variables);
      } catch (IOException e) {
        throw new QueryExecutionException("Failed to read the cached models "
            + "of product " + product.getIdentifier(), 500, e);
      }
    }
  }
  
  private static Map<String, InterpolationKind> kinds(
      final List<? extends CacheableModel> models, 
      final InterpolationKind kind) {
    if (models == null || models.isEmpty()) {
      throw new IllegalArgumentException("Models cannot be null or empty.");
    }
    final Map<String, InterpolationKind> kinds = Maps.newHashMap();
    for (final CacheableModel model : models) {
      if (model == null) {
        throw new IllegalArgumentException("Models cannot contain nulls.");
      }
      kinds.put(cacheVariable(model), kind == null 
          ? InterpolationKind.NEAREST : kind);
    }
    return kinds;
  }
}
