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
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import net.satfusion.data.Dataset;
import net.satfusion.data.DatasetIterator;
import net.satfusion.data.DatasetIterators;
import net.satfusion.data.Record;
import net.satfusion.exceptions.EmptyCollectionException;
import net.satfusion.exceptions.QueryExecutionException;
import net.satfusion.interpolation.InterpolationKind;
import net.satfusion.source.ProductSource;
import net.satfusion.storage.ColumnReader;
import net.satfusion.storage.Product;
import net.satfusion.utils.DateTime;

/**
 * A time series backed by the records of a {@link ProductSource}. Each 
 * chunk holds the rows of one record within the requested window. When no
 * record overlaps the window a single empty chunk typed after a sample 
 * product of the collections is yielded.
 * 
 * @since 1.0
 */
public class ProductTimeSeries extends BaseProductTimeSeries {
  private static final Logger LOG = LoggerFactory.getLogger(
      ProductTimeSeries.class);
  
  /** The variables of the product type. */
  private final List<String> variables;
  
  /**
   * Default ctor.
   * @param source A non-null product source.
   * @param reader A non-null column reader.
   * @param variables A non-null and non-empty list of the variables of the
   * product type, including the time variable.
   */
  public ProductTimeSeries(final ProductSource source, 
                           final ColumnReader reader,
                           final List<String> variables) {
    this(source, reader, variables, null);
  }
  
  /**
   * Ctor with overridden interpolation kinds.
   * @param source A non-null product source.
   * @param reader A non-null column reader.
   * @param variables A non-null and non-empty list of the variables of the
   * product type, including the time variable.
   * @param kinds Optional interpolation kinds.
   */
  public ProductTimeSeries(final ProductSource source, 
                           final ColumnReader reader,
                           final List<String> variables,
                           final Map<String, InterpolationKind> kinds) {
    super(source, reader, kinds);
    if (variables == null || variables.isEmpty()) {
      throw new IllegalArgumentException("Variables cannot be null or "
          + "empty.");
    }
    if (!variables.contains(timeVariable())) {
      throw new IllegalArgumentException("Variables must contain the time "
          + "variable " + timeVariable());
    }
    this.variables = ImmutableList.copyOf(variables);
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
    return new RecordChunks(start, stop, extracted);
  }
  
  @Override
  protected Dataset emptyDataset(final List<String> variables) {
    final Product sample = source.sampleRecord();
    if (sample == null) {
      LOG.error("Empty collection {}! The variables and their types cannot "
          + "be reliably determined!", id());
      throw new EmptyCollectionException(id());
    }
    LOG.debug("{}: empty dataset typed after product {}", id(), 
        sample.getIdentifier());
    try {
      return extract(sample, variables, new RowSelection(0, 0, null));
    } catch (IOException e) {
      throw new QueryExecutionException("Failed to read the sample product "
          + sample.getIdentifier(), 500, e);
    }
  }
  
  /** Reads one record per chunk. */
  private class RecordChunks extends ChunkIterator {
    private final long start;
    private final long stop;
    private final List<String> variables;
    private final Iterator<Record<Product>> records;
    private int counter;
    
    RecordChunks(final long start, 
                 final long stop, 
                 final List<String> variables) {
      this.start = start;
      this.stop = stop;
      this.variables = variables;
      records = source.iterRecords(start, stop, 
          parameters.getTimeTolerance());
    }
    
    @Override
    protected Dataset computeNext() {
      if (!records.hasNext()) {
        if (counter++ < 1) {
          // at least one typed chunk for a non-empty collection
          return emptyDataset(variables);
        }
        return endOfData();
      }
      final Record<Product> record = records.next();
      final Product product = record.payload();
      counter++;
      product_set.add(product.getIdentifier());
      if (LOG.isDebugEnabled()) {
        LOG.debug("{}: product {} span {}/{}", id(), product.getIdentifier(),
            DateTime.format(record.start()), DateTime.format(record.end()));
      }
      try {
        final Dataset dataset = extract(product, variables, selectRows(
            product, Math.max(start, record.start()), 
            Math.min(stop, record.end())));
        LOG.debug("{}: dataset length: {}", id(), dataset.length());
        return dataset;
      } catch (IOException e) {
        throw new QueryExecutionException("Failed to read product " 
            + product.getIdentifier() + " of " + id(), 500, e);
      }
    }
  }
}
