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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.satfusion.data.Column;
import net.satfusion.data.ColumnType;
import net.satfusion.data.Dataset;
import net.satfusion.data.DatasetIterators;
import net.satfusion.exceptions.IllegalDataException;
import net.satfusion.interpolation.InterpolationKind;
import net.satfusion.query.TimeSeries;
import net.satfusion.source.ProductSource;
import net.satfusion.source.ProductTypeParameters;
import net.satfusion.storage.ColumnReader;
import net.satfusion.storage.Product;
import net.satfusion.utils.DateTime;

/**
 * Base for the time series reading the records of a {@link ProductSource}.
 * Implements the interpolation on top of {@link #subset(long, long, 
 * Collection)} and the row selection of the product payloads.
 * <p>
 * The set of products read is recorded as provenance and grows with every
 * call.
 * 
 * @since 1.0
 */
public abstract class BaseProductTimeSeries implements TimeSeries {
  private static final Logger LOG = LoggerFactory.getLogger(
      BaseProductTimeSeries.class);
  
  /** The source of the records. */
  protected final ProductSource source;
  
  /** The reader of the product payloads. */
  protected final ColumnReader reader;
  
  /** The product type parameters. */
  protected final ProductTypeParameters parameters;
  
  /** Interpolation kinds overriding the product type ones. */
  protected final Map<String, InterpolationKind> kinds;
  
  /** The identifiers of the products read. */
  protected final Set<String> product_set;
  
  /**
   * Default ctor.
   * @param source A non-null product source.
   * @param reader A non-null column reader.
   * @param kinds Optional kinds overriding the product type parameters.
   */
  protected BaseProductTimeSeries(final ProductSource source, 
                                  final ColumnReader reader, 
                                  final Map<String, InterpolationKind> kinds) {
    if (source == null) {
      throw new IllegalArgumentException("Source cannot be null.");
    }
    if (reader == null) {
      throw new IllegalArgumentException("Reader cannot be null.");
    }
    this.source = source;
    this.reader = reader;
    parameters = source.parameters();
    this.kinds = kinds == null ? ImmutableMap.<String, InterpolationKind>of() 
        : ImmutableMap.copyOf(kinds);
    product_set = Collections.synchronizedSet(new LinkedHashSet<String>());
  }
  
  @Override
  public String id() {
    return source.identifier();
  }
  
  /** @return The name of the time variable. */
  public String timeVariable() {
    return parameters.getTimeVariable();
  }
  
  /** @return The product source. */
  public ProductSource source() {
    return source;
  }
  
  @Override
  public List<String> requiredVariables() {
    return ImmutableList.of(timeVariable());
  }
  
  @Override
  public Set<String> products() {
    synchronized (product_set) {
      return ImmutableSet.copyOf(product_set);
    }
  }
  
  /**
   * @param variable A variable.
   * @return The interpolation kind of the variable.
   */
  public InterpolationKind kindOf(final String variable) {
    final InterpolationKind kind = kinds.get(variable);
    return kind == null ? parameters.kindOf(variable) : kind;
  }
  
  /**
   * Filters and de-duplicates the requested variables keeping the request 
   * order. The time variable is always accepted.
   * @param variables The requested variables, null for all.
   * @return The variables this series can extract.
   */
  protected List<String> extractedVariables(
      final Collection<String> variables) {
    if (variables == null) {
      return variables();
    }
    final Set<String> offered = Sets.newHashSet(variables());
    offered.add(timeVariable());
    final LinkedHashSet<String> extracted = new LinkedHashSet<String>();
    for (final String variable : variables) {
      if (offered.contains(variable)) {
        extracted.add(variable);
      }
    }
    return Lists.newArrayList(extracted);
  }
  
  @Override
  public Dataset interpolate(final long[] times, 
                             final Collection<String> variables,
                             final Map<String, InterpolationKind> kinds) {
    if (times == null) {
      throw new IllegalArgumentException("Times cannot be null.");
    }
    final List<String> extracted = extractedVariables(variables);
    if (LOG.isDebugEnabled()) {
      LOG.debug("{}: requested variables: {}", id(), extracted);
    }
    if (extracted.isEmpty()) {
      return new Dataset();
    }
    final List<String> subset_variables;
    if (extracted.contains(timeVariable())) {
      subset_variables = extracted;
    } else {
      subset_variables = Lists.newArrayListWithCapacity(extracted.size() + 1);
      subset_variables.add(timeVariable());
      subset_variables.addAll(extracted);
    }
    
    final Dataset dataset;
    if (times.length == 0) {
      dataset = emptyDataset(subset_variables);
    } else {
      final long start = times[0];
      final long stop = times[times.length - 1];
      if (LOG.isDebugEnabled()) {
        LOG.debug("{}: requested time-span: {}/{}", id(), 
            DateTime.format(start), DateTime.format(stop));
      }
      // the subset is half-open, include the last extended time
      dataset = DatasetIterators.concat(subset(
          start - parameters.getTimeOverlap(), 
          stop + parameters.getTimeOverlap() + 1, 
          subset_variables));
    }
    LOG.debug("{}: requested dataset length: {}, interpolated dataset "
        + "length: {}", id(), times.length, dataset.length());
    
    final Column source_times = dataset.get(timeVariable());
    if (source_times == null) {
      // nothing to resample from
      return missingDataset(times, extracted, dataset);
    }
    
    final Map<String, InterpolationKind> merged = Maps.newHashMap();
    for (final String variable : extracted) {
      InterpolationKind kind = kinds == null ? null : kinds.get(variable);
      if (kind == null) {
        kind = kindOf(variable);
      }
      merged.put(variable, kind);
    }
    return dataset.interpolate(times, timeVariable(), extracted, merged, 
        parameters.getGapThreshold(), parameters.getSegmentNeighbourhood());
  }
  
  /**
   * Builds the output of an interpolation without any source data. Every 
   * variable is filled with its missing value, the typed columns of the 
   * template are used where present and scalar doubles otherwise.
   * @param times The target times.
   * @param variables The requested variables.
   * @param template A possibly empty dataset with typed columns.
   * @return The all missing dataset.
   */
  protected Dataset missingDataset(final long[] times, 
                                   final List<String> variables, 
                                   final Dataset template) {
    final Dataset dataset = new Dataset();
    for (final String variable : variables) {
      if (variable.equals(timeVariable())) {
        dataset.set(variable, Column.ofTimestamps(times.clone()));
        continue;
      }
      final Column column = template.get(variable);
      if (column == null) {
        dataset.set(variable, Column.missing(ColumnType.DOUBLE, 1, 
            times.length, null));
      } else {
        dataset.set(variable, Column.missing(column.type(), column.width(), 
            times.length, column.metadata()));
      }
    }
    return dataset;
  }
  
  /**
   * @param variables The variables to extract.
   * @return A correctly typed dataset with zero rows.
   * @throws net.satfusion.exceptions.EmptyCollectionException if the 
   * collections hold no product to take the types from.
   */
  protected abstract Dataset emptyDataset(final List<String> variables);
  
  /**
   * Selects the rows of a product within {@code [start, stop)}.
   * @param product The non-null product.
   * @param start The inclusive start time.
   * @param stop The exclusive stop time.
   * @return The row selection.
   * @throws IOException if the time column could not be read.
   */
  protected RowSelection selectRows(final Product product, 
                                    final long start, 
                                    final long stop) throws IOException {
    final int first = Math.max(0, product.getIndexStart());
    final int last = product.getIndexEnd() < 0 
        ? reader.rowCount(product) : product.getIndexEnd();
    if (last <= first) {
      return new RowSelection(first, first, null);
    }
    final Column time_column = reader.read(product, timeVariable(), 
        first, last);
    final long[] times = time_column.longs();
    if (product.isSorted()) {
      final int low = TimeIndex.lowerBound(times, 0, times.length, start);
      final int high = Math.max(low, 
          TimeIndex.lowerBound(times, 0, times.length, stop));
      if (LOG.isTraceEnabled()) {
        LOG.trace("{}: product slice {}:{}", product.getIdentifier(), 
            first + low, first + high);
      }
      return new RowSelection(first + low, first + high, null);
    }
    
    final int[] order = TimeIndex.argsort(times, 0, times.length);
    final long[] sorted = TimeIndex.gather(times, order);
    final int low = TimeIndex.lowerBound(sorted, 0, sorted.length, start);
    final int high = Math.max(low, 
        TimeIndex.lowerBound(sorted, 0, sorted.length, stop));
    if (low == high) {
      return new RowSelection(first, first, null);
    }
    int min = Integer.MAX_VALUE;
    int max = Integer.MIN_VALUE;
    for (int i = low; i < high; i++) {
      min = Math.min(min, order[i]);
      max = Math.max(max, order[i]);
    }
    final int[] index = new int[high - low];
    for (int i = low; i < high; i++) {
      index[i - low] = order[i] - min;
    }
    if (LOG.isTraceEnabled()) {
      LOG.trace("{}: unsorted product slice {}:{}", product.getIdentifier(), 
          first + min, first + max + 1);
    }
    return new RowSelection(first + min, first + max + 1, index);
  }
  
  /**
   * Reads the selected rows of the variables. Constant variables are 
   * broadcast to the number of rows.
   * @param product The non-null product.
   * @param variables The variables to read.
   * @param selection The row selection.
   * @return The dataset.
   * @throws IOException if a variable could not be read.
   * @throws IllegalDataException if a column did not have the expected 
   * number of rows.
   */
  protected Dataset extract(final Product product, 
                            final Collection<String> variables, 
                            final RowSelection selection) throws IOException {
    final Dataset dataset = new Dataset();
    final int length = selection.to - selection.from;
    for (final String variable : variables) {
      Column column;
      if (reader.isRecordVarying(product, variable)) {
        column = reader.read(product, variable, selection.from, 
            selection.to);
      } else {
        column = reader.read(product, variable, 0, 1).broadcast(length);
      }
      if (column.rows() != length) {
        throw new IllegalDataException("Variable " + variable 
            + " of product " + product.getIdentifier() + " has " 
            + column.rows() + " rows instead of " + length);
      }
      dataset.set(variable, column);
    }
    return selection.index == null ? dataset 
        : dataset.subset(selection.index);
  }
  
  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + requiredVariables() + " -> " 
        + variables() + ")";
  }
  
  /**
   * A contiguous row range of a product and an optional index relative to 
   * the start of the range.
   */
  protected static class RowSelection {
    /** The first row, inclusive. */
    protected final int from;
    
    /** The last row, exclusive. */
    protected final int to;
    
    /** Optional index relative to {@link #from}. */
    protected final int[] index;
    
    protected RowSelection(final int from, final int to, final int[] index) {
      this.from = from;
      this.to = to;
      this.index = index;
    }
    
    /** @return The number of selected rows. */
    protected int length() {
      return index == null ? to - from : index.length;
    }
    
    /**
     * Applies the selection to a column aligned with the product rows.
     * @param column The non-null column.
     * @return The selected rows.
     */
    protected Column apply(final Column column) {
      final Column slice = column.slice(from, to);
      return index == null ? slice : slice.select(index);
    }
  }
}
