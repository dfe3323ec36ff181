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
package net.satfusion.data;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.satfusion.interpolation.Interpolator;
import net.satfusion.query.Filter;
import net.satfusion.interpolation.InterpolationKind;
import net.satfusion.utils.Pair;

/**
 * An ordered container of named {@link Column}s sharing the same number of
 * rows. The insertion order of the variables is significant as it defines
 * the output order.
 * <p>
 * Invariant: every column holds exactly {@link #length()} rows. The length
 * is 0 for a dataset without columns.
 * <p>
 * Rows are never modified in place. Subsetting always returns a new dataset
 * and appending replaces the columns with concatenated copies.
 * <p>
 * <b>NOTE:</b> The class is not thread safe.
 * 
 * @since 1.0
 */
public class Dataset {
  
  /** The ordered columns. */
  protected final LinkedHashMap<String, Column> columns;
  
  /** Default ctor for an empty dataset. */
  public Dataset() {
    columns = Maps.newLinkedHashMap();
  }
  
  /**
   * Shallow copy ctor. Columns are immutable so sharing them is safe.
   * @param dataset A non-null dataset to copy.
   */
  public Dataset(final Dataset dataset) {
    if (dataset == null) {
      throw new IllegalArgumentException("Dataset cannot be null.");
    }
    columns = Maps.newLinkedHashMap(dataset.columns);
  }
  
  /** @return The number of rows. */
  public int length() {
    if (columns.isEmpty()) {
      return 0;
    }
    return columns.values().iterator().next().rows();
  }
  
  /** @return True if the dataset has no columns. */
  public boolean isEmpty() {
    return columns.isEmpty();
  }
  
  /** @return The number of columns. */
  public int size() {
    return columns.size();
  }
  
  /** @return An immutable list of the variables in order. */
  public List<String> variables() {
    return ImmutableList.copyOf(columns.keySet());
  }
  
  /** @return An unmodifiable view of the ordered columns. */
  public Map<String, Column> columns() {
    return Collections.unmodifiableMap(columns);
  }
  
  /**
   * @param variable A variable name.
   * @return True if the variable is present.
   */
  public boolean contains(final String variable) {
    return columns.containsKey(variable);
  }
  
  /**
   * @param variable A variable name.
   * @return The column or null if not present.
   */
  public Column get(final String variable) {
    return columns.get(variable);
  }
  
  /**
   * Adds or replaces a column.
   * @param variable A non-null and non-empty variable name.
   * @param column A non-null column.
   * @return This dataset.
   * @throws IllegalArgumentException if the column row count differs from 
   * the dataset length.
   */
  public Dataset set(final String variable, final Column column) {
    if (variable == null || variable.isEmpty()) {
      throw new IllegalArgumentException("Variable cannot be null or empty.");
    }
    if (column == null) {
      throw new IllegalArgumentException("Column cannot be null.");
    }
    if (!columns.isEmpty()) {
      final Column replaced = columns.get(variable);
      final int length = (replaced != null && columns.size() == 1) 
          ? column.rows() : length();
      if (length != column.rows()) {
        throw new IllegalArgumentException("Array size mismatch! variable: " 
            + variable + ", size: " + column.rows() + ", dataset: " + length);
      }
    }
    columns.put(variable, column);
    return this;
  }
  
  /**
   * Removes a column.
   * @param variable The variable name.
   * @return The removed column or null if not present.
   */
  public Column remove(final String variable) {
    return columns.remove(variable);
  }
  
  /**
   * Adds the variables of the given dataset not already present in this 
   * one. Existing variables are never replaced.
   * @param dataset A non-null dataset.
   * @return This dataset.
   * @throws IllegalArgumentException if both datasets have columns and their
   * lengths differ.
   */
  public Dataset merge(final Dataset dataset) {
    checkLength(dataset);
    for (final Entry<String, Column> entry : dataset.columns.entrySet()) {
      if (!columns.containsKey(entry.getKey())) {
        set(entry.getKey(), entry.getValue());
      }
    }
    return this;
  }
  
  /**
   * Adds the variables of the given dataset replacing existing ones.
   * @param dataset A non-null dataset.
   * @return This dataset.
   * @throws IllegalArgumentException if both datasets have columns and their
   * lengths differ.
   */
  public Dataset update(final Dataset dataset) {
    checkLength(dataset);
    for (final Entry<String, Column> entry : dataset.columns.entrySet()) {
      set(entry.getKey(), entry.getValue());
    }
    return this;
  }
  
  /**
   * Appends the rows of a dataset of the same kind. An empty dataset is 
   * ignored and an empty receiver is simply filled.
   * @param dataset A non-null dataset.
   * @return This dataset.
   * @throws IllegalArgumentException if the variable sets or column types 
   * differ.
   */
  public Dataset append(final Dataset dataset) {
    if (dataset == null) {
      throw new IllegalArgumentException("Dataset cannot be null.");
    }
    if (dataset.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return update(dataset);
    }
    if (!columns.keySet().equals(dataset.columns.keySet())) {
      throw new IllegalArgumentException("Dataset variables mismatch! " 
          + Sets.difference(dataset.columns.keySet(), columns.keySet()) 
          + " != " 
          + Sets.difference(columns.keySet(), dataset.columns.keySet()));
    }
    // validate everything before touching the columns
    for (final Entry<String, Column> entry : columns.entrySet()) {
      if (!entry.getValue().isCompatible(dataset.columns.get(entry.getKey()))) {
        throw new IllegalArgumentException("Dataset type mismatch for " 
            + "variable " + entry.getKey() + ": " + entry.getValue() + " != " 
            + dataset.columns.get(entry.getKey()));
      }
    }
    for (final Entry<String, Column> entry : columns.entrySet()) {
      entry.setValue(entry.getValue().concat(
          dataset.columns.get(entry.getKey())));
    }
    return this;
  }
  
  /**
   * Selects rows by index. 
   * @param index An array of row indices or null to select all rows.
   * @return A new dataset.
   */
  public Dataset subset(final int[] index) {
    return subset(index, true);
  }
  
  /**
   * Selects rows by index.
   * @param index An array of row indices or null to select all rows.
   * @param always_copy When false and the index is null, this instance is 
   * returned.
   * @return The subset.
   */
  public Dataset subset(final int[] index, final boolean always_copy) {
    if (index == null) {
      return always_copy ? new Dataset(this) : this;
    }
    final Dataset dataset = new Dataset();
    for (final Entry<String, Column> entry : columns.entrySet()) {
      dataset.columns.put(entry.getKey(), entry.getValue().select(index));
    }
    return dataset;
  }
  
  /**
   * Selects rows by mask.
   * @param mask A non-null mask with one entry per row.
   * @return A new dataset.
   */
  public Dataset subset(final boolean[] mask) {
    return subset(Column.maskToIndex(mask, length()), true);
  }
  
  /**
   * @param from The first row, inclusive.
   * @param to The last row, exclusive.
   * @return A new dataset holding the row range.
   */
  public Dataset slice(final int from, final int to) {
    final Dataset dataset = new Dataset();
    for (final Entry<String, Column> entry : columns.entrySet()) {
      dataset.columns.put(entry.getKey(), entry.getValue().slice(from, to));
    }
    return dataset;
  }
  
  /**
   * Returns a new dataset with the selected variables in the given order.
   * Variables not present are silently ignored.
   * @param variables A non-null collection of variables.
   * @return The new dataset.
   */
  public Dataset extract(final Collection<String> variables) {
    final Dataset dataset = new Dataset();
    for (final String variable : variables) {
      final Column column = columns.get(variable);
      if (column != null) {
        dataset.columns.put(variable, column);
      }
    }
    return dataset;
  }
  
  /**
   * Applies the filters whose required variables are all present. 
   * @param filters A non-null list of filters.
   * @param index An optional initial index, null for all rows.
   * @return The filtered dataset and the filters that could not be applied.
   */
  public Pair<Dataset, List<Filter>> filter(final List<Filter> filters, 
                                            final int[] index) {
    final List<Filter> remaining = Lists.newArrayList();
    int[] idx = index;
    final Set<String> present = columns.keySet();
    for (final Filter filter : filters) {
      if (present.containsAll(filter.requiredVariables())) {
        idx = filter.filter(this, idx);
      } else {
        remaining.add(filter);
      }
    }
    return new Pair<Dataset, List<Filter>>(subset(idx, false), remaining);
  }
  
  /**
   * Interpolates the variables at the given times using the time variable of
   * this dataset as the abscissa. See {@link Interpolator}.
   * @param times The non-null, ascending target timestamps.
   * @param time_variable The non-null time variable.
   * @param variables The variables to interpolate, null for all.
   * @param kinds Per variable interpolation kinds, nearest by default.
   * @param gap_threshold The gap threshold in milliseconds.
   * @param segment_neighbourhood The segment neighbourhood in milliseconds.
   * @return A new dataset with {@code times.length} rows.
   */
  public Dataset interpolate(final long[] times,
                             final String time_variable,
                             final Collection<String> variables,
                             final Map<String, InterpolationKind> kinds,
                             final double gap_threshold,
                             final double segment_neighbourhood) {
    final Column source_times = columns.get(time_variable);
    if (source_times == null) {
      throw new IllegalArgumentException("Missing time variable " 
          + time_variable);
    }
    final Interpolator interpolator = new Interpolator(
        source_times.longs(), times, gap_threshold, segment_neighbourhood);
    final Dataset dataset = new Dataset();
    final Collection<String> selected = variables == null 
        ? columns.keySet() : variables;
    for (final String variable : selected) {
      final Column column = columns.get(variable);
      if (column == null || dataset.contains(variable)) {
        continue;
      }
      if (variable.equals(time_variable)) {
        dataset.set(variable, Column.ofTimestamps(times.clone())
            .withMetadata(column.metadata()));
        continue;
      }
      InterpolationKind kind = kinds == null ? null : kinds.get(variable);
      if (kind == null) {
        kind = InterpolationKind.NEAREST;
      }
      dataset.set(variable, interpolator.interpolate(column, kind));
    }
    return dataset;
  }
  
  private void checkLength(final Dataset dataset) {
    if (dataset == null) {
      throw new IllegalArgumentException("Dataset cannot be null.");
    }
    if (!isEmpty() && !dataset.isEmpty() && length() != dataset.length()) {
      throw new IllegalArgumentException("Dataset length mismatch! " 
          + dataset.length() + " != " + length());
    }
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Dataset other = (Dataset) o;
    return Lists.newArrayList(columns.keySet()).equals(
        Lists.newArrayList(other.columns.keySet())) 
        && columns.equals(other.columns);
  }
  
  @Override
  public int hashCode() {
    return columns.keySet().hashCode();
  }
  
  @Override
  public String toString() {
    final StringBuilder buf = new StringBuilder()
        .append("Dataset{length=")
        .append(length());
    for (final Entry<String, Column> entry : columns.entrySet()) {
      buf.append(", ")
         .append(entry.getKey())
         .append("=")
         .append(entry.getValue());
    }
    return buf.append("}").toString();
  }
}
