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
package net.satfusion.filters;

import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import net.satfusion.data.Column;
import net.satfusion.data.Dataset;
import net.satfusion.exceptions.IllegalDataException;
import net.satfusion.query.Filter;

/**
 * Keeps the rows whose value lies within the closed range [min, max]. NaN 
 * values never pass.
 * 
 * @since 1.0
 */
public class ScalarRangeFilter implements Filter {
  private static final Logger LOG = LoggerFactory.getLogger(
      ScalarRangeFilter.class);
  
  /** The filtered variable. */
  protected final String variable;
  
  /** The inclusive lower bound. */
  protected final double min;
  
  /** The inclusive upper bound. */
  protected final double max;
  
  /**
   * Default ctor.
   * @param variable A non-null and non-empty variable.
   * @param min The inclusive lower bound.
   * @param max The inclusive upper bound.
   */
  public ScalarRangeFilter(final String variable, 
                           final double min, 
                           final double max) {
    if (variable == null || variable.isEmpty()) {
      throw new IllegalArgumentException("Variable cannot be null or empty.");
    }
    this.variable = variable;
    this.min = min;
    this.max = max;
  }
  
  @Override
  public String id() {
    return String.format("%s:%.17g,%.17g", variable, min, max);
  }
  
  @Override
  public List<String> requiredVariables() {
    return ImmutableList.of(variable);
  }

  @Override
  public int[] filter(final Dataset dataset, final int[] index) {
    final Column column = dataset.get(variable);
    if (column == null) {
      throw new IllegalArgumentException("Missing variable " + variable);
    }
    if (column.width() != 1) {
      throw new IllegalDataException("An attempt to apply a scalar range "
          + "filter to a non-scalar variable " + variable + "!");
    }
    return filterComponent(column, 0, index);
  }
  
  /**
   * Filters one component of the column.
   * @param column A non-null numeric column.
   * @param component The component index.
   * @param index The initial index or null for all rows.
   * @return The refined index.
   */
  protected int[] filterComponent(final Column column, 
                                  final int component, 
                                  final int[] index) {
    final int size = index == null ? column.rows() : index.length;
    final int[] result = new int[size];
    int count = 0;
    for (int i = 0; i < size; i++) {
      final int row = index == null ? i : index[i];
      final double value = column.getDouble(row, component);
      if (value >= min && value <= max) {
        result[count++] = row;
      }
    }
    if (LOG.isDebugEnabled()) {
      LOG.debug("filter {}: initial size: {}, filtered size: {}", id(), 
          size, count);
    }
    return count == size ? result : Arrays.copyOf(result, count);
  }
  
  @Override
  public String toString() {
    return id();
  }
}
