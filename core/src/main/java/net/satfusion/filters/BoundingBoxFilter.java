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

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.satfusion.data.Dataset;
import net.satfusion.query.Filter;

/**
 * Chains one {@link ScalarRangeFilter} per variable, e.g. latitude and 
 * longitude bounds.
 * 
 * @since 1.0
 */
public class BoundingBoxFilter implements Filter {
  
  /** The range filters applied in order. */
  protected final List<ScalarRangeFilter> filters;
  
  /** The required variables. */
  protected final List<String> variables;
  
  /**
   * Default ctor.
   * @param variables The non-null and non-empty variables.
   * @param lower The lower bounds, one per variable.
   * @param upper The upper bounds, one per variable.
   */
  public BoundingBoxFilter(final List<String> variables, 
                           final double[] lower, 
                           final double[] upper) {
    if (variables == null || variables.isEmpty()) {
      throw new IllegalArgumentException("Variables cannot be null or "
          + "empty.");
    }
    if (lower == null || upper == null || lower.length != variables.size() 
        || upper.length != variables.size()) {
      throw new IllegalArgumentException("Bounds must have one entry per "
          + "variable.");
    }
    final ImmutableList.Builder<ScalarRangeFilter> builder = 
        ImmutableList.builder();
    for (int i = 0; i < variables.size(); i++) {
      builder.add(new ScalarRangeFilter(variables.get(i), lower[i], upper[i]));
    }
    filters = builder.build();
    this.variables = ImmutableList.copyOf(variables);
  }
  
  @Override
  public String id() {
    return "BoundingBox" + filters;
  }
  
  @Override
  public List<String> requiredVariables() {
    return variables;
  }

  @Override
  public int[] filter(final Dataset dataset, final int[] index) {
    int[] result = index;
    for (final ScalarRangeFilter filter : filters) {
      result = filter.filter(dataset, result);
    }
    return result;
  }
}
