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

import net.satfusion.data.Column;
import net.satfusion.data.Dataset;
import net.satfusion.exceptions.IllegalDataException;

/**
 * Range filter applied to one component of a vector variable, e.g. the 
 * north component of {@code B_NEC}.
 * 
 * @since 1.0
 */
public class VectorComponentRangeFilter extends ScalarRangeFilter {

  /** The component index. */
  protected final int component;
  
  /**
   * Default ctor.
   * @param variable A non-null and non-empty variable.
   * @param component The non-negative component index.
   * @param min The inclusive lower bound.
   * @param max The inclusive upper bound.
   */
  public VectorComponentRangeFilter(final String variable, 
                                    final int component,
                                    final double min, 
                                    final double max) {
    super(variable, min, max);
    if (component < 0) {
      throw new IllegalArgumentException("Component cannot be negative.");
    }
    this.component = component;
  }
  
  @Override
  public String id() {
    return String.format("%s[%d]:%.17g,%.17g", variable, component, min, max);
  }
  
  @Override
  public int[] filter(final Dataset dataset, final int[] index) {
    final Column column = dataset.get(variable);
    if (column == null) {
      throw new IllegalArgumentException("Missing variable " + variable);
    }
    if (column.width() <= component) {
      throw new IllegalDataException("An attempt to apply a vector component "
          + "range filter to a variable " + variable + " of width " 
          + column.width() + "!");
    }
    return filterComponent(column, component, index);
  }
}
