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
package net.satfusion.query;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

import net.satfusion.data.Dataset;
import net.satfusion.data.DatasetIterator;
import net.satfusion.interpolation.InterpolationKind;

/**
 * A source of time series data. A master time series has no required 
 * variables. Slave time series require the time variable they are
 * interpolated at.
 * 
 * @since 1.0
 */
public interface TimeSeries extends PipelineNode {

  /**
   * Lazily extracts the data within {@code [start, stop)}.
   * @param start The inclusive start in milliseconds.
   * @param stop The exclusive stop in milliseconds.
   * @param variables The variables to extract, null for all.
   * @return A non-null iterator over the chunks.
   */
  public DatasetIterator subset(final long start, 
                                final long stop, 
                                final Collection<String> variables);
  
  /**
   * Resamples the series onto the given times.
   * @param times The non-null, ascending target times.
   * @param variables The variables to interpolate, null for all.
   * @param kinds Optional interpolation kinds overriding the defaults.
   * @return A dataset with one row per target time.
   */
  public Dataset interpolate(final long[] times, 
                             final Collection<String> variables,
                             final Map<String, InterpolationKind> kinds);
  
  /** @return The identifiers of the products read so far. */
  public Set<String> products();
  
  @Override
  public default <R> R accept(final PipelineNodeVisitor<R> visitor) {
    return visitor.visit(this);
  }
  
}
