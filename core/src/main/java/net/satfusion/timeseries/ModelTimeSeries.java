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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.satfusion.data.Column;
import net.satfusion.data.Dataset;
import net.satfusion.data.DatasetIterator;
import net.satfusion.interpolation.InterpolationKind;
import net.satfusion.query.Model;
import net.satfusion.query.TimeSeries;

/**
 * A slave time series evaluating a model depending on time only, e.g. a 
 * solar position or an orbit counter, at the requested times. It has no
 * samples of its own so it cannot be subset.
 * 
 * @since 1.0
 */
public class ModelTimeSeries implements TimeSeries {
  private static final Logger LOG = LoggerFactory.getLogger(
      ModelTimeSeries.class);
  
  /** The evaluated model. */
  private final Model model;
  
  /** The time variable. */
  private final String time_variable;
  
  /**
   * Default ctor.
   * @param model A non-null model requiring nothing but the time variable.
   * @param time_variable A non-null and non-empty time variable.
   * @throws IllegalArgumentException if the model requires other variables.
   */
  public ModelTimeSeries(final Model model, final String time_variable) {
    if (model == null) {
      throw new IllegalArgumentException("Model cannot be null.");
    }
    if (time_variable == null || time_variable.isEmpty()) {
      throw new IllegalArgumentException("Time variable cannot be null or "
          + "empty.");
    }
    for (final String required : model.requiredVariables()) {
      if (!required.equals(time_variable)) {
        throw new IllegalArgumentException("Model " + model.id() 
            + " requires the variable " + required + " besides the time.");
      }
    }
    this.model = model;
    this.time_variable = time_variable;
  }
  
  @Override
  public String id() {
    return "model:" + model.id();
  }
  
  @Override
  public List<String> requiredVariables() {
    return ImmutableList.of(time_variable);
  }
  
  @Override
  public List<String> variables() {
    return model.variables();
  }
  
  /**
   * Not supported.
   * @throws UnsupportedOperationException always.
   */
  @Override
  public DatasetIterator subset(final long start, 
                                final long stop, 
                                final Collection<String> variables) {
    throw new UnsupportedOperationException("A model time series cannot be "
        + "subset.");
  }
  
  @Override
  public Dataset interpolate(final long[] times, 
                             final Collection<String> variables,
                             final Map<String, InterpolationKind> kinds) {
    if (times == null) {
      throw new IllegalArgumentException("Times cannot be null.");
    }
    final List<String> requested = Lists.newArrayList();
    for (final String variable : variables == null 
        ? model.variables() : variables) {
      if (model.variables().contains(variable) 
          && !requested.contains(variable)) {
        requested.add(variable);
      }
    }
    if (requested.isEmpty()) {
      return new Dataset();
    }
    LOG.debug("{}: evaluating {} at {} times", id(), requested, 
        times.length);
    final Dataset input = new Dataset();
    input.set(time_variable, Column.ofTimestamps(times));
    return model.eval(input, requested).extract(requested);
  }
  
  @Override
  public Set<String> products() {
    return model.products();
  }
  
  @Override
  public String toString() {
    return "ModelTimeSeries([" + time_variable + "] -> " + variables() + ")";
  }
}
