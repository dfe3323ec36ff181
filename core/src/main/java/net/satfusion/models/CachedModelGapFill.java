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
package net.satfusion.models;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import net.satfusion.data.Column;
import net.satfusion.data.Dataset;
import net.satfusion.exceptions.IllegalDataException;
import net.satfusion.query.CacheableModel;
import net.satfusion.query.Model;
import net.satfusion.timeseries.CachedModelExtraction;

/**
 * Fills the gaps of the cached model values extracted by the 
 * {@link CachedModelExtraction}. Rows holding NaNs are evaluated with the
 * live model and spliced back into the cached column, which is then output
 * as the cached variable of the model.
 * 
 * @since 1.0
 */
public class CachedModelGapFill implements Model {
  private static final Logger LOG = LoggerFactory.getLogger(
      CachedModelGapFill.class);
  
  /** The live model. */
  private final CacheableModel model;
  
  /** The cached input variable. */
  private final String source_variable;
  
  /** The produced variable. */
  private final String target_variable;
  
  /** The required variables. */
  private final List<String> required;
  
  /** The products of the live evaluations. */
  private final Set<String> product_set;
  
  /**
   * Default ctor.
   * @param model The non-null live model.
   */
  public CachedModelGapFill(final CacheableModel model) {
    if (model == null) {
      throw new IllegalArgumentException("Model cannot be null.");
    }
    this.model = model;
    source_variable = CachedModelExtraction.cacheVariable(model);
    target_variable = model.cachedVariable();
    required = ImmutableList.<String>builder()
        .add(source_variable)
        .addAll(model.requiredVariables())
        .build();
    product_set = Collections.synchronizedSet(new LinkedHashSet<String>());
  }
  
  @Override
  public String id() {
    return "CachedModelGapFill:" + model.name();
  }
  
  @Override
  public List<String> requiredVariables() {
    return required;
  }
  
  @Override
  public List<String> variables() {
    return ImmutableList.of(target_variable);
  }
  
  @Override
  public Dataset eval(final Dataset dataset, 
                     final Collection<String> variables) {
    final Dataset output = new Dataset();
    if (variables != null && !variables.contains(target_variable)) {
      return output;
    }
    final Column cached = dataset.get(source_variable);
    if (cached == null) {
      throw new IllegalArgumentException("Missing required variable " 
          + source_variable);
    }
    final double[] values = cached.doubles();
    final int width = cached.width();
    int gaps = 0;
    final boolean[] mask = new boolean[cached.rows()];
    for (int i = 0; i < mask.length; i++) {
      mask[i] = Double.isNaN(values[i * width]);
      if (mask[i]) {
        gaps++;
      }
    }
    LOG.debug("{}: filling {} of {} missing model values", model.name(), 
        gaps, mask.length);
    
    Column result = cached;
    if (gaps > 0) {
      final int[] index = Column.maskToIndex(mask, mask.length);
      final Dataset subset = dataset.extract(model.requiredVariables())
          .subset(index);
      final Column evaluated = model.eval(subset, 
          ImmutableList.of(target_variable)).get(target_variable);
      if (evaluated == null) {
        throw new IllegalDataException("Model " + model.name() 
            + " did not produce " + target_variable);
      }
      result = cached.splice(index, evaluated);
      product_set.addAll(model.products());
    }
    output.set(target_variable, result);
    return output;
  }
  
  @Override
  public Set<String> products() {
    synchronized (product_set) {
      return ImmutableSet.copyOf(product_set);
    }
  }
  
  /** @return The live model. */
  public CacheableModel model() {
    return model;
  }
  
  @Override
  public String toString() {
    return id();
  }
}
