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
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import net.satfusion.data.Dataset;
import net.satfusion.query.Model;

/**
 * Copies a variable under a new name, e.g. to expose the time variable of
 * a collection under a generic name.
 * 
 * @since 1.0
 */
public class Identity implements Model {
  
  /** The source variable. */
  private final String source;
  
  /** The target variable. */
  private final String target;
  
  /**
   * Default ctor.
   * @param source The non-null and non-empty source variable.
   * @param target The non-null and non-empty target variable.
   */
  public Identity(final String source, final String target) {
    if (source == null || source.isEmpty()) {
      throw new IllegalArgumentException("Source cannot be null or empty.");
    }
    if (target == null || target.isEmpty()) {
      throw new IllegalArgumentException("Target cannot be null or empty.");
    }
    if (source.equals(target)) {
      throw new IllegalArgumentException("Source and target cannot be the "
          + "same variable.");
    }
    this.source = source;
    this.target = target;
  }
  
  @Override
  public String id() {
    return "Identity:" + source + "->" + target;
  }
  
  @Override
  public List<String> requiredVariables() {
    return ImmutableList.of(source);
  }
  
  @Override
  public List<String> variables() {
    return ImmutableList.of(target);
  }
  
  @Override
  public Dataset eval(final Dataset dataset, 
                     final Collection<String> variables) {
    final Dataset output = new Dataset();
    if (variables != null && !variables.contains(target)) {
      return output;
    }
    output.set(target, dataset.get(source));
    return output;
  }
  
  @Override
  public Set<String> products() {
    return ImmutableSet.of();
  }
  
  @Override
  public String toString() {
    return id();
  }
}
