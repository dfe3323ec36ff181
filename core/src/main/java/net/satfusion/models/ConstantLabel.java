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

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import net.satfusion.data.Column;
import net.satfusion.data.Dataset;
import net.satfusion.query.Model;

/**
 * Produces a constant string label for every row, e.g. the spacecraft the
 * data were measured by.
 * 
 * @since 1.0
 */
public class ConstantLabel implements Model {
  
  /** The default name of the spacecraft variable. */
  public static final String SPACECRAFT = "Spacecraft";
  
  /** The produced variable. */
  private final String variable;
  
  /** The label. */
  private final String label;
  
  /** The variable defining the row count. */
  private final String time_variable;
  
  /**
   * Default ctor.
   * @param variable The non-null and non-empty produced variable.
   * @param label The non-null label.
   * @param time_variable The non-null variable defining the rows.
   */
  public ConstantLabel(final String variable, 
                       final String label, 
                       final String time_variable) {
    if (variable == null || variable.isEmpty()) {
      throw new IllegalArgumentException("Variable cannot be null or "
          + "empty.");
    }
    if (label == null) {
      throw new IllegalArgumentException("Label cannot be null.");
    }
    if (time_variable == null || time_variable.isEmpty()) {
      throw new IllegalArgumentException("Time variable cannot be null or "
          + "empty.");
    }
    this.variable = variable;
    this.label = label;
    this.time_variable = time_variable;
  }
  
  /**
   * @param spacecraft The spacecraft label, e.g. {@code A}.
   * @param time_variable The time variable.
   * @return A label model producing the {@link #SPACECRAFT} variable.
   */
  public static ConstantLabel spacecraft(final String spacecraft, 
                                         final String time_variable) {
    return new ConstantLabel(SPACECRAFT, spacecraft, time_variable);
  }
  
  @Override
  public String id() {
    return "ConstantLabel:" + variable + "=" + label;
  }
  
  @Override
  public List<String> requiredVariables() {
    return ImmutableList.of(time_variable);
  }
  
  @Override
  public List<String> variables() {
    return ImmutableList.of(variable);
  }
  
  @Override
  public Dataset eval(final Dataset dataset, 
                     final Collection<String> variables) {
    final Dataset output = new Dataset();
    if (variables != null && !variables.contains(variable)) {
      return output;
    }
    final String[] values = new String[dataset.get(time_variable).rows()];
    Arrays.fill(values, label);
    output.set(variable, Column.ofStrings(values));
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
