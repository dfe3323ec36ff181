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

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * The sink of the graph consuming the output variables of a request.
 * 
 * @since 1.0
 */
public final class OutputConsumer implements PipelineNode {
  
  /** The node identifier. */
  public static final String ID = "__output__";
  
  /** The consumed output variables. */
  private final List<String> variables;
  
  /**
   * Default ctor.
   * @param variables The non-null output variables.
   */
  public OutputConsumer(final List<String> variables) {
    if (variables == null) {
      throw new IllegalArgumentException("Variables cannot be null.");
    }
    this.variables = ImmutableList.copyOf(variables);
  }
  
  @Override
  public String id() {
    return ID;
  }
  
  @Override
  public List<String> requiredVariables() {
    return variables;
  }

  @Override
  public List<String> variables() {
    return ImmutableList.of();
  }

  @Override
  public <R> R accept(final PipelineNodeVisitor<R> visitor) {
    return visitor.visit(this);
  }
  
  @Override
  public String toString() {
    return "OutputConsumer{variables=" + variables + "}";
  }
}
