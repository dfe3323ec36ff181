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
import java.util.Set;

import net.satfusion.data.Dataset;

/**
 * A model deriving new variables from the variables of a dataset.
 * 
 * @since 1.0
 */
public interface Model extends PipelineNode {

  /**
   * Evaluates the model.
   * @param dataset The non-null dataset holding the required variables.
   * @param variables The variables to produce, null for all.
   * @return A dataset of the same length holding the produced variables.
   */
  public Dataset eval(final Dataset dataset, 
                      final Collection<String> variables);
  
  /** @return The identifiers of the inputs used by the evaluations. */
  public Set<String> products();
  
  @Override
  public default <R> R accept(final PipelineNodeVisitor<R> visitor) {
    return visitor.visit(this);
  }
  
}
