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

import java.util.Collections;
import java.util.List;

import net.satfusion.data.Dataset;

/**
 * A row filter. Filters produce no variables.
 * 
 * @since 1.0
 */
public interface Filter extends PipelineNode {

  /**
   * Refines the row index.
   * @param dataset The non-null dataset holding the required variables.
   * @param index The current row index or null for all rows.
   * @return The refined, ascending row index.
   */
  public int[] filter(final Dataset dataset, final int[] index);
  
  @Override
  public default List<String> variables() {
    return Collections.emptyList();
  }
  
  @Override
  public default <R> R accept(final PipelineNodeVisitor<R> visitor) {
    return visitor.visit(this);
  }
  
}
