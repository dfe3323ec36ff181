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

/**
 * A node of the producer/consumer graph built by the variable resolver. A
 * node consumes its required variables and produces its variables. The 
 * concrete kind is resolved through {@link #accept(PipelineNodeVisitor)}.
 * 
 * @since 1.0
 */
public interface PipelineNode {

  /** @return A non-null identifier used in logs and error messages. */
  public String id();
  
  /** @return The variables consumed by this node. May be empty. */
  public List<String> requiredVariables();
  
  /** @return The variables produced by this node. May be empty. */
  public List<String> variables();
  
  /**
   * Double dispatch on the node kind.
   * @param visitor A non-null visitor.
   * @return The value returned by the visitor.
   */
  public <R> R accept(final PipelineNodeVisitor<R> visitor);
  
}
