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

/**
 * Visitor over the kinds of {@link PipelineNode}.
 *
 * @param <R> The result type.
 * 
 * @since 1.0
 */
public interface PipelineNodeVisitor<R> {

  /**
   * @param time_series A time series source.
   * @return A result.
   */
  public R visit(final TimeSeries time_series);
  
  /**
   * @param model A model.
   * @return A result.
   */
  public R visit(final Model model);
  
  /**
   * @param filter A filter.
   * @return A result.
   */
  public R visit(final Filter filter);
  
  /**
   * @param output The output sink.
   * @return A result.
   */
  public R visit(final OutputConsumer output);
  
}
