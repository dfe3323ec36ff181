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
package net.satfusion.maintenance;

/**
 * A unit of work run by the {@link StreamExecutor} for one input. 
 * Implementations must not share mutable state between invocations.
 * 
 * @param <I> The input type.
 * @param <O> The result type.
 * 
 * @since 1.0
 */
public interface Task<I, O> {

  /**
   * @param input The input.
   * @return The result.
   * @throws Exception if the unit failed. The error is reported with the 
   * input and does not stop the other units.
   */
  public O run(final I input) throws Exception;
  
}
