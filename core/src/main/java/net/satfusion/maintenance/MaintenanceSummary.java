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
 * Counters of a maintenance batch. Failures of single products are counted
 * and logged but never abort the batch.
 * 
 * @since 1.0
 */
public class MaintenanceSummary {
  
  /** Products visited. */
  private int processed;
  
  /** Products whose cache entry changed. */
  private int updated;
  
  /** Products that failed. */
  private int failed;
  
  /** Models written or removed. */
  private int models;
  
  /**
   * Counts a successful product.
   * @param changed_models The number of models written or removed.
   */
  public void success(final int changed_models) {
    processed++;
    if (changed_models > 0) {
      updated++;
      models += changed_models;
    }
  }
  
  /** Counts a failed product. */
  public void failure() {
    processed++;
    failed++;
  }
  
  /** @return Products visited. */
  public int processed() {
    return processed;
  }
  
  /** @return Products whose cache entry changed. */
  public int updated() {
    return updated;
  }
  
  /** @return Products that failed. */
  public int failed() {
    return failed;
  }
  
  /** @return Models written or removed. */
  public int models() {
    return models;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("processed=")
        .append(processed)
        .append(", updated=")
        .append(updated)
        .append(", failed=")
        .append(failed)
        .append(", models=")
        .append(models)
        .toString();
  }
}
