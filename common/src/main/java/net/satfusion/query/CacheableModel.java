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
 * A model whose output may be precomputed per product and stored in the
 * model cache. The sources describe the model inputs valid for a time span
 * and decide whether a cached column is still current.
 * 
 * @since 1.0
 */
public interface CacheableModel extends Model {

  /** @return The unique name of the model, e.g. {@code CHAOS-Core}. */
  public String name();
  
  /** 
   * @return The produced variable whose values are cached, e.g. 
   * {@code B_NEC_CHAOS-Core}. Must be one of {@link #variables()}.
   */
  public String cachedVariable();
  
  /**
   * The sources the model would currently use for the time span.
   * @param start The inclusive start in milliseconds.
   * @param end The exclusive end in milliseconds.
   * @return A non-null, possibly empty list of sources.
   */
  public List<ModelSource> sources(final long start, final long end);
  
}
