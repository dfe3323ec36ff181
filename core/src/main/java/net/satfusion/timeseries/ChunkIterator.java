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
package net.satfusion.timeseries;

import com.google.common.collect.AbstractIterator;

import net.satfusion.data.Dataset;
import net.satfusion.data.DatasetIterator;

/**
 * Base for the lazy chunk iterators of the time series. Implementations 
 * compute one chunk per call to {@link #computeNext()}.
 * 
 * @since 1.0
 */
public abstract class ChunkIterator extends AbstractIterator<Dataset> 
    implements DatasetIterator {

  @Override
  public void close() {
    // nothing to release by default
  }
  
}
