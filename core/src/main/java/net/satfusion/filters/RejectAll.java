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
package net.satfusion.filters;

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.satfusion.data.Dataset;
import net.satfusion.query.Filter;

/**
 * Rejects every row. Substituted for the filters of a request when any of
 * them could not be resolved so that no unfiltered data is returned.
 * 
 * @since 1.0
 */
public final class RejectAll implements Filter {
  
  /** The shared instance. */
  public static final RejectAll INSTANCE = new RejectAll();
  
  private static final int[] EMPTY = new int[0];
  
  private RejectAll() {
  }
  
  @Override
  public String id() {
    return "RejectAll";
  }
  
  @Override
  public List<String> requiredVariables() {
    return ImmutableList.of();
  }

  @Override
  public int[] filter(final Dataset dataset, final int[] index) {
    return EMPTY;
  }
  
  @Override
  public String toString() {
    return id();
  }
}
