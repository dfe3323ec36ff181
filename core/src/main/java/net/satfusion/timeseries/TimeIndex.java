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

import java.util.Arrays;
import java.util.Comparator;

/**
 * Search and sort helpers over time columns.
 * 
 * @since 1.0
 */
public final class TimeIndex {
  private TimeIndex() {
    // statics
  }
  
  /**
   * Finds the first position in the sorted range whose value is not less 
   * than the key.
   * @param values The array sorted within the range.
   * @param from The first index of the range, inclusive.
   * @param to The last index of the range, exclusive.
   * @param key The key to search for.
   * @return The insertion point within {@code [from, to]}.
   */
  public static int lowerBound(final long[] values, 
                               final int from, 
                               final int to, 
                               final long key) {
    int low = from;
    int high = to;
    while (low < high) {
      final int mid = (low + high) >>> 1;
      if (values[mid] < key) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }
  
  /**
   * Stable arg-sort of a range of values.
   * @param values The values.
   * @param from The first index of the range, inclusive.
   * @param to The last index of the range, exclusive.
   * @return The indices into {@code values} ordering the range ascending. 
   * Equal values keep their original order.
   */
  public static int[] argsort(final long[] values, 
                              final int from, 
                              final int to) {
    final Integer[] boxed = new Integer[to - from];
    for (int i = 0; i < boxed.length; i++) {
      boxed[i] = from + i;
    }
    // object sorts are stable merge sorts
    Arrays.sort(boxed, new Comparator<Integer>() {
      @Override
      public int compare(final Integer a, final Integer b) {
        return Long.compare(values[a], values[b]);
      }
    });
    final int[] index = new int[boxed.length];
    for (int i = 0; i < boxed.length; i++) {
      index[i] = boxed[i];
    }
    return index;
  }
  
  /**
   * @param values The non-null values.
   * @param index The indices into the values.
   * @return The gathered values.
   */
  public static long[] gather(final long[] values, final int[] index) {
    final long[] result = new long[index.length];
    for (int i = 0; i < index.length; i++) {
      result[i] = values[index[i]];
    }
    return result;
  }
}
