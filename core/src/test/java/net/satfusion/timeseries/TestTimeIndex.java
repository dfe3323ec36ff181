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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class TestTimeIndex {

  @Test
  public void lowerBound() throws Exception {
    final long[] values = { 1, 3, 3, 5, 9 };
    assertEquals(0, TimeIndex.lowerBound(values, 0, values.length, 0));
    assertEquals(0, TimeIndex.lowerBound(values, 0, values.length, 1));
    assertEquals(1, TimeIndex.lowerBound(values, 0, values.length, 2));
    assertEquals(1, TimeIndex.lowerBound(values, 0, values.length, 3));
    assertEquals(3, TimeIndex.lowerBound(values, 0, values.length, 4));
    assertEquals(5, TimeIndex.lowerBound(values, 0, values.length, 10));
    // within a range
    assertEquals(2, TimeIndex.lowerBound(values, 2, 4, 1));
    assertEquals(4, TimeIndex.lowerBound(values, 2, 4, 6));
    assertEquals(0, TimeIndex.lowerBound(new long[0], 0, 0, 6));
  }
  
  @Test
  public void argsortIsStable() throws Exception {
    final long[] values = { 5, 1, 5, 0, 1 };
    assertArrayEquals(new int[] { 3, 1, 4, 0, 2 }, 
        TimeIndex.argsort(values, 0, values.length));
    assertArrayEquals(new int[] { 3, 4, 2 }, 
        TimeIndex.argsort(values, 2, 5));
  }
  
  @Test
  public void gather() throws Exception {
    final long[] values = { 5, 1, 5, 0, 1 };
    assertArrayEquals(new long[] { 0, 1, 1, 5, 5 }, TimeIndex.gather(values, 
        TimeIndex.argsort(values, 0, values.length)));
    assertArrayEquals(new long[0], TimeIndex.gather(values, new int[0]));
  }
}
