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
package net.satfusion.interpolation;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Iterator;
import java.util.List;

import org.junit.Test;

import net.satfusion.data.Column;
import net.satfusion.data.ColumnType;

public class TestInterpolator {
  
  private static final long[] SOURCE = new long[] { 0, 10, 20 };

  @Test
  public void ctor() {
    try {
      new Interpolator(null, new long[0], 1, 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      new Interpolator(new long[0], null, 1, 1);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void contiguousRanges() {
    final Iterator<int[]> ranges = Interpolator.contiguousRanges(
        new long[] { 0, 10, 100, 110, 500 }, 30);
    assertArrayEquals(new int[] { 0, 2 }, ranges.next());
    assertArrayEquals(new int[] { 2, 4 }, ranges.next());
    assertArrayEquals(new int[] { 4, 5 }, ranges.next());
    assertTrue(!ranges.hasNext());
    assertTrue(!Interpolator.contiguousRanges(new long[0], 30).hasNext());
  }
  
  @Test
  public void neighbourhoodClampedToGapThreshold() {
    final Interpolator interpolator = new Interpolator(SOURCE, 
        new long[] { -31, -30, 50, 51 }, 30, 1000);
    final List<Interpolator.Segment> segments = 
        interpolator.segments(30, 30);
    assertEquals(1, segments.size());
    assertEquals(-30, segments.get(0).x_low, 0.0);
    assertEquals(50, segments.get(0).x_high, 0.0);
    
    final double[] values = interpolator.interpolate(
        Column.ofDoubles(1, 2, 3), InterpolationKind.NEAREST).doubles();
    assertTrue(Double.isNaN(values[0]));
    assertEquals(1, values[1], 0.0);
    assertEquals(3, values[2], 0.0);
    assertTrue(Double.isNaN(values[3]));
  }
  
  @Test
  public void nearest() {
    final Interpolator interpolator = new Interpolator(SOURCE, 
        new long[] { -5, 0, 5, 6, 20, 25, 26 }, 30, 5);
    final double[] values = interpolator.interpolate(
        Column.ofDoubles(1, 2, 3), InterpolationKind.NEAREST).doubles();
    assertEquals(1, values[0], 0.0);
    assertEquals(1, values[1], 0.0);
    // midpoint goes to the earlier sample
    assertEquals(1, values[2], 0.0);
    assertEquals(2, values[3], 0.0);
    assertEquals(3, values[4], 0.0);
    assertEquals(3, values[5], 0.0);
    assertTrue(Double.isNaN(values[6]));
  }
  
  @Test
  public void previous() {
    final Interpolator interpolator = new Interpolator(new long[] { 0, 10 }, 
        new long[] { -1, 0, 9, 10, 15, 16 }, 30, 5);
    final long[] values = interpolator.interpolate(
        Column.ofLongs(1, 2), InterpolationKind.PREVIOUS).longs();
    assertEquals(Long.MIN_VALUE, values[0]);
    assertEquals(1, values[1]);
    assertEquals(1, values[2]);
    assertEquals(2, values[3]);
    assertEquals(2, values[4]);
    assertEquals(Long.MIN_VALUE, values[5]);
  }
  
  @Test
  public void linear() {
    final Interpolator interpolator = new Interpolator(SOURCE, 
        new long[] { -6, -5, 5, 15, 22, 26 }, 30, 5);
    final Column column = interpolator.interpolate(
        Column.ofLongs(0, 10, 20), InterpolationKind.LINEAR);
    assertEquals(ColumnType.DOUBLE, column.type());
    final double[] values = column.doubles();
    assertTrue(Double.isNaN(values[0]));
    assertEquals(-5, values[1], 1e-9);
    assertEquals(5, values[2], 1e-9);
    assertEquals(15, values[3], 1e-9);
    assertEquals(22, values[4], 1e-9);
    assertTrue(Double.isNaN(values[5]));
  }
  
  @Test
  public void linearVector() {
    final Interpolator interpolator = new Interpolator(new long[] { 0, 10 }, 
        new long[] { 5 }, 30, 0);
    final double[] values = interpolator.interpolate(
        Column.ofVectors(3, 0, 0, 0, 10, 20, 30), 
        InterpolationKind.LINEAR).doubles();
    assertArrayEquals(new double[] { 5, 10, 15 }, values, 1e-9);
  }
  
  @Test
  public void linearSingleSampleSegment() {
    final Interpolator interpolator = new Interpolator(new long[] { 0, 100 }, 
        new long[] { 0, 100 }, 30, 5);
    final double[] values = interpolator.interpolate(
        Column.ofDoubles(1, 2), InterpolationKind.LINEAR).doubles();
    assertTrue(Double.isNaN(values[0]));
    assertTrue(Double.isNaN(values[1]));
  }
  
  @Test
  public void gapThreshold() {
    final Interpolator interpolator = new Interpolator(
        new long[] { 0, 10, 100, 110 }, new long[] { 12, 50, 98 }, 30, 5);
    final double[] values = interpolator.interpolate(
        Column.ofDoubles(1, 2, 3, 4), InterpolationKind.NEAREST).doubles();
    assertEquals(2, values[0], 0.0);
    assertTrue(Double.isNaN(values[1]));
    assertEquals(3, values[2], 0.0);
  }
  
  @Test
  public void identity() {
    final long[] times = new long[] { 0, 10, 20, 200, 210 };
    final Column column = Column.ofDoubles(1, 2, 3, 4, 5);
    for (final InterpolationKind kind : InterpolationKind.values()) {
      final Interpolator interpolator = new Interpolator(times, times, 30, 5);
      assertEquals(kind.toString(), column, 
          interpolator.interpolate(column, kind));
    }
  }
  
  @Test
  public void badInputs() {
    final Interpolator interpolator = new Interpolator(SOURCE, SOURCE, 30, 5);
    try {
      interpolator.interpolate(Column.ofDoubles(1), 
          InterpolationKind.NEAREST);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
    
    try {
      interpolator.interpolate(Column.ofStrings("a", "b", "c"), 
          InterpolationKind.LINEAR);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
  
  @Test
  public void kindFromName() {
    assertEquals(InterpolationKind.PREVIOUS, 
        InterpolationKind.fromName("zero"));
    assertEquals(InterpolationKind.LINEAR, 
        InterpolationKind.fromName(" Linear"));
    assertEquals(InterpolationKind.NEAREST, 
        InterpolationKind.fromName("nearest"));
    try {
      InterpolationKind.fromName("cubic");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
