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

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;

import net.satfusion.data.Column;
import net.satfusion.data.ColumnType;

/**
 * A 1D interpolator resampling columns sampled at {@code source} times onto
 * the {@code target} times. Both time arrays must be sorted in ascending
 * order. The index mapping is computed once per kind and reused for every
 * column.
 * <p>
 * The source samples are split into contiguous segments wherever two
 * consecutive samples are more than the gap threshold apart. Each segment is
 * extended by the segment neighbourhood, clamped to [0, gap threshold],
 * below (nearest and linear) and above (all kinds). A target time outside
 * every extended segment receives the missing value of the column. A target
 * time covered by two extended segments takes the later one.
 * <p>
 * Nearest and previous interpolation preserve the column type. Linear 
 * interpolation is defined for numeric columns only and always produces a 
 * {@link ColumnType#DOUBLE} column. Single sample segments never produce a 
 * linear value.
 * 
 * @since 1.0
 */
public class Interpolator {
  private static final Logger LOG = LoggerFactory.getLogger(Interpolator.class);
  
  /** The source times. */
  protected final long[] source;
  
  /** The target times. */
  protected final long[] target;
  
  /** The gap threshold in milliseconds. */
  protected final double gap_threshold;
  
  /** The effective segment neighbourhood in milliseconds. */
  protected final double segment_neighbourhood;
  
  /** Cached neighbour index mappings. */
  protected final EnumMap<InterpolationKind, int[]> indices;
  
  /** Cached linear mapping, lower index and weight of the upper sample. */
  protected int[] linear_index;
  protected double[] linear_weight;
  
  /**
   * Default ctor.
   * @param source The non-null, ascending source times.
   * @param target The non-null, ascending target times.
   * @param gap_threshold The gap threshold in milliseconds. Negative values
   * are treated as 0.
   * @param segment_neighbourhood The segment neighbourhood in milliseconds.
   * @throws IllegalArgumentException if either time array was null.
   */
  public Interpolator(final long[] source, 
                      final long[] target, 
                      final double gap_threshold,
                      final double segment_neighbourhood) {
    if (source == null) {
      throw new IllegalArgumentException("Source times cannot be null.");
    }
    if (target == null) {
      throw new IllegalArgumentException("Target times cannot be null.");
    }
    this.source = source;
    this.target = target;
    this.gap_threshold = Math.max(0, gap_threshold);
    this.segment_neighbourhood = Math.max(0, 
        Math.min(gap_threshold, segment_neighbourhood));
    indices = new EnumMap<InterpolationKind, int[]>(InterpolationKind.class);
  }
  
  /**
   * Interpolates the column.
   * @param column A non-null column with one row per source time.
   * @param kind A non-null interpolation kind.
   * @return A column with one row per target time.
   * @throws IllegalArgumentException if the column length differs from the
   * source times or a string column was to be linearly interpolated.
   */
  public Column interpolate(final Column column, final InterpolationKind kind) {
    if (column == null) {
      throw new IllegalArgumentException("Column cannot be null.");
    }
    if (kind == null) {
      throw new IllegalArgumentException("Kind cannot be null.");
    }
    if (column.rows() != source.length) {
      throw new IllegalArgumentException("Source times and values must be "
          + "equal in length: " + source.length + " != " + column.rows());
    }
    if (kind != InterpolationKind.LINEAR) {
      return column.take(neighbourIndex(kind));
    }
    if (!column.type().isNumeric()) {
      throw new IllegalArgumentException("Linear interpolation is not "
          + "supported for columns of type " + column.type());
    }
    if (linear_index == null) {
      computeLinear();
    }
    final int width = column.width();
    final double[] result = new double[target.length * width];
    for (int i = 0; i < target.length; i++) {
      final int idx = linear_index[i];
      if (idx < 0) {
        Arrays.fill(result, i * width, (i + 1) * width, Double.NaN);
        continue;
      }
      final double weight = linear_weight[i];
      for (int c = 0; c < width; c++) {
        result[i * width + c] = (1.0 - weight) * column.getDouble(idx, c) 
            + weight * column.getDouble(idx + 1, c);
      }
    }
    return Column.of(ColumnType.DOUBLE, width, result, column.metadata());
  }
  
  /**
   * Computes or fetches the neighbour mapping for the kind.
   * @param kind The nearest or previous kind.
   * @return The source index per target time, -1 for missing.
   */
  @VisibleForTesting
  int[] neighbourIndex(final InterpolationKind kind) {
    int[] index = indices.get(kind);
    if (index != null) {
      return index;
    }
    final double lower = kind == InterpolationKind.NEAREST 
        ? segment_neighbourhood : 0;
    index = new int[target.length];
    Arrays.fill(index, -1);
    for (final Segment segment : segments(lower, segment_neighbourhood)) {
      for (int i = segment.dst_low; i < segment.dst_high; i++) {
        index[i] = kind == InterpolationKind.NEAREST 
            ? nearest(segment, target[i]) : previous(segment, target[i]);
      }
    }
    if (LOG.isDebugEnabled()) {
      int mapped = 0;
      for (final int idx : index) {
        if (idx >= 0) {
          mapped++;
        }
      }
      LOG.debug("{}: {} mapped, {} invalid", kind, mapped, 
          target.length - mapped);
    }
    indices.put(kind, index);
    return index;
  }
  
  /**
   * Nearest sample of the segment padded with the extension bounds. The 
   * decision boundaries are the midpoints between consecutive padded
   * abscissae and a time exactly on a midpoint goes to the lower sample.
   */
  private int nearest(final Segment segment, final long time) {
    // padded abscissae: [x_l, src[low] .. src[high - 1], x_h]
    final int count = segment.src_high - segment.src_low + 2;
    int lo = 0;
    int hi = count - 1;
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      final double midpoint = (padded(segment, mid) 
          + padded(segment, mid + 1)) / 2.0;
      if (time <= midpoint) {
        hi = mid;
      } else {
        lo = mid + 1;
      }
    }
    return paddedIndex(segment, lo);
  }
  
  /** Last padded sample at or before the time. */
  private int previous(final Segment segment, final long time) {
    final int count = segment.src_high - segment.src_low + 2;
    int lo = 0;
    int hi = count;
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      if (padded(segment, mid) <= time) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return paddedIndex(segment, Math.max(0, lo - 1));
  }
  
  private double padded(final Segment segment, final int position) {
    if (position == 0) {
      return segment.x_low;
    }
    final int count = segment.src_high - segment.src_low + 2;
    if (position == count - 1) {
      return segment.x_high;
    }
    return source[segment.src_low + position - 1];
  }
  
  private int paddedIndex(final Segment segment, final int position) {
    if (position == 0) {
      return segment.src_low;
    }
    final int count = segment.src_high - segment.src_low + 2;
    if (position == count - 1) {
      return segment.src_high - 1;
    }
    return segment.src_low + position - 1;
  }
  
  /**
   * Computes the linear mapping. The fractional source index of each target
   * time is found by linear interpolation of the indices within the segment,
   * extrapolating over the neighbourhood.
   */
  private void computeLinear() {
    linear_index = new int[target.length];
    linear_weight = new double[target.length];
    Arrays.fill(linear_index, -1);
    Arrays.fill(linear_weight, Double.NaN);
    for (final Segment segment : segments(segment_neighbourhood, 
        segment_neighbourhood)) {
      if (segment.src_high - segment.src_low < 2) {
        continue;
      }
      for (int i = segment.dst_low; i < segment.dst_high; i++) {
        final double fraction = fractionalIndex(segment, target[i]);
        final int idx = (int) Math.min(Math.max(Math.floor(fraction), 
            segment.src_low), segment.src_high - 2);
        linear_index[i] = idx;
        linear_weight[i] = fraction - idx;
      }
    }
  }
  
  private double fractionalIndex(final Segment segment, final long time) {
    // interval [k, k + 1] with src[k] <= time < src[k + 1], clamped to the
    // first and last interval for extrapolation
    int k = upperBound(source, segment.src_low, segment.src_high, time) - 1;
    k = Math.min(Math.max(k, segment.src_low), segment.src_high - 2);
    final double x0 = source[k];
    final double x1 = source[k + 1];
    if (x1 == x0) {
      return k;
    }
    return k + (time - x0) / (x1 - x0);
  }
  
  /**
   * Splits the source times into contiguous ranges and computes the covered
   * target range of each extended segment.
   * @param lower The extension below the first sample.
   * @param upper The extension above the last sample.
   * @return The non-empty segments in order.
   */
  @VisibleForTesting
  List<Segment> segments(final double lower, final double upper) {
    final List<Segment> segments = Lists.newArrayList();
    final Iterator<int[]> ranges = contiguousRanges(source, gap_threshold);
    while (ranges.hasNext()) {
      final int[] range = ranges.next();
      final double x_low = source[range[0]] - lower;
      final double x_high = source[range[1] - 1] + upper;
      final int dst_low = lowerBound(target, x_low);
      final int dst_high = upperBound(target, 0, target.length, x_high);
      if (dst_high > dst_low) {
        segments.add(new Segment(x_low, x_high, range[0], range[1], 
            dst_low, dst_high));
      }
    }
    return segments;
  }
  
  /**
   * Yields [low, high) index ranges of samples where no two consecutive 
   * samples are more than the gap threshold apart.
   * @param times The ascending times.
   * @param gap_threshold The threshold in milliseconds.
   * @return An iterator over the ranges.
   */
  @VisibleForTesting
  static Iterator<int[]> contiguousRanges(final long[] times, 
                                          final double gap_threshold) {
    final List<int[]> ranges = Lists.newArrayList();
    int low = 0;
    for (int i = 1; i < times.length; i++) {
      if (times[i] - times[i - 1] > gap_threshold) {
        ranges.add(new int[] { low, i });
        low = i;
      }
    }
    if (times.length > 0) {
      ranges.add(new int[] { low, times.length });
    }
    return ranges.iterator();
  }
  
  /** First index with {@code times[i] >= value}. */
  private static int lowerBound(final long[] times, final double value) {
    int lo = 0;
    int hi = times.length;
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      if (times[mid] < value) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }
  
  /** First index within [from, to) with {@code times[i] > value}. */
  private static int upperBound(final long[] times, 
                                final int from, 
                                final int to, 
                                final double value) {
    int lo = from;
    int hi = to;
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      if (times[mid] <= value) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo;
  }
  
  /** An extended contiguous segment and the target range it covers. */
  @VisibleForTesting
  static class Segment {
    final double x_low;
    final double x_high;
    final int src_low;
    final int src_high;
    final int dst_low;
    final int dst_high;
    
    Segment(final double x_low, 
            final double x_high, 
            final int src_low, 
            final int src_high, 
            final int dst_low, 
            final int dst_high) {
      this.x_low = x_low;
      this.x_high = x_high;
      this.src_low = src_low;
      this.src_high = src_high;
      this.dst_low = dst_low;
      this.dst_high = dst_high;
    }
  }
}
