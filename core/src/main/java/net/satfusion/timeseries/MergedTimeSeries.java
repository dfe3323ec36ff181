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

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.satfusion.data.Dataset;
import net.satfusion.data.DatasetIterator;
import net.satfusion.interpolation.InterpolationKind;
import net.satfusion.query.TimeSeries;

/**
 * Merges the time lines of several time series into one master time line 
 * offering the time variable and the variables common to all sources. 
 * Chunks are cut at the earliest end of the current source chunks, merged, 
 * sorted by time and de-duplicated so that each time appears once.
 * <p>
 * The merged series is a master only, it cannot be interpolated.
 * 
 * @since 1.0
 */
public class MergedTimeSeries implements TimeSeries {
  private static final Logger LOG = LoggerFactory.getLogger(
      MergedTimeSeries.class);
  
  /** The merged sources. */
  private final List<TimeSeries> sources;
  
  /** The shared time variable. */
  private final String time_variable;
  
  /** The time variable followed by the common variables. */
  private final List<String> variables;
  
  /**
   * Default ctor.
   * @param sources A non-null and non-empty list of time series.
   * @param time_variable The time variable offered by every source.
   * @throws IllegalArgumentException if a source lacks the time variable.
   */
  public MergedTimeSeries(final List<? extends TimeSeries> sources, 
                          final String time_variable) {
    if (sources == null || sources.isEmpty()) {
      throw new IllegalArgumentException("Sources cannot be null or empty.");
    }
    if (time_variable == null || time_variable.isEmpty()) {
      throw new IllegalArgumentException("Time variable cannot be null or "
          + "empty.");
    }
    final Set<String> common = Sets.newLinkedHashSet(
        sources.get(0).variables());
    for (final TimeSeries source : sources) {
      if (!source.variables().contains(time_variable)) {
        throw new IllegalArgumentException("Dataset time variable mismatch! "
            + source.id() + " does not offer " + time_variable);
      }
      common.retainAll(source.variables());
    }
    common.remove(time_variable);
    this.sources = ImmutableList.copyOf(sources);
    this.time_variable = time_variable;
    variables = ImmutableList.<String>builder()
        .add(time_variable)
        .addAll(common)
        .build();
  }
  
  @Override
  public String id() {
    return "-";
  }
  
  @Override
  public List<String> requiredVariables() {
    return ImmutableList.of();
  }
  
  @Override
  public List<String> variables() {
    return variables;
  }
  
  @Override
  public DatasetIterator subset(final long start, 
                                final long stop, 
                                final Collection<String> variables) {
    final List<String> extracted = Lists.newArrayList();
    extracted.add(time_variable);
    for (final String variable : variables == null 
        ? this.variables : variables) {
      if (this.variables.contains(variable) 
          && !extracted.contains(variable)) {
        extracted.add(variable);
      }
    }
    final List<DatasetIterator> iterators = Lists.newArrayList();
    for (final TimeSeries source : sources) {
      iterators.add(source.subset(start, stop, extracted));
    }
    LOG.debug("Merging {} time series of {}", sources.size(), extracted);
    return new MergingIterator(iterators, time_variable, extracted);
  }
  
  /**
   * Not supported.
   * @throws UnsupportedOperationException always.
   */
  @Override
  public Dataset interpolate(final long[] times, 
                             final Collection<String> variables,
                             final Map<String, InterpolationKind> kinds) {
    throw new UnsupportedOperationException("A merged time series cannot be "
        + "interpolated.");
  }
  
  @Override
  public Set<String> products() {
    final Set<String> products = Sets.newTreeSet();
    for (final TimeSeries source : sources) {
      products.addAll(source.products());
    }
    return products;
  }
  
  /** @return The merged sources. */
  public List<TimeSeries> sources() {
    return sources;
  }
  
  @Override
  public String toString() {
    return "MergedTimeSeries(" + sources + ")";
  }
  
  /**
   * Drains the source iterators in parallel cutting the head chunks at the 
   * earliest head end.
   */
  static class MergingIterator extends ChunkIterator {
    private final List<Head> heads;
    private final String time_variable;
    private final List<String> variables;
    
    MergingIterator(final List<DatasetIterator> iterators, 
                    final String time_variable,
                    final List<String> variables) {
      this.time_variable = time_variable;
      this.variables = variables;
      heads = Lists.newArrayListWithCapacity(iterators.size());
      for (final DatasetIterator iterator : iterators) {
        heads.add(new Head(iterator));
      }
    }
    
    @Override
    protected Dataset computeNext() {
      long cut_at = Long.MAX_VALUE;
      boolean any = false;
      for (final Head head : heads) {
        if (head.chunk != null) {
          cut_at = Math.min(cut_at, head.end);
          any = true;
        }
      }
      if (!any) {
        return endOfData();
      }
      final Dataset merged = new Dataset();
      for (final Head head : heads) {
        final Dataset part = head.split(cut_at);
        if (part != null) {
          merged.append(part);
        }
      }
      return unique(merged);
    }
    
    @Override
    public void close() {
      for (final Head head : heads) {
        head.iterator.close();
      }
    }
    
    /** Sorts the rows by time and drops repeated times. */
    private Dataset unique(final Dataset dataset) {
      final long[] times = dataset.get(time_variable).longs();
      final int[] order = TimeIndex.argsort(times, 0, times.length);
      int count = order.length > 0 ? 1 : 0;
      for (int i = 1; i < order.length; i++) {
        if (times[order[i]] > times[order[i - 1]]) {
          order[count++] = order[i];
        }
      }
      final int[] index = new int[count];
      System.arraycopy(order, 0, index, 0, count);
      return dataset.subset(index);
    }
    
    /** The current, possibly partially consumed, chunk of one source. */
    private class Head {
      private final DatasetIterator iterator;
      private Dataset chunk;
      private long end;
      
      Head(final DatasetIterator iterator) {
        this.iterator = iterator;
        advance();
      }
      
      /** Fetches the next non-empty chunk. */
      private void advance() {
        chunk = null;
        while (iterator.hasNext()) {
          final Dataset next = iterator.next().extract(variables);
          if (next.length() > 0) {
            setChunk(next);
            return;
          }
        }
      }
      
      private void setChunk(final Dataset dataset) {
        chunk = dataset;
        end = Long.MIN_VALUE;
        for (final long time : dataset.get(time_variable).longs()) {
          end = Math.max(end, time);
        }
      }
      
      /**
       * Removes and returns the rows of the head at or before the cut.
       * @return The rows or null if none.
       */
      Dataset split(final long cut_at) {
        if (chunk == null) {
          return null;
        }
        final long[] times = chunk.get(time_variable).longs();
        final boolean[] mask = new boolean[times.length];
        int count = 0;
        for (int i = 0; i < times.length; i++) {
          mask[i] = times[i] <= cut_at;
          if (mask[i]) {
            count++;
          }
        }
        if (count == times.length) {
          final Dataset head = chunk;
          advance();
          return head;
        }
        if (count == 0) {
          return null;
        }
        final Dataset head = chunk.subset(mask);
        for (int i = 0; i < mask.length; i++) {
          mask[i] = !mask[i];
        }
        setChunk(chunk.subset(mask));
        return head;
      }
    }
  }
}
