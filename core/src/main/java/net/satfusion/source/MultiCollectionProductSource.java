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
package net.satfusion.source;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import net.satfusion.data.Record;
import net.satfusion.storage.Product;
import net.satfusion.storage.RecordRepository;

/**
 * Product source combining several collections of the same product type in
 * priority order, the first collection having the highest priority. Gaps in
 * the coverage of a collection are filled from the next-in-line collections.
 * <p>
 * The records are swept in time order. At each position the record owning
 * the time is the one of the highest priority collection covering it. A 
 * record supersedes the earlier records of its own collection from its 
 * start onwards. Consecutive pieces owned by the same record are joined 
 * before being emitted.
 * <p>
 * The emitted records are sorted, do not overlap and cover the union of the 
 * input records. Each instant is claimed by the highest priority collection 
 * covering it.
 * 
 * @since 1.0
 */
public class MultiCollectionProductSource extends BaseProductSource {
  private static final Logger LOG = LoggerFactory.getLogger(
      MultiCollectionProductSource.class);

  /** The maximum number of combined collections. */
  public static final int MAX_COLLECTIONS = 256;
  
  /**
   * Default ctor.
   * @param repository A non-null repository.
   * @param collections Two to {@link #MAX_COLLECTIONS} distinct collections
   * in priority order.
   * @param parameters Optional parameters, the defaults when null.
   * @throws IllegalArgumentException if the collections were not distinct or
   * their number was out of range.
   */
  public MultiCollectionProductSource(final RecordRepository repository, 
                                      final List<String> collections,
                                      final ProductTypeParameters parameters) {
    super(repository, collections, parameters);
    if (collections.size() < 2) {
      throw new IllegalArgumentException("At least two distinct collections "
          + "must be given!");
    }
    if (collections.size() > MAX_COLLECTIONS) {
      throw new IllegalArgumentException("Maximum number of collections "
          + "exceeded!");
    }
    final Set<String> unique = Sets.newHashSet(collections);
    if (unique.size() < collections.size()) {
      throw new IllegalArgumentException("Combined collections are not "
          + "unique!");
    }
  }

  @Override
  public Iterator<Record<Product>> iterRecords(final long start, 
                                               final long end, 
                                               final long tolerance) {
    final PriorityQueue<Candidate> queue = 
        new PriorityQueue<Candidate>(collections.size(), CANDIDATE_ORDER);
    for (int i = 0; i < collections.size(); i++) {
      final Iterator<Product> iterator = repository.list(collections.get(i), 
          start, end, tolerance).iterator();
      if (iterator.hasNext()) {
        queue.add(new Candidate(toRecord(i, iterator.next()), iterator));
      }
    }
    return new Selector(queue);
  }
  
  /**
   * Pulls the next candidate, refilling the queue from the collection the 
   * candidate came from.
   */
  private static Record<Product> pull(final PriorityQueue<Candidate> queue) {
    final Candidate candidate = queue.poll();
    if (candidate == null) {
      return null;
    }
    if (candidate.source.hasNext()) {
      queue.add(new Candidate(toRecord(candidate.record.index(), 
          candidate.source.next()), candidate.source));
    }
    return candidate.record;
  }
  
  /** Lazily arbitrates the candidates. */
  private static class Selector extends AbstractIterator<Record<Product>> {
    private final PriorityQueue<Candidate> queue;
    
    /** The records covering the current position. */
    private final List<Record<Product>> active = Lists.newArrayList();
    
    /** The current position, everything before it was arbitrated. */
    private long position = Long.MIN_VALUE;
    
    /** The record owning the pending piece. */
    private Record<Product> owner;
    
    /** The piece waiting to be extended or emitted. */
    private Record<Product> pending;
    
    Selector(final PriorityQueue<Candidate> queue) {
      this.queue = queue;
    }
    
    @Override
    protected Record<Product> computeNext() {
      while (true) {
        final Iterator<Record<Product>> iterator = active.iterator();
        while (iterator.hasNext()) {
          if (iterator.next().end() <= position) {
            iterator.remove();
          }
        }
        
        if (active.isEmpty()) {
          final Candidate head = queue.peek();
          if (head == null) {
            if (pending == null) {
              return endOfData();
            }
            final Record<Product> result = pending;
            pending = null;
            return result;
          }
          position = Math.max(position, head.record.start());
        }
        
        // positions never pass a queued start so records activate there
        while (queue.peek() != null 
            && queue.peek().record.start() <= position) {
          activate(pull(queue));
        }
        if (active.isEmpty()) {
          continue;
        }
        
        Record<Product> best = null;
        long next = queue.peek() == null 
            ? Long.MAX_VALUE : queue.peek().record.start();
        for (final Record<Product> record : active) {
          if (best == null || record.index() < best.index()) {
            best = record;
          }
          next = Math.min(next, record.end());
        }
        
        Record<Product> result = null;
        if (pending != null && best == owner && pending.end() == position) {
          pending = pending.withEnd(next);
        } else {
          result = pending;
          owner = best;
          pending = best.withStart(position).withEnd(next);
        }
        position = next;
        if (result != null) {
          return result;
        }
      }
    }
    
    /**
     * Adds a record starting at the current position, dropping the records 
     * of the same collection it supersedes.
     */
    private void activate(final Record<Product> record) {
      if (record.end() <= position) {
        return;
      }
      final Iterator<Record<Product>> iterator = active.iterator();
      while (iterator.hasNext()) {
        final Record<Product> extant = iterator.next();
        if (extant.index() == record.index()) {
          if (LOG.isTraceEnabled()) {
            LOG.trace("Record {} superseded by {}", extant, record);
          }
          iterator.remove();
        }
      }
      active.add(record);
    }
  }
  
  /** A record waiting for arbitration with the iterator it came from. */
  private static class Candidate {
    final Record<Product> record;
    final Iterator<Product> source;
    
    Candidate(final Record<Product> record, final Iterator<Product> source) {
      this.record = record;
      this.source = source;
    }
  }
  
  /** Start time, then priority. */
  private static final Comparator<Candidate> CANDIDATE_ORDER = 
      new Comparator<Candidate>() {
    @Override
    public int compare(final Candidate a, final Candidate b) {
      final int result = Long.compare(a.record.start(), b.record.start());
      if (result != 0) {
        return result;
      }
      return Integer.compare(a.record.index(), b.record.index());
    }
  };
}
