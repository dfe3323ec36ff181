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
package net.satfusion.data;

import java.util.Objects;

/**
 * An immutable, half-open time interval {@code [start, end)} in milliseconds
 * since the Unix epoch with an attached payload, e.g. a product read from a
 * collection. The index is the priority of the originating collection where
 * a lower index means a higher priority.
 *
 * @param <T> The type of the payload.
 * 
 * @since 1.0
 */
public final class Record<T> {
  
  /** The priority index of the source collection. */
  private final int index;
  
  /** The inclusive start time. */
  private final long start;
  
  /** The exclusive end time. */
  private final long end;
  
  /** The payload. */
  private final T payload;
  
  /**
   * Default ctor.
   * @param index The priority index of the source collection.
   * @param start The inclusive start time in milliseconds.
   * @param end The exclusive end time in milliseconds.
   * @param payload The non-null payload.
   * @throws IllegalArgumentException if the payload was null or the end 
   * was before the start.
   */
  public Record(final int index, 
                final long start, 
                final long end, 
                final T payload) {
    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null.");
    }
    if (end < start) {
      throw new IllegalArgumentException("End " + end 
          + " cannot be before the start " + start);
    }
    this.index = index;
    this.start = start;
    this.end = end;
    this.payload = payload;
  }
  
  /** @return The priority index of the source collection. */
  public int index() {
    return index;
  }
  
  /** @return The inclusive start time in milliseconds. */
  public long start() {
    return start;
  }
  
  /** @return The exclusive end time in milliseconds. */
  public long end() {
    return end;
  }
  
  /** @return The payload. */
  public T payload() {
    return payload;
  }
  
  /** @return True if the interval is empty. */
  public boolean isEmpty() {
    return end <= start;
  }
  
  /**
   * @param start The new start time.
   * @return A copy of the record with the new start time.
   */
  public Record<T> withStart(final long start) {
    return new Record<T>(index, start, end, payload);
  }
  
  /**
   * @param end The new end time.
   * @return A copy of the record with the new end time.
   */
  public Record<T> withEnd(final long end) {
    return new Record<T>(index, start, end, payload);
  }
  
  /**
   * @param other A non-null record.
   * @return True if the two half-open intervals share at least one instant.
   */
  public boolean overlaps(final Record<?> other) {
    return start < other.end && other.start < end;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Record<?> other = (Record<?>) o;
    return index == other.index 
        && start == other.start 
        && end == other.end 
        && payload.equals(other.payload);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(index, start, end, payload);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("Record{index=")
        .append(index)
        .append(", start=")
        .append(start)
        .append(", end=")
        .append(end)
        .append(", payload=")
        .append(payload)
        .append("}")
        .toString();
  }
}
