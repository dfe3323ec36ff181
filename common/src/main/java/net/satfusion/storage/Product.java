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
package net.satfusion.storage;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * A product of a collection as listed by the {@link RecordRepository}, e.g.
 * one daily file of a satellite instrument. The end time is inclusive as it
 * is the time of the last sample.
 * 
 * @since 1.0
 */
@JsonDeserialize(builder = Product.Builder.class)
public final class Product {
  
  /** The unique identifier. */
  private final String identifier;
  
  /** The collection the product belongs to. */
  private final String collection;
  
  /** The time of the first sample in milliseconds. */
  private final long begin;
  
  /** The time of the last sample in milliseconds, inclusive. */
  private final long end;
  
  /** An optional location of the payload, e.g. a file path. */
  private final String location;
  
  /** Optional start of the valid row range. */
  private final int index_start;
  
  /** Optional exclusive end of the valid row range, -1 for all. */
  private final int index_end;
  
  /** Whether the time column is sorted. */
  private final boolean sorted;
  
  private Product(final Builder builder) {
    if (builder.identifier == null || builder.identifier.isEmpty()) {
      throw new IllegalArgumentException("Identifier cannot be null or "
          + "empty.");
    }
    if (builder.collection == null || builder.collection.isEmpty()) {
      throw new IllegalArgumentException("Collection cannot be null or "
          + "empty.");
    }
    if (builder.end < builder.begin) {
      throw new IllegalArgumentException("End cannot be before the begin "
          + "time for product " + builder.identifier);
    }
    identifier = builder.identifier;
    collection = builder.collection;
    begin = builder.begin;
    end = builder.end;
    location = builder.location;
    index_start = builder.indexStart;
    index_end = builder.indexEnd;
    sorted = builder.sorted;
  }
  
  /** @return The unique identifier. */
  public String getIdentifier() {
    return identifier;
  }
  
  /** @return The collection identifier. */
  public String getCollection() {
    return collection;
  }
  
  /** @return The time of the first sample in milliseconds. */
  public long getBegin() {
    return begin;
  }
  
  /** @return The time of the last sample in milliseconds, inclusive. */
  public long getEnd() {
    return end;
  }
  
  /** @return The location of the payload, may be null. */
  public String getLocation() {
    return location;
  }
  
  /** @return The start of the valid row range. */
  public int getIndexStart() {
    return index_start;
  }
  
  /** @return The exclusive end of the valid row range or -1 for all rows. */
  public int getIndexEnd() {
    return index_end;
  }
  
  /** @return Whether the time column is sorted in ascending order. */
  public boolean isSorted() {
    return sorted;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Product other = (Product) o;
    return identifier.equals(other.identifier) 
        && collection.equals(other.collection)
        && begin == other.begin
        && end == other.end;
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(identifier, collection, begin, end);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("Product{identifier=")
        .append(identifier)
        .append(", collection=")
        .append(collection)
        .append(", begin=")
        .append(begin)
        .append(", end=")
        .append(end)
        .append("}")
        .toString();
  }
  
  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "set")
  public static class Builder {
    @JsonProperty
    private String identifier;
    @JsonProperty
    private String collection;
    @JsonProperty
    private long begin;
    @JsonProperty
    private long end;
    @JsonProperty
    private String location;
    @JsonProperty
    private int indexStart;
    @JsonProperty
    private int indexEnd = -1;
    @JsonProperty
    private boolean sorted = true;
    
    public Builder setIdentifier(final String identifier) {
      this.identifier = identifier;
      return this;
    }
    
    public Builder setCollection(final String collection) {
      this.collection = collection;
      return this;
    }
    
    public Builder setBegin(final long begin) {
      this.begin = begin;
      return this;
    }
    
    public Builder setEnd(final long end) {
      this.end = end;
      return this;
    }
    
    public Builder setLocation(final String location) {
      this.location = location;
      return this;
    }
    
    public Builder setIndexStart(final int index_start) {
      indexStart = index_start;
      return this;
    }
    
    public Builder setIndexEnd(final int index_end) {
      indexEnd = index_end;
      return this;
    }
    
    public Builder setSorted(final boolean sorted) {
      this.sorted = sorted;
      return this;
    }
    
    public Product build() {
      return new Product(this);
    }
  }
}
