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
package net.satfusion.query;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An input of a model, e.g. a coefficient file, with the time span it is
 * valid for. Used as the provenance of cached model values.
 * 
 * @since 1.0
 */
public final class ModelSource {
  
  /** The source name. */
  private final String name;
  
  /** The inclusive validity start in milliseconds. */
  private final long validity_start;
  
  /** The exclusive validity end in milliseconds. */
  private final long validity_end;
  
  /**
   * Default ctor.
   * @param name The non-null and non-empty source name.
   * @param validity_start The validity start in milliseconds.
   * @param validity_end The validity end in milliseconds.
   */
  @JsonCreator
  public ModelSource(@JsonProperty("name") final String name, 
                     @JsonProperty("validityStart") final long validity_start, 
                     @JsonProperty("validityEnd") final long validity_end) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Name cannot be null or empty.");
    }
    this.name = name;
    this.validity_start = validity_start;
    this.validity_end = validity_end;
  }
  
  /** @return The source name. */
  public String getName() {
    return name;
  }
  
  /** @return The validity start in milliseconds. */
  public long getValidityStart() {
    return validity_start;
  }
  
  /** @return The validity end in milliseconds. */
  public long getValidityEnd() {
    return validity_end;
  }
  
  /**
   * @param start The inclusive start in milliseconds.
   * @param end The inclusive end in milliseconds.
   * @return True if the validity span intersects the closed interval.
   */
  public boolean intersects(final long start, final long end) {
    return validity_start <= end && validity_end >= start;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ModelSource other = (ModelSource) o;
    return name.equals(other.name) 
        && validity_start == other.validity_start 
        && validity_end == other.validity_end;
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(name, validity_start, validity_end);
  }
  
  @Override
  public String toString() {
    return name + "[" + validity_start + ", " + validity_end + "]";
  }
}
