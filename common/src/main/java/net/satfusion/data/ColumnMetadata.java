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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/**
 * Optional descriptive metadata attached to a column: unit, description and
 * a fill value used as the missing sentinel for non-floating columns.
 * Instances are immutable.
 * 
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = ColumnMetadata.Builder.class)
public final class ColumnMetadata {
  /** An empty metadata instance. */
  public static final ColumnMetadata EMPTY = newBuilder().build();
  
  /** An optional unit, e.g. "nT". */
  private final String unit;
  
  /** An optional human readable description. */
  private final String description;
  
  /** An optional fill value. */
  private final Object fill_value;
  
  private ColumnMetadata(final Builder builder) {
    unit = builder.unit;
    description = builder.description;
    fill_value = builder.fillValue;
  }
  
  /** @return The unit, may be null. */
  public String getUnit() {
    return unit;
  }
  
  /** @return The description, may be null. */
  public String getDescription() {
    return description;
  }
  
  /** @return The fill value, may be null. */
  public Object getFillValue() {
    return fill_value;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final ColumnMetadata other = (ColumnMetadata) o;
    return Objects.equals(unit, other.unit)
        && Objects.equals(description, other.description)
        && Objects.equals(fill_value, other.fill_value);
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(unit, description, fill_value);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("unit=")
        .append(unit)
        .append(", description=")
        .append(description)
        .append(", fillValue=")
        .append(fill_value)
        .toString();
  }
  
  public static Builder newBuilder() {
    return new Builder();
  }
  
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "set")
  public static class Builder {
    @JsonProperty
    private String unit;
    @JsonProperty
    private String description;
    @JsonProperty
    private Object fillValue;
    
    public Builder setUnit(final String unit) {
      this.unit = unit;
      return this;
    }
    
    public Builder setDescription(final String description) {
      this.description = description;
      return this;
    }
    
    public Builder setFillValue(final Object fill_value) {
      fillValue = fill_value;
      return this;
    }
    
    public ColumnMetadata build() {
      return new ColumnMetadata(this);
    }
  }
}
