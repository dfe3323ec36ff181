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

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.collect.ImmutableMap;

import net.satfusion.interpolation.InterpolationKind;
import net.satfusion.utils.DateTime;

/**
 * The temporal parameters of a product type. Durations are milliseconds and
 * are given as strings such as {@code 61m} in configuration files.
 * 
 * @since 1.0
 */
@JsonDeserialize(builder = ProductTypeParameters.Builder.class)
public final class ProductTypeParameters {
  
  /** The defaults applied to product types without explicit parameters. */
  public static final ProductTypeParameters DEFAULT = newBuilder().build();
  
  /** The name of the time variable. */
  private final String time_variable;
  
  /** The buffer added to both sides of a product selection. */
  private final long time_tolerance;
  
  /** The buffer added to both sides of an interpolated window. */
  private final long time_overlap;
  
  /** The maximum distance of two samples of one contiguous segment. */
  private final long gap_threshold;
  
  /** The extension of each contiguous segment. */
  private final long segment_neighbourhood;
  
  /** The interpolation kind of variables not listed in the kinds. */
  private final InterpolationKind default_kind;
  
  /** Per variable interpolation kinds. */
  private final Map<String, InterpolationKind> interpolation_kinds;
  
  private ProductTypeParameters(final Builder builder) {
    if (builder.timeVariable == null || builder.timeVariable.isEmpty()) {
      throw new IllegalArgumentException("Time variable cannot be null or "
          + "empty.");
    }
    if (builder.timeTolerance < 0 || builder.timeOverlap < 0 
        || builder.gapThreshold < 0 || builder.segmentNeighbourhood < 0) {
      throw new IllegalArgumentException("Durations cannot be negative.");
    }
    time_variable = builder.timeVariable;
    time_tolerance = builder.timeTolerance;
    time_overlap = builder.timeOverlap;
    gap_threshold = builder.gapThreshold;
    segment_neighbourhood = builder.segmentNeighbourhood;
    default_kind = builder.defaultKind == null 
        ? InterpolationKind.NEAREST : builder.defaultKind;
    interpolation_kinds = builder.interpolationKinds == null 
        ? ImmutableMap.<String, InterpolationKind>of() 
        : ImmutableMap.copyOf(builder.interpolationKinds);
  }
  
  /** @return The name of the time variable. */
  public String getTimeVariable() {
    return time_variable;
  }
  
  /** @return The selection tolerance in milliseconds. */
  public long getTimeTolerance() {
    return time_tolerance;
  }
  
  /** @return The interpolation overlap in milliseconds. */
  public long getTimeOverlap() {
    return time_overlap;
  }
  
  /** @return The gap threshold in milliseconds. */
  public long getGapThreshold() {
    return gap_threshold;
  }
  
  /** @return The segment neighbourhood in milliseconds. */
  public long getSegmentNeighbourhood() {
    return segment_neighbourhood;
  }
  
  /** @return The interpolation kind of variables without an explicit one. */
  public InterpolationKind getDefaultKind() {
    return default_kind;
  }
  
  /** @return The per variable interpolation kinds. */
  public Map<String, InterpolationKind> getInterpolationKinds() {
    return interpolation_kinds;
  }
  
  /**
   * @param variable A variable name.
   * @return The interpolation kind of the variable.
   */
  public InterpolationKind kindOf(final String variable) {
    final InterpolationKind kind = interpolation_kinds.get(variable);
    return kind == null ? default_kind : kind;
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("timeVariable=")
        .append(time_variable)
        .append(", timeTolerance=")
        .append(time_tolerance)
        .append(", timeOverlap=")
        .append(time_overlap)
        .append(", gapThreshold=")
        .append(gap_threshold)
        .append(", segmentNeighbourhood=")
        .append(segment_neighbourhood)
        .append(", interpolationKinds=")
        .append(interpolation_kinds)
        .toString();
  }
  
  /** @return A new builder with the Swarm defaults. */
  public static Builder newBuilder() {
    return new Builder();
  }
  
  /**
   * Builder. The string setters accept durations such as {@code 30s} or
   * {@code 61m} and are the ones used when parsing YAML.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "set")
  public static class Builder {
    private String timeVariable = "Timestamp";
    private long timeTolerance = 0;
    private long timeOverlap = 60000;
    private long gapThreshold = 30000;
    private long segmentNeighbourhood = 500;
    private InterpolationKind defaultKind;
    private Map<String, InterpolationKind> interpolationKinds;
    
    @JsonProperty("timeVariable")
    public Builder setTimeVariable(final String time_variable) {
      timeVariable = time_variable;
      return this;
    }
    
    @JsonProperty("timeTolerance")
    public Builder setTimeTolerance(final String time_tolerance) {
      timeTolerance = DateTime.parseDuration(time_tolerance);
      return this;
    }
    
    public Builder setTimeToleranceMillis(final long time_tolerance) {
      timeTolerance = time_tolerance;
      return this;
    }
    
    @JsonProperty("timeOverlap")
    public Builder setTimeOverlap(final String time_overlap) {
      timeOverlap = DateTime.parseDuration(time_overlap);
      return this;
    }
    
    public Builder setTimeOverlapMillis(final long time_overlap) {
      timeOverlap = time_overlap;
      return this;
    }
    
    @JsonProperty("gapThreshold")
    public Builder setGapThreshold(final String gap_threshold) {
      gapThreshold = DateTime.parseDuration(gap_threshold);
      return this;
    }
    
    public Builder setGapThresholdMillis(final long gap_threshold) {
      gapThreshold = gap_threshold;
      return this;
    }
    
    @JsonProperty("segmentNeighbourhood")
    public Builder setSegmentNeighbourhood(final String segment_neighbourhood) {
      segmentNeighbourhood = DateTime.parseDuration(segment_neighbourhood);
      return this;
    }
    
    public Builder setSegmentNeighbourhoodMillis(
        final long segment_neighbourhood) {
      segmentNeighbourhood = segment_neighbourhood;
      return this;
    }
    
    @JsonProperty("defaultKind")
    public Builder setDefaultKind(final InterpolationKind default_kind) {
      defaultKind = default_kind;
      return this;
    }
    
    @JsonProperty("interpolationKinds")
    public Builder setInterpolationKinds(
        final Map<String, InterpolationKind> interpolation_kinds) {
      interpolationKinds = interpolation_kinds;
      return this;
    }
    
    public ProductTypeParameters build() {
      return new ProductTypeParameters(this);
    }
  }
}
