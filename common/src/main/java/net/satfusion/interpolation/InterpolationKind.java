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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The supported 1D interpolation kinds.
 * 
 * @since 1.0
 */
public enum InterpolationKind {
  
  /** The nearest sample, ties at equal distance go to the earlier sample. */
  NEAREST("nearest"),
  
  /** The previous sample, a.k.a. zero order hold. */
  PREVIOUS("previous"),
  
  /** Linear interpolation between the two enclosing samples. */
  LINEAR("linear");
  
  private final String name;
  
  private InterpolationKind(final String name) {
    this.name = name;
  }
  
  /** @return The lower case name used in configuration files. */
  @JsonValue
  public String getName() {
    return name;
  }
  
  /**
   * Parses the kind from its name. {@code zero} is an alias of 
   * {@code previous}.
   * @param name The non-null name, case insensitive.
   * @return The kind.
   * @throws IllegalArgumentException if the name is null or not known.
   */
  @JsonCreator
  public static InterpolationKind fromName(final String name) {
    if (name == null) {
      throw new IllegalArgumentException("Interpolation kind cannot be null.");
    }
    final String lower = name.trim().toLowerCase();
    if (lower.equals("zero")) {
      return PREVIOUS;
    }
    for (final InterpolationKind kind : values()) {
      if (kind.name.equals(lower)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Invalid interpolation kind: " + name);
  }
}
