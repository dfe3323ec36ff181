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

/**
 * The element type tag carried by every {@link Column} of a {@link Dataset}.
 * Each type maps to exactly one backing Java array type.
 * 
 * @since 1.0
 */
public enum ColumnType {
  /** 64 bit floating point values backed by a {@code double[]}. */
  DOUBLE(double[].class, true),
  
  /** 64 bit signed integers backed by a {@code long[]}. */
  LONG(long[].class, false),
  
  /** 32 bit signed integers backed by an {@code int[]}. */
  INT(int[].class, false),
  
  /** Text values backed by a {@code String[]}. */
  STRING(String[].class, false),
  
  /** Milliseconds since the Unix epoch backed by a {@code long[]}. */
  TIMESTAMP(long[].class, false);
  
  /** The backing array class. */
  private final Class<?> array_class;
  
  /** Whether or not NaN is the natural missing value. */
  private final boolean floating;
  
  ColumnType(final Class<?> array_class, final boolean floating) {
    this.array_class = array_class;
    this.floating = floating;
  }
  
  /** @return The backing array class. */
  public Class<?> arrayClass() {
    return array_class;
  }
  
  /** @return True if the type is a floating point type. */
  public boolean isFloating() {
    return floating;
  }
  
  /** @return True if values of this type can be converted to doubles. */
  public boolean isNumeric() {
    return this != STRING;
  }
  
  /**
   * The sentinel written where no value is available and the column
   * metadata does not declare a fill value. Integer defaults follow the CDF
   * conventions.
   * @return The non-null default missing value.
   */
  public Object defaultMissingValue() {
    switch (this) {
    case DOUBLE:
      return Double.NaN;
    case LONG:
    case TIMESTAMP:
      return Long.MIN_VALUE;
    case INT:
      return Integer.MIN_VALUE;
    case STRING:
      return "";
    default:
      throw new IllegalStateException("Unhandled column type: " + this);
    }
  }
}
