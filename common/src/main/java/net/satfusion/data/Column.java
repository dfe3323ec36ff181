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

import java.lang.reflect.Array;
import java.util.Arrays;
import java.util.Objects;

import net.satfusion.exceptions.IllegalDataException;

/**
 * A single, immutable column of a {@link Dataset}. The values are held in a
 * flat primitive (or {@link String}) array in row major order with
 * {@link #width()} components per row, e.g. a width of 3 for a vector
 * variable such as a magnetic field in NEC coordinates.
 * <p>
 * None of the operations modify the backing array. Selection, slicing,
 * concatenation and splicing always return a new column.
 * <p>
 * <b>NOTE:</b> The raw array accessors return the backing array for speed.
 * Callers must not modify them.
 * 
 * @since 1.0
 */
public final class Column {
  
  /** The element type. */
  private final ColumnType type;
  
  /** Number of components per row. */
  private final int width;
  
  /** The number of rows. */
  private final int rows;
  
  /** The flat backing array. */
  private final Object values;
  
  /** The non-null metadata. */
  private final ColumnMetadata metadata;
  
  /**
   * Package private ctor, use the static factories.
   * @param type The non-null type.
   * @param width The number of components per row, at least 1.
   * @param values The backing array matching the type.
   * @param metadata Optional metadata.
   * @throws IllegalArgumentException if the array did not match the type
   * or the length was not a multiple of the width.
   */
  Column(final ColumnType type, 
         final int width, 
         final Object values, 
         final ColumnMetadata metadata) {
    if (type == null) {
      throw new IllegalArgumentException("Type cannot be null.");
    }
    if (width < 1) {
      throw new IllegalArgumentException("Width must be at least 1.");
    }
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null.");
    }
    if (!type.arrayClass().isInstance(values)) {
      throw new IllegalArgumentException("Array of " 
          + values.getClass().getSimpleName() + " cannot back a column of " 
          + type);
    }
    final int length = Array.getLength(values);
    if (length % width != 0) {
      throw new IllegalArgumentException("Array length " + length 
          + " is not a multiple of the width " + width);
    }
    this.type = type;
    this.width = width;
    this.values = values;
    this.rows = length / width;
    this.metadata = metadata == null ? ColumnMetadata.EMPTY : metadata;
  }
  
  /**
   * @param values A non-null array of scalar values.
   * @return A scalar double column.
   */
  public static Column ofDoubles(final double... values) {
    return new Column(ColumnType.DOUBLE, 1, values, null);
  }
  
  /**
   * @param width The number of components per row.
   * @param values A non-null flat array of row major values.
   * @return A double column with the given width.
   */
  public static Column ofVectors(final int width, final double... values) {
    return new Column(ColumnType.DOUBLE, width, values, null);
  }
  
  /**
   * @param values A non-null array of values.
   * @return A scalar long column.
   */
  public static Column ofLongs(final long... values) {
    return new Column(ColumnType.LONG, 1, values, null);
  }
  
  /**
   * @param values A non-null array of values.
   * @return A scalar int column.
   */
  public static Column ofInts(final int... values) {
    return new Column(ColumnType.INT, 1, values, null);
  }
  
  /**
   * @param values A non-null array of values.
   * @return A scalar string column.
   */
  public static Column ofStrings(final String... values) {
    return new Column(ColumnType.STRING, 1, values, null);
  }
  
  /**
   * @param values A non-null array of millisecond Unix epoch timestamps.
   * @return A timestamp column.
   */
  public static Column ofTimestamps(final long... values) {
    return new Column(ColumnType.TIMESTAMP, 1, values, null);
  }
  
  /**
   * Wraps an existing backing array.
   * @param type The non-null type.
   * @param width The width.
   * @param values The backing array matching the type.
   * @param metadata Optional metadata.
   * @return The column.
   * @throws IllegalArgumentException if the array does not match.
   */
  public static Column of(final ColumnType type, 
                          final int width, 
                          final Object values, 
                          final ColumnMetadata metadata) {
    return new Column(type, width, values, metadata);
  }
  
  /**
   * @param type The non-null type.
   * @param width The width.
   * @param metadata Optional metadata.
   * @return A column with zero rows.
   */
  public static Column empty(final ColumnType type, 
                             final int width, 
                             final ColumnMetadata metadata) {
    return new Column(type, width, newArray(type, 0), metadata);
  }
  
  /**
   * Creates a column with every value set to the missing sentinel of the
   * type, or the fill value of the metadata when one is declared.
   * @param type The non-null type.
   * @param width The width.
   * @param rows The number of rows.
   * @param metadata Optional metadata.
   * @return The filled column.
   */
  public static Column missing(final ColumnType type, 
                               final int width, 
                               final int rows,
                               final ColumnMetadata metadata) {
    final Object array = newArray(type, rows * width);
    fill(type, array, 0, rows * width, missingValue(type, metadata));
    return new Column(type, width, array, metadata);
  }
  
  /**
   * The missing sentinel of a column described by the type and metadata.
   * @param type The non-null type.
   * @param metadata Optional metadata.
   * @return The fill value.
   */
  public static Object missingValue(final ColumnType type, 
                                    final ColumnMetadata metadata) {
    if (type.isFloating() || metadata == null 
        || metadata.getFillValue() == null) {
      return type.defaultMissingValue();
    }
    return metadata.getFillValue();
  }
  
  /** @return The element type. */
  public ColumnType type() {
    return type;
  }
  
  /** @return The number of components per row. */
  public int width() {
    return width;
  }
  
  /** @return The number of rows. */
  public int rows() {
    return rows;
  }
  
  /** @return The non-null metadata. */
  public ColumnMetadata metadata() {
    return metadata;
  }
  
  /** @return The backing array. */
  public Object rawValues() {
    return values;
  }
  
  /**
   * @return The backing double array.
   * @throws IllegalDataException if the column is not a double column.
   */
  public double[] doubles() {
    checkType(ColumnType.DOUBLE);
    return (double[]) values;
  }
  
  /**
   * @return The backing long array of a long or timestamp column.
   * @throws IllegalDataException if the column is not backed by longs.
   */
  public long[] longs() {
    if (type != ColumnType.LONG && type != ColumnType.TIMESTAMP) {
      throw new IllegalDataException("Column of type " + type 
          + " is not backed by longs.");
    }
    return (long[]) values;
  }
  
  /**
   * @return The backing int array.
   * @throws IllegalDataException if the column is not an int column.
   */
  public int[] ints() {
    checkType(ColumnType.INT);
    return (int[]) values;
  }
  
  /**
   * @return The backing string array.
   * @throws IllegalDataException if the column is not a string column.
   */
  public String[] strings() {
    checkType(ColumnType.STRING);
    return (String[]) values;
  }
  
  /**
   * Reads a numeric value converted to a double.
   * @param row The row index.
   * @param component The component index.
   * @return The value.
   * @throws IllegalDataException if the column is a string column.
   */
  public double getDouble(final int row, final int component) {
    final int idx = row * width + component;
    switch (type) {
    case DOUBLE:
      return ((double[]) values)[idx];
    case LONG:
    case TIMESTAMP:
      return ((long[]) values)[idx];
    case INT:
      return ((int[]) values)[idx];
    default:
      throw new IllegalDataException("Column of type " + type 
          + " is not numeric.");
    }
  }
  
  /**
   * @param metadata The new metadata.
   * @return A column sharing the values with the new metadata.
   */
  public Column withMetadata(final ColumnMetadata metadata) {
    return new Column(type, width, values, metadata);
  }
  
  /**
   * Selects rows by index. The indices may repeat and need not be sorted.
   * @param index A non-null array of row indices.
   * @return The new column.
   * @throws IndexOutOfBoundsException if an index was out of range.
   */
  public Column select(final int[] index) {
    if (index == null) {
      throw new IllegalArgumentException("Index cannot be null.");
    }
    final Object result = newArray(type, index.length * width);
    for (int i = 0; i < index.length; i++) {
      if (index[i] < 0 || index[i] >= rows) {
        throw new IndexOutOfBoundsException("Row " + index[i] 
            + " is out of range [0, " + rows + ")");
      }
      System.arraycopy(values, index[i] * width, result, i * width, width);
    }
    return new Column(type, width, result, metadata);
  }
  
  /**
   * Selects rows by a boolean mask.
   * @param mask A non-null mask with one entry per row.
   * @return The new column.
   * @throws IllegalArgumentException if the mask length differs from the 
   * row count.
   */
  public Column select(final boolean[] mask) {
    return select(maskToIndex(mask, rows));
  }
  
  /**
   * @param from The first row, inclusive.
   * @param to The last row, exclusive.
   * @return A new column holding the copied row range.
   */
  public Column slice(final int from, final int to) {
    if (from < 0 || to > rows || from > to) {
      throw new IndexOutOfBoundsException("Invalid slice [" + from + ", " 
          + to + ") of " + rows + " rows");
    }
    final Object result = newArray(type, (to - from) * width);
    System.arraycopy(values, from * width, result, 0, (to - from) * width);
    return new Column(type, width, result, metadata);
  }
  
  /**
   * @param other A non-null column of the same type and width.
   * @return A new column with the rows of this column followed by the rows 
   * of the other.
   * @throws IllegalArgumentException if the type or width differ.
   */
  public Column concat(final Column other) {
    if (other == null) {
      throw new IllegalArgumentException("Other column cannot be null.");
    }
    if (other.type != type || other.width != width) {
      throw new IllegalArgumentException("Cannot concatenate " + type + "[" 
          + width + "] with " + other.type + "[" + other.width + "]");
    }
    final Object result = newArray(type, (rows + other.rows) * width);
    System.arraycopy(values, 0, result, 0, rows * width);
    System.arraycopy(other.values, 0, result, rows * width, 
        other.rows * width);
    return new Column(type, width, result, metadata);
  }
  
  /**
   * Repeats the first row of this column.
   * @param count The number of output rows.
   * @return A new column of {@code count} identical rows.
   * @throws IllegalDataException if this column has no rows.
   */
  public Column broadcast(final int count) {
    if (rows < 1) {
      throw new IllegalDataException("Cannot broadcast an empty column.");
    }
    final Object result = newArray(type, count * width);
    for (int i = 0; i < count; i++) {
      System.arraycopy(values, 0, result, i * width, width);
    }
    return new Column(type, width, result, metadata);
  }
  
  /**
   * Returns a copy of this column with the given rows replaced by the rows 
   * of the replacement column, in order.
   * @param index The non-null target rows.
   * @param replacement A non-null column with {@code index.length} rows of 
   * the same type and width.
   * @return The new column.
   */
  public Column splice(final int[] index, final Column replacement) {
    if (index == null || replacement == null) {
      throw new IllegalArgumentException("Index and replacement cannot be "
          + "null.");
    }
    if (replacement.type != type || replacement.width != width) {
      throw new IllegalDataException("Cannot splice " + replacement.type + "[" 
          + replacement.width + "] into " + type + "[" + width + "]");
    }
    if (replacement.rows != index.length) {
      throw new IllegalArgumentException("Replacement has " 
          + replacement.rows + " rows but " + index.length 
          + " were selected.");
    }
    final Object result = newArray(type, rows * width);
    System.arraycopy(values, 0, result, 0, rows * width);
    for (int i = 0; i < index.length; i++) {
      System.arraycopy(replacement.values, i * width, result, 
          index[i] * width, width);
    }
    return new Column(type, width, result, metadata);
  }
  
  /**
   * Gathers rows by index where a negative index yields the missing value
   * of the column.
   * @param index The non-null row indices.
   * @return The new column with {@code index.length} rows.
   */
  public Column take(final int[] index) {
    if (index == null) {
      throw new IllegalArgumentException("Index cannot be null.");
    }
    final Object result = newArray(type, index.length * width);
    final Object missing = missingValue(type, metadata);
    for (int i = 0; i < index.length; i++) {
      if (index[i] < 0) {
        fill(type, result, i * width, (i + 1) * width, missing);
      } else if (index[i] >= rows) {
        throw new IndexOutOfBoundsException("Index " + index[i] 
            + " out of bounds for " + rows + " rows");
      } else {
        System.arraycopy(values, index[i] * width, result, i * width, width);
      }
    }
    return new Column(type, width, result, metadata);
  }
  
  /**
   * @param other A non-null column.
   * @return True if the type and width match.
   */
  public boolean isCompatible(final Column other) {
    return other != null && other.type == type && other.width == width;
  }
  
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    final Column other = (Column) o;
    if (type != other.type || width != other.width || rows != other.rows) {
      return false;
    }
    switch (type) {
    case DOUBLE:
      return Arrays.equals((double[]) values, (double[]) other.values);
    case LONG:
    case TIMESTAMP:
      return Arrays.equals((long[]) values, (long[]) other.values);
    case INT:
      return Arrays.equals((int[]) values, (int[]) other.values);
    default:
      return Arrays.equals((String[]) values, (String[]) other.values);
    }
  }
  
  @Override
  public int hashCode() {
    return Objects.hash(type, width, rows);
  }
  
  @Override
  public String toString() {
    return new StringBuilder()
        .append("Column{type=")
        .append(type)
        .append(", width=")
        .append(width)
        .append(", rows=")
        .append(rows)
        .append(", metadata={")
        .append(metadata)
        .append("}}")
        .toString();
  }
  
  /**
   * Converts a boolean mask into an ascending array of row indices.
   * @param mask The non-null mask.
   * @param rows The expected mask length.
   * @return The indices of the true entries.
   */
  public static int[] maskToIndex(final boolean[] mask, final int rows) {
    if (mask == null) {
      throw new IllegalArgumentException("Mask cannot be null.");
    }
    if (mask.length != rows) {
      throw new IllegalArgumentException("Mask length " + mask.length 
          + " differs from the row count " + rows);
    }
    int count = 0;
    for (final boolean flag : mask) {
      if (flag) {
        count++;
      }
    }
    final int[] index = new int[count];
    int idx = 0;
    for (int i = 0; i < mask.length; i++) {
      if (mask[i]) {
        index[idx++] = i;
      }
    }
    return index;
  }
  
  /**
   * @param type The non-null type.
   * @param length The array length.
   * @return A new backing array for the type.
   */
  static Object newArray(final ColumnType type, final int length) {
    switch (type) {
    case DOUBLE:
      return new double[length];
    case LONG:
    case TIMESTAMP:
      return new long[length];
    case INT:
      return new int[length];
    case STRING:
      return new String[length];
    default:
      throw new IllegalStateException("Unhandled column type: " + type);
    }
  }
  
  /**
   * Fills a range of the array with the value, converting numbers as needed.
   */
  static void fill(final ColumnType type, 
                   final Object array, 
                   final int from, 
                   final int to, 
                   final Object value) {
    switch (type) {
    case DOUBLE:
      Arrays.fill((double[]) array, from, to, ((Number) value).doubleValue());
      break;
    case LONG:
    case TIMESTAMP:
      Arrays.fill((long[]) array, from, to, ((Number) value).longValue());
      break;
    case INT:
      Arrays.fill((int[]) array, from, to, ((Number) value).intValue());
      break;
    case STRING:
      Arrays.fill((String[]) array, from, to, value.toString());
      break;
    default:
      throw new IllegalStateException("Unhandled column type: " + type);
    }
  }
  
  private void checkType(final ColumnType expected) {
    if (type != expected) {
      throw new IllegalDataException("Column of type " + type 
          + " accessed as " + expected);
    }
  }
}
