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

import java.io.IOException;

import net.satfusion.data.Column;

/**
 * Reads the columns of a product payload.
 * 
 * @since 1.0
 */
public interface ColumnReader {

  /**
   * @param product The non-null product.
   * @return The number of rows of the record varying columns.
   * @throws IOException if the payload could not be read.
   */
  public int rowCount(final Product product) throws IOException;
  
  /**
   * @param product The non-null product.
   * @param variable The non-null variable.
   * @return True if the payload holds the variable.
   * @throws IOException if the payload could not be read.
   */
  public boolean contains(final Product product, final String variable) 
      throws IOException;
  
  /**
   * @param product The non-null product.
   * @param variable A variable of the payload.
   * @return True if the variable has one value per row. False for
   * constants that are broadcast to the row count.
   * @throws IOException if the payload could not be read.
   */
  public boolean isRecordVarying(final Product product, 
                                 final String variable) throws IOException;
  
  /**
   * Reads the rows {@code [from, to)} of a record varying variable or the 
   * single row of a constant.
   * @param product The non-null product.
   * @param variable A variable of the payload.
   * @param from The first row, inclusive.
   * @param to The last row, exclusive.
   * @return The non-null column.
   * @throws IOException if the payload could not be read.
   */
  public Column read(final Product product, 
                     final String variable, 
                     final int from, 
                     final int to) throws IOException;
  
}
