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
package net.satfusion.exceptions;

/**
 * Thrown when the output of a time series has to be typed from a sample
 * record but the backing collection holds no record at all.
 * 
 * @since 1.0
 */
public class EmptyCollectionException extends QueryExecutionException {
  private static final long serialVersionUID = 8807426114031594361L;

  /** Status reported for an empty collection. */
  public static final int STATUS_CODE = 500;
  
  /** The collection or source identifier. */
  protected final String collection;
  
  /**
   * Default ctor.
   * @param collection The identifier of the empty collection.
   */
  public EmptyCollectionException(final String collection) {
    super("Empty collection " + collection + "!", STATUS_CODE);
    this.collection = collection;
  }
  
  /** @return The identifier of the empty collection. */
  public String getCollection() {
    return collection;
  }
}
