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

import java.io.Closeable;
import java.util.Iterator;

/**
 * A lazy, single pass sequence of dataset chunks. Each call to 
 * {@link #next()} performs the I/O for at most one record. Consumers that
 * stop pulling early must {@link #close()} the iterator to release any 
 * resources held by the producers.
 * 
 * @since 1.0
 */
public interface DatasetIterator extends Iterator<Dataset>, Closeable {

  /**
   * Releases the resources of the iterator. Must not throw.
   */
  @Override
  public void close();
  
}
