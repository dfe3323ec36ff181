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
package net.satfusion.utils;

/**
 * Wraps the I/O exceptions thrown by Jackson while reading YAML documents.
 * 
 * @since 1.0
 */
public final class YAMLException extends RuntimeException {
  private static final long serialVersionUID = -6118025480234507712L;

  /**
   * Constructor.
   * @param msg The message of the exception.
   */
  public YAMLException(final String msg) {
    super(msg);
  }
  
  /**
   * Constructor.
   * @param cause The exception that caused this one to be thrown.
   */
  public YAMLException(final Throwable cause) {
    super(cause);
  }
  
  /**
   * Constructor.
   * @param msg The message of the exception.
   * @param cause The exception that caused this one to be thrown.
   */
  public YAMLException(final String msg, final Throwable cause) {
    super(msg, cause);
  }
  
}
