/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.skc.ir.access;

/**
 * How one occurrence of a variable uses it
 */
public enum AccessType {
  READ,
  WRITE,
  READWRITE,
  /** Nothing is known: treat as read and write */
  UNKNOWN;

  /**
   * @return true if the access may modify the variable
   */
  public boolean isWrite() {
    return this != READ;
  }

  /**
   * @return true if the access may read the variable
   */
  public boolean isRead() {
    return this != WRITE;
  }
}
