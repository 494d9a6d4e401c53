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
package exm.skc.common.util;

/**
 * Three-valued logic for questions that can't always be decided,
 * e.g. comparisons of symbolic expressions.
 */
public enum Ternary {
  TRUE,
  FALSE,
  MAYBE;

  public static Ternary fromBoolean(boolean b) {
    return b ? TRUE : FALSE;
  }

  public boolean isTrue() {
    return this == TRUE;
  }

  public boolean isFalse() {
    return this == FALSE;
  }

  public Ternary not() {
    switch (this) {
      case TRUE:
        return FALSE;
      case FALSE:
        return TRUE;
      default:
        return MAYBE;
    }
  }

  public Ternary and(Ternary other) {
    if (this == FALSE || other == FALSE) {
      return FALSE;
    } else if (this == TRUE && other == TRUE) {
      return TRUE;
    }
    return MAYBE;
  }

  public Ternary or(Ternary other) {
    if (this == TRUE || other == TRUE) {
      return TRUE;
    } else if (this == FALSE && other == FALSE) {
      return FALSE;
    }
    return MAYBE;
  }
}
