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

package exm.skc.common.exceptions;

/**
 * Symbol table violations.  None of these are recoverable: a
 * misresolved symbol would silently corrupt the generated code.
 */
public abstract class SymbolError extends RuntimeException {

  protected SymbolError(String message) {
    super(message);
  }

  /**
   * Name already declared in this table
   */
  public static class NameCollision extends SymbolError {
    public NameCollision(String name, String tableDesc) {
      super("Symbol '" + name + "' is already declared in " + tableDesc);
    }

    private static final long serialVersionUID = 1L;
  }

  /**
   * Name not found in table or any of its ancestors
   */
  public static class NotFound extends SymbolError {
    public NotFound(String message) {
      super(message);
    }

    public static NotFound fromName(String name, String tableDesc) {
      return new NotFound("Could not find '" + name + "' in " + tableDesc +
                          " or any outer scope");
    }

    private static final long serialVersionUID = 1L;
  }

  /**
   * Imported symbol could not be found in the module it is imported from
   */
  public static class UnresolvableImport extends SymbolError {
    public UnresolvableImport(String message) {
      super(message);
    }

    private static final long serialVersionUID = 1L;
  }

  /**
   * Symbol can't be removed while nodes still refer to it
   */
  public static class InUse extends SymbolError {
    public InUse(String message) {
      super(message);
    }

    private static final long serialVersionUID = 1L;
  }

  private static final long serialVersionUID = 1L;
}
