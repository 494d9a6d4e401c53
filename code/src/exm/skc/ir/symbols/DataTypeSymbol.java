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
package exm.skc.ir.symbols;

import exm.skc.ir.symbols.SymbolInterface.Local;

/**
 * Symbol naming a derived type
 */
public class DataTypeSymbol extends Symbol {

  public DataTypeSymbol(String name) {
    this(name, Visibility.PUBLIC, new Local());
  }

  public DataTypeSymbol(String name, Visibility visibility,
                        SymbolInterface iface) {
    super(name, visibility, iface);
  }

  @Override
  public DataTypeSymbol copy() {
    return new DataTypeSymbol(getName(), getVisibility(),
                              getInterface().copy());
  }

  @Override
  protected String describe() {
    return "DataTypeSymbol";
  }
}
