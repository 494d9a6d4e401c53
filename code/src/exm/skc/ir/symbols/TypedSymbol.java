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

import java.util.List;
import java.util.Map;

/**
 * Symbol that has a data type
 */
public abstract class TypedSymbol extends Symbol {
  private DataType datatype;

  protected TypedSymbol(String name, DataType datatype,
                        Visibility visibility, SymbolInterface iface) {
    super(name, visibility, iface);
    assert(datatype != null);
    this.datatype = datatype;
  }

  public DataType getDatatype() {
    return datatype;
  }

  public void setDatatype(DataType datatype) {
    assert(datatype != null);
    this.datatype = datatype;
  }

  @Override
  public List<Symbol> referencedSymbols() {
    return datatype.referencedSymbols();
  }

  @Override
  void remapReferences(Map<Symbol, Symbol> remap) {
    super.remapReferences(remap);
    datatype = datatype.remap(remap);
  }
}
