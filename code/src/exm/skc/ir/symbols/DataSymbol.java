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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import exm.skc.ir.symbols.DataType.ArrayType;
import exm.skc.ir.symbols.DataType.Extent;
import exm.skc.ir.symbols.SymbolInterface.Local;
import exm.skc.ir.tree.IRTree.Expression;
import exm.skc.ir.tree.Node;

/**
 * Symbol for a variable or named constant
 */
public class DataSymbol extends TypedSymbol {

  /** Value if this is a named constant, as a detached expression */
  private Expression constantValue;

  public DataSymbol(String name, DataType datatype) {
    this(name, datatype, Visibility.PUBLIC, new Local());
  }

  public DataSymbol(String name, DataType datatype, SymbolInterface iface) {
    this(name, datatype, Visibility.PUBLIC, iface);
  }

  public DataSymbol(String name, DataType datatype, Visibility visibility,
                    SymbolInterface iface) {
    super(name, datatype, visibility, iface);
  }

  public boolean isArray() {
    return getDatatype().isArray();
  }

  public boolean isScalar() {
    return getDatatype().isScalar();
  }

  public boolean isConstant() {
    return constantValue != null;
  }

  public Expression getConstantValue() {
    return constantValue;
  }

  /**
   * @param value expression with no parent, or null to clear
   */
  public void setConstantValue(Expression value) {
    if (value != null && value.parent() != null) {
      throw new IllegalArgumentException("Constant value of " + getName() +
                                         " must be a detached expression");
    }
    this.constantValue = value;
  }

  /**
   * @return shape of array, or empty list for scalars
   */
  public List<Extent> getShape() {
    if (getDatatype() instanceof ArrayType) {
      return ((ArrayType)getDatatype()).getShape();
    }
    return Collections.emptyList();
  }

  @Override
  public DataSymbol copy() {
    DataSymbol copy = new DataSymbol(getName(), getDatatype(),
                            getVisibility(), getInterface().copy());
    if (constantValue != null) {
      copy.setConstantValue((Expression)constantValue.copy());
    }
    return copy;
  }

  @Override
  public List<Symbol> referencedSymbols() {
    List<Symbol> result = new ArrayList<Symbol>(super.referencedSymbols());
    if (constantValue != null) {
      DataType.addReferences(constantValue, result);
    }
    return result;
  }

  @Override
  void remapReferences(Map<Symbol, Symbol> remap) {
    super.remapReferences(remap);
    if (constantValue != null) {
      for (Node n: constantValue.walk(Node.class)) {
        n.rebindSymbols(remap);
      }
    }
  }

  @Override
  protected String describe() {
    String desc = "DataSymbol " + getDatatype();
    if (constantValue != null) {
      desc += ", constant_value=" + constantValue;
    }
    return desc;
  }
}
