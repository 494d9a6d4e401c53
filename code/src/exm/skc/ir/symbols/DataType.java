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

import exm.skc.common.exceptions.SKCRuntimeError;
import exm.skc.ir.tree.IRTree.Expression;
import exm.skc.ir.tree.Node;

/**
 * Data types that a symbol can be declared with.
 */
public abstract class DataType {

  public abstract boolean isScalar();

  public boolean isArray() {
    return false;
  }

  /**
   * @param remap symbols to replace, e.g. when a symbol table is copied
   * @return this type with references to symbols in remap replaced,
   *         or this if nothing needed changing
   */
  public DataType remap(Map<Symbol, Symbol> remap) {
    return this;
  }

  /**
   * @return symbols this type is declared in terms of, e.g. a kind
   *         parameter or the derived type
   */
  public List<Symbol> referencedSymbols() {
    return Collections.emptyList();
  }

  public static enum Intrinsic {
    INTEGER,
    REAL,
    BOOLEAN,
    CHARACTER;
  }

  public static enum Precision {
    SINGLE,
    DOUBLE,
    UNDEFINED;
  }

  public static final ScalarType INTEGER_TYPE =
                    new ScalarType(Intrinsic.INTEGER, Precision.UNDEFINED);
  public static final ScalarType REAL_TYPE =
                    new ScalarType(Intrinsic.REAL, Precision.UNDEFINED);
  public static final ScalarType BOOLEAN_TYPE =
                    new ScalarType(Intrinsic.BOOLEAN, Precision.UNDEFINED);
  public static final ScalarType CHARACTER_TYPE =
                    new ScalarType(Intrinsic.CHARACTER, Precision.UNDEFINED);
  public static final ScalarType REAL_DOUBLE_TYPE =
                    new ScalarType(Intrinsic.REAL, Precision.DOUBLE);

  /**
   * Intrinsic type with a precision.  The precision is either
   * one of the generic {@link Precision} values, an explicit
   * kind number, or a symbol holding the kind, e.g. wp.
   */
  public static class ScalarType extends DataType {
    private final Intrinsic intrinsic;
    private final Precision precision;
    private final Integer kind;
    private final DataSymbol kindSymbol;

    public ScalarType(Intrinsic intrinsic, Precision precision) {
      this(intrinsic, precision, null, null);
    }

    public ScalarType(Intrinsic intrinsic, int kind) {
      this(intrinsic, null, kind, null);
    }

    public ScalarType(Intrinsic intrinsic, DataSymbol kindSymbol) {
      this(intrinsic, null, null, kindSymbol);
    }

    private ScalarType(Intrinsic intrinsic, Precision precision,
                       Integer kind, DataSymbol kindSymbol) {
      assert(intrinsic != null);
      this.intrinsic = intrinsic;
      this.precision = precision;
      this.kind = kind;
      this.kindSymbol = kindSymbol;
    }

    public Intrinsic getIntrinsic() {
      return intrinsic;
    }

    /**
     * @return generic precision, or null if given by kind or kind symbol
     */
    public Precision getPrecision() {
      return precision;
    }

    public Integer getKind() {
      return kind;
    }

    public DataSymbol getKindSymbol() {
      return kindSymbol;
    }

    @Override
    public boolean isScalar() {
      return true;
    }

    @Override
    public List<Symbol> referencedSymbols() {
      if (kindSymbol == null) {
        return Collections.emptyList();
      }
      return Collections.<Symbol>singletonList(kindSymbol);
    }

    @Override
    public DataType remap(Map<Symbol, Symbol> remap) {
      if (kindSymbol != null && remap.containsKey(kindSymbol)) {
        return new ScalarType(intrinsic,
                              (DataSymbol)remap.get(kindSymbol));
      }
      return this;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof ScalarType)) {
        return false;
      }
      ScalarType other = (ScalarType)o;
      if (intrinsic != other.intrinsic || precision != other.precision) {
        return false;
      }
      if (kind == null ? other.kind != null : !kind.equals(other.kind)) {
        return false;
      }
      if (kindSymbol == null) {
        return other.kindSymbol == null;
      }
      return other.kindSymbol != null &&
          kindSymbol.getName().equalsIgnoreCase(other.kindSymbol.getName());
    }

    @Override
    public int hashCode() {
      return intrinsic.hashCode() * 31 +
          (precision == null ? 0 : precision.hashCode());
    }

    @Override
    public String toString() {
      String prec;
      if (precision != null) {
        prec = precision.toString();
      } else if (kind != null) {
        prec = kind.toString();
      } else {
        prec = kindSymbol.getName();
      }
      return "Scalar<" + intrinsic + ", " + prec + ">";
    }
  }

  /**
   * Reference to a derived type, via the symbol naming it
   */
  public static class StructureRef extends DataType {
    private final DataTypeSymbol typeSymbol;

    public StructureRef(DataTypeSymbol typeSymbol) {
      this.typeSymbol = typeSymbol;
    }

    public DataTypeSymbol getTypeSymbol() {
      return typeSymbol;
    }

    public String getTypeName() {
      return typeSymbol.getName();
    }

    @Override
    public boolean isScalar() {
      return false;
    }

    @Override
    public List<Symbol> referencedSymbols() {
      return Collections.<Symbol>singletonList(typeSymbol);
    }

    @Override
    public DataType remap(Map<Symbol, Symbol> remap) {
      if (remap.containsKey(typeSymbol)) {
        return new StructureRef((DataTypeSymbol)remap.get(typeSymbol));
      }
      return this;
    }

    @Override
    public String toString() {
      return "Structure<" + typeSymbol.getName() + ">";
    }
  }

  public static class ArrayType extends DataType {
    private final DataType elementType;
    private final List<Extent> shape;

    public ArrayType(DataType elementType, List<Extent> shape) {
      if (elementType instanceof ArrayType) {
        throw new SKCRuntimeError("Array of arrays not supported: " +
                                  elementType);
      }
      if (shape.isEmpty()) {
        throw new SKCRuntimeError("Array must have at least one dimension");
      }
      this.elementType = elementType;
      this.shape = Collections.unmodifiableList(new ArrayList<Extent>(shape));
    }

    public DataType getElementType() {
      return elementType;
    }

    public List<Extent> getShape() {
      return shape;
    }

    public int getRank() {
      return shape.size();
    }

    @Override
    public boolean isScalar() {
      return false;
    }

    @Override
    public boolean isArray() {
      return true;
    }

    @Override
    public List<Symbol> referencedSymbols() {
      List<Symbol> result = new ArrayList<Symbol>(
                                  elementType.referencedSymbols());
      for (Extent e: shape) {
        if (e.getKind() == ExtentKind.BOUNDS) {
          addReferences(e.getLower(), result);
          addReferences(e.getUpper(), result);
        }
      }
      return result;
    }

    @Override
    public DataType remap(Map<Symbol, Symbol> remap) {
      List<Extent> newShape = new ArrayList<Extent>();
      for (Extent e: shape) {
        newShape.add(e.remap(remap));
      }
      return new ArrayType(elementType.remap(remap), newShape);
    }

    @Override
    public String toString() {
      return "Array<" + elementType + ", shape=" + shape + ">";
    }
  }

  static void addReferences(Expression e, List<Symbol> result) {
    for (Node n: e.walk(Node.class)) {
      result.addAll(n.referencedSymbols());
    }
  }

  public static enum ExtentKind {
    /** Allocatable, shape unknown until allocated: (:) */
    DEFERRED,
    /** Shape taken from the actual argument: (:) on a dummy argument */
    ATTRIBUTE,
    /** Explicit lower and upper bound */
    BOUNDS;
  }

  /**
   * One dimension of an array shape.  Bound expressions are detached
   * trees owned by the extent.
   */
  public static class Extent {
    private final ExtentKind kind;
    private final Expression lower;
    private final Expression upper;

    private Extent(ExtentKind kind, Expression lower, Expression upper) {
      this.kind = kind;
      this.lower = lower;
      this.upper = upper;
    }

    public static final Extent DEFERRED = new Extent(ExtentKind.DEFERRED,
                                                     null, null);
    public static final Extent ATTRIBUTE = new Extent(ExtentKind.ATTRIBUTE,
                                                      null, null);

    public static Extent bounds(Expression lower, Expression upper) {
      if (lower.parent() != null || upper.parent() != null) {
        throw new SKCRuntimeError("Array bounds must be detached expressions");
      }
      return new Extent(ExtentKind.BOUNDS, lower, upper);
    }

    public ExtentKind getKind() {
      return kind;
    }

    /**
     * @return lower bound, or null if not explicit
     */
    public Expression getLower() {
      return lower;
    }

    public Expression getUpper() {
      return upper;
    }

    Extent remap(Map<Symbol, Symbol> remap) {
      if (kind != ExtentKind.BOUNDS) {
        return this;
      }
      return new Extent(kind, copyBound(lower, remap),
                        copyBound(upper, remap));
    }

    private static Expression copyBound(Expression e,
                                        Map<Symbol, Symbol> remap) {
      Expression copy = (Expression)e.copy();
      for (Node n: copy.walk(Node.class)) {
        n.rebindSymbols(remap);
      }
      return copy;
    }

    @Override
    public String toString() {
      if (kind == ExtentKind.BOUNDS) {
        return lower + ":" + upper;
      }
      return kind.toString();
    }
  }

  /**
   * Type not known yet, e.g. for a symbol imported from a module
   * that hasn't been resolved
   */
  public static class DeferredType extends DataType {
    private DeferredType() {}

    @Override
    public boolean isScalar() {
      return false;
    }

    @Override
    public String toString() {
      return "DeferredType";
    }
  }

  public static final DeferredType DEFERRED_TYPE = new DeferredType();

  /**
   * Absence of a type, e.g. return type of a subroutine
   */
  public static class NoType extends DataType {
    private NoType() {}

    @Override
    public boolean isScalar() {
      return false;
    }

    @Override
    public String toString() {
      return "NoType";
    }
  }

  public static final NoType NO_TYPE = new NoType();
}
