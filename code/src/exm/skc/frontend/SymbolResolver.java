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
package exm.skc.frontend;

import exm.skc.common.exceptions.InvalidSyntaxException;
import exm.skc.common.exceptions.SymbolError;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.DataType;
import exm.skc.ir.symbols.DataTypeSymbol;
import exm.skc.ir.symbols.RoutineSymbol;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.symbols.SymbolInterface.Unresolved;
import exm.skc.ir.symbols.SymbolTable;

/**
 * Finds the symbol a name in the source refers to.  Names imported
 * with use ... only: start out as generic symbols and are replaced
 * by a symbol of the right kind the first time the reader sees how
 * they are used.  Names that aren't declared anywhere are added as
 * unresolved symbols to the innermost table.
 */
class SymbolResolver {

  /**
   * @return symbol for name, which may be a generic imported symbol
   */
  static Symbol reference(SymbolTable table, String name)
      throws InvalidSyntaxException {
    Symbol s = table.find(name);
    if (s == null) {
      return table.add(new DataSymbol(name, DataType.DEFERRED_TYPE,
                                      new Unresolved()));
    }
    if (s instanceof RoutineSymbol) {
      throw new InvalidSyntaxException("Function calls are not supported: '"
                                       + name + "'");
    }
    return s;
  }

  static DataSymbol data(SymbolTable table, String name,
                         DataType defaultType)
      throws InvalidSyntaxException {
    Symbol s = table.find(name);
    if (s == null) {
      return table.add(new DataSymbol(name, defaultType, new Unresolved()));
    } else if (s instanceof DataSymbol) {
      return (DataSymbol)s;
    } else if (isGeneric(s)) {
      return specialise(table, s, new DataSymbol(name, defaultType,
                                   s.getVisibility(), s.getInterface()));
    }
    throw new InvalidSyntaxException("'" + name + "' is not a variable");
  }

  static RoutineSymbol routine(SymbolTable table, String name)
      throws InvalidSyntaxException {
    Symbol s = table.find(name);
    if (s == null) {
      return table.add(new RoutineSymbol(name, Symbol.Visibility.PUBLIC,
                                         new Unresolved()));
    } else if (s instanceof RoutineSymbol) {
      return (RoutineSymbol)s;
    } else if (isGeneric(s)) {
      return specialise(table, s, new RoutineSymbol(name,
                             s.getVisibility(), s.getInterface()));
    }
    throw new InvalidSyntaxException("'" + name + "' is not a subroutine");
  }

  static DataTypeSymbol type(SymbolTable table, String name)
      throws InvalidSyntaxException {
    Symbol s = table.find(name);
    if (s == null) {
      return table.add(new DataTypeSymbol(name, Symbol.Visibility.PUBLIC,
                                          new Unresolved()));
    } else if (s instanceof DataTypeSymbol) {
      return (DataTypeSymbol)s;
    } else if (isGeneric(s)) {
      return specialise(table, s, new DataTypeSymbol(name,
                             s.getVisibility(), s.getInterface()));
    }
    throw new InvalidSyntaxException("'" + name + "' is not a type");
  }

  private static boolean isGeneric(Symbol s) {
    return s.getClass() == Symbol.class;
  }

  private static <S extends Symbol> S specialise(SymbolTable table,
                    Symbol generic, S replacement)
      throws InvalidSyntaxException {
    SymbolTable owner = table;
    while (owner != null && owner.findLocal(generic.getName()) != generic) {
      owner = owner.getParentTable();
    }
    assert(owner != null);
    try {
      owner.remove(generic);
    } catch (SymbolError.InUse e) {
      throw new InvalidSyntaxException("'" + generic.getName() +
          "' is used as both a variable and a " +
          replacement.getClass().getSimpleName() + ": " + e.getMessage());
    }
    return owner.add(replacement);
  }
}
