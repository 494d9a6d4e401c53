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
package exm.skc.transforms;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.skc.common.exceptions.TransformationError;
import exm.skc.ir.access.Signature;
import exm.skc.ir.symbols.ContainerSymbol;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.DataType;
import exm.skc.ir.symbols.DataType.ArrayType;
import exm.skc.ir.symbols.DataType.Extent;
import exm.skc.ir.symbols.DataType.ScalarType;
import exm.skc.ir.symbols.DataTypeSymbol;
import exm.skc.ir.symbols.RoutineSymbol;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.symbols.Symbol.Visibility;
import exm.skc.ir.symbols.SymbolInterface.Import;
import exm.skc.ir.symbols.SymbolInterface.Local;
import exm.skc.ir.symbols.SymbolInterface.Unresolved;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.Expressions.Literal;
import exm.skc.ir.tree.Expressions.Reference;
import exm.skc.ir.tree.IRTree.CodeBlock;
import exm.skc.ir.tree.IRTree.Expression;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.Statements.Call;

/**
 * Driver that reads the recorded inputs with the ReadKernelData library,
 * calls the extracted routine and compares the outputs against the
 * recorded values with the compare_variables library.
 */
public class ExtractDriverCreator implements DriverCreator {
  public static final String READ_MODULE = "read_kernel_data_mod";
  public static final String READ_TYPE = "ReadKernelDataType";
  public static final String COMPARE_MODULE = "compare_variables_mod";

  private static final String NAME = "ExtractDriverCreator";

  @Override
  public Routine createDriver(ExtractRegion region, Routine extracted,
                  String extractedModule) throws TransformationError {
    Routine driver = new Routine(programName(region), true);
    SymbolTable table = driver.getSymbolTable();
    SymbolTable source = extracted.getSymbolTable();

    ContainerSymbol readMod = table.add(new ContainerSymbol(READ_MODULE));
    DataTypeSymbol readType = table.add(new DataTypeSymbol(READ_TYPE,
                                    Visibility.PUBLIC, new Import(readMod)));
    table.add(new ContainerSymbol(COMPARE_MODULE, true));

    for (String in: region.getInputs()) {
      declareCopy(table, source, in, in);
    }
    for (String out: region.getOutputs()) {
      if (table.findLocal(out) == null) {
        declareCopy(table, source, out, out);
      }
      declareCopy(table, source, out, out + region.getPostfix());
    }
    DataSymbol psyData = table.newSymbol(region.getPrefix() + "_psy_data",
                    new DataType.StructureRef(readType), new Local());

    List<String> reads = new ArrayList<String>();
    reads.add(psyDataCall(psyData, "OpenRead",
              quote(region.getModuleName()) + ", " +
              quote(region.getRegionName())));
    for (String in: region.getInputs()) {
      reads.add(psyDataCall(psyData, "ReadVariable",
                            quote(in) + ", " + in));
    }
    for (String out: region.getOutputs()) {
      String post = out + region.getPostfix();
      reads.add(psyDataCall(psyData, "ReadVariable",
                            quote(post) + ", " + post));
    }
    driver.addChild(new CodeBlock(reads));

    RoutineSymbol routine;
    if (extractedModule != null) {
      Symbol mod = table.findLocal(extractedModule);
      if (!(mod instanceof ContainerSymbol)) {
        mod = table.add(new ContainerSymbol(extractedModule));
      }
      routine = new RoutineSymbol(extracted.getName(), Visibility.PUBLIC,
                                  new Import((ContainerSymbol)mod));
    } else {
      routine = new RoutineSymbol(extracted.getName(), Visibility.PUBLIC,
                                  new Unresolved());
    }
    table.add(routine);
    List<Expression> args = new ArrayList<Expression>();
    for (DataSymbol arg: source.getArgumentList()) {
      args.add(new Reference(table.lookupLocal(arg.getName())));
    }
    driver.addChild(Call.create(routine, args));

    driver.addChild(Call.create(compareRoutine(table, "compare_init"),
        Collections.singletonList(
                Literal.intLiteral(region.getOutputs().size()))));
    for (String out: region.getOutputs()) {
      driver.addChild(Call.create(compareRoutine(table, "compare"),
          Arrays.<Expression>asList(
              new Literal(out, DataType.CHARACTER_TYPE),
              new Reference(table.lookupLocal(out)),
              new Reference(table.lookupLocal(out + region.getPostfix())))));
    }
    driver.addChild(Call.create(compareRoutine(table, "compare_summary"),
                                Collections.<Expression>emptyList()));
    return driver;
  }

  @Override
  public String driverFileName(ExtractRegion region) {
    return "driver-" + region.getModuleName() + "-" +
           region.getRegionName() + ".F90";
  }

  static String programName(ExtractRegion region) {
    return ("driver_" + region.getModuleName() + "_" +
            region.getRegionName()).replaceAll("[^A-Za-z0-9_]", "_");
  }

  /**
   * Declare a local variable in the driver with the type of a variable
   * of the extracted routine.  Arrays become allocatable since the read
   * library allocates them.
   */
  private void declareCopy(SymbolTable table, SymbolTable source,
          String varName, String newName) throws TransformationError {
    if (Signature.parse(varName).isStructure()) {
      throw new TransformationError(NAME, "Structure access '" + varName +
                            "' is not supported in a driver");
    }
    Symbol s = source.findLocal(varName);
    if (!(s instanceof DataSymbol)) {
      throw new TransformationError(NAME, "Variable '" + varName +
          "' is not declared in the extracted routine");
    }
    DataType type = ((DataSymbol)s).getDatatype();
    table.declare(newName, driverType(table, varName, type), new Local());
  }

  private DataType driverType(SymbolTable table, String varName,
                        DataType type) throws TransformationError {
    if (type instanceof ArrayType) {
      ArrayType at = (ArrayType)type;
      return new ArrayType(driverType(table, varName, at.getElementType()),
                           Collections.nCopies(at.getRank(), Extent.DEFERRED));
    }
    if (!(type instanceof ScalarType)) {
      throw new TransformationError(NAME, "Cannot declare '" + varName +
                          "' of type " + type + " in a driver");
    }
    ScalarType st = (ScalarType)type;
    if (st.getKindSymbol() == null) {
      return st;
    }
    return new ScalarType(st.getIntrinsic(),
                          kindSymbol(table, st.getKindSymbol()));
  }

  /**
   * Make a kind parameter available in the driver, either imported from
   * the same module or as a copy of a constant
   */
  private DataSymbol kindSymbol(SymbolTable table, DataSymbol kind)
                                            throws TransformationError {
    Symbol existing = table.findLocal(kind.getName());
    if (existing instanceof DataSymbol) {
      return (DataSymbol)existing;
    }
    if (kind.isImport()) {
      String modName = ((Import)kind.getInterface()).getContainer().getName();
      Symbol mod = table.findLocal(modName);
      if (mod == null) {
        mod = table.add(new ContainerSymbol(modName));
      }
      return table.add(new DataSymbol(kind.getName(), kind.getDatatype(),
              Visibility.PUBLIC, new Import((ContainerSymbol)mod)));
    } else if (kind.isConstant()) {
      DataSymbol copy = kind.copy();
      copy.setInterface(new Local());
      return table.add(copy);
    }
    throw new TransformationError(NAME, "Kind '" + kind.getName() +
        "' is neither imported nor a constant, cannot use it in a driver");
  }

  private static RoutineSymbol compareRoutine(SymbolTable table,
                                              String routineName) {
    Symbol s = table.findLocal(routineName);
    if (s instanceof RoutineSymbol) {
      return (RoutineSymbol)s;
    }
    return table.add(new RoutineSymbol(routineName, Visibility.PUBLIC,
                                       new Unresolved()));
  }

  private static String psyDataCall(DataSymbol obj, String method,
                                    String args) {
    return "call " + obj.getName() + "%" + method + "(" + args + ")";
  }

  private static String quote(String s) {
    return "\"" + s + "\"";
  }
}
