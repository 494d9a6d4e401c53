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

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.io.FileUtils;

import exm.skc.analysis.DependencyTools;
import exm.skc.analysis.DependencyTools.InOut;
import exm.skc.backend.FortranWriter;
import exm.skc.common.Settings;
import exm.skc.common.exceptions.TransformationError;
import exm.skc.common.exceptions.VisitorError;
import exm.skc.common.util.Result;
import exm.skc.ir.access.AccessType;
import exm.skc.ir.access.Signature;
import exm.skc.ir.symbols.ContainerSymbol;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.DataType.StructureRef;
import exm.skc.ir.symbols.DataTypeSymbol;
import exm.skc.ir.symbols.RoutineSymbol;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.symbols.Symbol.Visibility;
import exm.skc.ir.symbols.SymbolInterface.Argument;
import exm.skc.ir.symbols.SymbolInterface.Import;
import exm.skc.ir.symbols.SymbolInterface.Local;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.Directives.ExtractNode;
import exm.skc.ir.tree.Directives.RegionType;
import exm.skc.ir.tree.IRTree.CodeBlock;
import exm.skc.ir.tree.IRTree.Container;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.IRTree.Statement;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;
import exm.skc.ir.tree.ScopingNode;

/**
 * Wraps a region in an {@link ExtractNode}, so that its inputs are
 * recorded before it runs and its outputs after.  A copy of the region is
 * added as a routine taking the inputs and outputs as arguments, and
 * optionally a driver program is written that replays the region from
 * the recorded data.
 */
public class ExtractTrans extends RegionTrans {
  public static final String CREATE_DRIVER = "create_driver";
  public static final String PREFIX = "prefix";
  public static final String REGION_NAME = "region_name";

  public static final String DEFAULT_PREFIX = "extract";
  public static final String POSTFIX = "_post";
  public static final String COLOURS_LOOP = "colours";

  @SuppressWarnings("unchecked")
  private static final List<Class<? extends Node>> EXCLUDED =
      Arrays.<Class<? extends Node>>asList(CodeBlock.class,
                                           ExtractNode.class);

  private final DriverCreator driverCreator;

  public ExtractTrans() {
    this(new ExtractDriverCreator());
  }

  public ExtractTrans(DriverCreator driverCreator) {
    super(CREATE_DRIVER, PREFIX, REGION_NAME);
    this.driverCreator = driverCreator;
  }

  @Override
  public String getName() {
    return "ExtractTrans";
  }

  @Override
  protected List<Class<? extends Node>> excludedNodeTypes() {
    return EXCLUDED;
  }

  /**
   * Everything the extraction will do, worked out before the tree
   * changes
   */
  private static class Extraction implements Wrapper {
    final ExtractRegion region;
    final Routine routine;
    final Routine extracted;
    final Container container;
    /** Source of the driver, null if not wanted */
    final String driverSource;

    Extraction(ExtractRegion region, Routine routine, Routine extracted,
               Container container, String driverSource) {
      this.region = region;
      this.routine = routine;
      this.extracted = extracted;
      this.container = container;
      this.driverSource = driverSource;
    }

    @Override
    public Statement wrap() {
      if (container != null) {
        container.getSymbolTable().add(new RoutineSymbol(
            extracted.getName(), Visibility.PUBLIC, new Local()));
        container.insertChild(routine.position() + 1, extracted);
      }
      SymbolTable table = routine.getSymbolTable();
      String prefix = region.getPrefix();
      ContainerSymbol mod = (ContainerSymbol)table.findLocal(
                                          prefix + "_psy_data_mod");
      if (mod == null) {
        mod = table.add(new ContainerSymbol(prefix + "_psy_data_mod"));
      }
      DataTypeSymbol type = (DataTypeSymbol)table.findLocal(
                                          prefix + "_PSyDataType");
      if (type == null) {
        type = table.add(new DataTypeSymbol(prefix + "_PSyDataType",
                                  Visibility.PUBLIC, new Import(mod)));
      }
      DataSymbol psyData = table.newSymbol(prefix + "_psy_data",
                                  new StructureRef(type), new Local());
      return ExtractNode.create(region.getModuleName(),
          region.getRegionName(), psyData, region.getInputs(),
          region.getOutputs(), region.getPostfix(), NO_STATEMENTS);
    }
  }

  @Override
  protected Result<Wrapper, TransformationError> prepare(
                  List<Statement> nodes, TransformOptions options) {
    boolean createDriver;
    String prefix;
    String regionOpt;
    try {
      createDriver = options.getBoolean(getName(), CREATE_DRIVER, false);
      prefix = options.getString(getName(), PREFIX, DEFAULT_PREFIX);
      regionOpt = options.getString(getName(), REGION_NAME, null);
    } catch (TransformationError e) {
      return Result.error(e);
    }
    if (!prefix.matches("[A-Za-z][A-Za-z0-9_]*")) {
      return fail("The prefix must be a valid name but got '" + prefix +
                  "'");
    }

    Statement first = nodes.get(0);
    if (first.ancestor(ExtractNode.class) != null) {
      return fail("Extraction of a region which is already inside " +
                  "another extract region is not allowed");
    }
    if (enclosingRegion(first, null, RegionType.PARALLEL) != null) {
      return fail("Extraction of a region inside a parallel region is " +
                  "not allowed");
    }
    for (Statement node: nodes) {
      Loop loop = node.ancestor(Loop.class);
      if (loop != null && COLOURS_LOOP.equals(loop.getLoopType())) {
        return fail("Error in " + getName() + ": Extraction of a Loop " +
            "over cells in a colour without its ancestor Loop over " +
            "colours is not allowed.");
      }
    }
    Routine routine = first.ancestor(Routine.class);
    if (routine == null) {
      return fail("Region to extract is not inside a routine");
    }
    Container container = routine.parent() instanceof Container ?
                          (Container)routine.parent() : null;
    Result<String[], TransformationError> names = regionNames(regionOpt,
                                                    routine, container);
    if (!names.isOk()) {
      return names.propagate();
    }
    Result<Void, TransformationError> free = checkPsyDataNames(
                                  routine.getSymbolTable(), prefix);
    if (!free.isOk()) {
      return free.propagate();
    }

    InOut inOut = new DependencyTools().getInOutParameters(nodes);
    String postfix = ExtractRegion.choosePostfix(inOut.getInputs(),
                                        inOut.getOutputs(), POSTFIX);
    ExtractRegion region = new ExtractRegion(names.get()[0],
        names.get()[1], prefix, inOut.getInputs(), inOut.getOutputs(),
        postfix);
    Routine extracted = extractedRoutine(nodes, routine, container,
                                         region);

    String driverSource = null;
    if (createDriver) {
      try {
        String module = (container != null && !container.isFile()) ?
                        container.getName() : null;
        Routine driver = driverCreator.createDriver(region, extracted,
                                                    module);
        driverSource = new FortranWriter().emit(driver);
      } catch (TransformationError e) {
        return Result.error(e);
      } catch (VisitorError e) {
        return fail("Could not create the driver: " + e.getMessage());
      }
    }
    logger.debug(getName() + ": " + region);
    return Result.<Wrapper, TransformationError>ok(new Extraction(region,
                          routine, extracted, container, driverSource));
  }

  @Override
  protected void beforeReplace(Wrapper wrapper) throws TransformationError {
    Extraction extraction = (Extraction)wrapper;
    if (extraction.driverSource == null) {
      return;
    }
    String dir = Settings.get(Settings.EXTRACT_DRIVER_DIR);
    if (dir == null || dir.isEmpty()) {
      logger.debug(getName() + ": no driver directory set, driver for " +
          extraction.region.getRegionName() + " not written");
      return;
    }
    File file = new File(dir,
                    driverCreator.driverFileName(extraction.region));
    try {
      FileUtils.writeStringToFile(file, extraction.driverSource,
                                  StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw error("Could not write driver to " + file + ": " +
                  e.getMessage());
    }
    logger.debug(getName() + ": wrote driver " + file);
  }

  /**
   * @return module and region name, from the option "module:region" or
   *        from where the region is
   */
  private Result<String[], TransformationError> regionNames(
          String regionOpt, Routine routine, Container container) {
    if (regionOpt != null) {
      String[] parts = regionOpt.split(":", -1);
      if (parts.length != 2 || parts[0].trim().isEmpty() ||
          parts[1].trim().isEmpty()) {
        return fail("The region name must have the form " +
            "'module:region' but got '" + regionOpt + "'");
      }
      return Result.ok(new String[] {parts[0].trim(), parts[1].trim()});
    }
    String module = (container != null && !container.isFile()) ?
                    container.getName() : routine.getName();
    int existing = routine.walkList(ExtractNode.class).size();
    return Result.ok(new String[] {module,
                                   routine.getName() + "-r" + existing});
  }

  /**
   * Names used for the data object must be free or already used for
   * the same purpose
   */
  private Result<Void, TransformationError> checkPsyDataNames(
                                  SymbolTable table, String prefix) {
    Symbol mod = table.findLocal(prefix + "_psy_data_mod");
    if (mod != null && !(mod instanceof ContainerSymbol)) {
      return fail("Cannot import from '" + mod.getName() + "': the name " +
                  "is already used for " + mod);
    }
    Symbol type = table.findLocal(prefix + "_PSyDataType");
    if (type != null && !(type instanceof DataTypeSymbol &&
        type.isImport() && mod != null &&
        ((Import)type.getInterface()).getContainer() == mod)) {
      return fail("Cannot import '" + type.getName() + "': the name is " +
                  "already used for " + type);
    }
    return Result.ok(null);
  }

  /**
   * Copy of the region as a routine whose arguments are the inputs and
   * outputs declared in the enclosing routine.  Not attached to the tree.
   */
  private Routine extractedRoutine(List<Statement> nodes, Routine routine,
                          Container container, ExtractRegion region) {
    Map<Symbol, Symbol> remap = new IdentityHashMap<Symbol, Symbol>();
    SymbolTable table = routine.getSymbolTable().deepCopy(remap);
    List<Statement> body = new ArrayList<Statement>();
    for (Statement s: nodes) {
      Statement copy = (Statement)s.copy();
      for (Node n: copy.walk(Node.class)) {
        n.rebindSymbols(remap);
        if (n instanceof ScopingNode) {
          ((ScopingNode)n).getSymbolTable().remapReferences(remap);
        }
      }
      body.add(copy);
    }

    Set<String> read = varNames(region.getInputs());
    Set<String> written = varNames(region.getOutputs());
    Set<String> all = new LinkedHashSet<String>(read);
    all.addAll(written);
    for (DataSymbol arg: table.getArgumentList()) {
      arg.setInterface(new Local());
    }
    List<DataSymbol> args = new ArrayList<DataSymbol>();
    for (String name: all) {
      Symbol s = table.findLocal(name);
      if (!(s instanceof DataSymbol) || !(s.isLocal() || s.isArgument())) {
        // Comes from elsewhere, e.g. a module variable
        continue;
      }
      AccessType access;
      if (read.contains(name) && written.contains(name)) {
        access = AccessType.READWRITE;
      } else if (written.contains(name)) {
        access = AccessType.WRITE;
      } else {
        access = AccessType.READ;
      }
      s.setInterface(new Argument(access));
      args.add((DataSymbol)s);
    }
    table.setArgumentList(args);
    String name = freeRoutineName(container,
                        routine.getName() + "_" + region.getPrefix());
    return Routine.create(name, table, body);
  }

  private static Set<String> varNames(List<String> signatures) {
    Set<String> names = new LinkedHashSet<String>();
    for (String sig: signatures) {
      names.add(Signature.parse(sig).getVarName());
    }
    return names;
  }

  /**
   * @return root, or root with a number appended, not used by any
   *        routine or symbol of the container
   */
  private static String freeRoutineName(Container container, String root) {
    if (container == null) {
      return root;
    }
    String name = root;
    int i = 1;
    while (container.getSymbolTable().findLocal(name) != null ||
           container.findRoutine(name) != null) {
      name = root + "_" + i;
      i++;
    }
    return name;
  }
}
