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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.StringUtils;

import exm.skc.common.Settings;
import exm.skc.common.exceptions.InvalidSyntaxException;
import exm.skc.common.exceptions.TransformationError;
import exm.skc.common.util.Result;
import exm.skc.frontend.FortranReader;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.DataType;
import exm.skc.ir.symbols.DataType.StructureRef;
import exm.skc.ir.symbols.SymbolInterface;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.Expressions.Reference;
import exm.skc.ir.tree.Expressions.StructureReference;
import exm.skc.ir.tree.IRTree.Expression;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.Loops.GridLoop;
import exm.skc.ir.tree.Node;
import exm.skc.ir.tree.Statements.Assignment;

/**
 * Replaces the bounds of the grid loops in a routine with expressions
 * in two new variables, istop and jstop, which are set once from the
 * grid of the first field argument at the start of the routine.  The
 * bounds depend on the index offset convention, the field space and the
 * iteration space of each loop.
 */
public class ConstLoopBoundsTrans extends BaseTransformation {

  public static final String OFFSET_NE = "go_offset_ne";
  public static final String OFFSET_SW = "go_offset_sw";
  public static final String OFFSET_ANY = "go_offset_any";
  public static final List<String> SUPPORTED_OFFSETS =
              Arrays.asList(OFFSET_NE, OFFSET_SW, OFFSET_ANY);

  public static final List<String> FIELD_SPACES =
              Arrays.asList("go_ct", "go_cu", "go_cv", "go_cf", "go_every");
  public static final List<String> ITERATION_SPACES =
              Arrays.asList("go_all_pts", "go_internal_pts");
  public static final String INNER = "inner";
  public static final String OUTER = "outer";

  private static final String START_VALUE = "2";

  /**
   * (offset, field space, iteration space, loop type) -> {start, stop}
   * templates with {start} and {stop} placeholders
   */
  private static final Map<List<String>, String[]> BOUNDS =
                                    new HashMap<List<String>, String[]>();

  static {
    bounds(OFFSET_NE, "go_ct", "go_all_pts",
           "{start}-1", "{stop}+1", "{start}-1", "{stop}+1");
    bounds(OFFSET_NE, "go_ct", "go_internal_pts",
           "{start}", "{stop}", "{start}", "{stop}");
    bounds(OFFSET_NE, "go_cu", "go_all_pts",
           "{start}-1", "{stop}", "{start}-1", "{stop}+1");
    bounds(OFFSET_NE, "go_cu", "go_internal_pts",
           "{start}", "{stop}-1", "{start}", "{stop}");
    bounds(OFFSET_NE, "go_cv", "go_all_pts",
           "{start}-1", "{stop}+1", "{start}-1", "{stop}");
    bounds(OFFSET_NE, "go_cv", "go_internal_pts",
           "{start}", "{stop}", "{start}", "{stop}-1");
    bounds(OFFSET_NE, "go_cf", "go_all_pts",
           "{start}-1", "{stop}", "{start}-1", "{stop}");
    bounds(OFFSET_NE, "go_cf", "go_internal_pts",
           "{start}-1", "{stop}-1", "{start}-1", "{stop}-1");

    bounds(OFFSET_SW, "go_ct", "go_all_pts",
           "{start}-1", "{stop}+1", "{start}-1", "{stop}+1");
    bounds(OFFSET_SW, "go_ct", "go_internal_pts",
           "{start}", "{stop}", "{start}", "{stop}");
    bounds(OFFSET_SW, "go_cu", "go_all_pts",
           "{start}-1", "{stop}+1", "{start}-1", "{stop}+1");
    bounds(OFFSET_SW, "go_cu", "go_internal_pts",
           "{start}", "{stop}+1", "{start}", "{stop}");
    bounds(OFFSET_SW, "go_cv", "go_all_pts",
           "{start}-1", "{stop}+1", "{start}-1", "{stop}+1");
    bounds(OFFSET_SW, "go_cv", "go_internal_pts",
           "{start}", "{stop}", "{start}", "{stop}+1");
    bounds(OFFSET_SW, "go_cf", "go_all_pts",
           "{start}-1", "{stop}+1", "{start}-1", "{stop}+1");
    bounds(OFFSET_SW, "go_cf", "go_internal_pts",
           "{start}", "{stop}+1", "{start}", "{stop}+1");

    for (String space: FIELD_SPACES) {
      for (String itSpace: ITERATION_SPACES) {
        bounds(OFFSET_ANY, space, itSpace,
               "{start}-1", "{stop}", "{start}-1", "{stop}");
      }
    }
    for (String offset: SUPPORTED_OFFSETS) {
      for (String itSpace: ITERATION_SPACES) {
        bounds(offset, "go_every", itSpace,
               "{start}-1", "{stop}+1", "{start}-1", "{stop}+1");
      }
    }
  }

  private static void bounds(String offset, String space, String itSpace,
                  String innerStart, String innerStop,
                  String outerStart, String outerStop) {
    BOUNDS.put(Arrays.asList(offset, space, itSpace, INNER),
               new String[] {innerStart, innerStop});
    BOUNDS.put(Arrays.asList(offset, space, itSpace, OUTER),
               new String[] {outerStart, outerStop});
  }

  /**
   * @return start and stop templates, or null if there are none
   */
  static String[] lookupBounds(String offset, String fieldSpace,
                               String iterationSpace, String loopType) {
    return BOUNDS.get(Arrays.asList(offset, fieldSpace, iterationSpace,
                                    loopType));
  }

  @Override
  public String getName() {
    return "ConstLoopBoundsTrans";
  }

  @Override
  public void validate(Node node, TransformOptions options)
                                          throws TransformationError {
    checkOptions(options);
    plan(node).getOrThrow();
  }

  @Override
  public Node apply(Node node, TransformOptions options)
                                          throws TransformationError {
    checkOptions(options);
    Map<GridLoop, String[]> loopBounds = plan(node).getOrThrow();
    Routine routine = (Routine)node;
    SymbolTable table = routine.getSymbolTable();
    DataSymbol field = fieldArgument(routine);

    DataSymbol iStop = table.newSymbol("istop", DataType.INTEGER_TYPE,
                                       new SymbolInterface.Local());
    DataSymbol jStop = table.newSymbol("jstop", DataType.INTEGER_TYPE,
                                       new SymbolInterface.Local());
    routine.insertChild(0, Assignment.create(new Reference(iStop),
        StructureReference.create(field,
                    gridMembers(Settings.GOCEAN_GRID_XSTOP, field))));
    routine.insertChild(1, Assignment.create(new Reference(jStop),
        StructureReference.create(field,
                    gridMembers(Settings.GOCEAN_GRID_YSTOP, field))));

    FortranReader reader = new FortranReader();
    for (Map.Entry<GridLoop, String[]> e: loopBounds.entrySet()) {
      GridLoop loop = e.getKey();
      String stop = loop.getLoopType().equals(INNER) ?
                              iStop.getName() : jStop.getName();
      try {
        loop.getStart().replaceWith(reader.psyirFromExpression(
                        boundText(e.getValue()[0], stop), table));
        loop.getStop().replaceWith(reader.psyirFromExpression(
                        boundText(e.getValue()[1], stop), table));
      } catch (InvalidSyntaxException ex) {
        throw error("Could not create bound expression for " +
                    loop.describe() + ": " + ex.getMessage());
      }
    }
    logger.debug(getName() + ": constant bounds for " + loopBounds.size() +
                 " loop(s) in " + routine.getName());
    return routine;
  }

  /**
   * Look up the bounds of every grid loop without changing anything
   */
  private Result<Map<GridLoop, String[]>, TransformationError> plan(
                                                          Node node) {
    if (!(node instanceof Routine)) {
      return fail("Expected a Routine but got a node of type '" +
                  node.typeName() + "'");
    }
    Routine routine = (Routine)node;
    if (fieldArgument(routine) == null) {
      return fail("Routine '" + routine.getName() + "' has no argument " +
          "of type '" + Settings.get(Settings.GOCEAN_FIELD_TYPE) +
          "' to take the grid bounds from");
    }
    Map<GridLoop, String[]> result = new LinkedHashMap<GridLoop,
                                                          String[]>();
    for (GridLoop loop: routine.walk(GridLoop.class)) {
      String offset = loop.getIndexOffset();
      if (!SUPPORTED_OFFSETS.contains(offset)) {
        return fail(MessageFormat.format("Constant bounds generation not " +
            "implemented for a grid offset of ''{0}''. Supported offsets " +
            "are {1}", offset, SUPPORTED_OFFSETS));
      }
      String[] b = lookupBounds(offset, loop.getFieldSpace(),
                          loop.getIterationSpace(), loop.getLoopType());
      if (b == null) {
        return fail("No loop bounds for field space '" +
            loop.getFieldSpace() + "', iteration space '" +
            loop.getIterationSpace() + "' and loop type '" +
            loop.getLoopType() + "'");
      }
      result.put(loop, b);
    }
    return Result.ok(result);
  }

  /**
   * @return first argument that is a field, or null
   */
  private static DataSymbol fieldArgument(Routine routine) {
    String fieldType = Settings.get(Settings.GOCEAN_FIELD_TYPE);
    for (DataSymbol arg: routine.getSymbolTable().getArgumentList()) {
      if (arg.getDatatype() instanceof StructureRef &&
          ((StructureRef)arg.getDatatype()).getTypeName()
                                      .equalsIgnoreCase(fieldType)) {
        return arg;
      }
    }
    return null;
  }

  /**
   * Members after the field name in a grid property template
   */
  private static List<String> gridMembers(String key, DataSymbol field) {
    String path = MessageFormat.format(Settings.get(key), field.getName());
    List<String> parts = Arrays.asList(path.split("%"));
    return new ArrayList<String>(parts.subList(1, parts.size()));
  }

  static String boundText(String template, String stop) {
    String text = StringUtils.replaceEach(template,
                      new String[] {"{start}", "{stop}"},
                      new String[] {START_VALUE, stop});
    text = StringUtils.deleteWhitespace(text);
    if (text.equals(START_VALUE + "-1")) {
      return "1";
    }
    return text;
  }
}
