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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;

import exm.skc.common.Logging;
import exm.skc.common.Settings;
import exm.skc.common.exceptions.InvalidSyntaxException;
import exm.skc.common.exceptions.InvalidTreeException;
import exm.skc.frontend.SourceLines.Line;
import exm.skc.ir.access.AccessType;
import exm.skc.ir.symbols.ContainerSymbol;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.DataType;
import exm.skc.ir.symbols.DataType.ArrayType;
import exm.skc.ir.symbols.DataType.Extent;
import exm.skc.ir.symbols.DataType.Intrinsic;
import exm.skc.ir.symbols.DataType.ScalarType;
import exm.skc.ir.symbols.DataType.StructureRef;
import exm.skc.ir.symbols.DataTypeSymbol;
import exm.skc.ir.symbols.RoutineSymbol;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.symbols.Symbol.Visibility;
import exm.skc.ir.symbols.SymbolInterface;
import exm.skc.ir.symbols.SymbolInterface.Argument;
import exm.skc.ir.symbols.SymbolInterface.Import;
import exm.skc.ir.symbols.SymbolInterface.Local;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.Expressions.Literal;
import exm.skc.ir.tree.Expressions.Reference;
import exm.skc.ir.tree.IRTree.CodeBlock;
import exm.skc.ir.tree.IRTree.Container;
import exm.skc.ir.tree.IRTree.Expression;
import exm.skc.ir.tree.IRTree.Routine;
import exm.skc.ir.tree.IRTree.Statement;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Statements.Assignment;
import exm.skc.ir.tree.Statements.Call;
import exm.skc.ir.tree.Statements.IfBlock;

/**
 * Lowers a subset of free-form Fortran to the IR.
 *
 * Handles modules, programs and subroutines; use statements, type
 * definitions and typed declarations; assignments, counted do loops,
 * block and single line if statements and calls.  Other executable
 * statements are kept verbatim in code blocks.  Comments, including
 * directives, are dropped.
 */
public class FortranReader {

  public static final String API_NEMO = "nemo";
  public static final String API_GOCEAN = "gocean";

  private static final Logger logger = Logging.getSKCLogger();

  private static final Pattern MODULE = Pattern.compile(
      "module\\s+(\\w+)");
  private static final Pattern PROGRAM = Pattern.compile(
      "program\\s+(\\w+)");
  private static final Pattern SUBROUTINE = Pattern.compile(
      "(?:(?:recursive|pure|elemental)\\s+)*subroutine\\s+(\\w+)\\s*" +
      "(?:\\((.*)\\))?");
  private static final Pattern CONTAINS = Pattern.compile("contains");
  private static final Pattern END_MODULE = Pattern.compile(
      "end(\\s*module(\\s+\\w+)?)?");
  private static final Pattern END_UNIT = Pattern.compile(
      "end(\\s*(subroutine|program)(\\s+\\w+)?)?");

  private static final Pattern USE = Pattern.compile(
      "use\\s+(\\w+)\\s*(,\\s*only\\s*:(.*))?");
  private static final Pattern IMPLICIT = Pattern.compile("implicit\\s.*");
  private static final Pattern TYPE_DEF = Pattern.compile(
      "type\\s*(?:,[^:]*)?::\\s*(\\w+)|type\\s+(\\w+)");
  private static final Pattern END_TYPE = Pattern.compile(
      "end\\s*type(\\s+\\w+)?");
  private static final Pattern ACCESS_STMT = Pattern.compile(
      "(private|public|save)\\s*(?:::\\s*(.*))?");
  private static final Pattern TYPE_SPEC = Pattern.compile(
      "^(?:(integer|real|logical|character|double\\s+precision)\\b|" +
      "type\\s*\\(\\s*(\\w+)\\s*\\))(?![\\w\\s]*=)\\s*");
  private static final Pattern DIMENSION = Pattern.compile(
      "dimension\\s*\\((.*)\\)");
  private static final Pattern INTENT = Pattern.compile(
      "intent\\s*\\(\\s*(in|out|inout|in\\s+out)\\s*\\)");
  private static final Pattern ENTITY = Pattern.compile("(\\w+)\\s*");

  private static final Pattern DO = Pattern.compile(
      "do\\s+(\\w+)\\s*=(.+)");
  private static final Pattern DO_OTHER = Pattern.compile(
      "do(\\s+while\\b.*|\\s*\\(.*|\\s+\\d+.*)?");
  private static final Pattern END_DO = Pattern.compile("end\\s*do");
  private static final Pattern IF = Pattern.compile("if\\s*\\(.*");
  private static final Pattern ELSE_IF = Pattern.compile(
      "else\\s*if\\s*\\(.*");
  private static final Pattern ELSE = Pattern.compile("else");
  private static final Pattern END_IF = Pattern.compile("end\\s*if");
  private static final Pattern BLOCK_END = Pattern.compile(
      "end(\\s*(do|if|subroutine|program|module)(\\s+\\w+)?)?|" +
      "else(\\s*if\\s*\\(.*)?|contains");
  private static final Pattern CALL = Pattern.compile(
      "call\\s+(\\w+)\\s*(\\((.*)\\))?");

  private static final Set<String> IGNORED_ATTRIBUTES = new HashSet<String>();
  static {
    Collections.addAll(IGNORED_ATTRIBUTES, "save", "target", "pointer",
                       "optional", "contiguous", "volatile", "public");
  }

  private final String api;
  private final Map<String, String> loopTypeMapping;

  public FortranReader() {
    this("");
  }

  /**
   * @param api API tag.  With "nemo", loop types are taken from the
   *      loop variable mapping in {@link Settings#NEMO_LOOP_TYPE_MAPPING}
   */
  public FortranReader(String api) {
    this.api = api == null ? "" : api.toLowerCase();
    this.loopTypeMapping = Settings.getMappingUnchecked(
                                      Settings.NEMO_LOOP_TYPE_MAPPING);
  }

  public String getApi() {
    return api;
  }

  /**
   * @param source
   * @return file container holding the program units of the source
   * @throws InvalidSyntaxException
   */
  public Container psyirFromSource(String source)
      throws InvalidSyntaxException {
    SourceLines lines = new SourceLines(source);
    Container file = new Container("");
    while (lines.hasNext()) {
      Line line = lines.next();
      Matcher m;
      if ((m = MODULE.matcher(line.lower)).matches()) {
        readModule(lines, m.group(1), file);
      } else if ((m = PROGRAM.matcher(line.lower)).matches()) {
        readRoutine(lines, m.group(1), true, null, file);
      } else if ((m = SUBROUTINE.matcher(line.lower)).matches()) {
        readRoutine(lines, m.group(1), false, m.group(2), file);
      } else {
        throw new InvalidSyntaxException(line.lineNum,
            "Expected module, program or subroutine but found '" +
            line.text + "'");
      }
    }
    logger.debug("Lowered " + file.numChildren() + " program units");
    return file;
  }

  /**
   * @param text Fortran expression
   * @param table scope for names in the expression.  Undeclared names
   *      are added to it as unresolved symbols
   * @throws InvalidSyntaxException
   */
  public Expression psyirFromExpression(String text, SymbolTable table)
      throws InvalidSyntaxException {
    return new ExprReader(table).parse(text);
  }

  private void readModule(SourceLines lines, String name, Container parent)
      throws InvalidSyntaxException {
    Container module = new Container(name);
    parent.addChild(module);
    readSpecification(lines, module.getSymbolTable(),
                      Collections.<String>emptyList());
    if (lines.hasNext() && CONTAINS.matcher(lines.peek().lower).matches()) {
      lines.next();
      while (lines.hasNext() &&
             !END_MODULE.matcher(lines.peek().lower).matches()) {
        Line line = lines.next();
        Matcher m = SUBROUTINE.matcher(line.lower);
        if (!m.matches()) {
          throw new InvalidSyntaxException(line.lineNum,
              "Expected subroutine in module " + name + " but found '" +
              line.text + "'");
        }
        readRoutine(lines, m.group(1), false, m.group(2), module);
      }
    }
    expectEnd(lines, END_MODULE, "end module " + name);
  }

  private void readRoutine(SourceLines lines, String name, boolean isProgram,
                           String argText, Container parent)
      throws InvalidSyntaxException {
    Routine routine = new Routine(name, isProgram);
    // Attach first so that names resolve in enclosing module
    parent.addChild(routine);
    SymbolTable table = routine.getSymbolTable();

    List<String> argNames = new ArrayList<String>();
    for (String arg: SourceLines.splitTopLevel(argText, ',')) {
      argNames.add(arg.toLowerCase());
    }

    readSpecification(lines, table, argNames);
    for (Statement stmt: readBlock(lines, table, END_UNIT,
                                   "end subroutine " + name)) {
      routine.addChild(stmt);
    }
    expectEnd(lines, END_UNIT, "end subroutine " + name);

    List<DataSymbol> args = new ArrayList<DataSymbol>();
    for (String argName: argNames) {
      Symbol s = table.findLocal(argName);
      if (s == null) {
        s = table.declare(argName, DataType.DEFERRED_TYPE, new Argument());
      } else if (!(s instanceof DataSymbol)) {
        throw new InvalidSyntaxException("Argument '" + argName + "' of " +
                                         name + " is not a variable");
      } else if (!s.isArgument()) {
        s.setInterface(new Argument());
      }
      args.add((DataSymbol)s);
    }
    table.setArgumentList(args);
  }

  private static void expectEnd(SourceLines lines, Pattern end,
                                String expected)
      throws InvalidSyntaxException {
    if (!lines.hasNext()) {
      throw new InvalidSyntaxException(lines.lineNum(),
          "Unexpected end of source, expected '" + expected + "'");
    }
    Line line = lines.next();
    if (!end.matcher(line.lower).matches()) {
      throw new InvalidSyntaxException(line.lineNum, "Expected '" +
                               expected + "' but found '" + line.text + "'");
    }
  }

  /* ---- specification part ---- */

  private void readSpecification(SourceLines lines, SymbolTable table,
                                 List<String> argNames)
      throws InvalidSyntaxException {
    List<String> privateNames = new ArrayList<String>();
    while (lines.hasNext()) {
      Line line = lines.peek();
      Matcher m;
      try {
        if ((m = USE.matcher(line.lower)).matches()) {
          readUse(table, m.group(1), m.group(2) != null, m.group(3));
        } else if (IMPLICIT.matcher(line.lower).matches()) {
          // Implicit typing isn't modelled
        } else if ((m = TYPE_DEF.matcher(line.lower)).matches()) {
          lines.next();
          readTypeDefinition(lines, table,
                             m.group(1) != null ? m.group(1) : m.group(2));
          continue;
        } else if ((m = ACCESS_STMT.matcher(line.lower)).matches()) {
          if (m.group(1).equals("private") && m.group(2) != null) {
            privateNames.addAll(SourceLines.splitTopLevel(m.group(2), ','));
          }
        } else if (TYPE_SPEC.matcher(line.lower).find()) {
          readDeclaration(line.lower, table, argNames);
        } else {
          break;
        }
      } catch (InvalidSyntaxException e) {
        throw new InvalidSyntaxException(line.lineNum, e.getMessage());
      } catch (InvalidTreeException e) {
        throw new InvalidSyntaxException(line.lineNum, e.getMessage());
      }
      lines.next();
    }

    for (String name: privateNames) {
      Symbol s = table.findLocal(name);
      if (s != null) {
        s.setVisibility(Visibility.PRIVATE);
      }
    }
  }

  private void readUse(SymbolTable table, String moduleName,
                       boolean hasOnly, String only)
      throws InvalidSyntaxException {
    Symbol existing = table.findLocal(moduleName);
    ContainerSymbol container;
    if (existing instanceof ContainerSymbol) {
      container = (ContainerSymbol)existing;
    } else if (existing == null) {
      container = table.add(new ContainerSymbol(moduleName, false));
    } else {
      throw new InvalidSyntaxException("'" + moduleName + "' is not " +
                                       "a module");
    }
    if (!hasOnly) {
      container.setWildcardImport(true);
      return;
    }
    for (String name: SourceLines.splitTopLevel(only, ',')) {
      if (name.contains("=>")) {
        throw new InvalidSyntaxException("Renaming in use statements is " +
                                         "not supported: '" + name + "'");
      }
      if (table.findLocal(name) == null) {
        table.add(new Symbol(name, Visibility.PUBLIC,
                             new Import(container)));
      }
    }
  }

  private void readTypeDefinition(SourceLines lines, SymbolTable table,
                                  String name)
      throws InvalidSyntaxException {
    table.add(new DataTypeSymbol(name));
    // Components aren't modelled
    while (lines.hasNext()) {
      if (END_TYPE.matcher(lines.next().lower).matches()) {
        return;
      }
    }
    throw new InvalidSyntaxException(lines.lineNum(),
                                     "Missing 'end type " + name + "'");
  }

  private void readDeclaration(String text, SymbolTable table,
                               List<String> argNames)
      throws InvalidSyntaxException {
    Matcher m = TYPE_SPEC.matcher(text);
    if (!m.find()) {
      throw new InvalidSyntaxException("Invalid declaration '" + text + "'");
    }
    String typeName = m.group(1);
    String rest = text.substring(m.end());

    String kindText = null;
    if (m.group(2) == null && rest.startsWith("(")) {
      int close = SourceLines.matchingParen(rest, 0);
      if (close < 0) {
        throw new InvalidSyntaxException("Unbalanced brackets in '" +
                                         text + "'");
      }
      kindText = rest.substring(1, close).trim();
      rest = rest.substring(close + 1).trim();
    } else if (m.group(2) == null && rest.startsWith("*")) {
      Matcher star = Pattern.compile("\\*\\s*(\\d+)\\s*").matcher(rest);
      if (!star.lookingAt()) {
        throw new InvalidSyntaxException("Invalid type length in '" +
                                         text + "'");
      }
      kindText = star.group(1);
      rest = rest.substring(star.end());
    }
    DataType baseType = baseType(typeName, m.group(2), kindText, table);

    List<String> attributes;
    String entityText;
    int colons = rest.indexOf("::");
    if (colons >= 0) {
      attributes = SourceLines.splitTopLevel(rest.substring(0, colons), ',');
      entityText = rest.substring(colons + 2);
    } else {
      attributes = new ArrayList<String>();
      entityText = rest;
    }

    boolean parameter = false;
    boolean allocatable = false;
    String dimensions = null;
    AccessType intent = null;
    Visibility visibility = Visibility.PUBLIC;
    for (String attr: attributes) {
      Matcher am;
      if (attr.length() == 0 || IGNORED_ATTRIBUTES.contains(attr)) {
        continue;
      } else if (attr.equals("parameter")) {
        parameter = true;
      } else if (attr.equals("allocatable")) {
        allocatable = true;
      } else if (attr.equals("private")) {
        visibility = Visibility.PRIVATE;
      } else if ((am = DIMENSION.matcher(attr)).matches()) {
        dimensions = am.group(1);
      } else if ((am = INTENT.matcher(attr)).matches()) {
        String access = am.group(1).replaceAll("\\s", "");
        intent = access.equals("in") ? AccessType.READ :
                 access.equals("out") ? AccessType.WRITE :
                                        AccessType.READWRITE;
      } else {
        throw new InvalidSyntaxException("Unsupported attribute '" + attr +
                                         "'");
      }
    }

    for (String entity: SourceLines.splitTopLevel(entityText, ',')) {
      Matcher em = ENTITY.matcher(entity);
      if (!em.lookingAt()) {
        throw new InvalidSyntaxException("Invalid declaration of '" +
                                         entity + "'");
      }
      String name = em.group(1);
      String after = entity.substring(em.end());
      String entityDims = dimensions;
      if (after.startsWith("(")) {
        int close = SourceLines.matchingParen(after, 0);
        if (close < 0) {
          throw new InvalidSyntaxException("Unbalanced brackets in '" +
                                           entity + "'");
        }
        entityDims = after.substring(1, close);
        after = after.substring(close + 1).trim();
      }
      String init = null;
      if (after.startsWith("=>")) {
        throw new InvalidSyntaxException("Pointer initialisation is not " +
                                         "supported for '" + name + "'");
      } else if (after.startsWith("=")) {
        init = after.substring(1).trim();
      } else if (after.length() > 0) {
        throw new InvalidSyntaxException("Unexpected '" + after +
                          "' in declaration of '" + name + "'");
      }

      DataType type = baseType;
      if (entityDims != null) {
        type = new ArrayType(baseType, readShape(entityDims, allocatable,
                                                 table));
      }
      SymbolInterface iface;
      if (argNames.contains(name)) {
        iface = intent == null ? new Argument() : new Argument(intent);
      } else if (intent != null) {
        throw new InvalidSyntaxException("'" + name + "' has an intent " +
                                         "but is not an argument");
      } else {
        iface = new Local();
      }

      DataSymbol sym = declare(table, name, type, visibility, iface);
      if (init != null) {
        if (!parameter) {
          throw new InvalidSyntaxException("Initial value for '" + name +
                           "' is only supported for parameters");
        }
        sym.setConstantValue(new ExprReader(table).parse(init));
      }
    }
  }

  /**
   * Names used before their declaration, e.g. an argument that gives
   * the extent of an earlier array, are already in the table as
   * unresolved variables and get their real type here.
   */
  private static DataSymbol declare(SymbolTable table, String name,
              DataType type, Visibility visibility, SymbolInterface iface)
      throws InvalidSyntaxException {
    Symbol existing = table.findLocal(name);
    if (existing == null) {
      return table.add(new DataSymbol(name, type, visibility, iface));
    }
    if (existing instanceof DataSymbol && existing.isUnresolved()) {
      DataSymbol sym = (DataSymbol)existing;
      sym.setDatatype(type);
      sym.setVisibility(visibility);
      sym.setInterface(iface);
      return sym;
    }
    throw new InvalidSyntaxException("'" + name + "' is declared twice");
  }

  private static DataType baseType(String typeName, String derivedName,
                                   String kindText, SymbolTable table)
      throws InvalidSyntaxException {
    if (derivedName != null) {
      DataTypeSymbol typeSymbol = SymbolResolver.type(table, derivedName);
      return new StructureRef(typeSymbol);
    }
    Intrinsic intrinsic;
    if (typeName.startsWith("double")) {
      return DataType.REAL_DOUBLE_TYPE;
    } else if (typeName.equals("integer")) {
      intrinsic = Intrinsic.INTEGER;
    } else if (typeName.equals("real")) {
      intrinsic = Intrinsic.REAL;
    } else if (typeName.equals("logical")) {
      intrinsic = Intrinsic.BOOLEAN;
    } else {
      // Character lengths aren't modelled
      return DataType.CHARACTER_TYPE;
    }
    if (kindText == null) {
      switch (intrinsic) {
        case INTEGER:
          return DataType.INTEGER_TYPE;
        case REAL:
          return DataType.REAL_TYPE;
        default:
          return DataType.BOOLEAN_TYPE;
      }
    }
    String kind = kindText.replaceFirst("^kind\\s*=\\s*", "");
    if (kind.matches("\\d+")) {
      return new ScalarType(intrinsic, Integer.parseInt(kind));
    } else if (kind.matches("\\w+")) {
      return new ScalarType(intrinsic,
              SymbolResolver.data(table, kind, DataType.INTEGER_TYPE));
    }
    throw new InvalidSyntaxException("Unsupported kind '" + kindText + "'");
  }

  private static List<Extent> readShape(String dims, boolean allocatable,
                                        SymbolTable table)
      throws InvalidSyntaxException {
    ExprReader reader = new ExprReader(table);
    List<Extent> shape = new ArrayList<Extent>();
    for (String dim: SourceLines.splitTopLevel(dims, ',')) {
      if (dim.equals(":") || dim.equals("*")) {
        shape.add(allocatable ? Extent.DEFERRED : Extent.ATTRIBUTE);
        continue;
      }
      List<String> bounds = SourceLines.splitTopLevel(dim, ':');
      if (bounds.size() == 1) {
        shape.add(Extent.bounds(Literal.intLiteral(1),
                                reader.parse(bounds.get(0))));
      } else if (bounds.size() == 2 && bounds.get(0).length() > 0 &&
                 bounds.get(1).length() > 0) {
        shape.add(Extent.bounds(reader.parse(bounds.get(0)),
                                reader.parse(bounds.get(1))));
      } else {
        throw new InvalidSyntaxException("Unsupported array extent '" +
                                         dim + "'");
      }
    }
    return shape;
  }

  /* ---- execution part ---- */

  /**
   * Read statements up to, but not including, a line matching end
   */
  private List<Statement> readBlock(SourceLines lines, SymbolTable table,
                                    Pattern end, String expected)
      throws InvalidSyntaxException {
    List<Statement> result = new ArrayList<Statement>();
    while (true) {
      if (!lines.hasNext()) {
        throw new InvalidSyntaxException(lines.lineNum(),
            "Unexpected end of source, expected '" + expected + "'");
      }
      Line line = lines.peek();
      if (end.matcher(line.lower).matches()) {
        return result;
      }
      lines.next();
      try {
        result.add(readStatement(lines, line, table));
      } catch (InvalidTreeException e) {
        throw new InvalidSyntaxException(line.lineNum, e.getMessage());
      }
    }
  }

  private Statement readStatement(SourceLines lines, Line line,
                                  SymbolTable table)
      throws InvalidSyntaxException {
    Matcher m;
    if ((m = DO.matcher(line.lower)).matches()) {
      return readLoop(lines, line, m.group(1), m.start(2), table);
    } else if (DO_OTHER.matcher(line.lower).matches()) {
      throw new InvalidSyntaxException(line.lineNum, "Only counted do " +
                                       "loops are supported: " + line.text);
    } else if (IF.matcher(line.lower).matches()) {
      return readIf(lines, line, line.lower.indexOf('('), table);
    } else if (BLOCK_END.matcher(line.lower).matches()) {
      throw new InvalidSyntaxException(line.lineNum, "Unexpected '" +
                                       line.text + "'");
    }
    return readSimpleStatement(line, line.text, table);
  }

  private Loop readLoop(SourceLines lines, Line line, String varName,
                        int boundsStart, SymbolTable table)
      throws InvalidSyntaxException {
    List<String> bounds = SourceLines.splitTopLevel(
                                  line.text.substring(boundsStart), ',');
    if (bounds.size() < 2 || bounds.size() > 3) {
      throw new InvalidSyntaxException(line.lineNum,
          "Expected start, stop and optional step in '" + line.text + "'");
    }
    DataSymbol variable;
    Expression start, stop, step;
    try {
      variable = SymbolResolver.data(table, varName, DataType.INTEGER_TYPE);
      ExprReader reader = new ExprReader(table);
      start = reader.parse(bounds.get(0));
      stop = reader.parse(bounds.get(1));
      step = bounds.size() == 3 ? reader.parse(bounds.get(2))
                                : Literal.intLiteral(1);
    } catch (InvalidSyntaxException e) {
      throw new InvalidSyntaxException(line.lineNum, e.getMessage());
    }
    List<Statement> body = readBlock(lines, table, END_DO, "end do");
    lines.next();
    return Loop.create(variable, start, stop, step, body,
                       loopType(variable.getName()));
  }

  private String loopType(String varName) {
    if (!api.equals(API_NEMO)) {
      return "";
    }
    String type = loopTypeMapping.get(varName.toLowerCase());
    return type == null ? "" : type;
  }

  /**
   * @param open index of the opening bracket of the condition
   */
  private Statement readIf(SourceLines lines, Line line, int open,
                           SymbolTable table)
      throws InvalidSyntaxException {
    int close = SourceLines.matchingParen(line.lower, open);
    if (close < 0) {
      throw new InvalidSyntaxException(line.lineNum,
          "Unbalanced brackets in '" + line.text + "'");
    }
    Expression condition;
    try {
      condition = new ExprReader(table).parse(
                                line.text.substring(open + 1, close));
    } catch (InvalidSyntaxException e) {
      throw new InvalidSyntaxException(line.lineNum, e.getMessage());
    }
    String rest = line.text.substring(close + 1).trim();
    if (rest.length() == 0) {
      throw new InvalidSyntaxException(line.lineNum,
          "Missing statement after if condition: " + line.text);
    }
    if (!rest.equalsIgnoreCase("then")) {
      List<Statement> body = new ArrayList<Statement>();
      body.add(readSimpleStatement(line, rest, table));
      return IfBlock.create(condition, body);
    }

    Pattern branchEnd = Pattern.compile(ELSE_IF.pattern() + "|" +
                        ELSE.pattern() + "|" + END_IF.pattern());
    List<Statement> ifBody = readBlock(lines, table, branchEnd, "end if");
    Line branch = lines.next();
    List<Statement> elseBody = null;
    if (ELSE_IF.matcher(branch.lower).matches()) {
      elseBody = new ArrayList<Statement>();
      // The nested if shares our end if
      elseBody.add(readIf(lines, branch, branch.lower.indexOf('('), table));
    } else if (ELSE.matcher(branch.lower).matches()) {
      elseBody = readBlock(lines, table, END_IF, "end if");
      lines.next();
    }
    return IfBlock.create(condition, ifBody, elseBody);
  }

  /**
   * Assignment, call or anything else as a code block.  Assignments
   * and calls with expressions the IR can't represent become code
   * blocks too.
   */
  private Statement readSimpleStatement(Line line, String text,
                                        SymbolTable table)
      throws InvalidSyntaxException {
    String lower = SourceLines.lowerOutsideStrings(text);
    Matcher m;
    try {
      if ((m = CALL.matcher(lower)).matches()) {
        ExprReader reader = new ExprReader(table);
        List<Expression> args = new ArrayList<Expression>();
        if (m.group(3) != null) {
          for (String arg: SourceLines.splitTopLevel(
                              text.substring(m.start(3), m.end(3)), ',')) {
            args.add(reader.parse(arg));
          }
        }
        RoutineSymbol routine = SymbolResolver.routine(table, m.group(1));
        return Call.create(routine, args);
      }
      int eq = SourceLines.assignmentEquals(lower);
      if (eq > 0 && Character.isLetter(lower.charAt(0))) {
        ExprReader reader = new ExprReader(table);
        Reference lhs = reader.parseReference(text.substring(0, eq));
        Expression rhs = reader.parse(text.substring(eq + 1));
        return Assignment.create(lhs, rhs);
      }
    } catch (InvalidSyntaxException e) {
      logger.debug("line " + line.lineNum + ": keeping '" + text +
                   "' as a code block: " + e.getMessage());
    }
    return new CodeBlock(Collections.singletonList(text));
  }
}
