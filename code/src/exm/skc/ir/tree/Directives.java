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
package exm.skc.ir.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;

import exm.skc.common.exceptions.VisitorError;
import exm.skc.ir.access.AccessType;
import exm.skc.ir.access.Signature;
import exm.skc.ir.access.SingleVariableAccessInfo;
import exm.skc.ir.access.VariablesAccessInfo;
import exm.skc.ir.symbols.DataSymbol;
import exm.skc.ir.symbols.Symbol;
import exm.skc.ir.symbols.SymbolTable;
import exm.skc.ir.tree.IRTree.Schedule;
import exm.skc.ir.tree.IRTree.Statement;
import exm.skc.ir.tree.Loops.Loop;

/**
 * Directive nodes.  The text of a directive is without the sentinel,
 * e.g. "omp do schedule(static)"; backends add "!$".
 */
public class Directives {

  /** Programming model a directive belongs to */
  public static enum Family {
    OMP, ACC;
  }

  /** What a region directive does to the code in it */
  public static enum RegionType {
    /** Code runs on many threads or on the device */
    PARALLEL,
    /** Code runs on one thread of a parallel region */
    SERIAL,
    /** Iterations of the loop are shared out */
    LOOP,
    /** Code runs as a deferred task */
    TASK;
  }

  /**
   * Directive with a body.  The only child is the body schedule.
   */
  public static abstract class RegionDirective extends Statement {

    protected RegionDirective() {
    }

    protected void fill(List<? extends Statement> body) {
      addChild(Schedule.create(body));
    }

    public abstract Family family();

    public abstract RegionType regionType();

    /**
     * @return text of the opening directive
     */
    public abstract String beginText();

    /**
     * @return text of the closing directive, or null if there is none
     */
    public abstract String endText();

    public Schedule getBody() {
      return (Schedule)getChild(0);
    }

    @Override
    public NodeKind kind() {
      return NodeKind.REGION_DIRECTIVE;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitRegionDirective(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return position == 0 && Schedule.isBody(child);
    }

    @Override
    protected int minChildren() {
      return 1;
    }

    @Override
    protected int maxChildren() {
      return 1;
    }

    @Override
    protected String childrenFormat() {
      return "Schedule";
    }

    @Override
    protected boolean sameAttributes(Node other) {
      return beginText().equals(((RegionDirective)other).beginText());
    }

    @Override
    public String describe() {
      return typeName() + "[" + beginText() + "]";
    }
  }

  /**
   * Directive without a body
   */
  public static abstract class StandaloneDirective extends Statement {

    public abstract Family family();

    public abstract String text();

    @Override
    public NodeKind kind() {
      return NodeKind.STANDALONE_DIRECTIVE;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitStandaloneDirective(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return false;
    }

    @Override
    protected int maxChildren() {
      return 0;
    }

    @Override
    protected String childrenFormat() {
      return "<LeafNode>";
    }

    @Override
    protected boolean sameAttributes(Node other) {
      return text().equals(((StandaloneDirective)other).text());
    }

    @Override
    public String describe() {
      return typeName() + "[" + text() + "]";
    }
  }

  /* ---- OpenMP ---- */

  public static class OMPParallelDirective extends RegionDirective {

    public static OMPParallelDirective create(
                                  List<? extends Statement> body) {
      OMPParallelDirective d = new OMPParallelDirective();
      d.fill(body);
      return d;
    }

    /**
     * Variables each thread needs its own copy of: loop variables, and
     * scalars whose first access in the region is a write.
     * @return sorted, lower case names
     */
    public List<String> getPrivateVariables() {
      SortedSet<String> result = new TreeSet<String>();
      for (Loop loop: walk(Loop.class)) {
        result.add(loop.getVariable().getName().toLowerCase());
      }
      SymbolTable table = scope();
      VariablesAccessInfo info = new VariablesAccessInfo(getBody());
      for (Signature sig: info.getAllSignatures()) {
        if (sig.isStructure()) {
          continue;
        }
        SingleVariableAccessInfo access = info.get(sig);
        if (access.isArray()) {
          continue;
        }
        if (table != null) {
          Symbol sym = table.find(sig.getVarName());
          if (sym instanceof DataSymbol && !((DataSymbol)sym).isScalar()) {
            continue;
          }
        }
        if (access.get(0).getAccessType() == AccessType.WRITE) {
          result.add(sig.getVarName());
        }
      }
      return new ArrayList<String>(result);
    }

    @Override
    public Family family() {
      return Family.OMP;
    }

    @Override
    public RegionType regionType() {
      return RegionType.PARALLEL;
    }

    @Override
    public String beginText() {
      List<String> privates = getPrivateVariables();
      String text = "omp parallel default(shared)";
      if (!privates.isEmpty()) {
        text += ", private(" + StringUtils.join(privates, ",") + ")";
      }
      return text;
    }

    @Override
    public String endText() {
      return "omp end parallel";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new OMPParallelDirective();
    }
  }

  public static class OMPDoDirective extends RegionDirective {
    private final String schedule;
    /** 0 for no collapse clause */
    private final int collapse;
    private final boolean reprod;

    public OMPDoDirective(String schedule, int collapse, boolean reprod) {
      this.schedule = schedule;
      this.collapse = collapse;
      this.reprod = reprod;
    }

    public static OMPDoDirective create(List<? extends Statement> body,
                          String schedule, int collapse, boolean reprod) {
      OMPDoDirective d = new OMPDoDirective(schedule, collapse, reprod);
      d.fill(body);
      return d;
    }

    public String getSchedule() {
      return schedule;
    }

    public int getCollapse() {
      return collapse;
    }

    /**
     * @return true if reductions must give reproducible results
     */
    public boolean isReprod() {
      return reprod;
    }

    @Override
    public Family family() {
      return Family.OMP;
    }

    @Override
    public RegionType regionType() {
      return RegionType.LOOP;
    }

    @Override
    public String beginText() {
      String text = "omp do schedule(" + schedule + ")";
      if (collapse > 0) {
        text += ", collapse(" + collapse + ")";
      }
      return text;
    }

    @Override
    public String endText() {
      return "omp end do";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new OMPDoDirective(schedule, collapse, reprod);
    }
  }

  public static class OMPSingleDirective extends RegionDirective {
    private final boolean nowait;

    public OMPSingleDirective(boolean nowait) {
      this.nowait = nowait;
    }

    public static OMPSingleDirective create(List<? extends Statement> body,
                                            boolean nowait) {
      OMPSingleDirective d = new OMPSingleDirective(nowait);
      d.fill(body);
      return d;
    }

    public boolean isNowait() {
      return nowait;
    }

    @Override
    public Family family() {
      return Family.OMP;
    }

    @Override
    public RegionType regionType() {
      return RegionType.SERIAL;
    }

    @Override
    public String beginText() {
      return nowait ? "omp single nowait" : "omp single";
    }

    @Override
    public String endText() {
      return "omp end single";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new OMPSingleDirective(nowait);
    }
  }

  public static class OMPMasterDirective extends RegionDirective {

    public static OMPMasterDirective create(List<? extends Statement> body) {
      OMPMasterDirective d = new OMPMasterDirective();
      d.fill(body);
      return d;
    }

    @Override
    public Family family() {
      return Family.OMP;
    }

    @Override
    public RegionType regionType() {
      return RegionType.SERIAL;
    }

    @Override
    public String beginText() {
      return "omp master";
    }

    @Override
    public String endText() {
      return "omp end master";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new OMPMasterDirective();
    }
  }

  public static class OMPTaskloopDirective extends RegionDirective {
    /** 0 if not set */
    private final int grainsize;
    /** 0 if not set */
    private final int numTasks;
    private final boolean nogroup;

    public OMPTaskloopDirective(int grainsize, int numTasks,
                                boolean nogroup) {
      this.grainsize = grainsize;
      this.numTasks = numTasks;
      this.nogroup = nogroup;
    }

    public static OMPTaskloopDirective create(List<? extends Statement> body,
                            int grainsize, int numTasks, boolean nogroup) {
      OMPTaskloopDirective d = new OMPTaskloopDirective(grainsize, numTasks,
                                                        nogroup);
      d.fill(body);
      return d;
    }

    public boolean isNogroup() {
      return nogroup;
    }

    @Override
    public Family family() {
      return Family.OMP;
    }

    @Override
    public RegionType regionType() {
      return RegionType.LOOP;
    }

    @Override
    public String beginText() {
      List<String> clauses = new ArrayList<String>();
      if (grainsize > 0) {
        clauses.add("grainsize(" + grainsize + ")");
      }
      if (numTasks > 0) {
        clauses.add("num_tasks(" + numTasks + ")");
      }
      if (nogroup) {
        clauses.add("nogroup");
      }
      if (clauses.isEmpty()) {
        return "omp taskloop";
      }
      return "omp taskloop " + StringUtils.join(clauses, ", ");
    }

    @Override
    public String endText() {
      return "omp end taskloop";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new OMPTaskloopDirective(grainsize, numTasks, nogroup);
    }
  }

  public static class OMPTaskDirective extends RegionDirective {

    public static OMPTaskDirective create(List<? extends Statement> body) {
      OMPTaskDirective d = new OMPTaskDirective();
      d.fill(body);
      return d;
    }

    @Override
    public Family family() {
      return Family.OMP;
    }

    @Override
    public RegionType regionType() {
      return RegionType.TASK;
    }

    @Override
    public String beginText() {
      return "omp task";
    }

    @Override
    public String endText() {
      return "omp end task";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new OMPTaskDirective();
    }
  }

  /* ---- OpenACC ---- */

  public static class ACCParallelDirective extends RegionDirective {
    private final boolean defaultPresent;

    public ACCParallelDirective(boolean defaultPresent) {
      this.defaultPresent = defaultPresent;
    }

    public static ACCParallelDirective create(List<? extends Statement> body,
                                              boolean defaultPresent) {
      ACCParallelDirective d = new ACCParallelDirective(defaultPresent);
      d.fill(body);
      return d;
    }

    public boolean isDefaultPresent() {
      return defaultPresent;
    }

    @Override
    public Family family() {
      return Family.ACC;
    }

    @Override
    public RegionType regionType() {
      return RegionType.PARALLEL;
    }

    @Override
    public String beginText() {
      return defaultPresent ? "acc parallel default(present)"
                            : "acc parallel";
    }

    @Override
    public String endText() {
      return "acc end parallel";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new ACCParallelDirective(defaultPresent);
    }
  }

  public static class ACCKernelsDirective extends RegionDirective {
    private final boolean defaultPresent;

    public ACCKernelsDirective(boolean defaultPresent) {
      this.defaultPresent = defaultPresent;
    }

    public static ACCKernelsDirective create(List<? extends Statement> body,
                                             boolean defaultPresent) {
      ACCKernelsDirective d = new ACCKernelsDirective(defaultPresent);
      d.fill(body);
      return d;
    }

    public boolean isDefaultPresent() {
      return defaultPresent;
    }

    @Override
    public Family family() {
      return Family.ACC;
    }

    @Override
    public RegionType regionType() {
      return RegionType.PARALLEL;
    }

    @Override
    public String beginText() {
      return defaultPresent ? "acc kernels default(present)"
                            : "acc kernels";
    }

    @Override
    public String endText() {
      return "acc end kernels";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new ACCKernelsDirective(defaultPresent);
    }
  }

  /**
   * acc loop applies to the following loop only, so has no end
   */
  public static class ACCLoopDirective extends RegionDirective {
    private final boolean independent;
    /** 0 for no collapse clause */
    private final int collapse;

    public ACCLoopDirective(boolean independent, int collapse) {
      this.independent = independent;
      this.collapse = collapse;
    }

    public static ACCLoopDirective create(List<? extends Statement> body,
                                   boolean independent, int collapse) {
      ACCLoopDirective d = new ACCLoopDirective(independent, collapse);
      d.fill(body);
      return d;
    }

    public int getCollapse() {
      return collapse;
    }

    @Override
    public Family family() {
      return Family.ACC;
    }

    @Override
    public RegionType regionType() {
      return RegionType.LOOP;
    }

    @Override
    public String beginText() {
      String text = "acc loop";
      if (independent) {
        text += " independent";
      }
      if (collapse > 0) {
        text += " collapse(" + collapse + ")";
      }
      return text;
    }

    @Override
    public String endText() {
      return null;
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new ACCLoopDirective(independent, collapse);
    }
  }

  public static class ACCEnterDataDirective extends StandaloneDirective {
    private final List<String> variables;

    public ACCEnterDataDirective(List<String> variables) {
      this.variables = Collections.unmodifiableList(
                                  new ArrayList<String>(variables));
    }

    public List<String> getVariables() {
      return variables;
    }

    @Override
    public Family family() {
      return Family.ACC;
    }

    @Override
    public String text() {
      return "acc enter data copyin(" + StringUtils.join(variables, ",") + ")";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new ACCEnterDataDirective(variables);
    }
  }

  public static class ACCUpdateDirective extends StandaloneDirective {
    public static enum Direction {
      HOST, DEVICE;
    }

    private final Direction direction;
    private final List<Signature> signatures;
    private final boolean conditional;

    public ACCUpdateDirective(Direction direction,
                      List<Signature> signatures, boolean conditional) {
      this.direction = direction;
      this.signatures = Collections.unmodifiableList(
                                  new ArrayList<Signature>(signatures));
      this.conditional = conditional;
    }

    public Direction getDirection() {
      return direction;
    }

    public List<Signature> getSignatures() {
      return signatures;
    }

    @Override
    public Family family() {
      return Family.ACC;
    }

    @Override
    public String text() {
      StringBuilder sb = new StringBuilder("acc update ");
      if (conditional) {
        sb.append("if_present ");
      }
      sb.append(direction.toString().toLowerCase());
      sb.append('(');
      sb.append(StringUtils.join(signatures, ","));
      sb.append(')');
      return sb.toString();
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new ACCUpdateDirective(direction, signatures, conditional);
    }
  }

  /* ---- extraction ---- */

  /**
   * Region whose inputs are written out before it runs and whose outputs
   * are written out after, through a PSyData object.  The only child
   * is the body schedule.
   */
  public static class ExtractNode extends Statement {
    private final String moduleName;
    private final String regionName;
    private DataSymbol dataSymbol;
    private final List<String> inputs;
    private final List<String> outputs;
    private final String postfix;

    public ExtractNode(String moduleName, String regionName,
                       DataSymbol dataSymbol, List<String> inputs,
                       List<String> outputs, String postfix) {
      this.moduleName = moduleName;
      this.regionName = regionName;
      this.dataSymbol = dataSymbol;
      this.inputs = Collections.unmodifiableList(
                                  new ArrayList<String>(inputs));
      this.outputs = Collections.unmodifiableList(
                                  new ArrayList<String>(outputs));
      this.postfix = postfix;
    }

    public static ExtractNode create(String moduleName, String regionName,
                DataSymbol dataSymbol, List<String> inputs,
                List<String> outputs, String postfix,
                List<? extends Statement> body) {
      ExtractNode n = new ExtractNode(moduleName, regionName, dataSymbol,
                                      inputs, outputs, postfix);
      n.addChild(Schedule.create(body));
      return n;
    }

    public String getModuleName() {
      return moduleName;
    }

    public String getRegionName() {
      return regionName;
    }

    public DataSymbol getDataSymbol() {
      return dataSymbol;
    }

    public List<String> getInputs() {
      return inputs;
    }

    public List<String> getOutputs() {
      return outputs;
    }

    /**
     * @return appended to output names for their values after the region
     */
    public String getPostfix() {
      return postfix;
    }

    public Schedule getBody() {
      return (Schedule)getChild(0);
    }

    @Override
    public List<Symbol> referencedSymbols() {
      return Collections.<Symbol>singletonList(dataSymbol);
    }

    @Override
    public void rebindSymbols(Map<Symbol, Symbol> remap) {
      Symbol newSym = remap.get(dataSymbol);
      if (newSym != null) {
        dataSymbol = (DataSymbol)newSym;
      }
    }

    @Override
    public NodeKind kind() {
      return NodeKind.EXTRACT_REGION;
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) throws VisitorError {
      return visitor.visitExtractNode(this);
    }

    @Override
    protected boolean isValidChild(int position, Node child) {
      return position == 0 && Schedule.isBody(child);
    }

    @Override
    protected int minChildren() {
      return 1;
    }

    @Override
    protected int maxChildren() {
      return 1;
    }

    @Override
    protected String childrenFormat() {
      return "Schedule";
    }

    @Override
    protected Node shallowCopy(Map<Symbol, Symbol> remap) {
      return new ExtractNode(moduleName, regionName, dataSymbol, inputs,
                             outputs, postfix);
    }

    @Override
    protected boolean sameAttributes(Node other) {
      ExtractNode o = (ExtractNode)other;
      return moduleName.equals(o.moduleName) &&
             regionName.equals(o.regionName) &&
             inputs.equals(o.inputs) && outputs.equals(o.outputs) &&
             postfix.equals(o.postfix);
    }

    @Override
    public String describe() {
      return "ExtractNode[" + moduleName + ":" + regionName + "]";
    }
  }
}
