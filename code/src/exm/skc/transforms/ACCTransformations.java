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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import exm.skc.common.exceptions.TransformationError;
import exm.skc.common.util.Result;
import exm.skc.ir.access.Signature;
import exm.skc.ir.access.VariablesAccessInfo;
import exm.skc.ir.tree.Directives.ACCEnterDataDirective;
import exm.skc.ir.tree.Directives.ACCKernelsDirective;
import exm.skc.ir.tree.Directives.ACCLoopDirective;
import exm.skc.ir.tree.Directives.ACCParallelDirective;
import exm.skc.ir.tree.Directives.Family;
import exm.skc.ir.tree.Directives.OMPDoDirective;
import exm.skc.ir.tree.Directives.OMPMasterDirective;
import exm.skc.ir.tree.Directives.OMPParallelDirective;
import exm.skc.ir.tree.Directives.OMPSingleDirective;
import exm.skc.ir.tree.Directives.OMPTaskDirective;
import exm.skc.ir.tree.Directives.OMPTaskloopDirective;
import exm.skc.ir.tree.Directives.RegionDirective;
import exm.skc.ir.tree.Directives.RegionType;
import exm.skc.ir.tree.IRTree.CodeBlock;
import exm.skc.ir.tree.IRTree.Schedule;
import exm.skc.ir.tree.IRTree.Statement;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;
import exm.skc.symbolic.SymbolicMaths;

/**
 * OpenACC transformations
 */
public class ACCTransformations {

  @SuppressWarnings("unchecked")
  private static final List<Class<? extends Node>> NOT_IN_ACC_REGION =
      Arrays.<Class<? extends Node>>asList(CodeBlock.class,
          OMPParallelDirective.class, OMPDoDirective.class,
          OMPSingleDirective.class, OMPMasterDirective.class,
          OMPTaskloopDirective.class, OMPTaskDirective.class);

  public static final String DEFAULT_PRESENT = "default_present";

  /**
   * Common checks for parallel and kernels regions, which both run
   * on the device and so can't be nested in each other.
   */
  private static abstract class DeviceRegionTrans extends RegionTrans {

    protected DeviceRegionTrans() {
      super(DEFAULT_PRESENT);
    }

    @Override
    protected List<Class<? extends Node>> excludedNodeTypes() {
      return NOT_IN_ACC_REGION;
    }

    protected abstract Statement build(List<Statement> body,
                                       boolean defaultPresent);

    @Override
    protected Result<Wrapper, TransformationError> prepare(
                    List<Statement> nodes, TransformOptions options) {
      final boolean defaultPresent;
      try {
        defaultPresent = options.getBoolean(getName(), DEFAULT_PRESENT,
                                            false);
      } catch (TransformationError e) {
        return Result.error(e);
      }
      if (enclosingRegion(nodes.get(0), Family.ACC,
                          RegionType.PARALLEL) != null) {
        return fail("Cannot create an OpenACC region inside another " +
                    "OpenACC parallel or kernels region");
      }
      if (containedRegion(nodes, Family.ACC, RegionType.PARALLEL) != null) {
        return fail("The region already contains an OpenACC parallel or " +
                    "kernels region");
      }
      Wrapper w = new Wrapper() {
        @Override
        public Statement wrap() {
          return build(NO_STATEMENTS, defaultPresent);
        }
      };
      return Result.ok(w);
    }
  }

  public static class ACCParallelTrans extends DeviceRegionTrans {
    @Override
    public String getName() {
      return "ACCParallelTrans";
    }

    @Override
    protected Statement build(List<Statement> body,
                              boolean defaultPresent) {
      return ACCParallelDirective.create(NO_STATEMENTS, defaultPresent);
    }
  }

  public static class ACCKernelsTrans extends DeviceRegionTrans {
    @Override
    public String getName() {
      return "ACCKernelsTrans";
    }

    @Override
    protected Statement build(List<Statement> body,
                              boolean defaultPresent) {
      return ACCKernelsDirective.create(NO_STATEMENTS, defaultPresent);
    }
  }

  /**
   * Marks a loop as independent with "acc loop"
   */
  public static class ACCLoopTrans extends ParallelLoopTrans {

    public ACCLoopTrans() {
      this(SymbolicMaths.get());
    }

    public ACCLoopTrans(SymbolicMaths maths) {
      super(maths);
    }

    @Override
    public String getName() {
      return "ACCLoopTrans";
    }

    @Override
    protected Result<Wrapper, TransformationError> prepare(Loop loop,
                          final int collapse, TransformOptions options) {
      Wrapper w = new Wrapper() {
        @Override
        public Statement wrap() {
          return ACCLoopDirective.create(NO_STATEMENTS, true, collapse);
        }
      };
      return Result.ok(w);
    }
  }

  /**
   * Adds an "enter data" directive at the start of a schedule, copying
   * everything the device regions of the schedule use.
   */
  public static class ACCEnterDataTrans extends BaseTransformation {

    @Override
    public String getName() {
      return "ACCEnterDataTrans";
    }

    @Override
    public void validate(Node node, TransformOptions options)
                                            throws TransformationError {
      checkOptions(options);
      deviceRegions(node).getOrThrow();
    }

    @Override
    public Statement apply(Node node, TransformOptions options)
                                            throws TransformationError {
      checkOptions(options);
      List<RegionDirective> regions = deviceRegions(node).getOrThrow();
      List<String> vars = new ArrayList<String>(deviceVariables(regions));
      ACCEnterDataDirective enter = new ACCEnterDataDirective(vars);
      node.insertChild(0, enter);
      logger.debug(getName() + ": " + enter.describe());
      return enter;
    }

    private Result<List<RegionDirective>, TransformationError> deviceRegions(
                                                          Node node) {
      if (!(node instanceof Schedule)) {
        return fail("Expected a Schedule but got a node of type '" +
                    node.typeName() + "'");
      }
      if (!node.walkList(ACCEnterDataDirective.class).isEmpty()) {
        return fail("Schedule already has an OpenACC data region, cannot " +
                    "add an enter data directive");
      }
      List<RegionDirective> regions = new ArrayList<RegionDirective>();
      for (RegionDirective d: node.walk(RegionDirective.class)) {
        if (d.family() == Family.ACC &&
            d.regionType() == RegionType.PARALLEL) {
          regions.add(d);
        }
      }
      if (regions.isEmpty()) {
        return fail("Schedule has no OpenACC parallel or kernels regions, " +
                    "there is nothing to copy to the device");
      }
      return Result.ok(regions);
    }

    /**
     * @return names of variables accessed in regions, in order of first
     *        access, without loop variables
     */
    static Set<String> deviceVariables(List<RegionDirective> regions) {
      Set<String> loopVars = new LinkedHashSet<String>();
      Set<String> vars = new LinkedHashSet<String>();
      for (RegionDirective region: regions) {
        for (Loop loop: region.walk(Loop.class)) {
          loopVars.add(loop.getVariable().getName());
        }
        VariablesAccessInfo info = new VariablesAccessInfo(region);
        for (Signature sig: info.getAllSignatures()) {
          vars.add(sig.getVarName());
        }
      }
      vars.removeAll(loopVars);
      return vars;
    }
  }
}
