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
import java.util.List;

import exm.skc.common.Settings;
import exm.skc.common.exceptions.TransformationError;
import exm.skc.common.util.Result;
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
import exm.skc.ir.tree.Directives.RegionType;
import exm.skc.ir.tree.IRTree.CodeBlock;
import exm.skc.ir.tree.IRTree.Statement;
import exm.skc.ir.tree.Loops.Loop;
import exm.skc.ir.tree.Node;
import exm.skc.symbolic.SymbolicMaths;

/**
 * OpenMP transformations
 */
public class OMPTransformations {

  @SuppressWarnings("unchecked")
  private static final List<Class<? extends Node>> NOT_IN_OMP_REGION =
      Arrays.<Class<? extends Node>>asList(CodeBlock.class,
          ACCParallelDirective.class, ACCKernelsDirective.class,
          ACCLoopDirective.class);

  /**
   * Creates an OpenMP parallel region.  Parallel regions can't be nested.
   */
  public static class OMPParallelTrans extends RegionTrans {

    @Override
    public String getName() {
      return "OMPParallelTrans";
    }

    @Override
    protected List<Class<? extends Node>> excludedNodeTypes() {
      return NOT_IN_OMP_REGION;
    }

    @Override
    protected Result<Wrapper, TransformationError> prepare(
                    List<Statement> nodes, TransformOptions options) {
      if (enclosingRegion(nodes.get(0), Family.OMP,
                          RegionType.PARALLEL) != null) {
        return fail("Cannot create an OpenMP parallel region inside " +
                    "another OpenMP parallel region");
      }
      if (containedRegion(nodes, Family.OMP, RegionType.PARALLEL) != null) {
        return fail("The region already contains an OpenMP parallel " +
                    "region");
      }
      Wrapper w = new Wrapper() {
        @Override
        public Statement wrap() {
          return OMPParallelDirective.create(NO_STATEMENTS);
        }
      };
      return Result.ok(w);
    }
  }

  /**
   * Base for regions executed by one thread of a parallel region
   */
  private static abstract class SerialRegionTrans extends RegionTrans {

    protected SerialRegionTrans(String... optionNames) {
      super(optionNames);
    }

    @Override
    protected List<Class<? extends Node>> excludedNodeTypes() {
      return NOT_IN_OMP_REGION;
    }

    protected abstract Wrapper serialWrapper(TransformOptions options)
                                            throws TransformationError;

    @Override
    protected Result<Wrapper, TransformationError> prepare(
                    List<Statement> nodes, TransformOptions options) {
      if (enclosingRegion(nodes.get(0), Family.OMP,
                          RegionType.SERIAL) != null) {
        return fail("Nodes of type '" + nodes.get(0).typeName() +
            "' are already inside a serial region and cannot be enclosed " +
            "by another one");
      }
      if (containedRegion(nodes, Family.OMP, RegionType.SERIAL) != null) {
        return fail("The region already contains a serial region, " +
                    "serial regions cannot be nested");
      }
      try {
        return Result.ok(serialWrapper(options));
      } catch (TransformationError e) {
        return Result.error(e);
      }
    }
  }

  public static class OMPSingleTrans extends SerialRegionTrans {
    public static final String NOWAIT = "nowait";

    public OMPSingleTrans() {
      super(NOWAIT);
    }

    @Override
    public String getName() {
      return "OMPSingleTrans";
    }

    @Override
    protected Wrapper serialWrapper(TransformOptions options)
                                            throws TransformationError {
      final boolean nowait = options.getBoolean(getName(), NOWAIT, false);
      return new Wrapper() {
        @Override
        public Statement wrap() {
          return OMPSingleDirective.create(NO_STATEMENTS, nowait);
        }
      };
    }
  }

  public static class OMPMasterTrans extends SerialRegionTrans {

    @Override
    public String getName() {
      return "OMPMasterTrans";
    }

    @Override
    protected Wrapper serialWrapper(TransformOptions options) {
      return new Wrapper() {
        @Override
        public Statement wrap() {
          return OMPMasterDirective.create(NO_STATEMENTS);
        }
      };
    }
  }

  /**
   * Wraps one statement in a task.  Code blocks can't be analysed, so
   * they aren't allowed in a task.
   */
  public static class OMPTaskTrans extends RegionTrans {

    @Override
    public String getName() {
      return "OMPTaskTrans";
    }

    @Override
    protected List<Class<? extends Node>> excludedNodeTypes() {
      return new ArrayList<Class<? extends Node>>();
    }

    @Override
    protected Result<Wrapper, TransformationError> prepare(
                    List<Statement> nodes, TransformOptions options) {
      if (nodes.size() != 1) {
        return fail("Can only be applied to a single statement but got " +
                    nodes.size());
      }
      if (!nodes.get(0).walkList(CodeBlock.class).isEmpty()) {
        return fail("OMPTaskDirective cannot be applied to a region " +
                    "containing a code block");
      }
      Wrapper w = new Wrapper() {
        @Override
        public Statement wrap() {
          return OMPTaskDirective.create(NO_STATEMENTS);
        }
      };
      return Result.ok(w);
    }
  }

  /**
   * Shares loop iterations among the threads of a parallel region
   * with "omp do"
   */
  public static class OMPLoopTrans extends ParallelLoopTrans {
    public static final String REPROD = "reprod";

    private final String schedule;

    /**
     * Schedule from {@link Settings#OMP_SCHEDULE}
     */
    public OMPLoopTrans() {
      this(Settings.get(Settings.OMP_SCHEDULE), SymbolicMaths.get());
    }

    /**
     * @param schedule one of {@link Settings#OMP_SCHEDULES}
     * @param maths used by dependency analysis
     */
    public OMPLoopTrans(String schedule, SymbolicMaths maths) {
      super(maths, REPROD);
      if (!Settings.OMP_SCHEDULES.contains(schedule)) {
        throw new IllegalArgumentException("Valid OpenMP schedules are " +
            Settings.OMP_SCHEDULES + " but got '" + schedule + "'");
      }
      this.schedule = schedule;
    }

    public String getSchedule() {
      return schedule;
    }

    @Override
    public String getName() {
      return "OMPLoopTrans";
    }

    @Override
    protected Result<Wrapper, TransformationError> prepare(Loop loop,
                          final int collapse, TransformOptions options) {
      final boolean reprod;
      try {
        reprod = options.getBoolean(getName(), REPROD, false);
      } catch (TransformationError e) {
        return Result.error(e);
      }
      if (reprod && !schedule.equals("static")) {
        return fail("Reproducible reductions need the 'static' schedule " +
                    "but the schedule is '" + schedule + "'");
      }
      Wrapper w = new Wrapper() {
        @Override
        public Statement wrap() {
          return OMPDoDirective.create(NO_STATEMENTS, schedule, collapse, reprod);
        }
      };
      return Result.ok(w);
    }
  }

  /**
   * Turns the iterations of a loop into tasks
   */
  public static class OMPTaskloopTrans extends ParallelLoopTrans {
    public static final String GRAINSIZE = "grainsize";
    public static final String NUM_TASKS = "num_tasks";
    public static final String NOGROUP = "nogroup";

    public OMPTaskloopTrans() {
      this(SymbolicMaths.get());
    }

    public OMPTaskloopTrans(SymbolicMaths maths) {
      super(maths, GRAINSIZE, NUM_TASKS, NOGROUP);
    }

    @Override
    public String getName() {
      return "OMPTaskloopTrans";
    }

    @Override
    protected Result<Wrapper, TransformationError> prepare(Loop loop,
                          int collapse, TransformOptions options) {
      if (collapse > 0) {
        return fail("The 'collapse' option is not supported for taskloops");
      }
      final int grainsize, numTasks;
      final boolean nogroup;
      try {
        grainsize = options.getInt(getName(), GRAINSIZE, 0);
        numTasks = options.getInt(getName(), NUM_TASKS, 0);
        nogroup = options.getBoolean(getName(), NOGROUP, false);
      } catch (TransformationError e) {
        return Result.error(e);
      }
      if (options.has(GRAINSIZE) && options.has(NUM_TASKS)) {
        return fail("The grainsize and num_tasks clauses would both be " +
            "specified for this Taskloop. A maximum of one of these may " +
            "be used");
      }
      if ((options.has(GRAINSIZE) && grainsize < 1) ||
          (options.has(NUM_TASKS) && numTasks < 1)) {
        return fail("The grainsize and num_tasks options must be positive " +
                    "integers");
      }
      Wrapper w = new Wrapper() {
        @Override
        public Statement wrap() {
          return OMPTaskloopDirective.create(NO_STATEMENTS, grainsize, numTasks,
                                             nogroup);
        }
      };
      return Result.ok(w);
    }
  }
}
