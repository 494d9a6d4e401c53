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
package exm.skc;

import org.apache.log4j.Logger;

import exm.skc.backend.CodeWriter;
import exm.skc.common.Logging;
import exm.skc.common.Settings;
import exm.skc.common.exceptions.InvalidSyntaxException;
import exm.skc.common.exceptions.TransformationError;
import exm.skc.common.exceptions.UserException;
import exm.skc.common.exceptions.VisitorError;
import exm.skc.frontend.FortranReader;
import exm.skc.ir.tree.IRTree.Container;
import exm.skc.ir.tree.Node;
import exm.skc.transforms.TransformationPipeline;

/**
 * Entry point to the compiler core: lower source to IR, transform it,
 * then emit it with a backend
 */
public class SKCompiler {

  private final Logger logger;
  private final FortranReader reader;

  /**
   * Log as configured by the skc.log.file and skc.log.trace settings
   */
  public SKCompiler(String api) {
    this(api, Logging.setupLogging(Settings.get(Settings.LOG_FILE),
                          Settings.getBooleanUnchecked(Settings.LOG_TRACE)));
  }

  public SKCompiler(String api, Logger logger) {
    this.logger = logger;
    this.reader = new FortranReader(api);
  }

  public String getApi() {
    return reader.getApi();
  }

  public Container lower(String source) throws InvalidSyntaxException {
    Container root = reader.psyirFromSource(source);
    logger.debug("Lowered " + root.getRoutines().size() + " routine(s)");
    return root;
  }

  public void transform(Node root, TransformationPipeline pipeline)
                                            throws TransformationError {
    logger.debug("Running " + pipeline.getSteps().size() +
                 " transformation step(s)");
    pipeline.run(logger, root);
  }

  public String emit(Node root, CodeWriter writer) throws VisitorError {
    logger.debug("Generating code with " + writer.getName());
    return writer.emit(root);
  }

  /**
   * All three stages in order
   */
  public String compile(String source, TransformationPipeline pipeline,
                        CodeWriter writer) throws UserException {
    logger.info("SKC starting");
    Container root = lower(source);
    transform(root, pipeline);
    String result = emit(root, writer);
    logger.debug("SKC done");
    return result;
  }
}
