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

import exm.skc.common.exceptions.TransformationError;
import exm.skc.ir.tree.IRTree.Routine;

/**
 * Creates a stand-alone program that replays an extracted region from
 * the data recorded when it ran
 */
public interface DriverCreator {

  /**
   * @param region the extracted region
   * @param extracted routine holding a copy of the region, with the
   *        inputs and outputs as arguments
   * @param extractedModule module the routine is in, or null
   * @return the driver program
   * @throws TransformationError if no driver can be made for the region
   */
  public Routine createDriver(ExtractRegion region, Routine extracted,
                    String extractedModule) throws TransformationError;

  /**
   * @return name of the file to write the driver for region to
   */
  public String driverFileName(ExtractRegion region);
}
