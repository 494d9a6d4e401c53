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

package exm.skc.common;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import exm.skc.common.exceptions.InvalidOptionException;
import exm.skc.common.exceptions.SKCRuntimeError;

/**
 * General compiler settings.
 *
 * Defaults are set here and can be overridden by Java system
 * properties (see {@link #initProperties()}) or a properties file
 * (see {@link #load(InputStream)}).
 * */
public class Settings
{
  /** Whether the exact symbolic algebra engine may be used */
  public static final String SYMBOLIC_ALGEBRA = "skc.symbolic.algebra";

  public static final String BACKEND_INDENT = "skc.backend.indent";
  public static final String BACKEND_INITIAL_DEPTH =
                                        "skc.backend.initial-depth";
  /* Emit placeholders for unsupported nodes rather than failing */
  public static final String BACKEND_SKIP_NODES = "skc.backend.skip-nodes";

  /** Loop types that dependency analysis is willing to parallelise */
  public static final String PARALLEL_LOOP_TYPES = "skc.parallel.loop-types";
  /** Mapping of loop variable names to loop types, e.g. ji:lon */
  public static final String NEMO_LOOP_TYPE_MAPPING =
                                        "skc.nemo.loop-type-mapping";

  public static final String GOCEAN_FIELD_TYPE = "skc.gocean.field-type";
  public static final String GOCEAN_GRID_XSTOP = "skc.gocean.grid.xstop";
  public static final String GOCEAN_GRID_YSTOP = "skc.gocean.grid.ystop";

  public static final String OMP_SCHEDULE = "skc.omp.schedule";

  /** Directory extraction drivers are written to.  Empty: don't write */
  public static final String EXTRACT_DRIVER_DIR = "skc.extract.driver-dir";

  /** Run IR validator after every transformation in a pipeline */
  public static final String VALIDATE_IR = "skc.validate-ir";

  public static final String LOG_FILE = "skc.log.file";
  public static final String LOG_TRACE = "skc.log.trace";

  public static final List<String> OMP_SCHEDULES = Collections.unmodifiableList(
      Arrays.asList("static", "dynamic", "guided", "auto", "runtime"));

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    // Set defaults here
    defaults.setProperty(SYMBOLIC_ALGEBRA, "true");
    defaults.setProperty(BACKEND_INDENT, "  ");
    defaults.setProperty(BACKEND_INITIAL_DEPTH, "0");
    defaults.setProperty(BACKEND_SKIP_NODES, "false");
    defaults.setProperty(PARALLEL_LOOP_TYPES, "lat");
    defaults.setProperty(NEMO_LOOP_TYPE_MAPPING,
                         "ji:lon,jj:lat,jk:levels,jt:tracers");
    defaults.setProperty(GOCEAN_FIELD_TYPE, "r2d_field");
    defaults.setProperty(GOCEAN_GRID_XSTOP,
                         "{0}%grid%subdomain%internal%xstop");
    defaults.setProperty(GOCEAN_GRID_YSTOP,
                         "{0}%grid%subdomain%internal%ystop");
    defaults.setProperty(OMP_SCHEDULE, "static");
    defaults.setProperty(EXTRACT_DRIVER_DIR, "");
    defaults.setProperty(VALIDATE_IR, "true");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  /**
   * Overlay settings from a properties file.  Keys we don't know about
   * are rejected so that typos don't go unnoticed.
   * @param in
   * @throws InvalidOptionException
   */
  public static void load(InputStream in) throws InvalidOptionException {
    Properties loaded = new Properties();
    try {
      loaded.load(in);
    } catch (IOException e) {
      throw new InvalidOptionException("Could not read settings: " +
                                       e.getMessage());
    }
    List<String> known = getKeys();
    for (String key: loaded.stringPropertyNames()) {
      if (!known.contains(key)) {
        throw new InvalidOptionException("Unknown setting " + key);
      }
      properties.setProperty(key, loaded.getProperty(key));
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop all overrides, returning to defaults
   */
  public static void reset() {
    properties.clear();
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(SYMBOLIC_ALGEBRA);
    getBoolean(BACKEND_SKIP_NODES);
    getBoolean(VALIDATE_IR);
    getBoolean(LOG_TRACE);
    getInt(BACKEND_INITIAL_DEPTH);
    getMapping(NEMO_LOOP_TYPE_MAPPING);
    checkOneOf(OMP_SCHEDULE, OMP_SCHEDULES);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  /**
   * Throw an exception if the property value for the specified key
   * is not in the set.  We are insensitive to the case
   * @param key
   * @param validVals
   * @throws InvalidOptionException
   */
  private static void checkOneOf(String key, List<String> validVals)
                                                  throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    for (String vv: validVals) {
      if (val.equalsIgnoreCase(vv)) {
        return;
      }
    }

    StringBuilder sb = new StringBuilder();
    for (String vv: validVals) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append("'");
      sb.append(vv);
      sb.append("'");
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: " + sb.toString() + " but was '" + val + "'");
  }

  public static int getInt(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Integer.parseInt(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }

  public static boolean getBooleanUnchecked(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new SKCRuntimeError(e.getMessage(), e);
    }
  }

  public static int getIntUnchecked(String key) {
    try {
      return getInt(key);
    } catch (InvalidOptionException e) {
      throw new SKCRuntimeError(e.getMessage(), e);
    }
  }

  /**
   * @param key
   * @return comma separated list, with whitespace and empty entries removed
   */
  public static List<String> getList(String key) {
    String strVal = properties.getProperty(key);
    List<String> result = new ArrayList<String>();
    if (strVal == null) {
      return result;
    }
    for (String item: strVal.split(",")) {
      String trimmed = item.trim();
      if (trimmed.length() > 0) {
        result.add(trimmed);
      }
    }
    return result;
  }

  /**
   * Parse a list of key:value pairs, e.g. "ji:lon,jj:lat"
   * @param key
   * @return insertion-ordered mapping, keys in lower case
   * @throws InvalidOptionException
   */
  public static Map<String, String> getMapping(String key)
                                  throws InvalidOptionException {
    Map<String, String> result = new LinkedHashMap<String, String>();
    for (String item: getList(key)) {
      int colon = item.indexOf(':');
      if (colon <= 0 || colon == item.length() - 1) {
        throw new InvalidOptionException("Expected name:value pairs for " +
                          key + " but found '" + item + "'");
      }
      result.put(item.substring(0, colon).trim().toLowerCase(),
                 item.substring(colon + 1).trim());
    }
    return result;
  }

  public static Map<String, String> getMappingUnchecked(String key) {
    try {
      return getMapping(key);
    } catch (InvalidOptionException e) {
      throw new SKCRuntimeError(e.getMessage(), e);
    }
  }
}
