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

package exm.r1c.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import exm.r1c.common.exceptions.InvalidOptionException;

/**
 * General R1C settings.  Defaults are set here and can be overridden by
 * Java system properties or -D options on the command line.
 * */
public class Settings
{
  public static final String OPT_PARTIAL_EVAL = "r1c.opt.partial-eval";
  /* Fold inside let bound expressions and bodies.  Off by default:
   * let nodes are opaque to the partial evaluator */
  public static final String PARTIAL_EVAL_FOLD_LET = "r1c.partial-eval.fold-let";
  /* Rename variable references inside let bound expressions */
  public static final String UNIQUIFY_RENAME_BOUND_EXPR =
                                    "r1c.uniquify.rename-bound-expr";

  public static final String LOG_FILE = "r1c.log.file";
  public static final String LOG_TRACE = "r1c.log.trace";

  private static final Properties defaults;
  private static Properties properties;

  static {
    defaults = new Properties();
    defaults.setProperty(OPT_PARTIAL_EVAL, "true");
    defaults.setProperty(PARTIAL_EVAL_FOLD_LET, "false");
    defaults.setProperty(UNIQUIFY_RENAME_BOUND_EXPR, "false");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initR1CProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  /**
   * Drop all overrides.  Mainly for tests
   */
  public static void reset() {
    properties = new Properties(defaults);
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
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
  public static void validateProperties() throws InvalidOptionException {
    getBoolean(OPT_PARTIAL_EVAL);
    getBoolean(PARTIAL_EVAL_FOLD_LET);
    getBoolean(UNIQUIFY_RENAME_BOUND_EXPR);
    getBoolean(LOG_TRACE);
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
}
