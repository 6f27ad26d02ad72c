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

package exm.iet.common;

import java.util.Properties;

import exm.iet.common.exceptions.InvalidOptionException;

/**
 * General IET settings.  Values come from built-in defaults, which
 * can be overridden by Java system properties of the same name.
 * */
public class Settings
{
  public static final String LOG_FILE = "iet.log.file";
  public static final String LOG_TRACE = "iet.log.trace";

  /** Dump trees before and after each rewrite */
  public static final String COMPILER_DEBUG = "iet.compiler-debug";

  /** Suffix appended to dimension names for implicit size parameters */
  public static final String SIZE_PARAM_SUFFIX = "iet.param.size-suffix";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(COMPILER_DEBUG, "false");
    defaults.setProperty(SIZE_PARAM_SUFFIX, "_size");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initIETProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(COMPILER_DEBUG);
    String suffix = get(SIZE_PARAM_SUFFIX);
    if (suffix == null || suffix.trim().isEmpty()) {
      throw new InvalidOptionException("Option " + SIZE_PARAM_SUFFIX +
                                       " must not be empty");
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    String lcase = strVal.trim().toLowerCase();
    if (lcase.equals("true")) {
      return true;
    } else if (lcase.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for option " +
                          key + ": '" + strVal + "'");
    }
  }

  /**
   * Boolean lookup for code paths that can't usefully report a bad option,
   * e.g. debug toggles checked deep inside a pass.
   * @param key
   * @return false if the value is missing or malformed
   */
  public static boolean getBooleanUnchecked(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      Logging.uniqueWarn(e.getMessage());
      return false;
    }
  }
}
