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

package hypertag.common;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import com.google.common.base.Joiner;

import hypertag.common.exceptions.InvalidOptionException;

/**
 * Options of the compiler, as Java properties with defaults.
 * Any key can be overridden with a system property of the same name,
 * e.g. -Dhypertag.escape=none
 */
public class Settings
{
  /** Pre-render pure parts of text lines at analysis time */
  public static final String OPT_COMPACTIFY = "hypertag.opt.compactify";

  /** Escaping applied to normal text blocks: html or none */
  public static final String ESCAPE = "hypertag.escape";
  public static final String XHTML = "hypertag.xhtml";

  public static final String INPUT_FILENAME = "hypertag.input_filename";
  public static final String OUTPUT_FILENAME = "hypertag.output_filename";

  public static final String LOG_FILE = "hypertag.log.file";
  public static final String LOG_TRACE = "hypertag.log.trace";

  private static final List<String> ESCAPE_MODES =
                              Collections.unmodifiableList(
                                  Arrays.asList("html", "none"));

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(OPT_COMPACTIFY, "true");
    defaults.setProperty(ESCAPE, "html");
    defaults.setProperty(XHTML, "false");
    defaults.setProperty(INPUT_FILENAME, "");
    defaults.setProperty(OUTPUT_FILENAME, "");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
   * Take values of known keys from system properties, then validate
   * @throws InvalidOptionException if a value is malformed
   */
  public static void initProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    getBoolean(OPT_COMPACTIFY);
    getBoolean(XHTML);
    getBoolean(LOG_TRACE);
    checkOneOf(ESCAPE, ESCAPE_MODES);
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set explicitly for the key, falling back to its default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  /** @return all keys with a value, sorted */
  public static List<String> getKeys() {
    List<String> keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /** @return the value, or null if the key is unknown */
  public static String get(String key) {
    return properties.getProperty(key);
  }

  private static String require(String key) throws InvalidOptionException {
    String value = properties.getProperty(key);
    if (value == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    return value;
  }

  public static List<String> escapeModes() {
    return ESCAPE_MODES;
  }

  /**
   * Case-insensitive check that the value is one of validVals
   */
  public static void checkOneOf(String key, List<String> validVals)
                                          throws InvalidOptionException {
    String value = require(key);
    List<String> quoted = new ArrayList<String>();
    for (String valid: validVals) {
      if (valid.equalsIgnoreCase(value)) {
        return;
      }
      quoted.add("'" + valid + "'");
    }
    throw new InvalidOptionException("Expected property " + key +
        " to be one of: " + Joiner.on(", ").join(quoted) + " but was '" +
        value + "'");
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String value = require(key);
    if (value.equalsIgnoreCase("true")) {
      return true;
    } else if (value.equalsIgnoreCase("false")) {
      return false;
    }
    throw new InvalidOptionException("option string for " + key +
        " must be true or false, but was '" + value + "'");
  }
}
