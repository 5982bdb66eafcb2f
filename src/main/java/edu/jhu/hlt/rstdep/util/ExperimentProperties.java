package edu.jhu.hlt.rstdep.util;

import java.io.IOException;
import java.io.InputStream;

import org.apache.log4j.Logger;

/**
 * Methods with defaults will return the default if the key is not in this map,
 * and also add the (key, defaultValue) pair to this map, so that after a run
 * this holds every setting that was actually used.
 *
 * @author travis
 */
public class ExperimentProperties extends java.util.Properties {
  private static final long serialVersionUID = 1L;
  public static final Logger LOG = Logger.getLogger(ExperimentProperties.class);

  /** Classpath resource read by {@link #withDefaults()}. */
  public static final String DEFAULTS_RESOURCE = "/rstdep.properties";

  /** Builds properties from alternating key value arguments. */
  public static ExperimentProperties fromArgs(String... keyValues) {
    ExperimentProperties p = new ExperimentProperties();
    p.putAll(keyValues);
    return p;
  }

  /**
   * Reads {@link #DEFAULTS_RESOURCE} from the classpath, if present.
   */
  public static ExperimentProperties withDefaults() {
    ExperimentProperties p = new ExperimentProperties();
    try (InputStream is = ExperimentProperties.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
      if (is == null) {
        LOG.info("[withDefaults] no " + DEFAULTS_RESOURCE + " on the classpath");
      } else {
        p.load(is);
        LOG.info("[withDefaults] read " + p.size() + " settings from " + DEFAULTS_RESOURCE);
      }
    } catch (IOException e) {
      throw new RuntimeException("could not read " + DEFAULTS_RESOURCE, e);
    }
    return p;
  }

  public void putAll(String[] mainArgs) {
    putAll(mainArgs, false);
  }

  public void putAll(String[] mainArgs, boolean allowOverwrites) {
    if (mainArgs.length % 2 != 0)
      throw new IllegalArgumentException("need key value pairs, got " + mainArgs.length + " args");
    for (int i = 0; i < mainArgs.length; i += 2) {
      Object old = put(mainArgs[i], mainArgs[i+1]);
      if (!allowOverwrites && old != null) {
        throw new IllegalArgumentException(mainArgs[i] + " has two values: "
            + mainArgs[i+1] + " and " + old);
      }
    }
  }

  public int getInt(String key, int defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return Integer.parseInt(value.trim());
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  public String getString(String key, String defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, defaultValue);
      return defaultValue;
    }
    return value.trim();
  }

  public String getString(String key) {
    String value = getProperty(key);
    if (value == null)
      throw new IllegalArgumentException("missing required property: " + key);
    return value.trim();
  }
}
