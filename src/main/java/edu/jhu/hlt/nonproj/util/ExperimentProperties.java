package edu.jhu.hlt.nonproj.util;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * Methods with defaults will return the default if the key is not in this map,
 * and also add the (key, defaultValue) pair to this map.
 *
 * There is one shared instance per JVM, see {@link #getInstance()} and
 * {@link #init(String[])}.
 *
 * @author travis
 */
public class ExperimentProperties extends java.util.Properties {
  private static final long serialVersionUID = 1L;

  /** Read from the classpath (if present) when the shared instance is created */
  public static final String DEFAULTS_RESOURCE = "/nonproj.properties";

  private static ExperimentProperties singleton;

  public static synchronized ExperimentProperties getInstance() {
    if (singleton == null) {
      singleton = new ExperimentProperties();
      singleton.loadResource(DEFAULTS_RESOURCE);
    }
    return singleton;
  }

  /** Adds (key, value) pairs from main's arguments to the shared instance */
  public static synchronized ExperimentProperties init(String[] mainArgs) {
    ExperimentProperties p = getInstance();
    p.putAll(mainArgs, true);
    return p;
  }

  /** Drops the shared instance, mostly for tests */
  public static synchronized void clearInstance() {
    singleton = null;
  }

  public void loadResource(String resource) {
    try (InputStream is = ExperimentProperties.class.getResourceAsStream(resource)) {
      if (is != null)
        load(is);
    } catch (IOException e) {
      throw new RuntimeException("couldn't read " + resource, e);
    }
  }

  public void putAll(String[] mainArgs) {
    putAll(mainArgs, false);
  }

  public void putAll(String[] mainArgs, boolean allowOverwrites) {
    if (mainArgs.length % 2 != 0)
      throw new IllegalArgumentException("expected key value pairs but got " + mainArgs.length + " args");
    for (int i = 0; i < mainArgs.length; i += 2) {
      Object old = put(mainArgs[i], mainArgs[i+1]);
      if (!allowOverwrites && old != null) {
        throw new RuntimeException(mainArgs[i] + " has two values: "
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
    return Integer.parseInt(value);
  }

  public int getInt(String key) {
    return Integer.parseInt(getString(key));
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }

  public <T extends Enum<T>> T getEnum(String key, Class<T> type, T defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, defaultValue.name());
      return defaultValue;
    }
    return Enum.valueOf(type, value.trim().toUpperCase());
  }

  public File getExistingFile(String key) {
    File f = getFile(key);
    if (!f.isFile())
      throw new RuntimeException(key + "=" + f.getPath() + " is not a file");
    return f;
  }

  public File getFile(String key) {
    return new File(getString(key));
  }

  public String getString(String key, String defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, defaultValue);
      return defaultValue;
    }
    return value;
  }

  public String getString(String key) {
    String value = getProperty(key);
    if (value == null)
      throw new RuntimeException("no value for " + key);
    return value;
  }
}
