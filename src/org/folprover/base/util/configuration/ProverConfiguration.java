package org.folprover.base.util.configuration;

import java.net.URL;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.PropertiesConfiguration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to prover configuration.
 *
 * Values are read from {@value #PROPS_FILE} on the classpath (or from the file named by the system property
 * {@value #PROPS_FILE_PROPERTY}, if set).  Anything not configured takes the default from {@link CfgItem}.
 */
public class ProverConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * Name of the configuration resource.
   */
  public static final String PROPS_FILE = "folprover.properties";

  /**
   * System property which, if set, names a configuration file to use instead of the classpath resource.
   */
  public static final String PROPS_FILE_PROPERTY = "folprover.config";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * Maximum number of given-clause iterations in a proof attempt.
     */
    MAX_ITERATIONS(10000),

    /**
     * Maximum number of clauses in the clause store.
     */
    MAX_CLAUSES(50000),

    /**
     * Wall-clock budget for a proof attempt, in milliseconds.
     */
    TIME_BUDGET_MS((int)TimeUnit.SECONDS.toMillis(30)),

    /**
     * The number of threads to resolve clause pairs on.  With 1, everything runs on the caller's thread.
     */
    RESOLUTION_THREADS(1),

    /**
     * Whether to discard new clauses that are subsumed by a clause already stored.
     */
    USE_SUBSUMPTION(true);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final PropertiesConfiguration PROVER_PROPERTIES = load();

  private ProverConfiguration()
  {
    // Static access only.
  }

  private static PropertiesConfiguration load()
  {
    try
    {
      String lOverride = System.getProperty(PROPS_FILE_PROPERTY);
      if (lOverride != null)
      {
        return new PropertiesConfiguration(lOverride);
      }

      URL lResource = ProverConfiguration.class.getClassLoader().getResource(PROPS_FILE);
      if (lResource != null)
      {
        return new PropertiesConfiguration(lResource);
      }
      LOGGER.debug("No " + PROPS_FILE + " on the classpath - using defaults");
    }
    catch (ConfigurationException lEx)
    {
      LOGGER.warn("Missing/invalid prover configuration - using defaults: " + lEx);
    }

    return new PropertiesConfiguration();
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static synchronized String getCfgStr(CfgItem xiKey)
  {
    return PROVER_PROPERTIES.getString(xiKey.toString(), xiKey.mDefault);
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    String lValue = getCfgStr(xiKey);
    try
    {
      return Integer.parseInt(lValue.trim());
    }
    catch (NumberFormatException lEx)
    {
      LOGGER.warn("Invalid value '" + lValue + "' for " + xiKey + " - using default " + xiKey.mDefault);
      return Integer.parseInt(xiKey.mDefault);
    }
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey).trim());
  }

  /**
   * Log all configuration.
   */
  public static synchronized void logConfig()
  {
    LOGGER.info("Running with prover properties:");
    Iterator<String> lKeys = PROVER_PROPERTIES.getKeys();
    while (lKeys.hasNext())
    {
      String lKey = lKeys.next();

      // Check that this is a known configuration parameter (and not a typo in the config file).
      try
      {
        CfgItem lItem = CfgItem.valueOf(lKey);
        LOGGER.info("\t" + lKey + " = " + PROVER_PROPERTIES.getString(lKey) + " (default: " + lItem.mDefault + ")");
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
      }
    }
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value, or null to revert to the default.
   */
  public static synchronized void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    if (xiValue == null)
    {
      PROVER_PROPERTIES.clearProperty(xiKey.toString());
    }
    else
    {
      PROVER_PROPERTIES.setProperty(xiKey.toString(), xiValue);
    }
  }
}
