// ******************************************************************************
//
// Title:       Spatial Statistics X.
// Description: Spatial Statistics X - Pair Correlations of Periodic Particle Systems.
// Copyright:   Copyright (c) Michael J. Schnieders 2001-2021.
//
// This file is part of Spatial Statistics X.
//
// Spatial Statistics X is free software; you can redistribute it and/or modify it
// under the terms of the GNU General Public License version 3 as published by
// the Free Software Foundation.
//
// Spatial Statistics X is distributed in the hope that it will be useful, but WITHOUT
// ANY WARRANTY; without even the implied warranty of MERCHANTABILITY or FITNESS
// FOR A PARTICULAR PURPOSE. See the GNU General Public License for more
// details.
//
// You should have received a copy of the GNU General Public License along with
// Spatial Statistics X; if not, write to the Free Software Foundation, Inc., 59 Temple
// Place, Suite 330, Boston, MA 02111-1307 USA
//
// Linking this library statically or dynamically with other modules is making a
// combined work based on this library. Thus, the terms and conditions of the
// GNU General Public License cover the whole combination.
//
// As a special exception, the copyright holders of this library give you
// permission to link this library with independent modules to produce an
// executable, regardless of the license terms of these independent modules, and
// to copy and distribute the resulting executable under terms of your choice,
// provided that you also meet, for each linked independent module, the terms
// and conditions of the license of that module. An independent module is a
// module which is not derived from or based on this library. If you modify this
// library, you may extend this exception to your version of the library, but
// you are not obligated to do so. If you do not wish to do so, delete this
// exception statement from your version.
//
// ******************************************************************************
package spx.utilities;

import java.io.File;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.SystemConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;

/**
 * The ConfigurationLoader assembles the properties that control a calculation.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class ConfigurationLoader {

  private static final Logger logger = Logger.getLogger(ConfigurationLoader.class.getName());

  /** Name of the per-user properties file, relative to the home directory. */
  public static final String USER_PROPERTIES = ".spx" + File.separator + "spx.properties";

  private ConfigurationLoader() {
    // Prevent instantiation.
  }

  /**
   * This method sets up configuration properties in the following precedence order:
   *
   * <p>1.) Java system properties a.) -Dkey=value from the Java command line b.)
   * System.setProperty("key","value") within Java code.
   *
   * <p>2.) The properties file given as an argument (for example run.properties).
   *
   * <p>3.) User specific properties (~/.spx/spx.properties)
   *
   * @param file a properties file, which may be null.
   * @return a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   */
  public static CompositeConfiguration loadProperties(@Nullable File file) {
    CompositeConfiguration properties = new CompositeConfiguration();

    // JVM system properties take precedence.
    PropertiesConfiguration systemConfiguration = new PropertiesConfiguration();
    systemConfiguration.append(new SystemConfiguration());
    systemConfiguration.setHeader("JVM system properties (i.e. command line -Dkey=value pairs).");
    properties.addConfiguration(systemConfiguration);

    // Run specific properties are 2nd.
    if (file != null) {
      if (file.exists() && file.canRead()) {
        PropertiesConfiguration runConfiguration = readFile(file);
        if (runConfiguration != null) {
          runConfiguration.setHeader("Run properties from (" + file.getPath() + ").");
          properties.addConfiguration(runConfiguration);
          try {
            properties.addProperty("propertyFile", file.getCanonicalPath());
          } catch (IOException e) {
            logger.log(Level.INFO, " Could not resolve the path of {0}.", file.getPath());
          }
        }
      } else {
        logger.warning(String.format(" Properties file %s could not be read.", file.getPath()));
      }
    }

    // User specific properties are last.
    File userPropFile = new File(System.getProperty("user.home"), USER_PROPERTIES);
    if (userPropFile.exists() && userPropFile.canRead()) {
      PropertiesConfiguration userConfiguration = readFile(userPropFile);
      if (userConfiguration != null) {
        userConfiguration.setHeader("User properties from (" + userPropFile.getPath() + ").");
        properties.addConfiguration(userConfiguration);
      }
    }

    if (logger.isLoggable(Level.FINE)) {
      StringBuilder sb = new StringBuilder(" Properties:\n");
      properties.getKeys().forEachRemaining(key ->
          sb.append(String.format("  %-24s %s%n", key, properties.getString(key))));
      logger.fine(sb.toString());
    }

    return properties;
  }

  /**
   * Read a single properties file.
   *
   * @param file the file to read.
   * @return the parsed configuration, or null if it could not be parsed.
   */
  @Nullable
  private static PropertiesConfiguration readFile(File file) {
    FileBasedConfigurationBuilder<PropertiesConfiguration> builder =
        new FileBasedConfigurationBuilder<>(PropertiesConfiguration.class)
            .configure(new Parameters().properties()
                .setFile(file)
                .setThrowExceptionOnMissing(true)
                .setIncludesAllowed(false));
    try {
      return builder.getConfiguration();
    } catch (ConfigurationException e) {
      logger.log(Level.WARNING, " Error loading " + file.getPath(), e);
      return null;
    }
  }
}
