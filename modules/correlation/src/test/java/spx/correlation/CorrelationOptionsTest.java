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
package spx.correlation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.MapConfiguration;
import org.junit.Test;
import spx.crystal.PeriodicBox;
import spx.numerics.atomic.AtomicDoubleArray.AtomicDoubleArrayImpl;
import spx.utilities.ConfigurationLoader;
import spx.utilities.InvalidConfigurationException;
import spx.utilities.SPXTest;

/**
 * Test reading correlation options from properties.
 *
 * @author Michael J. Schnieders
 */
public class CorrelationOptionsTest extends SPXTest {

  private static CompositeConfiguration properties(Map<String, Object> map) {
    CompositeConfiguration properties = new CompositeConfiguration();
    properties.addConfiguration(new MapConfiguration(map));
    return properties;
  }

  @Test
  public void defaults() {
    CorrelationOptions options = CorrelationOptions.fromProperties(properties(new HashMap<>()));
    PeriodicBox box = new PeriodicBox(8.0, 12.0, 10.0);
    assertEquals(0.0, options.getRmin(), 0.0);
    assertEquals(6.0, options.getRmax(box), 0.0);
    assertEquals(CorrelationOptions.DEFAULT_NR, options.getNr());
    assertEquals(1.0, options.getWeightExponent(), 0.0);
    assertEquals(AtomicDoubleArrayImpl.MULTI, options.getReduction());
    assertTrue(options.getThreads() >= 1);

    BinSpec bins = options.toBinSpec(box);
    assertEquals(1, bins.getRank());
    assertFalse(bins.getAzimuthal().isBinned());
    assertFalse(bins.getPolar().isBinned());
  }

  @Test
  public void explicitValues() {
    Map<String, Object> map = new HashMap<>();
    map.put("rmin", "0.5");
    map.put("rmax", "3.0");
    map.put("nr", "30");
    map.put("nphi", "12");
    map.put("ntheta", "6");
    map.put("weight-exponent", "2");
    map.put("spx.threads", "3");
    map.put("histogram-reduction", "adder");
    CorrelationOptions options = CorrelationOptions.fromProperties(properties(map));
    PeriodicBox box = new PeriodicBox(10.0, 10.0, 10.0);
    assertEquals(0.5, options.getRmin(), 0.0);
    assertEquals(3.0, options.getRmax(box), 0.0);
    assertEquals(2.0, options.getWeightExponent(), 0.0);
    assertEquals(3, options.getThreads());
    assertEquals(AtomicDoubleArrayImpl.ADDER, options.getReduction());
    BinSpec bins = options.toBinSpec(box);
    assertEquals(3, bins.getRank());
    assertEquals(30 * 12 * 6, bins.getCellCount());

    // The polar axis is never binned in 2D.
    bins = options.toBinSpec(new PeriodicBox(10.0, 10.0));
    assertEquals(2, bins.getRank());
  }

  @Test
  public void systemPropertiesTakePrecedence() {
    System.setProperty("nr", "42");
    System.setProperty("a-axis", "7.0");
    System.setProperty("b-axis", "9.0");
    CompositeConfiguration properties = ConfigurationLoader.loadProperties(null);
    assertEquals(42, CorrelationOptions.fromProperties(properties).getNr());
    PeriodicBox box = PeriodicBox.checkProperties(properties);
    assertEquals(2, box.getDimension());
    assertEquals(9.0, box.maximumSide(), 0.0);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void unknownReduction() {
    Map<String, Object> map = new HashMap<>();
    map.put("histogram-reduction", "shared");
    CorrelationOptions.fromProperties(properties(map));
  }

  @Test(expected = InvalidConfigurationException.class)
  public void unparsableNumber() {
    Map<String, Object> map = new HashMap<>();
    map.put("nr", "many");
    CorrelationOptions.fromProperties(properties(map));
  }

  @Test(expected = InvalidConfigurationException.class)
  public void invalidRadialRange() {
    CorrelationOptions options = new CorrelationOptions();
    options.setRmin(2.0);
    options.setRmax(1.0);
    options.toBinSpec(new PeriodicBox(10.0, 10.0));
  }
}
