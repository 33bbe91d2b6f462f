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
package spx.crystal;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.MapConfiguration;
import org.junit.Test;
import spx.utilities.InvalidConfigurationException;
import spx.utilities.InvalidDimensionException;
import spx.utilities.SPXTest;

/**
 * Test wrapping and periodic images for the PeriodicBox.
 *
 * @author Michael J. Schnieders
 */
public class PeriodicBoxTest extends SPXTest {

  private static final double TOLERANCE = 1.0e-12;

  @Test
  public void wrapIntoPrimaryCell() {
    PeriodicBox box = new PeriodicBox(10.0, 20.0, 5.0);
    double[][] xyz = {{-1.0, 45.0, 5.0}, {1.0e3 + 0.5, -79.0, -0.25}};
    double[][] wrapped = box.toPrimaryCell(xyz);
    assertArrayEquals(new double[] {9.0, 5.0, 0.0}, wrapped[0], TOLERANCE);
    assertArrayEquals(new double[] {0.5, 1.0, 4.75}, wrapped[1], 1.0e-9);
    // The caller's coordinates are unchanged.
    assertEquals(-1.0, xyz[0][0], 0.0);
    for (double[] w : wrapped) {
      for (int k = 0; k < 3; k++) {
        assertTrue(w[k] >= 0.0 && w[k] < box.getSide(k));
      }
    }
  }

  @Test
  public void volumeAndDensity() {
    PeriodicBox box = new PeriodicBox(2.0, 4.0);
    assertEquals(2, box.getDimension());
    assertEquals(8.0, box.volume(), TOLERANCE);
    assertEquals(2.0, box.numberDensity(16), TOLERANCE);
    assertEquals(2.0, box.minimumSide(), 0.0);
    assertEquals(4.0, box.maximumSide(), 0.0);
  }

  @Test
  public void minimumImage() {
    PeriodicBox box = new PeriodicBox(10.0, 10.0, 10.0);
    double[] dx = {9.0, -6.0, 2.0};
    double r2 = box.image(dx);
    assertArrayEquals(new double[] {-1.0, 4.0, 2.0}, dx, TOLERANCE);
    assertEquals(21.0, r2, TOLERANCE);
  }

  @Test
  public void closestImageAcrossFace() {
    PeriodicBox box = new PeriodicBox(10.0, 10.0, 10.0);
    double[] d = box.closestImage(new double[] {0.5, 5.0, 5.0}, new double[] {9.5, 5.0, 5.0}, new double[3]);
    assertArrayEquals(new double[] {-1.0, 0.0, 0.0}, d, TOLERANCE);
    d = box.closestImage(new double[] {9.5, 0.2, 5.0}, new double[] {0.5, 9.8, 5.0}, new double[3]);
    assertArrayEquals(new double[] {1.0, -0.4, 0.0}, d, TOLERANCE);
  }

  @Test
  public void cutoffCheck() {
    PeriodicBox box = new PeriodicBox(10.0, 8.0);
    assertTrue(box.checkCutoff(4.0));
    assertFalse(box.checkCutoff(4.5));
  }

  @Test
  public void boxFromProperties() {
    Map<String, Object> map = new HashMap<>();
    map.put("a-axis", "10.0");
    map.put("b-axis", "12.0");
    CompositeConfiguration properties = new CompositeConfiguration();
    properties.addConfiguration(new MapConfiguration(map));
    PeriodicBox box = PeriodicBox.checkProperties(properties);
    assertEquals(2, box.getDimension());
    assertArrayEquals(new double[] {10.0, 12.0}, box.getSides(), 0.0);

    map.put("c-axis", "14.0");
    box = PeriodicBox.checkProperties(properties);
    assertEquals(3, box.getDimension());
    assertEquals(1680.0, box.volume(), TOLERANCE);

    map.remove("a-axis");
    assertNull(PeriodicBox.checkProperties(properties));
  }

  @Test(expected = InvalidDimensionException.class)
  public void oneDimensionIsRejected() {
    new PeriodicBox(1.0);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void negativeSideIsRejected() {
    new PeriodicBox(1.0, -2.0, 3.0);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void wrongCoordinateShapeIsRejected() {
    new PeriodicBox(1.0, 1.0).toPrimaryCell(new double[][] {{0.1, 0.2, 0.3}});
  }
}
