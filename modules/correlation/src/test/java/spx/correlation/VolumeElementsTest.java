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

import org.junit.Test;
import spx.utilities.SPXTest;

/**
 * The volume elements must tile the shell between rmin and rmax.
 *
 * @author Michael J. Schnieders
 */
public class VolumeElementsTest extends SPXTest {

  private static double sum(double[] values) {
    double sum = 0.0;
    for (double v : values) {
      sum += v;
    }
    return sum;
  }

  @Test
  public void sphericalShellIn3D() {
    double shell = 4.0 / 3.0 * Math.PI * (125.0 - 1.0);
    assertEquals(shell, sum(VolumeElements.compute(new BinSpec(3, 1.0, 5.0, 40, 12, 9))), 1.0e-9);
    // Unbinned angular axes contribute their whole domain.
    assertEquals(shell, sum(VolumeElements.compute(new BinSpec(3, 1.0, 5.0, 40, 1, 1))), 1.0e-9);
    assertEquals(shell, sum(VolumeElements.compute(new BinSpec(3, 1.0, 5.0, 1, 1, 7))), 1.0e-9);
  }

  @Test
  public void annulusIn2D() {
    double annulus = Math.PI * (9.0 - 0.0);
    assertEquals(annulus, sum(VolumeElements.compute(new BinSpec(2, 0.0, 3.0, 30, 16, 50))), 1.0e-10);
    assertEquals(annulus, sum(VolumeElements.compute(new BinSpec(2, 0.0, 3.0, 30, 1, 1))), 1.0e-10);
  }

  @Test
  public void singleCell() {
    double[] v = VolumeElements.compute(new BinSpec(3, 0.0, 1.0, 2, 1, 2));
    assertEquals(4, v.length);
    // r in [0, 0.5], theta in [0, pi/2].
    assertEquals(0.125 / 3.0 * 2.0 * Math.PI * 1.0, v[0], 1.0e-12);
    // r in [0.5, 1], theta in [pi/2, pi].
    assertEquals(0.875 / 3.0 * 2.0 * Math.PI * 1.0, v[3], 1.0e-12);
  }
}
