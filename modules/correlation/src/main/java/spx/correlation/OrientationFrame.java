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

import static java.lang.String.format;

import spx.numerics.math.DoubleMath;
import spx.utilities.InvalidConfigurationException;
import spx.utilities.InvalidDimensionException;

/**
 * Rotation matrices that take an orientation vector onto the reference axis: +y in 2D and +z in
 * 3D. In 3D the rotation is given by Rodrigues' formula about the axis p x z.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class OrientationFrame {

  /** Below this length p x z is treated as zero. */
  private static final double PARALLEL_TOLERANCE = 1.0e-12;

  private OrientationFrame() {
    // Prevent instantiation.
  }

  /**
   * Compute the rotation matrix for an orientation. The orientation is normalized and is not
   * modified.
   *
   * @param orientation the orientation vector (2 or 3 components).
   * @return the rotation matrix R, with R p equal to the reference axis.
   * @throws InvalidConfigurationException if the orientation has zero length.
   */
  public static double[][] rotationMatrix(double[] orientation) {
    int dimension = InvalidDimensionException.check(orientation.length);
    double norm = DoubleMath.length(orientation);
    if (!(norm > 0.0) || Double.isInfinite(norm)) {
      throw new InvalidConfigurationException(
          format(" An orientation vector must have finite, non-zero length (%s).", norm));
    }
    double[] p = DoubleMath.normalize(orientation, new double[dimension]);
    if (dimension == 2) {
      double c = p[1];
      double s = p[0];
      return new double[][] {{c, -s}, {s, c}};
    }

    double cos = p[2];
    double[] k = DoubleMath.X(p, new double[] {0.0, 0.0, 1.0}, new double[3]);
    double sin = DoubleMath.length(k);
    if (sin < PARALLEL_TOLERANCE) {
      if (cos > 0.0) {
        return DoubleMath.identity(3);
      }
      // Rotation by pi about the x-axis.
      return new double[][] {{1.0, 0.0, 0.0}, {0.0, -1.0, 0.0}, {0.0, 0.0, -1.0}};
    }
    k[0] /= sin;
    k[1] /= sin;
    k[2] /= sin;

    // Cross product matrix K.
    double[][] kMatrix = {
        {0.0, -k[2], k[1]},
        {k[2], 0.0, -k[0]},
        {-k[1], k[0], 0.0}
    };
    double[][] k2 = DoubleMath.matMat(kMatrix, kMatrix);
    double[][] r = DoubleMath.identity(3);
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        r[i][j] += sin * kMatrix[i][j] + (1.0 - cos) * k2[i][j];
      }
    }
    return r;
  }
}
