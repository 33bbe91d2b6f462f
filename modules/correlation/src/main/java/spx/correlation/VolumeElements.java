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

import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.pow;

/**
 * Exact volume elements of the (r, phi, theta) cells. The volume of a cell is the product of a
 * radial factor (r_hi^d - r_lo^d) / d, the azimuthal width, and in 3D the polar factor cos(theta_lo)
 * - cos(theta_hi). An unbinned axis contributes the factor of its whole domain.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public final class VolumeElements {

  private VolumeElements() {
    // Prevent instantiation.
  }

  /**
   * Compute the volume of every cell.
   *
   * @param bins the bins.
   * @return the cell volumes, in cell order.
   */
  public static double[] compute(BinSpec bins) {
    int dimension = bins.getDimension();
    double[] rEdges = bins.getRadial().getEdges();
    double[] phiEdges = bins.getAzimuthal().getEdges();
    double[] thetaEdges = bins.getPolar().getEdges();
    int nr = rEdges.length - 1;
    int nphi = phiEdges.length - 1;
    int ntheta = thetaEdges.length - 1;

    double[] volumes = new double[bins.getCellCount()];
    for (int n = 0; n < nr; n++) {
      double dr = (pow(rEdges[n + 1], dimension) - pow(rEdges[n], dimension)) / dimension;
      for (int m = 0; m < nphi; m++) {
        double dphi = phiEdges[m + 1] - phiEdges[m];
        for (int l = 0; l < ntheta; l++) {
          double v = dr * dphi;
          if (dimension == 3) {
            v *= cos(thetaEdges[l]) - cos(thetaEdges[l + 1]);
          }
          volumes[bins.cellIndex(n, m, l)] = v;
        }
      }
    }
    return volumes;
  }
}
