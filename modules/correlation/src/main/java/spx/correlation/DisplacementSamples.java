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

import javax.annotation.Nullable;

/**
 * Displacement coordinates of each ordered pair. Only the binned coordinates are stored; the
 * arrays of unbinned coordinates are null, as is the weight array when no weights were given.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class DisplacementSamples {

  private final int size;
  private final double[] r;
  private final double[] phi;
  private final double[] theta;
  private final double[] weights;

  /**
   * Allocate samples.
   *
   * @param size the number of ordered pairs.
   * @param bins which coordinates are stored.
   * @param weighted true to store a weight per pair.
   */
  DisplacementSamples(int size, BinSpec bins, boolean weighted) {
    this.size = size;
    r = bins.getRadial().isBinned() ? new double[size] : null;
    phi = bins.getAzimuthal().isBinned() ? new double[size] : null;
    theta = bins.getPolar().isBinned() ? new double[size] : null;
    weights = weighted ? new double[size] : null;
  }

  /**
   * The number of samples.
   *
   * @return the number of ordered pairs.
   */
  public int size() {
    return size;
  }

  /**
   * The distance of each pair.
   *
   * @return r, or null if r is unbinned.
   */
  @Nullable
  public double[] getR() {
    return r;
  }

  /**
   * The azimuthal angle of each pair, in [-pi, pi].
   *
   * @return phi, or null if phi is unbinned.
   */
  @Nullable
  public double[] getPhi() {
    return phi;
  }

  /**
   * The polar angle of each pair, in [0, pi].
   *
   * @return theta, or null if theta is unbinned.
   */
  @Nullable
  public double[] getTheta() {
    return theta;
  }

  /**
   * The weight (w_i . w_j)^z of each pair.
   *
   * @return the weights, or null if the particles carry none.
   */
  @Nullable
  public double[] getWeights() {
    return weights;
  }
}
