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
package spx.numerics.integrate;

import static java.lang.String.format;
import static java.lang.System.arraycopy;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.max;

import spx.utilities.InvalidConfigurationException;

/**
 * Describes a set of x, f(x) obtained by some mechanism (for example a histogram); intended for
 * numerical integration.
 *
 * @author Jacob M. Litman
 */
public class DoublesDataSet implements DataSet {

  /** Relative tolerance on the uniform spacing of x. */
  private static final double SPACING_TOLERANCE = 1.0e-8;
  /** An array of input points. */
  private final double[] x;
  /** An array of results f(x). */
  private final double[] fX;
  /** Lower bound. */
  private final double lb;
  /** Upper bound. */
  private final double ub;
  /** Number of data points. */
  private final int nX;
  /** Bin size. */
  private final double sep;

  /**
   * Constructs a DataSet from actual data, with no known underlying function.
   *
   * @param x Points where f(x) is known; must be increasing and evenly spaced.
   * @param fX Values/estimates of f(x)
   * @throws InvalidConfigurationException if fewer than 2 points are given, the lengths differ, or
   *     x is not evenly spaced.
   */
  public DoublesDataSet(double[] x, double[] fX) {
    nX = x.length;
    if (nX < 2) {
      throw new InvalidConfigurationException(
          format("At least 2 points are required for integration (found %d).", nX));
    }
    if (fX.length != nX) {
      throw new InvalidConfigurationException(
          format("The number of f(x) values (%d) must match the number of x values (%d).", fX.length, nX));
    }

    this.x = new double[nX];
    arraycopy(x, 0, this.x, 0, nX);

    this.fX = new double[nX];
    arraycopy(fX, 0, this.fX, 0, nX);

    lb = x[0];
    ub = x[nX - 1];
    sep = (ub - lb) / ((double) nX - 1);
    checkXIntegrity();
  }

  /** {@inheritDoc} */
  @Override
  public int numPoints() {
    return nX;
  }

  /** {@inheritDoc} */
  @Override
  public double binWidth() {
    return sep;
  }

  /** {@inheritDoc} */
  @Override
  public double[] getAllFxPoints() {
    double[] pts = new double[nX];
    arraycopy(fX, 0, pts, 0, nX);
    return pts;
  }

  /** Check that x is composed of equally-spaced, increasing points from lb to ub. */
  private void checkXIntegrity() {
    if (!(ub > lb)) {
      throw new InvalidConfigurationException(
          format("Points along x must be increasing (lower bound %g, upper bound %g).", lb, ub));
    }
    double tolerance = SPACING_TOLERANCE * max(sep, max(abs(lb), abs(ub)));
    for (int i = 1; i < nX - 1; i++) {
      if (abs(x[i] - (lb + i * sep)) > tolerance) {
        throw new InvalidConfigurationException(
            format("Points along x must be evenly spaced (x[%d] = %g, expected %g).", i, x[i], lb + i * sep));
      }
    }
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("Data set with %d points from lower bound %9.3g and upper bound %9.3g.", nX, lb, ub);
  }
}
