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

import spx.utilities.InvalidConfigurationException;

/**
 * Integrates uniformly sampled data with composite Simpson's rule. When the number of bins is odd,
 * the last bin is finished with the trapezoidal rule.
 *
 * @author Claire O'Connell
 * @author Jacob M. Litman
 */
public class Integrate1DNumeric {

  /** Constant used for Simpson's rule. */
  private static final double ONE_THIRD = (1.0 / 3.0);

  private Integrate1DNumeric() {
    // Prevent instantiation.
  }

  /**
   * Generates a set of evenly spaced points along x.
   *
   * @param lb Beginning value, inclusive
   * @param ub Ending value, inclusive
   * @param nPoints Total number of points
   * @return the points, with the first equal to lb and the last equal to ub.
   * @throws InvalidConfigurationException if ub is not above lb or fewer than 2 points are asked for.
   */
  public static double[] generateXPoints(double lb, double ub, int nPoints) {
    if (lb >= ub) {
      throw new InvalidConfigurationException(format("ub (%g) must be greater than lb (%g).", ub, lb));
    }
    if (nPoints < 2) {
      throw new InvalidConfigurationException(format("At least 2 points are required (%d).", nPoints));
    }
    double[] points = new double[nPoints];
    double sep = (ub - lb) / ((double) (nPoints - 1));
    for (int i = 0; i < nPoints - 1; i++) {
      points[i] = lb + ((double) i) * sep;
    }
    // The last point is exact.
    points[nPoints - 1] = ub;
    return points;
  }

  /**
   * Numerically integrates a data set using Simpson's rule, starting from the first point.
   *
   * @param data Data set to integrate
   * @return Area of integral
   */
  public static double simpsons(DataSet data) {
    int ub = data.numPoints() - 1;
    double[] points = data.getAllFxPoints();
    int nPairs = ub / 2;
    double area = 0.0;
    for (int i = 0; i < 2 * nPairs; i += 2) {
      area += points[i] + (4 * points[i + 1]) + points[i + 2];
    }
    area *= ONE_THIRD * data.binWidth();
    // At most one bin is left over.
    int last = 2 * nPairs;
    if (last < ub) {
      area += trapezoid(points, data.binWidth(), last, ub);
    }
    return area;
  }

  /**
   * The trapezoidal rule over points lb .. ub inclusive.
   *
   * @param points f(x)
   * @param width spacing along x
   * @param lb First index to integrate over
   * @param ub Last index to integrate over
   * @return Area of integral
   */
  private static double trapezoid(double[] points, double width, int lb, int ub) {
    double area = 0.5 * (points[lb] + points[ub]);
    for (int i = lb + 1; i < ub; i++) {
      area += points[i];
    }
    return area * width;
  }
}
