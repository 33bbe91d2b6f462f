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
import static org.apache.commons.math3.util.FastMath.floor;

import spx.numerics.integrate.Integrate1DNumeric;
import spx.utilities.InvalidConfigurationException;

/**
 * Uniform bins along one coordinate. An axis with a count of 1 or less is unbinned: it keeps a
 * single implicit bin spanning its whole domain and its samples are not stored.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class AxisBins {

  private final double min;
  private final double max;
  private final int count;
  private final double width;

  /**
   * Constructor for AxisBins.
   *
   * @param min the lower edge.
   * @param max the upper edge.
   * @param count the number of bins; 1 or less means unbinned.
   */
  public AxisBins(double min, double max, int count) {
    if (!Double.isFinite(min) || !Double.isFinite(max) || max <= min) {
      throw new InvalidConfigurationException(
          format(" Bin edges must be finite and increasing (%s, %s).", min, max));
    }
    this.min = min;
    this.max = max;
    this.count = Math.max(count, 1);
    width = (max - min) / this.count;
  }

  /**
   * Check if samples are stored for this axis.
   *
   * @return true if there is more than one bin.
   */
  public boolean isBinned() {
    return count > 1;
  }

  /**
   * Getter for the number of bins.
   *
   * @return the bin count (1 when unbinned).
   */
  public int getCount() {
    return count;
  }

  /**
   * Getter for the lower edge.
   *
   * @return the lower edge of the first bin.
   */
  public double getMin() {
    return min;
  }

  /**
   * Getter for the upper edge.
   *
   * @return the upper edge of the last bin, which the last bin includes.
   */
  public double getMax() {
    return max;
  }

  /**
   * The count + 1 bin edges.
   *
   * @return the edges.
   */
  public double[] getEdges() {
    return Integrate1DNumeric.generateXPoints(min, max, count + 1);
  }

  /**
   * The left edge of each bin.
   *
   * @return the left edges.
   */
  public double[] getLeftEdges() {
    double[] edges = getEdges();
    double[] left = new double[count];
    System.arraycopy(edges, 0, left, 0, count);
    return left;
  }

  /**
   * Locate the bin that holds a value. Bins are closed on the left and open on the right, except
   * the last bin, which includes the upper edge.
   *
   * @param value the value.
   * @return the bin index, or -1 if the value is outside [min, max].
   */
  public int index(double value) {
    if (!(value >= min && value <= max)) {
      return -1;
    }
    int i = (int) floor((value - min) / width);
    return i >= count ? count - 1 : i;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format("[%8.4f, %8.4f] in %d bins", min, max, count);
  }
}
