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

import java.util.Arrays;
import javax.annotation.Nullable;

/**
 * The DistributionGrid holds g(r, phi, theta) over the binned axes, stored in row-major order with
 * r slowest, then phi, then theta. The raw (weighted) counts and the cell volumes are kept with it.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class DistributionGrid {

  private final BinSpec bins;
  private final int[] shape;
  private final double[] values;
  private final double[] counts;
  private final double[] volumes;

  /**
   * Constructor for a DistributionGrid.
   *
   * @param bins the bins.
   * @param values the normalized distribution.
   * @param counts the (weighted) counts.
   * @param volumes the cell volumes.
   */
  DistributionGrid(BinSpec bins, double[] values, double[] counts, double[] volumes) {
    this.bins = bins;
    this.shape = bins.getShape();
    this.values = values;
    this.counts = counts;
    this.volumes = volumes;
  }

  public BinSpec getBins() {
    return bins;
  }

  /**
   * The number of bins along each binned axis.
   *
   * @return the shape.
   */
  public int[] getShape() {
    return shape.clone();
  }

  /**
   * The number of binned axes.
   *
   * @return the rank.
   */
  public int getRank() {
    return shape.length;
  }

  /**
   * The number of cells.
   *
   * @return the product of the shape.
   */
  public int size() {
    return values.length;
  }

  /**
   * Look up one value.
   *
   * @param index one index per binned axis.
   * @return the value.
   */
  public double get(int... index) {
    if (index.length != shape.length) {
      throw new IllegalArgumentException(
          format(" Expected %d indices but found %d.", shape.length, index.length));
    }
    int flat = 0;
    for (int k = 0; k < shape.length; k++) {
      if (index[k] < 0 || index[k] >= shape[k]) {
        throw new IndexOutOfBoundsException(
            format(" Index %d is out of range for axis %d of length %d.", index[k], k, shape[k]));
      }
      flat = flat * shape[k] + index[k];
    }
    return values[flat];
  }

  /**
   * The distribution values.
   *
   * @return a copy of the values, in cell order.
   */
  public double[] getValues() {
    return values.clone();
  }

  /**
   * The raw (weighted) count of each cell.
   *
   * @return a copy of the counts.
   */
  public double[] getCounts() {
    return counts.clone();
  }

  /**
   * The volume element of each cell.
   *
   * @return a copy of the volumes.
   */
  public double[] getVolumes() {
    return volumes.clone();
  }

  /**
   * Left edges of the radial bins.
   *
   * @return the radial edges.
   */
  public double[] getRadialEdges() {
    return bins.getRadial().getLeftEdges();
  }

  /**
   * Left edges of the azimuthal bins in [-pi, pi).
   *
   * @return the azimuthal edges.
   */
  public double[] getAzimuthalEdges() {
    return bins.getAzimuthal().getLeftEdges();
  }

  /**
   * Left edges of the polar bins in [0, pi).
   *
   * @return the polar edges, or null in 2D.
   */
  @Nullable
  public double[] getPolarEdges() {
    return bins.getDimension() == 3 ? bins.getPolar().getLeftEdges() : null;
  }

  /**
   * The sum of the (weighted) counts.
   *
   * @return the total count.
   */
  public double getTotalCount() {
    double sum = 0.0;
    for (double count : counts) {
      sum += count;
    }
    return sum;
  }

  /**
   * The mean over all cells.
   *
   * @return the mean value.
   */
  public double mean() {
    double sum = 0.0;
    for (double value : values) {
      sum += value;
    }
    return sum / values.length;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Distribution of shape %s (mean %10.6f, total count %12.1f)",
        Arrays.toString(shape), mean(), getTotalCount());
  }
}
