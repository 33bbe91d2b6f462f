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
import static org.apache.commons.math3.util.FastMath.PI;

import spx.utilities.InvalidConfigurationException;
import spx.utilities.InvalidDimensionException;

/**
 * The BinSpec describes how displacements are binned in (r, phi, theta). The radial axis spans
 * [rmin, rmax], the azimuthal axis [-pi, pi] and the polar axis [0, pi]. The polar axis is always
 * unbinned in 2D.
 *
 * <p>Cells are stored in row-major order with r slowest, then phi, then theta. Unbinned axes have a
 * single bin, so the same ordering holds over the binned axes alone.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class BinSpec {

  private final int dimension;
  private final AxisBins radial;
  private final AxisBins azimuthal;
  private final AxisBins polar;

  /**
   * Constructor for a BinSpec.
   *
   * @param dimension the dimension of space.
   * @param rmin the minimum r.
   * @param rmax the maximum r.
   * @param nr the number of radial bins.
   * @param nphi the number of azimuthal bins.
   * @param ntheta the number of polar bins (ignored in 2D).
   * @throws InvalidConfigurationException if the radial range is invalid or no axis is binned.
   */
  public BinSpec(int dimension, double rmin, double rmax, int nr, int nphi, int ntheta) {
    this.dimension = InvalidDimensionException.check(dimension);
    if (!(rmin >= 0.0) || !(rmax > rmin) || Double.isInfinite(rmax)) {
      throw new InvalidConfigurationException(
          format(" The radial range must satisfy 0 <= rmin < rmax (rmin %s, rmax %s).", rmin, rmax));
    }
    radial = new AxisBins(rmin, rmax, nr);
    azimuthal = new AxisBins(-PI, PI, nphi);
    polar = new AxisBins(0.0, PI, dimension == 2 ? 1 : ntheta);
    if (!radial.isBinned() && !azimuthal.isBinned() && !polar.isBinned()) {
      throw new InvalidConfigurationException(
          " At least one of r, phi or theta must have more than one bin.");
    }
  }

  /**
   * Getter for the dimension.
   *
   * @return 2 or 3.
   */
  public int getDimension() {
    return dimension;
  }

  /**
   * Getter for the radial bins.
   *
   * @return the bins along r.
   */
  public AxisBins getRadial() {
    return radial;
  }

  /**
   * Getter for the azimuthal bins.
   *
   * @return the bins along phi, over [-pi, pi].
   */
  public AxisBins getAzimuthal() {
    return azimuthal;
  }

  /**
   * Getter for the polar bins. In 2D this is a single unbinned bin.
   *
   * @return the bins along theta, over [0, pi].
   */
  public AxisBins getPolar() {
    return polar;
  }

  /**
   * The bin counts of the binned axes.
   *
   * @return the shape of the distribution.
   */
  public int[] getShape() {
    int[] shape = new int[getRank()];
    int k = 0;
    for (AxisBins axis : new AxisBins[] {radial, azimuthal, polar}) {
      if (axis.isBinned()) {
        shape[k++] = axis.getCount();
      }
    }
    return shape;
  }

  /**
   * The number of binned axes.
   *
   * @return 1, 2 or 3.
   */
  public int getRank() {
    int rank = 0;
    for (AxisBins axis : new AxisBins[] {radial, azimuthal, polar}) {
      if (axis.isBinned()) {
        rank++;
      }
    }
    return rank;
  }

  /**
   * The total number of cells.
   *
   * @return nr * nphi * ntheta.
   */
  public int getCellCount() {
    return radial.getCount() * azimuthal.getCount() * polar.getCount();
  }

  /**
   * The flattened index of a cell.
   *
   * @param ir the radial bin.
   * @param iphi the azimuthal bin.
   * @param itheta the polar bin.
   * @return the index of the cell.
   */
  public int cellIndex(int ir, int iphi, int itheta) {
    return (ir * azimuthal.getCount() + iphi) * polar.getCount() + itheta;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Bins (%dD)\n  r:     %s\n  phi:   %s\n  theta: %s",
        dimension, radial, azimuthal, polar);
  }
}
