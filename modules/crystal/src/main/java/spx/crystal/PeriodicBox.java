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

import static java.lang.String.format;
import static org.apache.commons.math3.util.FastMath.abs;
import static org.apache.commons.math3.util.FastMath.floor;
import static org.apache.commons.math3.util.FastMath.signum;

import java.util.Arrays;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import org.apache.commons.configuration2.CompositeConfiguration;
import spx.utilities.InvalidConfigurationException;
import spx.utilities.InvalidDimensionException;

/**
 * The PeriodicBox class describes a rectangular, axis-aligned box that is periodic along every
 * axis in 2 or 3 dimensions.
 *
 * <p>Coordinates are wrapped into the primary cell [0, side) along each axis. Two image
 * conventions are supported: the rounding based minimum image used to search for neighbors, and a
 * per-axis closest image search that considers only the neighboring cells.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PeriodicBox {

  private static final Logger logger = Logger.getLogger(PeriodicBox.class.getName());

  /** Side lengths. */
  private final double[] sides;
  /** Inverse side lengths. */
  private final double[] inverseSides;
  /** Dimension of space. */
  private final int dimension;
  /** Area (2D) or volume (3D). */
  private final double volume;

  /**
   * Constructor for a PeriodicBox.
   *
   * @param sides the side lengths; 2 or 3 are required.
   * @throws InvalidDimensionException if the number of sides is not 2 or 3.
   * @throws InvalidConfigurationException if a side is not finite and positive.
   */
  public PeriodicBox(double... sides) {
    if (sides == null) {
      throw new InvalidConfigurationException(" The box side lengths are required.");
    }
    dimension = InvalidDimensionException.check(sides.length);
    this.sides = Arrays.copyOf(sides, dimension);
    inverseSides = new double[dimension];
    double v = 1.0;
    for (int i = 0; i < dimension; i++) {
      double side = sides[i];
      if (!Double.isFinite(side) || side <= 0.0) {
        throw new InvalidConfigurationException(
            format(" Box side %d must be finite and positive (%s).", i, side));
      }
      inverseSides[i] = 1.0 / side;
      v *= side;
    }
    volume = v;
  }

  /**
   * Create a PeriodicBox from the <code>a-axis</code>, <code>b-axis</code> and
   * <code>c-axis</code> properties. The box is 2D if the <code>c-axis</code> is not set.
   *
   * @param properties a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @return a PeriodicBox, or null if the a-axis or b-axis is missing.
   */
  @Nullable
  public static PeriodicBox checkProperties(CompositeConfiguration properties) {
    double a = properties.getDouble("a-axis", -1.0);
    double b = properties.getDouble("b-axis", -1.0);
    double c = properties.getDouble("c-axis", -1.0);
    if (a < 0.0 || b < 0.0) {
      return null;
    }
    if (!properties.containsKey("c-axis")) {
      return new PeriodicBox(a, b);
    }
    return new PeriodicBox(a, b, c);
  }

  /**
   * Getter for the dimension of space.
   *
   * @return 2 or 3.
   */
  public int getDimension() {
    return dimension;
  }

  /**
   * Getter for one side length.
   *
   * @param axis the axis.
   * @return the side length along the axis.
   */
  public double getSide(int axis) {
    return sides[axis];
  }

  /**
   * Getter for the side lengths.
   *
   * @return a copy of the side lengths.
   */
  public double[] getSides() {
    return Arrays.copyOf(sides, dimension);
  }

  /**
   * The area (2D) or volume (3D) of the box.
   *
   * @return the volume.
   */
  public double volume() {
    return volume;
  }

  /**
   * The number density of a set of particles in the box.
   *
   * @param nParticles the number of particles.
   * @return nParticles / volume.
   */
  public double numberDensity(int nParticles) {
    return nParticles / volume;
  }

  /**
   * The smallest side length.
   *
   * @return the minimum side.
   */
  public double minimumSide() {
    double min = sides[0];
    for (int i = 1; i < dimension; i++) {
      min = Math.min(min, sides[i]);
    }
    return min;
  }

  /**
   * The largest side length.
   *
   * @return the maximum side.
   */
  public double maximumSide() {
    double max = sides[0];
    for (int i = 1; i < dimension; i++) {
      max = Math.max(max, sides[i]);
    }
    return max;
  }

  /**
   * Wrap coordinates into the primary cell. The input array is not modified.
   *
   * @param xyz coordinates with shape [n][dimension].
   * @return a new array with every component in [0, side).
   * @throws InvalidConfigurationException if a coordinate is not finite or a row has the wrong
   *     length.
   */
  public double[][] toPrimaryCell(double[][] xyz) {
    int n = xyz.length;
    double[][] wrapped = new double[n][];
    for (int i = 0; i < n; i++) {
      double[] x = xyz[i];
      if (x == null || x.length != dimension) {
        throw new InvalidConfigurationException(
            format(" Coordinate %d must have %d components.", i, dimension));
      }
      double[] w = new double[dimension];
      for (int k = 0; k < dimension; k++) {
        if (!Double.isFinite(x[k])) {
          throw new InvalidConfigurationException(
              format(" Coordinate %d has a component that is not finite (%s).", i, x[k]));
        }
        w[k] = wrap(x[k], k);
      }
      wrapped[i] = w;
    }
    return wrapped;
  }

  /**
   * Move one coordinate into [0, side) along an axis.
   *
   * @param x the coordinate.
   * @param axis the axis.
   * @return the wrapped coordinate.
   */
  public double wrap(double x, int axis) {
    double side = sides[axis];
    double w = x - side * floor(x * inverseSides[axis]);
    // Round off can leave the result one side length out of range.
    while (w < 0.0) {
      w += side;
    }
    while (w >= side) {
      w -= side;
    }
    return w;
  }

  /**
   * Apply the minimum image convention.
   *
   * @param dx input displacement that is over-written.
   * @return the output distance squared.
   */
  public double image(double[] dx) {
    double r2 = 0.0;
    for (int k = 0; k < dimension; k++) {
      double f = dx[k] * inverseSides[k];
      f = floor(abs(f) + 0.5) * signum(-f) + f;
      double d = f * sides[k];
      dx[k] = d;
      r2 += d * d;
    }
    return r2;
  }

  /**
   * Find the displacement from a target to the closest periodic image of a source. Each axis is
   * treated independently and the candidates are the source coordinate and its images one side
   * length below and above.
   *
   * @param target the target position.
   * @param source the source position.
   * @param ret the displacement (source image - target).
   * @return the displacement.
   */
  public double[] closestImage(double[] target, double[] source, double[] ret) {
    for (int k = 0; k < dimension; k++) {
      double side = sides[k];
      double t = target[k];
      double best = source[k];
      double candidate = best - side;
      if (abs(candidate - t) < abs(best - t)) {
        best = candidate;
      }
      candidate = source[k] + side;
      if (abs(candidate - t) < abs(best - t)) {
        best = candidate;
      }
      ret[k] = best - t;
    }
    return ret;
  }

  /**
   * Log a warning if a cutoff exceeds half of the smallest side, where the closest image is no
   * longer unique.
   *
   * @param cutoff the cutoff.
   * @return true if the cutoff is at most half of the smallest side.
   */
  public boolean checkCutoff(double cutoff) {
    double half = 0.5 * minimumSide();
    if (cutoff > half) {
      logger.warning(format(
          " The cutoff %8.3f is larger than half the smallest side (%8.3f); "
              + "displacements use the per-axis closest image.", cutoff, half));
      return false;
    }
    return true;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(format(" Periodic box (%dD):", dimension));
    for (double side : sides) {
      sb.append(format(" %10.4f", side));
    }
    return sb.toString();
  }
}
