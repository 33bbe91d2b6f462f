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

import javax.annotation.Nullable;
import spx.numerics.math.DoubleMath;
import spx.utilities.InvalidConfigurationException;
import spx.utilities.InvalidDimensionException;

/**
 * A ParticleSet holds the positions of N particles in 2 or 3 dimensions, with optional orientation
 * vectors and optional weight vectors. All arrays are deep copied, so later changes by the caller
 * have no effect.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class ParticleSet {

  /** Positions [nParticles][dimension]. */
  private final double[][] positions;
  /** Orientations [nParticles][dimension], or null. */
  private final double[][] orientations;
  /** Weights [nParticles][k], or null. */
  private final double[][] weights;
  /** Dimension of space. */
  private final int dimension;

  /**
   * Construct a ParticleSet of point-like particles without weights.
   *
   * @param positions particle positions [nParticles][dimension].
   */
  public ParticleSet(double[][] positions) {
    this(positions, null, null);
  }

  /**
   * Construct a ParticleSet.
   *
   * @param positions particle positions [nParticles][dimension].
   * @param orientations orientation vectors [nParticles][dimension] or null for point-like
   *     particles.
   * @param weights weight vectors [nParticles][k] or null.
   * @throws InvalidDimensionException if the dimension is not 2 or 3.
   * @throws InvalidConfigurationException if the array shapes are inconsistent or an orientation
   *     does not have finite, non-zero length.
   */
  public ParticleSet(double[][] positions, @Nullable double[][] orientations,
      @Nullable double[][] weights) {
    if (positions == null || positions.length == 0) {
      throw new InvalidConfigurationException(" At least one particle position is required.");
    }
    int n = positions.length;
    dimension = InvalidDimensionException.check(positions[0].length);
    this.positions = copy("positions", positions, n, dimension);
    if (orientations != null) {
      if (orientations.length != n) {
        throw new InvalidConfigurationException(format(
            " Shape of orientations must match positions (%d, %d).", n, dimension));
      }
      this.orientations = copy("orientations", orientations, n, dimension);
      for (int i = 0; i < n; i++) {
        double norm = DoubleMath.length(this.orientations[i]);
        if (!(norm > 0.0) || Double.isInfinite(norm)) {
          throw new InvalidConfigurationException(format(
              " The orientation of particle %d must have finite, non-zero length (%s).", i, norm));
        }
      }
    } else {
      this.orientations = null;
    }
    if (weights != null) {
      if (weights.length != n || weights[0] == null || weights[0].length < 1) {
        throw new InvalidConfigurationException(format(
            " Weights must have one non-empty vector for each of the %d particles.", n));
      }
      this.weights = copy("weights", weights, n, weights[0].length);
    } else {
      this.weights = null;
    }
  }

  private static double[][] copy(String name, double[][] source, int n, int width) {
    double[][] ret = new double[n][];
    for (int i = 0; i < n; i++) {
      double[] row = source[i];
      if (row == null || row.length != width) {
        throw new InvalidConfigurationException(format(
            " Shape of %s must be (%d, %d); row %d differs.", name, n, width, i));
      }
      ret[i] = row.clone();
    }
    return ret;
  }

  /**
   * Getter for the number of particles.
   *
   * @return the number of particles.
   */
  public int getNumberOfParticles() {
    return positions.length;
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
   * Getter for the positions. The returned array is owned by this ParticleSet and must not be
   * modified.
   *
   * @return the positions.
   */
  double[][] getPositions() {
    return positions;
  }

  /**
   * Getter for the orientations.
   *
   * @return the orientations, or null if the particles are point-like.
   */
  @Nullable
  double[][] getOrientations() {
    return orientations;
  }

  /**
   * Getter for the weights.
   *
   * @return the weights, or null if there are none.
   */
  @Nullable
  double[][] getWeights() {
    return weights;
  }

  /**
   * Check for orientations.
   *
   * @return true if each particle has an orientation.
   */
  public boolean hasOrientations() {
    return orientations != null;
  }

  /**
   * Check for weights.
   *
   * @return true if each particle has a weight vector.
   */
  public boolean hasWeights() {
    return weights != null;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" %d particles in %dD (orientations: %b, weights: %b)",
        positions.length, dimension, hasOrientations(), hasWeights());
  }
}
