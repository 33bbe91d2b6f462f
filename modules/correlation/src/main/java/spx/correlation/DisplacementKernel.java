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
import static org.apache.commons.math3.util.FastMath.acos;
import static org.apache.commons.math3.util.FastMath.atan2;
import static org.apache.commons.math3.util.FastMath.pow;
import static org.apache.commons.math3.util.FastMath.rint;

import java.util.logging.Level;
import java.util.logging.Logger;
import spx.crystal.PeriodicBox;
import spx.numerics.math.DoubleMath;
import spx.numerics.parallel.WorkerTeam;
import spx.utilities.InvalidConfigurationException;

/**
 * The DisplacementKernel computes the displacement r_j - r_i of every ordered pair, rotates it into
 * the frame of particle i when orientations are present, and projects it onto (r, phi, theta).
 *
 * <p>When weights are present each pair also receives (w_i . w_j)^z.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class DisplacementKernel {

  private static final Logger logger = Logger.getLogger(DisplacementKernel.class.getName());

  private final PeriodicBox box;
  private final BinSpec bins;
  private final double cutoff;
  private final double exponent;
  /** True if the exponent is an integer. */
  private final boolean integralExponent;

  /**
   * Constructor for a DisplacementKernel.
   *
   * @param box the periodic box.
   * @param bins the bins, which select the stored coordinates.
   * @param cutoff displacements at least this long are replaced by the closest periodic image.
   * @param exponent the exponent z of the weight (w_i . w_j)^z.
   */
  public DisplacementKernel(PeriodicBox box, BinSpec bins, double cutoff, double exponent) {
    if (!Double.isFinite(exponent)) {
      throw new InvalidConfigurationException(
          format(" The weight exponent must be finite (%s).", exponent));
    }
    this.box = box;
    this.bins = bins;
    this.cutoff = cutoff;
    this.exponent = exponent;
    integralExponent = exponent == rint(exponent) && Math.abs(exponent) <= Integer.MAX_VALUE;
  }

  /**
   * Compute displacement samples for every ordered pair.
   *
   * @param particles the particles.
   * @param wrapped the particle positions in the primary cell.
   * @param pairList the pairs.
   * @param workerTeam the team that runs the loops.
   * @return the samples, in pair list order.
   */
  public DisplacementSamples compute(ParticleSet particles, double[][] wrapped, PairList pairList,
      WorkerTeam workerTeam) {
    long time = System.nanoTime();
    int dimension = box.getDimension();
    double[][] weights = particles.getWeights();
    DisplacementSamples samples =
        new DisplacementSamples(pairList.size(), bins, weights != null);

    // Rotation matrix of each particle frame.
    double[][][] frames = null;
    double[][] orientations = particles.getOrientations();
    if (orientations != null) {
      double[][][] rotations = new double[orientations.length][][];
      workerTeam.execute(0, orientations.length - 1, (threadIndex, first, last) -> {
        for (int i = first; i <= last; i++) {
          rotations[i] = OrientationFrame.rotationMatrix(orientations[i]);
        }
      });
      frames = rotations;
    }

    final double[][][] rotations = frames;
    double[] r = samples.getR();
    double[] phi = samples.getPhi();
    double[] theta = samples.getTheta();
    double[] w = samples.getWeights();
    workerTeam.execute(0, pairList.size() - 1, (threadIndex, first, last) -> {
      double[] d = new double[dimension];
      double[] rotated = new double[dimension];
      for (int k = first; k <= last; k++) {
        int i = pairList.getI(k);
        int j = pairList.getJ(k);
        double[] d0 = displacement(wrapped[i], wrapped[j], d);
        if (rotations != null) {
          d0 = DoubleMath.matVec(rotations[i], d0, rotated);
        }
        double norm = DoubleMath.length(d0);
        if (r != null) {
          r[k] = norm;
        }
        if (phi != null) {
          phi[k] = atan2(d0[1], d0[0]);
        }
        if (theta != null) {
          theta[k] = polarAngle(d0[2], norm);
        }
        if (w != null) {
          w[k] = weight(weights[i], weights[j]);
        }
      }
    });

    if (logger.isLoggable(Level.FINE)) {
      time = System.nanoTime() - time;
      logger.fine(format(" Displacements of %d pairs: %8.4f (sec)", pairList.size(), time * 1.0e-9));
    }
    return samples;
  }

  /**
   * The displacement from xi to xj. If the direct displacement is at least the cutoff, the closest
   * periodic image of xj is used instead.
   *
   * @param xi the origin.
   * @param xj the partner.
   * @param ret the displacement.
   * @return the displacement.
   */
  double[] displacement(double[] xi, double[] xj, double[] ret) {
    DoubleMath.sub(xj, xi, ret);
    if (DoubleMath.length(ret) >= cutoff) {
      box.closestImage(xi, xj, ret);
    }
    return ret;
  }

  /**
   * The polar angle of a displacement. A zero-length displacement has theta = 0.
   *
   * @param z the z-component.
   * @param norm the length.
   * @return theta in [0, pi].
   */
  static double polarAngle(double z, double norm) {
    if (norm == 0.0) {
      return 0.0;
    }
    double c = z / norm;
    return acos(Math.max(-1.0, Math.min(1.0, c)));
  }

  /**
   * The weight (wi . wj)^z.
   *
   * @param wi the first weight vector.
   * @param wj the second weight vector.
   * @return the weight.
   * @throws InvalidConfigurationException if z is not an integer and wi . wj is negative, or if z
   *     is negative and wi . wj is zero.
   */
  double weight(double[] wi, double[] wj) {
    double dot = DoubleMath.dot(wi, wj);
    if (dot == 0.0 && exponent < 0.0) {
      throw new InvalidConfigurationException(format(
          " A zero weight product cannot be raised to the negative power %s.", exponent));
    }
    if (integralExponent) {
      return pow(dot, (int) exponent);
    }
    if (dot < 0.0) {
      throw new InvalidConfigurationException(format(
          " A negative weight product (%s) cannot be raised to the non-integral power %s.",
          dot, exponent));
    }
    return pow(dot, exponent);
  }
}
