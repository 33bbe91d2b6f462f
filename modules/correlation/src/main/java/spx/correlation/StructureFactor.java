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
import static org.apache.commons.math3.util.FastMath.cos;
import static org.apache.commons.math3.util.FastMath.sin;
import static org.apache.commons.math3.util.FastMath.sqrt;

import java.util.logging.Logger;
import javax.annotation.Nullable;
import org.apache.commons.math3.special.BesselJ;
import spx.crystal.PeriodicBox;
import spx.numerics.integrate.DoublesDataSet;
import spx.numerics.integrate.Integrate1DNumeric;
import spx.numerics.parallel.WorkerTeam;
import spx.utilities.InvalidConfigurationException;

/**
 * The StructureFactor computes the isotropic structure factor S(q) from a radial pair correlation
 * G(r) sampled on a uniform grid:
 *
 * <p>S(q) = 1 + 4 pi rho / q &int; r sin(qr) G(r) dr in 3D, and
 *
 * <p>S(q) = 1 + 2 pi rho &int; r J0(qr) G(r) dr in 2D,
 *
 * <p>where rho = N / V. The integrals use composite Simpson quadrature.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class StructureFactor {

  private static final Logger logger = Logger.getLogger(StructureFactor.class.getName());

  /** Number of default wavenumbers. */
  public static final int DEFAULT_WAVENUMBERS = 199;
  /** BesselJ does not converge beyond this argument. */
  private static final double BESSEL_ASYMPTOTIC = 1.0e4;

  /** How G(r) relates to the supplied values. */
  public enum Baseline {
    /** The values are g(r), which decays to 1; g(r) - 1 is integrated. */
    SUBTRACT_ONE,
    /** The values are integrated as they are. */
    NONE
  }

  private final PeriodicBox box;
  private final int nParticles;
  private final Baseline baseline;

  /**
   * Constructor for a StructureFactor.
   *
   * @param box the periodic box.
   * @param nParticles the number of particles.
   * @param baseline how the correlation values are interpreted.
   */
  public StructureFactor(PeriodicBox box, int nParticles, Baseline baseline) {
    if (nParticles < 1) {
      throw new InvalidConfigurationException(
          format(" The number of particles must be positive (%d).", nParticles));
    }
    this.box = box;
    this.nParticles = nParticles;
    this.baseline = baseline;
  }

  /**
   * The default wavenumbers q_k = k dq for k = 1 .. 199, where dq = 2 pi / max(side).
   *
   * @param box the periodic box.
   * @return the wavenumbers.
   */
  public static double[] defaultWavenumbers(PeriodicBox box) {
    double dq = 2.0 * PI / box.maximumSide();
    double[] q = new double[DEFAULT_WAVENUMBERS];
    for (int k = 0; k < DEFAULT_WAVENUMBERS; k++) {
      q[k] = (k + 1) * dq;
    }
    return q;
  }

  /**
   * Compute S(q) at the default wavenumbers on a single thread.
   *
   * @param gr the correlation values.
   * @param r the uniform radial grid.
   * @return the structure factor.
   */
  public StructureFactorResult compute(double[] gr, double[] r) {
    return compute(gr, r, null);
  }

  /**
   * Compute S(q) on a single thread.
   *
   * @param gr the correlation values.
   * @param r the uniform radial grid.
   * @param q the wavenumbers, or null for the defaults.
   * @return the structure factor.
   */
  public StructureFactorResult compute(double[] gr, double[] r, @Nullable double[] q) {
    try (WorkerTeam workerTeam = new WorkerTeam(1)) {
      return compute(gr, r, q, workerTeam);
    }
  }

  /**
   * Compute S(q).
   *
   * @param gr the correlation values.
   * @param r the uniform radial grid.
   * @param q the wavenumbers, or null for the defaults.
   * @param workerTeam the team that runs the loop over q.
   * @return the structure factor.
   * @throws InvalidConfigurationException if r has fewer than 2 points, is not uniform, does not
   *     match gr in length, or a wavenumber is negative.
   */
  public StructureFactorResult compute(double[] gr, double[] r, @Nullable double[] q,
      WorkerTeam workerTeam) {
    if (gr.length != r.length) {
      throw new InvalidConfigurationException(
          format(" G(r) has %d values but r has %d.", gr.length, r.length));
    }
    double[] wavenumbers = q == null ? defaultWavenumbers(box) : q.clone();
    for (double value : wavenumbers) {
      if (!(value >= 0.0) || Double.isInfinite(value)) {
        throw new InvalidConfigurationException(
            format(" Wavenumbers must be finite and non-negative (%s).", value));
      }
    }
    int nr = r.length;
    double[] g = new double[nr];
    for (int i = 0; i < nr; i++) {
      g[i] = baseline == Baseline.SUBTRACT_ONE ? gr[i] - 1.0 : gr[i];
    }
    // Validates the radial grid.
    new DoublesDataSet(r, g);

    int dimension = box.getDimension();
    double rho = box.numberDensity(nParticles);
    double[] s = new double[wavenumbers.length];
    workerTeam.execute(0, wavenumbers.length - 1, (threadIndex, first, last) -> {
      double[] f = new double[nr];
      for (int k = first; k <= last; k++) {
        double qk = wavenumbers[k];
        if (dimension == 3) {
          for (int i = 0; i < nr; i++) {
            f[i] = qk == 0.0 ? r[i] * r[i] * g[i] : sin(qk * r[i]) * r[i] * g[i];
          }
          double integral = Integrate1DNumeric.simpsons(new DoublesDataSet(r, f));
          s[k] = qk == 0.0 ? 1.0 + 4.0 * PI * rho * integral : 1.0 + 4.0 * PI * rho * integral / qk;
        } else {
          for (int i = 0; i < nr; i++) {
            f[i] = besselJ0(qk * r[i]) * r[i] * g[i];
          }
          double integral = Integrate1DNumeric.simpsons(new DoublesDataSet(r, f));
          s[k] = 1.0 + 2.0 * PI * rho * integral;
        }
      }
    });

    logger.fine(format(" Structure factor (%dD) at %d wavenumbers from %d radial points.",
        dimension, wavenumbers.length, nr));
    return new StructureFactorResult(wavenumbers, s);
  }

  /**
   * The Bessel function of the first kind of order 0. Beyond the range of BesselJ the leading
   * asymptotic term is used.
   *
   * @param x the argument (x &gt;= 0).
   * @return J0(x).
   */
  static double besselJ0(double x) {
    if (x < BESSEL_ASYMPTOTIC) {
      return BesselJ.value(0.0, x);
    }
    return sqrt(2.0 / (PI * x)) * cos(x - 0.25 * PI);
  }
}
