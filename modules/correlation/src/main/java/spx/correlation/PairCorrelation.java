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

import java.util.logging.Level;
import java.util.logging.Logger;
import spx.crystal.PeriodicBox;
import spx.numerics.parallel.WorkerTeam;
import spx.utilities.InvalidConfigurationException;

/**
 * PairCorrelation computes the spatial distribution function g(r, phi, theta) of particles in a
 * periodic box. With weights it computes the pair correlation G = &lt;(w_i . w_j)^z&gt; instead.
 *
 * <p>Particles are wrapped into the primary cell, pairs within the cutoff are found with a cell
 * list, each ordered pair is projected onto (r, phi, theta) in the frame of its origin particle,
 * and the binned counts are normalized by N, the number density and the exact cell volumes. With no
 * angular bins this reduces to the radial distribution function g(r).
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PairCorrelation {

  private static final Logger logger = Logger.getLogger(PairCorrelation.class.getName());

  private final CorrelationOptions options;

  /**
   * Constructor for PairCorrelation.
   *
   * @param options the options.
   */
  public PairCorrelation(CorrelationOptions options) {
    this.options = options;
  }

  /**
   * Compute the distribution using a WorkerTeam sized by the options.
   *
   * @param particles the particles.
   * @param box the periodic box.
   * @return the distribution.
   * @throws InvalidConfigurationException if the inputs are inconsistent.
   * @throws EmptyPairListException if no pair lies within the cutoff.
   */
  public DistributionGrid compute(ParticleSet particles, PeriodicBox box) {
    try (WorkerTeam workerTeam = new WorkerTeam(options.getThreads())) {
      return compute(particles, box, workerTeam);
    }
  }

  /**
   * Compute the distribution.
   *
   * @param particles the particles.
   * @param box the periodic box.
   * @param workerTeam the team that runs the parallel loops.
   * @return the distribution.
   * @throws InvalidConfigurationException if the inputs are inconsistent.
   * @throws EmptyPairListException if no pair lies within the cutoff.
   */
  public DistributionGrid compute(ParticleSet particles, PeriodicBox box, WorkerTeam workerTeam) {
    long time = System.nanoTime();
    if (particles.getDimension() != box.getDimension()) {
      throw new InvalidConfigurationException(format(
          " The particles are %dD but the box is %dD.", particles.getDimension(), box.getDimension()));
    }
    BinSpec bins = options.toBinSpec(box);
    double rmax = bins.getRadial().getMax();
    DisplacementKernel kernel =
        new DisplacementKernel(box, bins, rmax, options.getWeightExponent());
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(options.toString());
      logger.fine(bins.toString());
    }
    box.checkCutoff(rmax);

    int nParticles = particles.getNumberOfParticles();
    double[][] wrapped = box.toPrimaryCell(particles.getPositions());
    PairList pairList = new PairFinder(box, rmax).findPairs(wrapped, workerTeam);
    DisplacementSamples samples = kernel.compute(particles, wrapped, pairList, workerTeam);
    DistributionHistogram histogram = new DistributionHistogram(bins, options.getReduction());
    DistributionGrid grid =
        histogram.normalize(samples, nParticles, box.numberDensity(nParticles), workerTeam);

    time = System.nanoTime() - time;
    logger.info(format("%s in %8.3f (sec)", grid, time * 1.0e-9));
    return grid;
  }
}
