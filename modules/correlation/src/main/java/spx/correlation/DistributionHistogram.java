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
import spx.numerics.atomic.AtomicDoubleArray;
import spx.numerics.atomic.AtomicDoubleArray.AtomicDoubleArrayImpl;
import spx.numerics.parallel.WorkerTeam;

/**
 * The DistributionHistogram bins displacement samples over the binned axes and normalizes the
 * counts by the particle number, the number density and the cell volumes.
 *
 * <p>Samples outside the domain of a binned axis are dropped.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class DistributionHistogram {

  private static final Logger logger = Logger.getLogger(DistributionHistogram.class.getName());

  private final BinSpec bins;
  private final AtomicDoubleArrayImpl reduction;

  /**
   * Constructor for a DistributionHistogram.
   *
   * @param bins the bins.
   * @param reduction how contributions from concurrent threads are combined.
   */
  public DistributionHistogram(BinSpec bins, AtomicDoubleArrayImpl reduction) {
    this.bins = bins;
    this.reduction = reduction;
  }

  /**
   * Count the (weighted) samples in each cell.
   *
   * @param samples the samples.
   * @param workerTeam the team that runs the loops.
   * @return the counts, in cell order.
   */
  public double[] count(DisplacementSamples samples, WorkerTeam workerTeam) {
    int nCells = bins.getCellCount();
    AtomicDoubleArray counts = AtomicDoubleArray.atomicDoubleArrayFactory(
        reduction, workerTeam.getThreadCount(), nCells);
    AxisBins radial = bins.getRadial();
    AxisBins azimuthal = bins.getAzimuthal();
    AxisBins polar = bins.getPolar();
    double[] r = samples.getR();
    double[] phi = samples.getPhi();
    double[] theta = samples.getTheta();
    double[] weights = samples.getWeights();
    workerTeam.execute(0, samples.size() - 1, (threadIndex, first, last) -> {
      for (int k = first; k <= last; k++) {
        int ir = r == null ? 0 : radial.index(r[k]);
        int iphi = phi == null ? 0 : azimuthal.index(phi[k]);
        int itheta = theta == null ? 0 : polar.index(theta[k]);
        if (ir < 0 || iphi < 0 || itheta < 0) {
          continue;
        }
        double value = weights == null ? 1.0 : weights[k];
        counts.add(threadIndex, bins.cellIndex(ir, iphi, itheta), value);
      }
    });
    counts.reduce(workerTeam, 0, nCells - 1);
    return counts.toArray();
  }

  /**
   * Bin and normalize the samples: g = count / (N * rho * V_cell).
   *
   * @param samples the samples.
   * @param nParticles the number of particles N.
   * @param density the number density rho.
   * @param workerTeam the team that runs the loops.
   * @return the distribution.
   */
  public DistributionGrid normalize(DisplacementSamples samples, int nParticles, double density,
      WorkerTeam workerTeam) {
    long time = System.nanoTime();
    double[] counts = count(samples, workerTeam);
    double[] volumes = VolumeElements.compute(bins);
    double[] g = new double[counts.length];
    double scale = nParticles * density;
    for (int i = 0; i < g.length; i++) {
      g[i] = counts[i] / (scale * volumes[i]);
    }
    if (logger.isLoggable(Level.FINE)) {
      time = System.nanoTime() - time;
      logger.fine(format(" Binned %d samples into %d cells: %8.4f (sec)",
          samples.size(), counts.length, time * 1.0e-9));
    }
    return new DistributionGrid(bins, g, counts, volumes);
  }
}
