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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Random;
import org.junit.Test;
import spx.crystal.PeriodicBox;
import spx.numerics.atomic.AtomicDoubleArray.AtomicDoubleArrayImpl;
import spx.numerics.parallel.WorkerTeam;
import spx.utilities.InvalidConfigurationException;
import spx.utilities.InvalidDimensionException;
import spx.utilities.SPXTest;

/**
 * Test the spatial distribution function of random and hand-built configurations.
 *
 * @author Michael J. Schnieders
 */
public class PairCorrelationTest extends SPXTest {

  private static double[][] randomUnitVectors(Random random, int n, int dimension) {
    double[][] p = new double[n][dimension];
    for (int i = 0; i < n; i++) {
      double norm = 0.0;
      while (norm < 1.0e-6) {
        norm = 0.0;
        for (int k = 0; k < dimension; k++) {
          p[i][k] = random.nextGaussian();
          norm += p[i][k] * p[i][k];
        }
      }
      norm = Math.sqrt(norm);
      for (int k = 0; k < dimension; k++) {
        p[i][k] /= norm;
      }
    }
    return p;
  }

  private static CorrelationOptions options(double rmax, int nr, int nphi, int ntheta) {
    CorrelationOptions options = new CorrelationOptions();
    options.setRmax(rmax);
    options.setNr(nr);
    options.setNphi(nphi);
    options.setNtheta(ntheta);
    options.setThreads(4);
    return options;
  }

  private static void assertFiniteAndBounded(DistributionGrid grid, double bound) {
    for (double g : grid.getValues()) {
      assertTrue("g = " + g, Double.isFinite(g));
      assertTrue("g = " + g, g >= 0.0 && g <= bound);
    }
  }

  @Test
  public void idealGasRadialDistribution() {
    double[] sides = {10.0, 10.0, 10.0};
    PeriodicBox box = new PeriodicBox(sides);
    double[][] xyz = PairFinderTest.randomPositions(new Random(7L), 2000, sides);
    DistributionGrid grid =
        new PairCorrelation(options(4.0, 20, 1, 1)).compute(new ParticleSet(xyz), box);
    assertArrayEquals(new int[] {20}, grid.getShape());
    double[] g = grid.getValues();
    for (int n = 5; n < 20; n++) {
      assertEquals("g(r) bin " + n, 1.0, g[n], 0.1);
    }
    double[] edges = grid.getRadialEdges();
    assertEquals(20, edges.length);
    assertEquals(0.0, edges[0], 0.0);
    assertEquals(0.2, edges[1], 1.0e-12);
  }

  @Test
  public void idealGasIn2D() {
    double[] sides = {40.0, 30.0};
    PeriodicBox box = new PeriodicBox(sides);
    double[][] xyz = PairFinderTest.randomPositions(new Random(11L), 3000, sides);
    DistributionGrid grid =
        new PairCorrelation(options(5.0, 10, 8, 1)).compute(new ParticleSet(xyz), box);
    assertArrayEquals(new int[] {10, 8}, grid.getShape());
    assertNull(grid.getPolarEdges());
    for (int n = 4; n < 10; n++) {
      for (int m = 0; m < 8; m++) {
        assertEquals(1.0, grid.get(n, m), 0.15);
      }
    }
  }

  @Test
  public void countsAreConserved() {
    double[] sides = {12.0, 9.0, 15.0};
    PeriodicBox box = new PeriodicBox(sides);
    double[][] xyz = PairFinderTest.randomPositions(new Random(3L), 500, sides);
    double[][] orientations = randomUnitVectors(new Random(4L), 500, 3);
    ParticleSet particles = new ParticleSet(xyz, orientations, null);
    for (AtomicDoubleArrayImpl reduction : AtomicDoubleArrayImpl.values()) {
      CorrelationOptions options = options(4.0, 16, 6, 5);
      options.setReduction(reduction);
      DistributionGrid grid = new PairCorrelation(options).compute(particles, box);

      int nPairs;
      try (WorkerTeam workerTeam = new WorkerTeam(2)) {
        nPairs = new PairFinder(box, 4.0).findPairs(box.toPrimaryCell(xyz), workerTeam).size();
      }
      assertEquals(reduction.toString(), nPairs, grid.getTotalCount(), 1.0e-6);

      // Sum of g * N * rho * V recovers the total count.
      double density = box.numberDensity(500);
      double[] g = grid.getValues();
      double[] volumes = grid.getVolumes();
      double sum = 0.0;
      for (int i = 0; i < g.length; i++) {
        sum += g[i] * 500 * density * volumes[i];
      }
      assertEquals(reduction.toString(), nPairs, sum, 1.0e-6 * nPairs);
    }
  }

  @Test
  public void polarDistributionOfSmallSystem() {
    double[] sides = {10.0, 10.0, 10.0};
    PeriodicBox box = new PeriodicBox(sides);
    double[][] xyz = PairFinderTest.randomPositions(new Random(200L), 200, sides);
    DistributionGrid grid =
        new PairCorrelation(options(5.0, 150, 1, 10)).compute(new ParticleSet(xyz), box);
    assertArrayEquals(new int[] {150, 10}, grid.getShape());
    assertFiniteAndBounded(grid, 1.0e6);
    assertEquals(1.0, grid.mean(), 0.5);
    assertEquals(10, grid.getPolarEdges().length);
  }

  @Test
  public void orientedLargeSystem() {
    double[] sides = {100.0, 100.0, 100.0};
    PeriodicBox box = new PeriodicBox(sides);
    double[][] xyz = PairFinderTest.randomPositions(new Random(3000L), 3000, sides);
    double[][] orientations = randomUnitVectors(new Random(3001L), 3000, 3);
    DistributionGrid grid = new PairCorrelation(options(50.0, 150, 1, 100))
        .compute(new ParticleSet(xyz, orientations, null), box);
    assertArrayEquals(new int[] {150, 100}, grid.getShape());
    assertFiniteAndBounded(grid, 1.0e6);
  }

  @Test
  public void pairAcrossBoxFace() {
    PeriodicBox box = new PeriodicBox(10.0, 10.0, 10.0);
    ParticleSet particles = new ParticleSet(new double[][] {{0.5, 5.0, 5.0}, {9.5, 5.0, 5.0}});
    DistributionGrid grid = new PairCorrelation(options(3.0, 3, 1, 1)).compute(particles, box);
    assertArrayEquals(new double[] {0.0, 2.0, 0.0}, grid.getCounts(), 0.0);
    // g = count / (N * rho * V), with V = 4 pi (2^3 - 1^3) / 3.
    double expected = 2.0 / (2.0 * 0.002 * 4.0 * Math.PI * 7.0 / 3.0);
    assertEquals(expected, grid.get(1), 1.0e-12);
  }

  @Test
  public void cutoffAboveHalfTheBox() {
    PeriodicBox box = new PeriodicBox(10.0, 10.0, 10.0);
    assertFalse(box.checkCutoff(6.0));
    // The first two particles are 9 apart directly and 1 apart through the x face. The third is
    // 5.41 from each of them without crossing a face.
    ParticleSet particles = new ParticleSet(
        new double[][] {{0.5, 5.0, 5.0}, {9.5, 5.0, 5.0}, {5.0, 5.0, 2.0}});
    DistributionGrid grid = new PairCorrelation(options(6.0, 6, 1, 1)).compute(particles, box);
    assertArrayEquals(new double[] {0.0, 2.0, 0.0, 0.0, 0.0, 4.0}, grid.getCounts(), 0.0);
    assertEquals(6.0, grid.getTotalCount(), 0.0);
  }

  @Test
  public void weightedCorrelation() {
    double[] sides = {10.0, 10.0, 10.0};
    PeriodicBox box = new PeriodicBox(sides);
    int n = 400;
    double[][] xyz = PairFinderTest.randomPositions(new Random(5L), n, sides);
    double[][] weights = new double[n][];
    for (int i = 0; i < n; i++) {
      weights[i] = new double[] {i % 2 == 0 ? 1.0 : -1.0, 0.0, 0.0};
    }
    ParticleSet unweighted = new ParticleSet(xyz);
    ParticleSet weighted = new ParticleSet(xyz, null, weights);

    CorrelationOptions options = options(3.0, 10, 1, 1);
    DistributionGrid g = new PairCorrelation(options).compute(unweighted, box);
    // Squared products are all 1.
    options.setWeightExponent(2.0);
    DistributionGrid g2 = new PairCorrelation(options).compute(weighted, box);
    assertArrayEquals(g.getValues(), g2.getValues(), 1.0e-12);

    // Products of +1 and -1 labels count like pairs minus unlike pairs.
    options.setWeightExponent(1.0);
    DistributionGrid g1 = new PairCorrelation(options).compute(weighted, box);
    double like = 0.0;
    double unlike = 0.0;
    try (WorkerTeam workerTeam = new WorkerTeam(1)) {
      PairList pairs = new PairFinder(box, 3.0).findPairs(box.toPrimaryCell(xyz), workerTeam);
      for (int k = 0; k < pairs.size(); k++) {
        if ((pairs.getI(k) + pairs.getJ(k)) % 2 == 0) {
          like++;
        } else {
          unlike++;
        }
      }
    }
    assertEquals(like - unlike, g1.getTotalCount(), 1.0e-9);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void dimensionMismatch() {
    new PairCorrelation(options(1.0, 10, 1, 1))
        .compute(new ParticleSet(new double[][] {{0.0, 0.0}}), new PeriodicBox(5.0, 5.0, 5.0));
  }

  @Test(expected = InvalidDimensionException.class)
  public void fourDimensionsAreRejected() {
    new ParticleSet(new double[][] {{0.0, 0.0, 0.0, 0.0}});
  }

  @Test(expected = InvalidConfigurationException.class)
  public void orientationShapeMismatch() {
    new ParticleSet(new double[][] {{0.0, 0.0}, {1.0, 1.0}}, new double[][] {{0.0, 1.0}}, null);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void zeroLengthOrientation() {
    new PairCorrelation(options(1.0, 10, 1, 1)).compute(
        new ParticleSet(new double[][] {{0.0, 0.0, 0.0}, {5.0, 5.0, 5.0}},
            new double[][] {{0.0, 0.0, 0.0}, {0.0, 0.0, 1.0}}, null),
        new PeriodicBox(10.0, 10.0, 10.0));
  }

  @Test(expected = InvalidConfigurationException.class)
  public void nonFiniteOrientation() {
    new ParticleSet(new double[][] {{0.0, 0.0}, {1.0, 1.0}},
        new double[][] {{Double.NaN, 1.0}, {0.0, 1.0}}, null);
  }

  @Test(expected = InvalidConfigurationException.class)
  public void noBinnedAxis() {
    new PairCorrelation(options(1.0, 1, 1, 1))
        .compute(new ParticleSet(new double[][] {{0.0, 0.0}, {0.5, 0.0}}), new PeriodicBox(5.0, 5.0));
  }

  @Test(expected = EmptyPairListException.class)
  public void isolatedParticles() {
    new PairCorrelation(options(1.0, 10, 1, 1))
        .compute(new ParticleSet(new double[][] {{0.0, 0.0}, {2.5, 2.5}}), new PeriodicBox(5.0, 5.0));
  }
}
