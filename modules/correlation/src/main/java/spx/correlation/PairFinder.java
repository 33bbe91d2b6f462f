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

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import spx.crystal.PeriodicBox;
import spx.numerics.parallel.WorkerTeam;
import spx.utilities.InvalidConfigurationException;

/**
 * The PairFinder collects all pairs of particles whose periodic minimum image distance is less than
 * a cutoff.
 *
 * <p>The box is partitioned into <code>nA * nB * nC</code> axis-aligned cells, where each count is
 * as large as possible subject to the cell side being at least the cutoff. All neighbors of a
 * particle are then in the surrounding block of 3^d cells. If fewer than 3 cells fit along an axis,
 * the axis is not divided.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class PairFinder {

  private static final Logger logger = Logger.getLogger(PairFinder.class.getName());

  /** Number of cells that must be searched in each direction to find all neighbors. */
  private static final int N_EDGE = 1;
  /** Number of cells along an axis that is worth dividing. */
  private static final int N_SEARCH = 2 * N_EDGE + 1;

  private final PeriodicBox box;
  private final double cutoff;
  private final int dimension;
  /** Number of cells along each axis. */
  private final int[] nCells;

  /**
   * Constructor for a PairFinder.
   *
   * @param box the periodic box.
   * @param cutoff the cutoff distance.
   */
  public PairFinder(PeriodicBox box, double cutoff) {
    if (!(cutoff > 0.0) || Double.isInfinite(cutoff)) {
      throw new InvalidConfigurationException(format(" The cutoff must be positive (%s).", cutoff));
    }
    this.box = box;
    this.cutoff = cutoff;
    dimension = box.getDimension();
    nCells = new int[3];
    Arrays.fill(nCells, 1);
    for (int k = 0; k < dimension; k++) {
      int max = (int) floor(box.getSide(k) / cutoff);
      nCells[k] = max < N_SEARCH ? 1 : max;
    }
  }

  /**
   * Getter for the number of cells along each axis.
   *
   * @return the cell counts (the third entry is 1 in 2D).
   */
  public int[] getCellCounts() {
    return nCells.clone();
  }

  /**
   * Find all pairs within the cutoff.
   *
   * @param wrapped coordinates in the primary cell [nParticles][dimension].
   * @param workerTeam the team that runs the search.
   * @return the doubled, ordered pair list.
   * @throws EmptyPairListException if no pair is found.
   */
  public PairList findPairs(double[][] wrapped, WorkerTeam workerTeam) {
    long time = System.nanoTime();
    int nParticles = wrapped.length;
    int nA = nCells[0];
    int nB = nCells[1];
    int nC = nCells[2];

    // Assign particles to cells, with a linked list per cell.
    int[] head = new int[nA * nB * nC];
    Arrays.fill(head, -1);
    int[] next = new int[nParticles];
    int[][] cellOf = new int[nParticles][3];
    for (int i = nParticles - 1; i >= 0; i--) {
      int[] c = cellOf[i];
      for (int k = 0; k < dimension; k++) {
        int index = (int) floor(wrapped[i][k] / box.getSide(k) * nCells[k]);
        c[k] = Math.min(Math.max(index, 0), nCells[k] - 1);
      }
      int cell = (c[0] * nB + c[1]) * nC + c[2];
      next[i] = head[cell];
      head[cell] = i;
    }

    int nThreads = workerTeam.getThreadCount();
    PairBuffer[] buffers = new PairBuffer[nThreads];
    for (int t = 0; t < nThreads; t++) {
      buffers[t] = new PairBuffer();
    }
    final double cutoff2 = cutoff * cutoff;
    workerTeam.execute(0, nParticles - 1, (threadIndex, first, last) -> {
      PairBuffer buffer = buffers[threadIndex];
      double[] dx = new double[dimension];
      for (int i = first; i <= last; i++) {
        int[] c = cellOf[i];
        double[] xi = wrapped[i];
        int aStart = nA == 1 ? c[0] : c[0] - N_EDGE;
        int aStop = nA == 1 ? c[0] : c[0] + N_EDGE;
        int bStart = nB == 1 ? c[1] : c[1] - N_EDGE;
        int bStop = nB == 1 ? c[1] : c[1] + N_EDGE;
        int cStart = nC == 1 ? c[2] : c[2] - N_EDGE;
        int cStop = nC == 1 ? c[2] : c[2] + N_EDGE;
        for (int a = aStart; a <= aStop; a++) {
          int aa = Math.floorMod(a, nA);
          for (int b = bStart; b <= bStop; b++) {
            int bb = Math.floorMod(b, nB);
            for (int cc = cStart; cc <= cStop; cc++) {
              int cell = (aa * nB + bb) * nC + Math.floorMod(cc, nC);
              for (int j = head[cell]; j >= 0; j = next[j]) {
                if (j <= i) {
                  continue;
                }
                double[] xj = wrapped[j];
                for (int k = 0; k < dimension; k++) {
                  dx[k] = xj[k] - xi[k];
                }
                if (box.image(dx) < cutoff2) {
                  buffer.add(i, j);
                }
              }
            }
          }
        }
      }
    });

    // Concatenate the thread buffers in thread order.
    int nPairs = 0;
    for (PairBuffer buffer : buffers) {
      nPairs += buffer.size;
    }
    if (nPairs == 0) {
      throw new EmptyPairListException(nParticles, cutoff);
    }
    int[] firstIndex = new int[nPairs];
    int[] secondIndex = new int[nPairs];
    int offset = 0;
    for (PairBuffer buffer : buffers) {
      System.arraycopy(buffer.first, 0, firstIndex, offset, buffer.size);
      System.arraycopy(buffer.second, 0, secondIndex, offset, buffer.size);
      offset += buffer.size;
    }
    PairList pairList = new PairList(firstIndex, secondIndex);

    time = System.nanoTime() - time;
    logger.info(format(" Counted %d pairs within %8.3f.", nPairs, cutoff));
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(format(" Pair search over %d x %d x %d cells: %8.4f (sec)", nA, nB, nC, time * 1.0e-9));
    }
    return pairList;
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Pair finder with cutoff %8.3f and %d x %d x %d cells",
        cutoff, nCells[0], nCells[1], nCells[2]);
  }

  /** A growable buffer of pairs owned by one thread. */
  private static class PairBuffer {

    private int[] first = new int[64];
    private int[] second = new int[64];
    private int size = 0;

    void add(int i, int j) {
      if (size == first.length) {
        int length = 2 * size;
        first = Arrays.copyOf(first, length);
        second = Arrays.copyOf(second, length);
      }
      first[size] = i;
      second[size] = j;
      size++;
    }
  }
}
