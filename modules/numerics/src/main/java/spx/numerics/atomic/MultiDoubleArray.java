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
package spx.numerics.atomic;

import java.util.Arrays;
import spx.numerics.parallel.WorkerTeam;

/**
 * Each thread accumulates into a private copy of the array, so no synchronization is needed while
 * counting. The reduction sums the copies into the copy of thread 0 and clears the others.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class MultiDoubleArray implements AtomicDoubleArray {

  /** Per-thread partial sums, indexed [thread][element]. */
  private final double[][] partial;

  /**
   * Constructor for MultiDoubleArray.
   *
   * @param nThreads the number of contributing threads.
   * @param size the number of elements.
   */
  public MultiDoubleArray(int nThreads, int size) {
    partial = new double[nThreads][size];
  }

  /** {@inheritDoc} */
  @Override
  public void add(int threadID, int index, double value) {
    partial[threadID][index] += value;
  }

  /** {@inheritDoc} */
  @Override
  public double get(int index) {
    return partial[0][index];
  }

  /** {@inheritDoc} */
  @Override
  public void reduce(int lb, int ub) {
    double[] total = partial[0];
    for (int t = 1; t < partial.length; t++) {
      double[] threadSum = partial[t];
      for (int i = lb; i <= ub; i++) {
        total[i] += threadSum[i];
        threadSum[i] = 0.0;
      }
    }
  }

  /**
   * {@inheritDoc}
   *
   * <p>Each worker reduces a disjoint block of elements.
   */
  @Override
  public void reduce(WorkerTeam workerTeam, int lb, int ub) {
    workerTeam.execute(lb, ub, (threadIndex, first, last) -> reduce(first, last));
  }

  /** {@inheritDoc} */
  @Override
  public void reset(int threadID, int lb, int ub) {
    Arrays.fill(partial[threadID], lb, ub + 1, 0.0);
  }

  /** {@inheritDoc} */
  @Override
  public int size() {
    return partial[0].length;
  }
}
