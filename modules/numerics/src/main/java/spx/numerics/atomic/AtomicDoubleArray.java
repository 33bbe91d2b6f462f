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

import spx.numerics.parallel.WorkerTeam;

/**
 * A double array that several threads accumulate into at once, such as the cells of a histogram.
 * Each contribution is tagged with the index of the thread that makes it. Once all threads are
 * done, {@link #reduce(int, int)} combines the contributions so that {@link #get(int)} returns the
 * totals.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public interface AtomicDoubleArray {

  /**
   * Create an AtomicDoubleArray.
   *
   * @param atomicDoubleArrayImpl the implementation.
   * @param threads the number of threads that will contribute.
   * @param size the number of elements.
   * @return a zeroed AtomicDoubleArray.
   */
  static AtomicDoubleArray atomicDoubleArrayFactory(
      AtomicDoubleArrayImpl atomicDoubleArrayImpl, int threads, int size) {
    return switch (atomicDoubleArrayImpl) {
      case ADDER -> new AdderDoubleArray(size);
      case MULTI -> new MultiDoubleArray(threads, size);
    };
  }

  /**
   * Accumulate a contribution.
   *
   * @param threadID the index of the contributing thread.
   * @param index the element.
   * @param value the contribution.
   */
  void add(int threadID, int index, double value);

  /**
   * The total of one element. Only valid after the element has been reduced.
   *
   * @param index the element.
   * @return the total.
   */
  double get(int index);

  /**
   * Combine the contributions of all threads for elements lb .. ub.
   *
   * @param lb the first element.
   * @param ub the last element.
   */
  void reduce(int lb, int ub);

  /**
   * Combine the contributions of all threads for elements lb .. ub in parallel.
   *
   * @param workerTeam the team that runs the reduction.
   * @param lb the first element.
   * @param ub the last element.
   */
  void reduce(WorkerTeam workerTeam, int lb, int ub);

  /**
   * Zero elements lb .. ub for one thread.
   *
   * @param threadID the thread.
   * @param lb the first element.
   * @param ub the last element.
   */
  void reset(int threadID, int lb, int ub);

  /**
   * The number of elements.
   *
   * @return the size.
   */
  int size();

  /**
   * Copy the totals into a new array.
   *
   * @return the totals.
   */
  default double[] toArray() {
    double[] values = new double[size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = get(i);
    }
    return values;
  }

  /** The available implementations. */
  enum AtomicDoubleArrayImpl {
    /** One DoubleAdder per element; contributions are combined as they arrive. */
    ADDER,
    /** One private array per thread, summed by an explicit reduction. */
    MULTI
  }
}
