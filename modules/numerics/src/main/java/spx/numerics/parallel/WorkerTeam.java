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
package spx.numerics.parallel;

import static java.lang.String.format;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.IntStream;

/**
 * A WorkerTeam executes parallel for loops on a fixed number of threads. An inclusive index range
 * is split into one contiguous chunk per thread; chunk <code>t</code> is always executed with
 * <code>threadIndex = t</code>.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class WorkerTeam implements AutoCloseable {

  private static final Logger logger = Logger.getLogger(WorkerTeam.class.getName());

  /** Number of threads used by the team. */
  private final int threadCount;
  /** The pool that executes each chunk. */
  private final ForkJoinPool pool;

  /** Construct a WorkerTeam with one thread per available processor. */
  public WorkerTeam() {
    this(Runtime.getRuntime().availableProcessors());
  }

  /**
   * Construct a WorkerTeam.
   *
   * @param threadCount the number of threads.
   */
  public WorkerTeam(int threadCount) {
    if (threadCount < 1) {
      throw new IllegalArgumentException(format(" The thread count must be positive (%d).", threadCount));
    }
    this.threadCount = threadCount;
    pool = new ForkJoinPool(threadCount);
  }

  /**
   * Getter for the thread count.
   *
   * @return the number of threads.
   */
  public int getThreadCount() {
    return threadCount;
  }

  /**
   * Execute a parallel loop over the inclusive range lb .. ub. Nothing is executed if ub &lt; lb.
   *
   * @param lb the first index.
   * @param ub the last index.
   * @param loop the loop body.
   */
  public void execute(int lb, int ub, RangeLoop loop) {
    if (ub < lb) {
      return;
    }
    long n = (long) ub - lb + 1;
    int chunks = (int) Math.min(threadCount, n);
    if (chunks == 1) {
      loop.run(0, lb, ub);
      return;
    }
    try {
      pool.submit(() -> IntStream.range(0, chunks).parallel().forEach(t -> {
        int first = (int) (lb + n * t / chunks);
        int last = (int) (lb + n * (t + 1) / chunks - 1);
        loop.run(t, first, last);
      })).get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.SEVERE, " Interrupted while executing a parallel loop.", e);
      throw new IllegalStateException("Interrupted while executing a parallel loop.", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      logger.log(Level.SEVERE, " Exception executing a parallel loop.", cause);
      throw new IllegalStateException("Exception executing a parallel loop.", cause);
    }
  }

  /** Shut down the threads of this team. */
  @Override
  public void close() {
    pool.shutdown();
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Worker team with %d threads.", threadCount);
  }
}
