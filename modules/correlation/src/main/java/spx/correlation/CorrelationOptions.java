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

import java.util.Locale;
import org.apache.commons.configuration2.CompositeConfiguration;
import org.apache.commons.configuration2.ex.ConversionException;
import spx.crystal.PeriodicBox;
import spx.numerics.atomic.AtomicDoubleArray.AtomicDoubleArrayImpl;
import spx.utilities.InvalidConfigurationException;

/**
 * Options that control a pair correlation calculation.
 *
 * <p>The keys read by {@link #fromProperties(CompositeConfiguration)} are <code>rmin</code>,
 * <code>rmax</code>, <code>nr</code>, <code>nphi</code>, <code>ntheta</code>,
 * <code>weight-exponent</code>, <code>spx.threads</code> and <code>histogram-reduction</code>.
 *
 * @author Michael J. Schnieders
 * @since 1.0
 */
public class CorrelationOptions {

  /** The default number of radial bins. */
  public static final int DEFAULT_NR = 100;

  private double rmin = 0.0;
  /** NaN selects half of the largest box side. */
  private double rmax = Double.NaN;
  private int nr = DEFAULT_NR;
  private int nphi = 1;
  private int ntheta = 1;
  private double weightExponent = 1.0;
  private int threads = Runtime.getRuntime().availableProcessors();
  private AtomicDoubleArrayImpl reduction = AtomicDoubleArrayImpl.MULTI;

  /**
   * Read options from properties. Keys that are absent keep their defaults.
   *
   * @param properties a {@link org.apache.commons.configuration2.CompositeConfiguration} object.
   * @return the options.
   * @throws InvalidConfigurationException if a value cannot be parsed.
   */
  public static CorrelationOptions fromProperties(CompositeConfiguration properties) {
    CorrelationOptions options = new CorrelationOptions();
    try {
      options.setRmin(properties.getDouble("rmin", options.rmin));
      options.setRmax(properties.getDouble("rmax", options.rmax));
      options.setNr(properties.getInt("nr", options.nr));
      options.setNphi(properties.getInt("nphi", options.nphi));
      options.setNtheta(properties.getInt("ntheta", options.ntheta));
      options.setWeightExponent(properties.getDouble("weight-exponent", options.weightExponent));
      options.setThreads(properties.getInt("spx.threads", options.threads));
    } catch (ConversionException e) {
      throw new InvalidConfigurationException(" Could not parse the correlation properties.", e);
    }
    String reduction = properties.getString("histogram-reduction", null);
    if (reduction != null) {
      try {
        options.setReduction(AtomicDoubleArrayImpl.valueOf(reduction.trim().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new InvalidConfigurationException(
            format(" Unknown histogram reduction %s (expected MULTI or ADDER).", reduction), e);
      }
    }
    return options;
  }

  public double getRmin() {
    return rmin;
  }

  public void setRmin(double rmin) {
    this.rmin = rmin;
  }

  /**
   * The cutoff, which is also the upper edge of the radial bins.
   *
   * @param box the periodic box.
   * @return rmax, or half of the largest side if it was not set.
   */
  public double getRmax(PeriodicBox box) {
    return Double.isNaN(rmax) ? 0.5 * box.maximumSide() : rmax;
  }

  /**
   * Set the cutoff. NaN restores the default of half the largest box side.
   *
   * @param rmax the cutoff.
   */
  public void setRmax(double rmax) {
    this.rmax = rmax;
  }

  public int getNr() {
    return nr;
  }

  public void setNr(int nr) {
    this.nr = nr;
  }

  public int getNphi() {
    return nphi;
  }

  public void setNphi(int nphi) {
    this.nphi = nphi;
  }

  public int getNtheta() {
    return ntheta;
  }

  public void setNtheta(int ntheta) {
    this.ntheta = ntheta;
  }

  public double getWeightExponent() {
    return weightExponent;
  }

  public void setWeightExponent(double weightExponent) {
    this.weightExponent = weightExponent;
  }

  public int getThreads() {
    return threads;
  }

  /**
   * Set the number of worker threads.
   *
   * @param threads the thread count; must be positive.
   */
  public void setThreads(int threads) {
    if (threads < 1) {
      throw new InvalidConfigurationException(format(" The thread count must be positive (%d).", threads));
    }
    this.threads = threads;
  }

  public AtomicDoubleArrayImpl getReduction() {
    return reduction;
  }

  public void setReduction(AtomicDoubleArrayImpl reduction) {
    this.reduction = reduction;
  }

  /**
   * Create the bins for a box.
   *
   * @param box the periodic box.
   * @return the bins.
   */
  public BinSpec toBinSpec(PeriodicBox box) {
    return new BinSpec(box.getDimension(), rmin, getRmax(box), nr, nphi, ntheta);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return format(" Correlation options: rmin %s, rmax %s, nr %d, nphi %d, ntheta %d, z %s, "
        + "threads %d, reduction %s", rmin, Double.isNaN(rmax) ? "default" : rmax, nr, nphi,
        ntheta, weightExponent, threads, reduction);
  }
}
