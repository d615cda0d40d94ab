/**
 **
 ** CoarseToFineScheduler - working resolution scale per outer iteration
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  CoarseToFineScheduler.java is free software: you can redistribute it and/or modify
 **  it under the terms of the GNU General Public License as published by
 **  the Free Software Foundation, either version 3 of the License, or
 **  (at your option) any later version.
 **
 **  This program is distributed in the hope that it will be useful,
 **  but WITHOUT ANY WARRANTY; without even the implied warranty of
 **  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 **  GNU General Public License for more details.
 **
 **  You should have received a copy of the GNU General Public License
 **  along with this program.  If not, see <http://www.gnu.org/licenses/>.
 ** -----------------------------------------------------------------------------**
 **
 */
package com.elphel.facetrack.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.facetrack.model.Rescalable;
import com.elphel.facetrack.optimizer.ConfigurationException;

/**
 * Scale scales[k] is used for breakpoints[k-1] &lt;= outer_iter &lt; breakpoints[k]. Scales
 * are positive and non-increasing, breakpoints are positive and strictly increasing.
 */
public class CoarseToFineScheduler {
	private static final Logger LOGGER = LoggerFactory.getLogger(CoarseToFineScheduler.class);

	private final int [] scales;
	private final int [] breakpoints;
	private int          applied_scale = -1;

	public CoarseToFineScheduler(int [] scales, int [] breakpoints) {
		if (scales.length != (breakpoints.length + 1)) {
			throw new ConfigurationException("Coarse-to-fine schedule needs one more scale than breakpoints, got "+
					scales.length+" scales and "+breakpoints.length+" breakpoints");
		}
		for (int i = 0; i < scales.length; i++) {
			if ((scales[i] < 1) || ((i > 0) && (scales[i] > scales[i - 1]))) {
				throw new ConfigurationException("Coarse-to-fine scales should be positive and non-increasing");
			}
		}
		for (int i = 0; i < breakpoints.length; i++) {
			if ((breakpoints[i] < 1) || ((i > 0) && (breakpoints[i] <= breakpoints[i - 1]))) {
				throw new ConfigurationException("Coarse-to-fine breakpoints should be positive and increasing");
			}
		}
		this.scales =      scales.clone();
		this.breakpoints = breakpoints.clone();
	}

	/** single scale 1, full resolution from the start */
	public static CoarseToFineScheduler fullResolution() {
		return new CoarseToFineScheduler(new int [] {1}, new int [0]);
	}

	public int schedule(int outer_iter) {
		int k = 0;
		while ((k < breakpoints.length) && (outer_iter >= breakpoints[k])) {
			k++;
		}
		return scales[k];
	}

	/**
	 * Rescale the collaborators when the scale of this iteration differs from the last
	 * applied one (always on the first call after reset())
	 * @return scale of the iteration
	 */
	public int apply(int outer_iter, Rescalable ... targets) {
		int scale = schedule(outer_iter);
		if (scale != applied_scale) {
			LOGGER.debug("outer iteration {}: rescaling {} collaborators to scale {}", outer_iter, targets.length, scale);
			for (Rescalable target : targets) {
				if (target != null) {
					target.rescale(scale);
				}
			}
			applied_scale = scale;
		}
		return scale;
	}

	public void reset() {
		applied_scale = -1;
	}
}
