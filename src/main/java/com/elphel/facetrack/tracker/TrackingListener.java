/**
 **
 ** TrackingListener - observer of the tracking loop, no effect on the computation
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TrackingListener.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.tracker;

import com.elphel.facetrack.optimizer.OptimizationStats;
import com.elphel.facetrack.optimizer.ResidualResult;
import com.elphel.facetrack.scheduler.ScheduleConfig;

public interface TrackingListener {
	TrackingListener NONE = new TrackingListener() {};

	/**
	 * @param frame_idx          first frame of the batch
	 * @param config             schedule of this outer iteration
	 * @param num_correspondences selected correspondences of all batch items, -1 when not rendered
	 */
	default void onOuterStart(int frame_idx, ScheduleConfig config, int num_correspondences) {
	}

	/**
	 * @param loss residuals after the step, null when loss logging is off
	 */
	default void onInnerStep(int frame_idx, ScheduleConfig config, int inner_iter, OptimizationStats stats, ResidualResult loss) {
	}

	default void onFinish(TrackingResult result) {
	}
}
