/**
 **
 ** LandmarkRigidOptimizer - rigid alignment of the model landmarks to detected landmarks
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LandmarkRigidOptimizer.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.elphel.facetrack.model.ParametricModel;
import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.ParameterSet;
import com.elphel.facetrack.residuals.LandmarkResidual;
import com.elphel.facetrack.residuals.ResidualChain;
import com.elphel.facetrack.scheduler.CoarseToFineScheduler;
import com.elphel.facetrack.scheduler.ScheduleConfig;
import com.elphel.facetrack.scheduler.StepSizeScheduler;

/**
 * Only translation and global rotation are free, the active parameter schedule is not
 * used. The scale and damping schedules still apply.
 */
public class LandmarkRigidOptimizer extends OptimizerFramework {
	public static final List<String> RIGID_PARAMETERS =
			Collections.unmodifiableList(Arrays.asList(ParameterSet.TRANSL, ParameterSet.GLOBAL_POSE));

	public LandmarkRigidOptimizer(ParametricModel model, TrackerParameters tracker_parameters) {
		super(model, null, tracker_parameters, ResidualChain.parse(LandmarkResidual.NAME), null, null);
	}

	@Override
	protected List<ScheduleConfig> resolveSchedule(ParameterSet params) {
		for (String name : RIGID_PARAMETERS) {
			if (!params.has(name)) {
				throw new ConfigurationException("Rigid landmark alignment needs parameter \""+name+"\"");
			}
		}
		CoarseToFineScheduler c2f =       tracker_parameters.schedule.createCoarseToFine();
		StepSizeScheduler     step_size = tracker_parameters.schedule.createStepSize();
		List<ScheduleConfig> configs = new ArrayList<ScheduleConfig>();
		for (int i = 0; i < tracker_parameters.max_iters; i++) {
			configs.add(new ScheduleConfig(i, c2f.schedule(i), RIGID_PARAMETERS, step_size.damping(i)));
		}
		return configs;
	}
}
