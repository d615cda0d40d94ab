/**
 **
 ** ScheduleParameters - coarse-to-fine, active parameter and damping schedules as properties
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ScheduleParameters.java is free software: you can redistribute it and/or modify
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

import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import com.elphel.facetrack.common.EProperties;
import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.ParameterSet;

public class ScheduleParameters implements Cloneable {
	public int []  c2f_scales =            {1};
	public int []  c2f_breakpoints =       {};
	public String  active_milestones =     "0:transl,global_pose;2:expression;4:shape,neck_pose,jaw_pose";
	public boolean active_cumulative =     true;
	public boolean active_allow_shrink =   false;
	public String  damping_policy =        StepSizeScheduler.POLICY_CONSTANT;
	public double  damping_initial =       0.0;
	public double  damping_rate =          1.0;
	public int     damping_step =          1;

	public CoarseToFineScheduler createCoarseToFine() {
		return new CoarseToFineScheduler(c2f_scales, c2f_breakpoints);
	}

	public FinetuneScheduler createFinetune() {
		return FinetuneScheduler.parse(active_milestones, active_cumulative, active_allow_shrink);
	}

	public StepSizeScheduler createStepSize() {
		return new StepSizeScheduler(damping_policy, damping_initial, damping_rate, damping_step);
	}

	/**
	 * Build and check all schedules before any solve
	 * @param max_iters number of outer iterations
	 * @param params    parameter set the active names refer to
	 * @return one configuration per outer iteration
	 * @throws ConfigurationException on malformed schedules or unknown parameter names
	 */
	public List<ScheduleConfig> resolve(int max_iters, ParameterSet params) {
		CoarseToFineScheduler c2f = createCoarseToFine();
		FinetuneScheduler finetune = createFinetune();
		StepSizeScheduler step_size = createStepSize();
		finetune.validate(params);
		List<ScheduleConfig> configs = new ArrayList<ScheduleConfig>();
		for (int i = 0; i < max_iters; i++) {
			configs.add(new ScheduleConfig(i, c2f.schedule(i), finetune.activeParams(i), step_size.damping(i)));
		}
		return configs;
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"c2f_scales",          EProperties.joinList(this.c2f_scales));
		properties.setProperty(prefix+"c2f_breakpoints",     EProperties.joinList(this.c2f_breakpoints));
		properties.setProperty(prefix+"active_milestones",   this.active_milestones);
		properties.setProperty(prefix+"active_cumulative",   this.active_cumulative+"");
		properties.setProperty(prefix+"active_allow_shrink", this.active_allow_shrink+"");
		properties.setProperty(prefix+"damping_policy",      this.damping_policy);
		properties.setProperty(prefix+"damping_initial",     this.damping_initial+"");
		properties.setProperty(prefix+"damping_rate",        this.damping_rate+"");
		properties.setProperty(prefix+"damping_step",        this.damping_step+"");
	}

	public void getProperties(String prefix,Properties properties){
		try {
			if (properties.getProperty(prefix+"c2f_scales")!=null)          this.c2f_scales=EProperties.parseInts(properties.getProperty(prefix+"c2f_scales"));
			if (properties.getProperty(prefix+"c2f_breakpoints")!=null)     this.c2f_breakpoints=EProperties.parseInts(properties.getProperty(prefix+"c2f_breakpoints"));
			if (properties.getProperty(prefix+"active_milestones")!=null)   this.active_milestones=properties.getProperty(prefix+"active_milestones").trim();
			if (properties.getProperty(prefix+"active_cumulative")!=null)   this.active_cumulative=Boolean.parseBoolean(properties.getProperty(prefix+"active_cumulative").trim());
			if (properties.getProperty(prefix+"active_allow_shrink")!=null) this.active_allow_shrink=Boolean.parseBoolean(properties.getProperty(prefix+"active_allow_shrink").trim());
			if (properties.getProperty(prefix+"damping_policy")!=null)      this.damping_policy=properties.getProperty(prefix+"damping_policy").trim();
			if (properties.getProperty(prefix+"damping_initial")!=null)     this.damping_initial=Double.parseDouble(properties.getProperty(prefix+"damping_initial"));
			if (properties.getProperty(prefix+"damping_rate")!=null)        this.damping_rate=Double.parseDouble(properties.getProperty(prefix+"damping_rate"));
			if (properties.getProperty(prefix+"damping_step")!=null)        this.damping_step=Integer.parseInt(properties.getProperty(prefix+"damping_step").trim());
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Malformed schedule property with prefix \""+prefix+"\": "+e.getMessage(), e);
		}
	}

	@Override
	public ScheduleParameters clone() {
		ScheduleParameters sp = new ScheduleParameters();
		sp.c2f_scales =          this.c2f_scales.clone();
		sp.c2f_breakpoints =     this.c2f_breakpoints.clone();
		sp.active_milestones =   this.active_milestones;
		sp.active_cumulative =   this.active_cumulative;
		sp.active_allow_shrink = this.active_allow_shrink;
		sp.damping_policy =      this.damping_policy;
		sp.damping_initial =     this.damping_initial;
		sp.damping_rate =        this.damping_rate;
		sp.damping_step =        this.damping_step;
		return sp;
	}
}
