/**
 **
 ** ScheduleConfig - resolution scale, active parameters and damping of one outer iteration
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ScheduleConfig.java is free software: you can redistribute it and/or modify
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
import java.util.Collections;
import java.util.List;

public final class ScheduleConfig {
	private final int          outer_iter;
	private final int          scale;
	private final List<String> active_names;
	private final double       damping;

	public ScheduleConfig(int outer_iter, int scale, List<String> active_names, double damping) {
		this.outer_iter =   outer_iter;
		this.scale =        scale;
		this.active_names = Collections.unmodifiableList(new ArrayList<String>(active_names));
		this.damping =      damping;
	}

	public int          getOuterIteration()    {return outer_iter;}
	public int          getScale()             {return scale;}
	public List<String> getActiveParameters()  {return active_names;}
	public double       getDamping()           {return damping;}

	@Override
	public String toString() {
		return "ScheduleConfig{iter="+outer_iter+", scale="+scale+", active="+active_names+", damping="+damping+"}";
	}
}
