/**
 **
 ** TrackingResult - final parameters of a tracking call with step statistics and timings
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TrackingResult.java is free software: you can redistribute it and/or modify
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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.elphel.facetrack.optimizer.OptimizationStats;
import com.elphel.facetrack.optimizer.ParameterSet;
import com.elphel.facetrack.regularize.RegularizeOutput;
import com.elphel.facetrack.scheduler.ScheduleConfig;

public class TrackingResult {
	private final int                     frame_idx;
	private final ParameterSet            params;
	private final List<OptimizationStats> steps;
	private final List<ScheduleConfig>    schedule;     // executed outer iterations
	private final List<Integer>           correspondences;
	private final List<double []>         weight_stats; // min, max, mean per outer iteration
	private final List<RegularizeOutput>  regularize;
	private final Map<String, Double>     timings;
	private final double                  final_loss;
	private final boolean                 cancelled;
	private final boolean                 aborted;

	public TrackingResult(
			int                     frame_idx,
			ParameterSet            params,
			List<OptimizationStats> steps,
			List<ScheduleConfig>    schedule,
			List<Integer>           correspondences,
			List<double []>         weight_stats,
			List<RegularizeOutput>  regularize,
			Map<String, Double>     timings,
			double                  final_loss,
			boolean                 cancelled,
			boolean                 aborted)
	{
		this.frame_idx =       frame_idx;
		this.params =          params;
		this.steps =           Collections.unmodifiableList(new ArrayList<OptimizationStats>(steps));
		this.schedule =        Collections.unmodifiableList(new ArrayList<ScheduleConfig>(schedule));
		this.correspondences = Collections.unmodifiableList(new ArrayList<Integer>(correspondences));
		this.weight_stats =    Collections.unmodifiableList(new ArrayList<double []>(weight_stats));
		this.regularize =      Collections.unmodifiableList(new ArrayList<RegularizeOutput>(regularize));
		this.timings =         Collections.unmodifiableMap(new LinkedHashMap<String, Double>(timings));
		this.final_loss =      final_loss;
		this.cancelled =       cancelled;
		this.aborted =         aborted;
	}

	public int                     getFrameIdx()        {return frame_idx;}
	public ParameterSet            getParams()          {return params.copy();}
	public List<OptimizationStats> getSteps()           {return steps;}
	public List<ScheduleConfig>    getSchedule()        {return schedule;}
	public List<Integer>           getCorrespondences() {return correspondences;}
	public List<RegularizeOutput>  getRegularize()      {return regularize;}
	public Map<String, Double>     getTimings()         {return timings;}
	public double                  getFinalLoss()       {return final_loss;}
	public boolean                 isCancelled()        {return cancelled;}
	public boolean                 isAborted()          {return aborted;}

	public int getNumOuterIterations() {
		return schedule.size();
	}

	public int getNumApplied() {
		int n = 0;
		for (OptimizationStats s : steps) {
			if (s.isUpdateApplied()) n++;
		}
		return n;
	}

	/**
	 * @return step statistics summary, regularization summary and the robust weight range of
	 *         the last outer iteration
	 */
	public Map<String, Double> getSummary() {
		Map<String, Double> summary = new LinkedHashMap<String, Double>();
		if (!weight_stats.isEmpty()) {
			double [] last = weight_stats.get(weight_stats.size() - 1);
			summary.put("min_weight", last[0]);
			summary.put("max_weight", last[1]);
		}
		summary.putAll(OptimizationStats.summarize(steps));
		summary.putAll(RegularizeOutput.summarize(regularize));
		return summary;
	}
}
