/**
 **
 ** FinetuneScheduler - active parameter groups per outer iteration
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FinetuneScheduler.java is free software: you can redistribute it and/or modify
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.elphel.facetrack.common.EProperties;
import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.DifferentiableOptimizer;
import com.elphel.facetrack.optimizer.ParameterSet;

/**
 * Milestones map the first outer iteration to the groups unfrozen there, for example
 * "0:transl,global_pose;3:expression;6:shape,neck_pose,jaw_pose". In cumulative mode a
 * milestone adds its groups to the previous ones, otherwise it replaces them.
 */
public class FinetuneScheduler {
	private final TreeMap<Integer, List<String>> milestones = new TreeMap<Integer, List<String>>();
	private final boolean cumulative;
	private final boolean allow_shrink;

	public FinetuneScheduler(Map<Integer, List<String>> milestones, boolean cumulative, boolean allow_shrink) {
		if (!milestones.containsKey(0)) {
			throw new ConfigurationException("Active parameter schedule should start at outer iteration 0");
		}
		this.cumulative =   cumulative;
		this.allow_shrink = allow_shrink;
		List<String> previous = Collections.emptyList();
		TreeMap<Integer, List<String>> sorted = new TreeMap<Integer, List<String>>(milestones);
		for (Map.Entry<Integer, List<String>> entry : sorted.entrySet()) {
			if (entry.getKey() < 0) {
				throw new ConfigurationException("Negative milestone "+entry.getKey()+" in the active parameter schedule");
			}
			LinkedHashSet<String> names = new LinkedHashSet<String>();
			if (cumulative) {
				names.addAll(previous);
			}
			for (String name : entry.getValue()) {
				if (!names.add(name) && !cumulative) {
					throw new ConfigurationException("Parameter \""+name+"\" is listed more than once at milestone "+entry.getKey());
				}
			}
			List<String> active = Collections.unmodifiableList(new ArrayList<String>(names));
			if (!allow_shrink && (active.size() < previous.size())) {
				throw new ConfigurationException("Active parameter set shrinks at milestone "+entry.getKey()+
						" ("+previous+" -> "+active+"), set allow_shrink to permit it");
			}
			this.milestones.put(entry.getKey(), active);
			previous = active;
		}
	}

	/**
	 * @param declaration "iter:name,name;iter:name..."
	 */
	public static FinetuneScheduler parse(String declaration, boolean cumulative, boolean allow_shrink) {
		TreeMap<Integer, List<String>> milestones = new TreeMap<Integer, List<String>>();
		if (declaration != null) {
			for (String item : declaration.split(";")) {
				if (item.trim().isEmpty()) {
					continue;
				}
				int sep = item.indexOf(':');
				if (sep < 0) {
					throw new ConfigurationException("Malformed active parameter milestone \""+item+"\", expected iter:names");
				}
				int iter;
				try {
					iter = Integer.parseInt(item.substring(0, sep).trim());
				} catch (NumberFormatException e) {
					throw new ConfigurationException("Malformed milestone iteration in \""+item+"\"", e);
				}
				if (milestones.containsKey(iter)) {
					throw new ConfigurationException("Milestone "+iter+" is declared more than once");
				}
				List<String> names = new ArrayList<String>();
				for (String name : EProperties.splitList(item.substring(sep + 1))) {
					names.add(name);
				}
				milestones.put(iter, names);
			}
		}
		return new FinetuneScheduler(milestones, cumulative, allow_shrink);
	}

	/** same groups for all iterations */
	public static FinetuneScheduler constant(List<String> names) {
		TreeMap<Integer, List<String>> milestones = new TreeMap<Integer, List<String>>();
		milestones.put(0, names);
		return new FinetuneScheduler(milestones, true, false);
	}

	/**
	 * Check every scheduled name against the parameter set
	 * @throws ConfigurationException for unknown names
	 */
	public void validate(ParameterSet params) {
		for (Map.Entry<Integer, List<String>> entry : milestones.entrySet()) {
			for (String name : entry.getValue()) {
				if (!params.has(name)) {
					throw new ConfigurationException("Unknown parameter \""+name+"\" scheduled at outer iteration "+
							entry.getKey()+", defined are "+params.names());
				}
			}
		}
	}

	public List<String> activeParams(int outer_iter) {
		return milestones.floorEntry(Math.max(outer_iter, 0)).getValue();
	}

	public void configureOptimizer(DifferentiableOptimizer optimizer, int outer_iter) {
		optimizer.setActiveParameters(activeParams(outer_iter));
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (Map.Entry<Integer, List<String>> entry : milestones.entrySet()) {
			if (sb.length() > 0) {
				sb.append(";");
			}
			sb.append(entry.getKey()).append(":").append(String.join(",", entry.getValue()));
		}
		return sb.toString();
	}
}
