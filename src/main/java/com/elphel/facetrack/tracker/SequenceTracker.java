/**
 **
 ** SequenceTracker - tracks frames in order, each warm-started from an earlier result
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SequenceTracker.java is free software: you can redistribute it and/or modify
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
import java.util.List;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.facetrack.model.DataPipeline;
import com.elphel.facetrack.model.FrameBatch;
import com.elphel.facetrack.model.FrameData;
import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.ParameterSet;

/**
 * Frame i starts from the result of frame i - jump_size, the first jump_size frames start
 * from the initial guess. Frames are never processed concurrently.
 */
public class SequenceTracker {
	private static final Logger LOGGER = LoggerFactory.getLogger(SequenceTracker.class);

	private final OptimizerFramework   tracker;
	private final int                  jump_size;
	private final List<TrackingResult> results = new ArrayList<TrackingResult>();
	private volatile boolean           cancel_requested = false;

	public SequenceTracker(OptimizerFramework tracker) {
		this(tracker, tracker.getTrackerParameters().jump_size);
	}

	public SequenceTracker(OptimizerFramework tracker, int jump_size) {
		if (jump_size < 1) {
			throw new ConfigurationException("jump_size should be positive, got "+jump_size);
		}
		this.tracker =   tracker;
		this.jump_size = jump_size;
	}

	/**
	 * Stop after the current outer iteration, the frame in progress keeps the parameters of
	 * that iteration and no further frames are started. Safe to call from another thread.
	 */
	public void cancel() {
		cancel_requested = true;
	}

	public boolean isCancelled() {
		return cancel_requested;
	}

	public List<TrackingResult> getResults() {
		return Collections.unmodifiableList(results);
	}

	public List<TrackingResult> trackFrames(List<FrameData> frames, ParameterSet init_params) {
		List<DataPipeline> pipelines = new ArrayList<DataPipeline>();
		for (FrameData frame : frames) {
			pipelines.add(DataPipeline.of(FrameBatch.of(frame)));
		}
		return track(pipelines, init_params);
	}

	/**
	 * @param frames      one pipeline per frame, in sequence order
	 * @param init_params initial guess of the first frames
	 * @return results of the processed frames
	 */
	public List<TrackingResult> track(List<DataPipeline> frames, ParameterSet init_params) {
		results.clear();
		cancel_requested = false;
		BooleanSupplier cancel = () -> cancel_requested;
		tracker.setCancel(cancel);
		try {
			for (int i = 0; i < frames.size(); i++) {
				if (cancel_requested) {
					break;
				}
				ParameterSet warm = (i >= jump_size) ? results.get(i - jump_size).getParams() : init_params;
				TrackingResult result = tracker.track(frames.get(i), warm);
				results.add(result);
				LOGGER.debug("sequence frame {} ({} of {}) tracked, loss {}", result.getFrameIdx(), i + 1, frames.size(),
						result.getFinalLoss());
			}
		} finally {
			tracker.setCancel(null);
		}
		return getResults();
	}
}
