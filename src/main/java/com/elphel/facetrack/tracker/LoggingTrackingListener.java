/**
 **
 ** LoggingTrackingListener - reports tracking progress through slf4j
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  LoggingTrackingListener.java is free software: you can redistribute it and/or modify
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

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.facetrack.optimizer.OptimizationStats;
import com.elphel.facetrack.optimizer.ResidualResult;
import com.elphel.facetrack.scheduler.ScheduleConfig;

public class LoggingTrackingListener implements TrackingListener {
	private static final Logger LOGGER = LoggerFactory.getLogger(LoggingTrackingListener.class);

	@Override
	public void onOuterStart(int frame_idx, ScheduleConfig config, int num_correspondences) {
		LOGGER.info("frame {} outer {}: scale={}, active={}, damping={}, correspondences={}",
				frame_idx, config.getOuterIteration(), config.getScale(), config.getActiveParameters(),
				config.getDamping(), num_correspondences);
	}

	@Override
	public void onInnerStep(int frame_idx, ScheduleConfig config, int inner_iter, OptimizationStats stats, ResidualResult loss) {
		if (!LOGGER.isDebugEnabled()) {
			return;
		}
		LOGGER.debug("frame {} step {}:{} {} loss={} cond={} fallback={}",
				frame_idx, config.getOuterIteration(), inner_iter, stats.getStatus(),
				(loss != null) ? loss.loss() : stats.getLoss(), stats.getConditionNumber(), stats.isFallbackUsed());
		if (loss != null) {
			for (Map.Entry<String, Double> entry : loss.getInfo().entrySet()) {
				LOGGER.debug("    {} = {}", entry.getKey(), entry.getValue());
			}
		}
		if (stats.hasSystem()) {
			LOGGER.debug("    H: min={} max={} mean={}, g: min={} max={} mean={}",
					stats.getHessianMin(), stats.getHessianMax(), stats.getHessianMean(),
					stats.getGradientMin(), stats.getGradientMax(), stats.getGradientMean());
		}
	}

	@Override
	public void onFinish(TrackingResult result) {
		LOGGER.info("frame {} done: {} steps, {} applied, final loss {}{}",
				result.getFrameIdx(), result.getSteps().size(), result.getNumApplied(), result.getFinalLoss(),
				result.isCancelled() ? " (cancelled)" : (result.isAborted() ? " (aborted after failed steps)" : ""));
		for (Map.Entry<String, Double> entry : result.getSummary().entrySet()) {
			LOGGER.debug("    {} = {}", entry.getKey(), entry.getValue());
		}
		for (Map.Entry<String, Double> entry : result.getTimings().entrySet()) {
			LOGGER.info("    time {}: {} ms", entry.getKey(), String.format("%.3f", entry.getValue()));
		}
	}
}
