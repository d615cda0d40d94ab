/**
 **
 ** SequenceTrackerTest - tests of frame sequence tracking with warm starts
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SequenceTrackerTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.elphel.facetrack.model.FrameData;
import com.elphel.facetrack.model.LinearBlendshapeModel;
import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.ParameterSet;
import com.elphel.facetrack.scheduler.ScheduleConfig;

public class SequenceTrackerTest {
	private LinearBlendshapeModel model;
	private List<ParameterSet>    gts;
	private List<FrameData>       frames;
	private ParameterSet          init;

	@BeforeEach
	void setUp() {
		model = TrackingFixtures.createModel();
		ParameterSet gt = TrackingFixtures.groundTruth(model);
		gts =    new ArrayList<ParameterSet>();
		frames = new ArrayList<FrameData>();
		for (int i = 0; i < 4; i++) {
			ParameterSet p = gt.copy();
			double [] t = p.get(ParameterSet.TRANSL);
			p.set(ParameterSet.TRANSL, new double [] {t[0] + 0.005 * i, t[1], t[2]});
			gts.add(p);
			frames.add(TrackingFixtures.observe(model, 100 + i, p));
		}
		init = TrackingFixtures.perturbRigid(gt);
	}

	private ICPOptimizer createTracker() {
		return new ICPOptimizer(model, new TrackingFixtures.VertexSplatRenderer(), TrackingFixtures.rigidParameters("point2point"));
	}

	@Test
	@DisplayName("every frame is tracked from the previous result")
	void warmStart() {
		List<TrackingResult> results = new SequenceTracker(createTracker()).trackFrames(frames, init);
		assertEquals(4, results.size());
		for (int i = 0; i < results.size(); i++) {
			assertEquals(100 + i, results.get(i).getFrameIdx());
			assertTrue(TrackingFixtures.maxDifference(results.get(i).getParams(), gts.get(i),
					ParameterSet.TRANSL, ParameterSet.GLOBAL_POSE) < 1e-6);
		}
		// frame 1 starts 5 mm away from its pose
		assertEquals(0.5 * 25 * 0.005 * 0.005, results.get(1).getSteps().get(0).getLoss(), 1e-9);
		assertTrue(results.get(1).getSteps().get(0).getLoss() < results.get(0).getSteps().get(0).getLoss());
	}

	@Test
	@DisplayName("jump size selects the warm start frame")
	void jump() {
		List<TrackingResult> results = new SequenceTracker(createTracker(), 2).trackFrames(frames, init);
		double first_loss_0 = results.get(0).getSteps().get(0).getLoss();
		assertEquals(first_loss_0, results.get(1).getSteps().get(0).getLoss(), first_loss_0 * 0.5);
		assertEquals(0.5 * 25 * 0.01 * 0.01, results.get(2).getSteps().get(0).getLoss(), 1e-9);
		assertThrows(ConfigurationException.class, () -> new SequenceTracker(createTracker(), 0));
	}

	@Test
	@DisplayName("cancel stops the frame in progress and the rest of the sequence")
	void cancel() {
		ICPOptimizer tracker = createTracker();
		final SequenceTracker sequence = new SequenceTracker(tracker);
		tracker.setListener(new TrackingListener() {
			@Override
			public void onOuterStart(int frame_idx, ScheduleConfig config, int num_correspondences) {
				if (frame_idx == 101) {
					sequence.cancel();
				}
			}
		});
		List<TrackingResult> results = sequence.trackFrames(frames, init);
		assertEquals(2, results.size());
		assertFalse(results.get(0).isCancelled());
		assertTrue(results.get(1).isCancelled());
		assertEquals(1, results.get(1).getNumOuterIterations());
		assertTrue(sequence.isCancelled());
	}
}
