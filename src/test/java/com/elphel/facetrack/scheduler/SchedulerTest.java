/**
 **
 ** SchedulerTest - tests of coarse-to-fine, active parameter and damping schedules
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SchedulerTest.java is free software: you can redistribute it and/or modify
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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.elphel.facetrack.model.Rescalable;
import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.DifferentiableOptimizer;
import com.elphel.facetrack.optimizer.OptimizerParameters;
import com.elphel.facetrack.optimizer.ParameterSet;

public class SchedulerTest {

	private static ParameterSet params() {
		return new ParameterSet()
				.add(ParameterSet.TRANSL,      0, 0, 0)
				.add(ParameterSet.GLOBAL_POSE, 0, 0, 0)
				.add(ParameterSet.EXPRESSION,  0, 0)
				.add(ParameterSet.SHAPE,       0, 0);
	}

	@Nested
	@DisplayName("coarse-to-fine")
	class CoarseToFine {
		@Test
		@DisplayName("scale follows the breakpoints")
		void schedule() {
			CoarseToFineScheduler c2f = new CoarseToFineScheduler(new int [] {4, 2, 1}, new int [] {3, 6});
			int [] expected = {4, 4, 4, 2, 2, 2, 1, 1, 1, 1};
			for (int i = 0; i < expected.length; i++) {
				assertEquals(expected[i], c2f.schedule(i), "outer iteration "+i);
			}
			assertEquals(1, CoarseToFineScheduler.fullResolution().schedule(0));
			assertEquals(1, CoarseToFineScheduler.fullResolution().schedule(100));
		}

		@Test
		@DisplayName("collaborators are rescaled only when the scale changes")
		void apply() {
			final List<Integer> calls = new ArrayList<Integer>();
			Rescalable target = scale -> calls.add(scale);
			CoarseToFineScheduler c2f = new CoarseToFineScheduler(new int [] {4, 2, 1}, new int [] {3, 6});
			for (int i = 0; i < 8; i++) {
				c2f.apply(i, target, null);
			}
			assertEquals(Arrays.asList(4, 2, 1), calls);
			c2f.reset();
			c2f.apply(7, target);
			assertEquals(Arrays.asList(4, 2, 1, 1), calls);
		}

		@Test
		@DisplayName("inconsistent schedules are rejected")
		void invalid() {
			assertThrows(ConfigurationException.class, () -> new CoarseToFineScheduler(new int [] {4, 2}, new int [] {3, 6}));
			assertThrows(ConfigurationException.class, () -> new CoarseToFineScheduler(new int [] {2, 4}, new int [] {3}));
			assertThrows(ConfigurationException.class, () -> new CoarseToFineScheduler(new int [] {0}, new int [0]));
			assertThrows(ConfigurationException.class, () -> new CoarseToFineScheduler(new int [] {4, 2, 1}, new int [] {6, 3}));
		}
	}

	@Nested
	@DisplayName("active parameters")
	class Finetune {
		@Test
		@DisplayName("cumulative milestones grow the active set")
		void cumulative() {
			FinetuneScheduler ft = FinetuneScheduler.parse("0:transl,global_pose;2:expression;4:shape", true, false);
			assertEquals(Arrays.asList("transl", "global_pose"), ft.activeParams(0));
			assertEquals(Arrays.asList("transl", "global_pose"), ft.activeParams(1));
			assertEquals(Arrays.asList("transl", "global_pose", "expression"), ft.activeParams(3));
			assertEquals(Arrays.asList("transl", "global_pose", "expression", "shape"), ft.activeParams(9));
			assertEquals("0:transl,global_pose;2:transl,global_pose,expression;4:transl,global_pose,expression,shape",
					ft.toString());
			ft.validate(params());
		}

		@Test
		@DisplayName("shrinking sets need explicit permission")
		void shrink() {
			assertThrows(ConfigurationException.class, () -> FinetuneScheduler.parse("0:transl,global_pose;2:shape", false, false));
			FinetuneScheduler ft = FinetuneScheduler.parse("0:transl,global_pose;2:shape", false, true);
			assertEquals(Collections.singletonList("shape"), ft.activeParams(2));
		}

		@Test
		@DisplayName("malformed or unknown declarations are configuration errors")
		void invalid() {
			assertThrows(ConfigurationException.class, () -> FinetuneScheduler.parse("1:transl", true, false));
			assertThrows(ConfigurationException.class, () -> FinetuneScheduler.parse("0:transl;x:shape", true, false));
			assertThrows(ConfigurationException.class, () -> FinetuneScheduler.parse("0:transl;0:shape", true, false));
			assertThrows(ConfigurationException.class, () -> FinetuneScheduler.parse("0 transl", true, false));
			FinetuneScheduler ft = FinetuneScheduler.parse("0:transl;1:jaw_pose", true, false);
			assertThrows(ConfigurationException.class, () -> ft.validate(params()));
		}
	}

	@Nested
	@DisplayName("damping")
	class StepSize {
		@Test
		@DisplayName("geometric policy decays by the rate every iteration")
		void geometric() {
			StepSizeScheduler ss = StepSizeScheduler.geometric(1.0, 0.9);
			for (int i = 0; i < 6; i++) {
				assertEquals(Math.pow(0.9, i), ss.damping(i));
			}
		}

		@Test
		@DisplayName("step policy decays every step iterations")
		void step() {
			StepSizeScheduler ss = new StepSizeScheduler(StepSizeScheduler.POLICY_STEP, 2.0, 0.5, 3);
			assertEquals(2.0, ss.damping(2));
			assertEquals(1.0, ss.damping(3));
			assertEquals(0.5, ss.damping(6));
			assertEquals(0.25, StepSizeScheduler.constant(0.25).damping(17));
		}

		@Test
		@DisplayName("invalid policies are rejected")
		void invalid() {
			assertThrows(ConfigurationException.class, () -> new StepSizeScheduler("linear", 1.0, 0.5, 1));
			assertThrows(ConfigurationException.class, () -> StepSizeScheduler.geometric(-1.0, 0.5));
			assertThrows(ConfigurationException.class, () -> StepSizeScheduler.geometric(1.0, 0.0));
			assertThrows(ConfigurationException.class, () -> new StepSizeScheduler(StepSizeScheduler.POLICY_STEP, 1.0, 0.5, 0));
		}
	}

	@Test
	@DisplayName("schedulers configure the optimizer")
	void configureOptimizer() {
		DifferentiableOptimizer optimizer = new DifferentiableOptimizer(new OptimizerParameters());
		optimizer.setParams(params());
		FinetuneScheduler.parse("0:transl;2:expression", true, false).configureOptimizer(optimizer, 2);
		StepSizeScheduler.geometric(4.0, 0.5).configureOptimizer(optimizer, 2);
		assertEquals(Arrays.asList("transl", "expression"), optimizer.getActiveParameters());
		assertEquals(1.0, optimizer.getDamping());
	}

	@Nested
	@DisplayName("parameters")
	class Parameters {
		@Test
		@DisplayName("resolve produces one configuration per outer iteration")
		void resolve() {
			ScheduleParameters sp = new ScheduleParameters();
			sp.c2f_scales =        new int [] {4, 2, 1};
			sp.c2f_breakpoints =   new int [] {3, 6};
			sp.active_milestones = "0:transl,global_pose;2:expression;4:shape";
			sp.damping_policy =    StepSizeScheduler.POLICY_GEOMETRIC;
			sp.damping_initial =   1.0;
			sp.damping_rate =      0.5;
			List<ScheduleConfig> configs = sp.resolve(8, params());
			assertEquals(8, configs.size());
			assertEquals(4, configs.get(2).getScale());
			assertEquals(2, configs.get(3).getScale());
			assertEquals(1, configs.get(7).getScale());
			assertEquals(0.125, configs.get(3).getDamping());
			assertEquals(Arrays.asList("transl", "global_pose", "expression"), configs.get(3).getActiveParameters());
			assertEquals(5, configs.get(5).getOuterIteration());
		}

		@Test
		@DisplayName("default milestones name groups missing from a small parameter set")
		void unknownGroups() {
			ParameterSet small = new ParameterSet().add(ParameterSet.TRANSL, 0, 0, 0);
			assertThrows(ConfigurationException.class, () -> new ScheduleParameters().resolve(5, small));
		}

		@Test
		@DisplayName("properties round trip")
		void properties() {
			ScheduleParameters sp = new ScheduleParameters();
			sp.c2f_scales =      new int [] {2, 1};
			sp.c2f_breakpoints = new int [] {4};
			sp.damping_policy =  StepSizeScheduler.POLICY_STEP;
			sp.damping_step =    3;
			Properties properties = new Properties();
			sp.setProperties("s.", properties);
			ScheduleParameters restored = new ScheduleParameters();
			restored.getProperties("s.", properties);
			assertArrayEquals(new int [] {2, 1}, restored.c2f_scales);
			assertArrayEquals(new int [] {4}, restored.c2f_breakpoints);
			assertEquals(StepSizeScheduler.POLICY_STEP, restored.damping_policy);
			assertEquals(3, restored.damping_step);
			assertEquals(sp.active_milestones, restored.active_milestones);
		}

		@Test
		@DisplayName("malformed numbers are configuration errors")
		void malformed() {
			Properties properties = new Properties();
			properties.setProperty("s.damping_rate", "fast");
			assertThrows(ConfigurationException.class, () -> new ScheduleParameters().getProperties("s.", properties));
		}
	}
}
