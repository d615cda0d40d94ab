/**
 **
 ** DifferentiableOptimizerTest - tests of the damped Gauss-Newton step
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  DifferentiableOptimizerTest.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.optimizer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.elphel.facetrack.residuals.Point2PointResidual;
import com.elphel.facetrack.residuals.ResidualChain;
import com.elphel.facetrack.residuals.ResidualContext;
import com.elphel.facetrack.residuals.ResidualTerm;

public class DifferentiableOptimizerTest {

	/** F(theta) = theta - target, dF/dtheta = 1 */
	private static DifferentiableResidualFunction linear(final double target) {
		return new DifferentiableResidualFunction() {
			@Override
			public ResidualResult evaluate(ParameterSet params) {
				return new ResidualResult(new double [] {params.getValue("x", 0) - target});
			}
			@Override
			public double [][] getJacobianTransposed(ParameterSet params, ParameterLayout layout) {
				return new double [][] {{1.0}};
			}
		};
	}

	private static DifferentiableOptimizer optimizer(double x) {
		DifferentiableOptimizer opt = new DifferentiableOptimizer(new OptimizerParameters());
		opt.setParams(new ParameterSet().add("x", x).add("y", 7.0, 8.0));
		opt.setActiveParameters(Collections.singletonList("x"));
		opt.setDamping(0.0);
		return opt;
	}

	@Nested
	@DisplayName("Gauss-Newton step")
	class GaussNewton {
		@Test
		@DisplayName("linear residual converges in one undamped step")
		void linearConvergesInOneStep() {
			double [][] cases = {{5.0, 2.0}, {-3.25, 0.5}, {1024.5, -17.0}, {0.0, 0.0}};
			for (double [] c : cases) {
				DifferentiableOptimizer opt = optimizer(c[0]);
				OptimizationStats stats = opt.step(linear(c[1]));
				assertTrue(stats.isUpdateApplied());
				assertFalse(stats.isFallbackUsed());
				assertEquals(c[1], opt.getParams().getValue("x", 0));
			}
		}

		@Test
		@DisplayName("linear residual with finite differences converges to the target")
		void linearWithFiniteDifferences() {
			DifferentiableOptimizer opt = optimizer(0.3);
			OptimizationStats stats = opt.step((ResidualFunction) (p) -> new ResidualResult(new double [] {p.getValue("x", 0) - 0.7}));
			assertTrue(stats.isUpdateApplied());
			assertEquals(0.7, opt.getParams().getValue("x", 0), 1e-9);
		}

		@Test
		@DisplayName("point-to-point example: one step from 5 gives 0")
		void pointToPointExample() {
			final ResidualChain chain = new ResidualChain(
					Collections.<ResidualTerm>singletonList(new Point2PointResidual()), new double [] {1.0});
			DifferentiableResidualFunction fn = new DifferentiableResidualFunction() {
				private ResidualContext context(ParameterSet params, boolean derivatives) {
					double theta = params.getValue("theta", 0);
					ResidualContext.Builder b = ResidualContext.builder()
							.points(new double [][] {{0, 0, 0}}, new double [][] {{0, 0, 1}},
									new double [][] {{theta, 0, 0}}, new double [][] {{0, 0, 1}})
							.params(params);
					if (derivatives) {
						b.pointDerivatives(new double [][][] {{{1, 0, 0}}});
					}
					return b.build();
				}
				@Override
				public ResidualResult evaluate(ParameterSet params) {
					return chain.evaluate(context(params, false));
				}
				@Override
				public double [][] getJacobianTransposed(ParameterSet params, ParameterLayout layout) {
					return chain.getJacobianTransposed(context(params, true), layout);
				}
			};
			DifferentiableOptimizer opt = new DifferentiableOptimizer(new OptimizerParameters());
			opt.setParams(new ParameterSet().add("theta", 5.0));
			opt.setActiveParameters(Collections.singletonList("theta"));
			assertEquals(12.5, opt.lossStep(fn).loss());
			OptimizationStats stats = opt.step(fn);
			assertTrue(stats.isUpdateApplied());
			assertEquals(0.0, opt.getParams().getValue("theta", 0));
			assertEquals(0.0, opt.lossStep(fn).loss());
		}

		@Test
		@DisplayName("statistics report H, g and the condition number")
		void statistics() {
			DifferentiableOptimizer opt = optimizer(5.0);
			opt.setDamping(1.0);
			OptimizationStats stats = opt.step(linear(2.0));
			assertEquals(1.0, stats.getHessian()[0][0]);
			assertEquals(3.0, stats.getGradient()[0]);
			assertEquals(1.0, stats.getConditionNumber());
			assertEquals(1.0, stats.getLambda());
			assertEquals(4.5, stats.getLoss());
			assertEquals(-1.5, stats.getDelta()[0], 1e-12);
			assertEquals(3.5, opt.getParams().getValue("x", 0), 1e-12);
			assertEquals(1.0, stats.toMap().get("applied"));
		}

		@Test
		@DisplayName("diagonal damping scales the Hessian diagonal")
		void diagonalDamping() {
			OptimizerParameters op = new OptimizerParameters();
			op.damping_mode = OptimizerParameters.DAMPING_DIAGONAL;
			DifferentiableOptimizer opt = new DifferentiableOptimizer(op);
			opt.setParams(new ParameterSet().add("x", 3.0));
			opt.setActiveParameters(Collections.singletonList("x"));
			opt.setDamping(1.0);
			ResidualFunction fn = (p) -> new ResidualResult(new double [] {2.0 * (p.getValue("x", 0) - 1.0)});
			opt.step(fn); // H = 4, g = 8, (4 + 4) * delta = -8
			assertEquals(2.0, opt.getParams().getValue("x", 0), 1e-9);
		}

		@Test
		@DisplayName("singular normal matrix falls back to the minimal norm solution")
		void singularFallback() {
			DifferentiableResidualFunction fn = new DifferentiableResidualFunction() {
				@Override
				public ResidualResult evaluate(ParameterSet params) {
					double [] v = params.get("v");
					return new ResidualResult(new double [] {v[0] + v[1] - 2.0});
				}
				@Override
				public double [][] getJacobianTransposed(ParameterSet params, ParameterLayout layout) {
					return new double [][] {{1.0}, {1.0}};
				}
			};
			DifferentiableOptimizer opt = new DifferentiableOptimizer(new OptimizerParameters());
			opt.setParams(new ParameterSet().add("v", 0.0, 0.0));
			opt.setActiveParameters(Collections.singletonList("v"));
			OptimizationStats stats = opt.step(fn);
			assertTrue(stats.isUpdateApplied());
			assertTrue(stats.isFallbackUsed());
			assertArrayEquals(new double [] {1.0, 1.0}, opt.getParams().get("v"), 1e-12);
		}
	}

	@Nested
	@DisplayName("no-op and failed steps")
	class NoOp {
		@Test
		@DisplayName("empty residual leaves the parameters bit-identical")
		void emptyResidual() {
			DifferentiableOptimizer opt = optimizer(0.1);
			ParameterSet before = opt.getParams();
			OptimizationStats stats = opt.step((ResidualFunction) (p) -> new ResidualResult(new double [0]));
			assertEquals(StepStatus.EMPTY_RESIDUAL, stats.getStatus());
			assertFalse(stats.isUpdateApplied());
			assertFalse(stats.getStatus().isFailure());
			assertEquals(before, opt.getParams());
		}

		@Test
		@DisplayName("empty active list is a no-op")
		void noActiveParameters() {
			DifferentiableOptimizer opt = optimizer(0.1);
			opt.setActiveParameters(Collections.<String>emptyList());
			ParameterSet before = opt.getParams();
			OptimizationStats stats = opt.step(linear(1.0));
			assertEquals(StepStatus.NO_ACTIVE_PARAMETERS, stats.getStatus());
			assertEquals(before, opt.getParams());
		}

		@Test
		@DisplayName("non-finite residual discards the update")
		void nonFiniteResidual() {
			DifferentiableOptimizer opt = optimizer(0.1);
			ParameterSet before = opt.getParams();
			OptimizationStats stats = opt.step((ResidualFunction) (p) -> new ResidualResult(new double [] {1.0, Double.NaN}));
			assertEquals(StepStatus.NON_FINITE_RESIDUAL, stats.getStatus());
			assertTrue(stats.getStatus().isFailure());
			assertEquals(before, opt.getParams());
		}

		@Test
		@DisplayName("non-finite Jacobian discards the update")
		void nonFiniteJacobian() {
			DifferentiableOptimizer opt = optimizer(0.1);
			ParameterSet before = opt.getParams();
			OptimizationStats stats = opt.step(new DifferentiableResidualFunction() {
				@Override
				public ResidualResult evaluate(ParameterSet params) {
					return new ResidualResult(new double [] {1.0});
				}
				@Override
				public double [][] getJacobianTransposed(ParameterSet params, ParameterLayout layout) {
					return new double [][] {{Double.POSITIVE_INFINITY}};
				}
			});
			assertEquals(StepStatus.NON_FINITE_JACOBIAN, stats.getStatus());
			assertFalse(stats.isUpdateApplied());
			assertEquals(before, opt.getParams());
		}

		@Test
		@DisplayName("overflow of the normal equations discards the update")
		void normalEquationsOverflow() {
			final DifferentiableOptimizer opt = new DifferentiableOptimizer(new OptimizerParameters());
			opt.setParams(new ParameterSet().add("x", 1.0, 2.0));
			opt.setActiveParameters(Collections.singletonList("x"));
			opt.setDamping(0.0);
			ParameterSet before = opt.getParams();
			final DifferentiableResidualFunction huge = new DifferentiableResidualFunction() {
				@Override
				public ResidualResult evaluate(ParameterSet params) {
					return new ResidualResult(new double [] {1e200 * params.getValue("x", 0), 1e200 * params.getValue("x", 1)});
				}
				@Override
				public double [][] getJacobianTransposed(ParameterSet params, ParameterLayout layout) {
					return new double [][] {{1e200, 0.0}, {0.0, 1e200}};
				}
			};
			OptimizationStats stats = assertTimeoutPreemptively(Duration.ofSeconds(20), () -> opt.step(huge));
			assertEquals(StepStatus.SOLVE_FAILED, stats.getStatus());
			assertFalse(stats.isUpdateApplied());
			assertEquals(before, opt.getParams());
		}
	}

	@Nested
	@DisplayName("errors")
	class Errors {
		@Test
		@DisplayName("residual length change inside a step throws")
		void residualLengthChange() {
			final AtomicInteger calls = new AtomicInteger();
			OptimizerParameters op = new OptimizerParameters();
			op.threads_max = 1;
			DifferentiableOptimizer opt = new DifferentiableOptimizer(op);
			opt.setParams(new ParameterSet().add("x", 1.0));
			opt.setActiveParameters(Collections.singletonList("x"));
			ResidualFunction fn = (p) -> new ResidualResult(new double [1 + calls.getAndIncrement()]);
			assertThrows(DimensionMismatchException.class, () -> opt.step(fn));
		}

		@Test
		@DisplayName("analytic Jacobian with a wrong number of rows throws")
		void wrongJacobianRows() {
			DifferentiableOptimizer opt = optimizer(1.0);
			DifferentiableResidualFunction fn = new DifferentiableResidualFunction() {
				@Override
				public ResidualResult evaluate(ParameterSet params) {
					return new ResidualResult(new double [] {1.0, 2.0});
				}
				@Override
				public double [][] getJacobianTransposed(ParameterSet params, ParameterLayout layout) {
					return new double [][] {{1.0}};
				}
			};
			DimensionMismatchException e = assertThrows(DimensionMismatchException.class, () -> opt.step(fn));
			assertEquals(2, e.getExpected());
			assertEquals(1, e.getActual());
		}

		@Test
		@DisplayName("unknown active parameter name throws")
		void unknownName() {
			DifferentiableOptimizer opt = optimizer(1.0);
			assertThrows(ConfigurationException.class, () -> opt.setActiveParameters(Arrays.asList("x", "nope")));
			assertEquals(Collections.singletonList("x"), opt.getActiveParameters());
		}

		@Test
		@DisplayName("negative damping throws")
		void negativeDamping() {
			DifferentiableOptimizer opt = optimizer(1.0);
			assertThrows(ConfigurationException.class, () -> opt.setDamping(-1.0));
			assertThrows(ConfigurationException.class, () -> opt.setDamping(Double.NaN));
		}

		@Test
		@DisplayName("parameters must be set before stepping")
		void paramsNotSet() {
			DifferentiableOptimizer opt = new DifferentiableOptimizer(new OptimizerParameters());
			assertThrows(IllegalStateException.class, () -> opt.step(linear(0.0)));
		}
	}

	@Nested
	@DisplayName("active parameters")
	class Active {
		@Test
		@DisplayName("residualParams overlays only the active groups")
		void isolation() {
			DifferentiableOptimizer opt = optimizer(1.0);
			opt.setActiveParameters(Collections.singletonList("y"));
			ParameterSet p = opt.residualParams(new double [] {-1.0, -2.0});
			assertArrayEquals(new double [] {-1.0, -2.0}, p.get("y"));
			assertArrayEquals(new double [] {1.0}, p.get("x"));
			assertArrayEquals(new double [] {7.0, 8.0}, opt.getParams().get("y"));
		}

		@Test
		@DisplayName("a step changes only the active groups")
		void stepIsolation() {
			DifferentiableOptimizer opt = optimizer(5.0);
			opt.step(linear(2.0));
			assertArrayEquals(new double [] {7.0, 8.0}, opt.getParams().get("y"));
		}

		@Test
		@DisplayName("loss step never changes the parameters")
		void lossStepReadOnly() {
			DifferentiableOptimizer opt = optimizer(5.0);
			ParameterSet before = opt.getParams();
			ResidualResult r = opt.lossStep(linear(2.0));
			assertEquals(4.5, r.loss());
			assertEquals(before, opt.getParams());
		}
	}

	@Nested
	@DisplayName("adaptive damping")
	class Adaptive {
		private DifferentiableOptimizer adaptive(double x) {
			OptimizerParameters op = new OptimizerParameters();
			op.adaptive_damping = true;
			DifferentiableOptimizer opt = new DifferentiableOptimizer(op);
			opt.setParams(new ParameterSet().add("x", x));
			opt.setActiveParameters(Collections.singletonList("x"));
			opt.setDamping(1.0);
			return opt;
		}

		@Test
		@DisplayName("loss decrease keeps the update and relaxes damping")
		void accepted() {
			DifferentiableOptimizer opt = adaptive(5.0);
			OptimizationStats stats = opt.step(linear(1.0));
			assertEquals(StepStatus.APPLIED, stats.getStatus());
			assertEquals(3.0, opt.getParams().getValue("x", 0), 1e-12);
			assertEquals(0.5, opt.getDamping());
			assertEquals(2.0, stats.getLossAfter(), 1e-12);
		}

		@Test
		@DisplayName("loss increase rejects the update and raises damping")
		void rejected() {
			DifferentiableOptimizer opt = adaptive(5.0);
			OptimizationStats stats = opt.step(new DifferentiableResidualFunction() {
				@Override
				public ResidualResult evaluate(ParameterSet params) {
					return new ResidualResult(new double [] {params.getValue("x", 0)});
				}
				@Override
				public double [][] getJacobianTransposed(ParameterSet params, ParameterLayout layout) {
					return new double [][] {{-1.0}}; // wrong sign
				}
			});
			assertEquals(StepStatus.REJECTED, stats.getStatus());
			assertEquals(5.0, opt.getParams().getValue("x", 0));
			assertEquals(8.0, opt.getDamping());
			assertNotNull(stats.getDelta());
		}
	}
}
