/**
 **
 ** OptimizerFramework - outer/inner tracking loop shared by the optimizer configurations
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  OptimizerFramework.java is free software: you can redistribute it and/or modify
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
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.facetrack.common.TimeTracker;
import com.elphel.facetrack.correspondence.CorrespondenceFilter;
import com.elphel.facetrack.correspondence.CorrespondenceMask;
import com.elphel.facetrack.model.DataPipeline;
import com.elphel.facetrack.model.FrameBatch;
import com.elphel.facetrack.model.FrameData;
import com.elphel.facetrack.model.ParametricModel;
import com.elphel.facetrack.model.RenderOutput;
import com.elphel.facetrack.model.Renderer;
import com.elphel.facetrack.model.Rescalable;
import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.DifferentiableOptimizer;
import com.elphel.facetrack.optimizer.DimensionMismatchException;
import com.elphel.facetrack.optimizer.OptimizationStats;
import com.elphel.facetrack.optimizer.ParameterSet;
import com.elphel.facetrack.optimizer.ResidualResult;
import com.elphel.facetrack.regularize.DummyRegularizeModule;
import com.elphel.facetrack.regularize.RegularizeModule;
import com.elphel.facetrack.regularize.RegularizeOutput;
import com.elphel.facetrack.residuals.ResidualChain;
import com.elphel.facetrack.scheduler.CoarseToFineScheduler;
import com.elphel.facetrack.scheduler.ScheduleConfig;
import com.elphel.facetrack.weighting.DummyWeightModule;
import com.elphel.facetrack.weighting.WeightOutput;
import com.elphel.facetrack.weighting.WeightingModule;

/**
 * INIT: warm start, schedules resolved and checked, first active set applied.
 * OUTER_ITER: rescale, fetch, configure the optimizer, render, find correspondences,
 * predict weights and priors, build the residual function.
 * INNER_ITER: max_optims optimizer steps with the same residual function.
 * FINALIZE: parameters and statistics returned.
 * <p>
 * Configurations differ in the weighting/regularization modules and the residual terms.
 * One instance tracks one call at a time.
 */
public abstract class OptimizerFramework {
	private static final Logger LOGGER = LoggerFactory.getLogger(OptimizerFramework.class);

	public enum State {IDLE, INIT, OUTER_ITER, INNER_ITER, FINALIZE}

	protected final ParametricModel         model;
	protected final Renderer                renderer;
	protected final TrackerParameters       tracker_parameters;
	protected final ResidualChain           residuals;
	protected final DifferentiableOptimizer optimizer;
	protected final CorrespondenceFilter    correspondence;
	protected final TimeTracker             time_tracker = new TimeTracker();
	private final WeightingModule           default_w_module = new DummyWeightModule();
	private final RegularizeModule          default_r_module = new DummyRegularizeModule();
	protected WeightingModule               w_module;
	protected RegularizeModule              r_module;
	private TrackingListener                listener = TrackingListener.NONE;
	private BooleanSupplier                 cancel =   () -> false;
	private volatile State                  state =    State.IDLE;

	protected OptimizerFramework(
			ParametricModel   model,
			Renderer          renderer,
			TrackerParameters tracker_parameters,
			ResidualChain     residuals,
			WeightingModule   w_module,
			RegularizeModule  r_module)
	{
		tracker_parameters.validate();
		this.model =              model;
		this.renderer =           renderer;
		this.tracker_parameters = tracker_parameters.clone();
		this.residuals =          residuals;
		this.w_module =           (w_module != null) ? w_module : default_w_module;
		this.r_module =           (r_module != null) ? r_module : default_r_module;
		this.optimizer =          new DifferentiableOptimizer(this.tracker_parameters.optimizer);
		this.correspondence =     CorrespondenceFilter.fromAngle(
				this.tracker_parameters.d_max,
				this.tracker_parameters.max_normal_angle,
				this.tracker_parameters.threads_max);
		if (residuals.requiresCorrespondences() && (renderer == null)) {
			String msg = "Residual terms "+residuals+" need correspondences, but no renderer is provided";
			LOGGER.error(msg);
			throw new ConfigurationException(msg);
		}
	}

	public void setListener(TrackingListener listener) {
		this.listener = (listener != null) ? listener : TrackingListener.NONE;
	}

	/**
	 * @param cancel checked after every completed outer iteration, true stops the call with
	 *               the parameters of that iteration
	 */
	public void setCancel(BooleanSupplier cancel) {
		this.cancel = (cancel != null) ? cancel : () -> false;
	}

	public State getState() {
		return state;
	}

	public TrackerParameters getTrackerParameters() {
		return tracker_parameters.clone();
	}

	public ResidualChain getResiduals() {
		return residuals;
	}

	public WeightingModule getWeightingModule() {
		return w_module;
	}

	public RegularizeModule getRegularizeModule() {
		return r_module;
	}

	/**
	 * Schedule of every outer iteration. Configurations with a fixed active set override it.
	 * @throws ConfigurationException on malformed schedules or unknown names
	 */
	protected List<ScheduleConfig> resolveSchedule(ParameterSet params) {
		return tracker_parameters.schedule.resolve(tracker_parameters.max_iters, params);
	}

	public TrackingResult track(FrameBatch batch, ParameterSet init_params) {
		return track(DataPipeline.of(batch), init_params);
	}

	/**
	 * Same loop with uniform weights and neutral regularization, the configured modules are
	 * restored afterwards
	 */
	public TrackingResult trackIcp(DataPipeline pipeline, ParameterSet init_params) {
		WeightingModule  w = w_module;
		RegularizeModule r = r_module;
		w_module = default_w_module;
		r_module = default_r_module;
		try {
			return track(pipeline, init_params);
		} finally {
			w_module = w;
			r_module = r;
		}
	}

	/**
	 * @param pipeline    observed data, rescaled by the coarse-to-fine schedule
	 * @param init_params warm start, batch size should match the fetched batches
	 * @return final parameters and statistics
	 */
	public TrackingResult track(DataPipeline pipeline, ParameterSet init_params) {
		// INIT
		state = State.INIT;
		time_tracker.reset();
		ParameterSet reference = init_params.copy();
		List<ScheduleConfig> schedule = resolveSchedule(reference);
		CoarseToFineScheduler c2f = tracker_parameters.schedule.createCoarseToFine();
		Map<String, Double> reg_factors = tracker_parameters.getRegularizeWeights();
		optimizer.setParams(reference);
		if (!schedule.isEmpty()) {
			optimizer.setActiveParameters(schedule.get(0).getActiveParameters());
		}
		List<OptimizationStats> steps =      new ArrayList<OptimizationStats>();
		List<ScheduleConfig>    executed =   new ArrayList<ScheduleConfig>();
		List<Integer>           num_corr =   new ArrayList<Integer>();
		List<double []>         w_stats =    new ArrayList<double []>();
		List<RegularizeOutput>  reg_outs =   new ArrayList<RegularizeOutput>();
		boolean cancelled = false;
		boolean aborted =   false;
		int num_failed =    0;
		int frame_idx =     -1;
		TrackingResidualFunction fn = null;

		time_tracker.start("outer_loop");
		for (ScheduleConfig config : schedule) {
			// OUTER_ITER
			state = State.OUTER_ITER;
			int outer_iter = config.getOuterIteration();

			time_tracker.start("fetch_data");
			c2f.apply(outer_iter, pipeline, (renderer instanceof Rescalable) ? (Rescalable) renderer : null);
			FrameBatch batch = pipeline.fetch();
			frame_idx = batch.getFrameIdx();
			if (batch.size() != reference.getBatchSize()) {
				throw new DimensionMismatchException("Frame batch", reference.getBatchSize(), batch.size());
			}
			time_tracker.stop("fetch_data");

			time_tracker.start("setup_optimizer");
			optimizer.setOuterIteration(outer_iter);
			optimizer.setActiveParameters(config.getActiveParameters());
			optimizer.setDamping(config.getDamping());
			time_tracker.stop("setup_optimizer");

			ParameterSet current = optimizer.getParams();
			List<RenderOutput> renders = null;
			List<boolean []>   masks =   null;
			List<double []>    weights = null;
			double [] latent = new double [0];
			int correspondences = -1;
			if (residuals.requiresCorrespondences()) {
				time_tracker.start("find_correspondences");
				renders = new ArrayList<RenderOutput>();
				masks =   new ArrayList<boolean []>();
				correspondences = 0;
				for (int item = 0; item < batch.size(); item++) {
					FrameData frame = batch.get(item);
					RenderOutput render = renderer.render(model.forward(current.item(item)));
					CorrespondenceMask mask = correspondence.mask(
							frame.getMask(), frame.getPoint(), frame.getNormal(),
							render.getMask(), render.getPoint(), render.getNormal());
					renders.add(render);
					masks.add(mask.getMask());
					correspondences += mask.count();
					if (tracker_parameters.debug_level > 1) {
						LOGGER.debug("frame {} item {}: {}", frame.getFrameIdx(), item, mask);
					}
				}
				time_tracker.stop("find_correspondences");

				time_tracker.start("weighting");
				weights = new ArrayList<double []>();
				List<double []> latents = new ArrayList<double []>();
				double mn = Double.POSITIVE_INFINITY, mx = Double.NEGATIVE_INFINITY, s = 0.0;
				int n = 0;
				for (int item = 0; item < batch.size(); item++) {
					FrameData frame = batch.get(item);
					WeightOutput w_out = w_module.predict(
							frame.getPoint(), frame.getNormal(), renders.get(item).getPoint(), renders.get(item).getNormal());
					weights.add(w_out.getWeights());
					latents.add(w_out.getLatent());
					for (double w : w_out.getWeights()) {
						mn = Math.min(mn, w);
						mx = Math.max(mx, w);
						s += w;
						n++;
					}
				}
				w_stats.add(new double [] {mn, mx, (n > 0) ? (s / n) : Double.NaN});
				latent = concat(latents);
				time_tracker.stop("weighting");
			}
			num_corr.add(correspondences);

			time_tracker.start("regularization");
			RegularizeOutput reg_out = r_module.predict(current, config.getActiveParameters(), latent)
					.scaleWeights(reg_factors);
			reg_outs.add(reg_out);
			time_tracker.stop("regularization");

			fn = new TrackingResidualFunction(model, residuals, batch, renders, masks, weights, reference, reg_out);
			listener.onOuterStart(frame_idx, config, correspondences);

			// INNER_ITER
			state = State.INNER_ITER;
			time_tracker.start("inner_loop");
			for (int inner = 0; inner < tracker_parameters.max_optims; inner++) {
				time_tracker.start("optimizer_step");
				OptimizationStats stats = optimizer.step(fn);
				time_tracker.stop("optimizer_step");
				steps.add(stats);
				ResidualResult loss = null;
				if (tracker_parameters.log_loss) {
					time_tracker.start("inner_logging");
					loss = optimizer.lossStep(fn);
					time_tracker.stop("inner_logging");
				}
				listener.onInnerStep(frame_idx, config, optimizer.getInnerIteration(), stats, loss);
				num_failed = stats.isUpdateApplied() ? 0 : (num_failed + 1);
				if ((tracker_parameters.max_failed_steps > 0) && (num_failed >= tracker_parameters.max_failed_steps)) {
					LOGGER.warn("frame {}: {} consecutive steps without update (last {}), stopping", frame_idx, num_failed,
							stats.getStatus());
					aborted = true;
					break;
				}
			}
			time_tracker.stop("inner_loop");
			executed.add(config);
			if (aborted) {
				break;
			}
			if (cancel.getAsBoolean()) {
				LOGGER.info("frame {}: cancelled after outer iteration {}", frame_idx, outer_iter);
				cancelled = true;
				break;
			}
		}
		time_tracker.stop("outer_loop");

		// FINALIZE
		state = State.FINALIZE;
		double final_loss = (fn != null) ? optimizer.lossStep(fn).loss() : Double.NaN;
		TrackingResult result = new TrackingResult(
				frame_idx,
				optimizer.getParams(),
				steps,
				executed,
				num_corr,
				w_stats,
				reg_outs,
				time_tracker.getTotals(),
				final_loss,
				cancelled,
				aborted);
		listener.onFinish(result);
		state = State.IDLE;
		return result;
	}

	private static double [] concat(List<double []> parts) {
		int len = 0;
		for (double [] p : parts) len += p.length;
		double [] rslt = new double [len];
		int indx = 0;
		for (double [] p : parts) {
			System.arraycopy(p, 0, rslt, indx, p.length);
			indx += p.length;
		}
		return rslt;
	}
}
