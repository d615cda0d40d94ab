/**
 **
 ** TrackerParameters - parameters of a tracking call: loop bounds, correspondences, residual terms, schedules
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  TrackerParameters.java is free software: you can redistribute it and/or modify
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

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.elphel.facetrack.common.EProperties;
import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.OptimizerParameters;
import com.elphel.facetrack.residuals.ResidualTermDeclaration;
import com.elphel.facetrack.scheduler.ScheduleParameters;

public class TrackerParameters implements Cloneable {
	private static final Logger LOGGER = LoggerFactory.getLogger(TrackerParameters.class);
	public static final String DEFAULTS_RESOURCE = "/facetrack.properties";
	public static final String DEFAULTS_PREFIX =   "facetrack.";

	public int     max_iters =           10;      // outer iterations (re-render, new correspondences)
	public int     max_optims =          1;       // optimizer steps per outer iteration
	public double  d_max =               0.01;    // maximal correspondence distance (m)
	public double  max_normal_angle =    45.0;    // maximal angle between normals (degrees)
	public String  residuals =           "point2plane:1.0,regularize:1.0";
	public String  regularize_weights =  "";      // name:factor list, static factors of the prior weights
	public double  huber_k =             0.0;     // >0 - Huber weighting in the ICP configuration (m)
	public int     jump_size =           1;       // warm start frame i from frame i - jump_size
	public int     max_failed_steps =    0;       // stop after this many consecutive non-applied steps, 0 - never
	public boolean log_loss =            true;    // evaluate loss after each step
	public int     threads_max =         100;
	public int     debug_level =         0;

	public OptimizerParameters optimizer = new OptimizerParameters();
	public ScheduleParameters  schedule =  new ScheduleParameters();

	/**
	 * @return parameters with the defaults from the class path resource
	 */
	public static TrackerParameters loadDefaults() {
		TrackerParameters tp = new TrackerParameters();
		Properties properties = new Properties();
		try (InputStream is = TrackerParameters.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (is == null) {
				LOGGER.warn("Resource {} not found, using built-in defaults", DEFAULTS_RESOURCE);
				return tp;
			}
			properties.load(is);
		} catch (IOException e) {
			throw new ConfigurationException("Failed to read "+DEFAULTS_RESOURCE, e);
		}
		tp.getProperties(DEFAULTS_PREFIX, properties);
		return tp;
	}

	/**
	 * @return static regularization factors by parameter group
	 */
	public Map<String, Double> getRegularizeWeights() {
		Map<String, Double> weights = new LinkedHashMap<String, Double>();
		for (String item : EProperties.splitList(regularize_weights)) {
			String [] pair = item.split(":");
			if (pair.length != 2) {
				throw new ConfigurationException("Malformed regularization weight \""+item+"\", expected name:factor");
			}
			try {
				weights.put(pair[0].trim(), Double.parseDouble(pair[1].trim()));
			} catch (NumberFormatException e) {
				throw new ConfigurationException("Malformed regularization weight \""+item+"\"", e);
			}
		}
		return weights;
	}

	public void validate() {
		if (max_iters < 0) {
			throw new ConfigurationException("max_iters should be non-negative, got "+max_iters);
		}
		if (max_optims < 0) {
			throw new ConfigurationException("max_optims should be non-negative, got "+max_optims);
		}
		if (jump_size < 1) {
			throw new ConfigurationException("jump_size should be positive, got "+jump_size);
		}
		if (!(max_normal_angle >= 0.0) || (max_normal_angle > 180.0)) {
			throw new ConfigurationException("max_normal_angle should be in [0,180] degrees, got "+max_normal_angle);
		}
		ResidualTermDeclaration.parseList(residuals);
		for (Map.Entry<String, Double> entry : getRegularizeWeights().entrySet()) {
			if (!(entry.getValue() >= 0.0)) {
				throw new ConfigurationException("Regularization factor of \""+entry.getKey()+"\" should be non-negative");
			}
		}
		optimizer.validate();
		schedule.createCoarseToFine();
		schedule.createFinetune();
		schedule.createStepSize();
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"max_iters",          this.max_iters+"");
		properties.setProperty(prefix+"max_optims",         this.max_optims+"");
		properties.setProperty(prefix+"d_max",              this.d_max+"");
		properties.setProperty(prefix+"max_normal_angle",   this.max_normal_angle+"");
		properties.setProperty(prefix+"residuals",          this.residuals);
		properties.setProperty(prefix+"regularize_weights", this.regularize_weights);
		properties.setProperty(prefix+"huber_k",            this.huber_k+"");
		properties.setProperty(prefix+"jump_size",          this.jump_size+"");
		properties.setProperty(prefix+"max_failed_steps",   this.max_failed_steps+"");
		properties.setProperty(prefix+"log_loss",           this.log_loss+"");
		properties.setProperty(prefix+"threads_max",        this.threads_max+"");
		properties.setProperty(prefix+"debug_level",        this.debug_level+"");
		optimizer.setProperties(prefix+"optimizer.", properties);
		schedule.setProperties(prefix+"schedule.", properties);
	}

	public void getProperties(String prefix,Properties properties){
		EProperties ep = new EProperties(properties);
		try {
			this.max_iters =          ep.getProperty(prefix+"max_iters",        this.max_iters);
			this.max_optims =         ep.getProperty(prefix+"max_optims",       this.max_optims);
			this.d_max =              ep.getProperty(prefix+"d_max",            this.d_max);
			this.max_normal_angle =   ep.getProperty(prefix+"max_normal_angle", this.max_normal_angle);
			this.residuals =          ep.getProperty(prefix+"residuals",        this.residuals).trim();
			this.regularize_weights = ep.getProperty(prefix+"regularize_weights", this.regularize_weights).trim();
			this.huber_k =            ep.getProperty(prefix+"huber_k",          this.huber_k);
			this.jump_size =          ep.getProperty(prefix+"jump_size",        this.jump_size);
			this.max_failed_steps =   ep.getProperty(prefix+"max_failed_steps", this.max_failed_steps);
			this.log_loss =           ep.getProperty(prefix+"log_loss",         this.log_loss);
			this.threads_max =        ep.getProperty(prefix+"threads_max",      this.threads_max);
			this.debug_level =        ep.getProperty(prefix+"debug_level",      this.debug_level);
			optimizer.getProperties(prefix+"optimizer.", properties);
		} catch (NumberFormatException e) {
			throw new ConfigurationException("Malformed tracker property with prefix \""+prefix+"\": "+e.getMessage(), e);
		}
		schedule.getProperties(prefix+"schedule.", properties);
	}

	@Override
	public TrackerParameters clone() {
		TrackerParameters tp = new TrackerParameters();
		tp.max_iters =          this.max_iters;
		tp.max_optims =         this.max_optims;
		tp.d_max =              this.d_max;
		tp.max_normal_angle =   this.max_normal_angle;
		tp.residuals =          this.residuals;
		tp.regularize_weights = this.regularize_weights;
		tp.huber_k =            this.huber_k;
		tp.jump_size =          this.jump_size;
		tp.max_failed_steps =   this.max_failed_steps;
		tp.log_loss =           this.log_loss;
		tp.threads_max =        this.threads_max;
		tp.debug_level =        this.debug_level;
		tp.optimizer =          this.optimizer.clone();
		tp.schedule =           this.schedule.clone();
		return tp;
	}
}
