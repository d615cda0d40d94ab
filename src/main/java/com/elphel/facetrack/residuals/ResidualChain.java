/**
 **
 ** ResidualChain - stacks weighted residual terms in the declared order
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ResidualChain.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.residuals;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

import com.elphel.facetrack.optimizer.ConfigurationException;
import com.elphel.facetrack.optimizer.ParameterLayout;
import com.elphel.facetrack.optimizer.ResidualResult;

/**
 * Final residual of a geometric term entry is robust_weight * term_weight * raw, other terms
 * are scaled by term_weight only. The order of the terms is fixed at construction, Jacobian
 * rows follow the same order.
 */
public class ResidualChain {
	private final List<ResidualTerm> terms;
	private final double []          term_weights;

	public ResidualChain(List<ResidualTerm> terms, double [] term_weights) {
		if (terms.size() != term_weights.length) {
			throw new ConfigurationException("Number of residual terms ("+terms.size()+
					") differs from number of weights ("+term_weights.length+")");
		}
		this.terms =        Collections.unmodifiableList(new ArrayList<ResidualTerm>(terms));
		this.term_weights = term_weights.clone();
	}

	public static ResidualChain fromDeclarations(List<ResidualTermDeclaration> declarations) {
		List<ResidualTerm> terms = new ArrayList<ResidualTerm>();
		double [] weights = new double [declarations.size()];
		for (int i = 0; i < weights.length; i++) {
			terms.add(declarations.get(i).createTerm());
			weights[i] = declarations.get(i).getWeight();
		}
		return new ResidualChain(terms, weights);
	}

	/**
	 * @param declaration for example "point2plane:1.0,landmark:0.01,regularize:1.0"
	 */
	public static ResidualChain parse(String declaration) {
		return fromDeclarations(ResidualTermDeclaration.parseList(declaration));
	}

	public List<String> getNames() {
		List<String> names = new ArrayList<String>();
		for (ResidualTerm term : terms) {
			names.add(term.getName());
		}
		return names;
	}

	public boolean requiresCorrespondences() {
		for (ResidualTerm term : terms) {
			if (term.requiresCorrespondences()) {
				return true;
			}
		}
		return false;
	}

	/**
	 * @return stacked residuals, info holds mean |raw| per term name and "loss_"+name with
	 *         0.5*sum(r^2) of the weighted term residuals
	 */
	public ResidualResult evaluate(ResidualContext ctx) {
		double [][] parts = new double [terms.size()][];
		LinkedHashMap<String, Double> info = new LinkedHashMap<String, Double>();
		int len = 0;
		for (int n = 0; n < parts.length; n++) {
			ResidualTerm term = terms.get(n);
			double [] raw = term.compute(ctx);
			double s_abs = 0.0;
			double s2 =    0.0;
			double [] r = new double [raw.length];
			for (int i = 0; i < raw.length; i++) {
				s_abs += Math.abs(raw[i]);
				r[i] = getScale(term, n, ctx, i) * raw[i];
				s2 += r[i] * r[i];
			}
			info.put(term.getName(), (raw.length > 0) ? (s_abs / raw.length) : 0.0);
			info.put("loss_"+term.getName(), 0.5 * s2);
			parts[n] = r;
			len += r.length;
		}
		double [] fx = new double [len];
		int indx = 0;
		for (double [] r : parts) {
			System.arraycopy(r, 0, fx, indx, r.length);
			indx += r.length;
		}
		return new ResidualResult(fx, info);
	}

	/**
	 * @return transposed Jacobian of the stacked residuals, or null if any term can not
	 *         provide derivatives from this context
	 */
	public double [][] getJacobianTransposed(ResidualContext ctx, ParameterLayout layout) {
		int num_pars = layout.getNumParameters();
		double [][][] parts = new double [terms.size()][][];
		int len = 0;
		for (int n = 0; n < parts.length; n++) {
			ResidualTerm term = terms.get(n);
			double [][] jt = term.getJacobianTransposed(ctx, layout);
			if (jt == null) {
				return null;
			}
			parts[n] = jt;
			len += (num_pars > 0) ? jt[0].length : 0;
		}
		double [][] jt = new double [num_pars][len];
		for (int j = 0; j < num_pars; j++) {
			int indx = 0;
			for (int n = 0; n < parts.length; n++) {
				double [] d = parts[n][j];
				for (int i = 0; i < d.length; i++) {
					jt[j][indx++] = getScale(terms.get(n), n, ctx, i) * d[i];
				}
			}
		}
		return jt;
	}

	private double getScale(ResidualTerm term, int n, ResidualContext ctx, int i) {
		if (term.isGeometric()) {
			return ctx.getWeight(i / term.getStride()) * term_weights[n];
		}
		return term_weights[n];
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("ResidualChain[");
		for (int n = 0; n < terms.size(); n++) {
			sb.append((n > 0) ? "," : "").append(terms.get(n).getName()).append(":").append(term_weights[n]);
		}
		return sb.append("]").toString();
	}
}
