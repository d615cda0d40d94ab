/**
 **
 ** ResidualTermDeclaration - parses "name:weight" residual term lists
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  ResidualTermDeclaration.java is free software: you can redistribute it and/or modify
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
import java.util.HashSet;
import java.util.List;

import com.elphel.facetrack.common.EProperties;
import com.elphel.facetrack.optimizer.ConfigurationException;

public class ResidualTermDeclaration {
	public static final String [] TERM_NAMES = {
			Point2PlaneResidual.NAME,
			Point2PointResidual.NAME,
			LandmarkResidual.NAME,
			VertexResidual.NAME,
			RegularizeResidual.NAME};

	private final String name;
	private final double weight;

	public ResidualTermDeclaration(String name, double weight) {
		this.name =   name;
		this.weight = weight;
	}

	public String getName() {
		return name;
	}

	public double getWeight() {
		return weight;
	}

	public ResidualTerm createTerm() {
		return createTerm(name);
	}

	public static ResidualTerm createTerm(String name) {
		switch (name) {
		case Point2PlaneResidual.NAME: return new Point2PlaneResidual();
		case Point2PointResidual.NAME: return new Point2PointResidual();
		case LandmarkResidual.NAME:    return new LandmarkResidual();
		case VertexResidual.NAME:      return new VertexResidual();
		case RegularizeResidual.NAME:  return new RegularizeResidual();
		default:
			throw new ConfigurationException("Unknown residual term \""+name+"\", known are "+String.join(",", TERM_NAMES));
		}
	}

	/**
	 * @param declaration comma-separated "name:weight" list, "name" alone means weight 1.0
	 * @return declarations in the listed order
	 */
	public static List<ResidualTermDeclaration> parseList(String declaration) {
		String [] items = EProperties.splitList(declaration);
		if (items.length == 0) {
			throw new ConfigurationException("Empty residual term declaration");
		}
		List<ResidualTermDeclaration> list = new ArrayList<ResidualTermDeclaration>();
		HashSet<String> seen = new HashSet<String>();
		for (String item : items) {
			String [] pair = item.split(":");
			if ((pair.length > 2) || pair[0].trim().isEmpty()) {
				throw new ConfigurationException("Malformed residual term \""+item+"\", expected name:weight");
			}
			String term_name = pair[0].trim();
			double term_weight = 1.0;
			if (pair.length == 2) {
				try {
					term_weight = Double.parseDouble(pair[1].trim());
				} catch (NumberFormatException e) {
					throw new ConfigurationException("Malformed weight of residual term \""+item+"\"", e);
				}
			}
			if (!(term_weight >= 0.0) || Double.isInfinite(term_weight)) {
				throw new ConfigurationException("Residual term weight should be finite and non-negative: \""+item+"\"");
			}
			createTerm(term_name); // validate name
			if (!seen.add(term_name)) {
				throw new ConfigurationException("Residual term \""+term_name+"\" is declared more than once");
			}
			list.add(new ResidualTermDeclaration(term_name, term_weight));
		}
		return list;
	}

	public static String toString(List<ResidualTermDeclaration> list) {
		StringBuilder sb = new StringBuilder();
		for (ResidualTermDeclaration d : list) {
			if (sb.length() > 0) {
				sb.append(",");
			}
			sb.append(d.toString());
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return name+":"+weight;
	}
}
