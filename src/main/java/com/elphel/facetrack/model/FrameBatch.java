/**
 **
 ** FrameBatch - frames optimized jointly with one normal-equation system
 **
 ** Copyright (C) 2024 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  FrameBatch.java is free software: you can redistribute it and/or modify
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
package com.elphel.facetrack.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class FrameBatch {
	private final List<FrameData> frames;

	public FrameBatch(List<FrameData> frames) {
		if ((frames == null) || frames.isEmpty()) {
			throw new IllegalArgumentException("Frame batch should have at least one frame");
		}
		this.frames = Collections.unmodifiableList(new ArrayList<FrameData>(frames));
	}

	public static FrameBatch of(FrameData ... frames) {
		return new FrameBatch(Arrays.asList(frames));
	}

	public int size() {
		return frames.size();
	}

	public FrameData get(int item) {
		return frames.get(item);
	}

	/** @return frame index of the first item */
	public int getFrameIdx() {
		return frames.get(0).getFrameIdx();
	}
}
