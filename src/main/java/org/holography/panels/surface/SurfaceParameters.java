/**
 **
 ** SurfaceParameters - configuration of the antenna surface analysis
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  SurfaceParameters.java is free software: you can redistribute it and/or modify
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

package org.holography.panels.surface;

import java.util.Properties;

import org.holography.panels.common.EProperties;
import org.holography.panels.fitting.PanelKind;
import org.holography.panels.fitting.PanelLmaParameters;
import org.holography.panels.geometry.TelescopeGeometry;

public class SurfaceParameters {
	public double             cutoff =             0.21;  // fraction of the maximal amplitude, lower amplitudes are masked out
	public String             panel_kind =         "";    // empty - telescope default
	public boolean            deviation_is_phase = false; // second input grid is phase (radians), not deviation (m)
	public double             panel_margin =       0.2;   // fraction of each panel side excluded from fitting
	public int                threads_max =        100;
	public PanelLmaParameters lma =                new PanelLmaParameters();

	public SurfaceParameters() {
	}

	/**
	 * @param telescope telescope to select the default kind for
	 * @return configured panel kind, or rotatedparaboloid for ringed telescopes
	 *         and xyparaboloid for others when not configured
	 */
	public PanelKind getPanelKind(TelescopeGeometry telescope) {
		if ((panel_kind == null) || panel_kind.trim().isEmpty()) {
			return telescope.isRinged() ? PanelKind.ROTATED_PARABOLOID : PanelKind.XY_PARABOLOID;
		}
		return PanelKind.fromName(panel_kind);
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"cutoff",             this.cutoff+"");             // double
		properties.setProperty(prefix+"panel_kind",         this.panel_kind);            // String
		properties.setProperty(prefix+"deviation_is_phase", this.deviation_is_phase+""); // boolean
		properties.setProperty(prefix+"panel_margin",       this.panel_margin+"");       // double
		properties.setProperty(prefix+"threads_max",        this.threads_max+"");        // int
		lma.setProperties(prefix, properties);
	}

	public void getProperties(String prefix,Properties properties){
		EProperties eprops = (properties instanceof EProperties) ? ((EProperties) properties) : new EProperties(properties);
		this.cutoff =             eprops.getProperty(prefix+"cutoff",             this.cutoff);
		this.panel_kind =         eprops.getProperty(prefix+"panel_kind",         this.panel_kind).trim();
		this.deviation_is_phase = eprops.getProperty(prefix+"deviation_is_phase", this.deviation_is_phase);
		this.panel_margin =       eprops.getProperty(prefix+"panel_margin",       this.panel_margin);
		this.threads_max =        eprops.getProperty(prefix+"threads_max",        this.threads_max);
		lma.getProperties(prefix, eprops);
		if (!this.panel_kind.isEmpty()) {
			PanelKind.fromName(this.panel_kind); // fail early on a misspelled kind
		}
		if ((this.panel_margin < 0.0) || (this.panel_margin >= 0.5)) {
			throw new IllegalArgumentException("panel_margin should be in [0, 0.5), got "+this.panel_margin);
		}
		if (this.threads_max < 1) {
			throw new IllegalArgumentException("threads_max should be positive, got "+this.threads_max);
		}
	}

	@Override
	public SurfaceParameters clone() {
		SurfaceParameters sp =  new SurfaceParameters();
		sp.cutoff =             this.cutoff;
		sp.panel_kind =         this.panel_kind;
		sp.deviation_is_phase = this.deviation_is_phase;
		sp.panel_margin =       this.panel_margin;
		sp.threads_max =        this.threads_max;
		sp.lma =                this.lma.clone();
		return sp;
	}
}
