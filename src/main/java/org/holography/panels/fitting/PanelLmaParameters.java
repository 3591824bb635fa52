/**
 **
 ** PanelLmaParameters - settings of the bounded LMA used for nonlinear panel models
 **
 ** Copyright (C) 2023 Elphel, Inc.
 **
 ** -----------------------------------------------------------------------------**
 **
 **  PanelLmaParameters.java is free software: you can redistribute it and/or modify
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

package org.holography.panels.fitting;

import java.util.Properties;

import org.holography.panels.common.EProperties;

public class PanelLmaParameters {
	public double     plma_lambda =            0.1;
	public double     plma_lambda_scale_good = 0.5;
	public double     plma_lambda_scale_bad =  8.0;
	public double     plma_lambda_max =        1.0E8;
	public double     plma_rms_diff =          1.0E-10;
	public int []     plma_iteration_tiers =   {100, 1000, 10000}; // escalating LMA step budgets
	public int        plma_debug_level =       0;

	public PanelLmaParameters() {
	}

	public void setProperties(String prefix,Properties properties){
		properties.setProperty(prefix+"plma_lambda",            this.plma_lambda+"");
		properties.setProperty(prefix+"plma_lambda_scale_good", this.plma_lambda_scale_good+"");
		properties.setProperty(prefix+"plma_lambda_scale_bad",  this.plma_lambda_scale_bad+"");
		properties.setProperty(prefix+"plma_lambda_max",        this.plma_lambda_max+"");
		properties.setProperty(prefix+"plma_rms_diff",          this.plma_rms_diff+"");
		properties.setProperty(prefix+"plma_iteration_tiers",   EProperties.join(this.plma_iteration_tiers));
		properties.setProperty(prefix+"plma_debug_level",       this.plma_debug_level+"");
	}

	public void getProperties(String prefix,Properties properties){
		EProperties eprops = (properties instanceof EProperties) ? ((EProperties) properties) : new EProperties(properties);
		this.plma_lambda =            eprops.getProperty(prefix+"plma_lambda",            this.plma_lambda);
		this.plma_lambda_scale_good = eprops.getProperty(prefix+"plma_lambda_scale_good", this.plma_lambda_scale_good);
		this.plma_lambda_scale_bad =  eprops.getProperty(prefix+"plma_lambda_scale_bad",  this.plma_lambda_scale_bad);
		this.plma_lambda_max =        eprops.getProperty(prefix+"plma_lambda_max",        this.plma_lambda_max);
		this.plma_rms_diff =          eprops.getProperty(prefix+"plma_rms_diff",          this.plma_rms_diff);
		this.plma_iteration_tiers =   eprops.getProperty(prefix+"plma_iteration_tiers",   this.plma_iteration_tiers);
		this.plma_debug_level =       eprops.getProperty(prefix+"plma_debug_level",       this.plma_debug_level);
		if (this.plma_iteration_tiers.length == 0) {
			throw new IllegalArgumentException("At least one LMA iteration tier is required");
		}
	}

	@Override
	public PanelLmaParameters clone() {
		PanelLmaParameters plp =     new PanelLmaParameters();
		plp.plma_lambda =            this.plma_lambda;
		plp.plma_lambda_scale_good = this.plma_lambda_scale_good;
		plp.plma_lambda_scale_bad =  this.plma_lambda_scale_bad;
		plp.plma_lambda_max =        this.plma_lambda_max;
		plp.plma_rms_diff =          this.plma_rms_diff;
		plp.plma_iteration_tiers =   this.plma_iteration_tiers.clone();
		plp.plma_debug_level =       this.plma_debug_level;
		return plp;
	}
}
