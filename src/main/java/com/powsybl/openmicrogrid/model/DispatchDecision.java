/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.model;

/**
 * Dispatch of one hour. Powers in MW, {@code soc} is the hydrogen storage level in MWh at the end of
 * the hour. {@code importing} and {@code exporting} are only meaningful when import/export exclusion
 * is enabled, they are false otherwise.
 *
 * @author PowSyBl Open Microgrid team
 */
public record DispatchDecision(double importPower,
                               double exportPower,
                               double electrolyzerPower,
                               double fuelCellPower,
                               double dieselPower,
                               double curtailment,
                               double soc,
                               boolean dieselOn,
                               boolean electrolyzerOn,
                               boolean fuelCellOn,
                               boolean importing,
                               boolean exporting) {

    /**
     * Supply minus demand of the hour, zero when the energy balance holds.
     */
    public double getEnergyBalanceResidual(double load, double pv, double wind) {
        return pv + wind + importPower + dieselPower + fuelCellPower
                - load - electrolyzerPower - exportPower - curtailment;
    }

    /**
     * Energy cost of the hour: import cost minus export income plus diesel fuel cost. Curtailment
     * penalty is not included, it is not a real cost.
     *
     * @param dieselCostPerMwh fuel cost per MWh of electricity produced by the diesel generator
     */
    public double getOperatingCost(double importPrice, double exportPrice, double dieselCostPerMwh, double dt) {
        return dt * (importPrice * importPower - exportPrice * exportPower + dieselCostPerMwh * dieselPower);
    }
}
