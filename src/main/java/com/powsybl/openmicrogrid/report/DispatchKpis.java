/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.report;

import com.powsybl.openmicrogrid.OpenMicrogridParameters;
import com.powsybl.openmicrogrid.model.CommittedHour;
import com.powsybl.openmicrogrid.model.CommittedSchedule;
import com.powsybl.openmicrogrid.model.DispatchDecision;
import com.powsybl.openmicrogrid.scenario.ScenarioTable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Energy and economic indicators of a committed schedule. Energies in MWh, costs in currency.
 *
 * @author PowSyBl Open Microgrid team
 */
public final class DispatchKpis {

    private int hourCount;
    private double loadEnergy;
    private double pvEnergy;
    private double windEnergy;
    private double importEnergy;
    private double exportEnergy;
    private double dieselEnergy;
    private double electrolyzerEnergy;
    private double fuelCellEnergy;
    private double curtailedEnergy;
    private double importCost;
    private double exportIncome;
    private double dieselCost;
    private double hydrogenEquivalentCycles;
    private double hydrogenRoundTripEfficiency;

    private DispatchKpis() {
    }

    public static DispatchKpis compute(ScenarioTable table, CommittedSchedule schedule, OpenMicrogridParameters parameters) {
        Objects.requireNonNull(table);
        Objects.requireNonNull(schedule);
        Objects.requireNonNull(parameters);
        double dt = parameters.getTimestepHours();
        double dieselCostPerMwh = parameters.getFuelPrice() / parameters.getDieselEfficiency();

        DispatchKpis kpis = new DispatchKpis();
        for (CommittedHour committedHour : schedule.getHours()) {
            int hour = committedHour.hour();
            DispatchDecision d = committedHour.decision();
            kpis.hourCount++;
            kpis.loadEnergy += table.getLoad(hour) * dt;
            kpis.pvEnergy += table.getPv(hour) * dt;
            kpis.windEnergy += table.getWind(hour) * dt;
            kpis.importEnergy += d.importPower() * dt;
            kpis.exportEnergy += d.exportPower() * dt;
            kpis.dieselEnergy += d.dieselPower() * dt;
            kpis.electrolyzerEnergy += d.electrolyzerPower() * dt;
            kpis.fuelCellEnergy += d.fuelCellPower() * dt;
            kpis.curtailedEnergy += d.curtailment() * dt;
            kpis.importCost += d.importPower() * dt * table.getImportPrice(hour);
            kpis.exportIncome += d.exportPower() * dt * table.getExportPrice(hour);
            kpis.dieselCost += d.dieselPower() * dt * dieselCostPerMwh;
        }
        double capacity = parameters.getStorageCapacity();
        kpis.hydrogenEquivalentCycles = capacity > 0 ? (kpis.electrolyzerEnergy + kpis.fuelCellEnergy) / (2 * capacity) : 0;
        kpis.hydrogenRoundTripEfficiency = kpis.electrolyzerEnergy > 0 ? kpis.fuelCellEnergy / kpis.electrolyzerEnergy * 100 : 0;
        return kpis;
    }

    public int getHourCount() {
        return hourCount;
    }

    public double getLoadEnergy() {
        return loadEnergy;
    }

    public double getPvEnergy() {
        return pvEnergy;
    }

    public double getWindEnergy() {
        return windEnergy;
    }

    public double getImportEnergy() {
        return importEnergy;
    }

    public double getExportEnergy() {
        return exportEnergy;
    }

    public double getDieselEnergy() {
        return dieselEnergy;
    }

    public double getElectrolyzerEnergy() {
        return electrolyzerEnergy;
    }

    public double getFuelCellEnergy() {
        return fuelCellEnergy;
    }

    public double getCurtailedEnergy() {
        return curtailedEnergy;
    }

    public double getImportCost() {
        return importCost;
    }

    public double getExportIncome() {
        return exportIncome;
    }

    public double getDieselCost() {
        return dieselCost;
    }

    /**
     * Import cost plus diesel cost minus export income.
     */
    public double getNetCost() {
        return importCost + dieselCost - exportIncome;
    }

    public double getHydrogenEquivalentCycles() {
        return hydrogenEquivalentCycles;
    }

    /**
     * Fuel cell energy over electrolyzer energy, in percent.
     */
    public double getHydrogenRoundTripEfficiency() {
        return hydrogenRoundTripEfficiency;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("hours", hourCount);
        map.put("energy_load_mwh", loadEnergy);
        map.put("energy_pv_mwh", pvEnergy);
        map.put("energy_wind_mwh", windEnergy);
        map.put("energy_import_mwh", importEnergy);
        map.put("energy_export_mwh", exportEnergy);
        map.put("energy_dg_mwh", dieselEnergy);
        map.put("energy_ely_mwh", electrolyzerEnergy);
        map.put("energy_fc_mwh", fuelCellEnergy);
        map.put("energy_curt_mwh", curtailedEnergy);
        map.put("cost_import_eur", importCost);
        map.put("income_export_eur", exportIncome);
        map.put("cost_dg_eur", dieselCost);
        map.put("net_cost_eur", getNetCost());
        map.put("h2_equivalent_cycles", hydrogenEquivalentCycles);
        map.put("h2_roundtrip_efficiency", hydrogenRoundTripEfficiency);
        return map;
    }

    @Override
    public String toString() {
        return "DispatchKpis(" + toMap() + ")";
    }
}
