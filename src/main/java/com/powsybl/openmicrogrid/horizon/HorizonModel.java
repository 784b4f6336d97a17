/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.horizon;

import com.powsybl.openmicrogrid.OpenMicrogridParameters;
import com.powsybl.openmicrogrid.milp.LinearExpression;
import com.powsybl.openmicrogrid.milp.MilpProgram;
import com.powsybl.openmicrogrid.milp.MilpSolution;
import com.powsybl.openmicrogrid.milp.MilpVariable;
import com.powsybl.openmicrogrid.model.DispatchDecision;
import com.powsybl.openmicrogrid.scenario.ScenarioWindow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mixed integer dispatch program of one horizon.
 * <p>
 * Per hour t: grid import and export, electrolyzer, fuel cell and diesel powers, curtailment, storage
 * level at the end of the hour, on/off flags of the three dispatchable units and, when import/export
 * exclusion is enabled, importing/exporting flags. Constraints:
 * <pre>
 * pv + wind + import + diesel + fc = load + ely + export + curt
 * soc[t] = soc[t-1] + dt * (etaEly * ely - fc / etaFc), soc[-1] = socInit
 * min * on &lt;= p &lt;= nominal * on        (diesel, electrolyzer, fuel cell)
 * import &lt;= importMax * importing, export &lt;= exportMax * exporting, importing + exporting &lt;= 1
 * </pre>
 * Objective: sum of dt * (importPrice * import - exportPrice * export + fuelPrice / etaDg * diesel + penalty * curt).
 *
 * @author PowSyBl Open Microgrid team
 */
public final class HorizonModel {

    static final double BINARY_THRESHOLD = 0.5;

    private record HourVariables(MilpVariable importPower, MilpVariable exportPower, MilpVariable electrolyzerPower,
                                 MilpVariable fuelCellPower, MilpVariable dieselPower, MilpVariable curtailment,
                                 MilpVariable soc, MilpVariable dieselOn, MilpVariable electrolyzerOn,
                                 MilpVariable fuelCellOn, MilpVariable importing, MilpVariable exporting) {
    }

    private final ScenarioWindow window;

    private final double socInit;

    private final MilpProgram program;

    private final List<HourVariables> hourVariables;

    private HorizonModel(ScenarioWindow window, double socInit, MilpProgram program, List<HourVariables> hourVariables) {
        this.window = window;
        this.socInit = socInit;
        this.program = program;
        this.hourVariables = hourVariables;
    }

    public static HorizonModel build(ScenarioWindow window, double socInit) {
        Objects.requireNonNull(window);
        OpenMicrogridParameters parameters = window.getParameters();
        double dt = parameters.getTimestepHours();
        boolean exclusion = parameters.isImportExportExclusion();

        MilpProgram program = new MilpProgram("horizon_" + window.getFirstHour());
        List<HourVariables> hours = new ArrayList<>(window.getHourCount());
        LinearExpression.Builder objective = LinearExpression.newBuilder();
        MilpVariable previousSoc = null;
        for (int t = 0; t < window.getHourCount(); t++) {
            MilpVariable pImport = program.newContinuousVariable("p_import_" + t, 0, parameters.getImportMaxPower());
            MilpVariable pExport = program.newContinuousVariable("p_export_" + t, 0, parameters.getExportMaxPower());
            MilpVariable pEly = program.newContinuousVariable("p_ely_" + t, 0, parameters.getElectrolyzerNominalPower());
            MilpVariable pFc = program.newContinuousVariable("p_fc_" + t, 0, parameters.getFuelCellNominalPower());
            MilpVariable pDg = program.newContinuousVariable("p_dg_" + t, 0, parameters.getDieselNominalPower());
            MilpVariable pCurt = program.newContinuousVariable("p_curt_" + t, 0, Double.POSITIVE_INFINITY);
            MilpVariable soc = program.newContinuousVariable("soc_" + t, 0, parameters.getStorageCapacity());
            MilpVariable uDg = program.newBinaryVariable("u_dg_" + t);
            MilpVariable uEly = program.newBinaryVariable("u_ely_" + t);
            MilpVariable uFc = program.newBinaryVariable("u_fc_" + t);
            MilpVariable uImport = null;
            MilpVariable uExport = null;

            // energy balance, renewables moved to the right hand side
            program.addEquality("balance_" + t, LinearExpression.newBuilder()
                            .addTerm(pImport, 1)
                            .addTerm(pDg, 1)
                            .addTerm(pFc, 1)
                            .addTerm(pEly, -1)
                            .addTerm(pExport, -1)
                            .addTerm(pCurt, -1)
                            .build(),
                    window.getLoad(t) - window.getPv(t) - window.getWind(t));

            // storage dynamics, the initial level is a constant
            LinearExpression.Builder dynamics = LinearExpression.newBuilder()
                    .addTerm(soc, 1)
                    .addTerm(pEly, -dt * parameters.getElectrolyzerEfficiency())
                    .addTerm(pFc, dt / parameters.getFuelCellEfficiency());
            if (previousSoc == null) {
                program.addEquality("soc_dynamics_" + t, dynamics.build(), socInit);
            } else {
                program.addEquality("soc_dynamics_" + t, dynamics.addTerm(previousSoc, -1).build(), 0);
            }

            addUnitCommitment(program, "dg", t, pDg, uDg, parameters.getDieselMinPower(), parameters.getDieselNominalPower());
            addUnitCommitment(program, "ely", t, pEly, uEly, parameters.getElectrolyzerMinPower(), parameters.getElectrolyzerNominalPower());
            addUnitCommitment(program, "fc", t, pFc, uFc, parameters.getFuelCellMinPower(), parameters.getFuelCellNominalPower());

            if (exclusion) {
                uImport = program.newBinaryVariable("u_import_" + t);
                uExport = program.newBinaryVariable("u_export_" + t);
                program.addLessOrEqual("import_max_" + t, LinearExpression.newBuilder()
                        .addTerm(pImport, 1)
                        .addTerm(uImport, -parameters.getImportMaxPower())
                        .build(), 0);
                program.addLessOrEqual("export_max_" + t, LinearExpression.newBuilder()
                        .addTerm(pExport, 1)
                        .addTerm(uExport, -parameters.getExportMaxPower())
                        .build(), 0);
                program.addLessOrEqual("import_export_exclusion_" + t, LinearExpression.newBuilder()
                        .addTerm(uImport, 1)
                        .addTerm(uExport, 1)
                        .build(), 1);
            }

            objective.addTerm(pImport, window.getImportPrice(t) * dt)
                    .addTerm(pExport, -window.getExportPrice(t) * dt)
                    .addTerm(pDg, parameters.getFuelPrice() / parameters.getDieselEfficiency() * dt)
                    .addTerm(pCurt, parameters.getCurtailmentPenalty() * dt);

            hours.add(new HourVariables(pImport, pExport, pEly, pFc, pDg, pCurt, soc, uDg, uEly, uFc, uImport, uExport));
            previousSoc = soc;
        }
        program.minimize(objective.build());
        return new HorizonModel(window, socInit, program, Collections.unmodifiableList(hours));
    }

    private static void addUnitCommitment(MilpProgram program, String unit, int t, MilpVariable p, MilpVariable on,
                                          double minPower, double nominalPower) {
        program.addLessOrEqual(unit + "_max_" + t, LinearExpression.newBuilder()
                .addTerm(p, 1)
                .addTerm(on, -nominalPower)
                .build(), 0);
        program.addGreaterOrEqual(unit + "_min_" + t, LinearExpression.newBuilder()
                .addTerm(p, 1)
                .addTerm(on, -minPower)
                .build(), 0);
    }

    public ScenarioWindow getWindow() {
        return window;
    }

    public double getSocInit() {
        return socInit;
    }

    public MilpProgram getProgram() {
        return program;
    }

    /**
     * Solver values may exceed variable bounds by a few ulps, which would make the storage level fed to the
     * next horizon invalid.
     */
    static double getBoundedValue(MilpSolution solution, MilpVariable variable) {
        double value = solution.getValue(variable);
        return Math.min(Math.max(value, variable.lowerBound()), variable.upperBound());
    }

    private static boolean isOn(MilpSolution solution, MilpVariable flag) {
        return flag != null && solution.getValue(flag) > BINARY_THRESHOLD;
    }

    /**
     * Reads the dispatch of every hour from an optimal solution of {@link #getProgram()}.
     */
    public List<DispatchDecision> extractDecisions(MilpSolution solution) {
        Objects.requireNonNull(solution);
        List<DispatchDecision> decisions = new ArrayList<>(hourVariables.size());
        for (HourVariables v : hourVariables) {
            decisions.add(new DispatchDecision(getBoundedValue(solution, v.importPower()),
                    getBoundedValue(solution, v.exportPower()),
                    getBoundedValue(solution, v.electrolyzerPower()),
                    getBoundedValue(solution, v.fuelCellPower()),
                    getBoundedValue(solution, v.dieselPower()),
                    getBoundedValue(solution, v.curtailment()),
                    getBoundedValue(solution, v.soc()),
                    isOn(solution, v.dieselOn()),
                    isOn(solution, v.electrolyzerOn()),
                    isOn(solution, v.fuelCellOn()),
                    isOn(solution, v.importing()),
                    isOn(solution, v.exporting())));
        }
        return decisions;
    }
}
