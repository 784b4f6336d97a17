/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.horizon;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.openmicrogrid.InfeasibleHorizonException;
import com.powsybl.openmicrogrid.InputShapeException;
import com.powsybl.openmicrogrid.OpenMicrogridParameters;
import com.powsybl.openmicrogrid.UnboundedHorizonException;
import com.powsybl.openmicrogrid.milp.MilpSolution;
import com.powsybl.openmicrogrid.milp.SolverBackendAdapter;
import com.powsybl.openmicrogrid.model.DispatchDecision;
import com.powsybl.openmicrogrid.model.HorizonResult;
import com.powsybl.openmicrogrid.scenario.ScenarioWindow;
import com.powsybl.openmicrogrid.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link HorizonOptimizer} solving the {@link HorizonModel} program with a {@link SolverBackendAdapter}.
 *
 * @author PowSyBl Open Microgrid team
 */
public class HorizonSolver implements HorizonOptimizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(HorizonSolver.class);

    private final SolverBackendAdapter backendAdapter;

    public HorizonSolver(SolverBackendAdapter backendAdapter) {
        this.backendAdapter = Objects.requireNonNull(backendAdapter);
    }

    /**
     * Creates a solver with the backends and time limit of the given parameters.
     */
    public static HorizonSolver create(OpenMicrogridParameters parameters) {
        Objects.requireNonNull(parameters);
        long timeLimitMillis = Math.round(parameters.getSolveTimeLimitSeconds() * 1000);
        return new HorizonSolver(SolverBackendAdapter.create(parameters.getSolverBackends(), Duration.ofMillis(timeLimitMillis)));
    }

    public SolverBackendAdapter getBackendAdapter() {
        return backendAdapter;
    }

    @Override
    public HorizonResult solve(ScenarioWindow window, double socInit, ReportNode reportNode) {
        Objects.requireNonNull(window);
        Objects.requireNonNull(reportNode);
        OpenMicrogridParameters parameters = window.getParameters();
        double boundedSocInit = checkInitialSoc(socInit, parameters);

        Stopwatch stopwatch = Stopwatch.createStarted();
        HorizonModel model = HorizonModel.build(window, boundedSocInit);
        MilpSolution solution = backendAdapter.solve(model.getProgram());
        switch (solution.getStatus()) {
            case INFEASIBLE -> throw new InfeasibleHorizonException(window.getFirstHour(), solution.getBackendName());
            case UNBOUNDED -> throw new UnboundedHorizonException(window.getFirstHour(), solution.getBackendName());
            case OPTIMAL -> {
                // nothing to do
            }
        }
        List<DispatchDecision> decisions = model.extractDecisions(solution);
        checkEnergyBalance(window, decisions, parameters.getEnergyBalanceTolerance(), reportNode);
        stopwatch.stop();

        LOGGER.debug("Horizon of {} hours starting at hour {} solved by {} in {} ms, cost {}", window.getHourCount(),
                window.getFirstHour(), solution.getBackendName(), stopwatch.elapsed(TimeUnit.MILLISECONDS), solution.getObjectiveValue());
        return new HorizonResult(window.getFirstHour(), decisions, solution.getObjectiveValue(), solution.getBackendName());
    }

    /**
     * An initial SOC outside storage bounds by less than the energy balance tolerance is snapped to the bound.
     */
    static double checkInitialSoc(double socInit, OpenMicrogridParameters parameters) {
        double capacity = parameters.getStorageCapacity();
        double tolerance = parameters.getEnergyBalanceTolerance() * Math.max(1, capacity);
        if (Double.isNaN(socInit) || socInit < -tolerance || socInit > capacity + tolerance) {
            throw new InputShapeException("Initial SOC " + socInit + " MWh is outside storage bounds [0, " + capacity + "]");
        }
        return Math.min(Math.max(socInit, 0), capacity);
    }

    private static void checkEnergyBalance(ScenarioWindow window, List<DispatchDecision> decisions, double relativeTolerance,
                                           ReportNode reportNode) {
        double tolerance = relativeTolerance * Math.max(1, window.getMaxLoad());
        for (int t = 0; t < decisions.size(); t++) {
            double residual = decisions.get(t).getEnergyBalanceResidual(window.getLoad(t), window.getPv(t), window.getWind(t));
            if (Math.abs(residual) > tolerance) {
                int hour = window.getFirstHour() + t;
                LOGGER.warn("Numerical tolerance warning: energy balance residual of hour {} is {} MW (tolerance {} MW)",
                        hour, residual, tolerance);
                Reports.reportEnergyBalanceMismatch(reportNode, hour, residual, tolerance);
            }
        }
    }
}
