/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.mpc;

import com.google.common.base.Stopwatch;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.openmicrogrid.InputShapeException;
import com.powsybl.openmicrogrid.OpenMicrogridParameters;
import com.powsybl.openmicrogrid.RecedingHorizonException;
import com.powsybl.openmicrogrid.horizon.HorizonOptimizer;
import com.powsybl.openmicrogrid.model.CommittedHour;
import com.powsybl.openmicrogrid.model.CommittedSchedule;
import com.powsybl.openmicrogrid.model.DispatchDecision;
import com.powsybl.openmicrogrid.model.HorizonResult;
import com.powsybl.openmicrogrid.scenario.ScenarioTable;
import com.powsybl.openmicrogrid.scenario.ScenarioWindow;
import com.powsybl.openmicrogrid.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Model predictive control loop: at each hour the whole horizon ahead is optimized and only the first
 * hour of the plan is committed, the resulting storage level being the initial one of the next solve.
 * <p>
 * The run stops when the horizon starting at the current hour reaches the last hour of the table, so
 * the last {@code horizonHours} hours of the table are only seen as look ahead.
 * Not thread safe, one controller per run.
 *
 * @author PowSyBl Open Microgrid team
 */
public class RecedingHorizonController {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecedingHorizonController.class);

    /**
     * Carried state between two steps.
     */
    private record Step(int hour, double soc) {

        Step next(double committedSoc) {
            return new Step(hour + 1, committedSoc);
        }
    }

    private final HorizonOptimizer optimizer;

    private final OpenMicrogridParameters parameters;

    private ControllerState state = ControllerState.INITIALIZING;

    public RecedingHorizonController(HorizonOptimizer optimizer, OpenMicrogridParameters parameters) {
        this.optimizer = Objects.requireNonNull(optimizer);
        this.parameters = Objects.requireNonNull(parameters).copy();
        this.parameters.checkConsistency();
    }

    public ControllerState getState() {
        return state;
    }

    public OpenMicrogridParameters getParameters() {
        return parameters.copy();
    }

    public CommittedSchedule run(ScenarioTable table) {
        return run(table, ReportNode.NO_OP);
    }

    /**
     * Runs from the configured start hour and initial SOC.
     *
     * @throws RecedingHorizonException if one of the horizon solves fails
     */
    public CommittedSchedule run(ScenarioTable table, ReportNode reportNode) {
        Objects.requireNonNull(table);
        return run(table, new Step(parameters.getStartHour(), parameters.getInitialSoc()), new CommittedSchedule(), reportNode);
    }

    public CommittedSchedule resume(ScenarioTable table, CommittedSchedule partialSchedule) {
        return resume(table, partialSchedule, ReportNode.NO_OP);
    }

    /**
     * Continues a schedule from the hour following its last committed hour, with its final SOC. New
     * hours are appended to the given schedule. An empty schedule is run from the configured start.
     */
    public CommittedSchedule resume(ScenarioTable table, CommittedSchedule partialSchedule, ReportNode reportNode) {
        Objects.requireNonNull(table);
        Objects.requireNonNull(partialSchedule);
        Step first = partialSchedule.isEmpty()
                ? new Step(parameters.getStartHour(), parameters.getInitialSoc())
                : new Step(partialSchedule.getLastCommittedHour().orElseThrow() + 1, partialSchedule.getFinalSoc().orElseThrow());
        return run(table, first, partialSchedule, reportNode);
    }

    private CommittedSchedule run(ScenarioTable table, Step first, CommittedSchedule schedule, ReportNode reportNode) {
        Objects.requireNonNull(reportNode);
        state = ControllerState.INITIALIZING;
        int horizonHours = parameters.getHorizonHours();
        int lastHour = table.getLastHour();
        if (first.hour() < table.getFirstHour()) {
            throw new InputShapeException("Start hour " + first.hour() + " is before first available hour " + table.getFirstHour());
        }
        OpenMicrogridParameters.log(parameters);
        ReportNode runReportNode = Reports.createRecedingHorizonReporter(reportNode, first.hour(), horizonHours, first.soc());
        double dieselCostPerMwh = parameters.getFuelPrice() / parameters.getDieselEfficiency();
        double dt = parameters.getTimestepHours();

        Stopwatch stopwatch = Stopwatch.createStarted();
        int committedCount = 0;
        double committedCost = 0;
        Step step = first;
        state = ControllerState.STEPPING;
        while (step.hour() + horizonHours <= lastHour) {
            HorizonResult result;
            try {
                ScenarioWindow window = ScenarioWindow.slice(table, step.hour(), horizonHours, parameters);
                result = optimizer.solve(window, step.soc(), runReportNode);
            } catch (RuntimeException e) {
                state = ControllerState.DONE;
                LOGGER.error("Receding horizon stopped at hour {} after {} committed hours", step.hour(), schedule.size(), e);
                Reports.reportRecedingHorizonFailed(runReportNode, step.hour(), schedule.size(), e.getMessage());
                throw new RecedingHorizonException(step.hour(), schedule, e);
            }

            DispatchDecision decision = result.getFirstDecision();
            CommittedHour committed = schedule.commit(step.hour(), decision, result.getObjectiveValue());
            committedCount++;
            committedCost += decision.getOperatingCost(table.getImportPrice(step.hour()), table.getExportPrice(step.hour()), dieselCostPerMwh, dt);
            LOGGER.debug("Hour {} committed (backend {}): import={} export={} ely={} fc={} dg={} curt={} soc={} horizon cost={}",
                    committed.hour(), result.getBackendName(), decision.importPower(), decision.exportPower(),
                    decision.electrolyzerPower(), decision.fuelCellPower(), decision.dieselPower(), decision.curtailment(),
                    decision.soc(), result.getObjectiveValue());
            Reports.reportHourCommitted(runReportNode, committed.hour(), decision.soc(), result.getObjectiveValue(), result.getBackendName());

            step = step.next(decision.soc());
        }
        stopwatch.stop();
        state = ControllerState.DONE;

        if (committedCount == 0) {
            LOGGER.warn("No hour to commit: horizon of {} hours starting at hour {} goes beyond last hour {}",
                    horizonHours, first.hour(), lastHour);
            Reports.reportNoHourToCommit(runReportNode, first.hour(), horizonHours, lastHour);
        } else {
            LOGGER.info("Receding horizon done: {} hours committed from hour {} to hour {}, committed cost {}, final SOC {} MWh in {} ms",
                    committedCount, first.hour(), step.hour() - 1, committedCost, step.soc(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
            Reports.reportRecedingHorizonCompleted(runReportNode, committedCount, first.hour(), step.hour() - 1, step.soc());
        }
        return schedule;
    }
}
