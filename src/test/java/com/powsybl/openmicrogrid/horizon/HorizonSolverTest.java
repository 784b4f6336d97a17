/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.horizon;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.openmicrogrid.InfeasibleHorizonException;
import com.powsybl.openmicrogrid.InputShapeException;
import com.powsybl.openmicrogrid.OpenMicrogridParameters;
import com.powsybl.openmicrogrid.ScenarioFixtures;
import com.powsybl.openmicrogrid.UnboundedHorizonException;
import com.powsybl.openmicrogrid.milp.MilpBackend;
import com.powsybl.openmicrogrid.milp.MilpBackendFactory;
import com.powsybl.openmicrogrid.milp.MilpProgram;
import com.powsybl.openmicrogrid.milp.MilpSolution;
import com.powsybl.openmicrogrid.milp.SolverBackendAdapter;
import com.powsybl.openmicrogrid.model.DispatchDecision;
import com.powsybl.openmicrogrid.model.HorizonResult;
import com.powsybl.openmicrogrid.scenario.ScenarioWindow;
import com.powsybl.openmicrogrid.util.Reports;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

import static com.powsybl.openmicrogrid.ScenarioFixtures.DELTA_COST;
import static com.powsybl.openmicrogrid.ScenarioFixtures.DELTA_POWER;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * @author PowSyBl Open Microgrid team
 */
class HorizonSolverTest {

    private static final Duration TIME_LIMIT = Duration.ofSeconds(60);

    private static ScenarioWindow singleHour(double load, double pv, double wind, double importPrice, double exportPrice,
                                             OpenMicrogridParameters parameters) {
        return new ScenarioWindow(0, new double[] {load}, new double[] {pv}, new double[] {wind},
                new double[] {importPrice}, new double[] {exportPrice}, parameters);
    }

    private static HorizonSolver solverWith(String backendName) {
        MilpBackend backend = MilpBackendFactory.find(backendName).create();
        assumeTrue(backend.isAvailable(), backendName + " not available");
        return new HorizonSolver(new SolverBackendAdapter(List.of(backend), TIME_LIMIT));
    }

    private static HorizonSolver solverWith(MilpBackend backend) {
        return new HorizonSolver(new SolverBackendAdapter(List.of(backend), TIME_LIMIT));
    }

    @Test
    void testGridImportOnly() {
        OpenMicrogridParameters parameters = new OpenMicrogridParameters().setStorageCapacity(0);
        HorizonResult result = HorizonSolver.create(parameters).solve(singleHour(10, 4, 2, 100, 50, parameters), 0);

        assertEquals(1, result.getHourCount());
        DispatchDecision d = result.getFirstDecision();
        assertEquals(4, d.importPower(), DELTA_POWER);
        assertEquals(0, d.exportPower(), DELTA_POWER);
        assertEquals(0, d.electrolyzerPower(), DELTA_POWER);
        assertEquals(0, d.fuelCellPower(), DELTA_POWER);
        assertEquals(0, d.dieselPower(), DELTA_POWER);
        assertEquals(0, d.curtailment(), DELTA_POWER);
        assertEquals(400, result.getObjectiveValue(), DELTA_COST);
    }

    private static OpenMicrogridParameters surplusParameters(double dt) {
        return new OpenMicrogridParameters()
                .setTimestepHours(dt)
                .setStorageCapacity(5)
                .setElectrolyzerNominalPower(8)
                .setElectrolyzerMinPower(0)
                .setElectrolyzerEfficiency(0.7)
                .setExportMaxPower(0);
    }

    @Test
    void testSurplusAbsorbedByElectrolyzer() {
        OpenMicrogridParameters parameters = surplusParameters(0.5);
        HorizonResult result = HorizonSolver.create(parameters).solve(singleHour(2, 10, 0, 100, 50, parameters), 0);

        DispatchDecision d = result.getFirstDecision();
        assertEquals(8, d.electrolyzerPower(), DELTA_POWER);
        assertEquals(0, d.curtailment(), DELTA_POWER);
        assertEquals(0, d.exportPower(), DELTA_POWER);
        assertEquals(0.7 * 8 * 0.5, d.soc(), DELTA_POWER);
        assertTrue(d.electrolyzerOn());
        assertEquals(0, result.getObjectiveValue(), DELTA_COST);
    }

    @Test
    void testSurplusLimitedByStorageCapacity() {
        // with one hour time step 8 MW would store 5.6 MWh, above the 5 MWh capacity. Running the fuel cell at
        // its 0.3 MW minimum alongside the electrolyzer removes 0.6 MWh and curtails less than throttling the
        // electrolyzer to 5 / 0.7 MW would
        OpenMicrogridParameters parameters = surplusParameters(1)
                .setFuelCellMinPower(0.3)
                .setFuelCellEfficiency(0.5)
                .setCurtailmentPenalty(1);
        HorizonResult result = HorizonSolver.create(parameters).solve(singleHour(2, 10, 0, 100, 50, parameters), 0);

        DispatchDecision d = result.getFirstDecision();
        assertEquals(8, d.electrolyzerPower(), DELTA_POWER);
        assertEquals(0.3, d.fuelCellPower(), DELTA_POWER);
        assertEquals(0.3, d.curtailment(), DELTA_POWER);
        assertEquals(5, d.soc(), DELTA_POWER);
        assertTrue(d.electrolyzerOn());
        assertTrue(d.fuelCellOn());
        assertEquals(0, d.getEnergyBalanceResidual(2, 10, 0), DELTA_POWER);
        assertEquals(0.3, result.getObjectiveValue(), DELTA_COST);
    }

    @Test
    void testDailyHorizonProperties() {
        OpenMicrogridParameters parameters = new OpenMicrogridParameters();
        ScenarioWindow window = ScenarioWindow.slice(ScenarioFixtures.createDailyTable(24), 0, 24, parameters);
        double socInit = 2;
        HorizonResult result = HorizonSolver.create(parameters).solve(window, socInit);
        assertEquals(24, result.getHourCount());

        double eps = 1E-6 * Math.max(1, window.getMaxLoad());
        double previousSoc = socInit;
        for (int t = 0; t < result.getHourCount(); t++) {
            DispatchDecision d = result.getDecision(t);
            assertEquals(0, d.getEnergyBalanceResidual(window.getLoad(t), window.getPv(t), window.getWind(t)), eps);

            assertTrue(d.soc() >= -DELTA_POWER && d.soc() <= parameters.getStorageCapacity() + DELTA_POWER);
            double expectedSoc = previousSoc + parameters.getTimestepHours()
                    * (parameters.getElectrolyzerEfficiency() * d.electrolyzerPower() - d.fuelCellPower() / parameters.getFuelCellEfficiency());
            assertEquals(expectedSoc, d.soc(), DELTA_POWER);
            previousSoc = d.soc();

            for (double p : new double[] {d.importPower(), d.exportPower(), d.electrolyzerPower(), d.fuelCellPower(), d.dieselPower(), d.curtailment()}) {
                assertTrue(p >= -DELTA_POWER);
            }
            assertUnitBounds(d.dieselPower(), d.dieselOn(), parameters.getDieselMinPower(), parameters.getDieselNominalPower());
            assertUnitBounds(d.electrolyzerPower(), d.electrolyzerOn(), parameters.getElectrolyzerMinPower(), parameters.getElectrolyzerNominalPower());
            assertUnitBounds(d.fuelCellPower(), d.fuelCellOn(), parameters.getFuelCellMinPower(), parameters.getFuelCellNominalPower());
            assertFalse(d.importPower() > DELTA_POWER && d.exportPower() > DELTA_POWER);
        }
    }

    private static void assertUnitBounds(double p, boolean on, double minPower, double nominalPower) {
        if (on) {
            assertTrue(p >= minPower - DELTA_POWER && p <= nominalPower + DELTA_POWER);
        } else {
            assertEquals(0, p, DELTA_POWER);
        }
    }

    @Test
    void testSameInputSameObjective() {
        OpenMicrogridParameters parameters = new OpenMicrogridParameters();
        ScenarioWindow window = ScenarioWindow.slice(ScenarioFixtures.createDailyTable(24), 0, 12, parameters);
        HorizonSolver solver = HorizonSolver.create(parameters);
        HorizonResult result1 = solver.solve(window, 1);
        HorizonResult result2 = solver.solve(window, 1);
        assertEquals(result1.getBackendName(), result2.getBackendName());
        assertEquals(result1.getObjectiveValue(), result2.getObjectiveValue(), DELTA_COST);
    }

    @Test
    void testFallbackGivesSameObjective() {
        OpenMicrogridParameters parameters = new OpenMicrogridParameters();
        ScenarioWindow window = ScenarioWindow.slice(ScenarioFixtures.createDailyTable(24), 0, 12, parameters);
        HorizonResult primary = solverWith("SCIP").solve(window, 0);

        MilpBackend unavailableScip = mock(MilpBackend.class);
        when(unavailableScip.getName()).thenReturn("SCIP");
        when(unavailableScip.isAvailable()).thenReturn(false);
        MilpBackend highs = MilpBackendFactory.find("HIGHS").create();
        assumeTrue(highs.isAvailable(), "HIGHS not available");
        HorizonSolver fallbackSolver = new HorizonSolver(new SolverBackendAdapter(List.of(unavailableScip, highs), TIME_LIMIT));
        HorizonResult fallback = fallbackSolver.solve(window, 0);

        assertEquals("HIGHS", fallback.getBackendName());
        // both backends stop at their default relative gap
        assertEquals(primary.getObjectiveValue(), fallback.getObjectiveValue(), Math.abs(primary.getObjectiveValue()) * 1E-3 + DELTA_COST);
    }

    @Test
    void testImportExportExclusion() {
        // exporting is paid more than importing costs, only the exclusion prevents arbitrage
        OpenMicrogridParameters parameters = new OpenMicrogridParameters()
                .setStorageCapacity(0)
                .setImportMaxPower(5)
                .setExportMaxPower(5);
        HorizonResult withExclusion = HorizonSolver.create(parameters).solve(singleHour(1, 0, 0, 10, 20, parameters), 0);
        assertEquals(1, withExclusion.getFirstDecision().importPower(), DELTA_POWER);
        assertEquals(0, withExclusion.getFirstDecision().exportPower(), DELTA_POWER);
        assertTrue(withExclusion.getFirstDecision().importing());
        assertEquals(10, withExclusion.getObjectiveValue(), DELTA_COST);

        parameters.setImportExportExclusion(false);
        HorizonResult withoutExclusion = HorizonSolver.create(parameters).solve(singleHour(1, 0, 0, 10, 20, parameters), 0);
        assertEquals(5, withoutExclusion.getFirstDecision().importPower(), DELTA_POWER);
        assertEquals(4, withoutExclusion.getFirstDecision().exportPower(), DELTA_POWER);
        assertFalse(withoutExclusion.getFirstDecision().importing());
        assertEquals(-30, withoutExclusion.getObjectiveValue(), DELTA_COST);
    }

    @Test
    void testInfeasible() {
        // no grid and no storage, diesel alone cannot supply the load
        OpenMicrogridParameters parameters = new OpenMicrogridParameters()
                .setImportMaxPower(0)
                .setStorageCapacity(0)
                .setDieselNominalPower(5);
        ScenarioWindow window = new ScenarioWindow(7, new double[] {10}, new double[] {0}, new double[] {0},
                new double[] {100}, new double[] {50}, parameters);
        HorizonSolver solver = solverWith("SCIP");
        InfeasibleHorizonException e = assertThrows(InfeasibleHorizonException.class, () -> solver.solve(window, 0));
        assertEquals(7, e.getFirstHour());
        assertEquals("Horizon starting at hour 7 is infeasible (backend SCIP)", e.getMessage());
    }

    @Test
    void testUnbounded() {
        MilpBackend backend = mock(MilpBackend.class);
        when(backend.getName()).thenReturn("FAKE");
        when(backend.isAvailable()).thenReturn(true);
        when(backend.solve(any(), any())).thenReturn(MilpSolution.unbounded("FAKE"));
        OpenMicrogridParameters parameters = new OpenMicrogridParameters();
        ScenarioWindow window = singleHour(1, 0, 0, 10, 5, parameters);
        HorizonSolver solver = solverWith(backend);
        UnboundedHorizonException e = assertThrows(UnboundedHorizonException.class, () -> solver.solve(window, 0));
        assertEquals(0, e.getFirstHour());
    }

    @Test
    void testInvalidInitialSoc() {
        OpenMicrogridParameters parameters = new OpenMicrogridParameters().setStorageCapacity(5);
        ScenarioWindow window = singleHour(1, 0, 0, 10, 5, parameters);
        HorizonSolver solver = solverWith(mock(MilpBackend.class));
        assertThrows(InputShapeException.class, () -> solver.solve(window, -0.1));
        InputShapeException e = assertThrows(InputShapeException.class, () -> solver.solve(window, 6));
        assertEquals("Initial SOC 6.0 MWh is outside storage bounds [0, 5.0]", e.getMessage());
    }

    @Test
    void testInitialSocRoundingNoise() {
        OpenMicrogridParameters parameters = new OpenMicrogridParameters().setStorageCapacity(3.3);
        assertEquals(3.3, HorizonSolver.checkInitialSoc(3.3000000000000003, parameters));
        assertEquals(0, HorizonSolver.checkInitialSoc(-8.659739592076222E-16, parameters));
        assertEquals(1.2, HorizonSolver.checkInitialSoc(1.2, parameters));
        assertThrows(InputShapeException.class, () -> HorizonSolver.checkInitialSoc(3.31, parameters));
        assertThrows(InputShapeException.class, () -> HorizonSolver.checkInitialSoc(Double.NaN, parameters));
    }

    @Test
    void testEnergyBalanceWarning() {
        // a backend returning an all zero solution leaves the load unserved
        MilpBackend backend = mock(MilpBackend.class);
        when(backend.getName()).thenReturn("FAKE");
        when(backend.isAvailable()).thenReturn(true);
        when(backend.solve(any(), any())).thenAnswer(invocation -> {
            int variableCount = invocation.getArgument(0, MilpProgram.class).getVariables().size();
            return MilpSolution.optimal("FAKE", 0, new double[variableCount]);
        });
        OpenMicrogridParameters parameters = new OpenMicrogridParameters();
        ScenarioWindow window = singleHour(1, 0, 0, 10, 5, parameters);
        ReportNode reportNode = Reports.createRootReportNode("omg.scenarioBatch", Locale.US);

        HorizonResult result = solverWith(backend).solve(window, 0, reportNode);

        assertEquals("FAKE", result.getBackendName());
        assertEquals(1, reportNode.getChildren().size());
        assertTrue(reportNode.getChildren().get(0).getMessage().startsWith("Energy balance residual of hour 0"));
    }
}
