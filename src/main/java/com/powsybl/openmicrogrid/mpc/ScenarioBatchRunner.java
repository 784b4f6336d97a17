/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.mpc;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.computation.CompletableFutureTask;
import com.powsybl.openmicrogrid.OpenMicrogridException;
import com.powsybl.openmicrogrid.OpenMicrogridParameters;
import com.powsybl.openmicrogrid.RecedingHorizonException;
import com.powsybl.openmicrogrid.horizon.HorizonOptimizer;
import com.powsybl.openmicrogrid.model.CommittedSchedule;
import com.powsybl.openmicrogrid.scenario.ScenarioTable;
import com.powsybl.openmicrogrid.util.Reports;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs independent receding horizon simulations, one per {@link ScenarioVariant}, in parallel. Each
 * run has its own copy of the table, its own parameters, optimizer and schedule.
 *
 * @author PowSyBl Open Microgrid team
 */
public class ScenarioBatchRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScenarioBatchRunner.class);

    public interface OptimizerProvider {
        HorizonOptimizer create(OpenMicrogridParameters parameters);
    }

    private final OptimizerProvider optimizerProvider;

    private final OpenMicrogridParameters parameters;

    private final Executor executor;

    public ScenarioBatchRunner(OptimizerProvider optimizerProvider, OpenMicrogridParameters parameters, Executor executor) {
        this.optimizerProvider = Objects.requireNonNull(optimizerProvider);
        this.parameters = Objects.requireNonNull(parameters).copy();
        this.executor = Objects.requireNonNull(executor);
    }

    public List<ScenarioRunResult> run(ScenarioTable table, List<ScenarioVariant> variants) {
        return run(table, variants, ReportNode.NO_OP);
    }

    /**
     * @return one result per variant, in the order of the given variants
     */
    public List<ScenarioRunResult> run(ScenarioTable table, List<ScenarioVariant> variants, ReportNode reportNode) {
        Objects.requireNonNull(table);
        Objects.requireNonNull(variants);
        Objects.requireNonNull(reportNode);
        Set<String> ids = new HashSet<>();
        for (ScenarioVariant variant : variants) {
            if (!ids.add(variant.id())) {
                throw new IllegalArgumentException("Duplicate scenario variant id: " + variant.id());
            }
        }

        // report nodes are not thread safe, each run reports in its own tree merged at the end
        List<ReportNode> threadReportNodes = new ArrayList<>(variants.size());
        List<ScenarioRunResult> results = Collections.synchronizedList(new ArrayList<>(Collections.nCopies(variants.size(), null)));
        List<CompletableFuture<Void>> futures = new ArrayList<>(variants.size());
        for (int i = 0; i < variants.size(); i++) {
            final int variantNum = i;
            ScenarioVariant variant = variants.get(i);
            ReportNode threadReportNode = reportNode == ReportNode.NO_OP
                    ? ReportNode.NO_OP
                    : Reports.createRootReportNode(Reports.SCENARIO_BATCH_KEY, reportNode.getTreeContext().getLocale());
            threadReportNodes.add(threadReportNode);
            futures.add(CompletableFutureTask.runAsync(() -> {
                results.set(variantNum, runVariant(table, variant, threadReportNode));
                return null;
            }, executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                    .get(); // get instead of join to be interruptible
        } catch (InterruptedException e) {
            for (var future : futures) {
                future.cancel(true);
            }
            Thread.currentThread().interrupt();
            throw new OpenMicrogridException("Scenario batch interrupted", e);
        } catch (ExecutionException e) {
            throw new OpenMicrogridException("Scenario batch failed", e.getCause());
        }

        if (reportNode != ReportNode.NO_OP) {
            threadReportNodes.forEach(reportNode::include);
        }
        return new ArrayList<>(results);
    }

    private ScenarioRunResult runVariant(ScenarioTable table, ScenarioVariant variant, ReportNode reportNode) {
        ReportNode variantReportNode = Reports.createScenarioVariantReporter(reportNode, variant.id(), variant.fuelPrice(), variant.loadScale());
        try {
            OpenMicrogridParameters variantParameters = variant.applyTo(parameters);
            RecedingHorizonController controller = new RecedingHorizonController(optimizerProvider.create(variantParameters), variantParameters);
            CommittedSchedule schedule = controller.run(variant.applyTo(table), variantReportNode);
            LOGGER.info("Scenario variant '{}' done, {} hours committed", variant.id(), schedule.size());
            return ScenarioRunResult.success(variant, schedule);
        } catch (RecedingHorizonException e) {
            LOGGER.warn("Scenario variant '{}' failed at hour {}: {}", variant.id(), e.getFailedHour(), e.getMessage());
            Reports.reportScenarioVariantFailed(variantReportNode, variant.id(), e.getMessage());
            return ScenarioRunResult.failure(variant, e.getPartialSchedule(), e);
        } catch (RuntimeException e) {
            LOGGER.warn("Scenario variant '{}' failed: {}", variant.id(), e.getMessage());
            Reports.reportScenarioVariantFailed(variantReportNode, variant.id(), e.getMessage());
            return ScenarioRunResult.failure(variant, new CommittedSchedule(), e);
        }
    }
}
