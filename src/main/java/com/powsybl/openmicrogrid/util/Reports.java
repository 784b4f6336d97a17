/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.util;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;
import com.powsybl.openmicrogrid.util.report.PowsyblOpenMicrogridReportResourceBundle;

import java.util.Locale;

/**
 * @author PowSyBl Open Microgrid team
 */
public final class Reports {

    private static final String HOUR = "hour";
    private static final String FIRST_HOUR = "firstHour";
    private static final String HOUR_COUNT = "hourCount";
    private static final String VARIANT_ID = "variantId";

    public static final String RECEDING_HORIZON_KEY = "omg.recedingHorizon";
    public static final String SCENARIO_BATCH_KEY = "omg.scenarioBatch";

    private Reports() {
    }

    public static ReportNode createRootReportNode(String key, Locale locale) {
        return ReportNode.newRootReportNode()
                .withLocale(locale)
                .withResourceBundles(PowsyblOpenMicrogridReportResourceBundle.BASE_NAME)
                .withMessageTemplate(key)
                .build();
    }

    public static ReportNode createRecedingHorizonReporter(ReportNode reportNode, int startHour, int horizonHours, double initialSoc) {
        return reportNode.newReportNode()
                .withMessageTemplate(RECEDING_HORIZON_KEY)
                .withUntypedValue("startHour", startHour)
                .withUntypedValue("horizonHours", horizonHours)
                .withUntypedValue("initialSoc", initialSoc)
                .add();
    }

    public static void reportHourCommitted(ReportNode reportNode, int hour, double soc, double objectiveValue, String backendName) {
        reportNode.newReportNode()
                .withMessageTemplate("omg.hourCommitted")
                .withUntypedValue(HOUR, hour)
                .withUntypedValue("soc", soc)
                .withUntypedValue("objective", objectiveValue)
                .withUntypedValue("backend", backendName)
                .withSeverity(TypedValue.TRACE_SEVERITY)
                .add();
    }

    public static void reportRecedingHorizonCompleted(ReportNode reportNode, int hourCount, int firstHour, int lastHour, double finalSoc) {
        reportNode.newReportNode()
                .withMessageTemplate("omg.recedingHorizonCompleted")
                .withUntypedValue(HOUR_COUNT, hourCount)
                .withUntypedValue(FIRST_HOUR, firstHour)
                .withUntypedValue("lastHour", lastHour)
                .withUntypedValue("finalSoc", finalSoc)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportNoHourToCommit(ReportNode reportNode, int startHour, int horizonHours, int lastHour) {
        reportNode.newReportNode()
                .withMessageTemplate("omg.noHourToCommit")
                .withUntypedValue("startHour", startHour)
                .withUntypedValue("horizonHours", horizonHours)
                .withUntypedValue("lastHour", lastHour)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportRecedingHorizonFailed(ReportNode reportNode, int hour, int committedHourCount, String reason) {
        reportNode.newReportNode()
                .withMessageTemplate("omg.recedingHorizonFailed")
                .withUntypedValue(HOUR, hour)
                .withUntypedValue("committedHourCount", committedHourCount)
                .withUntypedValue("reason", reason)
                .withSeverity(TypedValue.ERROR_SEVERITY)
                .add();
    }

    public static void reportEnergyBalanceMismatch(ReportNode reportNode, int hour, double residual, double tolerance) {
        reportNode.newReportNode()
                .withMessageTemplate("omg.energyBalanceMismatch")
                .withUntypedValue(HOUR, hour)
                .withUntypedValue("residual", residual)
                .withUntypedValue("tolerance", tolerance)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static ReportNode createScenarioVariantReporter(ReportNode reportNode, String variantId, double fuelPrice, double loadScale) {
        return reportNode.newReportNode()
                .withMessageTemplate("omg.scenarioVariant")
                .withUntypedValue(VARIANT_ID, variantId)
                .withUntypedValue("fuelPrice", fuelPrice)
                .withUntypedValue("loadScale", loadScale)
                .add();
    }

    public static void reportScenarioVariantFailed(ReportNode reportNode, String variantId, String reason) {
        reportNode.newReportNode()
                .withMessageTemplate("omg.scenarioVariantFailed")
                .withUntypedValue(VARIANT_ID, variantId)
                .withUntypedValue("reason", reason)
                .withSeverity(TypedValue.ERROR_SEVERITY)
                .add();
    }
}
