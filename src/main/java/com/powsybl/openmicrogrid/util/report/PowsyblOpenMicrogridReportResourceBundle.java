/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.util.report;

import com.google.auto.service.AutoService;
import com.powsybl.commons.report.ReportResourceBundle;

/**
 * @author PowSyBl Open Microgrid team
 */
@AutoService(ReportResourceBundle.class)
public final class PowsyblOpenMicrogridReportResourceBundle implements ReportResourceBundle {

    public static final String BASE_NAME = "com.powsybl.openmicrogrid.reports";

    public String getBaseName() {
        return BASE_NAME;
    }
}
