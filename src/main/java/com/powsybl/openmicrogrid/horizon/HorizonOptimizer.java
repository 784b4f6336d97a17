/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.horizon;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.openmicrogrid.model.HorizonResult;
import com.powsybl.openmicrogrid.scenario.ScenarioWindow;

/**
 * Computes the cost optimal dispatch of every hour of a window, starting from a given storage level.
 *
 * @author PowSyBl Open Microgrid team
 */
public interface HorizonOptimizer {

    HorizonResult solve(ScenarioWindow window, double socInit, ReportNode reportNode);

    default HorizonResult solve(ScenarioWindow window, double socInit) {
        return solve(window, socInit, ReportNode.NO_OP);
    }
}
