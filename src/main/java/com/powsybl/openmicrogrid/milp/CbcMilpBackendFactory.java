/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.milp;

import com.google.auto.service.AutoService;

/**
 * COIN-OR CBC, reached through the OR-Tools linear solver wrapper as the model builder does not support it.
 *
 * @author PowSyBl Open Microgrid team
 */
@AutoService(MilpBackendFactory.class)
public class CbcMilpBackendFactory implements MilpBackendFactory {

    public static final String NAME = "CBC";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public MilpBackend create() {
        return new OrToolsLinearSolverMilpBackend(NAME, "CBC");
    }
}
