/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.milp;

import com.powsybl.openmicrogrid.OpenMicrogridException;

/**
 * Failure of a single backend. Recovered by {@link SolverBackendAdapter} which falls back to the next
 * backend.
 *
 * @author PowSyBl Open Microgrid team
 */
public class MilpBackendException extends OpenMicrogridException {

    public MilpBackendException(String backendName, String msg) {
        super("MILP backend '" + backendName + "': " + msg);
    }

    public MilpBackendException(String backendName, String msg, Throwable cause) {
        super("MILP backend '" + backendName + "': " + msg, cause);
    }
}
