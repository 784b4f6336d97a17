/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid.milp;

/**
 * @author PowSyBl Open Microgrid team
 */
public abstract class AbstractOrToolsMilpBackendFactory implements MilpBackendFactory {

    protected abstract String getSolverId();

    @Override
    public MilpBackend create() {
        return new OrToolsMilpBackend(getName(), getSolverId());
    }
}
