/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid;

import com.powsybl.commons.PowsyblException;

/**
 * Base class of all the errors raised by the microgrid dispatch.
 *
 * @author PowSyBl Open Microgrid team
 */
public class OpenMicrogridException extends PowsyblException {

    public OpenMicrogridException(String msg) {
        super(msg);
    }

    public OpenMicrogridException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
