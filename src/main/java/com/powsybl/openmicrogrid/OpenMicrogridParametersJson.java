/**
 * Copyright (c) 2026, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.openmicrogrid;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.powsybl.commons.json.JsonUtil;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON read and write of {@link OpenMicrogridParameters}. Property names are the parameter names.
 *
 * @author PowSyBl Open Microgrid team
 */
public final class OpenMicrogridParametersJson {

    private OpenMicrogridParametersJson() {
    }

    private static ObjectMapper createMapper() {
        return JsonUtil.createObjectMapper();
    }

    public static OpenMicrogridParameters read(Path jsonFile) {
        Objects.requireNonNull(jsonFile);
        try (InputStream is = Files.newInputStream(jsonFile)) {
            return read(is);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static OpenMicrogridParameters read(InputStream jsonStream) {
        Objects.requireNonNull(jsonStream);
        try {
            return createMapper().readValue(jsonStream, OpenMicrogridParameters.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(OpenMicrogridParameters parameters, Path jsonFile) {
        Objects.requireNonNull(jsonFile);
        try (OutputStream os = Files.newOutputStream(jsonFile)) {
            write(parameters, os);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(OpenMicrogridParameters parameters, OutputStream outputStream) {
        Objects.requireNonNull(parameters);
        Objects.requireNonNull(outputStream);
        try {
            createMapper().writerWithDefaultPrettyPrinter().writeValue(outputStream, parameters);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
