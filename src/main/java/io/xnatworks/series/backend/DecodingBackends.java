/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend;

import io.xnatworks.series.backend.local.LocalDicomBackend;
import io.xnatworks.series.backend.remote.RemoteDicomBackend;
import io.xnatworks.series.config.EngineConfig;

/**
 * Picks the backend named in the configuration.
 */
public final class DecodingBackends {

    private DecodingBackends() {
    }

    public static DecodingBackend forConfig(EngineConfig config) {
        config.validate();
        if (EngineConfig.BACKEND_REMOTE.equals(config.getBackend())) {
            return new RemoteDicomBackend();
        }
        return new LocalDicomBackend();
    }
}
