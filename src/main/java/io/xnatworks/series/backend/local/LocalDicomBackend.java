/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend.local;

import io.xnatworks.series.backend.BackendHandle;
import io.xnatworks.series.backend.DecodingBackend;
import io.xnatworks.series.backend.InitException;
import io.xnatworks.series.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decoding backend that runs in this JVM on top of dcm4che.
 * Handles native (uncompressed) transfer syntaxes only.
 */
public class LocalDicomBackend implements DecodingBackend {
    private static final Logger log = LoggerFactory.getLogger(LocalDicomBackend.class);

    @Override
    public String getName() {
        return EngineConfig.BACKEND_LOCAL;
    }

    @Override
    public BackendHandle open(EngineConfig config) throws InitException {
        try {
            LocalBackendHandle handle = new LocalBackendHandle();
            log.debug("Started local DICOM worker");
            return handle;
        } catch (RuntimeException e) {
            throw new InitException("Could not start local DICOM worker: " + e.getMessage(), e);
        }
    }
}
