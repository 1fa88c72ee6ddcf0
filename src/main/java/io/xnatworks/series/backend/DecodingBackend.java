/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend;

import io.xnatworks.series.config.EngineConfig;

/**
 * Starts decoding backends. One implementation per transport.
 */
public interface DecodingBackend {

    /**
     * Short name used in configuration and logs.
     */
    String getName();

    /**
     * Bring up a backend and return a handle to it.
     *
     * @param config endpoints and transport settings for this engine
     * @throws InitException if the backend cannot be started or reached
     */
    BackendHandle open(EngineConfig config) throws InitException;
}
