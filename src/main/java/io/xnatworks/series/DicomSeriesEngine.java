/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series;

import io.xnatworks.series.backend.BackendGateway;
import io.xnatworks.series.backend.DecodingBackend;
import io.xnatworks.series.backend.DecodingBackends;
import io.xnatworks.series.backend.InitException;
import io.xnatworks.series.config.EngineConfig;
import io.xnatworks.series.dicom.BuildException;
import io.xnatworks.series.dicom.CategorizeException;
import io.xnatworks.series.dicom.ImageBuilder;
import io.xnatworks.series.dicom.InstanceOrderer;
import io.xnatworks.series.dicom.OrderException;
import io.xnatworks.series.dicom.SeriesCategorizer;
import io.xnatworks.series.dicom.TagReadException;
import io.xnatworks.series.dicom.TagReader;
import io.xnatworks.series.model.DicomFile;
import io.xnatworks.series.model.DicomImage;
import io.xnatworks.series.model.TagSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Organizes loose DICOM files into ordered volumes.
 * <p>
 * Typical use:
 * <pre>
 * try (DicomSeriesEngine engine = new DicomSeriesEngine(EngineConfig.load("engine.yaml"))) {
 *     Map&lt;String, List&lt;DicomFile&gt;&gt; volumes = engine.categorize(files);
 *     DicomImage volume = engine.buildVolume(volumes.values().iterator().next());
 * }
 * </pre>
 * The backend starts on first use. Operations block until the backend answers; an engine may be
 * shared between threads.
 */
public class DicomSeriesEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DicomSeriesEngine.class);

    private final EngineConfig config;
    private final BackendGateway gateway;
    private final TagReader tagReader;
    private final SeriesCategorizer categorizer;
    private final InstanceOrderer orderer;
    private final ImageBuilder imageBuilder;

    public DicomSeriesEngine(EngineConfig config) {
        this(config, DecodingBackends.forConfig(config));
    }

    public DicomSeriesEngine(EngineConfig config, DecodingBackend backend) {
        config.validate();
        this.config = config;
        this.gateway = new BackendGateway(backend, config);
        this.tagReader = new TagReader(gateway);
        this.categorizer = new SeriesCategorizer(gateway);
        this.orderer = new InstanceOrderer(tagReader, config.getDuplicateInstancePolicy());
        this.imageBuilder = new ImageBuilder(gateway, config.isSortByInstanceNumber());
        log.debug("Created series engine with '{}' backend", backend.getName());
    }

    public EngineConfig getConfig() {
        return config;
    }

    /**
     * Start the backend if it is not running yet. Other operations do this themselves.
     */
    public void initialize() throws InitException {
        gateway.initialize();
    }

    /**
     * Discard a failed initialization so the next operation starts the backend again.
     */
    public boolean resetBackend() {
        return gateway.reset();
    }

    /**
     * Group files into volumes and, unless disabled in the configuration, order each volume by instance number.
     *
     * @return volume ID to files
     * @throws CategorizeException if grouping fails
     * @throws OrderException      if ordering a volume fails
     */
    public Map<String, List<DicomFile>> categorize(List<DicomFile> files) throws CategorizeException, OrderException {
        Map<String, List<DicomFile>> volumes = categorizer.categorize(files);

        if (config.isSortByInstanceNumber()) {
            for (Map.Entry<String, List<DicomFile>> volume : volumes.entrySet()) {
                volume.setValue(orderer.orderByInstance(volume.getValue()));
            }
        }
        return volumes;
    }

    /**
     * Order one volume's files by instance number.
     */
    public List<DicomFile> orderByInstance(List<DicomFile> files) throws OrderException {
        return orderer.orderByInstance(files);
    }

    public Map<String, String> readTags(DicomFile file, List<TagSpec> tags) throws TagReadException {
        return tagReader.readTags(file, tags);
    }

    public DicomImage getSlice(DicomFile file, boolean asThumbnail) throws BuildException {
        return imageBuilder.getSlice(file, asThumbnail);
    }

    /**
     * Reconstruct a volume from files already in slice order, such as a volume returned by {@link #categorize}.
     */
    public DicomImage buildVolume(List<DicomFile> orderedFiles) throws BuildException {
        return imageBuilder.buildVolume(orderedFiles);
    }

    @Override
    public void close() {
        gateway.close();
    }
}
