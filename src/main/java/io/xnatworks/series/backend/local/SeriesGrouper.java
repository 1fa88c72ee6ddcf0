/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend.local;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Tag;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Groups datasets into volumes.
 * <p>
 * Files are grouped by Series Instance UID. A series whose files disagree on image orientation or
 * matrix size cannot be stacked into one volume, so it is split, and the parts are keyed
 * {@code <uid>.1}, {@code <uid>.2}, ... in first-seen order.
 */
final class SeriesGrouper {

    static final String UNKNOWN_SERIES = "unknown-series";

    private final Map<String, Map<String, List<String>>> series = new LinkedHashMap<>();

    /**
     * Add one file under its identifier.
     */
    void add(String id, Attributes attrs) {
        String seriesUid = attrs.getString(Tag.SeriesInstanceUID);
        if (seriesUid == null || seriesUid.isBlank()) {
            seriesUid = UNKNOWN_SERIES;
        }
        series.computeIfAbsent(seriesUid.trim(), k -> new LinkedHashMap<>())
                .computeIfAbsent(geometryKey(attrs), k -> new ArrayList<>())
                .add(id);
    }

    /**
     * Volume key to identifiers, in the order files were added.
     */
    Map<String, List<String>> volumes() {
        Map<String, List<String>> volumes = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, List<String>>> entry : series.entrySet()) {
            Map<String, List<String>> parts = entry.getValue();
            if (parts.size() == 1) {
                volumes.put(entry.getKey(), new ArrayList<>(parts.values().iterator().next()));
                continue;
            }
            int index = 1;
            for (List<String> ids : parts.values()) {
                volumes.put(entry.getKey() + "." + index++, new ArrayList<>(ids));
            }
        }
        return volumes;
    }

    private static String geometryKey(Attributes attrs) {
        StringBuilder key = new StringBuilder();
        key.append(attrs.getInt(Tag.Rows, 0)).append('x').append(attrs.getInt(Tag.Columns, 0));
        double[] orientation = attrs.getDoubles(Tag.ImageOrientationPatient);
        if (orientation != null && orientation.length == 6) {
            for (double v : orientation) {
                // round away floating point noise between slices of one acquisition
                double rounded = Math.round(v * 10000) / 10000.0;
                key.append('/').append(String.format(Locale.ROOT, "%.4f", rounded));
            }
        }
        return key.toString();
    }
}
