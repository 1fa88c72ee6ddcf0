/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend.local;

import io.xnatworks.series.model.DicomImage;
import io.xnatworks.series.model.ImageType;
import io.xnatworks.series.model.SpatialParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stacks decoded slices into a 3D volume and derives its geometry.
 */
final class SeriesVolumeAssembler {
    private static final Logger log = LoggerFactory.getLogger(SeriesVolumeAssembler.class);

    private SeriesVolumeAssembler() {
    }

    /**
     * @param slices             decoded files, one or more frames each
     * @param singleSortedSeries keep the given order; otherwise sort by position along the slice normal
     */
    static DicomImage assemble(String name, List<DecodedSlice> slices, boolean singleSortedSeries) throws IOException {
        if (slices.isEmpty()) {
            throw new IOException("No slices to assemble");
        }

        DecodedSlice first = slices.get(0);
        for (DecodedSlice slice : slices) {
            if (slice.rows != first.rows || slice.columns != first.columns) {
                throw new IOException("Slice " + slice.source + " is " + slice.columns + "x" + slice.rows
                        + ", expected " + first.columns + "x" + first.rows);
            }
            if (!slice.pixelType.equals(first.pixelType)) {
                throw new IOException("Slice " + slice.source + " has pixel type " + slice.pixelType
                        + ", expected " + first.pixelType);
            }
        }

        double[] normal = first.normal();
        List<DecodedSlice> ordered = new ArrayList<>(slices);
        if (!singleSortedSeries && ordered.stream().allMatch(DecodedSlice::hasPosition)) {
            // List.sort is stable, so slices at the same position keep their input order
            ordered.sort(Comparator.comparingDouble(s -> s.distanceAlong(normal)));
        }
        DecodedSlice origin = ordered.get(0);

        int frameCount = 0;
        for (DecodedSlice slice : ordered) {
            frameCount += slice.frames.size();
        }
        int frameLength = first.frames.get(0).length;
        byte[] data = new byte[frameLength * frameCount];
        int offset = 0;
        for (DecodedSlice slice : ordered) {
            for (byte[] frame : slice.frames) {
                System.arraycopy(frame, 0, data, offset, frameLength);
                offset += frameLength;
            }
        }

        double[] inPlane = origin.inPlaneSpacing();
        double[] spacing = {inPlane[0], inPlane[1], sliceSpacing(ordered, normal)};
        double[] originPoint = origin.hasPosition() ? origin.position.clone() : new double[3];
        double[] direction = direction(origin, normal);

        SpatialParameters geometry = new SpatialParameters(
                new int[]{first.columns, first.rows, frameCount}, spacing, originPoint, direction);
        ImageType type = first.pixelType.withDimension(3);

        log.debug("Assembled volume '{}' from {} files: {}", name, slices.size(), geometry);
        return new DicomImage(name, type, geometry, data);
    }

    /**
     * Distance between the first two slice positions, falling back to Spacing Between Slices,
     * then Slice Thickness, then 1.
     */
    static double sliceSpacing(List<DecodedSlice> ordered, double[] normal) {
        if (ordered.size() >= 2 && ordered.get(0).hasPosition() && ordered.get(1).hasPosition()) {
            double d = Math.abs(ordered.get(1).distanceAlong(normal) - ordered.get(0).distanceAlong(normal));
            if (d > 1e-6) {
                return d;
            }
        }
        DecodedSlice first = ordered.get(0);
        if (first.spacingBetweenSlices > 0) {
            return first.spacingBetweenSlices;
        }
        if (first.sliceThickness > 0) {
            return first.sliceThickness;
        }
        return 1.0;
    }

    /**
     * Row-major 3x3 matrix whose columns are the row cosine, column cosine and slice normal.
     */
    private static double[] direction(DecodedSlice slice, double[] normal) {
        if (!slice.hasOrientation()) {
            return new double[]{1, 0, 0, 0, 1, 0, 0, 0, 1};
        }
        double[] o = slice.orientation;
        return new double[]{
                o[0], o[3], normal[0],
                o[1], o[4], normal[1],
                o[2], o[5], normal[2]
        };
    }
}
