/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend.local;

import io.xnatworks.series.model.ImageType;

import java.util.List;

/**
 * Pixel frames and geometry decoded from one DICOM file.
 * Frames are little-endian with interleaved components.
 */
final class DecodedSlice {

    final String source;
    final int rows;
    final int columns;
    final ImageType pixelType;
    final List<byte[]> frames;

    // Geometry attributes, null or NaN when the file does not carry them
    final double[] pixelSpacing;
    final double[] position;
    final double[] orientation;
    final double spacingBetweenSlices;
    final double sliceThickness;

    DecodedSlice(String source, int rows, int columns, ImageType pixelType, List<byte[]> frames,
                 double[] pixelSpacing, double[] position, double[] orientation,
                 double spacingBetweenSlices, double sliceThickness) {
        this.source = source;
        this.rows = rows;
        this.columns = columns;
        this.pixelType = pixelType;
        this.frames = frames;
        this.pixelSpacing = pixelSpacing;
        this.position = position;
        this.orientation = orientation;
        this.spacingBetweenSlices = spacingBetweenSlices;
        this.sliceThickness = sliceThickness;
    }

    boolean hasPosition() {
        return position != null && position.length == 3;
    }

    boolean hasOrientation() {
        return orientation != null && orientation.length == 6;
    }

    /**
     * Column spacing (x) then row spacing (y); unit spacing when absent.
     */
    double[] inPlaneSpacing() {
        if (pixelSpacing != null && pixelSpacing.length == 2 && pixelSpacing[0] > 0 && pixelSpacing[1] > 0) {
            return new double[]{pixelSpacing[1], pixelSpacing[0]};
        }
        return new double[]{1.0, 1.0};
    }

    /**
     * Unit normal of the slice plane, the cross product of the row and column direction cosines.
     */
    double[] normal() {
        if (!hasOrientation()) {
            return new double[]{0, 0, 1};
        }
        double[] r = {orientation[0], orientation[1], orientation[2]};
        double[] c = {orientation[3], orientation[4], orientation[5]};
        double[] n = {
                r[1] * c[2] - r[2] * c[1],
                r[2] * c[0] - r[0] * c[2],
                r[0] * c[1] - r[1] * c[0]
        };
        double length = Math.sqrt(n[0] * n[0] + n[1] * n[1] + n[2] * n[2]);
        if (length == 0) {
            return new double[]{0, 0, 1};
        }
        return new double[]{n[0] / length, n[1] / length, n[2] / length};
    }

    /**
     * Distance of this slice along the given normal, 0 when the position is unknown.
     */
    double distanceAlong(double[] n) {
        if (!hasPosition()) {
            return 0;
        }
        return position[0] * n[0] + position[1] * n[1] + position[2] * n[2];
    }
}
