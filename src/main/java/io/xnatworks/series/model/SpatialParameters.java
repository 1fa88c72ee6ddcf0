/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * Geometry of a reconstructed image.
 * Direction is a dimension x dimension matrix stored row-major; column i is the direction of axis i.
 */
public final class SpatialParameters {

    private final int[] size;
    private final double[] spacing;
    private final double[] origin;
    private final double[] direction;

    @JsonCreator
    public SpatialParameters(@JsonProperty("size") int[] size,
                             @JsonProperty("spacing") double[] spacing,
                             @JsonProperty("origin") double[] origin,
                             @JsonProperty("direction") double[] direction) {
        if (size == null || size.length == 0) {
            throw new IllegalArgumentException("size is required");
        }
        int dimension = size.length;
        this.size = size.clone();
        this.spacing = checkLength("spacing", spacing, dimension);
        this.origin = checkLength("origin", origin, dimension);
        this.direction = checkLength("direction", direction, dimension * dimension);
    }

    /**
     * Unit spacing, zero origin and identity direction for the given size.
     */
    public static SpatialParameters identity(int... size) {
        int dimension = size.length;
        double[] spacing = new double[dimension];
        Arrays.fill(spacing, 1.0);
        double[] direction = new double[dimension * dimension];
        for (int i = 0; i < dimension; i++) {
            direction[i * dimension + i] = 1.0;
        }
        return new SpatialParameters(size, spacing, new double[dimension], direction);
    }

    private static double[] checkLength(String field, double[] values, int expected) {
        if (values == null || values.length != expected) {
            throw new IllegalArgumentException(field + " must have " + expected + " values");
        }
        return values.clone();
    }

    @JsonIgnore
    public int getDimension() {
        return size.length;
    }

    public int[] getSize() {
        return size.clone();
    }

    public double[] getSpacing() {
        return spacing.clone();
    }

    public double[] getOrigin() {
        return origin.clone();
    }

    public double[] getDirection() {
        return direction.clone();
    }

    /**
     * Number of pixels described by the size.
     */
    @JsonIgnore
    public long getPixelCount() {
        long count = 1;
        for (int s : size) {
            count *= s;
        }
        return count;
    }

    @Override
    public String toString() {
        return "SpatialParameters{size=" + Arrays.toString(size) +
                ", spacing=" + Arrays.toString(spacing) +
                ", origin=" + Arrays.toString(origin) +
                ", direction=" + Arrays.toString(direction) + "}";
    }
}
