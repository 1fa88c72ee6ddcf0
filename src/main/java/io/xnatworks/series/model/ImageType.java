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

import java.util.Objects;

/**
 * Pixel layout of a {@link DicomImage}.
 */
public final class ImageType {

    public static final String UINT8 = "uint8";
    public static final String INT8 = "int8";
    public static final String UINT16 = "uint16";
    public static final String INT16 = "int16";

    public static final String SCALAR = "Scalar";
    public static final String RGB = "RGB";

    private final int dimension;
    private final String componentType;
    private final String pixelType;
    private final int components;

    @JsonCreator
    public ImageType(@JsonProperty("dimension") int dimension,
                     @JsonProperty("componentType") String componentType,
                     @JsonProperty("pixelType") String pixelType,
                     @JsonProperty("components") int components) {
        if (dimension < 2 || dimension > 3) {
            throw new IllegalArgumentException("Unsupported image dimension: " + dimension);
        }
        if (components < 1) {
            throw new IllegalArgumentException("components must be positive");
        }
        bytesFor(componentType);
        this.dimension = dimension;
        this.componentType = componentType;
        this.pixelType = pixelType != null ? pixelType : SCALAR;
        this.components = components;
    }

    public static ImageType scalar(int dimension, String componentType) {
        return new ImageType(dimension, componentType, SCALAR, 1);
    }

    private static int bytesFor(String componentType) {
        if (componentType == null) {
            throw new IllegalArgumentException("componentType is required");
        }
        switch (componentType) {
            case UINT8:
            case INT8:
                return 1;
            case UINT16:
            case INT16:
                return 2;
            default:
                throw new IllegalArgumentException("Unsupported component type: " + componentType);
        }
    }

    public int getDimension() {
        return dimension;
    }

    public String getComponentType() {
        return componentType;
    }

    public String getPixelType() {
        return pixelType;
    }

    public int getComponents() {
        return components;
    }

    /**
     * Bytes per pixel, all components included.
     */
    @JsonIgnore
    public int getBytesPerPixel() {
        return bytesFor(componentType) * components;
    }

    /**
     * Same pixel layout with another dimension.
     */
    public ImageType withDimension(int newDimension) {
        return new ImageType(newDimension, componentType, pixelType, components);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImageType)) return false;
        ImageType other = (ImageType) o;
        return dimension == other.dimension && components == other.components
                && componentType.equals(other.componentType) && pixelType.equals(other.pixelType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, componentType, pixelType, components);
    }

    @Override
    public String toString() {
        return dimension + "D " + componentType + " " + pixelType + "[" + components + "]";
    }
}
