/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.model;

import java.util.Objects;

/**
 * A reconstructed 2D slice or 3D volume.
 * Pixel data is little-endian, components interleaved, x fastest.
 */
public final class DicomImage {

    private final String name;
    private final ImageType imageType;
    private final SpatialParameters spatialParameters;
    private final byte[] data;

    public DicomImage(String name, ImageType imageType, SpatialParameters spatialParameters, byte[] data) {
        this.name = name;
        this.imageType = Objects.requireNonNull(imageType, "imageType");
        this.spatialParameters = Objects.requireNonNull(spatialParameters, "spatialParameters");
        Objects.requireNonNull(data, "data");

        if (imageType.getDimension() != spatialParameters.getDimension()) {
            throw new IllegalArgumentException("Image type is " + imageType.getDimension()
                    + "D but geometry is " + spatialParameters.getDimension() + "D");
        }
        long expected = spatialParameters.getPixelCount() * imageType.getBytesPerPixel();
        if (data.length != expected) {
            throw new IllegalArgumentException("Pixel buffer holds " + data.length
                    + " bytes, expected " + expected);
        }
        this.data = data.clone();
    }

    public String getName() {
        return name;
    }

    public ImageType getImageType() {
        return imageType;
    }

    public SpatialParameters getSpatialParameters() {
        return spatialParameters;
    }

    public int getDimension() {
        return imageType.getDimension();
    }

    public byte[] getData() {
        return data.clone();
    }

    @Override
    public String toString() {
        return "DicomImage{" + name + ", " + imageType + ", " + spatialParameters + "}";
    }
}
