/*
 * XNAT DICOM Series Organizer
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.series.backend.local;

import io.xnatworks.series.model.ImageType;
import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Fragments;
import org.dcm4che3.data.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts native (uncompressed) pixel data from a dataset.
 * Encapsulated pixel data is rejected; decompression is left to a remote backend.
 */
final class PixelDataDecoder {
    private static final Logger log = LoggerFactory.getLogger(PixelDataDecoder.class);

    private PixelDataDecoder() {
    }

    static DecodedSlice decode(String source, Attributes attrs) throws IOException {
        int rows = attrs.getInt(Tag.Rows, 0);
        int cols = attrs.getInt(Tag.Columns, 0);
        int bitsAllocated = attrs.getInt(Tag.BitsAllocated, 16);
        int bitsStored = attrs.getInt(Tag.BitsStored, bitsAllocated);
        int samplesPerPixel = attrs.getInt(Tag.SamplesPerPixel, 1);
        int planarConfiguration = attrs.getInt(Tag.PlanarConfiguration, 0);
        boolean signed = attrs.getInt(Tag.PixelRepresentation, 0) == 1;
        int frameCount = Math.max(1, attrs.getInt(Tag.NumberOfFrames, 1));

        if (rows <= 0 || cols <= 0) {
            throw new IOException("Invalid image dimensions in " + source + ": " + cols + "x" + rows);
        }

        Object value = attrs.getValue(Tag.PixelData);
        if (value == null) {
            throw new IOException("No pixel data in " + source);
        }
        if (value instanceof Fragments) {
            throw new IOException("Compressed pixel data is not supported by the local backend: " + source);
        }
        if (bitsAllocated != 8 && bitsAllocated != 16) {
            throw new IOException("Unsupported bits allocated (" + bitsAllocated + ") in " + source);
        }
        if (samplesPerPixel != 1 && samplesPerPixel != 3) {
            throw new IOException("Unsupported samples per pixel (" + samplesPerPixel + ") in " + source);
        }

        byte[] pixelData = attrs.getBytes(Tag.PixelData);
        int bytesPerSample = bitsAllocated / 8;
        int frameLength = rows * cols * samplesPerPixel * bytesPerSample;
        if (pixelData == null || pixelData.length < frameLength * frameCount) {
            throw new IOException("Truncated pixel data in " + source + ": expected "
                    + ((long) frameLength * frameCount) + " bytes, found "
                    + (pixelData == null ? 0 : pixelData.length));
        }

        String componentType = bitsAllocated == 8
                ? (signed ? ImageType.INT8 : ImageType.UINT8)
                : (signed ? ImageType.INT16 : ImageType.UINT16);
        ImageType pixelType = samplesPerPixel == 3
                ? new ImageType(2, componentType, ImageType.RGB, 3)
                : ImageType.scalar(2, componentType);

        List<byte[]> frames = new ArrayList<>(frameCount);
        for (int f = 0; f < frameCount; f++) {
            byte[] frame = new byte[frameLength];
            System.arraycopy(pixelData, f * frameLength, frame, 0, frameLength);
            if (bytesPerSample == 2) {
                normalizeWords(frame, attrs.bigEndian(), bitsStored, signed);
            }
            if (samplesPerPixel == 3 && planarConfiguration == 1) {
                frame = interleave(frame, rows * cols, bytesPerSample);
            }
            frames.add(frame);
        }

        log.debug("Decoded {}: {}x{} {} with {} frame(s)", source, cols, rows, pixelType, frameCount);

        return new DecodedSlice(source, rows, cols, pixelType, frames,
                attrs.getDoubles(Tag.PixelSpacing),
                attrs.getDoubles(Tag.ImagePositionPatient),
                attrs.getDoubles(Tag.ImageOrientationPatient),
                attrs.getDouble(Tag.SpacingBetweenSlices, Double.NaN),
                attrs.getDouble(Tag.SliceThickness, Double.NaN));
    }

    /**
     * Convert 16-bit samples to little-endian and drop bits above BitsStored, sign-extending signed values.
     */
    private static void normalizeWords(byte[] frame, boolean bigEndian, int bitsStored, boolean signed) {
        int mask = bitsStored >= 16 ? 0xFFFF : (1 << bitsStored) - 1;
        int signBit = 1 << (bitsStored - 1);
        for (int i = 0; i + 1 < frame.length; i += 2) {
            int v = bigEndian
                    ? ((frame[i] & 0xFF) << 8) | (frame[i + 1] & 0xFF)
                    : ((frame[i + 1] & 0xFF) << 8) | (frame[i] & 0xFF);
            v &= mask;
            if (signed && bitsStored < 16 && (v & signBit) != 0) {
                v |= ~mask;
            }
            frame[i] = (byte) v;
            frame[i + 1] = (byte) (v >> 8);
        }
    }

    private static byte[] interleave(byte[] planar, int pixels, int bytesPerSample) {
        byte[] out = new byte[planar.length];
        int planeLength = pixels * bytesPerSample;
        for (int p = 0; p < pixels; p++) {
            for (int s = 0; s < 3; s++) {
                System.arraycopy(planar, s * planeLength + p * bytesPerSample,
                        out, (p * 3 + s) * bytesPerSample, bytesPerSample);
            }
        }
        return out;
    }

    /**
     * Linearly rescale a frame to 8-bit using its own minimum and maximum.
     * Components are rescaled together so colour balance is kept.
     */
    static byte[] rescaleToUint8(byte[] frame, ImageType type) {
        String componentType = type.getComponentType();
        if (ImageType.UINT8.equals(componentType)) {
            return frame.clone();
        }
        boolean wide = ImageType.UINT16.equals(componentType) || ImageType.INT16.equals(componentType);
        boolean signed = ImageType.INT8.equals(componentType) || ImageType.INT16.equals(componentType);
        int samples = wide ? frame.length / 2 : frame.length;

        int[] values = new int[samples];
        int min = Integer.MAX_VALUE;
        int max = Integer.MIN_VALUE;
        for (int i = 0; i < samples; i++) {
            int v;
            if (wide) {
                v = ((frame[2 * i + 1] & 0xFF) << 8) | (frame[2 * i] & 0xFF);
                if (signed) {
                    v = (short) v;
                }
            } else {
                v = signed ? frame[i] : frame[i] & 0xFF;
            }
            values[i] = v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }

        byte[] out = new byte[samples];
        double range = max - min;
        for (int i = 0; i < samples; i++) {
            out[i] = range == 0 ? 0 : (byte) Math.round((values[i] - min) * 255.0 / range);
        }
        return out;
    }
}
