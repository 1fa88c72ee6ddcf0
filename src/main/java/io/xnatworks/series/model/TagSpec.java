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
 * A tag to read: the caller-facing name and the backend-facing code in {@code gggg|eeee} form.
 */
public final class TagSpec {

    public static final TagSpec PATIENT_NAME = new TagSpec("PatientName", "0010|0010");
    public static final TagSpec PATIENT_ID = new TagSpec("PatientID", "0010|0020");
    public static final TagSpec STUDY_INSTANCE_UID = new TagSpec("StudyInstanceUID", "0020|000d");
    public static final TagSpec SERIES_INSTANCE_UID = new TagSpec("SeriesInstanceUID", "0020|000e");
    public static final TagSpec SERIES_NUMBER = new TagSpec("SeriesNumber", "0020|0011");
    public static final TagSpec SERIES_DESCRIPTION = new TagSpec("SeriesDescription", "0008|103e");
    public static final TagSpec MODALITY = new TagSpec("Modality", "0008|0060");
    public static final TagSpec INSTANCE_NUMBER = new TagSpec("InstanceNumber", "0020|0013");
    public static final TagSpec IMAGE_POSITION_PATIENT = new TagSpec("ImagePositionPatient", "0020|0032");
    public static final TagSpec IMAGE_ORIENTATION_PATIENT = new TagSpec("ImageOrientationPatient", "0020|0037");

    private final String name;
    private final String tag;

    public TagSpec(String name, String tag) {
        this.name = Objects.requireNonNull(name, "name");
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    public String getName() {
        return name;
    }

    public String getTag() {
        return tag;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TagSpec)) return false;
        TagSpec other = (TagSpec) o;
        return name.equals(other.name) && tag.equals(other.tag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, tag);
    }

    @Override
    public String toString() {
        return name + "(" + tag + ")";
    }
}
