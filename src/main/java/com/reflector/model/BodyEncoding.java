package com.reflector.model;

import org.springframework.http.MediaType;

/**
 * A request body encoding: the field location that feeds it and the media type it is published under.
 */
public enum BodyEncoding {

    JSON(FieldLocation.JSON, MediaType.APPLICATION_JSON_VALUE),
    FORM_DATA(FieldLocation.FORM_DATA, MediaType.APPLICATION_FORM_URLENCODED_VALUE);

    private final FieldLocation location;
    private final String mimeType;

    BodyEncoding(FieldLocation location, String mimeType) {
        this.location = location;
        this.mimeType = mimeType;
    }

    public FieldLocation location() {
        return location;
    }

    public String mimeType() {
        return mimeType;
    }
}
