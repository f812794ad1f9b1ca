package com.idp.assessment.model;

/**
 * Rendered page image sent with the static context.
 *
 * @param mimeType image MIME type, e.g. {@code image/png}
 * @param data     encoded image bytes
 */
public record PageImage(String mimeType, byte[] data) {

    public PageImage {
        mimeType = mimeType != null && !mimeType.isBlank() ? mimeType : "image/png";
        data = data != null ? data : new byte[0];
    }
}
