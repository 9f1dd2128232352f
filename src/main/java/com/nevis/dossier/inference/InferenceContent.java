package com.nevis.dossier.inference;

import java.util.Objects;

/**
 * What a model request is about: either extracted text or the raw document bytes.
 */
public record InferenceContent(
    String text,
    byte[] data,
    String mimeType
) {

    public static InferenceContent ofText(String text) {
        return new InferenceContent(Objects.requireNonNull(text, "text"), null, "text/plain");
    }

    public static InferenceContent ofBinary(byte[] data, String mimeType) {
        return new InferenceContent(null, Objects.requireNonNull(data, "data"), mimeType);
    }

    public boolean isText() {
        return text != null;
    }

    public int length() {
        return isText() ? text.length() : data.length;
    }
}
