package com.architecture.memory.flowgrade.service.llm;

import lombok.Value;

import java.util.Base64;

/**
 * Base64 image sent alongside a prompt, e.g. a flowchart photo or an image extracted from a PDF.
 */
@Value
public class ImageAttachment {

    private static final String DEFAULT_MIME_TYPE = "image/png";

    String base64Data;
    String mimeType;

    /**
     * Accepts raw base64 or a data URL ({@code data:image/jpeg;base64,...}).
     *
     * @throws IllegalArgumentException if the payload is empty or not valid base64
     */
    public static ImageAttachment fromBase64(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new IllegalArgumentException("Image payload is empty");
        }

        String mimeType = DEFAULT_MIME_TYPE;
        String data = payload.trim();
        int comma = data.indexOf(',');
        if (comma >= 0) {
            String header = data.substring(0, comma);
            if (header.startsWith("data:") && header.contains(";")) {
                mimeType = header.substring("data:".length(), header.indexOf(';'));
            }
            data = data.substring(comma + 1);
        }
        data = data.replaceAll("\\s", "");

        try {
            Base64.getDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Image payload is not valid base64", e);
        }
        if (data.isEmpty()) {
            throw new IllegalArgumentException("Image payload is empty");
        }
        return new ImageAttachment(data, mimeType.isEmpty() ? DEFAULT_MIME_TYPE : mimeType);
    }
}
