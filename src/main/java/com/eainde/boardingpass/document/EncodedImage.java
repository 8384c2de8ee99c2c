package com.eainde.boardingpass.document;

import java.util.Base64;

/**
 * Image bytes in a format a remote model accepts, with their media type.
 */
public record EncodedImage(byte[] data, String mediaType) {

    public String base64() {
        return Base64.getEncoder().encodeToString(data);
    }
}
