package com.ryuqq.cutover.adapter.filesystem;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Maps partition and row keys to file names and back.
 *
 * <p>Uses URL encoding, and also encodes a leading '.' so that no name resolves to a hidden file or a parent directory.</p>
 *
 * @author Cutover Team
 * @since 1.0.0
 */
final class KeyCodec {

    private KeyCodec() {
    }

    static String encode(String key) {
        String encoded = URLEncoder.encode(key, StandardCharsets.UTF_8);
        if (encoded.startsWith(".")) {
            encoded = "%2E" + encoded.substring(1);
        }
        return encoded;
    }

    static String decode(String fileName) {
        return URLDecoder.decode(fileName, StandardCharsets.UTF_8);
    }
}
