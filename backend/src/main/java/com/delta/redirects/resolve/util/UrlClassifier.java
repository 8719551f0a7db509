package com.delta.redirects.resolve.util;

import com.delta.redirects.resolve.model.UrlCategory;
import com.delta.redirects.resolve.model.UrlClassification;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public final class UrlClassifier {

    private UrlClassifier() {
    }

    public static UrlClassification classify(String url) {
        if (url == null || url.isBlank()) {
            return new UrlClassification(null, null, false);
        }
        String decoded = decode(url);
        if (decoded == null) {
            return UrlClassification.undecodable();
        }
        return new UrlClassification(categoryOf(url), lastSegment(decoded), false);
    }

    public static UrlCategory categoryOf(String url) {
        if (url == null) {
            return null;
        }
        if (url.contains(UrlCategory.PRODUCT.pathMarker())) {
            return UrlCategory.PRODUCT;
        }
        if (url.contains(UrlCategory.CATALOG.pathMarker())) {
            return UrlCategory.CATALOG;
        }
        return null;
    }

    static String lastSegment(String decoded) {
        String clean = decoded.endsWith("/") ? decoded.substring(0, decoded.length() - 1) : decoded;
        int idx = clean.lastIndexOf('/');
        String segment = idx < 0 ? clean : clean.substring(idx + 1);
        return segment.isEmpty() ? null : segment;
    }

    // strict percent-decoding: '+' is data, escapes must form valid UTF-8
    static String decode(String url) {
        if (url == null) {
            return null;
        }
        StringBuilder out = new StringBuilder(url.length());
        ByteBuffer pending = ByteBuffer.allocate(url.length());
        int i = 0;
        try {
            while (i < url.length()) {
                char c = url.charAt(i);
                if (c != '%') {
                    flush(pending, out);
                    out.append(c);
                    i++;
                    continue;
                }
                if (i + 2 >= url.length()) {
                    return null;
                }
                int hi = hexValue(url.charAt(i + 1));
                int lo = hexValue(url.charAt(i + 2));
                if (hi < 0 || lo < 0) {
                    return null;
                }
                pending.put((byte) ((hi << 4) | lo));
                i += 3;
            }
            flush(pending, out);
        } catch (CharacterCodingException e) {
            return null;
        }
        return out.toString();
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }

    private static void flush(ByteBuffer pending, StringBuilder out) throws CharacterCodingException {
        if (pending.position() == 0) {
            return;
        }
        pending.flip();
        out.append(StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(pending));
        pending.clear();
    }
}
