package com.structcheck.verification.cache;

import com.structcheck.common.model.RectangularSection;
import com.structcheck.common.model.SteelLayer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content address of an interaction curve: the section value and the sample count
 * fully determine the curve, so equal keys always map to equal curves.
 */
public record CurveKey(RectangularSection section, int samplePoints) {

    /** SHA-256 over the canonical text of the key, for logs and reports. */
    public String fingerprint() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Short form of {@link #fingerprint()} for log lines. */
    public String shortFingerprint() {
        return fingerprint().substring(0, 12);
    }

    String canonical() {
        StringBuilder sb = new StringBuilder()
            .append("b=").append(section.width())
            .append(";h=").append(section.depth())
            .append(";fc=").append(section.fc())
            .append(";fy=").append(section.fy())
            .append(";n=").append(samplePoints);
        for (SteelLayer layer : section.layers()) {
            sb.append(";L=").append(layer.position()).append('@').append(layer.area());
        }
        return sb.toString();
    }
}
