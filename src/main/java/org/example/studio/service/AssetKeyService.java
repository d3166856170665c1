package org.example.studio.service;

import org.example.studio.generation.GenerationKind;
import org.springframework.stereotype.Service;

import java.time.LocalDate;

@Service
public class AssetKeyService {

    private static final int MAX_SEGMENT_LENGTH = 64;
    private static final int MAX_KEY_LENGTH = 255;

    /**
     * Key for a freshly generated image, e.g. {@code generated/page-sketch/2026/10/19/<id>.png}.
     */
    public String buildGeneratedKey(GenerationKind kind, String generationId) {
        return buildGeneratedKey(kind, generationId, LocalDate.now());
    }

    String buildGeneratedKey(GenerationKind kind, String generationId, LocalDate date) {
        String base = "generated/"
                + kind.assetSegment()
                + "/" + date.getYear()
                + "/" + String.format("%02d", date.getMonthValue())
                + "/" + String.format("%02d", date.getDayOfMonth())
                + "/";
        String id = normalizeSegment(generationId);
        if (id.isBlank()) {
            id = "image";
        }
        int maxIdLength = Math.max(16, MAX_KEY_LENGTH - base.length() - ".png".length());
        if (id.length() > maxIdLength) {
            id = id.substring(0, maxIdLength).replaceAll("-+$", "");
        }
        return base + id + ".png";
    }

    public String normalizeSegment(String value) {
        if (value == null) {
            return "";
        }
        String normalized = value.trim().toLowerCase();
        normalized = normalized.replaceAll("[^a-z0-9]+", "-");
        normalized = normalized.replaceAll("^-+", "").replaceAll("-+$", "");
        if (normalized.length() > MAX_SEGMENT_LENGTH) {
            normalized = normalized.substring(0, MAX_SEGMENT_LENGTH);
            normalized = normalized.replaceAll("-+$", "");
        }
        return normalized;
    }
}
