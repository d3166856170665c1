package org.example.studio.model;

/**
 * What a generation request covers: every pending item of a kind, or one explicit item.
 */
public record GenerationScope(Kind kind, String itemId) {

    public enum Kind {
        CHARACTERS,
        PAGES
    }

    public GenerationScope {
        if (kind == null) {
            throw new IllegalArgumentException("Generation kind is required");
        }
        itemId = (itemId == null || itemId.isBlank()) ? null : itemId.trim();
    }

    public static GenerationScope characters() {
        return new GenerationScope(Kind.CHARACTERS, null);
    }

    public static GenerationScope character(String characterId) {
        return new GenerationScope(Kind.CHARACTERS, characterId);
    }

    public static GenerationScope pages() {
        return new GenerationScope(Kind.PAGES, null);
    }

    public static GenerationScope page(String pageId) {
        return new GenerationScope(Kind.PAGES, pageId);
    }

    public boolean isExplicitItem() {
        return itemId != null;
    }
}
