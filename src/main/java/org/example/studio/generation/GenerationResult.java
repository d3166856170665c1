package org.example.studio.generation;

/**
 * Outcome of one generation call. Ordinary failures are values, not exceptions.
 */
public interface GenerationResult {

    static GenerationResult success(String ref) {
        return new Success(ref);
    }

    static GenerationResult failure(String error) {
        return new Failure(error == null || error.isBlank() ? "Generation failed" : error);
    }

    record Success(String ref) implements GenerationResult {}

    record Failure(String error) implements GenerationResult {}
}
