package org.example.studio.generation;

import java.util.List;

/**
 * An image generation backend.
 */
public interface GenerationClient {

    /**
     * Generate one image and store it.
     *
     * @param kind      what is being generated
     * @param inputRefs reference images, the first one being the primary anchor; may be empty
     * @param prompt    text prompt
     * @return the stored image reference, or the failure reason. Implementations report
     *         timeouts and backend errors as {@link GenerationResult.Failure}.
     */
    GenerationResult generate(GenerationKind kind, List<String> inputRefs, String prompt);
}
