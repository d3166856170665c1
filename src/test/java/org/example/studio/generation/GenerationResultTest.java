package org.example.studio.generation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

class GenerationResultTest {

    @Test
    void failure_withoutReason_getsDefaultMessage() {
        GenerationResult.Failure failure =
                assertInstanceOf(GenerationResult.Failure.class, GenerationResult.failure("  "));

        assertEquals("Generation failed", failure.error());
    }

    @Test
    void success_carriesStoredReference() {
        GenerationResult.Success success =
                assertInstanceOf(GenerationResult.Success.class, GenerationResult.success("/assets/owl.png"));

        assertEquals("/assets/owl.png", success.ref());
    }
}
