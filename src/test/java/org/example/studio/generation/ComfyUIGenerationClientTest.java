package org.example.studio.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.example.studio.service.AssetKeyService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ExtendWith(MockitoExtension.class)
class ComfyUIGenerationClientTest {

    @Mock
    private BlobStorage blobStorage;

    @Mock
    private AssetKeyService assetKeyService;

    private ComfyUIGenerationClient client;

    @BeforeEach
    void setUp() {
        client = new ComfyUIGenerationClient(blobStorage, assetKeyService);
        ReflectionTestUtils.setField(client, "checkpoint", "test.safetensors");
        ReflectionTestUtils.setField(client, "portraitWidth", 512);
        ReflectionTestUtils.setField(client, "portraitHeight", 640);
        ReflectionTestUtils.setField(client, "pageWidth", 1024);
        ReflectionTestUtils.setField(client, "pageHeight", 768);
        ReflectionTestUtils.setField(client, "samplerSteps", 20);
        ReflectionTestUtils.setField(client, "cfgScale", 7);
        ReflectionTestUtils.setField(client, "referenceDenoise", 0.65);
    }

    @Test
    void buildWorkflow_withoutReferenceStartsFromEmptyLatent() {
        ObjectNode workflow = client.buildWorkflow(GenerationKind.CHARACTER_PORTRAIT, "a fox", null);

        JsonNode latent = workflow.get("5");
        assertEquals("EmptyLatentImage", latent.get("class_type").asText());
        assertEquals(512, latent.get("inputs").get("width").asInt());
        assertEquals(640, latent.get("inputs").get("height").asInt());
        assertFalse(workflow.has("10"));

        JsonNode sampler = workflow.get("3").get("inputs");
        assertEquals(1.0, sampler.get("denoise").asDouble());
        assertEquals("5", sampler.get("latent_image").get(0).asText());
        assertEquals("test.safetensors", workflow.get("4").get("inputs").get("ckpt_name").asText());
        assertEquals("a fox", workflow.get("6").get("inputs").get("text").asText());
    }

    @Test
    void buildWorkflow_withReferenceEncodesUploadedImage() {
        ObjectNode workflow = client.buildWorkflow(GenerationKind.PAGE_ILLUSTRATION, "a forest", "ref-1.png");

        assertFalse(workflow.has("5"));
        assertEquals("LoadImage", workflow.get("10").get("class_type").asText());
        assertEquals("ref-1.png", workflow.get("10").get("inputs").get("image").asText());
        assertEquals("VAEEncode", workflow.get("11").get("class_type").asText());

        JsonNode sampler = workflow.get("3").get("inputs");
        assertEquals(0.65, sampler.get("denoise").asDouble());
        assertEquals("11", sampler.get("latent_image").get(0).asText());
        assertEquals("page-illustration", workflow.get("9").get("inputs").get("filename_prefix").asText());
    }

    @Test
    void buildWorkflow_sketchCapsDenoiseAndAddsLineArtPrompt() {
        ObjectNode workflow = client.buildWorkflow(GenerationKind.PAGE_SKETCH, "a forest", "ref-1.png");

        assertEquals(0.5, workflow.get("3").get("inputs").get("denoise").asDouble());
        String positive = workflow.get("6").get("inputs").get("text").asText();
        assertTrue(positive.startsWith("a forest"));
        assertTrue(positive.contains("pencil sketch"));
    }
}
