package org.example.studio.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import org.example.studio.service.AssetKeyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * {@link GenerationClient} backed by a ComfyUI server: submit a workflow to {@code /prompt},
 * poll {@code /history/{id}}, download the output from {@code /view} and hand it to
 * {@link BlobStorage}. With a reference image the workflow runs image-to-image from it.
 */
@Service
public class ComfyUIGenerationClient implements GenerationClient {

  private static final Logger log = LoggerFactory.getLogger(ComfyUIGenerationClient.class);

  private static final String NEGATIVE_PROMPT = "text, watermark, blurry, bad quality, deformed, ugly, low resolution";
  private static final String SKETCH_SUFFIX = ", pencil sketch, clean line art, black and white, no shading";

  @Value("${comfyui.base-url:http://localhost:8188}")
  private String comfyuiBaseUrl;

  @Value("${comfyui.workflow-timeout:180000}")
  private long workflowTimeout;

  @Value("${comfyui.poll-interval:2000}")
  private long pollInterval;

  @Value("${comfyui.checkpoint:sd_xl_base_1.0.safetensors}")
  private String checkpoint;

  @Value("${generation.portrait.width:512}")
  private int portraitWidth;

  @Value("${generation.portrait.height:640}")
  private int portraitHeight;

  @Value("${generation.page.width:1024}")
  private int pageWidth;

  @Value("${generation.page.height:768}")
  private int pageHeight;

  @Value("${generation.sampler-steps:25}")
  private int samplerSteps;

  @Value("${generation.cfg-scale:7}")
  private int cfgScale;

  @Value("${generation.reference-denoise:0.65}")
  private double referenceDenoise;

  private final BlobStorage blobStorage;
  private final AssetKeyService assetKeyService;
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final Random random = new Random();
  private WebClient webClient;

  public ComfyUIGenerationClient(BlobStorage blobStorage, AssetKeyService assetKeyService) {
    this.blobStorage = blobStorage;
    this.assetKeyService = assetKeyService;
  }

  @PostConstruct
  public void init() {
    // 16MB buffer for image downloads
    this.webClient = WebClient.builder()
        .baseUrl(comfyuiBaseUrl)
        .codecs(configurer -> configurer
            .defaultCodecs()
            .maxInMemorySize(16 * 1024 * 1024))
        .build();
    log.info("ComfyUI generation client initialized with endpoint: {}", comfyuiBaseUrl);
  }

  @Override
  public GenerationResult generate(GenerationKind kind, List<String> inputRefs, String prompt) {
    try {
      String referenceName = null;
      if (inputRefs != null && !inputRefs.isEmpty()) {
        referenceName = uploadReference(inputRefs.get(0));
      }
      String promptId = submitWorkflow(kind, prompt, referenceName);
      return pollForCompletion(kind, promptId);
    } catch (TimeoutException e) {
      log.warn("ComfyUI {} generation timed out: {}", kind, e.getMessage());
      return GenerationResult.failure(e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return GenerationResult.failure("Generation interrupted");
    } catch (Exception e) {
      log.warn("ComfyUI {} generation failed", kind, e);
      return GenerationResult.failure(e.getMessage());
    }
  }

  /**
   * Copy a reference image into ComfyUI's input folder so a LoadImage node can use it.
   */
  private String uploadReference(String ref) throws Exception {
    byte[] bytes = blobStorage.read(ref).orElseGet(() -> fetchRemote(ref));
    if (bytes == null || bytes.length == 0) {
      throw new IllegalStateException("Reference image is not readable: " + ref);
    }
    String filename = "ref-" + Integer.toHexString(ref.hashCode()) + ".png";

    MultipartBodyBuilder body = new MultipartBodyBuilder();
    body.part("image", new ByteArrayResource(bytes) {
      @Override
      public String getFilename() {
        return filename;
      }
    }).contentType(MediaType.IMAGE_PNG);
    body.part("overwrite", "true");

    String response = webClient.post()
        .uri("/upload/image")
        .contentType(MediaType.MULTIPART_FORM_DATA)
        .body(BodyInserters.fromMultipartData(body.build()))
        .retrieve()
        .bodyToMono(String.class)
        .block(Duration.ofSeconds(30));

    JsonNode node = objectMapper.readTree(response);
    String name = node.path("name").asText(filename);
    String subfolder = node.path("subfolder").asText("");
    return subfolder.isBlank() ? name : subfolder + "/" + name;
  }

  private byte[] fetchRemote(String ref) {
    if (!ref.startsWith("http://") && !ref.startsWith("https://")) {
      return null;
    }
    return WebClient.create()
        .get()
        .uri(ref)
        .retrieve()
        .bodyToMono(byte[].class)
        .block(Duration.ofSeconds(30));
  }

  String submitWorkflow(GenerationKind kind, String prompt, String referenceName) throws Exception {
    ObjectNode requestBody = objectMapper.createObjectNode();
    requestBody.set("prompt", buildWorkflow(kind, prompt, referenceName));

    String response = webClient.post()
        .uri("/prompt")
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(objectMapper.writeValueAsString(requestBody))
        .retrieve()
        .bodyToMono(String.class)
        .block(Duration.ofSeconds(10));

    JsonNode responseNode = objectMapper.readTree(response);
    String promptId = responseNode.get("prompt_id").asText();
    log.info("Submitted {} workflow to ComfyUI, prompt_id: {}", kind, promptId);
    return promptId;
  }

  private GenerationResult pollForCompletion(GenerationKind kind, String promptId) throws Exception {
    long startTime = System.currentTimeMillis();

    while (System.currentTimeMillis() - startTime < workflowTimeout) {
      String response = webClient.get()
          .uri("/history/{promptId}", promptId)
          .retrieve()
          .bodyToMono(String.class)
          .block(Duration.ofSeconds(5));

      JsonNode promptHistory = objectMapper.readTree(response).get(promptId);
      if (promptHistory != null && !promptHistory.isNull()) {
        JsonNode status = promptHistory.get("status");
        if (status != null && "error".equals(status.path("status_str").asText())) {
          String errorMsg = status.has("messages") ? status.get("messages").toString() : "ComfyUI workflow error";
          return GenerationResult.failure(errorMsg);
        }

        Optional<JsonNode> image = firstOutputImage(promptHistory.get("outputs"));
        if (image.isPresent()) {
          String filename = image.get().get("filename").asText();
          String subfolder = image.get().path("subfolder").asText("");
          byte[] data = downloadImage(filename, subfolder);
          String ref = blobStorage.upload(assetKeyService.buildGeneratedKey(kind, promptId), data);
          return GenerationResult.success(ref);
        }
      }

      Thread.sleep(pollInterval);
    }

    throw new TimeoutException("Workflow timed out after " + workflowTimeout + "ms");
  }

  private Optional<JsonNode> firstOutputImage(JsonNode outputs) {
    if (outputs == null || outputs.isEmpty()) {
      return Optional.empty();
    }
    for (JsonNode nodeOutput : outputs) {
      JsonNode images = nodeOutput.get("images");
      if (images != null && images.isArray() && !images.isEmpty()) {
        return Optional.of(images.get(0));
      }
    }
    return Optional.empty();
  }

  private byte[] downloadImage(String filename, String subfolder) {
    return webClient.get()
        .uri(builder -> {
          builder.path("/view").queryParam("filename", filename);
          if (subfolder != null && !subfolder.isEmpty()) {
            builder.queryParam("subfolder", subfolder);
          }
          return builder.build();
        })
        .retrieve()
        .bodyToMono(byte[].class)
        .block(Duration.ofSeconds(30));
  }

  /**
   * API-format workflow. Text-to-image from an empty latent, or image-to-image from the
   * uploaded reference when there is one.
   */
  ObjectNode buildWorkflow(GenerationKind kind, String prompt, String referenceName) {
    boolean portrait = kind == GenerationKind.CHARACTER_PORTRAIT || kind == GenerationKind.CHARACTER_SKETCH;
    String positive = kind.isSketch() ? prompt + SKETCH_SUFFIX : prompt;
    ObjectNode workflow = objectMapper.createObjectNode();

    workflow.set("4", node("CheckpointLoaderSimple", inputs -> inputs.put("ckpt_name", checkpoint)));

    String latentNode;
    double denoise;
    if (referenceName != null) {
      workflow.set("10", node("LoadImage", inputs -> inputs.put("image", referenceName)));
      workflow.set("11", node("VAEEncode", inputs -> {
        inputs.set("pixels", link("10", 0));
        inputs.set("vae", link("4", 2));
      }));
      latentNode = "11";
      // sketches trace the reference closely
      denoise = kind.isSketch() ? Math.min(referenceDenoise, 0.5) : referenceDenoise;
    } else {
      workflow.set("5", node("EmptyLatentImage", inputs -> {
        inputs.put("width", portrait ? portraitWidth : pageWidth);
        inputs.put("height", portrait ? portraitHeight : pageHeight);
        inputs.put("batch_size", 1);
      }));
      latentNode = "5";
      denoise = 1.0;
    }

    workflow.set("6", node("CLIPTextEncode", inputs -> {
      inputs.put("text", positive);
      inputs.set("clip", link("4", 1));
    }));
    workflow.set("7", node("CLIPTextEncode", inputs -> {
      inputs.put("text", NEGATIVE_PROMPT);
      inputs.set("clip", link("4", 1));
    }));
    workflow.set("3", node("KSampler", inputs -> {
      inputs.put("seed", random.nextLong() & Long.MAX_VALUE);
      inputs.put("steps", samplerSteps);
      inputs.put("cfg", cfgScale);
      inputs.put("sampler_name", "euler");
      inputs.put("scheduler", "normal");
      inputs.put("denoise", denoise);
      inputs.set("model", link("4", 0));
      inputs.set("positive", link("6", 0));
      inputs.set("negative", link("7", 0));
      inputs.set("latent_image", link(latentNode, 0));
    }));
    workflow.set("8", node("VAEDecode", inputs -> {
      inputs.set("samples", link("3", 0));
      inputs.set("vae", link("4", 2));
    }));
    workflow.set("9", node("SaveImage", inputs -> {
      inputs.put("filename_prefix", kind.assetSegment());
      inputs.set("images", link("8", 0));
    }));
    return workflow;
  }

  private ObjectNode node(String classType, Consumer<ObjectNode> inputsWriter) {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("class_type", classType);
    ObjectNode inputs = objectMapper.createObjectNode();
    inputsWriter.accept(inputs);
    node.set("inputs", inputs);
    return node;
  }

  private ArrayNode link(String nodeId, int output) {
    ArrayNode link = objectMapper.createArrayNode();
    link.add(nodeId).add(output);
    return link;
  }
}
