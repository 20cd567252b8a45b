package com.framegate.infrastructure.generator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.framegate.domain.frame.exception.GenerationException;
import com.framegate.domain.frame.exception.GenerationFailure;
import com.framegate.domain.frame.model.CandidateResult;
import com.framegate.domain.frame.model.GenerationRequest;
import com.framegate.domain.frame.model.ReferenceImage;
import com.framegate.domain.frame.service.GeneratorAdapter;
import com.framegate.infrastructure.imaging.ImageCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generates candidate frames with the Gemini {@code generateContent} image API.
 * <p>
 * Reference images are sent as labelled inline parts, anchor first. HTTP failures are
 * classified for the orchestrator: 429 is rate limited, 5xx and I/O errors are transient,
 * everything else fails fast.
 * </p>
 */
@Slf4j
@Component
public class GeminiGeneratorAdapter implements GeneratorAdapter {

    private static final String GENERATE_PATH = "/models/%s:generateContent";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final ImageCodec imageCodec;
    private final String apiKey;
    private final String model;
    private final String baseUrl;

    public GeminiGeneratorAdapter(RestTemplate restTemplate,
                                  ObjectMapper objectMapper,
                                  ImageCodec imageCodec,
                                  @Value("${framegate.generator.gemini.api-key:}") String apiKey,
                                  @Value("${framegate.generator.gemini.model:gemini-2.5-flash-image}") String model,
                                  @Value("${framegate.generator.gemini.base-url:https://generativelanguage.googleapis.com/v1beta}") String baseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.imageCodec = imageCodec;
        this.apiKey = apiKey;
        this.model = model;
        this.baseUrl = baseUrl;
    }

    @Override
    public String name() {
        return "gemini:" + model;
    }

    @Override
    public CandidateResult generate(GenerationRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new GenerationException(GenerationFailure.FAIL_FAST,
                    "Gemini API key is not configured (framegate.generator.gemini.api-key)");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-goog-api-key", apiKey);

        String url = baseUrl + String.format(GENERATE_PATH, model);
        long start = System.currentTimeMillis();
        try {
            String body = objectMapper.writeValueAsString(buildRequestBody(request));
            ResponseEntity<String> response = restTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);

            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new GenerationException(GenerationFailure.FAIL_FAST,
                        "Unexpected Gemini response status " + response.getStatusCode());
            }
            byte[] image = extractImage(response.getBody());
            log.info("[Gemini] Frame {} attempt {} generated in {}ms ({} bytes)",
                    request.frameIndex(), request.attemptIndex(), System.currentTimeMillis() - start, image.length);
            return new CandidateResult(image, request.seed(), request.prompt());

        } catch (HttpClientErrorException e) {
            if (e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                Duration retryAfter = parseRetryAfter(e.getResponseHeaders());
                log.warn("[Gemini] Rate limited on frame {} (retry after {})", request.frameIndex(), retryAfter);
                throw new GenerationException(GenerationFailure.RATE_LIMITED,
                        "Gemini rate limit exceeded", retryAfter, e);
            }
            log.error("[Gemini] Client error {} on frame {}: {}",
                    e.getStatusCode(), request.frameIndex(), e.getResponseBodyAsString());
            throw new GenerationException(GenerationFailure.FAIL_FAST,
                    "Gemini request rejected: " + e.getStatusCode(), e);
        } catch (HttpServerErrorException e) {
            log.warn("[Gemini] Server error {} on frame {}", e.getStatusCode(), request.frameIndex());
            throw new GenerationException(GenerationFailure.TRANSIENT,
                    "Gemini server error: " + e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            log.warn("[Gemini] Network error on frame {}: {}", request.frameIndex(), e.getMessage());
            throw new GenerationException(GenerationFailure.TRANSIENT, "Gemini network error", e);
        } catch (JsonProcessingException e) {
            throw new GenerationException(GenerationFailure.FAIL_FAST, "Gemini payload could not be processed", e);
        }
    }

    // ===== Request =====

    Map<String, Object> buildRequestBody(GenerationRequest request) {
        List<Map<String, Object>> parts = new ArrayList<>();
        for (ReferenceImage reference : request.references()) {
            parts.add(Map.of("text", reference.role().getLabel()));
            Map<String, Object> inlineData = new HashMap<>();
            inlineData.put("mimeType", "image/png");
            inlineData.put("data", Base64.getEncoder().encodeToString(imageCodec.encodePng(reference.image())));
            parts.add(Map.of("inlineData", inlineData));
        }

        StringBuilder prompt = new StringBuilder(request.prompt());
        if (request.negativePrompt() != null && !request.negativePrompt().isBlank()) {
            prompt.append("\n\n").append(request.negativePrompt());
        }
        prompt.append("\n\nOutput a ").append(request.generationSize()).append('x')
                .append(request.generationSize()).append(" image.");
        parts.add(Map.of("text", prompt.toString()));

        Map<String, Object> generationConfig = new HashMap<>();
        generationConfig.put("responseModalities", List.of("TEXT", "IMAGE"));
        generationConfig.put("seed", request.seed());

        Map<String, Object> body = new HashMap<>();
        body.put("contents", List.of(Map.of("parts", parts)));
        body.put("generationConfig", generationConfig);
        return body;
    }

    // ===== Response =====

    byte[] extractImage(String responseBody) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(responseBody);
        if (root.has("error")) {
            throw new GenerationException(GenerationFailure.FAIL_FAST,
                    "Gemini API error: " + root.path("error").path("message").asText("unknown"));
        }
        JsonNode candidate = root.path("candidates").path(0);
        String finishReason = candidate.path("finishReason").asText("");
        if ("SAFETY".equals(finishReason) || "IMAGE_SAFETY".equals(finishReason) || "BLOCKED".equals(finishReason)) {
            throw new GenerationException(GenerationFailure.FAIL_FAST, "Gemini blocked the request: " + finishReason);
        }
        for (JsonNode part : candidate.path("content").path("parts")) {
            JsonNode data = part.path("inlineData").path("data");
            if (data.isTextual()) {
                try {
                    return Base64.getDecoder().decode(data.asText());
                } catch (IllegalArgumentException e) {
                    throw new GenerationException(GenerationFailure.FAIL_FAST, "Gemini image data is not valid base64", e);
                }
            }
        }
        throw new GenerationException(GenerationFailure.FAIL_FAST, "Gemini response contained no image");
    }

    private static Duration parseRetryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null) {
            return null;
        }
        try {
            return Duration.ofSeconds(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.debug("[Gemini] Ignoring non-numeric Retry-After '{}'", value);
            return null;
        }
    }
}
