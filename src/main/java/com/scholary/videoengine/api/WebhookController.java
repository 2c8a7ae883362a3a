package com.scholary.videoengine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoengine.pipeline.InvariantViolationException;
import com.scholary.videoengine.pipeline.Provider;
import com.scholary.videoengine.webhook.CallbackResolution;
import com.scholary.videoengine.webhook.MalformedWebhookException;
import com.scholary.videoengine.webhook.WebhookCorrelator;
import com.scholary.videoengine.webhook.WebhookEvent;
import com.scholary.videoengine.webhook.WebhookPayloadNormalizer;
import com.scholary.videoengine.webhook.WebhookSignatureVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives provider callbacks.
 *
 * <p>Every well-formed callback gets a 200, whether it was applied, a replay, or stale, so
 * providers do not keep retrying. Unknown providers get 404, bad signatures 401, unreadable bodies
 * 400.
 */
@RestController
@Tag(name = "Webhooks", description = "Provider completion callbacks")
public class WebhookController {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookController.class);

  private final WebhookCorrelator correlator;
  private final WebhookSignatureVerifier signatureVerifier;
  private final ObjectMapper objectMapper;
  private final Map<Provider, WebhookPayloadNormalizer> normalizers = new EnumMap<>(Provider.class);

  public WebhookController(
      WebhookCorrelator correlator,
      WebhookSignatureVerifier signatureVerifier,
      ObjectMapper objectMapper,
      List<WebhookPayloadNormalizer> normalizers) {
    this.correlator = correlator;
    this.signatureVerifier = signatureVerifier;
    this.objectMapper = objectMapper;
    for (WebhookPayloadNormalizer normalizer : normalizers) {
      this.normalizers.put(normalizer.provider(), normalizer);
    }
  }

  @PostMapping("/webhooks/{provider}")
  @Operation(
      summary = "Provider callback",
      description = "Completion or failure of a dispatched stage, identified by its token")
  public ResponseEntity<WebhookAck> receive(
      @PathVariable("provider") String providerName,
      @RequestParam("token") String token,
      @RequestHeader HttpHeaders headers,
      @RequestBody String rawBody) {

    Provider provider = Provider.fromPathName(providerName).orElse(null);
    WebhookPayloadNormalizer normalizer = provider == null ? null : normalizers.get(provider);
    if (normalizer == null) {
      LOGGER.warn("Callback for unknown provider {}", providerName);
      return ResponseEntity.notFound().build();
    }

    if (!signatureVerifier.verify(provider, headers::getFirst, rawBody)) {
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
    }

    WebhookEvent event = normalizer.normalize(token, parse(provider, rawBody));
    try {
      return ResponseEntity.ok(WebhookAck.of(correlator.onCallback(event)));
    } catch (InvariantViolationException e) {
      LOGGER.error("Callback {} from {} broke an invariant: {}", token, provider, e.getMessage());
      return ResponseEntity.ok(WebhookAck.of(CallbackResolution.STALE));
    }
  }

  private JsonNode parse(Provider provider, String rawBody) {
    try {
      JsonNode payload = objectMapper.readTree(rawBody);
      if (payload == null || !payload.isObject()) {
        throw new MalformedWebhookException(provider, "Callback body is not a JSON object");
      }
      return payload;
    } catch (JsonProcessingException e) {
      throw new MalformedWebhookException(provider, "Callback body is not valid JSON", e);
    }
  }
}
