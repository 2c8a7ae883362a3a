package com.scholary.videoengine.webhook;

import com.scholary.videoengine.pipeline.Provider;
import com.scholary.videoengine.stage.ProviderProperties;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.function.UnaryOperator;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks the HMAC-SHA256 signature a provider puts on its callbacks.
 *
 * <p>The signature header holds the hex digest of the raw request body, optionally prefixed with
 * {@code sha256=}. Providers with verification switched off always pass.
 */
@Component
public class WebhookSignatureVerifier {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookSignatureVerifier.class);
  private static final String ALGORITHM = "HmacSHA256";
  private static final String PREFIX = "sha256=";

  private final ProviderProperties providerProperties;

  public WebhookSignatureVerifier(ProviderProperties providerProperties) {
    this.providerProperties = providerProperties;
  }

  /**
   * @param headers looks up a request header by name, returning null when absent
   * @return true if the callback may be processed
   */
  public boolean verify(Provider provider, UnaryOperator<String> headers, String rawBody) {
    ProviderProperties.Webhook webhook = providerProperties.webhookFor(provider);
    if (!webhook.verifySignature()) {
      return true;
    }
    if (webhook.signatureSecret() == null || webhook.signatureHeader() == null) {
      LOGGER.error("Signature verification enabled for {} without secret or header", provider);
      return false;
    }

    String received = headers.apply(webhook.signatureHeader());
    if (received == null || received.isBlank()) {
      LOGGER.warn("Missing {} header on {} callback", webhook.signatureHeader(), provider);
      return false;
    }
    if (received.startsWith(PREFIX)) {
      received = received.substring(PREFIX.length());
    }

    String expected = sign(webhook.signatureSecret(), rawBody);
    boolean matches =
        MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.US_ASCII),
            received.trim().toLowerCase().getBytes(StandardCharsets.US_ASCII));
    if (!matches) {
      LOGGER.warn("Signature mismatch on {} callback", provider);
    }
    return matches;
  }

  /** Hex HMAC-SHA256 of {@code body} under {@code secret}. */
  public static String sign(String secret, String body) {
    try {
      Mac mac = Mac.getInstance(ALGORITHM);
      mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
      return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("Cannot compute " + ALGORITHM, e);
    }
  }
}
