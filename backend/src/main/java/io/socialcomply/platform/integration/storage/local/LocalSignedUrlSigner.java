package io.socialcomply.platform.integration.storage.local;

import io.socialcomply.platform.integration.storage.SignedUrlMethod;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Issues and verifies HMAC-SHA256 tokens for {@link LocalObjectController}. The signed payload is
 * {@code method \n key \n expires \n contentType}, so a URL cannot be replayed for another object,
 * verb or content type.
 */
public class LocalSignedUrlSigner {

  public static final String ENDPOINT_PATH = "/storage/local/objects";

  private static final String HMAC_ALGORITHM = "HmacSHA256";

  private final byte[] secret;
  private final String publicUrl;

  public LocalSignedUrlSigner(byte[] secret, String publicUrl) {
    this.secret = secret.clone();
    this.publicUrl = publicUrl;
  }

  /** Absolute URL authorizing {@code method} on {@code key} until {@code expiresAt}. */
  public String signedUrl(
      String key, SignedUrlMethod method, Instant expiresAt, String contentType) {
    long expires = expiresAt.getEpochSecond();
    var variables = new HashMap<String, Object>();
    variables.put("key", key);
    variables.put("method", method.name());
    variables.put("expires", expires);
    variables.put("signature", signature(key, method, expires, contentType));

    var builder =
        UriComponentsBuilder.fromUriString(publicUrl)
            .path(ENDPOINT_PATH)
            .queryParam("key", "{key}")
            .queryParam("method", "{method}")
            .queryParam("expires", "{expires}");
    if (contentType != null) {
      builder.queryParam("contentType", "{contentType}");
      variables.put("contentType", contentType);
    }
    builder.queryParam("signature", "{signature}");
    return builder.encode().buildAndExpand(variables).toUriString();
  }

  /** Constant-time check of the signature plus expiry against {@code now}. */
  public boolean verify(
      String key,
      SignedUrlMethod method,
      long expires,
      String contentType,
      String signature,
      Instant now) {
    if (signature == null || now.getEpochSecond() > expires) {
      return false;
    }
    byte[] provided;
    try {
      provided = Base64.getUrlDecoder().decode(signature);
    } catch (IllegalArgumentException e) {
      return false;
    }
    return MessageDigest.isEqual(computeHmac(key, method, expires, contentType), provided);
  }

  String signature(String key, SignedUrlMethod method, long expires, String contentType) {
    return Base64.getUrlEncoder()
        .withoutPadding()
        .encodeToString(computeHmac(key, method, expires, contentType));
  }

  private byte[] computeHmac(
      String key, SignedUrlMethod method, long expires, String contentType) {
    String payload =
        String.join(
            "\n",
            method.name(),
            key,
            String.valueOf(expires),
            contentType != null ? contentType : "");
    try {
      Mac mac = Mac.getInstance(HMAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
      return mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Failed to compute HMAC: " + e.getMessage(), e);
    }
  }
}
