package com.flagship.number_gateway.settlement;

import com.flagship.number_gateway.deposit.PaymentsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Authenticates inbound payment notifications.
 *
 * The primary scheme is a hex HMAC-SHA512 of the raw body keyed with the shared secret. The
 * processor's static {@code verif-hash} header, which carries the secret itself, is accepted as well.
 * All comparisons are constant time.
 */
@Slf4j
@Component
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA512";

    private final byte[] secret;
    private final boolean allowUnsigned;

    public WebhookSignatureVerifier(PaymentsProperties properties) {
        String configured = properties.getWebhookSecret();
        this.secret = configured != null ? configured.getBytes(StandardCharsets.UTF_8) : new byte[0];
        this.allowUnsigned = properties.isAllowUnsigned();
        if (allowUnsigned) {
            log.warn("Unsigned payment webhooks are ACCEPTED. Never enable this outside local development.");
        }
    }

    public boolean verify(byte[] rawBody, String signature, String verifHash) {
        boolean hasSignature = signature != null && !signature.isBlank();
        boolean hasVerifHash = verifHash != null && !verifHash.isBlank();
        if (!hasSignature && !hasVerifHash) {
            return allowUnsigned;
        }
        if (secret.length == 0) {
            log.warn("Webhook secret is not configured; rejecting signed webhook");
            return false;
        }
        if (hasSignature) {
            byte[] expected = sign(rawBody).getBytes(StandardCharsets.US_ASCII);
            byte[] provided = signature.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII);
            return MessageDigest.isEqual(expected, provided);
        }
        return MessageDigest.isEqual(secret, verifHash.trim().getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @return lowercase hex HMAC-SHA512 of {@code body}
     */
    public String sign(byte[] body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(body));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA512 unavailable", e);
        }
    }
}
