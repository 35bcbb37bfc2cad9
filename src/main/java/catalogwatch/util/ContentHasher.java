package catalogwatch.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Digest over the change-relevant fields of a book.
 * <p>
 * The fields are serialised as a JSON object with a fixed key order and hashed with SHA-256,
 * so equal inputs always produce the same lowercase hex string.
 */
public final class ContentHasher {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ContentHasher() {
    }

    public static String contentHash(String title,
                                     BigDecimal priceExclTax,
                                     BigDecimal priceInclTax,
                                     String availability,
                                     Integer numReviews,
                                     Integer rating) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("availability", availability);
        content.put("num_reviews", numReviews);
        content.put("price_excl_tax", plain(priceExclTax));
        content.put("price_incl_tax", plain(priceInclTax));
        content.put("rating", rating);
        content.put("title", title);
        try {
            return sha256(MAPPER.writeValueAsString(content));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise content for hashing", e);
        }
    }

    private static String plain(BigDecimal value) {
        return value == null ? null : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return bytesToHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder();
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }
}
