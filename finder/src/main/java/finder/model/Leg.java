package finder.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * A single origin -> destination flight segment to be checked for availability.
 * Two legs with the same airports always have the same {@link #hash()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Leg(String origin, String destination) {
    public Leg {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(destination, "destination");
    }

    @JsonProperty
    public String hash() {
        return hashOf(origin, destination);
    }

    public boolean connectsTo(Leg next) {
        return destination.equals(next.origin());
    }

    public static String hashOf(String origin, String destination) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest((origin + "-" + destination).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            // every JDK ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    @Override
    public String toString() {
        return origin + "->" + destination;
    }
}
