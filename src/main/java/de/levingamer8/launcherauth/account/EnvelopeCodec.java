package de.levingamer8.launcherauth.account;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.levingamer8.launcherauth.crypto.CryptoException;
import de.levingamer8.launcherauth.crypto.Envelope;

import java.util.HexFormat;

/**
 * At-rest form of an {@link Envelope}: {@code {"iv": hex, "encrypted": hex, "authTag": hex}}.
 */
public final class EnvelopeCodec {

    private static final HexFormat HEX = HexFormat.of();

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonPropertyOrder({"iv", "encrypted", "authTag"})
    record StoredEnvelope(String iv, String encrypted, String authTag) {}

    private final ObjectMapper om;

    public EnvelopeCodec(ObjectMapper om) {
        this.om = om;
    }

    public String toJson(Envelope envelope) throws CryptoException {
        try {
            return om.writeValueAsString(new StoredEnvelope(
                    HEX.formatHex(envelope.iv()),
                    HEX.formatHex(envelope.ciphertext()),
                    HEX.formatHex(envelope.authTag())));
        } catch (JsonProcessingException e) {
            throw new CryptoException("Failed to serialize envelope: " + e.getOriginalMessage(), e);
        }
    }

    public Envelope fromJson(String json) throws CryptoException {
        StoredEnvelope s;
        try {
            s = om.readValue(json, StoredEnvelope.class);
        } catch (JsonProcessingException e) {
            throw new CryptoException("Malformed envelope: " + e.getOriginalMessage(), e);
        }
        if (s == null || s.iv() == null || s.encrypted() == null || s.authTag() == null) {
            throw new CryptoException("Malformed envelope: iv, encrypted and authTag are required");
        }
        try {
            return new Envelope(HEX.parseHex(s.iv()), HEX.parseHex(s.encrypted()), HEX.parseHex(s.authTag()));
        } catch (IllegalArgumentException e) {
            throw new CryptoException("Malformed envelope: " + e.getMessage(), e);
        }
    }
}
