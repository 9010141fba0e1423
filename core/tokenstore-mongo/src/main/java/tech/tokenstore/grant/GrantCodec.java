package tech.tokenstore.grant;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Encodes grants to the byte payload kept in the basic collection and decodes
 * them back on read. The payload is UTF-8 JSON.
 */
public class GrantCodec {

    private final ObjectMapper mapper;

    public GrantCodec() {
        this(new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public GrantCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(TokenGrant grant) {
        try {
            return mapper.writeValueAsBytes(grant);
        } catch (IOException e) {
            throw new GrantCodecException("Failed to encode token grant", e);
        }
    }

    public TokenGrant decode(byte[] payload) {
        if (payload == null || payload.length == 0) {
            throw new GrantCodecException("Stored grant payload is empty", null);
        }
        try {
            return mapper.readValue(payload, TokenGrant.class);
        } catch (IOException e) {
            throw new GrantCodecException("Failed to decode token grant", e);
        }
    }
}
