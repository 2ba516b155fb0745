package io.hermes.server.security;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.hermes.server.config.A2AConfig;
import io.hermes.spec.Event;
import io.hermes.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signs broadcast events and verifies received ones.
 * <p>
 * The signature is an HMAC-SHA256 over the canonical JSON form of the unsigned envelope: object
 * members sorted by name at every level.
 */
@ApplicationScoped
public class MessageSigner {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageSigner.class);

    private static final ObjectMapper CANONICAL_MAPPER = Utils.OBJECT_MAPPER.copy()
            .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private final HmacSha256 hmac;

    @Inject
    public MessageSigner(A2AConfig config) {
        this(config.secret());
    }

    public MessageSigner(String secret) {
        this.hmac = HmacSha256.fromSecret(secret);
    }

    public Event sign(Event event) {
        return event.withSignature(hmac.sign(canonicalBytes(event)));
    }

    /**
     * Checks the signature of an event.
     *
     * @return {@code false} if the event is unsigned or the signature does not match
     */
    public boolean verify(Event event) {
        String signature = event.signature();
        if (signature == null) {
            LOGGER.debug("Event {} is not signed", event.id());
            return false;
        }
        return hmac.verify(canonicalBytes(event), signature);
    }

    private static byte[] canonicalBytes(Event event) {
        try {
            return CANONICAL_MAPPER.writeValueAsBytes(event.unsigned());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialise event " + event.id(), e);
        }
    }
}
