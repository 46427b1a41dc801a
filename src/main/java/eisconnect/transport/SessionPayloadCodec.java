package eisconnect.transport;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import eisconnect.domain.Ack;
import eisconnect.domain.Sample;
import eisconnect.domain.SessionMeta;
import eisconnect.error.ProcessingException;
import eisconnect.error.SessionException;
import eisconnect.error.StorageException;
import eisconnect.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Converts Socket.IO payloads to session requests and replies back to plain maps.
 * Payloads may arrive as JSON text, raw bytes or an already decoded object tree.
 * NaN and Infinity literals are accepted so that non-finite readings reach
 * the engine's validation instead of failing here.
 */
public class SessionPayloadCodec {
    private static final Logger logger = LoggerFactory.getLogger(SessionPayloadCodec.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public SessionPayloadCodec() {
        this.objectMapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
                .addModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, false)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    /**
     * @throws ValidationException if the payload cannot be read as session metadata
     */
    public SessionMeta readMeta(Object payload) {
        return read(payload, SessionMeta.class, "meta");
    }

    /**
     * @throws ValidationException if the payload cannot be read as a sample
     */
    public Sample readSample(Object payload) {
        return read(payload, Sample.class, "sample");
    }

    public Map<String, Object> ackReply(Ack ack) {
        return objectMapper.convertValue(ack, MAP_TYPE);
    }

    public Map<String, Object> errorReply(SessionException error) {
        String field = null;
        String value = null;
        String details = null;
        if (error instanceof ValidationException validation) {
            field = validation.getField();
            value = validation.getValue();
        } else if (error instanceof ProcessingException processing) {
            details = processing.getDetails();
        } else if (error instanceof StorageException storage) {
            details = storage.getDetails();
        }
        ErrorReply reply = new ErrorReply(false, error.kind().name(), error.getMessage(), field, value, details);
        return objectMapper.convertValue(reply, MAP_TYPE);
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    private <T> T read(Object payload, Class<T> type, String field) {
        if (payload == null) {
            return null;
        }
        try {
            T result;
            if (payload instanceof String text) {
                result = objectMapper.readValue(text, type);
            } else if (payload instanceof byte[] bytes) {
                result = objectMapper.readValue(new String(bytes, StandardCharsets.UTF_8), type);
            } else {
                result = objectMapper.convertValue(payload, type);
            }
            logger.debug("Decoded {} payload", field);
            return result;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            logger.debug("Malformed {} payload: {}", field, e.getMessage());
            throw new ValidationException("Malformed " + field + " payload: " + originalMessage(e),
                    field, String.valueOf(payload));
        }
    }

    private static String originalMessage(Exception e) {
        if (e instanceof JsonProcessingException jsonError) {
            return jsonError.getOriginalMessage();
        }
        return e.getMessage();
    }

    /**
     * Error reply sent through the Socket.IO acknowledgement.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ErrorReply(
            boolean success,
            String kind,
            String message,
            String field,
            String value,
            String details
    ) {}
}
