package org.datayoinker.service.content;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.datayoinker.models.YoinkException;
import org.datayoinker.models.dto.Yoink;
import org.datayoinker.models.entity.YoinkRecord;
import org.datayoinker.models.enums.ErrorKind;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts typed content to the stored JSON document and back.
 */
@Component
public class ContentCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> CONTENT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ObjectWriter documentWriter;

    public ContentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.documentWriter = objectMapper.writer().with(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    /**
     * Applies {@link ValueInference} to every value, keeping parameter order.
     */
    public Map<String, Object> inferContent(Map<String, String> params) {
        Map<String, Object> content = new LinkedHashMap<>();
        params.forEach((key, value) -> content.put(key, ValueInference.infer(value)));
        return content;
    }

    /**
     * Serializes typed content and checks the result parses back as a JSON object.
     *
     * @throws YoinkException with {@link ErrorKind#MALFORMED_CONTENT} when no valid document comes out
     */
    public String encode(Map<String, Object> content) {
        ObjectNode document = objectMapper.createObjectNode();
        content.forEach((key, value) -> putValue(document, key, value));

        String json;
        try {
            json = documentWriter.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new YoinkException(ErrorKind.MALFORMED_CONTENT, e.getOriginalMessage(), e);
        }
        validate(json);
        return json;
    }

    /**
     * Reads a stored document back into typed values: floats as {@link Double}, integers as
     * {@link Integer}/{@link Long}/{@link BigInteger} depending on magnitude, strings verbatim.
     *
     * @throws YoinkException with {@link ErrorKind#CONTENT_DECODE_FAILURE} when the document is not a JSON object
     */
    public Map<String, Object> decode(String document) {
        Map<String, Object> content;
        try {
            content = objectMapper.readValue(document, CONTENT_TYPE);
        } catch (JsonProcessingException e) {
            throw new YoinkException(ErrorKind.CONTENT_DECODE_FAILURE, e.getOriginalMessage(), e);
        }
        if (content == null) {
            throw new YoinkException(ErrorKind.CONTENT_DECODE_FAILURE, "Stored content is not a JSON object");
        }
        return content;
    }

    public Yoink toYoink(YoinkRecord record) {
        return new Yoink(record.getId(), record.getTopic(), record.getCreatedAt(), decode(record.getContent()));
    }

    private void validate(String json) {
        try {
            JsonNode parsed = objectMapper.readTree(json);
            if (parsed == null || !parsed.isObject()) {
                throw new YoinkException(ErrorKind.MALFORMED_CONTENT, "Content is not a JSON object");
            }
        } catch (JsonProcessingException e) {
            throw new YoinkException(ErrorKind.MALFORMED_CONTENT, e.getOriginalMessage(), e);
        }
    }

    private static void putValue(ObjectNode document, String key, Object value) {
        if (value == null) {
            document.putNull(key);
        } else if (value instanceof Double floating) {
            // DecimalNode directly, the node factory would strip the trailing zero again
            document.set(key, DecimalNode.valueOf(ValueInference.toPlainDecimal(floating)));
        } else if (value instanceof Long integer) {
            document.put(key, integer);
        } else if (value instanceof Integer integer) {
            document.put(key, integer);
        } else if (value instanceof BigInteger integer) {
            document.put(key, integer);
        } else if (value instanceof BigDecimal decimal) {
            document.put(key, decimal);
        } else {
            document.put(key, value.toString());
        }
    }
}
