package org.datayoinker.service.ingestion;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.datayoinker.adapters.YoinkStore;
import org.datayoinker.models.YoinkException;
import org.datayoinker.models.dto.Yoink;
import org.datayoinker.models.entity.YoinkRecord;
import org.datayoinker.models.enums.ErrorKind;
import org.datayoinker.service.content.ContentCodec;
import org.springframework.stereotype.Service;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns request parameters into a typed JSON document and appends it to a topic.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IngestionService {

    private final YoinkStore yoinkStore;
    private final ContentCodec contentCodec;

    /**
     * Publishes one reading. Either exactly one record is appended and returned as stored, or nothing is.
     *
     * @param topic     topic taken from the request path
     * @param rawParams every value supplied for every parameter name
     * @return the persisted record, read back from storage
     */
    public Yoink publish(String topic, MultiValueMap<String, String> rawParams) {
        if (!StringUtils.hasLength(topic)) {
            throw new YoinkException(ErrorKind.MISSING_TOPIC, "topic is empty");
        }

        Map<String, String> params = singleValued(rawParams);
        Map<String, Object> content = contentCodec.inferContent(params);
        String document = contentCodec.encode(content);

        YoinkRecord stored = yoinkStore.append(topic, document);
        log.debug("Published yoink {} for topic {} with {} field(s)", stored.getId(), topic, content.size());
        return contentCodec.toYoink(stored);
    }

    private static Map<String, String> singleValued(MultiValueMap<String, String> rawParams) {
        Map<String, String> params = new LinkedHashMap<>();
        if (rawParams == null) {
            return params;
        }
        for (Map.Entry<String, List<String>> entry : rawParams.entrySet()) {
            List<String> values = entry.getValue();
            if (values == null || values.size() != 1) {
                throw new YoinkException(ErrorKind.MULTI_VALUED_PARAMETER,
                        "Parameter with more than 1 value found: " + entry.getKey());
            }
            params.put(entry.getKey(), values.get(0));
        }
        return params;
    }
}
