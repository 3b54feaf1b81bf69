package org.datayoinker.service.retrieval;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.datayoinker.adapters.YoinkStore;
import org.datayoinker.models.YoinkException;
import org.datayoinker.models.dto.Yoink;
import org.datayoinker.models.entity.YoinkRecord;
import org.datayoinker.models.enums.ErrorKind;
import org.datayoinker.service.content.ContentCodec;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigInteger;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only, newest-first lookups over a topic's history.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RetrievalService {

    private static final BigInteger MAX_LIMIT = BigInteger.valueOf(Integer.MAX_VALUE);

    private final YoinkStore yoinkStore;
    private final ContentCodec contentCodec;

    /**
     * Latest record of the topic, or {@link Yoink#empty()} when the topic has none.
     */
    public Yoink getLatest(String topic) {
        List<Yoink> latest = fetch(topic, 1);
        return latest.isEmpty() ? Yoink.empty() : latest.get(0);
    }

    /**
     * Up to {@code number} most recent records. The number arrives as raw path text.
     */
    public List<Yoink> getLastN(String topic, String number) {
        requireTopic(topic);
        int limit = parseNumber(number);
        return fetch(topic, limit);
    }

    public List<Yoink> getAll(String topic) {
        return fetch(topic, null);
    }

    // Any positive count is accepted; counts past what a single query can page are capped.
    private static int parseNumber(String number) {
        if (number == null) {
            throw new YoinkException(ErrorKind.INVALID_NUMBER, "number is missing");
        }
        BigInteger parsed;
        try {
            parsed = new BigInteger(number);
        } catch (NumberFormatException e) {
            throw new YoinkException(ErrorKind.INVALID_NUMBER, "invalid number: " + number, e);
        }
        if (parsed.signum() < 1) {
            throw new YoinkException(ErrorKind.NUMBER_OUT_OF_RANGE, "number is less than 1");
        }
        return parsed.min(MAX_LIMIT).intValueExact();
    }

    private List<Yoink> fetch(String topic, Integer limit) {
        requireTopic(topic);
        List<YoinkRecord> records = yoinkStore.query(topic, limit);
        log.debug("Fetched {} yoink(s) for topic {} (limit {})", records.size(), topic, limit);
        // Any undecodable row fails the whole lookup.
        return records.stream()
                .map(contentCodec::toYoink)
                .collect(Collectors.toList());
    }

    private static void requireTopic(String topic) {
        if (!StringUtils.hasLength(topic)) {
            throw new YoinkException(ErrorKind.MISSING_TOPIC, "topic is empty");
        }
    }
}
