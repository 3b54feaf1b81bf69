package org.datayoinker.adapters;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.datayoinker.models.YoinkException;
import org.datayoinker.models.entity.YoinkRecord;
import org.datayoinker.models.enums.ErrorKind;
import org.datayoinker.repository.YoinkRecordRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaYoinkStore implements YoinkStore {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt")
            .and(Sort.by(Sort.Direction.DESC, "id"));

    private final YoinkRecordRepository yoinkRecordRepository;

    @Override
    public YoinkRecord append(String topic, String content) {
        YoinkRecord record = new YoinkRecord();
        record.setTopic(topic);
        record.setContent(content);
        // Second resolution, the id orders rows written within the same second.
        record.setCreatedAt(Instant.now().truncatedTo(ChronoUnit.SECONDS));
        try {
            YoinkRecord saved = yoinkRecordRepository.saveAndFlush(record);
            log.debug("Appended yoink {} to topic {}", saved.getId(), topic);
            return saved;
        } catch (DataAccessException | TransactionException ex) {
            throw new YoinkException(ErrorKind.STORAGE_FAILURE, ex.getMessage(), ex);
        }
    }

    @Override
    public List<YoinkRecord> query(String topic, Integer limit) {
        try {
            if (limit == null) {
                return yoinkRecordRepository.findByTopic(topic, NEWEST_FIRST);
            }
            return yoinkRecordRepository.findByTopic(topic, PageRequest.of(0, limit, NEWEST_FIRST));
        } catch (DataAccessException | TransactionException ex) {
            throw new YoinkException(ErrorKind.STORAGE_FAILURE, ex.getMessage(), ex);
        }
    }
}
