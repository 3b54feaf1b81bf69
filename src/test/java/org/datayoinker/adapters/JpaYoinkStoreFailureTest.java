package org.datayoinker.adapters;

import org.datayoinker.models.YoinkException;
import org.datayoinker.models.entity.YoinkRecord;
import org.datayoinker.models.enums.ErrorKind;
import org.datayoinker.repository.YoinkRecordRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.transaction.CannotCreateTransactionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaYoinkStoreFailureTest {

    @Mock
    private YoinkRecordRepository yoinkRecordRepository;

    @InjectMocks
    private JpaYoinkStore yoinkStore;

    @Test
    void constraintViolationOnAppendIsStorageFailure() {
        DataIntegrityViolationException cause = new DataIntegrityViolationException("NULL not allowed for column TOPIC");
        when(yoinkRecordRepository.saveAndFlush(any(YoinkRecord.class))).thenThrow(cause);

        YoinkException ex = assertThrows(YoinkException.class, () -> yoinkStore.append("t", "{}"));

        assertEquals(ErrorKind.STORAGE_FAILURE, ex.getKind());
        assertEquals("NULL not allowed for column TOPIC", ex.getMessage());
        assertSame(cause, ex.getCause());
    }

    @Test
    void unreachableDatabaseOnQueryIsStorageFailure() {
        when(yoinkRecordRepository.findByTopic(eq("t"), any(Sort.class)))
                .thenThrow(new DataAccessResourceFailureException("database file is locked"));
        when(yoinkRecordRepository.findByTopic(eq("t"), any(Pageable.class)))
                .thenThrow(new CannotCreateTransactionException("connection refused"));

        YoinkException all = assertThrows(YoinkException.class, () -> yoinkStore.query("t", null));
        YoinkException bounded = assertThrows(YoinkException.class, () -> yoinkStore.query("t", 2));

        assertEquals(ErrorKind.STORAGE_FAILURE, all.getKind());
        assertEquals("database file is locked", all.getMessage());
        assertEquals(ErrorKind.STORAGE_FAILURE, bounded.getKind());
    }
}
