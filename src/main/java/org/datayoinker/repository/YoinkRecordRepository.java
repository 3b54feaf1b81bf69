package org.datayoinker.repository;

import org.datayoinker.models.entity.YoinkRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface YoinkRecordRepository extends JpaRepository<YoinkRecord, Long> {

    List<YoinkRecord> findByTopic(String topic, Sort sort);

    List<YoinkRecord> findByTopic(String topic, Pageable pageable);
}
