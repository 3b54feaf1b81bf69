package org.datayoinker.models.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One row of the append-only yoink log. Content is kept as the JSON text that was validated on publish.
 */
@Setter
@Getter
@Entity
@Table(name = "yoinks")
public class YoinkRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "topic", nullable = false, updatable = false)
    private String topic;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "content", nullable = false, updatable = false)
    private String content;
}
