package com.example.FolioAgent.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;

import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "query_logs")
@Getter
@Setter
public class QueryLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String sessionId;

    private String model;

    @Lob
    @Column(columnDefinition = "TEXT")
    private String query;

    @Enumerated(EnumType.STRING)
    private Intent intent;

    @Lob
    @Column(columnDefinition = "TEXT")
    private String answer;

    private long latencyMs;

    private int chunksRetrieved;

    @Enumerated(EnumType.STRING)
    private ValidationState validationState;

    private boolean degraded;

    private Instant createdAt;

    @PrePersist
    public void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
