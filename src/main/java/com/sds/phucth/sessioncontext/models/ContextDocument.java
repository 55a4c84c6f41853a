package com.sds.phucth.sessioncontext.models;

import com.sds.phucth.sessioncontext.utils.JsonMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.Map;

@Entity
@Table(name = "context_records", indexes = @Index(name = "idx_context_records_last_updated", columnList = "last_updated"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextDocument {
    @Id
    @Column(name = "session_id", length = 128)
    private String sessionId;

    @Column(name = "intent", nullable = false)
    private String intent;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "data", length = 1_048_576)
    private Map<String, Object> data;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "last_updated", nullable = false)
    private OffsetDateTime lastUpdated;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    // bumped by every write and append
    @Column(name = "revision", nullable = false)
    private long revision;
}
