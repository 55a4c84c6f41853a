package com.sds.phucth.sessioncontext.models;

import com.sds.phucth.sessioncontext.utils.JsonMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * One entry of a session's append log. Rows are only ever inserted; the identity key
 * gives insertion order.
 */
@Entity
@Table(name = "context_appends", indexes = @Index(name = "idx_context_appends_session", columnList = "session_id, id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContextAppendRow {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "entry_id", length = 36, nullable = false, unique = true)
    private String entryId;

    @Column(name = "session_id", length = 128, nullable = false)
    private String sessionId;

    @Column(name = "source", length = 64, nullable = false)
    private String source;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "output", length = 1_048_576)
    private Map<String, Object> output;

    @Column(name = "appended_at", nullable = false)
    private OffsetDateTime appendedAt;
}
