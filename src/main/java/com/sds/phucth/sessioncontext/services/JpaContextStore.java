package com.sds.phucth.sessioncontext.services;

import com.sds.phucth.sessioncontext.dto.AppendEntry;
import com.sds.phucth.sessioncontext.dto.ContextRecord;
import com.sds.phucth.sessioncontext.dto.ContextSummary;
import com.sds.phucth.sessioncontext.models.ContextAppendRow;
import com.sds.phucth.sessioncontext.models.ContextDocument;
import com.sds.phucth.sessioncontext.repository.ContextAppendRepository;
import com.sds.phucth.sessioncontext.repository.ContextDocumentRepository;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Durable tier. One {@code context_records} row per session plus insert-only rows in
 * {@code context_appends}, so concurrent appends never overwrite each other.
 */
@Repository("durableContextStore")
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class JpaContextStore implements ContextStore {
    ContextDocumentRepository documents;
    ContextAppendRepository appends;

    @Override
    @Transactional(readOnly = true, timeoutString = "${app.context.storeTimeoutSeconds:3}")
    public Optional<ContextRecord> find(String sessionId) {
        return documents.findById(sessionId)
                .map(doc -> toRecord(doc, appends.findBySessionIdOrderByIdAsc(sessionId)));
    }

    @Override
    @Transactional(timeoutString = "${app.context.storeTimeoutSeconds:3}")
    public ContextRecord save(ContextRecord draft) {
        String sessionId = draft.getSessionId();
        // row lock keeps revisions strictly increasing under concurrent writers
        ContextDocument doc = documents.findForUpdate(sessionId)
                .orElseGet(() -> ContextDocument.builder()
                        .sessionId(sessionId)
                        .createdAt(draft.getLastUpdated())
                        .revision(0L)
                        .build());

        doc.setIntent(draft.getIntent());
        doc.setData(new LinkedHashMap<>(draft.getData()));
        doc.setLastUpdated(draft.getLastUpdated());
        doc.setExpiresAt(draft.getExpiresAt());
        doc.setRevision(doc.getRevision() + 1);

        ContextDocument saved = documents.save(doc);
        log.debug("Durable record saved for session {} at revision {}", sessionId, saved.getRevision());
        return toRecord(saved, appends.findBySessionIdOrderByIdAsc(sessionId));
    }

    @Override
    @Transactional(timeoutString = "${app.context.storeTimeoutSeconds:3}")
    public Optional<Long> append(String sessionId, AppendEntry entry, OffsetDateTime expiresAt) {
        int touched = documents.touch(sessionId, entry.getAppendedAt(), expiresAt);
        if (touched == 0) {
            return Optional.empty();
        }

        appends.save(ContextAppendRow.builder()
                .entryId(entry.getId())
                .sessionId(sessionId)
                .source(entry.getSource())
                .output(new LinkedHashMap<>(entry.getOutput()))
                .appendedAt(entry.getAppendedAt())
                .build());

        return documents.findRevision(sessionId);
    }

    @Override
    @Transactional(timeoutString = "${app.context.storeTimeoutSeconds:3}")
    public boolean delete(String sessionId) {
        int removedAppends = appends.deleteBySessionId(sessionId);
        int removed = documents.deleteBySessionId(sessionId);
        log.debug("Durable delete for session {}: {} record(s), {} append(s)", sessionId, removed, removedAppends);
        return removed > 0;
    }

    @Override
    @Transactional(readOnly = true, timeoutString = "${app.context.storeTimeoutSeconds:3}")
    public Optional<Long> revision(String sessionId) {
        return documents.findRevision(sessionId);
    }

    @Override
    @Transactional(readOnly = true, timeoutString = "${app.context.storeTimeoutSeconds:3}")
    public List<ContextSummary> list(int page, int size) {
        return documents.findAllByOrderByLastUpdatedDesc(PageRequest.of(page, size))
                .map(doc -> ContextSummary.builder()
                        .sessionId(doc.getSessionId())
                        .intent(doc.getIntent())
                        .createdAt(doc.getCreatedAt())
                        .lastUpdated(doc.getLastUpdated())
                        .expiresAt(doc.getExpiresAt())
                        .revision(doc.getRevision())
                        .build())
                .getContent();
    }

    @Override
    @Transactional(readOnly = true, timeoutString = "${app.context.storeTimeoutSeconds:3}")
    public boolean ping() {
        documents.existsById("");
        return true;
    }

    private ContextRecord toRecord(ContextDocument doc, List<ContextAppendRow> rows) {
        List<AppendEntry> entries = rows.stream()
                .map(row -> AppendEntry.builder()
                        .id(row.getEntryId())
                        .source(row.getSource())
                        .output(row.getOutput())
                        .appendedAt(row.getAppendedAt())
                        .build())
                .toList();

        return ContextRecord.builder()
                .sessionId(doc.getSessionId())
                .intent(doc.getIntent())
                .data(doc.getData() == null ? new LinkedHashMap<>() : doc.getData())
                .appends(new ArrayList<>(entries))
                .createdAt(doc.getCreatedAt())
                .lastUpdated(doc.getLastUpdated())
                .expiresAt(doc.getExpiresAt())
                .revision(doc.getRevision())
                .build();
    }
}
