package com.sds.phucth.sessioncontext.repository;

import com.sds.phucth.sessioncontext.models.ContextDocument;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Optional;

public interface ContextDocumentRepository extends JpaRepository<ContextDocument, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from ContextDocument d where d.sessionId = :sid")
    Optional<ContextDocument> findForUpdate(@Param("sid") String sessionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
    update ContextDocument d
    set d.lastUpdated = :now, d.expiresAt = :expiresAt, d.revision = d.revision + 1
    where d.sessionId = :sid
    """)
    int touch(@Param("sid") String sessionId, @Param("now") OffsetDateTime now, @Param("expiresAt") OffsetDateTime expiresAt);

    @Query("select d.revision from ContextDocument d where d.sessionId = :sid")
    Optional<Long> findRevision(@Param("sid") String sessionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ContextDocument d where d.sessionId = :sid")
    int deleteBySessionId(@Param("sid") String sessionId);

    Page<ContextDocument> findAllByOrderByLastUpdatedDesc(Pageable pageable);
}
