package com.sds.phucth.sessioncontext.repository;

import com.sds.phucth.sessioncontext.models.ContextAppendRow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface ContextAppendRepository extends JpaRepository<ContextAppendRow, Long> {

    List<ContextAppendRow> findBySessionIdOrderByIdAsc(String sessionId);

    @Modifying(flushAutomatically = true)
    @Query("delete from ContextAppendRow a where a.sessionId = :sid")
    int deleteBySessionId(@Param("sid") String sessionId);
}
