package com.sds.phucth.sessioncontext.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.FieldDefaults;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ContextRecord {
    String sessionId;
    String intent;
    Map<String, Object> data;       // replaced wholesale by every write
    @Builder.Default
    List<AppendEntry> appends = new ArrayList<>();
    OffsetDateTime createdAt;
    OffsetDateTime lastUpdated;
    OffsetDateTime expiresAt;       // hot cache eviction only
    long revision;
}
