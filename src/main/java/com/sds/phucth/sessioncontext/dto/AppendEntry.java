package com.sds.phucth.sessioncontext.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.FieldDefaults;

import java.time.OffsetDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AppendEntry {
    String id;
    String source;          // orchestrator|superagi|n8n|...
    Map<String, Object> output;
    OffsetDateTime appendedAt;
}
