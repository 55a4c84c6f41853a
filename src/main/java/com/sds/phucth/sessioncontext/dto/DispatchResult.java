package com.sds.phucth.sessioncontext.dto;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Data;
import lombok.experimental.FieldDefaults;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@FieldDefaults(level = AccessLevel.PRIVATE)
public class DispatchResult {
    boolean success;
    Integer httpStatus;
    Map<String, Object> response;
    String error;
    long elapsedMs;

    public static DispatchResult delivered(int httpStatus, Map<String, Object> response, long elapsedMs) {
        return DispatchResult.builder()
                .success(true)
                .httpStatus(httpStatus)
                .response(response)
                .elapsedMs(elapsedMs)
                .build();
    }

    public static DispatchResult failed(Integer httpStatus, String error, long elapsedMs) {
        return DispatchResult.builder()
                .success(false)
                .httpStatus(httpStatus)
                .error(error)
                .elapsedMs(elapsedMs)
                .build();
    }

    public Map<String, Object> toAuditMap() {
        Map<String, Object> audit = new LinkedHashMap<>();
        audit.put("success", success);
        if (httpStatus != null) {
            audit.put("httpStatus", httpStatus);
        }
        if (response != null) {
            audit.put("response", response);
        }
        if (error != null) {
            audit.put("error", error);
        }
        audit.put("elapsedMs", elapsedMs);
        return audit;
    }
}
