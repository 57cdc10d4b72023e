package com.staycheckout.common.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error envelope shared by every endpoint: {@code {"ok": false, "error": "..."}}.
 * Success payloads carry {@code ok: true} alongside their own fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"ok", "error"})
public class ErrorResponse {
    private boolean ok;
    private String error;

    public static ErrorResponse of(String message) {
        return ErrorResponse.builder()
                .ok(false)
                .error(message)
                .build();
    }
}
