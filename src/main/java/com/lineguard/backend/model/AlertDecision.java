package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertDecision {

    public enum Reason {
        NO_PREVIOUS_STATE,
        CONTENT_CHANGED,
        UNCHANGED,
        UNREADABLE_STATE,
        CACHE_UNAVAILABLE
    }

    private boolean send;
    private String contentHash;
    private Reason reason;
}
