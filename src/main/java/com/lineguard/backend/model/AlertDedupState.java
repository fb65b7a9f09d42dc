package com.lineguard.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertDedupState {
    private String contentHash;
    private String timestamp;

    // What the user was last told; contentHash is the hash of these
    @Builder.Default
    private List<AlertedStatus> statuses = new ArrayList<>();
}
