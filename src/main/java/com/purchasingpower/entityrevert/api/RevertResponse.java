package com.purchasingpower.entityrevert.api;

import com.purchasingpower.entityrevert.model.RevertStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Undo / rollback response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RevertResponse {

    private boolean success;
    private String commitHash;
    private RevertStatus status;
    private String error;

    public static RevertResponse of(String commitHash, RevertStatus status) {
        return RevertResponse.builder()
            .success(status.isSuccess())
            .commitHash(commitHash)
            .status(status)
            .build();
    }

    public static RevertResponse error(String commitHash, String error) {
        return RevertResponse.builder()
            .success(false)
            .commitHash(commitHash)
            .error(error)
            .build();
    }
}
