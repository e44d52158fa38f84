package com.purchasingpower.entityrevert.api;

import com.purchasingpower.entityrevert.model.RevertStatus;
import com.purchasingpower.entityrevert.service.RevertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.function.Function;

/**
 * REST controller for undo and rollback of entity-store commits.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RevertController {

    private final RevertService revertService;

    /**
     * Undo a single commit.
     *
     * POST /api/v1/commits/{hash}/undo
     */
    @PostMapping("/commits/{hash}/undo")
    public ResponseEntity<RevertResponse> undo(@PathVariable String hash) {
        return execute(hash, "Undo", revertService::revert);
    }

    /**
     * Roll back to the state of a commit.
     *
     * POST /api/v1/commits/{hash}/rollback
     */
    @PostMapping("/commits/{hash}/rollback")
    public ResponseEntity<RevertResponse> rollback(@PathVariable String hash) {
        return execute(hash, "Rollback", revertService::revertAll);
    }

    private ResponseEntity<RevertResponse> execute(String hash, String operation, Function<String, RevertStatus> action) {
        try {
            RevertStatus status = action.apply(hash);
            RevertResponse body = RevertResponse.of(hash, status);
            return status.isSuccess()
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.CONFLICT).body(body);

        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(RevertResponse.error(hash, e.getMessage()));

        } catch (Exception e) {
            log.error("{} of {} failed", operation, hash, e);
            return ResponseEntity.internalServerError()
                .body(RevertResponse.error(hash, operation + " failed: " + e.getMessage()));
        }
    }
}
