package com.work.lock.worker.web;

import com.work.lock.core.lock.LockCoordinator;
import com.work.lock.worker.web.dto.LockStatusResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 运维查询接口：某个 key 当前是否被锁定，以及本实例是否处于降级模式。
 */
@RestController
@RequestMapping("/api/locks")
public class LockStatusController {

    private final LockCoordinator lockCoordinator;

    public LockStatusController(LockCoordinator lockCoordinator) {
        this.lockCoordinator = lockCoordinator;
    }

    @GetMapping("/{key}")
    public ResponseEntity<LockStatusResponse> status(@PathVariable String key) {
        boolean locked = lockCoordinator.isLocked(key);
        return ResponseEntity.ok(new LockStatusResponse(
                key, locked, lockCoordinator.getInstanceId(), lockCoordinator.isDegraded()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> badKey(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}
