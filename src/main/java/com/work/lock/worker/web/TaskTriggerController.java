package com.work.lock.worker.web;

import com.work.lock.core.execution.GuardedTaskRegistry;
import com.work.lock.core.execution.LockExecutionGate;
import com.work.lock.worker.web.dto.TaskTriggerResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 手动触发已注册的受保护任务，与定时触发走同一把锁。
 */
@RestController
@RequestMapping("/api/tasks")
public class TaskTriggerController {

    private final GuardedTaskRegistry registry;
    private final LockExecutionGate gate;

    public TaskTriggerController(GuardedTaskRegistry registry, LockExecutionGate gate) {
        this.registry = registry;
        this.gate = gate;
    }

    @PostMapping("/{name}/trigger")
    public ResponseEntity<TaskTriggerResponse> trigger(@PathVariable String name) {
        if (registry.find(name).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        boolean executed = gate.trigger(name);
        return ResponseEntity.ok(new TaskTriggerResponse(name, executed));
    }
}
