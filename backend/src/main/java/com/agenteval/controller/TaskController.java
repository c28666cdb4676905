package com.agenteval.controller;

import com.agenteval.dto.TaskResponses;
import com.agenteval.service.TaskCatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskCatalogService taskCatalogService;

    public TaskController(TaskCatalogService taskCatalogService) {
        this.taskCatalogService = taskCatalogService;
    }

    @GetMapping
    public ResponseEntity<List<TaskResponses.TaskSummary>> listTasks(
            @RequestParam(defaultValue = "false") boolean includeInactive
    ) {
        return ResponseEntity.ok(taskCatalogService.listTasks(includeInactive));
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponses.TaskDetail> getTask(@PathVariable String taskId) {
        return ResponseEntity.ok(taskCatalogService.getTask(taskId));
    }

    @PostMapping("/{taskId}/deactivate")
    public ResponseEntity<TaskResponses.TaskDetail> deactivateTask(@PathVariable String taskId) {
        return ResponseEntity.ok(taskCatalogService.deactivateTask(taskId));
    }
}
