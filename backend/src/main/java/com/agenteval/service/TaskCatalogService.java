package com.agenteval.service;

import com.agenteval.config.EvaluatorRuntimeProperties;
import com.agenteval.dto.TaskResponses;
import com.agenteval.mapper.EvaluationResponseMapper;
import com.agenteval.model.Task;
import com.agenteval.model.TaskConfigCodec;
import com.agenteval.model.TaskDefinition;
import com.agenteval.repository.TaskRepository;
import com.agenteval.web.EvaluationRequestException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Task catalog backed by the {@code tasks} table. On startup imports every {@code <tasksDir>/<id>/config.yaml}
 * whose task id is not stored yet.
 */
@Service
public class TaskCatalogService implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskCatalogService.class);

    static final String CONFIG_FILE_NAME = "config.yaml";

    private final TaskRepository taskRepository;
    private final EvaluationResponseMapper evaluationResponseMapper;
    private final EvaluatorRuntimeProperties runtimeProperties;
    private final ObjectMapper yamlMapper;

    public TaskCatalogService(
            TaskRepository taskRepository,
            EvaluationResponseMapper evaluationResponseMapper,
            EvaluatorRuntimeProperties runtimeProperties
    ) {
        this.taskRepository = taskRepository;
        this.evaluationResponseMapper = evaluationResponseMapper;
        this.runtimeProperties = runtimeProperties;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!runtimeProperties.getWorkspace().isBootstrapTasks()) {
            return;
        }
        int imported = importTasks(Paths.get(runtimeProperties.getWorkspace().getTasksDir()));
        log.info("Task catalog bootstrap imported {} new task(s)", imported);
    }

    public int importTasks(Path tasksRoot) {
        if (!Files.isDirectory(tasksRoot)) {
            log.info("Tasks directory {} does not exist; nothing to import", tasksRoot.toAbsolutePath());
            return 0;
        }

        List<Path> configFiles = new ArrayList<>();
        try (DirectoryStream<Path> taskDirs = Files.newDirectoryStream(tasksRoot, Files::isDirectory)) {
            for (Path taskDir : taskDirs) {
                Path configFile = taskDir.resolve(CONFIG_FILE_NAME);
                if (Files.isRegularFile(configFile)) {
                    configFiles.add(configFile);
                }
            }
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to list task directories under " + tasksRoot, ex);
        }
        configFiles.sort(null);

        int imported = 0;
        for (Path configFile : configFiles) {
            String directoryName = configFile.getParent().getFileName().toString();
            try {
                JsonNode config = yamlMapper.readTree(configFile.toFile());
                TaskDefinition definition = TaskConfigCodec.fromJson(config, directoryName);
                if (taskRepository.existsById(definition.taskId())) {
                    log.debug("Task {} already stored; skipping {}", definition.taskId(), configFile);
                    continue;
                }
                taskRepository.save(toTask(definition, config));
                imported++;
                log.info("Imported task {} from {}", definition.taskId(), configFile);
            } catch (IOException | IllegalArgumentException ex) {
                log.warn("Skipping invalid task configuration {}: {}", configFile, ex.getMessage());
            }
        }
        return imported;
    }

    @Transactional(readOnly = true)
    public List<TaskResponses.TaskSummary> listTasks(boolean includeInactive) {
        List<Task> tasks = includeInactive
                ? taskRepository.findAllByOrderByTaskIdAsc()
                : taskRepository.findByActiveTrueOrderByTaskIdAsc();
        return tasks.stream()
                .map(evaluationResponseMapper::toTaskSummaryResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public TaskResponses.TaskDetail getTask(String taskId) {
        Task task = requireTask(taskId);
        return evaluationResponseMapper.toTaskDetailResponse(task, toDefinition(task));
    }

    @Transactional
    public TaskResponses.TaskDetail deactivateTask(String taskId) {
        Task task = requireTask(taskId);
        if (Boolean.TRUE.equals(task.getActive())) {
            task.setActive(false);
            task.setUpdatedAt(OffsetDateTime.now());
            task = taskRepository.save(task);
            log.info("Deactivated task {}", taskId);
        }
        return evaluationResponseMapper.toTaskDetailResponse(task, toDefinition(task));
    }

    /**
     * Resolves an active task for a new evaluation.
     */
    @Transactional(readOnly = true)
    public Task requireActiveTask(String taskId) {
        Task task = requireTask(taskId);
        if (!Boolean.TRUE.equals(task.getActive())) {
            throw EvaluationRequestException.taskNotFound(taskId);
        }
        return task;
    }

    /**
     * Parsed definition of a stored task, active or not. Existing evaluations keep scoring against
     * deactivated tasks.
     */
    @Transactional(readOnly = true)
    public TaskDefinition requireTaskDefinition(String taskId) {
        return toDefinition(requireTask(taskId));
    }

    private Task requireTask(String taskId) {
        return taskRepository.findById(taskId)
                .orElseThrow(() -> EvaluationRequestException.taskNotFound(taskId));
    }

    private static TaskDefinition toDefinition(Task task) {
        return TaskConfigCodec.fromJson(task.getConfigJson(), task.getTaskId());
    }

    private static Task toTask(TaskDefinition definition, JsonNode config) {
        OffsetDateTime now = OffsetDateTime.now();
        Task task = new Task();
        task.setTaskId(definition.taskId());
        task.setName(definition.name());
        task.setDescription(definition.description());
        task.setCategory(definition.category());
        task.setEvaluationStrategy(definition.strategy());
        task.setJudgeModel(definition.judgeModel());
        task.setConfigJson(config.deepCopy());
        task.setActive(true);
        task.setCreatedAt(now);
        task.setUpdatedAt(now);
        return task;
    }
}
