package com.agenteval.service;

import com.agenteval.config.EvaluatorRuntimeProperties;
import com.agenteval.dto.TaskResponses;
import com.agenteval.mapper.EvaluationResponseMapper;
import com.agenteval.model.EvaluationStrategy;
import com.agenteval.model.Task;
import com.agenteval.model.TaskDefinition;
import com.agenteval.repository.TaskRepository;
import com.agenteval.web.EvaluationRequestException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskCatalogServiceTest {

    private static final String CONFIG = """
            task:
              id: css-consolidation
              name: "CSS Consolidation Challenge"
              category: refactoring
            evaluation:
              type: hybrid
              scoring:
                pattern_consolidation:
                  weight: 40
                  description: "Consolidation"
            ai_judge:
              model: "anthropic/claude-3-sonnet"
            agents:
              claude: "Consolidate styles."
            """;

    @TempDir
    Path tasksRoot;

    @Mock
    private TaskRepository taskRepository;

    private TaskCatalogService taskCatalogService;

    @BeforeEach
    void setUp() {
        taskCatalogService = new TaskCatalogService(
                taskRepository,
                new EvaluationResponseMapper(),
                new EvaluatorRuntimeProperties()
        );
    }

    @Test
    void importStoresNewTasksAndSkipsInvalidOnes() throws Exception {
        writeConfig("css-consolidation", CONFIG);
        writeConfig("broken", "evaluation:\n  type: crowd_vote\n");
        Files.createDirectories(tasksRoot.resolve("no-config"));
        when(taskRepository.existsById("css-consolidation")).thenReturn(false);

        int imported = taskCatalogService.importTasks(tasksRoot);

        assertEquals(1, imported);
        ArgumentCaptor<Task> saved = ArgumentCaptor.forClass(Task.class);
        verify(taskRepository).save(saved.capture());
        Task task = saved.getValue();
        assertEquals("css-consolidation", task.getTaskId());
        assertEquals("CSS Consolidation Challenge", task.getName());
        assertEquals("refactoring", task.getCategory());
        assertEquals(EvaluationStrategy.HYBRID, task.getEvaluationStrategy());
        assertEquals("anthropic/claude-3-sonnet", task.getJudgeModel());
        assertEquals(40, task.getConfigJson().path("evaluation").path("scoring")
                .path("pattern_consolidation").path("weight").asInt());
    }

    @Test
    void importKeepsExistingTasks() throws Exception {
        writeConfig("css-consolidation", CONFIG);
        when(taskRepository.existsById("css-consolidation")).thenReturn(true);

        assertEquals(0, taskCatalogService.importTasks(tasksRoot));
        verify(taskRepository, never()).save(any());
    }

    @Test
    void importOfMissingDirectoryIsNoop() {
        assertEquals(0, taskCatalogService.importTasks(tasksRoot.resolve("absent")));
    }

    @Test
    void getTaskExposesRubricAndAgentPrompts() throws Exception {
        when(taskRepository.findById("css-consolidation")).thenReturn(Optional.of(storedTask(true)));

        TaskResponses.TaskDetail detail = taskCatalogService.getTask("css-consolidation");

        assertEquals(1, detail.rubric().size());
        assertEquals("pattern_consolidation", detail.rubric().get(0).name());
        assertEquals("Consolidate styles.", detail.agentPrompts().get("claude"));
    }

    @Test
    void deactivatedTaskIsHiddenFromNewEvaluationsButStillResolvable() throws Exception {
        Task task = storedTask(true);
        when(taskRepository.findById("css-consolidation")).thenReturn(Optional.of(task));
        when(taskRepository.save(task)).thenReturn(task);

        TaskResponses.TaskDetail detail = taskCatalogService.deactivateTask("css-consolidation");

        assertFalse(detail.active());
        EvaluationRequestException ex = assertThrows(
                EvaluationRequestException.class,
                () -> taskCatalogService.requireActiveTask("css-consolidation")
        );
        assertEquals("task_not_found", ex.getCode());
        TaskDefinition definition = taskCatalogService.requireTaskDefinition("css-consolidation");
        assertEquals(EvaluationStrategy.HYBRID, definition.strategy());
        verify(taskRepository, times(1)).save(task);
    }

    @Test
    void listTasksHonorsInactiveFlag() throws Exception {
        when(taskRepository.findByActiveTrueOrderByTaskIdAsc()).thenReturn(List.of(storedTask(true)));
        when(taskRepository.findAllByOrderByTaskIdAsc()).thenReturn(List.of(storedTask(true), inactiveTask()));

        assertEquals(1, taskCatalogService.listTasks(false).size());
        assertEquals(2, taskCatalogService.listTasks(true).size());
    }

    private void writeConfig(String directory, String content) throws Exception {
        Path taskDir = tasksRoot.resolve(directory);
        Files.createDirectories(taskDir);
        Files.writeString(taskDir.resolve(TaskCatalogService.CONFIG_FILE_NAME), content, StandardCharsets.UTF_8);
    }

    private static Task storedTask(boolean active) throws Exception {
        Task task = new Task();
        task.setTaskId("css-consolidation");
        task.setName("CSS Consolidation Challenge");
        task.setCategory("refactoring");
        task.setEvaluationStrategy(EvaluationStrategy.HYBRID);
        task.setConfigJson(new ObjectMapper(new YAMLFactory()).readTree(CONFIG));
        task.setActive(active);
        return task;
    }

    private static Task inactiveTask() {
        Task task = new Task();
        task.setTaskId("legacy-cleanup");
        task.setName("Legacy cleanup");
        task.setEvaluationStrategy(EvaluationStrategy.RULE_BASED);
        task.setActive(false);
        return task;
    }
}
