package com.agenteval.workspace;

import com.agenteval.config.EvaluatorRuntimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads baselines from {@code <tasksDir>/<taskId>/baseline} and solutions from
 * {@code <solutionsDir>/<evaluationId>/<agent>}. Files that are not valid UTF-8 are skipped.
 */
@Component
public class FileSystemWorkspaceProvider implements WorkspaceProvider {

    private static final Logger log = LoggerFactory.getLogger(FileSystemWorkspaceProvider.class);

    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path tasksRoot;
    private final Path solutionsRoot;

    @Autowired
    public FileSystemWorkspaceProvider(EvaluatorRuntimeProperties runtimeProperties) {
        this(
                Paths.get(runtimeProperties.getWorkspace().getTasksDir()),
                Paths.get(runtimeProperties.getWorkspace().getSolutionsDir())
        );
    }

    FileSystemWorkspaceProvider(Path tasksRoot, Path solutionsRoot) {
        this.tasksRoot = tasksRoot.toAbsolutePath().normalize();
        this.solutionsRoot = solutionsRoot.toAbsolutePath().normalize();
    }

    @Override
    public Map<String, String> loadBaseline(String taskId) {
        Path baselineDir = tasksRoot.resolve(requireSafeSegment(taskId, "taskId")).resolve("baseline");
        if (!Files.isDirectory(baselineDir)) {
            log.debug("No baseline directory for task {} at {}", taskId, baselineDir);
            return Map.of();
        }
        return readTree(baselineDir);
    }

    @Override
    public Map<String, String> loadSolution(String evaluationId, String agentName) {
        Path solutionDir = solutionsRoot
                .resolve(requireSafeSegment(evaluationId, "evaluationId"))
                .resolve(requireSafeSegment(agentName, "agentName"));
        if (!Files.isDirectory(solutionDir)) {
            throw new WorkspaceException(
                    "Solution directory not found for evaluation " + evaluationId + " agent " + agentName
            );
        }
        return readTree(solutionDir);
    }

    private Map<String, String> readTree(Path root) {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile).collect(Collectors.toList());
        } catch (IOException | UncheckedIOException ex) {
            throw new WorkspaceException("Failed to list files under " + root, ex);
        }

        Map<String, String> contents = new TreeMap<>();
        for (Path file : files) {
            String relativePath = root.relativize(file).toString().replace('\\', '/');
            byte[] bytes;
            try {
                bytes = Files.readAllBytes(file);
            } catch (IOException ex) {
                throw new WorkspaceException("Failed to read " + file, ex);
            }
            String text = decodeUtf8(bytes);
            if (text == null) {
                log.debug("Skipping non-text file {}", relativePath);
                continue;
            }
            contents.put(relativePath, text);
        }
        return Collections.unmodifiableMap(contents);
    }

    private static String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException ex) {
            return null;
        }
    }

    static String requireSafeSegment(String value, String fieldName) {
        if (value == null || !SAFE_SEGMENT.matcher(value).matches() || value.contains("..")) {
            throw new WorkspaceException("Invalid " + fieldName + " for workspace path: " + value);
        }
        return value;
    }
}
