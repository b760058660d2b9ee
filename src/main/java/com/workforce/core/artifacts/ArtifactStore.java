package com.workforce.core.artifacts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workforce.core.events.SessionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Per-run artifact directory under {@code workforce.artifacts.base-dir}.
 * <p>
 * Layout of {@code {baseDir}/{runId}/}: {@code input.txt} written at start, {@code events.jsonl}
 * appended as events happen, then {@code response.md}, {@code trace.json} and
 * {@code conversation.json} at the end. Every file except the event log is written once;
 * a second write of the same file fails.
 */
@Service
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    public static final String INPUT_FILE = "input.txt";
    public static final String EVENTS_FILE = "events.jsonl";
    public static final String RESPONSE_FILE = "response.md";
    public static final String TRACE_FILE = "trace.json";
    public static final String CONVERSATION_FILE = "conversation.json";

    private static final TypeReference<Map<String, Object>> EVENT_TYPE = new TypeReference<>() {};

    private final Path baseDir;
    private final boolean enabled;
    private final ObjectMapper objectMapper;

    @Autowired
    public ArtifactStore(ArtifactProperties properties, ObjectMapper objectMapper) {
        this(Path.of(properties.getBaseDir()), properties.isEnabled(), objectMapper);
    }

    public ArtifactStore(Path baseDir, boolean enabled, ObjectMapper objectMapper) {
        this.baseDir = baseDir;
        this.enabled = enabled;
        this.objectMapper = objectMapper;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Path baseDir() {
        return baseDir;
    }

    public Path runDirectory(String runId) {
        if (runId == null || runId.isBlank() || runId.contains("/") || runId.contains("\\") || runId.contains("..")) {
            throw new ArtifactStoreException("Invalid run id: " + runId);
        }
        return baseDir.resolve(runId);
    }

    public Path writeInput(String runId, String goal) {
        return writeOnce(runId, INPUT_FILE, goal);
    }

    public Path writeResponse(String runId, String response) {
        return writeOnce(runId, RESPONSE_FILE, response != null ? response : "");
    }

    public Path writeTrace(String runId, RunTrace trace) {
        return writeOnce(runId, TRACE_FILE, toJson(trace));
    }

    public Path writeConversation(String runId, ConversationLog conversation) {
        return writeOnce(runId, CONVERSATION_FILE, toJson(conversation));
    }

    /**
     * Appends one event as a JSON line.
     */
    public void appendEvent(String runId, SessionEvent event) {
        Path file = ensureRunDirectory(runId).resolve(EVENTS_FILE);
        String line;
        try {
            line = objectMapper.writeValueAsString(event.toMap()) + "\n";
        } catch (JsonProcessingException e) {
            throw new ArtifactStoreException("Could not serialize " + event.type().wireName() + " event", e);
        }
        try {
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new ArtifactStoreException("Could not append to " + file, e);
        }
    }

    public List<Map<String, Object>> readEvents(String runId) {
        Path file = runDirectory(runId).resolve(EVENTS_FILE);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<Map<String, Object>> events = new ArrayList<>();
        try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
            for (String line : (Iterable<String>) lines::iterator) {
                if (!line.isBlank()) {
                    events.add(objectMapper.readValue(line, EVENT_TYPE));
                }
            }
        } catch (IOException e) {
            throw new ArtifactStoreException("Could not read " + file, e);
        }
        return events;
    }

    public Optional<String> readInput(String runId) {
        return readString(runId, INPUT_FILE);
    }

    public Optional<String> readResponse(String runId) {
        return readString(runId, RESPONSE_FILE);
    }

    public Optional<RunTrace> readTrace(String runId) {
        return readString(runId, TRACE_FILE).map(json -> {
            try {
                return objectMapper.readValue(json, RunTrace.class);
            } catch (JsonProcessingException e) {
                throw new ArtifactStoreException("Corrupt " + TRACE_FILE + " for run " + runId, e);
            }
        });
    }

    /**
     * Stored runs, newest first. Run ids are time ordered, so name order is start order.
     */
    public List<RunSummary> listRuns(int limit) {
        if (!Files.isDirectory(baseDir)) {
            return List.of();
        }
        List<Path> dirs;
        try (Stream<Path> children = Files.list(baseDir)) {
            dirs = children.filter(Files::isDirectory)
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .limit(Math.max(limit, 0))
                    .toList();
        } catch (IOException e) {
            throw new ArtifactStoreException("Could not list " + baseDir, e);
        }
        return dirs.stream().map(this::summarize).toList();
    }

    /**
     * Finds a run by full id or unique prefix.
     *
     * @throws ArtifactStoreException if the prefix is malformed or matches more than one run
     */
    public Optional<String> resolveRun(String idOrPrefix) {
        if (idOrPrefix == null || idOrPrefix.isBlank() || !Files.isDirectory(baseDir)) {
            return Optional.empty();
        }
        if (Files.isDirectory(runDirectory(idOrPrefix))) {
            return Optional.of(idOrPrefix);
        }
        List<String> matches;
        try (Stream<Path> children = Files.list(baseDir)) {
            matches = children.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.startsWith(idOrPrefix))
                    .toList();
        } catch (IOException e) {
            throw new ArtifactStoreException("Could not list " + baseDir, e);
        }
        if (matches.size() > 1) {
            throw new ArtifactStoreException("Run prefix '" + idOrPrefix + "' is ambiguous: " + matches);
        }
        return matches.stream().findFirst();
    }

    private RunSummary summarize(Path dir) {
        String runId = dir.getFileName().toString();
        String input = readString(runId, INPUT_FILE)
                .map(s -> s.lines().findFirst().orElse(""))
                .orElse("");
        String outcome = "unknown";
        try {
            Optional<String> trace = readString(runId, TRACE_FILE);
            if (trace.isPresent()) {
                JsonNode node = objectMapper.readTree(trace.get());
                outcome = node.path("outcome").asText("unknown");
            }
        } catch (JsonProcessingException e) {
            log.warn("Unreadable {} for run {}: {}", TRACE_FILE, runId, e.getOriginalMessage());
        }
        return new RunSummary(runId, input, outcome, dir.toAbsolutePath().toString());
    }

    private Optional<String> readString(String runId, String fileName) {
        Path file = runDirectory(runId).resolve(fileName);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ArtifactStoreException("Could not read " + file, e);
        }
    }

    private Path writeOnce(String runId, String fileName, String content) {
        Path file = ensureRunDirectory(runId).resolve(fileName);
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            log.debug("Wrote {} for run {}", fileName, runId);
            return file;
        } catch (FileAlreadyExistsException e) {
            throw new ArtifactStoreException(fileName + " already written for run " + runId, e);
        } catch (IOException e) {
            throw new ArtifactStoreException("Could not write " + file, e);
        }
    }

    private Path ensureRunDirectory(String runId) {
        Path dir = runDirectory(runId);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ArtifactStoreException("Could not create " + dir, e);
        }
        return dir;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ArtifactStoreException("Could not serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
