package org.learningjava.gaugeledger.infrastructure.adapter.out.fs;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.gaugeledger.application.port.RunExportReaderPort;
import org.learningjava.gaugeledger.domain.error.MalformedExportException;
import org.learningjava.gaugeledger.domain.model.run.AttemptRecord;
import org.learningjava.gaugeledger.domain.model.run.ResultRecord;
import org.learningjava.gaugeledger.domain.model.run.RunExport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Reads {@code benchmark-results-<epochMillis>.json} files written by the benchmark runner.
 */
public class JsonRunExportReader implements RunExportReaderPort {

    private static final Logger log = LoggerFactory.getLogger(JsonRunExportReader.class);

    static final String FILE_PREFIX = "benchmark-results-";
    static final Pattern FILE_NAME = Pattern.compile("benchmark-results-(\\d+)\\.json$");

    private static final TypeReference<Map<String, Object>> JSON_MAP = new TypeReference<>() {
    };

    private final ObjectMapper om;

    public JsonRunExportReader(ObjectMapper om) {
        this.om = om;
    }

    @Override
    public String runIdFor(Path file) {
        String name = file.getFileName().toString();
        Matcher m = FILE_NAME.matcher(name);
        if (m.find()) {
            return m.group(1);
        }
        return name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
    }

    @Override
    public List<Path> discoverExports(Path dir) {
        if (!Files.isDirectory(dir)) {
            throw new UncheckedIOException("Results directory not found: " + dir,
                    new NoSuchFileException(dir.toString()));
        }
        try (Stream<Path> s = Files.list(dir)) {
            List<Path> files = s.filter(Files::isRegularFile)
                    .filter(p -> {
                        String name = p.getFileName().toString();
                        return name.startsWith(FILE_PREFIX) && name.endsWith(".json");
                    })
                    .sorted(Comparator.comparingLong(JsonRunExportReader::timestampOf)
                            .thenComparing(p -> p.getFileName().toString()))
                    .toList();
            log.debug("Found {} export files in {}", files.size(), dir);
            return files;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + dir, e);
        }
    }

    @Override
    public RunExport read(Path file, String runId) {
        JsonNode root;
        try {
            root = om.readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new MalformedExportException("Invalid JSON in " + file.getFileName() + ": "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }

        if (root == null || !root.path("results").isArray() || !root.path("stats").isObject()) {
            throw new MalformedExportException(file.getFileName() + " has no results array or stats object");
        }

        List<ResultRecord> results = new ArrayList<>();
        for (JsonNode r : root.path("results")) {
            results.add(toResult(r, file));
        }

        return new RunExport(runId, executedAt(runId, file), file, results, toStats(root.path("stats")));
    }

    private ResultRecord toResult(JsonNode r, Path file) {
        String taskId = r.path("taskId").asText("");
        JsonNode ctx = r.path("context");
        String provider = ctx.path("llmProvider").asText("");
        String model = ctx.path("llmModel").asText("");
        if (taskId.isBlank() || provider.isBlank() || model.isBlank()) {
            throw new MalformedExportException(file.getFileName()
                    + " contains a result without taskId, context.llmProvider or context.llmModel");
        }
        String variantId = ctx.path("variantId").asText("");
        if (variantId.isBlank()) {
            variantId = provider + "/" + model;
        }

        Map<String, Object> variantConfig = ctx.path("variantConfig").isObject()
                ? om.convertValue(ctx.path("variantConfig"), JSON_MAP)
                : Map.of();

        long promptTokens = 0;
        long completionTokens = 0;
        List<AttemptRecord> attempts = new ArrayList<>();
        for (JsonNode a : r.path("attempts")) {
            JsonNode usage = a.path("llmResponse").path("usage");
            promptTokens += usage.path("promptTokens").asLong(0);
            completionTokens += usage.path("completionTokens").asLong(0);
            attempts.add(new AttemptRecord(
                    a.path("attemptNumber").asInt(attempts.size() + 1),
                    a.path("success").asBoolean(false),
                    a.path("score").asDouble(0),
                    a.path("tokensUsed").asLong(0),
                    a.path("cost").asDouble(0),
                    a.path("duration").asLong(0),
                    optionalBoolean(a.path("compilationResult").path("success")),
                    optionalBoolean(a.path("testResult").path("success")),
                    strings(a.path("failureReasons"))));
        }

        String resultJson;
        try {
            resultJson = om.writeValueAsString(r);
        } catch (JsonProcessingException e) {
            throw new MalformedExportException("Cannot re-serialize result " + taskId, e);
        }

        return new ResultRecord(
                taskId,
                variantId,
                model,
                provider,
                r.path("success").asBoolean(false),
                r.path("finalScore").asDouble(0),
                r.path("passedAttemptNumber").asInt(0),
                r.path("totalTokensUsed").asLong(0),
                promptTokens,
                completionTokens,
                r.path("totalCost").asDouble(0),
                r.path("totalDuration").asLong(0),
                variantConfig,
                resultJson,
                attempts);
    }

    private RunExport.Stats toStats(JsonNode s) {
        return new RunExport.Stats(
                s.path("totalTokens").asLong(0),
                s.path("totalCost").asDouble(0),
                s.path("totalDuration").asLong(0),
                s.path("overallPassRate").asDouble(0),
                s.path("averageScore").asDouble(0),
                s.path("passRate1").isNumber() ? s.path("passRate1").asDouble() : null,
                s.path("passRate2").isNumber() ? s.path("passRate2").asDouble() : null,
                keys(s.path("perModel")),
                keys(s.path("perTask")));
    }

    private static Instant executedAt(String runId, Path file) {
        if (runId.chars().allMatch(Character::isDigit) && !runId.isEmpty()) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(runId));
            } catch (NumberFormatException e) {
                throw new MalformedExportException(
                        file.getFileName() + " has a timestamp out of range: " + runId, e);
            }
        }
        try {
            return Files.getLastModifiedTime(file).toInstant();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot stat " + file, e);
        }
    }

    // Names whose timestamp overflows a long sort last; read() reports them.
    static long timestampOf(Path p) {
        Matcher m = FILE_NAME.matcher(p.getFileName().toString());
        if (!m.find()) {
            return 0L;
        }
        try {
            return Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }

    private static Boolean optionalBoolean(JsonNode n) {
        return n.isBoolean() ? n.asBoolean() : null;
    }

    private static List<String> strings(JsonNode n) {
        List<String> out = new ArrayList<>();
        for (JsonNode item : n) {
            out.add(item.asText());
        }
        return out;
    }

    private static List<String> keys(JsonNode n) {
        List<String> out = new ArrayList<>();
        Iterator<String> it = n.fieldNames();
        it.forEachRemaining(out::add);
        return out;
    }
}
