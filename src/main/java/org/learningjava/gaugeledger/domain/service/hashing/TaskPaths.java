package org.learningjava.gaugeledger.domain.service.hashing;

import org.learningjava.gaugeledger.domain.error.MalformedTaskPathException;
import org.learningjava.gaugeledger.domain.model.fingerprint.Difficulty;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Naming convention of the task corpus: {@code tasks/<difficulty>/<TASK-ID>-<slug>.yml}.
 */
public class TaskPaths {

    public static final String DEFAULT_TASK_ID_PATTERN = "CG-AL-[A-Z]\\d+";

    private final Pattern taskIdPattern;

    public TaskPaths() {
        this(DEFAULT_TASK_ID_PATTERN);
    }

    public TaskPaths(String taskIdRegex) {
        this.taskIdPattern = Pattern.compile("^(" + taskIdRegex + ")");
    }

    /** {@code tasks/easy/CG-AL-E008-basic-interface.yml -> CG-AL-E008} */
    public String extractTaskId(String manifestPath) {
        String normalized = ContentHasher.normalizePath(manifestPath);
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        Matcher m = taskIdPattern.matcher(fileName);
        if (!m.find()) {
            throw new MalformedTaskPathException("Cannot extract task ID", manifestPath);
        }
        return m.group(1);
    }

    public Difficulty extractDifficulty(String manifestPath) {
        String normalized = "/" + ContentHasher.normalizePath(manifestPath);
        for (Difficulty d : Difficulty.values()) {
            if (normalized.contains("/" + d.dirName() + "/")) {
                return d;
            }
        }
        throw new MalformedTaskPathException("Cannot determine difficulty", manifestPath);
    }
}
