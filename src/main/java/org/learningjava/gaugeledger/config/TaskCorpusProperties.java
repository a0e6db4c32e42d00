package org.learningjava.gaugeledger.config;

import org.learningjava.gaugeledger.domain.service.hashing.TaskPaths;
import org.learningjava.gaugeledger.domain.service.hashing.TaskSetFingerprinter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/** Where the task corpus lives on disk; relative paths resolve against {@code projectRoot}. */
@Component
@ConfigurationProperties(prefix = "gaugeledger.tasks")
public class TaskCorpusProperties {
    private String projectRoot = ".";
    private String tasksDir = "tasks";
    private String fixturesDir = TaskSetFingerprinter.DEFAULT_FIXTURES_DIR;
    private String fixtureExtension = TaskSetFingerprinter.DEFAULT_FIXTURE_EXTENSION;
    private String descriptorFile = TaskSetFingerprinter.DEFAULT_DESCRIPTOR_FILE;
    private String taskIdPattern = TaskPaths.DEFAULT_TASK_ID_PATTERN;

    public String getProjectRoot() { return projectRoot; }
    public void setProjectRoot(String v) { this.projectRoot = v; }
    public String getTasksDir() { return tasksDir; }
    public void setTasksDir(String v) { this.tasksDir = v; }
    public String getFixturesDir() { return fixturesDir; }
    public void setFixturesDir(String v) { this.fixturesDir = v; }
    public String getFixtureExtension() { return fixtureExtension; }
    public void setFixtureExtension(String v) { this.fixtureExtension = v; }
    public String getDescriptorFile() { return descriptorFile; }
    public void setDescriptorFile(String v) { this.descriptorFile = v; }
    public String getTaskIdPattern() { return taskIdPattern; }
    public void setTaskIdPattern(String v) { this.taskIdPattern = v; }
}
