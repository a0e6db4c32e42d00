package org.learningjava.gaugeledger.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.gaugeledger.application.port.RunExportReaderPort;
import org.learningjava.gaugeledger.application.port.StatsStoragePort;
import org.learningjava.gaugeledger.application.port.TaskCorpusPort;
import org.learningjava.gaugeledger.domain.service.hashing.TaskPaths;
import org.learningjava.gaugeledger.domain.service.hashing.TaskSetFingerprinter;
import org.learningjava.gaugeledger.infrastructure.adapter.out.StatsStorageFactory;
import org.learningjava.gaugeledger.infrastructure.adapter.out.fs.FileSystemTaskCorpusReader;
import org.learningjava.gaugeledger.infrastructure.adapter.out.fs.JsonRunExportReader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class AppConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    //opened here, closed with the context
    @Bean(destroyMethod = "close")
    StatsStoragePort statsStorage(StorageProperties props, ObjectMapper om, Clock clock) {
        StatsStoragePort storage = StatsStorageFactory.create(props.toSettings(), om, clock);
        storage.open();
        return storage;
    }

    @Bean
    RunExportReaderPort runExportReader(ObjectMapper om) {
        return new JsonRunExportReader(om);
    }

    @Bean
    TaskSetFingerprinter taskSetFingerprinter(TaskCorpusProperties props, Clock clock) {
        return new TaskSetFingerprinter(
                Path.of(props.getProjectRoot()),
                props.getFixturesDir(),
                props.getFixtureExtension(),
                props.getDescriptorFile(),
                new TaskPaths(props.getTaskIdPattern()),
                clock);
    }

    @Bean
    TaskCorpusPort taskCorpus(TaskCorpusProperties props) {
        return new FileSystemTaskCorpusReader(Path.of(props.getProjectRoot()).resolve(props.getTasksDir()));
    }
}
