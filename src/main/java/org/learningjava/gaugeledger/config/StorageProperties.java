package org.learningjava.gaugeledger.config;

import org.learningjava.gaugeledger.infrastructure.adapter.out.StorageSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "gaugeledger.storage")
public class StorageProperties {
    private String type = "sqlite";
    private String sqlitePath = StorageSettings.DEFAULT_SQLITE_PATH.toString();

    public String getType() { return type; }
    public void setType(String v) { this.type = v; }
    public String getSqlitePath() { return sqlitePath; }
    public void setSqlitePath(String v) { this.sqlitePath = v; }

    public StorageSettings toSettings() {
        return new StorageSettings(StorageSettings.Type.parse(type),
                sqlitePath == null || sqlitePath.isBlank() ? null : Path.of(sqlitePath));
    }
}
