package org.learningjava.gaugeledger.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "gaugeledger.import")
public class ImportProperties {
    private boolean onStartup = false;
    private String resultsDir = "results";

    public boolean isOnStartup() { return onStartup; }
    public void setOnStartup(boolean v) { this.onStartup = v; }
    public String getResultsDir() { return resultsDir; }
    public void setResultsDir(String v) { this.resultsDir = v; }
}
