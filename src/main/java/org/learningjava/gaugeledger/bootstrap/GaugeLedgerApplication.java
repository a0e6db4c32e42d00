package org.learningjava.gaugeledger.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.gaugeledger")
public class GaugeLedgerApplication {
    public static void main(String[] args) {
        SpringApplication.run(GaugeLedgerApplication.class, args);
    }
}
