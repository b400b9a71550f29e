package io.riskradar.ingestion;

import io.riskradar.ingestion.config.RiskRadarConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(RiskRadarConfig.class)
@ConfigurationPropertiesScan
public class RiskRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(RiskRadarApplication.class, args);
    }
}
