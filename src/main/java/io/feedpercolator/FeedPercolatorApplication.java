package io.feedpercolator;

import io.feedpercolator.config.PercolatorConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(PercolatorConfig.class)
@ConfigurationPropertiesScan
public class FeedPercolatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeedPercolatorApplication.class, args);
    }
}
