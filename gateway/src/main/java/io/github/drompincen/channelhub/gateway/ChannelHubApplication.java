package io.github.drompincen.channelhub.gateway;

import io.github.drompincen.channelhub.runtime.config.ChannelHubProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.channelhub")
@EnableMongoRepositories(basePackages = "io.github.drompincen.channelhub.persistence.repository")
@EnableConfigurationProperties(ChannelHubProperties.class)
public class ChannelHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChannelHubApplication.class, args);
    }
}
