package io.github.drompincen.playdeck.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.playdeck")
@EnableMongoRepositories(basePackages = "io.github.drompincen.playdeck.persistence.repository")
@EnableScheduling
public class PlaydeckApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlaydeckApplication.class, args);
    }
}
