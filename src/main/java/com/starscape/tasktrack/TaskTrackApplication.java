package com.starscape.tasktrack;

import com.starscape.tasktrack.common.config.TaskProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(TaskProperties.class)
public class TaskTrackApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskTrackApplication.class, args);
    }
}
