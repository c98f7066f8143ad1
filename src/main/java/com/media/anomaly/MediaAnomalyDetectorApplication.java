package com.media.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MediaAnomalyDetectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaAnomalyDetectorApplication.class, args);
    }
}
