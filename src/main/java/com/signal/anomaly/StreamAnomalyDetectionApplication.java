package com.signal.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StreamAnomalyDetectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(StreamAnomalyDetectionApplication.class, args);
    }
}
