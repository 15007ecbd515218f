package com.swiftload.loadservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = {"com.swiftload.loadservice", "com.swiftload.common"})
@EnableScheduling
public class LoadServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoadServiceApplication.class, args);
    }
}
