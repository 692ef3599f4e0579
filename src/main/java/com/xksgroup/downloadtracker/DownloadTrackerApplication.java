package com.xksgroup.downloadtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DownloadTrackerApplication {
    public static void main(String[] args) {
        SpringApplication.run(DownloadTrackerApplication.class, args);
    }
}
