package com.drawsync.syncbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SyncBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(SyncBackendApplication.class, args);
    }
}
