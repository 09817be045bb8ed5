package com.mead.kpcdst;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class KpCdstApplication {

    public static void main(String[] args) {
        SpringApplication.run(KpCdstApplication.class, args);
    }
}
