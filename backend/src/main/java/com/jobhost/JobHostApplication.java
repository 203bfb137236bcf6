package com.jobhost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobHostApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobHostApplication.class, args);
    }
}
