package com.accesslog.risk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccessLogRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessLogRiskApplication.class, args);
    }
}
