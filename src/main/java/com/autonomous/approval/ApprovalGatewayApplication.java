package com.autonomous.approval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ApprovalGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApprovalGatewayApplication.class, args);
    }
}
