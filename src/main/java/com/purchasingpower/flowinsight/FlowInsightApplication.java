package com.purchasingpower.flowinsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlowInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlowInsightApplication.class, args);
    }
}
