package com.purchasingpower.entityrevert;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EntityRevertApplication {

    public static void main(String[] args) {
        SpringApplication.run(EntityRevertApplication.class, args);
    }
}
