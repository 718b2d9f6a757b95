package com.gdin.inspection.waterleak;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WaterLeakApplication {

    public static void main(String[] args) {
        SpringApplication.run(WaterLeakApplication.class, args);
    }
}
