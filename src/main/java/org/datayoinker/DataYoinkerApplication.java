package org.datayoinker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DataYoinkerApplication {
    public static void main(String[] args) {
        SpringApplication.run(DataYoinkerApplication.class, args);
    }
}
