package org.exquisite;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExquisiteApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExquisiteApplication.class, args);
    }
}
