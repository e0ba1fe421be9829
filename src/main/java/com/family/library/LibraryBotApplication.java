package com.family.library;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.family.library")
@EnableJpaRepositories(basePackages = "com.family.library.repository")
@EntityScan(basePackages = "com.family.library.entity")
public class LibraryBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(LibraryBotApplication.class, args);
    }
}
