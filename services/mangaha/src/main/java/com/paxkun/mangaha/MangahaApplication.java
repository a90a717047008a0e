package com.paxkun.mangaha;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 📚 Mangaha Application Entry Point
 *
 * The main Spring Boot application class for the Mangaha catalog harvester.
 */
@SpringBootApplication
public class MangahaApplication {
    public static void main(String[] args) {
        SpringApplication.run(MangahaApplication.class, args);
    }
}
