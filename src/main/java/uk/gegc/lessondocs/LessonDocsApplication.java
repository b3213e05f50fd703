package uk.gegc.lessondocs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LessonDocsApplication {

    public static void main(String[] args) {
        SpringApplication.run(LessonDocsApplication.class, args);
    }
}
