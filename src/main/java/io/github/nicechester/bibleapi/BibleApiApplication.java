package io.github.nicechester.bibleapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BibleApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(BibleApiApplication.class, args);
    }
}
