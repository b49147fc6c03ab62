package dev.linguaroute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LinguaRouteApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinguaRouteApplication.class, args);
    }
}
