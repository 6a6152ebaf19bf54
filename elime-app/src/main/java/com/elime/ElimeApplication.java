package com.elime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ElimeApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(ElimeApplication.class);
        // Correction windows need a display
        application.setHeadless(false);
        System.exit(SpringApplication.exit(application.run(args)));
    }
}
