package com.edustream.studio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PublishWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PublishWorkerApplication.class, args);
    }

}
