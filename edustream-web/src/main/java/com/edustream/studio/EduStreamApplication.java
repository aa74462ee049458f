package com.edustream.studio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EduStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(EduStreamApplication.class, args);
    }

}
