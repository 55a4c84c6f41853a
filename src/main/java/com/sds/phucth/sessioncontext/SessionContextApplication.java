package com.sds.phucth.sessioncontext;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SessionContextApplication {

    public static void main(String[] args) {
        SpringApplication.run(SessionContextApplication.class, args);
    }
}
