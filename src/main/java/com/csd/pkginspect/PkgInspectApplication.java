package com.csd.pkginspect;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PkgInspectApplication {

    public static void main(String[] args) {
        SpringApplication.run(PkgInspectApplication.class, args);
    }
}
