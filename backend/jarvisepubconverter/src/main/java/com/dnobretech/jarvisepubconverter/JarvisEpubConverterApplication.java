package com.dnobretech.jarvisepubconverter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class JarvisEpubConverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(JarvisEpubConverterApplication.class, args);
    }
}
