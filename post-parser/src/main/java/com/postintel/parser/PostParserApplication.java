package com.postintel.parser;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class PostParserApplication {

    public static void main(String[] args) {
        SpringApplication.run(PostParserApplication.class, args);
    }
}
