package com.linkshelf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LinkshelfRefreshApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinkshelfRefreshApplication.class, args);
    }
}
