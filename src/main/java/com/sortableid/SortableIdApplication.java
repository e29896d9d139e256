package com.sortableid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SortableIdApplication {

    public static void main(String[] args) {
        SpringApplication.run(SortableIdApplication.class, args);
    }
}
