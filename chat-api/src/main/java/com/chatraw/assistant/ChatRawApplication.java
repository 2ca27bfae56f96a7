package com.chatraw.assistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatRawApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatRawApplication.class, args);
    }
}
