package com.example.chatfunctions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatFunctionsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatFunctionsApplication.class, args);
    }
}
