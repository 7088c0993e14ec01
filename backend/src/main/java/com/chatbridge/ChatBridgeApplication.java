package com.chatbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatBridgeApplication.class, args);
    }
}
