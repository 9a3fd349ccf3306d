package com.chatpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChatPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatPulseApplication.class, args);
    }
}
