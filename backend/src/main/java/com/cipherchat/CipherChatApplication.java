package com.cipherchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CipherChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(CipherChatApplication.class, args);
    }
}
