package com.openforge.mcpchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class McpChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(McpChatApplication.class, args);
    }
}
