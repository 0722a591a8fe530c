package com.openforge.chatrouter;

import com.openforge.chatrouter.memory.MilvusProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

// Milvus properties are registered globally so they bind even when the
// conditional Milvus beans are not loaded.
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(MilvusProperties.class)
public class ChatRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatRouterApplication.class, args);
    }
}
