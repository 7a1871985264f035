package com.williamcallahan.knowledgeindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class KnowledgeIndexApplication {

    public static void main(String[] args) {
        // Disable Netty native OpenSSL (tcnative) for the shaded gRPC transport used by Qdrant
        System.setProperty("io.grpc.netty.shaded.io.netty.handler.ssl.noOpenSsl", "true");
        SpringApplication.run(KnowledgeIndexApplication.class, args);
    }

}
