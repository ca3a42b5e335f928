package com.adlanda.mediphant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Mediphant FAQ - Main Application
 *
 * Answers medication questions from a small curated corpus. Passages are found by
 * vector similarity when OpenAI and Pinecone are configured, and by a local term
 * overlap search otherwise or once either of them fails.
 *
 * This application uses:
 * - Spring Boot 3.4 on Java 17
 * - Spring AI for embeddings and answer generation via OpenAI
 * - Pinecone over its REST API as the vector index
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
@EnableScheduling
public class MediphantApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediphantApplication.class, args);
    }
}
