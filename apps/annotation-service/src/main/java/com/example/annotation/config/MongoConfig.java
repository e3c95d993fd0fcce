package com.example.annotation.config;

import com.fasterxml.jackson.databind.Module;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.ReactiveMongoDatabaseFactory;
import org.springframework.data.mongodb.ReactiveMongoTransactionManager;
import org.springframework.data.mongodb.config.EnableReactiveMongoAuditing;
import org.springframework.data.mongodb.core.convert.MongoCustomConversions;
import org.springframework.data.mongodb.repository.config.EnableReactiveMongoRepositories;
import org.springframework.transaction.reactive.TransactionalOperator;

// Transactions need a replica set; cascades and rating writes depend on them.
@Configuration
@EnableReactiveMongoRepositories(basePackages = {
        "com.example.annotation.profile.repository",
        "com.example.annotation.cases.repository",
        "com.example.annotation.evaluation.repository",
        "com.example.annotation.rating.repository"
})
@EnableReactiveMongoAuditing
public class MongoConfig {

    @Bean
    public ReactiveMongoTransactionManager reactiveMongoTransactionManager(ReactiveMongoDatabaseFactory factory) {
        return new ReactiveMongoTransactionManager(factory);
    }

    @Bean
    public TransactionalOperator transactionalOperator(ReactiveMongoTransactionManager transactionManager) {
        return TransactionalOperator.create(transactionManager);
    }

    @Bean
    public MongoCustomConversions mongoCustomConversions() {
        return new MongoCustomConversions(PayloadNumberConverters.converters());
    }

    // Picked up by Boot's ObjectMapper; case payloads may hold raw decimal128 values
    @Bean
    public Module payloadNumbersModule() {
        return PayloadNumberConverters.jacksonModule();
    }
}
