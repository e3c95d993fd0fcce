package com.example.annotation.rating.repository;

import com.example.annotation.rating.document.TacticRatingDoc;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

@Repository
public interface TacticRatingRepository extends ReactiveMongoRepository<TacticRatingDoc, String> {

    Flux<TacticRatingDoc> findBySessionIdOrderByTripleIndexAsc(String sessionId);

    Mono<Long> countBySessionId(String sessionId);

    Mono<Long> deleteBySessionIdIn(Collection<String> sessionIds);
}
