package com.example.annotation.cases.repository;

import com.example.annotation.cases.document.SyntheticCaseDoc;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface SyntheticCaseRepository extends ReactiveMongoRepository<SyntheticCaseDoc, String> {

    Flux<SyntheticCaseDoc> findAllByOrderByCreatedAtAsc();

    Flux<SyntheticCaseDoc> findByBatchIdOrderByCreatedAtAsc(String batchId);

    /**
     * Bumps {@code revision} so a transaction that inserts a child session
     * conflicts with one that deletes this document.
     *
     * @return 1 when the document exists, 0 otherwise
     */
    @Query("{ '_id': ?0 }")
    @Update("{ '$inc': { 'revision': 1 } }")
    Mono<Long> touchRevision(String id);
}
