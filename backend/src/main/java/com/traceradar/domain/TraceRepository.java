package com.traceradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for assembled trace trees (root documents, children nested).
 */
public interface TraceRepository extends MongoRepository<Trace, String> {
}
