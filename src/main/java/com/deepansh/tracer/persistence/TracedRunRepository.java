package com.deepansh.tracer.persistence;

import com.deepansh.tracer.model.RunType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TracedRunRepository extends MongoRepository<TracedRunDocument, String> {

    List<TracedRunDocument> findByNameOrderByPersistedAtDesc(String name, Pageable pageable);

    List<TracedRunDocument> findByRunTypeOrderByPersistedAtDesc(RunType runType, Pageable pageable);

    List<TracedRunDocument> findAllByOrderByPersistedAtDesc(Pageable pageable);
}
