package com.deepansh.learnermemory.memory;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface MemoryRecordRepository extends MongoRepository<MemoryRecord, String> {

    Optional<MemoryRecord> findBySubjectIdAndLayerAndKey(String subjectId, MemoryLayer layer, String key);

    Optional<MemoryRecord> findFirstBySubjectIdAndKeyOrderByLastUpdatedDesc(String subjectId, String key);
}
