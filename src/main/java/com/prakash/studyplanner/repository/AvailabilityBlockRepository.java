package com.prakash.studyplanner.repository;

import com.prakash.studyplanner.model.AvailabilityBlock;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AvailabilityBlockRepository extends MongoRepository<AvailabilityBlock, String> {

    List<AvailabilityBlock> findByUserId(String userId);

    Optional<AvailabilityBlock> findByIdAndUserId(String id, String userId);

    long deleteByUserId(String userId);
}
