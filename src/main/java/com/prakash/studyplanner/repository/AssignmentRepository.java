package com.prakash.studyplanner.repository;

import com.prakash.studyplanner.model.Assignment;
import com.prakash.studyplanner.model.AssignmentStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AssignmentRepository extends MongoRepository<Assignment, String> {

    /**
     * Open work for a user, i.e. everything not in the given (completed) status.
     */
    List<Assignment> findByUserIdAndStatusNot(String userId, AssignmentStatus status);
}
