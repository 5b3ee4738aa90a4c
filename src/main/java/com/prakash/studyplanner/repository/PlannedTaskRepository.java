package com.prakash.studyplanner.repository;

import com.prakash.studyplanner.model.PlannedTask;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PlannedTaskRepository extends MongoRepository<PlannedTask, String> {

    List<PlannedTask> findByUserId(String userId);

    List<PlannedTask> findByUserIdAndScheduledDate(String userId, LocalDate scheduledDate);

    /**
     * Tasks of a user whose date lies in [from, to], both ends inclusive.
     */
    @Query("{ 'userId': ?0, 'scheduledDate': { $gte: ?1, $lte: ?2 } }")
    List<PlannedTask> findByUserIdAndScheduledDateWithin(String userId, LocalDate from, LocalDate to);

    Optional<PlannedTask> findByIdAndUserId(String id, String userId);

    long deleteBySourceSuggestionIdIn(Collection<String> suggestionIds);
}
