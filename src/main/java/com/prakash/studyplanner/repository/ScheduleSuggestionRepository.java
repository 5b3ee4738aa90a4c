package com.prakash.studyplanner.repository;

import com.prakash.studyplanner.model.ScheduleSuggestion;
import com.prakash.studyplanner.model.SuggestionStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

// Times are stored as dates by the Mongo converters, so callers order results by date/time in memory.
@Repository
public interface ScheduleSuggestionRepository extends MongoRepository<ScheduleSuggestion, String>,
        ScheduleSuggestionRepositoryCustom {

    List<ScheduleSuggestion> findByUserIdAndStatus(String userId, SuggestionStatus status);

    Optional<ScheduleSuggestion> findByIdAndUserId(String id, String userId);

    List<ScheduleSuggestion> findByResolutionToken(String resolutionToken);

    /**
     * Resolved suggestions whose resolution happened before the threshold; candidates for purging.
     */
    List<ScheduleSuggestion> findByStatusInAndResolvedAtBefore(List<SuggestionStatus> statuses, LocalDateTime olderThan);
}
