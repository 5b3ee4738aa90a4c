package com.prakash.studyplanner.repository;

import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import com.prakash.studyplanner.model.ScheduleSuggestion;
import com.prakash.studyplanner.model.SuggestionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;

public class ScheduleSuggestionRepositoryCustomImpl implements ScheduleSuggestionRepositoryCustom {

    private static final Logger log = LoggerFactory.getLogger(ScheduleSuggestionRepositoryCustomImpl.class);

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    @Autowired
    public ScheduleSuggestionRepositoryCustomImpl(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public boolean transition(String suggestionId, String userId, SuggestionStatus from, SuggestionStatus to, String resolutionToken) {
        Query query = Query.query(Criteria.where("_id").is(suggestionId)
                .and("userId").is(userId)
                .and("status").is(from));
        UpdateResult result = mongoTemplate.updateFirst(query, resolveUpdate(to, resolutionToken), ScheduleSuggestion.class);
        log.debug("Transition {} -> {} for suggestion {} modified {} document(s)", from, to, suggestionId, result.getModifiedCount());
        return result.getModifiedCount() == 1;
    }

    @Override
    public long transitionAll(String userId, SuggestionStatus from, SuggestionStatus to, String resolutionToken) {
        Query query = Query.query(Criteria.where("userId").is(userId).and("status").is(from));
        UpdateResult result = mongoTemplate.updateMulti(query, resolveUpdate(to, resolutionToken), ScheduleSuggestion.class);
        log.debug("Bulk transition {} -> {} for user {} modified {} document(s)", from, to, userId, result.getModifiedCount());
        return result.getModifiedCount();
    }

    @Override
    public long releaseClaim(String resolutionToken) {
        Query query = Query.query(Criteria.where("resolutionToken").is(resolutionToken));
        Update update = new Update()
                .set("status", SuggestionStatus.PENDING)
                .unset("resolutionToken")
                .unset("resolvedAt");
        UpdateResult result = mongoTemplate.updateMulti(query, update, ScheduleSuggestion.class);
        log.warn("Released claim {} on {} suggestion(s)", resolutionToken, result.getModifiedCount());
        return result.getModifiedCount();
    }

    @Override
    public long retireStalePending(String userId, Collection<String> keepIds) {
        Criteria criteria = Criteria.where("userId").is(userId).and("status").is(SuggestionStatus.PENDING);
        if (!keepIds.isEmpty()) {
            criteria = criteria.and("_id").nin(keepIds);
        }
        DeleteResult result = mongoTemplate.remove(Query.query(criteria), ScheduleSuggestion.class);
        log.debug("Retired {} stale pending suggestion(s) of user {} (kept {})", result.getDeletedCount(), userId, keepIds.size());
        return result.getDeletedCount();
    }

    private Update resolveUpdate(SuggestionStatus to, String resolutionToken) {
        return new Update()
                .set("status", to)
                .set("resolutionToken", resolutionToken)
                .set("resolvedAt", LocalDateTime.now(clock));
    }
}
