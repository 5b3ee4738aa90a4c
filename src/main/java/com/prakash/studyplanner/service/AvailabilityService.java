package com.prakash.studyplanner.service;

import com.prakash.studyplanner.dto.AvailabilityBlockRequest;
import com.prakash.studyplanner.dto.AvailabilityBlockUpdateRequest;
import com.prakash.studyplanner.exception.AvailabilityBlockNotFoundException;
import com.prakash.studyplanner.exception.InvalidRequestException;
import com.prakash.studyplanner.model.AvailabilityBlock;
import com.prakash.studyplanner.model.BlockType;
import com.prakash.studyplanner.repository.AvailabilityBlockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.LocalTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    // "Until midnight" is stored as the last second of the day so start < end holds
    static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    private static final Comparator<AvailabilityBlock> WEEK_ORDER = Comparator
            .comparingInt(AvailabilityBlock::getDayOfWeek)
            .thenComparing(AvailabilityBlock::getStart, Comparator.nullsLast(Comparator.naturalOrder()));

    private final AvailabilityBlockRepository availabilityBlockRepository;

    @Autowired
    public AvailabilityService(AvailabilityBlockRepository availabilityBlockRepository) {
        this.availabilityBlockRepository = availabilityBlockRepository;
    }

    public List<AvailabilityBlock> getBlocks(String userId) {
        log.debug("Fetching availability blocks for user {}", userId);
        return availabilityBlockRepository.findByUserId(userId).stream()
                .sorted(WEEK_ORDER)
                .collect(Collectors.toList());
    }

    public AvailabilityBlock createBlock(String userId, AvailabilityBlockRequest request) {
        AvailabilityBlock block = toBlock(userId, request);
        AvailabilityBlock saved = availabilityBlockRepository.save(block);
        log.info("Created {} block {} for user {} on day {} {}-{}", saved.getBlockType(), saved.getId(), userId,
                saved.getDayOfWeek(), saved.getStart(), saved.getEnd());
        return saved;
    }

    public AvailabilityBlock updateBlock(String userId, String blockId, AvailabilityBlockUpdateRequest request) {
        AvailabilityBlock block = availabilityBlockRepository.findByIdAndUserId(blockId, userId)
                .orElseThrow(() -> new AvailabilityBlockNotFoundException("Schedule block not found with ID: " + blockId));
        if (request.getDayOfWeek() != null) block.setDayOfWeek(request.getDayOfWeek());
        if (request.getStart() != null) block.setStart(request.getStart());
        if (request.getEnd() != null) block.setEnd(normalizeEndTime(request.getEnd()));
        if (request.getBlockType() != null) block.setBlockType(request.getBlockType());
        if (request.getLabel() != null) block.setLabel(blankToNull(request.getLabel()));
        if (request.getLocation() != null) block.setLocation(blankToNull(request.getLocation()));
        requireValidRange(block.getStart(), block.getEnd());
        log.info("Updating availability block {} for user {}", blockId, userId);
        return availabilityBlockRepository.save(block);
    }

    public void deleteBlock(String userId, String blockId) {
        AvailabilityBlock block = availabilityBlockRepository.findByIdAndUserId(blockId, userId)
                .orElseThrow(() -> new AvailabilityBlockNotFoundException("Schedule block not found with ID: " + blockId));
        log.warn("Deleting availability block {} for user {}", blockId, userId);
        availabilityBlockRepository.delete(block);
    }

    /**
     * Replaces the user's whole weekly schedule. Every new block is validated before the old
     * ones are removed.
     */
    public List<AvailabilityBlock> replaceSchedule(String userId, List<AvailabilityBlockRequest> requests) {
        List<AvailabilityBlock> blocks = requests.stream()
                .map(request -> toBlock(userId, request))
                .collect(Collectors.toList());
        long removed = availabilityBlockRepository.deleteByUserId(userId);
        log.warn("Replacing weekly schedule of user {}: removed {} blocks, inserting {}", userId, removed, blocks.size());
        if (!blocks.isEmpty()) {
            availabilityBlockRepository.saveAll(blocks);
        }
        return getBlocks(userId);
    }

    static LocalTime normalizeEndTime(LocalTime end) {
        return LocalTime.MIDNIGHT.equals(end) ? END_OF_DAY : end;
    }

    private AvailabilityBlock toBlock(String userId, AvailabilityBlockRequest request) {
        LocalTime end = normalizeEndTime(request.getEnd());
        requireValidRange(request.getStart(), end);
        return AvailabilityBlock.builder()
                .userId(userId)
                .dayOfWeek(request.getDayOfWeek())
                .start(request.getStart())
                .end(end)
                .blockType(request.getBlockType() != null ? request.getBlockType() : BlockType.STUDY)
                .label(blankToNull(request.getLabel()))
                .location(blankToNull(request.getLocation()))
                .recurring(true)
                .build();
    }

    private void requireValidRange(LocalTime start, LocalTime end) {
        if (start == null || end == null || !start.isBefore(end)) {
            throw new InvalidRequestException("Block start must be before its end (got " + start + "-" + end + ")");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
