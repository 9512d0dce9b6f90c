package uk.gegc.recall.features.stats.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.concept.domain.repository.ConceptRepository;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.stats.api.dto.DueCountDto;
import uk.gegc.recall.features.stats.api.dto.UserCardStatsDto;
import uk.gegc.recall.features.stats.application.UserStatsService;
import uk.gegc.recall.features.stats.domain.model.StatsCategory;
import uk.gegc.recall.features.stats.domain.model.StatsDelta;
import uk.gegc.recall.features.stats.domain.model.UserStats;
import uk.gegc.recall.features.stats.domain.repository.UserStatsRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserStatsServiceImpl implements UserStatsService {

    static final int RECONCILE_PAGE_SIZE = 200;

    private final UserStatsRepository userStatsRepository;
    private final ConceptRepository conceptRepository;
    private final Clock clock;

    @Lazy
    private final UserStatsService self;

    @Override
    @Transactional
    public void applyDelta(UUID userId, StatsDelta delta) {
        if (delta == null || delta.isEmpty()) {
            return;
        }
        Instant now = Instant.now(clock);

        int updated = applyCounters(userId, delta, now);
        if (updated == 0) {
            try {
                self.ensureStatsRow(userId);
            } catch (DataIntegrityViolationException e) {
                // Another writer inserted the row first
                log.debug("Stats row for user {} created concurrently", userId);
            }
            updated = applyCounters(userId, delta, now);
            if (updated == 0) {
                throw new IllegalStateException("Stats row for user " + userId + " could not be created");
            }
        }

        if (delta.nextReviewCandidate() != null) {
            userStatsRepository.lowerNextReviewTime(userId, delta.nextReviewCandidate());
        }
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void ensureStatsRow(UUID userId) {
        if (userStatsRepository.findByUserId(userId).isPresent()) {
            return;
        }
        UserStats stats = new UserStats();
        stats.setUserId(userId);
        stats.setLastCalculated(Instant.now(clock));
        userStatsRepository.saveAndFlush(stats);
    }

    @Override
    @Transactional(readOnly = true)
    public DueCountDto getDueCount(UUID userId) {
        return userStatsRepository.findByUserId(userId)
                .map(stats -> new DueCountDto(
                        Math.max(stats.getDueNowCount() - stats.getNewCount(), 0),
                        stats.getNewCount(),
                        stats.getDueNowCount()))
                .orElseGet(DueCountDto::empty);
    }

    @Override
    @Transactional(readOnly = true)
    public UserCardStatsDto getUserCardStats(UUID userId) {
        return userStatsRepository.findByUserId(userId)
                .map(this::toDto)
                .orElseGet(UserCardStatsDto::empty);
    }

    @Override
    @Transactional
    public UserCardStatsDto reconcile(UUID userId) {
        Instant now = Instant.now(clock);

        long total = 0;
        long newCount = 0;
        long learning = 0;
        long mature = 0;
        long dueNow = 0;
        Instant nextReviewTime = null;

        int page = 0;
        Slice<Concept> slice;
        do {
            slice = conceptRepository.findActiveForScan(userId, PageRequest.of(page++, RECONCILE_PAGE_SIZE));
            for (Concept concept : slice) {
                total++;
                CardState state = concept.getFsrs() == null ? CardState.NEW : concept.getFsrs().stateOrNew();
                switch (StatsCategory.of(state)) {
                    case NEW -> newCount++;
                    case LEARNING -> learning++;
                    case MATURE -> mature++;
                }
                Instant nextReview = concept.getFsrs() == null ? null : concept.getFsrs().getNextReview();
                if (nextReview == null || !nextReview.isAfter(now)) {
                    dueNow++;
                } else if (nextReviewTime == null || nextReview.isBefore(nextReviewTime)) {
                    nextReviewTime = nextReview;
                }
            }
        } while (slice.hasNext());

        UserStats stats = userStatsRepository.findByUserId(userId).orElseGet(() -> {
            UserStats created = new UserStats();
            created.setUserId(userId);
            return created;
        });

        if (stats.getId() != null && (stats.getTotalCards() != total || stats.getDueNowCount() != dueNow)) {
            log.info("Reconciled drifted stats for user {}: totalCards {} -> {}, dueNowCount {} -> {}",
                    userId, stats.getTotalCards(), total, stats.getDueNowCount(), dueNow);
        }

        stats.setTotalCards(total);
        stats.setNewCount(newCount);
        stats.setLearningCount(learning);
        stats.setMatureCount(mature);
        stats.setDueNowCount(dueNow);
        stats.setNextReviewTime(nextReviewTime);
        stats.setLastCalculated(now);
        return toDto(userStatsRepository.save(stats));
    }

    @Override
    public int reconcileAll() {
        int reconciled = 0;
        int page = 0;
        Page<UUID> userIds;
        do {
            userIds = userStatsRepository.findUserIds(PageRequest.of(page++, RECONCILE_PAGE_SIZE));
            for (UUID userId : userIds) {
                try {
                    self.reconcile(userId);
                    reconciled++;
                } catch (Exception e) {
                    log.error("Failed to reconcile stats for user {}", userId, e);
                }
            }
        } while (userIds.hasNext());
        return reconciled;
    }

    private int applyCounters(UUID userId, StatsDelta delta, Instant now) {
        return userStatsRepository.applyDelta(
                userId,
                delta.totalCards(),
                delta.newCount(),
                delta.learningCount(),
                delta.matureCount(),
                delta.dueNowCount(),
                now
        );
    }

    private UserCardStatsDto toDto(UserStats stats) {
        return new UserCardStatsDto(
                stats.getTotalCards(),
                stats.getNewCount(),
                stats.getLearningCount(),
                stats.getMatureCount(),
                stats.getNextReviewTime(),
                stats.getLastCalculated()
        );
    }
}
