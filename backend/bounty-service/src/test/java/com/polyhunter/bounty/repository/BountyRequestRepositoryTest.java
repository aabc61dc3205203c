package com.polyhunter.bounty.repository;

import com.polyhunter.bounty.BountyFixtures;
import com.polyhunter.bounty.entity.BountyRequest;
import com.polyhunter.bounty.entity.PayType;
import com.polyhunter.bounty.entity.RequestStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;

import java.time.LocalDateTime;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@DisplayName("BountyRequestRepository Tests")
class BountyRequestRepositoryTest {

    @Autowired
    private BountyRequestRepository requestRepository;

    @Autowired
    private TestEntityManager entityManager;

    private BountyRequest request;

    @BeforeEach
    void setUp() {
        request = requestRepository.save(BountyFixtures.flatRequest(600, 1000, 2).build());
        entityManager.flush();
        entityManager.clear();
    }

    @Test
    @DisplayName("Enum columns are stored as lower-case tokens")
    void enumsStoredAsLowerCaseTokens() {
        Object[] row = (Object[]) entityManager.getEntityManager()
                .createNativeQuery("SELECT status, pay_type FROM bounty_requests WHERE id = :id")
                .setParameter("id", request.getId())
                .getSingleResult();

        assertThat(row[0]).isEqualTo("published");
        assertThat(row[1]).isEqualTo("flat");
        assertThat(requestRepository.findById(request.getId()).orElseThrow().getPayType()).isEqualTo(PayType.FLAT);
    }

    @Test
    @DisplayName("Counter swap applies when version and counters match, and bumps the version")
    void compareAndSetCountersMatches() {
        int updated = requestRepository.compareAndSetCounters(request.getId(), 0L, 0L, 0,
                600L, 1, RequestStatus.PUBLISHED, RequestStatus.REVIEWABLE, LocalDateTime.now());

        assertThat(updated).isEqualTo(1);
        BountyRequest reloaded = requestRepository.findById(request.getId()).orElseThrow();
        assertThat(reloaded.getBudgetSpentCents()).isEqualTo(600L);
        assertThat(reloaded.getQuantityFulfilled()).isEqualTo(1);
        assertThat(reloaded.getVersion()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Counter swap with a stale read changes nothing")
    void compareAndSetCountersStale() {
        requestRepository.compareAndSetCounters(request.getId(), 0L, 0L, 0,
                600L, 1, RequestStatus.PUBLISHED, RequestStatus.REVIEWABLE, LocalDateTime.now());

        int second = requestRepository.compareAndSetCounters(request.getId(), 0L, 0L, 0,
                600L, 1, RequestStatus.PUBLISHED, RequestStatus.REVIEWABLE, LocalDateTime.now());

        assertThat(second).isZero();
        BountyRequest reloaded = requestRepository.findById(request.getId()).orElseThrow();
        assertThat(reloaded.getBudgetSpentCents()).isEqualTo(600L);
        assertThat(reloaded.getVersion()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Counter swap refuses a request that left the reviewable statuses")
    void compareAndSetCountersNeedsReviewableStatus() {
        requestRepository.transitionStatus(request.getId(), EnumSet.of(RequestStatus.PUBLISHED),
                RequestStatus.CLOSED, LocalDateTime.now());

        int updated = requestRepository.compareAndSetCounters(request.getId(), 1L, 0L, 0,
                600L, 1, RequestStatus.CLOSED, RequestStatus.REVIEWABLE, LocalDateTime.now());

        assertThat(updated).isZero();
    }

    @Test
    void transitionOnlyFromAllowedStatuses() {
        int fromDraft = requestRepository.transitionStatus(request.getId(), EnumSet.of(RequestStatus.DRAFT),
                RequestStatus.CANCELLED, LocalDateTime.now());
        int fromPublished = requestRepository.transitionStatus(request.getId(), EnumSet.of(RequestStatus.PUBLISHED),
                RequestStatus.PAUSED, LocalDateTime.now());

        assertThat(fromDraft).isZero();
        assertThat(fromPublished).isEqualTo(1);
        assertThat(requestRepository.findById(request.getId()).orElseThrow().getStatus())
                .isEqualTo(RequestStatus.PAUSED);
    }

    @Test
    void listAndCountByStatus() {
        requestRepository.save(BountyFixtures.flatRequest(100, 100, 1).status(RequestStatus.DRAFT).build());

        assertThat(requestRepository.countByStatus(RequestStatus.PUBLISHED)).isEqualTo(1);
        assertThat(requestRepository.findByStatusOrderByCreatedAtDesc(RequestStatus.DRAFT, PageRequest.of(0, 10)))
                .hasSize(1);
        assertThat(requestRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, 1))).hasSize(1);
        assertThat(requestRepository.sumBudgetTotalCents()).isEqualTo(1100);
        assertThat(requestRepository.sumBudgetSpentCents()).isZero();
    }
}
