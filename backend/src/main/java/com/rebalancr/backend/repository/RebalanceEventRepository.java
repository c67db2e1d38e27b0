package com.rebalancr.backend.repository;

import com.rebalancr.backend.model.RebalanceEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface RebalanceEventRepository extends JpaRepository<RebalanceEvent, Long> {

    List<RebalanceEvent> findByPortfolioIdOrderByCreatedAtDescIdDesc(Long portfolioId, Pageable pageable);

    List<RebalanceEvent> findByPortfolioIdAndEventTypeOrderByCreatedAtDescIdDesc(Long portfolioId, String eventType,
                                                                                Pageable pageable);

    List<RebalanceEvent> findByPortfolioIdAndCreatedAtGreaterThanEqualOrderByCreatedAtDescIdDesc(Long portfolioId,
                                                                                                  Instant from);
}
