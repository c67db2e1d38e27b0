package com.rebalancr.backend.repository;

import com.rebalancr.backend.model.Portfolio;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PortfolioRepository extends JpaRepository<Portfolio, Long> {

    Optional<Portfolio> findByIdAndUserId(Long id, String userId);

    List<Portfolio> findByUserIdOrderByIdAsc(String userId);

    List<Portfolio> findByAutoRebalanceTrueOrderByIdAsc();
}
