package com.rebalancr.backend.repository;

import com.rebalancr.backend.model.Portfolio;
import com.rebalancr.backend.model.PortfolioAsset;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class PortfolioRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private PortfolioRepository portfolioRepository;

    @Test
    void lookupsAreScopedToOwner() {
        Portfolio alice = entityManager.persist(portfolio("alice", false));
        entityManager.persist(portfolio("bob", false));
        entityManager.flush();

        assertThat(portfolioRepository.findByIdAndUserId(alice.getId(), "alice")).contains(alice);
        assertThat(portfolioRepository.findByIdAndUserId(alice.getId(), "bob")).isEmpty();
        assertThat(portfolioRepository.findByUserIdOrderByIdAsc("alice")).containsExactly(alice);
    }

    @Test
    void findsOnlyAutoRebalancingPortfolios() {
        Portfolio active = entityManager.persist(portfolio("alice", true));
        entityManager.persist(portfolio("alice", false));
        entityManager.flush();

        assertThat(portfolioRepository.findByAutoRebalanceTrueOrderByIdAsc()).containsExactly(active);
    }

    @Test
    void assetsAreStoredWithTheirPortfolio() {
        Portfolio portfolio = portfolio("alice", false);
        portfolio.addAsset(PortfolioAsset.builder().symbol("BTC").amount(0.6).lastUpdated(Instant.now()).build());
        portfolio.addAsset(PortfolioAsset.builder().symbol("USDC").tokenAddress("0xa0b8").amount(100).build());
        Long id = entityManager.persistAndFlush(portfolio).getId();
        entityManager.clear();

        Portfolio loaded = portfolioRepository.findById(id).orElseThrow();

        assertThat(loaded.getAssets()).extracting(PortfolioAsset::getSymbol).containsExactly("BTC", "USDC");
        assertThat(loaded.getAssets().get(1).getTokenAddress()).isEqualTo("0xa0b8");
        assertThat(loaded.getCheckInterval()).isEqualTo(86_400L);
    }

    private static Portfolio portfolio(String userId, boolean autoRebalance) {
        return Portfolio.builder()
                .userId(userId)
                .name("main")
                .autoRebalance(autoRebalance)
                .createdAt(Instant.now())
                .build();
    }
}
