package com.rebalancr.backend.model;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "portfolios")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Portfolio {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false)
    private String name;

    @Column(name = "auto_rebalance", nullable = false)
    @Builder.Default
    private boolean autoRebalance = false;

    // Percent, e.g. 1.0 means 1%.
    @Column(name = "max_slippage", nullable = false)
    @Builder.Default
    private double maxSlippage = 1.0;

    // Seconds.
    @Column(name = "check_interval", nullable = false)
    @Builder.Default
    private long checkInterval = 86_400L;

    @Column(name = "last_rebalance_timestamp")
    private Instant lastRebalanceTimestamp;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @OneToMany(mappedBy = "portfolio", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("id ASC")
    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<PortfolioAsset> assets = new ArrayList<>();

    public void addAsset(PortfolioAsset asset) {
        asset.setPortfolio(this);
        assets.add(asset);
    }
}
