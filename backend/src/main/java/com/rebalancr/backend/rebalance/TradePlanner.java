package com.rebalancr.backend.rebalance;

import com.rebalancr.backend.config.RebalanceProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Component
@RequiredArgsConstructor
public class TradePlanner {

    private final RebalanceProperties rebalanceProperties;

    // Sells come first so that buys are funded by them.
    public TradePlan plan(PortfolioSnapshot snapshot, AllocationTarget target) {
        double total = snapshot.totalValue();
        if (total <= 0.0) {
            return TradePlan.empty();
        }
        double minTradeFraction = rebalanceProperties.getAllocation().getMinTradeFraction();
        List<TradeOrder> orders = new ArrayList<>();
        for (AssetHolding holding : snapshot.holdings()) {
            if (!holding.priced() || holding.price() <= 0.0) {
                continue;
            }
            double targetValue = target.weightOf(holding.symbol()) * total;
            double delta = targetValue - holding.value();
            if (Math.abs(delta) / total <= minTradeFraction) {
                continue;
            }
            double amount = delta / holding.price();
            if (amount == 0.0) {
                continue;
            }
            orders.add(new TradeOrder(holding.symbol(), amount, delta, holding.price()));
        }
        orders.sort(Comparator.comparing(TradeOrder::isBuy));
        return new TradePlan(orders);
    }
}
