package org.nowstart.orderflow.repository;

import org.nowstart.orderflow.data.entity.TradingOrder;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TradingOrderRepository extends JpaRepository<TradingOrder, String> {
}
