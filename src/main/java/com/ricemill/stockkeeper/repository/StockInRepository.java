package com.ricemill.stockkeeper.repository;

import com.ricemill.stockkeeper.model.StockIn;

public interface StockInRepository extends MovementRepository<StockIn> {
}
