package com.ricemill.stockkeeper.repository;

import com.ricemill.stockkeeper.model.StockOut;

public interface StockOutRepository extends MovementRepository<StockOut> {
}
