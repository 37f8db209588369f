package com.ricemill.stockkeeper.dto;

import com.ricemill.stockkeeper.model.MovementType;

public enum TopEntityKind {
    PRODUCTS_IN(MovementType.STOCK_IN, true),
    PRODUCTS_OUT(MovementType.STOCK_OUT, true),
    FARMERS(MovementType.STOCK_IN, false),
    CUSTOMERS(MovementType.STOCK_OUT, false);

    private final MovementType movementType;
    private final boolean byProduct;

    TopEntityKind(MovementType movementType, boolean byProduct) {
        this.movementType = movementType;
        this.byProduct = byProduct;
    }

    public MovementType getMovementType() {
        return movementType;
    }

    public boolean isByProduct() {
        return byProduct;
    }
}
