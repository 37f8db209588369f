package com.ricemill.stockkeeper.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

@Entity
@Table(name = "stock_outs", indexes = {
        @Index(name = "idx_stock_outs_tenant_date", columnList = "tenant_id, movement_date"),
        @Index(name = "idx_stock_outs_tenant_product", columnList = "tenant_id, product_id"),
        @Index(name = "idx_stock_outs_tenant_customer", columnList = "tenant_id, customer_name")
})
@AttributeOverrides({
        @AttributeOverride(name = "partyName", column = @Column(name = "customer_name", nullable = false, updatable = false)),
        @AttributeOverride(name = "partyContact", column = @Column(name = "customer_contact", length = 20, updatable = false))
})
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class StockOut extends StockMovement {

    @Override
    public MovementType getMovementType() {
        return MovementType.STOCK_OUT;
    }
}
