package com.ricemill.stockkeeper.repository;

import com.ricemill.stockkeeper.dto.MovementTotals;
import com.ricemill.stockkeeper.model.StockMovement;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;

/**
 * Aggregate queries shared by the stock-in and stock-out tables. Every query is
 * keyed by tenant first so it can use the (tenant_id, ...) composite indexes.
 * Date bounds are half-open: {@code start <= date < end}.
 */
@NoRepositoryBean
public interface MovementRepository<T extends StockMovement> extends JpaRepository<T, Long> {

    @Query("SELECT s.product.id, SUM(s.totalQuintals) FROM #{#entityName} s WHERE s.tenantId = :tenantId GROUP BY s.product.id")
    List<Object[]> sumQuintalsByProduct(@Param("tenantId") Long tenantId); // [productId, quintals]

    @Query("SELECT new com.ricemill.stockkeeper.dto.MovementTotals(SUM(s.totalQuintals), SUM(s.totalPrice), COUNT(s)) "
            + "FROM #{#entityName} s WHERE s.tenantId = :tenantId AND s.date >= :start AND s.date < :end")
    MovementTotals totalsBetween(@Param("tenantId") Long tenantId, @Param("start") LocalDate start,
            @Param("end") LocalDate end);

    @Query("SELECT s.date, SUM(s.totalQuintals) FROM #{#entityName} s "
            + "WHERE s.tenantId = :tenantId AND s.date >= :start AND s.date < :end GROUP BY s.date")
    List<Object[]> sumQuintalsByDay(@Param("tenantId") Long tenantId, @Param("start") LocalDate start,
            @Param("end") LocalDate end); // [date, quintals]

    @Query("SELECT s.product.id, s.product.name, SUM(s.totalQuintals), SUM(s.totalPrice), COUNT(s) "
            + "FROM #{#entityName} s WHERE s.tenantId = :tenantId AND s.date >= :start AND s.date < :end "
            + "GROUP BY s.product.id, s.product.name "
            + "ORDER BY SUM(s.totalQuintals) DESC, SUM(s.totalPrice) DESC, s.product.id ASC")
    List<Object[]> rankProducts(@Param("tenantId") Long tenantId, @Param("start") LocalDate start,
            @Param("end") LocalDate end, Pageable page); // [productId, name, quintals, price, count]

    @Query("SELECT s.partyName, SUM(s.totalQuintals), SUM(s.totalPrice), COUNT(s) "
            + "FROM #{#entityName} s WHERE s.tenantId = :tenantId AND s.date >= :start AND s.date < :end "
            + "GROUP BY s.partyName "
            + "ORDER BY SUM(s.totalQuintals) DESC, SUM(s.totalPrice) DESC, s.partyName ASC")
    List<Object[]> rankParties(@Param("tenantId") Long tenantId, @Param("start") LocalDate start,
            @Param("end") LocalDate end, Pageable page); // [partyName, quintals, price, count]

    @Query("SELECT s FROM #{#entityName} s JOIN FETCH s.product WHERE s.tenantId = :tenantId "
            + "ORDER BY s.insertedAt DESC, s.id DESC")
    List<T> findRecent(@Param("tenantId") Long tenantId, Pageable page);

    @Query("SELECT s FROM #{#entityName} s JOIN FETCH s.product WHERE s.tenantId = :tenantId "
            + "AND s.date >= :start AND s.date < :end "
            + "AND LOWER(s.partyName) LIKE LOWER(CONCAT('%', :party, '%')) "
            + "ORDER BY s.date DESC, s.insertedAt DESC")
    List<T> findHistory(@Param("tenantId") Long tenantId, @Param("start") LocalDate start,
            @Param("end") LocalDate end, @Param("party") String party);
}
