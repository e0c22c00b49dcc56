package com.jarviz.moneybot.repository;

import com.jarviz.moneybot.entity.ExpenseTransaction;
import java.time.LocalDate;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface TransactionRepository extends JpaRepository<ExpenseTransaction, Long> {

    @Query(value = "SELECT CAST(COALESCE(MAX(id), 0) + 1 AS BIGINT) FROM transactions", nativeQuery = true)
    Long findNextId();

    List<ExpenseTransaction> findByUserIdOrderByDateDescIdDesc(Long userId, Pageable pageable);

    @Query("SELECT t.category AS category, SUM(t.amount) AS total FROM ExpenseTransaction t "
            + "WHERE t.userId = :userId AND t.date >= :startDate "
            + "GROUP BY t.category ORDER BY t.category")
    List<CategoryTotal> sumByCategorySince(@Param("userId") Long userId, @Param("startDate") LocalDate startDate);

    @Query("SELECT t.category AS category, SUM(t.amount) AS total FROM ExpenseTransaction t "
            + "WHERE t.userId = :userId "
            + "GROUP BY t.category ORDER BY t.category")
    List<CategoryTotal> sumByCategory(@Param("userId") Long userId);

    List<ExpenseTransaction> findByUserIdOrderByDateAscIdAsc(Long userId);
}
