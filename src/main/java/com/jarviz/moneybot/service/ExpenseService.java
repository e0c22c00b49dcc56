package com.jarviz.moneybot.service;

import com.jarviz.moneybot.entity.ExpenseTransaction;
import com.jarviz.moneybot.repository.CategoryTotal;
import com.jarviz.moneybot.repository.TransactionRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ExpenseService {

    private static final Logger logger = LoggerFactory.getLogger(ExpenseService.class);
    public static final String DEFAULT_CURRENCY = "INR";

    private final TransactionRepository transactionRepository;
    private final TagParser tagParser;
    private final Clock clock;

    public ExpenseService(TransactionRepository transactionRepository, TagParser tagParser, Clock clock) {
        this.transactionRepository = transactionRepository;
        this.tagParser = tagParser;
        this.clock = clock;
    }

    public long record(Long userId, String category, double amount, LocalDate date, String description) {
        return record(userId, category, amount, date, description, null, DEFAULT_CURRENCY);
    }

    /**
     * Stores one transaction and returns its id.
     *
     * @param date     {@code null} means today
     * @param tags     JSON array or comma separated list, may be {@code null}
     * @param currency {@code null} means {@link #DEFAULT_CURRENCY}
     */
    @Transactional
    public long record(Long userId, String category, double amount, LocalDate date,
                       String description, String tags, String currency) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category must not be blank");
        }
        Long nextId = transactionRepository.findNextId();
        long id = nextId != null ? nextId : 1L;

        ExpenseTransaction transaction = new ExpenseTransaction(
                id,
                userId,
                category.trim(),
                amount,
                currency != null ? currency : DEFAULT_CURRENCY,
                date != null ? date : LocalDate.now(clock),
                description);
        LocalDateTime now = LocalDateTime.now(clock);
        transaction.setCreatedAt(now);
        transaction.setUpdatedAt(now);
        List<String> parsedTags = tagParser.parse(tags);
        transaction.setTags(parsedTags == null || parsedTags.isEmpty() ? null : parsedTags);

        transactionRepository.save(transaction);
        logger.info("User {} recorded transaction {}: {} {} on {}",
                userId, id, transaction.getCategory(), amount, transaction.getDate());
        return id;
    }

    @Transactional(readOnly = true)
    public List<ExpenseTransaction> recent(Long userId, int limit) {
        return transactionRepository.findByUserIdOrderByDateDescIdDesc(userId, PageRequest.of(0, limit));
    }

    @Transactional(readOnly = true)
    public List<CategoryTotal> summary(Long userId, SummaryPeriod period) {
        LocalDate start = period.startDate(LocalDate.now(clock));
        if (start == null) {
            return transactionRepository.sumByCategory(userId);
        }
        return transactionRepository.sumByCategorySince(userId, start);
    }

    @Transactional(readOnly = true)
    public List<ExpenseTransaction> exportRows(Long userId) {
        return transactionRepository.findByUserIdOrderByDateAscIdAsc(userId);
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }
}
