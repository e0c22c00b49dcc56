package com.jarviz.moneybot.service;

import com.jarviz.moneybot.dto.AddExpenseDraft;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class ConversationStateService {

    private static final Logger logger = LoggerFactory.getLogger(ConversationStateService.class);

    // Pending /add flows (userId -> draft), kept in memory only
    private final Map<Long, AddExpenseDraft> drafts = new ConcurrentHashMap<>();

    /**
     * Starts a new /add flow, dropping any unfinished one.
     */
    public AddExpenseDraft start(Long userId) {
        AddExpenseDraft draft = new AddExpenseDraft();
        AddExpenseDraft previous = drafts.put(userId, draft);
        if (previous != null) {
            logger.debug("Restarted unfinished /add flow for user {} (was at {})", userId, previous.getStep());
        }
        return draft;
    }

    public AddExpenseDraft get(Long userId) {
        return drafts.get(userId);
    }

    public boolean isActive(Long userId) {
        return drafts.containsKey(userId);
    }

    /**
     * @return {@code true} if a flow was pending
     */
    public boolean clear(Long userId) {
        return drafts.remove(userId) != null;
    }
}
