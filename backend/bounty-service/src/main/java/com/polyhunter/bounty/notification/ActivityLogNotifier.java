package com.polyhunter.bounty.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polyhunter.bounty.entity.ActivityLogEntry;
import com.polyhunter.bounty.repository.ActivityLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.UUID;

/**
 * Appends notices to the contributor activity feed on the notification executor
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ActivityLogNotifier implements ActivityNotifier {

    private final ActivityLogRepository activityLogRepository;
    private final ObjectMapper objectMapper;

    @Override
    @Async("notificationExecutor")
    public void notify(UUID contributorId, String eventKind, String message, Map<String, Object> context) {
        try {
            ActivityLogEntry entry = ActivityLogEntry.builder()
                    .contributorId(contributorId)
                    .action(eventKind)
                    .description(message)
                    .metadata(context != null ? objectMapper.writeValueAsString(context) : null)
                    .build();
            activityLogRepository.save(entry);
            log.debug("Logged {} for contributor {}", eventKind, contributorId);
        } catch (JsonProcessingException | DataAccessException e) {
            log.warn("Dropped {} notice for contributor {}: {}", eventKind, contributorId, e.getMessage());
        }
    }
}
