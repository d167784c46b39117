package com.unisync.reminder.common.persistence;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Reminder 조회 조건. null 필드는 조건에서 제외됩니다.
 */
@Getter
@Builder
@ToString
public class ReminderFilter {

    private final UUID id;

    private final UUID userId;

    /**
     * 정확히 일치하는 날짜
     */
    private final LocalDate date;

    /**
     * date >= startDate
     */
    private final LocalDate startDate;

    /**
     * date <= endDate
     */
    private final LocalDate endDate;

    public static ReminderFilter byIdAndOwner(UUID id, UUID userId) {
        return ReminderFilter.builder().id(id).userId(userId).build();
    }
}
