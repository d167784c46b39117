package com.unisync.reminder.reminders.service;

import com.unisync.reminder.common.entity.Reminder;
import com.unisync.reminder.common.persistence.ReminderDatabaseRepository;
import com.unisync.reminder.common.persistence.ReminderFilter;
import com.unisync.reminder.reminders.dto.ReminderRequest;
import com.unisync.reminder.reminders.dto.ReminderResponse;
import com.unisync.reminder.reminders.exception.DuplicateReminderException;
import com.unisync.reminder.reminders.exception.ReminderNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderService {

    static final String NOT_FOUND_MESSAGE = "Reminder not found.";
    static final String DUPLICATE_MESSAGE = "Reminder already exists.";

    private final ReminderDatabaseRepository reminderDatabaseRepository;

    /**
     * 같은 (소유자, 날짜, 내용) 리마인더가 있으면 생성을 거부할지 여부
     */
    @Value("${reminder.duplicate-check.enabled:true}")
    private boolean duplicateCheckEnabled;

    /**
     * 리마인더 단건 조회 (소유자 범위)
     */
    @Transactional(readOnly = true)
    public ReminderResponse getReminder(UUID reminderId, UUID userId) {
        log.info("리마인더 조회 - reminderId: {}, userId: {}", reminderId, userId);

        Reminder reminder = reminderDatabaseRepository.get(ReminderFilter.byIdAndOwner(reminderId, userId))
                .orElseThrow(() -> new ReminderNotFoundException(NOT_FOUND_MESSAGE));

        return ReminderResponse.from(reminder);
    }

    /**
     * 사용자의 리마인더 목록 조회. 시작/종료 날짜는 각각 선택이며 경계를 포함한다.
     */
    @Transactional(readOnly = true)
    public List<ReminderResponse> getReminders(UUID userId, LocalDate startDate, LocalDate endDate) {
        log.info("리마인더 목록 조회 - userId: {}, startDate: {}, endDate: {}", userId, startDate, endDate);

        ReminderFilter filter = ReminderFilter.builder()
                .userId(userId)
                .startDate(startDate)
                .endDate(endDate)
                .build();

        return reminderDatabaseRepository.filter(filter).stream()
                .map(ReminderResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * 리마인더 생성
     */
    @Transactional
    public ReminderResponse createReminder(ReminderRequest request, UUID userId) {
        log.info("리마인더 생성 요청 - userId: {}, date: {}", userId, request.getDate());

        if (duplicateCheckEnabled && hasSameContent(userId, request)) {
            throw new DuplicateReminderException(DUPLICATE_MESSAGE);
        }

        Reminder reminder = Reminder.builder()
                .userId(userId)
                .date(request.getDate())
                .text(request.getText())
                .build();

        Reminder savedReminder = reminderDatabaseRepository.create(reminder);
        log.info("리마인더 생성 완료 - reminderId: {}", savedReminder.getId());

        return ReminderResponse.from(savedReminder);
    }

    /**
     * 같은 날짜에 같은 내용의 리마인더가 있는지 확인.
     * text는 TEXT 컬럼이라 쿼리 조건 대신 조회 결과에서 비교한다.
     */
    private boolean hasSameContent(UUID userId, ReminderRequest request) {
        ReminderFilter sameDay = ReminderFilter.builder()
                .userId(userId)
                .date(request.getDate())
                .build();

        return reminderDatabaseRepository.filter(sameDay).stream()
                .anyMatch(reminder -> reminder.getText().equals(request.getText()));
    }

    /**
     * 리마인더 수정 (날짜, 내용 전체 교체)
     */
    @Transactional
    public ReminderResponse updateReminder(UUID reminderId, ReminderRequest request, UUID userId) {
        log.info("리마인더 수정 요청 - reminderId: {}, userId: {}", reminderId, userId);

        if (reminderDatabaseRepository.get(ReminderFilter.byIdAndOwner(reminderId, userId)).isEmpty()) {
            throw new ReminderNotFoundException(NOT_FOUND_MESSAGE);
        }

        Reminder updatedReminder = reminderDatabaseRepository.update(reminderId, reminder -> {
                    reminder.setDate(request.getDate());
                    reminder.setText(request.getText());
                })
                .orElseThrow(() -> new ReminderNotFoundException(NOT_FOUND_MESSAGE));

        log.info("리마인더 수정 완료 - reminderId: {}", reminderId);
        return ReminderResponse.from(updatedReminder);
    }

    /**
     * 리마인더 삭제 (하드 삭제)
     */
    @Transactional
    public void deleteReminder(UUID reminderId, UUID userId) {
        log.info("리마인더 삭제 요청 - reminderId: {}, userId: {}", reminderId, userId);

        if (!reminderDatabaseRepository.delete(ReminderFilter.byIdAndOwner(reminderId, userId))) {
            throw new ReminderNotFoundException(NOT_FOUND_MESSAGE);
        }

        log.info("리마인더 삭제 완료 - reminderId: {}", reminderId);
    }
}
