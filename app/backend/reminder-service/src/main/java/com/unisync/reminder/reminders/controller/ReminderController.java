package com.unisync.reminder.reminders.controller;

import com.unisync.reminder.common.exception.UnauthorizedException;
import com.unisync.reminder.reminders.dto.ReminderRequest;
import com.unisync.reminder.reminders.dto.ReminderResponse;
import com.unisync.reminder.reminders.service.ReminderService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/reminder")
@RequiredArgsConstructor
@Tag(name = "Reminder", description = "리마인더 관리 API")
public class ReminderController {

    public static final String USER_ID_HEADER = "X-User-Id";

    private final ReminderService reminderService;

    @GetMapping("/{reminderId}")
    @Operation(summary = "리마인더 상세 조회")
    public ResponseEntity<ReminderResponse> getReminder(
            @PathVariable UUID reminderId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader
    ) {
        UUID userId = resolveUserId(userIdHeader);
        return ResponseEntity.ok(reminderService.getReminder(reminderId, userId));
    }

    @GetMapping({"", "/"})
    @Operation(summary = "리마인더 목록 조회 (날짜 범위 선택)")
    public ResponseEntity<List<ReminderResponse>> getReminders(
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader,
            @RequestParam(name = "start_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(name = "end_date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        UUID userId = resolveUserId(userIdHeader);
        return ResponseEntity.ok(reminderService.getReminders(userId, startDate, endDate));
    }

    @PostMapping({"", "/"})
    @Operation(summary = "리마인더 생성")
    public ResponseEntity<ReminderResponse> createReminder(
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader,
            @Valid @RequestBody ReminderRequest request
    ) {
        UUID userId = resolveUserId(userIdHeader);
        return ResponseEntity.status(HttpStatus.CREATED).body(reminderService.createReminder(request, userId));
    }

    @PutMapping("/{reminderId}")
    @Operation(summary = "리마인더 수정")
    public ResponseEntity<ReminderResponse> updateReminder(
            @PathVariable UUID reminderId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader,
            @Valid @RequestBody ReminderRequest request
    ) {
        UUID userId = resolveUserId(userIdHeader);
        return ResponseEntity.ok(reminderService.updateReminder(reminderId, request, userId));
    }

    @DeleteMapping("/{reminderId}")
    @Operation(summary = "리마인더 삭제")
    public ResponseEntity<Void> deleteReminder(
            @PathVariable UUID reminderId,
            @RequestHeader(value = USER_ID_HEADER, required = false) String userIdHeader
    ) {
        UUID userId = resolveUserId(userIdHeader);
        reminderService.deleteReminder(reminderId, userId);
        return ResponseEntity.ok().build();
    }

    private UUID resolveUserId(String userIdHeader) {
        if (userIdHeader == null || userIdHeader.isBlank()) {
            throw new UnauthorizedException("MISSING_USER_ID", "Missing X-User-Id header.");
        }
        try {
            return UUID.fromString(userIdHeader.trim());
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("INVALID_USER_ID", "Invalid X-User-Id header.", e);
        }
    }
}
