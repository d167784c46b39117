package com.unisync.reminder.reminders.dto;

import com.unisync.reminder.common.entity.Reminder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.UUID;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "리마인더 정보 응답")
public class ReminderResponse {

    @Schema(description = "리마인더 ID", example = "3f1c7a52-9d3e-4b8e-8d7f-0c2a4e6b1f90")
    private UUID id;

    @Schema(description = "소유자 ID", example = "a1b2c3d4-e5f6-7890-abcd-ef1234567890")
    private UUID userId;

    @Schema(description = "리마인더 날짜", example = "2024-01-01")
    private LocalDate date;

    @Schema(description = "메모 내용", example = "보고서 제출")
    private String text;

    public static ReminderResponse from(Reminder reminder) {
        return ReminderResponse.builder()
                .id(reminder.getId())
                .userId(reminder.getUserId())
                .date(reminder.getDate())
                .text(reminder.getText())
                .build();
    }
}
