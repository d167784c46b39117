package com.unisync.reminder.reminders.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * id, user_id는 서버가 결정하므로 요청으로 받지 않는다.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Schema(description = "리마인더 생성/수정 요청")
public class ReminderRequest {

    @NotNull(message = "Date is required")
    @Schema(description = "리마인더 날짜", example = "2024-01-01", requiredMode = Schema.RequiredMode.REQUIRED)
    private LocalDate date;

    @NotNull(message = "Text is required")
    @Schema(description = "메모 내용", example = "보고서 제출", requiredMode = Schema.RequiredMode.REQUIRED)
    private String text;
}
