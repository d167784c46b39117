package com.unisync.reminder.reminders.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.unisync.reminder.reminders.dto.ReminderRequest;
import com.unisync.reminder.reminders.dto.ReminderResponse;
import com.unisync.reminder.reminders.exception.DuplicateReminderException;
import com.unisync.reminder.reminders.exception.ReminderNotFoundException;
import com.unisync.reminder.reminders.service.ReminderService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * ReminderController 단위 테스트
 */
@WebMvcTest(ReminderController.class)
@DisplayName("ReminderController 단위 테스트")
class ReminderControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ReminderService reminderService;

    private ObjectMapper objectMapper;
    private static final UUID USER_ID = UUID.fromString("a1b2c3d4-e5f6-7890-abcd-ef1234567890");
    private static final UUID REMINDER_ID = UUID.fromString("3f1c7a52-9d3e-4b8e-8d7f-0c2a4e6b1f90");

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private ReminderResponse sampleResponse() {
        return ReminderResponse.builder()
                .id(REMINDER_ID)
                .userId(USER_ID)
                .date(LocalDate.of(2024, 1, 1))
                .text("보고서 제출")
                .build();
    }

    // ========================================
    // GET /reminder/{reminderId} 테스트
    // ========================================

    @Test
    @DisplayName("GET /reminder/{reminderId} - 리마인더 조회 성공")
    void getReminder_Success() throws Exception {
        // Given
        given(reminderService.getReminder(REMINDER_ID, USER_ID)).willReturn(sampleResponse());

        // When & Then
        mockMvc.perform(get("/reminder/{reminderId}", REMINDER_ID)
                        .header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(REMINDER_ID.toString()))
                .andExpect(jsonPath("$.user_id").value(USER_ID.toString()))
                .andExpect(jsonPath("$.date").value("2024-01-01"))
                .andExpect(jsonPath("$.text").value("보고서 제출"));
    }

    @Test
    @DisplayName("GET /reminder/{reminderId} - 존재하지 않으면 404")
    void getReminder_NotFound() throws Exception {
        // Given
        given(reminderService.getReminder(REMINDER_ID, USER_ID))
                .willThrow(new ReminderNotFoundException("Reminder not found."));

        // When & Then
        mockMvc.perform(get("/reminder/{reminderId}", REMINDER_ID)
                        .header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_code").value("REMINDER_NOT_FOUND"))
                .andExpect(jsonPath("$.error_message").value("Reminder not found."));
    }

    @Test
    @DisplayName("GET /reminder/{reminderId} - X-User-Id 헤더 누락 시 401")
    void getReminder_MissingHeader() throws Exception {
        mockMvc.perform(get("/reminder/{reminderId}", REMINDER_ID))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("MISSING_USER_ID"))
                .andExpect(jsonPath("$.error_message").value("Missing X-User-Id header."));

        then(reminderService).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("GET /reminder/{reminderId} - UUID가 아닌 X-User-Id는 401")
    void getReminder_InvalidHeader() throws Exception {
        mockMvc.perform(get("/reminder/{reminderId}", REMINDER_ID)
                        .header("X-User-Id", "not-a-uuid"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("INVALID_USER_ID"))
                .andExpect(jsonPath("$.error_message").value("Invalid X-User-Id header."));
    }

    @Test
    @DisplayName("GET /reminder/{reminderId} - 잘못된 ID 형식은 422")
    void getReminder_MalformedId() throws Exception {
        mockMvc.perform(get("/reminder/{reminderId}", "12345")
                        .header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"));
    }

    // ========================================
    // GET /reminder/ 테스트
    // ========================================

    @Test
    @DisplayName("GET /reminder/ - 필터 없이 목록 조회")
    void getReminders_NoFilter() throws Exception {
        // Given
        given(reminderService.getReminders(USER_ID, null, null)).willReturn(List.of(sampleResponse()));

        // When & Then
        mockMvc.perform(get("/reminder/")
                        .header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isArray())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].text").value("보고서 제출"));

        then(reminderService).should().getReminders(USER_ID, null, null);
    }

    @Test
    @DisplayName("GET /reminder - 날짜 범위로 조회")
    void getReminders_WithDateRange() throws Exception {
        // Given
        LocalDate start = LocalDate.of(2024, 1, 10);
        LocalDate end = LocalDate.of(2024, 1, 20);
        given(reminderService.getReminders(USER_ID, start, end)).willReturn(List.of());

        // When & Then
        mockMvc.perform(get("/reminder")
                        .header("X-User-Id", USER_ID.toString())
                        .param("start_date", "2024-01-10")
                        .param("end_date", "2024-01-20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        then(reminderService).should().getReminders(USER_ID, start, end);
    }

    @Test
    @DisplayName("GET /reminder/ - 잘못된 날짜 형식은 422")
    void getReminders_MalformedDate() throws Exception {
        mockMvc.perform(get("/reminder/")
                        .header("X-User-Id", USER_ID.toString())
                        .param("start_date", "2024/01/10"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"));

        then(reminderService).shouldHaveNoInteractions();
    }

    // ========================================
    // POST /reminder/ 테스트
    // ========================================

    @Test
    @DisplayName("POST /reminder/ - 리마인더 생성 성공")
    void createReminder_Success() throws Exception {
        // Given
        ReminderRequest request = ReminderRequest.builder()
                .date(LocalDate.of(2024, 1, 1))
                .text("보고서 제출")
                .build();

        given(reminderService.createReminder(any(ReminderRequest.class), eq(USER_ID)))
                .willReturn(sampleResponse());

        // When & Then
        mockMvc.perform(post("/reminder/")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(REMINDER_ID.toString()))
                .andExpect(jsonPath("$.user_id").value(USER_ID.toString()))
                .andExpect(jsonPath("$.date").value("2024-01-01"));
    }

    @Test
    @DisplayName("POST /reminder/ - 헤더 누락 시 401")
    void createReminder_MissingHeader() throws Exception {
        mockMvc.perform(post("/reminder/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"date\":\"2024-01-01\",\"text\":\"T\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_message").value("Missing X-User-Id header."));

        then(reminderService).should(never()).createReminder(any(), any());
    }

    @Test
    @DisplayName("POST /reminder/ - 필수 필드 누락 시 422")
    void createReminder_MissingText() throws Exception {
        mockMvc.perform(post("/reminder/")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"date\":\"2024-01-01\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.errors.text").value("Text is required"));
    }

    @Test
    @DisplayName("POST /reminder/ - 날짜 형식 오류 시 422")
    void createReminder_MalformedDate() throws Exception {
        mockMvc.perform(post("/reminder/")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"date\":\"01-01-2024\",\"text\":\"T\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error_message").value("Malformed request body."));
    }

    @Test
    @DisplayName("POST /reminder/ - 중복 리마인더는 409")
    void createReminder_Duplicate() throws Exception {
        // Given
        given(reminderService.createReminder(any(ReminderRequest.class), eq(USER_ID)))
                .willThrow(new DuplicateReminderException("Reminder already exists."));

        // When & Then
        mockMvc.perform(post("/reminder/")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"date\":\"2024-01-01\",\"text\":\"T\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("DUPLICATE_REMINDER"));
    }

    @Test
    @DisplayName("POST /reminder/ - JSON이 아닌 Content-Type은 415")
    void createReminder_UnsupportedMediaType() throws Exception {
        mockMvc.perform(post("/reminder/")
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("date=2024-01-01"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.error_code").value("UNSUPPORTED_MEDIA_TYPE"));

        then(reminderService).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("PATCH /reminder/{reminderId} - 지원하지 않는 메서드는 405")
    void patchReminder_MethodNotAllowed() throws Exception {
        mockMvc.perform(patch("/reminder/{reminderId}", REMINDER_ID)
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"T\"}"))
                .andExpect(status().isMethodNotAllowed())
                .andExpect(header().exists("Allow"))
                .andExpect(jsonPath("$.error_code").value("METHOD_NOT_ALLOWED"));

        then(reminderService).shouldHaveNoInteractions();
    }

    // ========================================
    // PUT /reminder/{reminderId} 테스트
    // ========================================

    @Test
    @DisplayName("PUT /reminder/{reminderId} - 리마인더 수정 성공")
    void updateReminder_Success() throws Exception {
        // Given
        ReminderResponse updated = sampleResponse();
        updated.setText("수정된 메모");
        given(reminderService.updateReminder(eq(REMINDER_ID), any(ReminderRequest.class), eq(USER_ID)))
                .willReturn(updated);

        // When & Then
        mockMvc.perform(put("/reminder/{reminderId}", REMINDER_ID)
                        .header("X-User-Id", USER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"date\":\"2024-01-01\",\"text\":\"수정된 메모\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value("수정된 메모"));
    }

    // ========================================
    // DELETE /reminder/{reminderId} 테스트
    // ========================================

    @Test
    @DisplayName("DELETE /reminder/{reminderId} - 리마인더 삭제 성공")
    void deleteReminder_Success() throws Exception {
        mockMvc.perform(delete("/reminder/{reminderId}", REMINDER_ID)
                        .header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isOk());

        then(reminderService).should().deleteReminder(REMINDER_ID, USER_ID);
    }

    @Test
    @DisplayName("DELETE /reminder/{reminderId} - 존재하지 않으면 404")
    void deleteReminder_NotFound() throws Exception {
        // Given
        willThrow(new ReminderNotFoundException("Reminder not found."))
                .given(reminderService).deleteReminder(REMINDER_ID, USER_ID);

        // When & Then
        mockMvc.perform(delete("/reminder/{reminderId}", REMINDER_ID)
                        .header("X-User-Id", USER_ID.toString()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error_message").value("Reminder not found."));
    }

    @Test
    @DisplayName("DELETE /reminder/{reminderId} - 헤더 누락 시 401, 삭제하지 않음")
    void deleteReminder_MissingHeader() throws Exception {
        mockMvc.perform(delete("/reminder/{reminderId}", REMINDER_ID))
                .andExpect(status().isUnauthorized());

        then(reminderService).shouldHaveNoInteractions();
    }
}
