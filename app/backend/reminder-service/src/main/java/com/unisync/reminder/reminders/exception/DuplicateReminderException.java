package com.unisync.reminder.reminders.exception;

public class DuplicateReminderException extends RuntimeException {
    public DuplicateReminderException(String message) {
        super(message);
    }
}
