package com.example.authservice.notification;

import com.example.authservice.entity.User;

/**
 * Outbound channel for account e-mails.
 * Callers treat delivery as fire-and-forget: implementations may throw, callers log and continue.
 */
public interface NotificationSender {

    void sendPasswordReset(User user, String resetToken);

    void sendEmailVerification(User user, String verificationToken);
}
