package com.example.authservice.notification;

import com.example.authservice.entity.User;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Default sender: writes the link to the log instead of mailing it.
 * The token is masked so full tokens never reach log files.
 */
@Slf4j
@Component
public class LoggingNotificationSender implements NotificationSender {

    private final String frontendBaseUrl;

    public LoggingNotificationSender(@Value("${app.frontend.base-url:http://localhost:3000}") String frontendBaseUrl) {
        this.frontendBaseUrl = frontendBaseUrl.endsWith("/")
                ? frontendBaseUrl.substring(0, frontendBaseUrl.length() - 1)
                : frontendBaseUrl;
    }

    @Override
    public void sendPasswordReset(User user, String resetToken) {
        log.info("Password reset link for {}: {}/reset-password?token={}",
                user.getEmail(), frontendBaseUrl, mask(resetToken));
    }

    @Override
    public void sendEmailVerification(User user, String verificationToken) {
        log.info("Email verification link for {}: {}/verify-email?token={}",
                user.getEmail(), frontendBaseUrl, mask(verificationToken));
    }

    static String mask(String token) {
        if (token == null || token.length() <= 12) {
            return "***";
        }
        return token.substring(0, 6) + "..." + token.substring(token.length() - 6);
    }
}
