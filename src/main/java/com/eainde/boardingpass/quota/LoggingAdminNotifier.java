package com.eainde.boardingpass.quota;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingAdminNotifier implements AdminNotifier {

    @Override
    public void sendAlert(String subject, String message) {
        log.warn("ADMIN ALERT [{}]: {}", subject, message);
    }
}
