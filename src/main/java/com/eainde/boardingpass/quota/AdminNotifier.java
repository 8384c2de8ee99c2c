package com.eainde.boardingpass.quota;

public interface AdminNotifier {

    void sendAlert(String subject, String message);
}
