package com.chicu.marketpulse.alert;

public class AlertNotFoundException extends RuntimeException {

    public AlertNotFoundException(long id) {
        super("Alert not found: " + id);
    }
}
