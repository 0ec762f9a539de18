package com.crave.search.ondemand;

import com.crave.search.collection.QueueDepth;

public record AdmissionDecision(boolean runNow, DeferReason deferReason, QueueDepth snapshot) {

    public static AdmissionDecision admit(QueueDepth snapshot) {
        return new AdmissionDecision(true, null, snapshot);
    }

    public static AdmissionDecision defer(DeferReason reason) {
        return new AdmissionDecision(false, reason, null);
    }

    public static AdmissionDecision defer(DeferReason reason, QueueDepth snapshot) {
        return new AdmissionDecision(false, reason, snapshot);
    }
}
