package com.polyhunter.bounty.notification;

import java.util.Map;
import java.util.UUID;

/**
 * Receives contributor-visible activity notices. Fire-and-forget: implementations must not throw
 * back into the caller.
 */
public interface ActivityNotifier {

    String SUBMISSION_ACCEPTED = "submission_accepted";
    String SUBMISSION_REJECTED = "submission_rejected";
    String SUBMISSION_REVISION_REQUESTED = "submission_revision_requested";

    void notify(UUID contributorId, String eventKind, String message, Map<String, Object> context);
}
