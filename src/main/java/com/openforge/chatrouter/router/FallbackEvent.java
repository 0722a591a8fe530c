package com.openforge.chatrouter.router;

import java.time.Instant;

/**
 * One candidate visited by the {@link FallbackRouter}.  Observability only;
 * nothing reads these to make routing decisions.
 */
public record FallbackEvent(
        String          requestId,
        String          providerId,
        int             tier,
        FallbackOutcome outcome,
        long            latencyMs,
        Instant         timestamp,
        String          detail
) {}
