package ch.so.arp.rag.hybrid.web;

import java.time.Clock;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.rag.hybrid.learning.DecayReport;
import ch.so.arp.rag.hybrid.learning.TemporalDecayManager;

/**
 * Manual trigger of a decay sweep, independent of the schedule.
 */
@RestController
@RequestMapping(path = "/api/decay", produces = MediaType.APPLICATION_JSON_VALUE)
public class DecayController {

    private final TemporalDecayManager decayManager;
    private final Clock clock;

    public DecayController(TemporalDecayManager decayManager, Clock clock) {
        this.decayManager = decayManager;
        this.clock = clock;
    }

    @PostMapping("/sweep")
    public DecayReport sweep() {
        return decayManager.sweep(clock.instant());
    }
}
