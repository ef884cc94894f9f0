package ch.so.arp.rag.hybrid.web;

import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;

import ch.so.arp.rag.hybrid.authority.AuthorityCalculator;
import ch.so.arp.rag.hybrid.authority.AuthorityScore;
import ch.so.arp.rag.hybrid.authority.FeedbackLevel;
import ch.so.arp.rag.hybrid.authority.UserAuthority;

/**
 * Authority lookup per user, level and domain, plus registration of baseline
 * credentials.
 */
@RestController
@RequestMapping(path = "/api/authority", produces = MediaType.APPLICATION_JSON_VALUE)
@Validated
public class AuthorityController {

    private final AuthorityCalculator authorityCalculator;

    public AuthorityController(AuthorityCalculator authorityCalculator) {
        this.authorityCalculator = authorityCalculator;
    }

    @GetMapping("/{userId}")
    public AuthorityScore authority(@PathVariable String userId,
            @RequestParam(defaultValue = "RETRIEVAL") FeedbackLevel level,
            @RequestParam(required = false) String domain) {
        return authorityCalculator.describe(userId, level, domain);
    }

    @PutMapping(path = "/{userId}/baseline", consumes = MediaType.APPLICATION_JSON_VALUE)
    public UserAuthority baseline(@PathVariable String userId, @Valid @RequestBody BaselineRequest request) {
        return authorityCalculator.registerBaseline(userId, request.baselineCredential());
    }
}
