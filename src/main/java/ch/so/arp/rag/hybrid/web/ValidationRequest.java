package ch.so.arp.rag.hybrid.web;

import java.util.Map;

import jakarta.validation.constraints.NotEmpty;

import ch.so.arp.rag.hybrid.authority.FeedbackLevel;

/**
 * Consensus verdict per level for an accepted feedback event.
 */
public record ValidationRequest(@NotEmpty Map<FeedbackLevel, Boolean> confirmed) {
}
