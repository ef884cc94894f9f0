package ch.so.arp.rag.hybrid.web;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;

public record BaselineRequest(@NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double baselineCredential) {
}
