package ch.so.arp.rag.hybrid.web;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import ch.so.arp.rag.hybrid.NotFoundException;
import ch.so.arp.rag.hybrid.parameter.ParameterChange;
import ch.so.arp.rag.hybrid.parameter.ParameterSnapshot;
import ch.so.arp.rag.hybrid.parameter.ParameterStore;
import ch.so.arp.rag.hybrid.parameter.ParameterWriter;
import ch.so.arp.rag.hybrid.parameter.VersionedParameter;

/**
 * Read access to the learned parameters, their change log and rollback.
 */
@RestController
@RequestMapping(path = "/api/parameters", produces = MediaType.APPLICATION_JSON_VALUE)
public class ParameterController {

    private final ParameterStore parameterStore;
    private final ParameterWriter parameterWriter;

    public ParameterController(ParameterStore parameterStore, ParameterWriter parameterWriter) {
        this.parameterStore = parameterStore;
        this.parameterWriter = parameterWriter;
    }

    @GetMapping
    public ParameterSnapshot snapshot() {
        return parameterStore.snapshot();
    }

    @GetMapping("/history")
    public List<ParameterChange> history(@RequestParam String key) {
        if (parameterStore.find(key).isEmpty()) {
            throw new NotFoundException("Unknown parameter '" + key + "'");
        }
        return parameterStore.history(key);
    }

    @PostMapping("/rollback")
    public VersionedParameter rollback(@RequestParam String key, @RequestParam long version) {
        return parameterWriter.rollback(key, version);
    }
}
