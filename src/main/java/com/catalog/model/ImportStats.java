package com.catalog.model;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Data;

/**
 * Counters describing one import run, plus every item that was skipped along the way.
 */
@Data
public class ImportStats {
    private UUID serviceId;
    private String serviceName;
    private String serviceVersion;
    private int importedSchemas;
    private int importedAttributes;
    private int importedEndpoints;
    private int importedParameters;
    private int importedResponses;
    private int linkedSchemas;
    private List<SkippedItemWarning> warnings = new ArrayList<>();

    public int getSkippedItems() {
        return warnings.size();
    }

    public void skip(SkippedItemWarning warning) {
        warnings.add(warning);
    }

    public void incrementEndpoints() {
        importedEndpoints++;
    }

    public void incrementParameters() {
        importedParameters++;
    }

    public void incrementResponses() {
        importedResponses++;
    }

    public void incrementLinkedSchemas() {
        linkedSchemas++;
    }

    public String summary() {
        return String.format("%d schemas (%d attributes), %d endpoints, %d parameters, %d responses, %d schema links, %d skipped",
                importedSchemas, importedAttributes, importedEndpoints, importedParameters, importedResponses,
                linkedSchemas, getSkippedItems());
    }
}
