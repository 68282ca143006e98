package com.example.skillsmatrix.service.staging;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Column indexes of the seven marker headers that delimit the classification zones.
 */
public record BoundarySet(
        int workExperience,
        int space,
        int aircraftPower,
        int otherStandards,
        int devsecops,
        int otherLanguages,
        int otherTools
) {

    /**
     * Adjacent marker pairs that appear out of zone order, e.g.
     * {@code "Space(4) before Work Experience(6)"}. Empty when the header layout is ordered.
     */
    public List<String> unorderedBoundaries() {
        Map<String, Integer> zones = asMap();
        List<String> violations = new ArrayList<>();
        String previousName = null;
        int previousIndex = -1;
        for (Map.Entry<String, Integer> zone : zones.entrySet()) {
            if (previousName != null && zone.getValue() < previousIndex) {
                violations.add(zone.getKey() + "(" + zone.getValue() + ") before "
                        + previousName + "(" + previousIndex + ")");
            }
            previousName = zone.getKey();
            previousIndex = zone.getValue();
        }
        return violations;
    }

    public boolean isOrdered() {
        return unorderedBoundaries().isEmpty();
    }

    public Map<String, Integer> asMap() {
        Map<String, Integer> zones = new LinkedHashMap<>();
        zones.put(HeaderBoundaryResolver.WORK_EXPERIENCE, workExperience);
        zones.put(HeaderBoundaryResolver.SPACE, space);
        zones.put(HeaderBoundaryResolver.AIRCRAFT_POWER, aircraftPower);
        zones.put(HeaderBoundaryResolver.OTHER_STANDARDS, otherStandards);
        zones.put(HeaderBoundaryResolver.DEVSECOPS, devsecops);
        zones.put(HeaderBoundaryResolver.OTHER_LANGUAGES, otherLanguages);
        zones.put(HeaderBoundaryResolver.OTHER_TOOLS, otherTools);
        return zones;
    }
}
