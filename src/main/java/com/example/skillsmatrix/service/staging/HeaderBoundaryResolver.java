package com.example.skillsmatrix.service.staging;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class HeaderBoundaryResolver {
    public static final String WORK_EXPERIENCE = "Work Experience";
    public static final String SPACE = "Space";
    public static final String AIRCRAFT_POWER = "Aircraft Power Generation";
    public static final String OTHER_STANDARDS = "Other Standards";
    public static final String DEVSECOPS = "DevSecOps";
    public static final String OTHER_LANGUAGES = "Other Languages";
    public static final String OTHER_TOOLS = "Other Tools";

    static final List<String> REQUIRED_HEADERS = List.of(
            WORK_EXPERIENCE, SPACE, AIRCRAFT_POWER, OTHER_STANDARDS, DEVSECOPS, OTHER_LANGUAGES, OTHER_TOOLS
    );

    /**
     * Looks up every marker header by exact name. The first occurrence wins when a name repeats.
     *
     * @throws MissingHeaderException listing every marker header that is absent
     */
    public BoundarySet resolve(List<String> headers) {
        if (headers == null) {
            throw new MissingHeaderException(REQUIRED_HEADERS);
        }
        List<String> missing = new ArrayList<>();
        int[] indexes = new int[REQUIRED_HEADERS.size()];
        for (int i = 0; i < REQUIRED_HEADERS.size(); i++) {
            String name = REQUIRED_HEADERS.get(i);
            indexes[i] = headers.indexOf(name);
            if (indexes[i] < 0) {
                missing.add(name);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingHeaderException(missing);
        }
        return new BoundarySet(indexes[0], indexes[1], indexes[2], indexes[3], indexes[4], indexes[5], indexes[6]);
    }
}
