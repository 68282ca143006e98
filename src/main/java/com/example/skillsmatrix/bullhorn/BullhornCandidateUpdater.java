package com.example.skillsmatrix.bullhorn;

import com.example.skillsmatrix.service.staging.Bucket;
import com.example.skillsmatrix.service.staging.ProfileRecord;
import com.example.skillsmatrix.service.staging.WorkExperience;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes staged profiles onto Bullhorn candidate records. A failed candidate is logged and
 * counted; the remaining candidates are still sent.
 */
@Slf4j
@Component
public class BullhornCandidateUpdater {
    static final String ABSENT = "None";

    private final RestTemplate restTemplate;

    public BullhornCandidateUpdater(@Qualifier("bullhornRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    public UpdateReport update(List<ProfileRecord> records, BullhornSession session) {
        log.info("Starting candidate modifications on Bullhorn.");
        int updated = 0;
        int skipped = 0;
        int failed = 0;
        List<String> missingId = new ArrayList<>();

        for (ProfileRecord record : records) {
            if (ABSENT.equals(record.name()) && ABSENT.equals(record.basic(ProfileRecord.SECONDARY_NAME))) {
                skipped++;
                continue;
            }
            if (ABSENT.equals(record.candidateId()) && !ABSENT.equals(record.name())) {
                log.warn("Employee: {} (NEEDS BULLHORN ID ENTERED)", record.name());
                missingId.add(record.name());
                skipped++;
                continue;
            }

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            try {
                URI uri = candidateUri(session, record.candidateId());
                restTemplate.postForEntity(uri, new HttpEntity<>(candidateFields(record), headers), String.class);
                log.info("Successfully accessed & modified {}'s profile.", record.name());
                updated++;
            } catch (HttpStatusCodeException e) {
                log.error("HTTP {} updating candidate {}: {}", e.getStatusCode().value(),
                        record.candidateId(), e.getResponseBodyAsString());
                failed++;
            } catch (RestClientException e) {
                log.error("Request to update candidate {} failed: {}", record.candidateId(), e.getMessage());
                failed++;
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.error("Cannot address candidate '{}': {}", record.candidateId(), e.getMessage());
                failed++;
            }
        }

        log.info("Candidate modifications on Bullhorn completed: {} updated, {} skipped, {} failed",
                updated, skipped, failed);
        return new UpdateReport(updated, skipped, failed, missingId);
    }

    /**
     * The id is expanded into a single, fully encoded path segment.
     */
    URI candidateUri(BullhornSession session, String candidateId) {
        return UriComponentsBuilder.fromHttpUrl(session.restUrl())
                .pathSegment("entity", "Candidate", "{id}")
                .queryParam("BhRestToken", "{token}")
                .encode()
                .buildAndExpand(candidateId, session.bhRestToken())
                .toUri();
    }

    Map<String, Object> candidateFields(ProfileRecord record) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("customText3", record.basic(ProfileRecord.PROJECT_ROLE));
        data.put("customText31", record.basic(ProfileRecord.OEM_EXPERIENCE));
        data.put("customText21", record.category(Bucket.INDUSTRY_EXPERIENCE));
        data.put("customTextBlock5", record.category(Bucket.DOMAINS));
        data.put("customTextBlock10", record.category(Bucket.STANDARDS));
        data.put("customTextBlock2", record.category(Bucket.SKILLS));
        data.put("customTextBlock6", record.category(Bucket.LANGUAGES));
        data.put("customTextBlock7", record.category(Bucket.TOOLS));
        if (record.workExperience() instanceof WorkExperience.Ordinal ordinal) {
            data.put("customFloat3", ordinal.code());
        }
        return data;
    }
}
