package com.example.skillsmatrix.service;

import com.example.skillsmatrix.bullhorn.BullhornAuthenticator;
import com.example.skillsmatrix.bullhorn.BullhornCandidateUpdater;
import com.example.skillsmatrix.bullhorn.BullhornSession;
import com.example.skillsmatrix.bullhorn.UpdateReport;
import com.example.skillsmatrix.config.SkillsMatrixProperties;
import com.example.skillsmatrix.service.staging.StagingPipeline;
import com.example.skillsmatrix.service.staging.StagingResult;
import com.example.skillsmatrix.service.staging.StagingSettings;
import com.example.skillsmatrix.service.workbook.SurveySheet;
import com.example.skillsmatrix.service.workbook.SurveyWorkbookReader;
import com.example.skillsmatrix.service.workbook.WorkbookReadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SkillsImportService {

    private final SurveyWorkbookReader workbookReader;
    private final StagingPipeline stagingPipeline;
    private final StagingSettings stagingSettings;
    private final BullhornAuthenticator bullhornAuthenticator;
    private final BullhornCandidateUpdater candidateUpdater;
    private final SkillsMatrixProperties properties;

    public StagingResponse stage(MultipartFile file) {
        StagingResult result = readAndStage(file);
        int limit = Math.min(properties.getStaging().getPreviewLimit(), result.records().size());
        List<ProfileView> preview = result.records().subList(0, limit).stream()
                .map(ProfileView::of)
                .toList();
        return new StagingResponse(result.headers(), preview, result.records().size(), result.issues());
    }

    public SyncResult sync(MultipartFile file) {
        StagingResult result = readAndStage(file);

        log.info("Bullhorn Authentication Started.");
        BullhornSession session = bullhornAuthenticator.authenticate();
        log.info("Bullhorn Authentication Complete.");

        UpdateReport report = candidateUpdater.update(result.records(), session);
        return new SyncResult(result.records().size(), result.issues(), report);
    }

    private StagingResult readAndStage(MultipartFile file) {
        SurveySheet sheet;
        try (InputStream input = file.getInputStream()) {
            sheet = workbookReader.read(input);
        } catch (IOException e) {
            throw new WorkbookReadException("Unable to open upload " + file.getOriginalFilename() + ": " + e.getMessage(), e);
        }
        log.info("Staging {} rows from {}", sheet.rows().size(), file.getOriginalFilename());
        return stagingPipeline.stage(sheet.headers(), sheet.rows(), sheet.rowNumbers(), stagingSettings);
    }
}
