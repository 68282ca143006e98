package com.example.skillsmatrix.web;

import com.example.skillsmatrix.service.SkillsImportService;
import com.example.skillsmatrix.service.StagingResponse;
import com.example.skillsmatrix.service.SyncResult;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/skills")
@RequiredArgsConstructor
public class SkillsMatrixController {

    private final SkillsImportService skillsImportService;

    @PostMapping("/stage")
    public StagingResponse stage(@RequestParam("file") MultipartFile file) {
        requireFile(file);
        return skillsImportService.stage(file);
    }

    @PostMapping("/sync")
    public SyncResult sync(@RequestParam("file") MultipartFile file) {
        requireFile(file);
        return skillsImportService.sync(file);
    }

    private void requireFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Survey file must not be empty.");
        }
    }
}
