package com.coursereq.api;

import com.coursereq.domain.CatalogModels.CatalogCourse;
import com.coursereq.repository.CatalogJdbcRepository;
import com.coursereq.service.ParseStatisticsService;
import com.coursereq.service.RequirementImportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/catalog")
public class CatalogController {
    private final CatalogJdbcRepository catalogRepository;
    private final RequirementImportService importService;
    private final ParseStatisticsService statisticsService;

    public CatalogController(CatalogJdbcRepository catalogRepository,
                             RequirementImportService importService,
                             ParseStatisticsService statisticsService) {
        this.catalogRepository = catalogRepository;
        this.importService = importService;
        this.statisticsService = statisticsService;
    }

    @GetMapping
    public ResponseEntity<List<CatalogCourse>> catalog() {
        return ResponseEntity.ok(catalogRepository.loadCatalog());
    }

    @PutMapping
    public ResponseEntity<Void> replaceCatalog(@RequestBody List<CatalogCourse> courses) {
        catalogRepository.replaceCatalog(courses);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/process")
    public ResponseEntity<RequirementImportService.BatchSummary> process() {
        return ResponseEntity.ok(importService.processCatalog());
    }

    @PostMapping("/blacklist")
    public ResponseEntity<Boolean> blacklist(@RequestBody BlacklistRequest request) {
        return ResponseEntity.ok(importService.blacklist(request.department(), request.number(), request.reason()));
    }

    @GetMapping("/statistics")
    public ResponseEntity<ParseStatisticsService.ParseStatistics> statistics() {
        return ResponseEntity.ok(statisticsService.statistics());
    }

    public record BlacklistRequest(String department, String number, String reason) {}
}
