package com.coursereq.api;

import com.coursereq.domain.CatalogModels.CatalogCourse;
import com.coursereq.domain.CatalogModels.StoredCourseRequirements;
import com.coursereq.domain.CourseNotFoundException;
import com.coursereq.domain.RequirementModels.ParsedCourseRequirements;
import com.coursereq.domain.RequirementModels.RequirementNode;
import com.coursereq.format.RequirementPrinter;
import com.coursereq.repository.RequirementJdbcRepository;
import com.coursereq.service.RequirementImportService;
import com.coursereq.validation.RequirementSchemaValidator;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/requirements")
public class RequirementController {
    private final RequirementSchemaValidator validator;
    private final RequirementImportService importService;
    private final RequirementJdbcRepository repository;
    private final RequirementPrinter printer;

    public RequirementController(RequirementSchemaValidator validator,
                                 RequirementImportService importService,
                                 RequirementJdbcRepository repository,
                                 RequirementPrinter printer) {
        this.validator = validator;
        this.importService = importService;
        this.repository = repository;
        this.printer = printer;
    }

    @PostMapping("/validate")
    public ResponseEntity<RequirementSchemaValidator.ValidationResult> validate(@RequestBody JsonNode candidate) {
        return ResponseEntity.ok(validator.validate(candidate));
    }

    @PostMapping("/import")
    public ResponseEntity<RequirementImportService.ImportResult> importCandidate(@RequestBody ImportRequest request) {
        return ResponseEntity.ok(importService.importCandidate(request.course(), request.candidate()));
    }

    @GetMapping
    public ResponseEntity<List<StoredCourseRequirements>> list() {
        return ResponseEntity.ok(repository.loadAll());
    }

    @GetMapping("/{department}/{number}")
    public ResponseEntity<RequirementView> get(@PathVariable String department, @PathVariable String number) {
        StoredCourseRequirements stored = repository.find(department, number)
                .orElseThrow(() -> new CourseNotFoundException(department + " " + number));
        return ResponseEntity.ok(new RequirementView(stored, readable(stored.requirements())));
    }

    private Map<String, String> readable(ParsedCourseRequirements req) {
        Map<String, String> text = new LinkedHashMap<>();
        put(text, "prerequisite", req.prerequisite());
        put(text, "corequisite", req.corequisite());
        put(text, "recommended_prerequisite", req.recommendedPrerequisite());
        put(text, "recommended_corequisite", req.recommendedCorequisite());
        return text;
    }

    private void put(Map<String, String> text, String field, RequirementNode node) {
        if (node != null) text.put(field, printer.readable(node));
    }

    public record ImportRequest(CatalogCourse course, JsonNode candidate) {}

    public record RequirementView(StoredCourseRequirements stored, Map<String, String> readable) {}
}
