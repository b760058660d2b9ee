package com.workforce.dispatch.api;

import com.workforce.core.artifacts.ArtifactStore;
import com.workforce.core.company.CompanyDataLoader;
import com.workforce.core.company.CompanyDataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for system health status.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);

    private final CompanyDataLoader companies;
    private final ArtifactStore artifactStore;

    public HealthController(CompanyDataLoader companies, ArtifactStore artifactStore) {
        this.companies = companies;
        this.artifactStore = artifactStore;
    }

    /**
     * GET /api/v1/health: Returns 200 if all components are UP, 503 if any is DOWN.
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> components = new LinkedHashMap<>();

        boolean companiesUp;
        String companiesDetail;
        try {
            int count = companies.companyIds().size();
            companiesUp = count > 0;
            companiesDetail = count + " companies available";
        } catch (CompanyDataException e) {
            log.warn("Company data check failed: {}", e.getMessage());
            companiesUp = false;
            companiesDetail = e.getMessage();
        }
        components.put("companies", component(companiesUp, companiesDetail));

        boolean artifactsUp = !artifactStore.isEnabled()
                || !Files.exists(artifactStore.baseDir())
                || Files.isWritable(artifactStore.baseDir());
        String artifactsDetail = artifactStore.isEnabled()
                ? artifactStore.baseDir().toAbsolutePath().toString()
                : "disabled";
        components.put("artifacts", component(artifactsUp, artifactsDetail));

        boolean allUp = companiesUp && artifactsUp;
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", allUp ? "UP" : "DOWN");
        result.put("components", components);
        return allUp ? ResponseEntity.ok(result) : ResponseEntity.status(503).body(result);
    }

    private static Map<String, String> component(boolean up, String detail) {
        Map<String, String> info = new LinkedHashMap<>();
        info.put("status", up ? "UP" : "DOWN");
        info.put("detail", detail);
        return info;
    }
}
