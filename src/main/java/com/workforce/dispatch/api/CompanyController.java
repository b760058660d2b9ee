package com.workforce.dispatch.api;

import com.workforce.core.company.CompanyDataLoader;
import com.workforce.core.company.CompanyNotFoundException;
import com.workforce.core.company.CompanyProfile;
import com.workforce.core.model.AgentNode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read-only endpoints over the loaded company data.
 */
@RestController
@RequestMapping("/api/v1/companies")
public class CompanyController {

    private final CompanyDataLoader companies;

    public CompanyController(CompanyDataLoader companies) {
        this.companies = companies;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> listCompanies() {
        return ResponseEntity.ok(Map.of(
                "companies", companies.listCompanies(),
                "default", companies.defaultCompanyId()));
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getCompany(@PathVariable String id) {
        try {
            CompanyProfile company = companies.load(id);
            return ResponseEntity.ok(company.info());
        } catch (CompanyNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * GET /api/v1/companies/{id}/agents: The agent hierarchy, flat and as a tree keyed by id.
     */
    @GetMapping("/{id}/agents")
    public ResponseEntity<?> getAgents(@PathVariable String id) {
        CompanyProfile company;
        try {
            company = companies.load(id);
        } catch (CompanyNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        }

        List<Map<String, Object>> agents = new ArrayList<>();
        Map<String, Object> hierarchy = new LinkedHashMap<>();
        for (AgentNode node : company.registry().agents()) {
            Map<String, Object> agent = new LinkedHashMap<>();
            agent.put("id", node.id());
            agent.put("name", node.displayName());
            agent.put("role", node.role().name().toLowerCase(Locale.ROOT));
            agent.put("description", node.description());
            agent.put("tools", node.tools());
            agents.add(agent);

            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", node.displayName());
            entry.put("children", node.children());
            if (node.parent() != null) {
                entry.put("parent", node.parent());
            }
            hierarchy.put(node.id(), entry);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("company_id", company.id());
        body.put("entry_point", company.registry().orchestrator().id());
        body.put("agents", agents);
        body.put("hierarchy", hierarchy);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{id}/suggested-prompts")
    public ResponseEntity<?> getSuggestedPrompts(@PathVariable String id) {
        try {
            return ResponseEntity.ok(Map.of(
                    "company_id", id,
                    "prompts", companies.suggestedPrompts(id)));
        } catch (CompanyNotFoundException e) {
            return ResponseEntity.status(404).body(Map.of("error", e.getMessage()));
        }
    }
}
