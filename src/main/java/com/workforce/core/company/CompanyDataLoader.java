package com.workforce.core.company;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.workforce.core.model.AgentNode;
import com.workforce.core.model.AgentRole;
import com.workforce.core.registry.AgentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Loads company profiles from {@code <location>/<id>.json}.
 * <p>
 * A file holds a {@code company} section (name, mission, brand_voice, target_audience,
 * philosophy, products), reference sections served by the company tools, and optionally an
 * {@code agents} list and {@code suggested_prompts}. Without {@code agents} the
 * {@link DefaultHierarchy} is used. Profiles are cached; they never change once loaded.
 */
@Service
public class CompanyDataLoader {

    private static final Logger log = LoggerFactory.getLogger(CompanyDataLoader.class);
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_-]+");
    private static final List<String> REFERENCE_SECTIONS = List.of(
            CompanyProfile.MARKET_RESEARCH, CompanyProfile.SEO_DATA, CompanyProfile.BRAND_ASSETS,
            CompanyProfile.CONTENT_TEMPLATES, CompanyProfile.ANALYTICS);

    private final String location;
    private final String defaultCompany;
    private final ObjectMapper objectMapper;
    private final ResourcePatternResolver resolver;

    private final ConcurrentHashMap<String, CompanyProfile> profiles = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<SuggestedPrompt>> extraPrompts = new ConcurrentHashMap<>();

    @Autowired
    public CompanyDataLoader(CompaniesProperties properties, ObjectMapper objectMapper) {
        this(properties.getLocation(), properties.getDefaultCompany(), objectMapper);
    }

    public CompanyDataLoader(String location, String defaultCompany, ObjectMapper objectMapper) {
        this.location = location.endsWith("/") ? location : location + "/";
        this.defaultCompany = defaultCompany;
        this.objectMapper = objectMapper;
        this.resolver = new PathMatchingResourcePatternResolver();
    }

    public String defaultCompanyId() {
        return defaultCompany;
    }

    /**
     * Ids of all available companies, sorted.
     */
    public List<String> companyIds() {
        try {
            Resource[] resources = resolver.getResources(location + "*.json");
            List<String> ids = new ArrayList<>();
            for (Resource resource : resources) {
                String filename = resource.getFilename();
                if (filename != null && filename.endsWith(".json")) {
                    ids.add(filename.substring(0, filename.length() - ".json".length()));
                }
            }
            ids.sort(Comparator.naturalOrder());
            return ids;
        } catch (IOException e) {
            throw new CompanyDataException("Could not list companies at " + location, e);
        }
    }

    /**
     * Companies with their display names. A company whose file cannot be read is listed under its id.
     */
    public List<CompanySummary> listCompanies() {
        List<CompanySummary> companies = new ArrayList<>();
        for (String id : companyIds()) {
            try {
                companies.add(new CompanySummary(id, load(id).name()));
            } catch (CompanyDataException e) {
                log.warn("Company {} could not be loaded: {}", id, e.getMessage());
                companies.add(new CompanySummary(id, id));
            }
        }
        return companies;
    }

    /**
     * @throws CompanyNotFoundException if no data file exists for the id
     * @throws CompanyDataException if the file is unreadable or its hierarchy is invalid
     */
    public CompanyProfile load(String companyId) {
        String id = companyId != null && !companyId.isBlank() ? companyId : defaultCompany;
        if (!VALID_ID.matcher(id).matches()) {
            throw new CompanyNotFoundException(id);
        }
        return profiles.computeIfAbsent(id, this::read);
    }

    public List<SuggestedPrompt> suggestedPrompts(String companyId) {
        CompanyProfile company = load(companyId);
        return SuggestedPrompts.forCompany(company, extraPrompts.getOrDefault(company.id(), List.of()));
    }

    private CompanyProfile read(String id) {
        Resource resource = resolver.getResource(location + id + ".json");
        if (!resource.exists()) {
            throw new CompanyNotFoundException(id);
        }
        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new CompanyDataException("Could not read company data for '" + id + "': " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new CompanyDataException("Company data for '" + id + "' is not a JSON object");
        }

        JsonNode info = root.path("company");
        Map<String, JsonNode> reference = new LinkedHashMap<>();
        for (String section : REFERENCE_SECTIONS) {
            JsonNode node = root.get(section);
            if (node != null && !node.isNull()) {
                reference.put(section, node);
            }
        }

        AgentRegistry registry;
        try {
            registry = AgentRegistry.of(root.has("agents") ? parseAgents(id, root.get("agents")) : DefaultHierarchy.nodes());
        } catch (IllegalArgumentException e) {
            throw new CompanyDataException("Invalid agent hierarchy for '" + id + "': " + e.getMessage(), e);
        }

        if (root.has("suggested_prompts")) {
            extraPrompts.put(id, parsePrompts(id, root.get("suggested_prompts")));
        }

        List<String> products = new ArrayList<>();
        info.path("products").forEach(p -> products.add(p.asText()));
        CompanyProfile profile = new CompanyProfile(
                id,
                info.path("name").asText(id),
                info.path("mission").asText(""),
                info.path("brand_voice").asText(""),
                info.path("target_audience").asText(""),
                info.path("philosophy").asText(""),
                products,
                info.isMissingNode() ? objectMapper.createObjectNode() : info,
                reference,
                registry);
        log.info("Loaded company {} ({}) with {} agents", id, profile.name(), registry.size());
        return profile;
    }

    private List<AgentNode> parseAgents(String id, JsonNode agents) {
        if (!agents.isArray()) {
            throw new CompanyDataException("'agents' for '" + id + "' must be an array");
        }
        List<AgentNode> nodes = new ArrayList<>();
        for (JsonNode a : agents) {
            String agentId = a.path("id").asText(null);
            if (agentId == null || agentId.isBlank()) {
                throw new CompanyDataException("An agent of '" + id + "' has no id");
            }
            AgentRole role;
            try {
                role = AgentRole.fromString(a.path("role").asText(null));
            } catch (IllegalArgumentException e) {
                throw new CompanyDataException("Agent '" + agentId + "' of '" + id + "': " + e.getMessage(), e);
            }
            nodes.add(new AgentNode(
                    agentId,
                    a.path("name").asText(agentId),
                    role,
                    a.path("description").asText(""),
                    strings(a.path("children")),
                    a.hasNonNull("parent") ? a.get("parent").asText() : null,
                    strings(a.path("tools"))));
        }
        return nodes;
    }

    private List<SuggestedPrompt> parsePrompts(String id, JsonNode prompts) {
        try {
            return objectMapper.convertValue(prompts, new TypeReference<List<SuggestedPrompt>>() {});
        } catch (IllegalArgumentException e) {
            throw new CompanyDataException("Invalid suggested_prompts for '" + id + "': " + e.getMessage(), e);
        }
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(n -> values.add(n.asText()));
        return values;
    }
}
