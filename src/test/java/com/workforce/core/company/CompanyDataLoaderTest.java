package com.workforce.core.company;

import com.workforce.core.model.AgentRole;
import com.workforce.core.model.TaskType;
import com.workforce.core.support.CompanyFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CompanyDataLoaderTest {

    @TempDir
    Path tempDir;

    private CompanyDataLoader loader;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("acme.json"), """
                {
                  "company": {
                    "name": "Acme Tea",
                    "mission": "Tea for everyone",
                    "brand_voice": "Calm",
                    "products": ["Green Tea", "Chai"]
                  },
                  "market_research": {"trends": ["Matcha"]},
                  "analytics": {},
                  "suggested_prompts": [
                    {"label": "Tea Launch", "prompt": "Plan a launch", "complexity": "medium",
                     "task_type": "strategy", "expected_flow": ["Founder"]}
                  ]
                }
                """);
        Files.writeString(tempDir.resolve("startup.json"), """
                {
                  "company": {"name": "Tiny Startup"},
                  "agents": [
                    {"id": "ceo", "name": "CEO", "role": "orchestrator", "children": ["writer", "critic"]},
                    {"id": "writer", "name": "Writer", "role": "worker", "parent": "ceo", "tools": ["get_brand_assets"]},
                    {"id": "critic", "name": "Critic", "role": "reviewer", "parent": "ceo"}
                  ]
                }
                """);
        Files.writeString(tempDir.resolve("broken.json"), "{ not json");
        Files.writeString(tempDir.resolve("orphan.json"), """
                {"company": {"name": "Orphan"},
                 "agents": [{"id": "boss", "role": "orchestrator"}, {"id": "lost", "role": "worker", "parent": "nobody"}]}
                """);
        loader = new CompanyDataLoader("file:" + tempDir.toAbsolutePath() + "/", "acme", CompanyFixtures.objectMapper());
    }

    @Nested
    @DisplayName("listing")
    class ListingTests {

        @Test
        @DisplayName("company ids come from json file names, sorted")
        void companyIds() {
            assertEquals(List.of("acme", "broken", "orphan", "startup"), loader.companyIds());
        }

        @Test
        @DisplayName("unreadable companies are listed under their id")
        void listCompanies() {
            List<CompanySummary> companies = loader.listCompanies();

            assertEquals(4, companies.size());
            assertEquals(new CompanySummary("acme", "Acme Tea"), companies.get(0));
            assertEquals(new CompanySummary("broken", "broken"), companies.get(1));
        }
    }

    @Nested
    @DisplayName("loading")
    class LoadingTests {

        @Test
        @DisplayName("a company without agents gets the default hierarchy")
        void defaultHierarchy() {
            CompanyProfile acme = loader.load("acme");

            assertEquals("Acme Tea", acme.name());
            assertEquals(List.of("Green Tea", "Chai"), acme.products());
            assertEquals(DefaultHierarchy.FOUNDER, acme.registry().orchestrator().id());
            assertTrue(acme.reference(CompanyProfile.MARKET_RESEARCH).isPresent());
            assertTrue(acme.reference(CompanyProfile.ANALYTICS).isEmpty());
            assertTrue(acme.reference(CompanyProfile.SEO_DATA).isEmpty());
        }

        @Test
        @DisplayName("a custom hierarchy is read from the agents list")
        void customHierarchy() {
            CompanyProfile startup = loader.load("startup");

            assertEquals("ceo", startup.registry().orchestrator().id());
            assertEquals(AgentRole.REVIEWER, startup.registry().require("critic").role());
            assertEquals(List.of("get_brand_assets"), startup.registry().require("writer").tools());
        }

        @Test
        @DisplayName("blank id loads the default company; profiles are cached")
        void defaultCompany() {
            assertSame(loader.load("acme"), loader.load(null));
            assertSame(loader.load("acme"), loader.load(" "));
        }

        @Test
        @DisplayName("unknown or malformed ids are not found")
        void notFound() {
            assertThrows(CompanyNotFoundException.class, () -> loader.load("ghost"));
            assertThrows(CompanyNotFoundException.class, () -> loader.load("../acme"));
        }

        @Test
        @DisplayName("invalid json and invalid hierarchies are data errors")
        void dataErrors() {
            assertThrows(CompanyDataException.class, () -> loader.load("broken"));
            var e = assertThrows(CompanyDataException.class, () -> loader.load("orphan"));
            assertTrue(e.getMessage().contains("orphan"));
        }
    }

    @Test
    @DisplayName("suggested prompts include the standard set and the company's own")
    void suggestedPrompts() {
        List<SuggestedPrompt> prompts = loader.suggestedPrompts("acme");

        assertEquals(6, prompts.size());
        assertTrue(prompts.get(0).prompt().contains("Acme Tea"));
        SuggestedPrompt custom = prompts.get(prompts.size() - 1);
        assertEquals("Tea Launch", custom.label());
        assertEquals(TaskType.STRATEGY, custom.taskType());
    }

    @Test
    @DisplayName("bundled companies load from the classpath")
    void bundledCompanies() {
        var bundled = new CompanyDataLoader("classpath:companies/", "solaris", CompanyFixtures.objectMapper());

        assertTrue(bundled.companyIds().containsAll(List.of("promptsmint", "solaris")));
        assertEquals("founder", bundled.load("promptsmint").registry().orchestrator().id());
        assertEquals(DefaultHierarchy.FOUNDER, bundled.load(null).registry().orchestrator().id());
    }
}
