package com.workforce.dispatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.workforce.core.artifacts.ArtifactReplayer;
import com.workforce.core.artifacts.ArtifactStore;
import com.workforce.core.company.CompanyDataLoader;
import com.workforce.core.cost.CostEstimator;
import com.workforce.core.cost.PricingProperties;
import com.workforce.core.engine.RunIdGenerator;
import com.workforce.core.engine.SessionProperties;
import com.workforce.core.engine.WorkforceEngine;
import com.workforce.core.events.EventBus;
import com.workforce.core.metrics.WorkforceMetrics;
import com.workforce.core.protocol.MessageCodec;
import com.workforce.core.protocol.MessageKind;
import com.workforce.core.support.CompanyFixtures;
import com.workforce.core.support.ScriptedAgentExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the workforce CLI command structure.
 * These tests exercise picocli directly without a Spring context, backed by the
 * bundled company files, scripted agents and a temporary artifact directory.
 */
class CliTest {

    @TempDir
    Path tempDir;

    private record CliResult(int exitCode, String output) {}

    private ObjectMapper mapper;
    private CompanyDataLoader companies;
    private ArtifactStore artifactStore;
    private ScriptedAgentExecutor executor;

    @BeforeEach
    void setUp() {
        mapper = CompanyFixtures.objectMapper();
        companies = new CompanyDataLoader("classpath:companies/", "solaris", mapper);
        artifactStore = new ArtifactStore(tempDir, true, mapper);
        executor = new ScriptedAgentExecutor();
    }

    private WorkforceEngine engine() {
        return new WorkforceEngine(
                companies,
                new SessionProperties(),
                new RunIdGenerator(Clock.systemUTC(), new Random(7)),
                executor,
                new MessageCodec(mapper),
                artifactStore,
                new CostEstimator(new PricingProperties()),
                new EventBus(),
                new WorkforceMetrics(new SimpleMeterRegistry()),
                Clock.systemUTC());
    }

    /**
     * Custom picocli IFactory that wires commands to the test collaborators.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ChatCommand.class) {
                    return (K) new ChatCommand(engine());
                }
                if (cls == CompaniesCommand.class) {
                    return (K) new CompaniesCommand(companies);
                }
                if (cls == AgentsCommand.class) {
                    return (K) new AgentsCommand(companies);
                }
                if (cls == PromptsCommand.class) {
                    return (K) new PromptsCommand(companies);
                }
                if (cls == RunsCommand.class) {
                    return (K) new RunsCommand(artifactStore);
                }
                if (cls == ShowRunCommand.class) {
                    return (K) new ShowRunCommand(artifactStore, new ArtifactReplayer(artifactStore));
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new WorkforceCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private void scriptResearchRun() {
        executor.handoff("founder", "market_researcher", MessageKind.TASK, "Find coffee trends")
                .handoff("market_researcher", "founder", MessageKind.RESULT, "Cold brew keeps growing")
                .answer("founder", "Cold brew is the trend to watch.");
    }

    // =====================================================================
    //  Help output
    // =====================================================================

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            for (String sub : new String[] {"companies", "agents", "prompts", "chat", "runs", "run", "serve", "help"}) {
                assertTrue(result.output().contains(sub), "Help should list '" + sub + "'");
            }
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Workforce 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints the banner and usage")
        void noArguments() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("WORKFORCE v0.1.0"));
            assertTrue(result.output().contains("Usage: workforce"));
        }

        @Test
        @DisplayName("unknown subcommand fails")
        void unknownSubcommand() {
            CliResult result = execute("launch");
            assertNotEquals(0, result.exitCode());
        }
    }

    // =====================================================================
    //  Company data commands
    // =====================================================================

    @Nested
    @DisplayName("companies, agents, prompts")
    class CompanyCommandTests {

        @Test
        @DisplayName("companies lists bundled companies and marks the default")
        void companies() {
            CliResult result = execute("companies");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("promptsmint"));
            assertTrue(result.output().contains("Solaris Coffee Roasters (default)"));
        }

        @Test
        @DisplayName("agents prints the default hierarchy as a tree")
        void agentsDefault() {
            CliResult result = execute("agents");
            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("(7 agents)"));
            assertTrue(output.contains("founder"));
            assertTrue(output.contains("[Orchestrator]"));
            assertTrue(output.indexOf("marketing_head") < output.indexOf("content_creator"));
        }

        @Test
        @DisplayName("agents prints a custom hierarchy from the company file")
        void agentsCustom() {
            CliResult result = execute("agents", "promptsmint");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("tech_lead"));
            assertFalse(result.output().contains("seo_analyst"));
        }

        @Test
        @DisplayName("agents reports an unknown company")
        void agentsUnknown() {
            CliResult result = execute("agents", "ghost");
            assertTrue(result.output().contains("Company 'ghost' not found"));
        }

        @Test
        @DisplayName("prompts lists suggested prompts with their expected flow")
        void prompts() {
            CliResult result = execute("prompts", "solaris");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("flow: "));
            assertTrue(result.output().contains("research"));
        }
    }

    // =====================================================================
    //  chat
    // =====================================================================

    @Nested
    @DisplayName("chat")
    class ChatTests {

        @Test
        @DisplayName("a completed run prints handoffs and the answer and exits 0")
        void completedRun() {
            scriptResearchRun();

            CliResult result = execute("chat", "Research coffee trends");

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("founder -> market_researcher (task)"));
            assertTrue(output.contains("Cold brew is the trend to watch."));
            assertTrue(output.contains("Artifacts saved to"));
            assertTrue(output.contains("Tokens: 300 in"));
        }

        @Test
        @DisplayName("a failed run prints the error and exits 1")
        void failedRun() {
            executor.fail("founder", new IllegalStateException("model unavailable"));

            CliResult result = execute("chat", "Research coffee trends");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("execution"));
            assertTrue(result.output().contains("model unavailable"));
        }

        @Test
        @DisplayName("an invalid task type exits 2 without running")
        void invalidTaskType() {
            CliResult result = execute("chat", "--task-type", "poetry", "Write a poem");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Invalid task type: poetry"));
            assertTrue(executor.turns().isEmpty());
        }

        @Test
        @DisplayName("an unknown company exits 2")
        void unknownCompany() {
            CliResult result = execute("chat", "-c", "ghost", "Hello");

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Company 'ghost' not found"));
        }

        @Test
        @DisplayName("a missing goal is a usage error")
        void missingGoal() {
            CliResult result = execute("chat");
            assertNotEquals(0, result.exitCode());
        }
    }

    // =====================================================================
    //  Stored runs
    // =====================================================================

    @Nested
    @DisplayName("runs and run")
    class StoredRunTests {

        @Test
        @DisplayName("runs reports an empty artifact directory")
        void noRuns() {
            CliResult result = execute("runs");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("No runs found"));
        }

        @Test
        @DisplayName("runs lists a completed chat run")
        void listsRun() {
            scriptResearchRun();
            execute("chat", "Research coffee trends");

            CliResult result = execute("runs");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Runs (1):"));
            assertTrue(result.output().contains("COMPLETED"));
            assertTrue(result.output().contains("Research coffee trends"));
        }

        @Test
        @DisplayName("run shows the trace, handoffs and response of a run by prefix")
        void showsRun() {
            scriptResearchRun();
            execute("chat", "Research coffee trends");
            String runId = artifactStore.listRuns(1).get(0).runId();

            CliResult result = execute("run", runId.substring(0, 20));

            assertEquals(0, result.exitCode());
            String output = result.output();
            assertTrue(output.contains("RUN " + runId));
            assertTrue(output.contains("Company:    solaris"));
            assertTrue(output.contains("HANDOFFS:"));
            assertTrue(output.contains("market_researcher"));
            assertTrue(output.contains("Cold brew is the trend to watch."));
        }

        @Test
        @DisplayName("run reports an unknown id")
        void unknownRun() {
            CliResult result = execute("run", "nope");
            assertTrue(result.output().contains("Run not found: nope"));
        }
    }
}
