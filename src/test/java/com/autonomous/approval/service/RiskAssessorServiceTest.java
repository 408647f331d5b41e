package com.autonomous.approval.service;

import com.autonomous.approval.model.RiskLevel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RiskAssessorServiceTest {

    @TempDir
    Path tempDir;

    private RiskAssessorService assessor;

    @BeforeEach
    void setUp() {
        assessor = new RiskAssessorService();
        assessor.setRulesPath(tempDir.resolve("missing.yaml").toString());
        assessor.loadRules();
    }

    @Test
    void shouldFallBackToBundledRules() {
        assertTrue(assessor.getRuleCount() > 0);
    }

    @Test
    void shouldScoreKnownCommands() {
        assertEquals(RiskLevel.CRITICAL, assessor.assess("rm -rf /var/lib/data", Map.of()));
        assertEquals(RiskLevel.CRITICAL, assessor.assess("psql -c 'DROP TABLE users'", Map.of()));
        assertEquals(RiskLevel.HIGH, assessor.assess("sudo systemctl restart nginx", Map.of()));
        assertEquals(RiskLevel.HIGH, assessor.assess("chmod 777 deploy.sh", Map.of()));
        assertEquals(RiskLevel.MEDIUM, assessor.assess("npm install left-pad", Map.of()));
        assertEquals(RiskLevel.LOW, assessor.assess("git status", Map.of()));
        assertEquals(RiskLevel.LOW, assessor.assess("ls -la", Map.of()));
    }

    @Test
    void shouldUseDefaultWhenNothingMatches() {
        assertEquals(RiskLevel.MEDIUM, assessor.assess("./gradlew build", Map.of()));
    }

    @Test
    void shouldPickHighestMatchingLevel() {
        assertEquals(RiskLevel.CRITICAL, assessor.assess("ls && rm -rf build", Map.of()));
    }

    @Test
    void shouldLetExplicitRiskWin() {
        assertEquals(RiskLevel.HIGH, assessor.assess("rm -rf /tmp/x", Map.of("risk", "high")));
        assertEquals(RiskLevel.LOW, assessor.assess("sudo reboot", Map.of("risk", "LOW")));
    }

    @Test
    void shouldIgnoreUnknownExplicitRisk() {
        assertEquals(RiskLevel.HIGH, assessor.assess("sudo reboot", Map.of("risk", "spicy")));
    }

    @Test
    void shouldLoadRulesFromConfiguredFile() throws IOException {
        Path rules = tempDir.resolve("rules.yaml");
        Files.writeString(rules, String.join("\n",
            "default_level: low",
            "rules:",
            "  - pattern: 'terraform\\s+apply'",
            "    level: critical",
            "  - pattern: '('",
            "    level: high",
            "  - pattern: 'kubectl'",
            "    level: extreme",
            ""));
        assessor.setRulesPath(rules.toString());

        assessor.loadRules();

        assertEquals(1, assessor.getRuleCount());
        assertEquals(RiskLevel.CRITICAL, assessor.assess("terraform apply -auto-approve", Map.of()));
        assertEquals(RiskLevel.LOW, assessor.assess("rm -rf /", Map.of()));
    }
}
