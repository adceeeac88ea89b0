package com.sourcesurvey.surveyor;

import com.sourcesurvey.surveyor.config.SurveyConfigReader;
import com.sourcesurvey.surveyor.driver.SurveyException;
import com.sourcesurvey.surveyor.driver.SurveyReport;
import com.sourcesurvey.surveyor.report.Category;
import com.sourcesurvey.surveyor.report.HumanReportFormatter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SurveyMainTest {

    private static final String FIXTURES = SourceFixtures.SURVEY_PACKAGES.toString();

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private void assertUsage(String expectedMessage, String... args) {
        SurveyMain.UsageException e = assertThrows(SurveyMain.UsageException.class, () -> SurveyMain.run(args, out));
        assertTrue(e.getMessage().contains(expectedMessage), e.getMessage());
    }

    @Test
    void missingCommand() {
        assertUsage("No command specified");
    }

    @Test
    void unknownCommand() {
        assertUsage("Unknown command: lint", "lint", FIXTURES);
    }

    @Test
    void unknownFlag() {
        assertUsage("Unknown flag: --fast", "all", "--fast", FIXTURES);
    }

    @Test
    void missingPath() {
        assertUsage("At least one path is required", "tearoffs", "--verbose");
    }

    @Test
    void flagWithoutValue() {
        assertUsage("--limit requires an argument", "all", "--limit");
    }

    @Test
    void badIntegers() {
        assertUsage("expects an integer", "all", "--limit", "few", FIXTURES);
        assertUsage("must be >= 0", "all", "--max-examples", "-1", FIXTURES);
    }

    @Test
    void skipAndForceConflict() {
        assertUsage("mutually exclusive", "all", "--skip-install", "--force-install", FIXTURES);
    }

    @Test
    void fullRunPrintsCategoriesAndStats() {
        SurveyReport report = SurveyMain.run(new String[]{"all", "--max-examples", "1", FIXTURES}, out);

        assertEquals(2, report.count(Category.TYPE_LITERAL));
        String text = output();
        assertTrue(text.contains("Recursing into '" + FIXTURES + "'..."), text);
        assertTrue(text.contains("(Found 5 subdirectories.)"), text);
        assertTrue(text.contains("Analyzing 'survey-packages/shapes' • [4/5]..."), text);
        assertTrue(text.contains("***** Found 2 type literals"), text);
        assertTrue(text.contains("  ... and 1 more"), text);
        assertTrue(text.contains("1 error and"), text);
        assertTrue(text.contains("(2 packages skipped)."), text);
        assertTrue(text.contains("(Elapsed time: "), text);
    }

    @Test
    void configFileIsOverriddenByFlags(@TempDir Path tmp) throws IOException {
        Path config = tmp.resolve("survey.json");
        Files.writeString(config, "{ \"package_limit\": 1, \"excludes\": [\"broken\"] }");

        SurveyReport fromFile = SurveyMain.run(new String[]{"tearoffs", "--config", config.toString(), FIXTURES}, out);
        assertEquals(4, fromFile.packagesDiscovered());
        assertEquals(1, fromFile.packagesAnalyzed());

        SurveyReport overridden = SurveyMain.run(
                new String[]{"tearoffs", "--config", config.toString(), "--limit", "0", FIXTURES}, out);
        assertEquals(4, overridden.packagesAnalyzed());
        assertEquals(2, overridden.count(Category.TYPE_LITERAL));
    }

    @Test
    void skipFlagOverridesForceFromConfigFile(@TempDir Path tmp) throws IOException {
        Path config = tmp.resolve("survey.json");
        Files.writeString(config, "{ \"force_install\": true, \"excludes\": [\"broken\", \"diagnostics\"] }");

        SurveyReport report = SurveyMain.run(new String[]{
                "tearoffs", "--config", config.toString(), "--skip-install", FIXTURES}, out);

        assertEquals(3, report.packagesAnalyzed());
        assertEquals(1, report.packagesSkipped());
        assertEquals(2, report.count(Category.TYPE_LITERAL));
    }

    @Test
    void reportStreamWritesUtf8Separators() {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream stream = SurveyMain.reportStream(bytes);

        new HumanReportFormatter(stream, false).reportProgress("p", 1, 1);

        assertEquals("Analyzing 'p' \u2022 [1/1]...", bytes.toString(StandardCharsets.UTF_8).stripTrailing());
        byte[] raw = bytes.toByteArray();
        assertEquals((byte) 0xE2, raw[14]);
        assertEquals((byte) 0x80, raw[15]);
        assertEquals((byte) 0xA2, raw[16]);
    }

    @Test
    void unreadableConfigFails(@TempDir Path tmp) {
        assertThrows(SurveyConfigReader.ConfigReadException.class, () -> SurveyMain.run(
                new String[]{"all", "--config", tmp.resolve("missing.json").toString(), FIXTURES}, out));
    }

    @Test
    void nothingToSurveyFails(@TempDir Path tmp) {
        assertThrows(SurveyException.class, () -> SurveyMain.run(new String[]{"all", tmp.toString()}, out));
    }
}
