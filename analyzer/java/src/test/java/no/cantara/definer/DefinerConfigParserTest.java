package no.cantara.definer;

import no.cantara.definer.FreeVariableAnalyzer.Mode;
import no.cantara.definer.model.Unit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static no.cantara.definer.model.CoreExpr.app;
import static no.cantara.definer.model.CoreExpr.id;
import static no.cantara.definer.model.Representation.object;
import static org.junit.jupiter.api.Assertions.*;

class DefinerConfigParserTest {

    private static final Map<String, Object> COMPLETE = Map.of(
            "mode", "lenient",
            "max_depth", 64,
            "standard_globals", false,
            "globals", List.of("my-helper", "other")
    );

    private static Map<String, Object> completeWith(String key, Object value) {
        Map<String, Object> m = new HashMap<>(COMPLETE);
        m.put(key, value);
        return m;
    }

    // -----------------------------------------------------------------------
    // Parsing
    // -----------------------------------------------------------------------

    @Test
    void emptyMapGivesDefaults() {
        DefinerConfig config = DefinerConfigParser.fromMap(Map.of());
        assertEquals(DefinerConfig.defaults(), config);
        assertEquals(Mode.STRICT, config.mode());
        assertEquals(FreeVariableAnalyzer.DEFAULT_MAX_DEPTH, config.maxDepth());
        assertTrue(config.standardGlobals());
        assertTrue(config.globals().isEmpty());
    }

    @Test
    void parsesCompleteConfig() {
        DefinerConfig config = DefinerConfigParser.fromMap(COMPLETE);
        assertEquals(Mode.LENIENT, config.mode());
        assertEquals(64, config.maxDepth());
        assertFalse(config.standardGlobals());
        assertEquals(List.of("my-helper", "other"), config.globals());
    }

    @Test
    void modeIsCaseInsensitive() {
        assertEquals(Mode.STRICT, DefinerConfigParser.fromMap(completeWith("mode", "STRICT")).mode());
    }

    @Test
    void rejectsUnknownMode() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DefinerConfigParser.fromMap(completeWith("mode", "sloppy")));
        assertTrue(e.getMessage().contains("mode"));
    }

    @Test
    void rejectsNonPositiveDepth() {
        assertThrows(IllegalArgumentException.class,
                () -> DefinerConfigParser.fromMap(completeWith("max_depth", 0)));
    }

    @Test
    void rejectsNonIntegerDepth() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DefinerConfigParser.fromMap(completeWith("max_depth", "deep")));
        assertTrue(e.getMessage().contains("max_depth"));
    }

    @Test
    void rejectsNonStringGlobal() {
        assertThrows(IllegalArgumentException.class,
                () -> DefinerConfigParser.fromMap(completeWith("globals", List.of("ok", 7))));
    }

    @Test
    void ignoresUnknownKeys() {
        DefinerConfig config = DefinerConfigParser.fromMap(completeWith("colour", "blue"));
        assertEquals(Mode.LENIENT, config.mode());
    }

    @Test
    void parsesYamlFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("definer.yaml");
        Files.writeString(file, "mode: strict\nmax_depth: 128\nglobals:\n  - my-helper\n");
        DefinerConfig config = DefinerConfigParser.parse(file);
        assertEquals(Mode.STRICT, config.mode());
        assertEquals(128, config.maxDepth());
        assertTrue(config.standardGlobals());
        assertEquals(List.of("my-helper"), config.globals());
    }

    @Test
    void emptyYamlGivesDefaults() {
        DefinerConfig config = DefinerConfigParser.parse(new ByteArrayInputStream(new byte[0]));
        assertEquals(DefinerConfig.defaults(), config);
    }

    @Test
    void rejectsListDocument() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DefinerConfigParser.parse(new ByteArrayInputStream("- lenient\n".getBytes(StandardCharsets.UTF_8))));
        assertTrue(e.getMessage().contains("mapping"));
    }

    @Test
    void rejectsScalarDocument() {
        assertThrows(IllegalArgumentException.class,
                () -> DefinerConfigParser.parse(new ByteArrayInputStream("lenient\n".getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void rejectsDepthAboveSupportedLimit() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> DefinerConfigParser.fromMap(completeWith("max_depth", DefinerConfig.MAX_SUPPORTED_DEPTH + 1)));
        assertTrue(e.getMessage().contains("max_depth"));
        assertEquals(DefinerConfig.MAX_SUPPORTED_DEPTH,
                DefinerConfigParser.fromMap(completeWith("max_depth", DefinerConfig.MAX_SUPPORTED_DEPTH)).maxDepth());
    }

    @Test
    void yamlTagsCannotInstantiateTypes() {
        String yaml = "mode: !!javax.script.ScriptEngineManager [!!java.net.URLClassLoader [[!!java.net.URL [\"http://localhost/\"]]]]\n";
        assertThrows(RuntimeException.class,
                () -> DefinerConfigParser.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8))));
    }

    @Test
    void missingFileThrowsIOException(@TempDir Path dir) {
        assertThrows(IOException.class, () -> DefinerConfigParser.parse(dir.resolve("absent.yaml")));
    }

    // -----------------------------------------------------------------------
    // Wiring
    // -----------------------------------------------------------------------

    @Test
    void environmentCombinesStandardAndExtraGlobals() {
        GlobalEnvironment env = DefinerConfigParser.fromMap(Map.of("globals", List.of("my-helper"))).environment();
        assertTrue(env.isGloballyDefined("car"));
        assertTrue(env.isGloballyDefined("my-helper"));
    }

    @Test
    void environmentWithoutStandardGlobals() {
        GlobalEnvironment env = DefinerConfigParser.fromMap(COMPLETE).environment();
        assertFalse(env.isGloballyDefined("car"));
        assertTrue(env.isGloballyDefined("other"));
    }

    @Test
    void analyzerUsesConfiguredSettings() {
        FreeVariableAnalyzer analyzer = DefinerConfigParser.fromMap(COMPLETE).analyzer();
        assertEquals(Mode.LENIENT, analyzer.mode());
        assertEquals(64, analyzer.maxDepth());
        assertEquals(Set.of("car"), analyzer.freeVariables(app(id("car"), id("my-helper"))));
    }

    @Test
    void evaluatorJudgesUnitsWithConfiguredGlobals() {
        WellPosedness evaluator = DefinerConfig.defaults().evaluator();
        assertTrue(evaluator.isWellPosed(Unit.of("u", object(app(id("display"), id("newline"))))));
        assertFalse(evaluator.isWellPosed(Unit.of("u", object(app(id("display"), id("mystery"))))));
    }
}
