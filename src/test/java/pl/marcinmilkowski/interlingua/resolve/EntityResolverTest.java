package pl.marcinmilkowski.interlingua.resolve;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import org.junit.jupiter.api.*;
import pl.marcinmilkowski.interlingua.preprocess.ClaimType;
import pl.marcinmilkowski.interlingua.preprocess.EntityType;
import pl.marcinmilkowski.interlingua.preprocess.ExtractedClaim;
import pl.marcinmilkowski.interlingua.preprocess.ExtractedEntity;
import pl.marcinmilkowski.interlingua.preprocess.PreProcessorOutput;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityResolverTest {

    private EntityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new EntityResolver();
    }

    @Test
    @DisplayName("Surface forms in every language should map to one canonical label")
    void testStaticTable() {
        assertEquals("Moscow", resolver.resolve("Moscow"));
        assertEquals("Moscow", resolver.resolve("Москва"));
        assertEquals("Moscow", resolver.resolve("Moscou"));
        assertEquals("Paris", resolver.resolve("Париж"));
        assertEquals("Paris", resolver.resolve("باريس"));
        assertEquals("Germany", resolver.resolve("Allemagne"));
        assertEquals("Spain", resolver.resolve("españa"));
        ResolutionResult r = resolver.resolveEntity("Россия");
        assertEquals(new ResolutionResult("Russia", true, ResolutionResult.Tier.STATIC), r);
    }

    @Test
    @DisplayName("Unknown surface should pass through unchanged")
    void testPassThrough() {
        ResolutionResult r = resolver.resolveEntity("Atlantis");
        assertEquals("Atlantis", r.canonical());
        assertFalse(r.resolved());
        assertEquals(ResolutionResult.Tier.PASS_THROUGH, r.source());
    }

    @Test
    @DisplayName("Runtime aliases should win over every other tier")
    void testAliasPriority() {
        resolver.addAlias("Paname", "Paris");
        resolver.addAlias("Paris", "paris");
        resolver.addLearned(new LearnedEquivalence("Lutetia", "Paname", "fr", 0.9, EquivalenceSource.MANUAL));
        assertEquals(1, resolver.aliasCount());
        ResolutionResult r = resolver.resolveEntity("PANAME");
        assertEquals("Paris", r.canonical());
        assertEquals(ResolutionResult.Tier.RUNTIME_ALIAS, r.source());
    }

    @Test
    @DisplayName("A weaker learned equivalence should not replace a stronger one")
    void testLearnedConfidence() {
        resolver.addLearned(new LearnedEquivalence("France", "Франции", "ru", 0.7, EquivalenceSource.CO_OCCURRENCE));
        resolver.addLearned(new LearnedEquivalence("Finland", "Франции", "ru", 0.3, EquivalenceSource.CO_OCCURRENCE));
        ResolutionResult r = resolver.resolveEntity("франции");
        assertEquals("France", r.canonical());
        assertEquals(ResolutionResult.Tier.LEARNED, r.source());
    }

    @Test
    @DisplayName("Entities sharing a canonical name should merge with their aliases")
    void testResolveEntities() {
        List<ExtractedEntity> merged = resolver.resolveEntities(List.of(
            ExtractedEntity.of("Paris", EntityType.CONCEPT, 0.8, "en"),
            ExtractedEntity.of("Париж", EntityType.CONCEPT, 0.9, "ru"),
            ExtractedEntity.of("Atlantis", EntityType.PLACE, 0.5, "en")));
        assertEquals(2, merged.size());
        ExtractedEntity paris = merged.get(0);
        assertEquals("Paris", paris.canonicalName());
        assertEquals(List.of("Париж"), paris.aliases());
        assertEquals(0.9, paris.confidence(), 1e-9);
        assertEquals("Atlantis", merged.get(1).canonicalName());
    }

    @Test
    @DisplayName("Parallel chunks should teach the unresolved surface of an aligned claim")
    void testLearnFromParallelChunks() {
        PreProcessorOutput en = output("capital_en", "en", "Paris", "France");
        PreProcessorOutput ru = output("capital_ru", "ru", "Париж", "Франции");
        PreProcessorOutput lone = output("other_fr", "fr", "Lyon", "Francie");

        assertEquals(1, resolver.learnFromParallelChunks(List.of(en, ru, lone)));
        LearnedEquivalence learned = resolver.learned().get(0);
        assertEquals("France", learned.canonical());
        assertEquals("Франции", learned.surface());
        assertEquals("ru", learned.sourceLanguage());
        assertEquals(EntityResolver.CO_OCCURRENCE_CONFIDENCE, learned.confidence(), 1e-9);
        assertEquals("France", resolver.resolve("Франции"));
        assertEquals(0, resolver.learnFromParallelChunks(List.of(en)));
    }

    @Test
    @DisplayName("Learned equivalences should survive export and import")
    void testExportImport() {
        resolver.addLearned(new LearnedEquivalence("France", "Франции", "ru", 0.7, EquivalenceSource.CO_OCCURRENCE));
        JSONArray exported = resolver.exportLearned();
        assertEquals("co-occurrence", exported.getJSONObject(0).getString("source"));

        EntityResolver fresh = new EntityResolver();
        assertEquals(1, fresh.importLearned(JSON.parseArray(exported.toJSONString())));
        assertEquals(resolver.learned(), fresh.learned());
    }

    @Test
    @DisplayName("Malformed equivalence documents should be rejected")
    void testTableValidation() {
        assertThrows(IllegalArgumentException.class, () -> EquivalenceTable.parse("{}"));
        assertThrows(IllegalArgumentException.class,
            () -> EquivalenceTable.parse("{\"equivalences\": [{\"aliases\": [\"x\"]}]}"));
        EquivalenceTable table = EquivalenceTable.parse(
            "{\"equivalences\": [{\"canonical\": \"Kyiv\", \"category\": \"city\", \"aliases\": [\"Київ\", \"Kiev\"]}]}");
        assertEquals(1, table.size());
        assertEquals("Kyiv", table.lookup(" kiev ").orElseThrow());
        assertTrue(EquivalenceTable.defaults().size() > 100);
    }

    private static PreProcessorOutput output(String id, String lang, String subject, String object) {
        ExtractedClaim claim = new ExtractedClaim(subject + " ... " + object, ClaimType.SPATIAL, 0.9,
            subject, "located-in", object, lang);
        return new PreProcessorOutput(id, lang, 0.9, List.of(), List.of(claim), List.of());
    }
}
