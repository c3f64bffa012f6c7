package com.mead.assistant.search;

import com.mead.assistant.KnowledgeFixtures;
import com.mead.assistant.knowledge.Condition;
import com.mead.assistant.knowledge.Drug;
import com.mead.assistant.knowledge.KnowledgeBase;
import com.mead.assistant.knowledge.Symptom;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SearchEngineTest {

    private SearchEngine engine;

    @BeforeEach
    void setUp() {
        engine = new SearchEngine(KnowledgeFixtures.knowledgeBase());
    }

    @Test
    void diabetesQuery_returnsConditionWithHighRelevance() {
        List<SearchResult> results = engine.search("diabetes");

        SearchResult top = results.get(0);
        assertThat(top.type()).isEqualTo(EntityType.CONDITION);
        assertThat(top.id()).isEqualTo("diabetes_type2");
        assertThat(top.score()).isGreaterThanOrEqualTo(10);
        assertThat(top.relevance()).isEqualTo(Relevance.HIGH);
        assertThat(top.entity()).isInstanceOf(Condition.class);
    }

    @Test
    void treatmentQuery_ranksConditionAboveIndicatedDrug() {
        List<SearchResult> results = engine.search("type 2 diabetes treatment");

        assertThat(results).extracting(SearchResult::id).containsExactly("diabetes_type2", "metformin");
        assertThat(results.get(0).score()).isGreaterThanOrEqualTo(10);
        assertThat(results.get(1).score()).isGreaterThanOrEqualTo(3);
        assertThat(results.get(1).type()).isEqualTo(EntityType.DRUG);
        assertThat(results.get(1).relevance()).isEqualTo(Relevance.MEDIUM);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\t\n"})
    void blankQuery_returnsEmptyList(String query) {
        assertThat(engine.search(query)).isEmpty();
    }

    @Test
    void nullQuery_failsFast() {
        assertThatThrownBy(() -> engine.search(null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unmatchedQuery_returnsEmptyList() {
        assertThat(engine.search("zzzz qqqq")).isEmpty();
        assertThat(engine.search("12345 !!!")).isEmpty();
    }

    @Test
    void results_areSortedByDescendingScore_andNeverZero() {
        List<SearchResult> results = engine.search("I have chest pain and shortness of breath");

        assertThat(results).isNotEmpty();
        assertThat(results).allSatisfy(r -> assertThat(r.score()).isPositive());
        for (int i = 1; i < results.size(); i++) {
            assertThat(results.get(i - 1).score()).isGreaterThanOrEqualTo(results.get(i).score());
        }
    }

    @Test
    void relevance_followsScoreThresholds() {
        List<SearchResult> results = engine.search("I have chest pain and shortness of breath");

        assertThat(results).allSatisfy(r -> assertThat(r.relevance()).isEqualTo(Relevance.fromScore(r.score())));
    }

    @Test
    void repeatedSearch_isDeterministic() {
        String query = "headache pain diabetes warfarin";

        assertThat(engine.search(query)).isEqualTo(engine.search(query));
    }

    @Test
    void resultCount_isCappedAtFifteen() {
        KnowledgeBase.Builder builder = KnowledgeBase.builder();
        for (int i = 0; i < 20; i++) {
            builder.condition(Condition.builder()
                    .identifier(String.format("flu-%02d", i))
                    .name("Influenza variant " + i)
                    .build());
        }
        SearchEngine bigEngine = new SearchEngine(builder.build());

        List<SearchResult> results = bigEngine.search("influenza");

        assertThat(results).hasSize(SearchEngine.MAX_RESULTS);
        assertThat(results.get(0).id()).isEqualTo("flu-00");
        assertThat(results.get(14).id()).isEqualTo("flu-14");
    }

    @Test
    void ties_keepConditionsThenDrugsThenSymptoms() {
        KnowledgeBase kb = KnowledgeBase.builder()
                .condition(Condition.builder().identifier("c2").name("Zoster rash").build())
                .condition(Condition.builder().identifier("c1").name("Allergic rash").build())
                .drug(Drug.builder().identifier("d1").name("Rash cream").build())
                .symptom(Symptom.builder().identifier("s1").name("Rash").build())
                .build();

        List<SearchResult> results = new SearchEngine(kb).search("rash");

        assertThat(results).extracting(SearchResult::id).containsExactly("c2", "c1", "d1", "s1");
        assertThat(results).extracting(SearchResult::score).containsOnly(10.0);
    }

    @Test
    void searchType_limitsScoredCollections() {
        List<SearchResult> drugsOnly = engine.search("diabetes", SearchType.DRUG_INFORMATION);
        assertThat(drugsOnly).extracting(SearchResult::type).containsOnly(EntityType.DRUG);
        assertThat(drugsOnly).extracting(SearchResult::id).containsExactly("metformin");

        List<SearchResult> symptomChecker = engine.search("headache", SearchType.SYMPTOM_CHECKER);
        assertThat(symptomChecker).extracting(SearchResult::type)
                .doesNotContain(EntityType.DRUG);

        assertThat(engine.search("diabetes", null)).isEqualTo(engine.search("diabetes"));
    }

    @Test
    void searchType_parsesUiLabels() {
        assertThat(SearchType.parse("Symptom Checker")).isEqualTo(SearchType.SYMPTOM_CHECKER);
        assertThat(SearchType.parse("general search")).isEqualTo(SearchType.GENERAL);
        assertThat(SearchType.parse("drug-information")).isEqualTo(SearchType.DRUG_INFORMATION);
        assertThat(SearchType.parse(null)).isEqualTo(SearchType.GENERAL);
        assertThatThrownBy(() -> SearchType.parse("astrology"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @ExtendWith(OutputCaptureExtension.class)
    void debugLog_carriesCountsButNotTheQueryText(CapturedOutput output) {
        Logger logger = (Logger) LoggerFactory.getLogger(SearchEngine.class);
        Level previous = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        try {
            engine.search("persistent migraine aura");
        } finally {
            logger.setLevel(previous);
        }

        assertThat(output.getAll()).contains("tokens=3");
        assertThat(output.getAll()).doesNotContain("persistent migraine aura");
    }
}
