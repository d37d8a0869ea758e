package com.talentscout.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchCriteriaTest {

    @Test
    void builder_shouldTrimAndDropBlankOrRepeatedEntries() {
        SearchCriteria criteria = SearchCriteria.builder()
                .query("  data engineer ")
                .skills(Arrays.asList("Python", " ", null, "python", "Spark"))
                .keywords(List.of("spark", "Airflow"))
                .sources(List.of(" GitHub", "github", "DEVTO"))
                .build();

        assertEquals("data engineer", criteria.query);
        assertEquals(List.of("Python", "Spark"), criteria.skills);
        assertEquals(List.of("github", "devto"), criteria.sources);
        assertEquals(List.of("python", "spark", "airflow"), criteria.terms());
        assertFalse(criteria.hasLocation());
    }

    @Test
    void sourcesShouldStayUnsetUntilChosen() {
        SearchCriteria criteria = SearchCriteria.builder().query("x").build();

        assertNull(criteria.sources);
        assertFalse(criteria.sourcesSpecified());
        assertTrue(criteria.toBuilder().sources(List.of()).build().sourcesSpecified());
    }
}
