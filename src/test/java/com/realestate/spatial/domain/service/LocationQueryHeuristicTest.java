package com.realestate.spatial.domain.service;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LocationQueryHeuristicTest {

    private final LocationQueryHeuristic heuristic = new LocationQueryHeuristic();

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Praha 5 - Smíchov                          | Praha 5 - Smíchov",
            "Brno, okres Brno-město                     | Brno",
            "Kolín, Středočeský kraj                    | Kolín",
            "Vinohradská 12, Praha 2                    | Praha 2",
            "Masarykova 1234/5a, Brno, okres Brno-město | Brno",
            "okres Kolín                                | Kolín",
            "Jihomoravský kraj                          | Jihomoravský",
            "'  Ostrava ,  Moravskoslezský kraj '       | Ostrava",
    })
    void buildsQueryFromLocationText(String locationText, String expected) {
        assertThat(heuristic.toQuery(locationText)).isEqualTo(expected);
    }

    @Test
    void streetWithoutFollowingSegmentIsKept() {
        assertThat(heuristic.toQuery("Vinohradská 12")).isEqualTo("Vinohradská 12");
    }

    @Test
    void blankInputGivesEmptyQuery() {
        assertThat(heuristic.toQuery(null)).isEmpty();
        assertThat(heuristic.toQuery("   ")).isEmpty();
        assertThat(heuristic.toQuery(" , , ")).isEmpty();
    }
}
