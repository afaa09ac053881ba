/*
 *  This file is part of geoplaces.
 *
 *  Geoplaces is free software: you can redistribute it and/or
 *  modify it under the terms of the GNU Affero General Public License
 *  as published by the Free Software Foundation, either version 3 or
 *  any later version.
 *
 *  Geoplaces is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.
 *  See the GNU Affero General Public License for more details.
 * You should have received a copy of the GNU Affero General Public License
 * along with Geoplaces. If not, see <https://www.gnu.org/licenses/>.
 */

package com.dedicatedcode.geoplaces.controller;

import com.dedicatedcode.geoplaces.dto.ComparisonResponse;
import com.dedicatedcode.geoplaces.exception.InvalidQueryException;
import com.dedicatedcode.geoplaces.exception.PlaceNotFoundException;
import com.dedicatedcode.geoplaces.index.PlaceRecord;
import com.dedicatedcode.geoplaces.service.PlaceQueryService;
import com.dedicatedcode.geoplaces.service.StatsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PlaceController.class)
class PlaceControllerTest {

    private static final PlaceRecord MOSCOW = new PlaceRecord(524901, "Moscow", "Moscow", List.of("Moscow", "Moskva"),
            55.75222, 37.61556, "P", "PPLC", "RU", "", "48", "", "", "", 10_000_000, null, 144,
            "Europe/Moscow", LocalDate.of(2022, 12, 10));
    private static final PlaceRecord SAINT_PETERSBURG = new PlaceRecord(498817, "Saint Petersburg", "Saint Petersburg",
            List.of("Saint Petersburg", "SPB"), 59.93863, 30.31413, "P", "PPLA", "RU", "", "66", "", "", "",
            5_000_000, null, 11, "Europe/Moscow", LocalDate.of(2022, 12, 10));

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PlaceQueryService placeQueryService;

    @MockBean
    private StatsService statsService;

    @Test
    void testGetById() throws Exception {
        when(placeQueryService.getById(524901)).thenReturn(MOSCOW);

        mockMvc.perform(get("/api/v1/places/524901"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value(524901))
                .andExpect(jsonPath("$.name").value("Moscow"))
                .andExpect(jsonPath("$.alternate_names[1]").value("Moskva"))
                .andExpect(jsonPath("$.feature_class").value("P"))
                .andExpect(jsonPath("$.timezone").value("Europe/Moscow"))
                .andExpect(jsonPath("$.modification_date").value("2022-12-10"))
                .andExpect(jsonPath("$.elevation").doesNotExist());
    }

    @Test
    void testGetByIdValidationErrorIsBadRequest() throws Exception {
        when(placeQueryService.getById(-1)).thenThrow(new InvalidQueryException("id must be >= 0"));

        mockMvc.perform(get("/api/v1/places/-1"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("id must be >= 0"));
    }

    @Test
    void testGetByIdUnknownIsNotFound() throws Exception {
        when(placeQueryService.getById(anyLong())).thenThrow(new PlaceNotFoundException("No place found with id 7"));

        mockMvc.perform(get("/api/v1/places/7"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("No place found with id 7"));
    }

    @Test
    void testGetByIdNotANumber() throws Exception {
        mockMvc.perform(get("/api/v1/places/moscow"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());

        verifyNoInteractions(placeQueryService);
    }

    @Test
    void testListDefaults() throws Exception {
        when(placeQueryService.getPage(eq(0L), isNull())).thenReturn(List.of(MOSCOW, SAINT_PETERSBURG));

        mockMvc.perform(get("/api/v1/places"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Result-Count", "2"))
                .andExpect(jsonPath("$[0].name").value("Moscow"))
                .andExpect(jsonPath("$[1].name").value("Saint Petersburg"));
    }

    @Test
    void testListPassesSkipAndLimit() throws Exception {
        when(placeQueryService.getPage(20L, 5)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/places").param("skip", "20").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());

        verify(placeQueryService).getPage(20L, 5);
    }

    @Test
    void testListInvalidLimit() throws Exception {
        when(placeQueryService.getPage(anyLong(), any())).thenThrow(new InvalidQueryException("limit must be > 0 and <= 1000"));

        mockMvc.perform(get("/api/v1/places").param("limit", "5000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("limit must be > 0 and <= 1000"));
    }

    @Test
    void testByName() throws Exception {
        when(placeQueryService.getCandidates("Moskva")).thenReturn(List.of(MOSCOW));

        mockMvc.perform(get("/api/v1/places/by-name").param("name", "Moskva"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(524901));
    }

    @Test
    void testCompare() throws Exception {
        when(placeQueryService.compare("Moscow", "Saint Petersburg")).thenReturn(
                new ComparisonResponse("Saint Petersburg", true, "+00:00", 0, MOSCOW, SAINT_PETERSBURG));

        mockMvc.perform(get("/api/v1/compare").param("name1", "Moscow").param("name2", "Saint Petersburg"))
                .andExpect(status().isOk())
                .andExpect(header().string("Cache-Control", containsString("no-store")))
                .andExpect(jsonPath("$.north").value("Saint Petersburg"))
                .andExpect(jsonPath("$.is_same_time").value(true))
                .andExpect(jsonPath("$.timezone_diff").value("+00:00"))
                .andExpect(jsonPath("$.timezone_diff_minutes").value(0))
                .andExpect(jsonPath("$.name_1.id").value(524901))
                .andExpect(jsonPath("$.name_2.id").value(498817));
    }

    @Test
    void testCompareUnknownName() throws Exception {
        when(placeQueryService.compare("Moscow", "Atlantis"))
                .thenThrow(new PlaceNotFoundException("No place found with name 'Atlantis'"));

        mockMvc.perform(get("/api/v1/compare").param("name1", "Moscow").param("name2", "Atlantis"))
                .andExpect(status().isNotFound());
    }

    @Test
    void testCompareMissingParameter() throws Exception {
        mockMvc.perform(get("/api/v1/compare").param("name1", "Moscow"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Missing parameter 'name2'"));
    }

    @Test
    void testSuggest() throws Exception {
        when(placeQueryService.prefixSearch("Mos", 10)).thenReturn(List.of("Moscow", "Moskva"));

        mockMvc.perform(get("/api/v1/suggest").param("prefix", "Mos").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Result-Count", "2"))
                .andExpect(jsonPath("$[0]").value("Moscow"))
                .andExpect(jsonPath("$[1]").value("Moskva"));
    }

    @Test
    void testSuggestEmptyPrefix() throws Exception {
        when(placeQueryService.prefixSearch(eq(""), any())).thenThrow(new InvalidQueryException("prefix must not be empty"));

        mockMvc.perform(get("/api/v1/suggest").param("prefix", ""))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("prefix must not be empty"));
    }

    @Test
    void testHealthEndpoint() throws Exception {
        when(placeQueryService.placeCount()).thenReturn(8);
        when(placeQueryService.nameCount()).thenReturn(9);

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("geoplaces"))
                .andExpect(jsonPath("$.places").value(8))
                .andExpect(jsonPath("$.names").value(9));
    }
}
