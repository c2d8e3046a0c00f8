package io.github.nicechester.bibleapi;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end requests against the translations under src/test/resources/bibles.
 */
@SpringBootTest
@AutoConfigureMockMvc
class BibleApiApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void listsFixtureTranslations() throws Exception {
        mockMvc.perform(get("/v1/data"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.translations", hasSize(5)))
            .andExpect(jsonPath("$.translations[0].identifier").value("asv"));
    }

    @Test
    void resolvesReferenceWithVerseNumbers() throws Exception {
        mockMvc.perform(get("/John+3:16-17").param("translation", "kjv").param("verse_numbers", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.reference").value("John 3:16-17"))
            .andExpect(jsonPath("$.verses", hasSize(2)))
            .andExpect(jsonPath("$.text", startsWith("(16) For God so loved the world")))
            .andExpect(jsonPath("$.text", containsString("(17) For God sent not his Son")))
            .andExpect(jsonPath("$.translation_name").value("King James Version"));
    }

    @Test
    void defaultTranslationIsFirst() throws Exception {
        mockMvc.perform(get("/Gen 1:1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.translation_id").value("asv"))
            .andExpect(jsonPath("$.text").value("In the beginning God created the heavens and the earth."));
    }

    @Test
    void searchesVerseText() throws Exception {
        mockMvc.perform(get("/v1/search/kjv").param("q", "the beginning").param("books", "NT"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total_results").value(1))
            .andExpect(jsonPath("$.results[0].book_id").value("JHN"))
            .andExpect(jsonPath("$.results[0].chapter").value(1));
    }

    @Test
    void readsMilestoneChapter() throws Exception {
        mockMvc.perform(get("/v1/data/web/GEN/1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.verses", hasSize(2)))
            .andExpect(jsonPath("$.verses[1].text")
                .value("The earth was formless and empty. Darkness was on the surface of the deep."));
    }

    @Test
    void listsUsfxBooksAndChapters() throws Exception {
        mockMvc.perform(get("/v1/data/ro-cornilescu"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.translation.language_code").value("ro"))
            .andExpect(jsonPath("$.books[0].name").value("Geneza"));

        mockMvc.perform(get("/v1/data/ro-cornilescu/GEN"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.chapters", hasSize(2)));
    }

    @Test
    void randomVerseFromNewTestament() throws Exception {
        mockMvc.perform(get("/v1/data/asv/random/NT"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.random_verse.book_id").value("JHN"));
    }

    @Test
    void missingResourcesAreNotFound() throws Exception {
        mockMvc.perform(get("/v1/data/nope")).andExpect(status().isNotFound());
        mockMvc.perform(get("/v1/data/kjv/REV")).andExpect(status().isNotFound());
        mockMvc.perform(get("/v1/data/kjv/GEN/50")).andExpect(status().isNotFound());
        mockMvc.perform(get("/John 0:1")).andExpect(status().isNotFound());
        mockMvc.perform(get("/Rev 1:1")).andExpect(status().isNotFound());
    }

    @Test
    void healthCheck() throws Exception {
        mockMvc.perform(get("/healthz")).andExpect(status().isOk());
    }
}
