package com.coursereq;

import com.coursereq.domain.CatalogModels.CatalogCourse;
import com.coursereq.domain.CatalogModels.StoredCourseRequirements;
import com.coursereq.domain.RequirementModels.CourseRef;
import com.coursereq.domain.RequirementModels.Group;
import com.coursereq.domain.RequirementModels.GroupLogic;
import com.coursereq.domain.RequirementModels.ParsedCourseRequirements;
import com.coursereq.repository.RequirementJdbcRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RequirementApiTest {
    @Autowired
    private MockMvc mockMvc;
    @Autowired
    private RequirementJdbcRepository repository;

    @Test
    void validateReportsErrors() throws Exception {
        mockMvc.perform(post("/api/requirements/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"department\": \"CMPT\", \"number\": \"225\", \"schema_version\": \"SFUv1.1\", \"prerequisite\": {\"type\": \"nope\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.errors[0]").value("prerequisite.type: Invalid requirement type 'nope'"));
    }

    @Test
    void returnsStoredRecordWithReadableText() throws Exception {
        var requirements = new ParsedCourseRequirements("APIA", "225", "SFUv1.1",
                new Group(GroupLogic.ONE_OF, List.of(new CourseRef("APIA", "125"), new CourseRef("APIA", "130"))), null);
        var source = new CatalogCourse("APIA", "225", "Data Structures", null, "APIA 125 or 130.", null);
        repository.save(StoredCourseRequirements.of(requirements, source, Instant.now()));

        mockMvc.perform(get("/api/requirements/APIA/225"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stored.original_title").value("Data Structures"))
                .andExpect(jsonPath("$.stored.requirements.prerequisite.type").value("group"))
                .andExpect(jsonPath("$.readable.prerequisite").value("APIA 125 or APIA 130"));
    }

    @Test
    void unknownCourseIsNotFound() throws Exception {
        mockMvc.perform(get("/api/requirements/APIZ/999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404))
                .andExpect(jsonPath("$.message").value("No stored requirements for course APIZ 999"))
                .andExpect(jsonPath("$.details.course").value("APIZ 999"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/requirements/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"department\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.path").value("/api/requirements/validate"));
    }

    @Test
    void importWithoutCourseIsRejected() throws Exception {
        mockMvc.perform(post("/api/requirements/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"candidate\": {\"department\": \"APIB\", \"number\": \"100\", \"schema_version\": \"SFUv1.1\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.errors[0]").value("course: Must be an object"));
    }

    @Test
    void mistypedRequestFieldIsBadRequestWithPath() throws Exception {
        mockMvc.perform(post("/api/requirements/import")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"course\": [1, 2], \"candidate\": {}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.path").value("body.course"));
    }

    @Test
    void exportsLinksAsCsv() throws Exception {
        mockMvc.perform(get("/api/graph/links.csv"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/csv"));
    }
}
