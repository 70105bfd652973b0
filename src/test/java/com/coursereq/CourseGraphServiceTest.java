package com.coursereq;

import com.coursereq.domain.CatalogModels.CatalogCourse;
import com.coursereq.domain.CatalogModels.StoredCourseRequirements;
import com.coursereq.domain.RequirementModels.CourseRef;
import com.coursereq.domain.RequirementModels.Group;
import com.coursereq.domain.RequirementModels.GroupLogic;
import com.coursereq.domain.RequirementModels.ParsedCourseRequirements;
import com.coursereq.domain.RequirementModels.RequirementNode;
import com.coursereq.graph.CourseGraphModels.DepartmentCount;
import com.coursereq.graph.CourseGraphService;
import com.coursereq.graph.GraphCsvCodec;
import com.coursereq.repository.RequirementJdbcRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CourseGraphServiceTest {
    @Autowired
    private CourseGraphService graphService;
    @Autowired
    private RequirementJdbcRepository repository;
    @Autowired
    private GraphCsvCodec csvCodec;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void storeSample() {
        jdbcTemplate.update("DELETE FROM course_requirements");
        graphService.invalidate();

        save("CMPT", "225", "Data Structures", new Group(GroupLogic.ALL_OF, List.of(
                new CourseRef("CMPT", "125"),
                new Group(GroupLogic.ONE_OF, List.of(new CourseRef("MACM", "101"), new CourseRef("MATH", "151"))))));
        save("CMPT", "300", "Operating Systems I",
                new Group(GroupLogic.ALL_OF, List.of(new CourseRef("CMPT", "225"), new CourseRef("CMPT", "125"))));
        save("CMPT", "125", "Intro to Computing Science",
                new Group(GroupLogic.ONE_OF, List.of(new CourseRef("CMPT", "120"), new CourseRef("CMPT", "130"))));
        graphService.invalidate();
    }

    private void save(String department, String number, String title, RequirementNode prerequisite) {
        var requirements = new ParsedCourseRequirements(department, number, "SFUv1.1", prerequisite, null);
        var source = new CatalogCourse(department, number, title, null, "see calendar", null);
        repository.save(StoredCourseRequirements.of(requirements, source, Instant.now()));
    }

    @Test
    void assemblesGraphFromStoredRecords() {
        var graph = graphService.graph();
        assertEquals(7, graph.nodes().size());
        assertEquals(7, graph.links().size());
        assertSame(graph, graphService.graph());

        var intro = graph.nodes().stream().filter(n -> n.id().equals("CMPT 125")).findFirst().orElseThrow();
        assertEquals("Intro to Computing Science", intro.title());
        assertEquals(3.0, intro.size());
    }

    @Test
    void replacedRecordKeepsListingOrder() {
        save("CMPT", "225", "Data Structures and Algorithms", new CourseRef("CMPT", "125"));
        graphService.invalidate();

        var ids = repository.loadAll().stream().map(StoredCourseRequirements::courseId).toList();
        assertEquals(List.of("CMPT 225", "CMPT 300", "CMPT 125"), ids);
        assertEquals(5, graphService.graph().links().size());
    }

    @Test
    void summarizesGraph() {
        var stats = graphService.statistics();

        assertEquals(7, stats.nodeCount());
        assertEquals(7, stats.linkCount());
        assertEquals(List.of(new DepartmentCount("CMPT", 5), new DepartmentCount("MACM", 1), new DepartmentCount("MATH", 1)),
                stats.departments());
        assertEquals("CMPT 125", stats.topPrerequisites().get(0).id());
        assertEquals(2, stats.topPrerequisites().get(0).dependentCourses());
        assertEquals(Map.of(0, 4L, 1, 2L, 2, 1L), stats.depthDistribution());
        assertEquals("CMPT 300", stats.deepestCourses().get(0).id());
    }

    @Test
    void exportsCsvTables() {
        var nodes = csvCodec.readNodes(graphService.nodesCsv());
        var links = csvCodec.readLinks(graphService.linksCsv());
        assertEquals(graphService.graph().nodes(), nodes);
        assertEquals(graphService.graph().links(), links);
        assertTrue(graphService.linksCsv().startsWith(GraphCsvCodec.LINK_HEADER + "\n"));
    }
}
