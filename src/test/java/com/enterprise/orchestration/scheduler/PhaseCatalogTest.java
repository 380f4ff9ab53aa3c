package com.enterprise.orchestration.scheduler;

import com.enterprise.orchestration.core.Complexity;
import com.enterprise.orchestration.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PhaseCatalogTest {

    @Test
    void testDefaultCatalog() {
        PhaseCatalog catalog = PhaseCatalog.defaults();

        assertEquals(PhaseCatalog.BASIC, catalog.getDefaultCategory());
        assertTrue(catalog.getCategories().containsAll(List.of("basic", "web_application", "mobile_app",
            "api_service", "data_analysis", "machine_learning")));
        assertEquals(Complexity.HIGH, catalog.complexityFor("mobile_app"));

        List<PhaseTemplate> basic = catalog.phasesFor(PhaseCatalog.BASIC);
        assertEquals(List.of("planning", "research", "implementation", "testing", "deployment"),
            basic.stream().map(PhaseTemplate::getPhaseName).collect(Collectors.toList()));
        assertNull(basic.get(0).getPreferredRole());
        assertEquals("senior_developer", basic.get(4).getPreferredRole());
        assertEquals(8, basic.get(3).getEstimatedHours());
    }

    @Test
    void testUnknownCategoryResolvesToDefault() {
        PhaseCatalog catalog = PhaseCatalog.defaults();

        assertEquals("basic", catalog.resolveCategory("space_program"));
        assertEquals("basic", catalog.resolveCategory(null));
        assertEquals("data_analysis", catalog.resolveCategory("data_analysis"));
    }

    @Test
    void testFirstCategoryIsDefaultWhenNoneNamed() {
        PhaseCatalog catalog = PhaseCatalog.builder()
            .category("docs", Complexity.LOW, PhaseTemplate.of("documentation"))
            .build();

        assertEquals("docs", catalog.getDefaultCategory());
    }

    @Test
    void testBuilderValidation() {
        // Empty catalog
        assertThrows(ValidationException.class, () -> PhaseCatalog.builder().build());

        // Default category must exist
        assertThrows(ValidationException.class, () -> PhaseCatalog.builder()
            .category("docs", Complexity.LOW, PhaseTemplate.of("documentation"))
            .defaultCategory("missing")
            .build());

        // Dependencies must name earlier phases
        assertThrows(ValidationException.class, () -> PhaseCatalog.builder()
            .category("backwards", Complexity.LOW,
                PhaseTemplate.builder("implementation").dependsOn("planning").build(),
                PhaseTemplate.of("planning"))
            .build());

        // Duplicate phase names
        assertThrows(ValidationException.class, () -> PhaseCatalog.builder()
            .category("twice", Complexity.LOW, PhaseTemplate.of("testing"), PhaseTemplate.of("testing"))
            .build());
    }

    @Test
    void testPhaseTemplateValidation() {
        assertThrows(ValidationException.class, () -> PhaseTemplate.of(" "));
        assertThrows(ValidationException.class, () -> PhaseTemplate.builder("testing").priority(9).build());
        assertThrows(ValidationException.class, () -> PhaseTemplate.builder("testing").estimatedHours(-1).build());
        assertThrows(ValidationException.class, () -> PhaseTemplate.builder("testing").dependsOn("testing").build());

        PhaseTemplate independent = PhaseTemplate.builder("research").independent().build();
        assertTrue(independent.hasExplicitDependencies());
        assertTrue(independent.getDependsOn().isEmpty());
        assertFalse(PhaseTemplate.of("research").hasExplicitDependencies());
    }

    @Test
    void testClassificationTable() {
        TaskClassificationTable table = TaskClassificationTable.defaults();

        TaskClassificationTable.Classification deployment = table.lookup("deployment").orElseThrow();
        assertEquals(4, deployment.getPriority());
        assertEquals("senior_developer", deployment.getRole());
        assertTrue(deployment.getCapabilities().contains("devops"));

        assertFalse(table.lookup("brainstorming").isPresent());
        assertEquals(TaskClassificationTable.DEFAULT_CAPABILITIES, table.requiredCapabilities("brainstorming"));
        assertEquals(TaskClassificationTable.DEFAULT_CAPABILITIES, table.requiredCapabilities("architecture"));

        assertThrows(ValidationException.class,
            () -> TaskClassificationTable.builder().classify("planning", 0, Complexity.LOW, "leader"));
    }
}
