package com.evaluate.interviewprep.service;

import com.evaluate.interviewprep.exception.InvalidInputException;
import com.evaluate.interviewprep.model.ExperienceLevel;
import com.evaluate.interviewprep.model.JobRole;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RoleCatalogTest {

    private final RoleCatalog catalog = new RoleCatalog();

    @Test
    void listsAllPredefinedRolesAndLevels() {
        assertEquals(6, catalog.availableRoles().size());
        assertTrue(catalog.roleIds().contains("software-engineer"));
        assertTrue(catalog.roleIds().contains("devops-engineer"));
        assertEquals(java.util.List.of("entry", "mid", "senior", "lead"), catalog.levelNames());
    }

    @Test
    void roleLookupsAreCaseInsensitiveAndTrimmed() {
        assertEquals("software-engineer", catalog.roleById("  Software-Engineer ").getId());
        assertEquals("product-manager", catalog.roleByName("product manager").getId());
        assertEquals("data-scientist", catalog.resolveRole("Data Scientist").getId());
        assertEquals("data-scientist", catalog.resolveRole("data-scientist").getId());
    }

    @Test
    void levelLookupMapsExpectedDepth() {
        ExperienceLevel senior = catalog.level(" SENIOR ");
        assertEquals(5, senior.getYearsMin());
        assertEquals(10, senior.getYearsMax());
        assertEquals(8, senior.getExpectedDepth());
        assertEquals(3, catalog.level("entry").getExpectedDepth());
    }

    @Test
    void invalidRoleListsValidIds() {
        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> catalog.roleById("astronaut"));
        assertEquals(catalog.roleIds(), ex.getValidOptions());
        assertTrue(ex.getMessage().contains("software-engineer"));
    }

    @Test
    void invalidLevelListsValidLevels() {
        InvalidInputException ex = assertThrows(InvalidInputException.class, () -> catalog.level("principal"));
        assertEquals(catalog.levelNames(), ex.getValidOptions());
    }

    @Test
    void validityChecksNeverThrow() {
        assertTrue(catalog.isValidRoleId("frontend-engineer"));
        assertFalse(catalog.isValidRoleId(null));
        assertTrue(catalog.isValidRoleName("Backend Engineer"));
        assertFalse(catalog.isValidRoleName(""));
        assertTrue(catalog.isValidLevel("Lead"));
        assertFalse(catalog.isValidLevel("intern"));
    }

    @Test
    void rolesCarryTechnicalAndBehavioralCategories() {
        JobRole role = catalog.roleById("software-engineer");
        assertFalse(role.getTechnicalSkills().isEmpty());
        assertFalse(role.getBehavioralCompetencies().isEmpty());
        assertTrue(role.getQuestionCategories().stream().anyMatch(c -> c.isTechnicalFocus()));
        assertTrue(role.getQuestionCategories().stream().anyMatch(c -> !c.isTechnicalFocus()));
    }
}
