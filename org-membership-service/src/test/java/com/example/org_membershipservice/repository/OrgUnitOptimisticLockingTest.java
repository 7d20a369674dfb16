package com.example.org_membershipservice.repository;

import com.example.org_membershipservice.entity.OrgUnit;
import com.example.org_membershipservice.entity.OrgUnitType;
import jakarta.persistence.EntityManager;
import jakarta.persistence.OptimisticLockException;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.context.TestPropertySource;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks that @Version on OrgUnit bumps on every update and rejects
 * a write based on a stale copy.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
    "spring.jpa.show-sql=true",
    "logging.level.org.hibernate.SQL=DEBUG"
})
@Slf4j
class OrgUnitOptimisticLockingTest {

    @Autowired
    private OrgUnitRepository unitRepository;

    @PersistenceContext
    private EntityManager entityManager;

    private UUID unitId;

    @BeforeEach
    void setup() {
        OrgUnit unit = OrgUnit.builder()
                .type(OrgUnitType.COUNCIL)
                .name("Conselho")
                .slug("conselho")
                .createdBy(UUID.randomUUID())
                .build();

        OrgUnit saved = unitRepository.saveAndFlush(unit);
        unitId = saved.getId();
        log.info("Unit created: id={}, version={}", saved.getId(), saved.getVersion());
        entityManager.clear();
    }

    @Test
    void versionIncrementsOnEveryUpdate() {
        OrgUnit unit = unitRepository.findById(unitId).orElseThrow();
        Integer v1 = unit.getVersion();

        unit.setName("Conselho Geral");
        unit = unitRepository.saveAndFlush(unit);
        Integer v2 = unit.getVersion();

        unit.setDescription("Coordena os setores");
        unit = unitRepository.saveAndFlush(unit);
        Integer v3 = unit.getVersion();

        assertNotNull(v1);
        assertTrue(v2 > v1, "Version should increment after first update");
        assertTrue(v3 > v2, "Version should increment after second update");
        log.info("Version increments: {} -> {} -> {}", v1, v2, v3);
    }

    @Test
    void staleCopyIsRejected() {
        OrgUnit first = unitRepository.findById(unitId).orElseThrow();
        entityManager.detach(first);
        OrgUnit second = unitRepository.findById(unitId).orElseThrow();
        entityManager.detach(second);

        first.setName("Renamed by first");
        unitRepository.saveAndFlush(first);
        entityManager.clear();

        second.setName("Renamed by second");
        Exception exception = assertThrows(Exception.class, () -> unitRepository.saveAndFlush(second));

        log.info("Stale write rejected with {}", exception.getClass().getSimpleName());
        assertTrue(exception instanceof OptimisticLockException
                        || exception instanceof ObjectOptimisticLockingFailureException,
                "Expected an optimistic lock failure, got: " + exception.getClass());
    }

    @Test
    void slugIsNeverUpdated() {
        OrgUnit unit = unitRepository.findById(unitId).orElseThrow();
        unit.setSlug("renamed");
        unitRepository.saveAndFlush(unit);
        entityManager.clear();

        assertEquals("conselho", unitRepository.findById(unitId).orElseThrow().getSlug());
        assertTrue(unitRepository.existsBySlug("conselho"));
    }
}
